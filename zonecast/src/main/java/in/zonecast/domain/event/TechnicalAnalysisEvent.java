package in.zonecast.domain.event;

import in.zonecast.domain.analysis.TechnicalAnalysis;
import in.zonecast.domain.common.EventType;

public record TechnicalAnalysisEvent(TechnicalAnalysis analysis) implements Event {

    @Override
    public EventType eventType() {
        return EventType.TECHNICAL_ANALYSIS;
    }

    @Override
    public long timestamp() {
        return analysis.timestamp();
    }

    @Override
    public Object payload() {
        return analysis;
    }
}
