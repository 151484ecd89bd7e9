package in.zonecast.domain.event;

import in.zonecast.domain.common.EventType;
import in.zonecast.domain.data.Candle;

public record CandleEvent(Candle candle) implements Event {

    @Override
    public EventType eventType() {
        return EventType.CANDLE;
    }

    @Override
    public long timestamp() {
        return candle.timestamp();
    }

    @Override
    public Object payload() {
        return candle;
    }
}
