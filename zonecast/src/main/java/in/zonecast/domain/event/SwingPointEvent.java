package in.zonecast.domain.event;

import in.zonecast.domain.common.EventType;
import in.zonecast.domain.zone.SwingPoint;

/**
 * A confirmed pivot. The timestamp is the confirming candle, not the pivot itself.
 */
public record SwingPointEvent(SwingPoint swingPoint, long timestamp) implements Event {

    @Override
    public EventType eventType() {
        return EventType.SWING_POINT;
    }

    @Override
    public Object payload() {
        return swingPoint;
    }
}
