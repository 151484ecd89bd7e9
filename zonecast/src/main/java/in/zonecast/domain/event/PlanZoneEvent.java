package in.zonecast.domain.event;

import in.zonecast.domain.common.EventType;
import in.zonecast.domain.zone.PlanZone;
import in.zonecast.domain.zone.ZoneChange;

public record PlanZoneEvent(PlanZone zone, ZoneChange change, long timestamp) implements Event {

    @Override
    public EventType eventType() {
        return EventType.PLAN_ZONE;
    }

    @Override
    public Object payload() {
        return zone;
    }
}
