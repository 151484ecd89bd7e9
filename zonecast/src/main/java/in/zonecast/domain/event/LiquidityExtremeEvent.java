package in.zonecast.domain.event;

import in.zonecast.domain.common.EventType;
import in.zonecast.domain.zone.LiquidityExtreme;
import in.zonecast.domain.zone.ZoneChange;

public record LiquidityExtremeEvent(LiquidityExtreme extreme, ZoneChange change, long timestamp) implements Event {

    @Override
    public EventType eventType() {
        return EventType.LIQUIDITY_EXTREME;
    }

    @Override
    public Object payload() {
        return extreme;
    }
}
