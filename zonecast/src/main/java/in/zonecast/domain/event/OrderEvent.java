package in.zonecast.domain.event;

import in.zonecast.domain.common.EventType;
import in.zonecast.domain.order.Order;

public record OrderEvent(Order order, long timestamp) implements Event {

    @Override
    public EventType eventType() {
        return EventType.ORDER;
    }

    @Override
    public Object payload() {
        return order;
    }
}
