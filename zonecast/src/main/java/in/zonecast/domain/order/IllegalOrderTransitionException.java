package in.zonecast.domain.order;

/**
 * Thrown when an order is asked to move backwards or out of a terminal state.
 */
public class IllegalOrderTransitionException extends RuntimeException {

    private final String orderId;
    private final OrderStatus from;
    private final OrderStatus to;

    public IllegalOrderTransitionException(String orderId, OrderStatus from, OrderStatus to) {
        super(String.format("Order %s cannot move from %s to %s", orderId, from, to));
        this.orderId = orderId;
        this.from = from;
        this.to = to;
    }

    public String getOrderId() {
        return orderId;
    }

    public OrderStatus getFrom() {
        return from;
    }

    public OrderStatus getTo() {
        return to;
    }
}
