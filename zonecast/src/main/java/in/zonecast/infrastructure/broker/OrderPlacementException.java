package in.zonecast.infrastructure.broker;

/**
 * Broker answered the bracket request but refused the order, or the answer could not be read.
 */
public class OrderPlacementException extends RuntimeException {

    private final String orderId;
    private final String contract;

    public OrderPlacementException(String orderId, String contract, String message) {
        super(String.format("[%s] Order placement failed for %s: %s", orderId, contract, message));
        this.orderId = orderId;
        this.contract = contract;
    }

    public OrderPlacementException(String orderId, String contract, String message, Throwable cause) {
        super(String.format("[%s] Order placement failed for %s: %s", orderId, contract, message), cause);
        this.orderId = orderId;
        this.contract = contract;
    }

    public String getOrderId() {
        return orderId;
    }

    public String getContract() {
        return contract;
    }
}
