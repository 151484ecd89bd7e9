package in.zonecast.service.execution;

/**
 * Execution reported by the broker for one order leg.
 */
public record BrokerFill(String id, String orderId, String contract, String action, int quantity,
                         double price, long timestamp) {
}
