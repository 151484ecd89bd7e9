package in.zonecast.service.execution;

public record BrokerOrder(String id, String contract, String action, BrokerOrderStatus status, long timestamp) {
}
