package in.zonecast.service.execution;

/**
 * Order status as reported by the broker.
 */
public enum BrokerOrderStatus {
    WORKING,
    FILLED,
    CANCELLED,
    REJECTED,
    UNKNOWN;

    public static BrokerOrderStatus fromWire(String value) {
        if (value == null) return UNKNOWN;
        switch (value.trim().toLowerCase()) {
            case "working":
            case "pendingnew":
            case "pendingreplace":
            case "suspended":
                return WORKING;
            case "filled":
            case "completed":
                return FILLED;
            case "canceled":
            case "cancelled":
            case "expired":
            case "pendingcancel":
                return CANCELLED;
            case "rejected":
                return REJECTED;
            default:
                return UNKNOWN;
        }
    }

    public boolean isDead() {
        return this == CANCELLED || this == REJECTED;
    }
}
