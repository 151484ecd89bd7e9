package in.zonecast.domain.order;

public enum OrderType {
    LONG,
    SHORT;

    public String brokerAction() {
        return this == LONG ? "Buy" : "Sell";
    }

    public String exitAction() {
        return this == LONG ? "Sell" : "Buy";
    }
}
