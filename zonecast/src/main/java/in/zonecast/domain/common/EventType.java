package in.zonecast.domain.common;

/**
 * Event kinds with their wire name and JSON payload field.
 */
public enum EventType {
    CANDLE("Candle", "candle"),
    SWING_POINT("SwingPoint", "swingPoint"),
    LIQUIDITY_EXTREME("LiquidityExtreme", "liquidityExtreme"),
    PLAN_ZONE("PlanZone", "planZone"),
    ORDER("Order", "order"),
    TECHNICAL_ANALYSIS("TechnicalAnalysis", "technicalAnalysis");

    private final String wireName;
    private final String payloadField;

    EventType(String wireName, String payloadField) {
        this.wireName = wireName;
        this.payloadField = payloadField;
    }

    public String wireName() {
        return wireName;
    }

    public String payloadField() {
        return payloadField;
    }

    public static EventType fromWire(String value) {
        for (EventType type : values()) {
            if (type.wireName.equals(value)) return type;
        }
        throw new IllegalArgumentException("Unknown event type: " + value);
    }
}
