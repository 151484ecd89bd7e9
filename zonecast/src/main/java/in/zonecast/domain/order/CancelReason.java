package in.zonecast.domain.order;

/**
 * Standard cancellation reasons recorded on orders.
 */
public final class CancelReason {
    public static final String END_OF_DAY = "Ten minutes until closing. All open orders cancelled.";
    public static final String FULL_CANDLE_OUTSIDE = "A full candle fell outside the range of the order before it filled.";
    public static final String BROKER_REJECTED = "Broker rejected the order";
    public static final String BROKER_CANCELLED = "Broker reported the order as cancelled";
    public static final String MANUAL = "Cancelled on request";

    private CancelReason() {}
}
