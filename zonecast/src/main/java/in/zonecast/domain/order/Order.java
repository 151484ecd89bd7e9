package in.zonecast.domain.order;

import in.zonecast.domain.regime.MarketRegime;

/**
 * Bracket order tracked from planning to close.
 *
 * Immutable: every transition returns a new instance. Transitions are validated against
 * {@link OrderStatus#canTransitionTo(OrderStatus)} and timestamps never move backwards.
 * {@code trailStop} is part of the wire model; bracket orders placed here keep a fixed stop
 * and leave it null.
 */
public record Order(
    String id,
    OrderType orderType,
    double entryPrice,
    double stopLoss,
    double takeProfit,
    OrderStatus status,
    String entryStrategy,
    double riskMultiplier,
    double profitMultiplier,
    MarketRegime regime,
    int score,
    String contract,
    int contracts,
    long createdTimestamp,
    Long placedTimestamp,
    Long filledTimestamp,
    Long closeTimestamp,
    Double trailStop,
    String brokerOrderId,
    String cancelReason,
    Double exitPrice
) {
    /** Dollars per point on one micro contract. */
    public static final double DOLLARS_PER_MICRO = 5.0;

    public static Order planned(
            String id,
            OrderType orderType,
            double entryPrice,
            double stopLoss,
            double takeProfit,
            String entryStrategy,
            double riskMultiplier,
            double profitMultiplier,
            MarketRegime regime,
            int score,
            String contract,
            int contracts,
            long createdTimestamp) {
        return new Order(id, orderType, entryPrice, stopLoss, takeProfit, OrderStatus.PLANNED,
            entryStrategy, riskMultiplier, profitMultiplier, regime, score, contract, contracts,
            createdTimestamp, null, null, null, null, null, null, null);
    }

    public boolean isActive() {
        return !status.isTerminal();
    }

    public boolean isLong() {
        return orderType == OrderType.LONG;
    }

    /**
     * Distance between entry and stop in price points.
     */
    public double riskPoints() {
        return Math.abs(entryPrice - stopLoss);
    }

    /**
     * Realized R-multiple from the exit price; 0 while the order is open or was cancelled.
     */
    public double realizedR() {
        if (exitPrice == null || riskPoints() == 0.0) return 0.0;
        return pointsGained(exitPrice) / riskPoints();
    }

    /**
     * Realized profit in dollars. A full-size (non-micro) contract is worth ten micros.
     */
    public double realizedDollars() {
        if (exitPrice == null) return 0.0;
        double perPoint = contract != null && contract.startsWith("M") ? DOLLARS_PER_MICRO : DOLLARS_PER_MICRO * 10;
        return pointsGained(exitPrice) * perPoint * contracts;
    }

    public double pointsGained(double price) {
        return isLong() ? price - entryPrice : entryPrice - price;
    }

    public boolean stopTouchedBy(double high, double low) {
        return isLong() ? low <= stopLoss : high >= stopLoss;
    }

    public boolean targetTouchedBy(double high, double low) {
        return isLong() ? high >= takeProfit : low <= takeProfit;
    }

    public boolean entryTouchedBy(double high, double low) {
        return low <= entryPrice && high >= entryPrice;
    }

    public Order placed(long timestamp, String brokerId) {
        requireTransition(OrderStatus.PLACED);
        return copy(OrderStatus.PLACED, Math.max(timestamp, createdTimestamp), null, null, brokerId, null, null);
    }

    public Order filled(long timestamp) {
        requireTransition(OrderStatus.FILLED);
        long floor = placedTimestamp != null ? placedTimestamp : createdTimestamp;
        return copy(OrderStatus.FILLED, placedTimestamp, Math.max(timestamp, floor), null, brokerOrderId, null, null);
    }

    /**
     * Closes a filled order as PROFIT or LOSS at the given exit price.
     */
    public Order closed(OrderStatus outcome, long timestamp, double price) {
        if (outcome != OrderStatus.PROFIT && outcome != OrderStatus.LOSS) {
            throw new IllegalOrderTransitionException(id, status, outcome);
        }
        requireTransition(outcome);
        return copy(outcome, placedTimestamp, filledTimestamp, Math.max(timestamp, filledTimestamp),
            brokerOrderId, null, price);
    }

    public Order cancelled(long timestamp, String reason) {
        requireTransition(OrderStatus.CANCELLED);
        long floor = placedTimestamp != null ? placedTimestamp : createdTimestamp;
        return copy(OrderStatus.CANCELLED, placedTimestamp, null, Math.max(timestamp, floor),
            brokerOrderId, reason, null);
    }

    /**
     * Records a broker failure reason without changing status.
     */
    public Order withFailure(String reason) {
        return copy(status, placedTimestamp, filledTimestamp, closeTimestamp, brokerOrderId, reason, exitPrice);
    }

    private Order copy(OrderStatus newStatus, Long placed, Long filled, Long closed,
                       String brokerId, String reason, Double exit) {
        return new Order(id, orderType, entryPrice, stopLoss, takeProfit, newStatus, entryStrategy,
            riskMultiplier, profitMultiplier, regime, score, contract, contracts, createdTimestamp,
            placed, filled, closed, trailStop, brokerId, reason, exit);
    }

    private void requireTransition(OrderStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalOrderTransitionException(id, status, next);
        }
    }
}
