package in.zonecast.domain.zone;

/**
 * Running high or low of a market session.
 *
 * Active while {@code endTimestamp} is null. Closed when a later candle surpasses it.
 */
public record LiquidityExtreme(
    Market market,
    ExtremeKind kind,
    double level,
    long startTimestamp,
    Long endTimestamp
) {
    public static LiquidityExtreme open(Market market, ExtremeKind kind, double level, long startTimestamp) {
        return new LiquidityExtreme(market, kind, level, startTimestamp, null);
    }

    public boolean isActive() {
        return endTimestamp == null;
    }

    public LiquidityExtreme withLevel(double newLevel) {
        return new LiquidityExtreme(market, kind, newLevel, startTimestamp, endTimestamp);
    }

    public LiquidityExtreme closedAt(long timestamp) {
        return new LiquidityExtreme(market, kind, level, startTimestamp, timestamp);
    }

    /**
     * True when the price trades through this level in the extreme's direction.
     */
    public boolean isSurpassedBy(double high, double low) {
        return kind == ExtremeKind.HIGH ? high > level : low < level;
    }
}
