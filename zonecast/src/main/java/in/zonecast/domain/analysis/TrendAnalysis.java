package in.zonecast.domain.analysis;

/**
 * Trend analytics for one candle.
 *
 * Direction is UP when +DI dominates and ADX is above {@link #ADX_TREND_THRESHOLD},
 * DOWN when -DI dominates under the same condition, otherwise DOJI.
 */
public record TrendAnalysis(
    long timestamp,
    double sma,
    double ema,
    double shortTermMA,
    double longTermMA,
    double plusDI,
    double minusDI,
    double adx
) {
    public static final double ADX_TREND_THRESHOLD = 25.0;

    public TrendDirection direction() {
        if (plusDI > minusDI && adx > ADX_TREND_THRESHOLD) return TrendDirection.UP;
        if (minusDI > plusDI && adx > ADX_TREND_THRESHOLD) return TrendDirection.DOWN;
        return TrendDirection.DOJI;
    }

    public boolean isUptrend() {
        return direction() == TrendDirection.UP;
    }

    public boolean isDowntrend() {
        return direction() == TrendDirection.DOWN;
    }

    public boolean isGoldenCross() {
        return shortTermMA > longTermMA;
    }

    public boolean isDeathCross() {
        return shortTermMA < longTermMA;
    }

    /**
     * Relative distance between short and long MA, clamped to [0, 1].
     */
    public double maCrossoverStrength() {
        if (longTermMA == 0.0) return 0.0;
        return Math.min(1.0, Math.abs(shortTermMA - longTermMA) / Math.abs(longTermMA));
    }
}
