package in.zonecast.domain.analysis;

/**
 * All analytics computed for a single candle.
 */
public record TechnicalAnalysis(
    long timestamp,
    TrendAnalysis trend,
    MomentumAnalysis momentum,
    VolatilityAnalysis volatility,
    VolumeAnalysis volume
) {
}
