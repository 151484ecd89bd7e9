package in.zonecast.domain.regime;

/**
 * Regime plus the scores it was derived from. Scores are 0-100, confidence 0-1.
 */
public record RegimeClassification(
    MarketRegime regime,
    double trendScore,
    double volatilityScore,
    double volumeScore,
    double confidence,
    boolean transitioning,
    long timestamp
) {
    public static RegimeClassification unknown(long timestamp) {
        return new RegimeClassification(MarketRegime.UNKNOWN, 0.0, 0.0, 0.0, 0.0, false, timestamp);
    }

    public boolean isHighVolatility() {
        return volatilityScore > 60.0;
    }

    public boolean isLowVolatility() {
        return volatilityScore < 40.0;
    }
}
