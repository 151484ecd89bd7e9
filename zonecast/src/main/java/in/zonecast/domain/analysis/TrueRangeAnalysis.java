package in.zonecast.domain.analysis;

public record TrueRangeAnalysis(
    double currentTR,
    double atr,
    AtrTrend atrTrend,
    VolatilityLevel volatilityLevel
) {
    public boolean isHighVolatility() {
        return volatilityLevel == VolatilityLevel.HIGH || volatilityLevel == VolatilityLevel.EXTREME;
    }
}
