package in.zonecast.domain.analysis;

public record VolatilityAnalysis(
    long timestamp,
    TrueRangeAnalysis trueRange,
    KeltnerChannel keltnerChannel,
    BollingerBand bollingerBand,
    StdDevBands stdDevBands
) {
    public double atr() {
        return trueRange.atr();
    }
}
