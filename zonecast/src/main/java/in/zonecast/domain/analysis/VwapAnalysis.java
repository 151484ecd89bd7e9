package in.zonecast.domain.analysis;

public record VwapAnalysis(double vwap, double stdDev, double slope) {

    public boolean isAbove(double price) {
        return price > vwap;
    }
}
