package in.zonecast.service.decision;

import in.zonecast.domain.analysis.VolumeAnalysis;
import in.zonecast.domain.data.Candle;
import in.zonecast.domain.regime.DivergenceType;
import in.zonecast.domain.regime.VolumeConfluenceSignal;

import java.util.List;

/**
 * Volume confirmation for a candidate entry.
 *
 * - spike: relative volume above 1.5, massive above 2.0
 * - divergence: last 5 vs previous 5 bars. Falling price on rising volume is BULLISH,
 *   rising price on falling volume is BEARISH.
 * - accumulation / distribution: close in the lower 40% / upper 60% of the 10-bar range
 *   with rising volume, and OBV rising / not rising
 */
public final class VolumeConfluenceAnalyzer {

    public static VolumeConfluenceSignal analyze(List<VolumeAnalysis> volumes, List<Candle> candles) {
        long timestamp = candles.isEmpty() ? 0L : candles.get(candles.size() - 1).timestamp();
        if (volumes.size() < 5 || candles.size() < 5) {
            return VolumeConfluenceSignal.neutral(timestamp);
        }

        VolumeAnalysis current = volumes.get(volumes.size() - 1);
        boolean spike = current.relativeVolume() > 1.5;
        boolean massive = current.relativeVolume() > 2.0;
        DivergenceType divergence = divergence(volumes, candles);

        boolean accumulation = false;
        boolean distribution = false;
        if (volumes.size() >= 10 && candles.size() >= 10) {
            double position = rangePosition(candles.subList(candles.size() - 10, candles.size()));
            boolean obvRising = current.onBalanceVolume() > volumes.get(volumes.size() - 10).onBalanceVolume();
            accumulation = position < 0.4 && current.isVolumeIncreasing() && obvRising;
            distribution = position > 0.6 && current.isVolumeIncreasing() && !obvRising;
        }

        double confirmation = confirmation(current, divergence != DivergenceType.NONE, accumulation, distribution);
        return new VolumeConfluenceSignal(spike, massive, divergence, accumulation, distribution, confirmation, timestamp);
    }

    private static DivergenceType divergence(List<VolumeAnalysis> volumes, List<Candle> candles) {
        if (volumes.size() < 10 || candles.size() < 10) {
            return DivergenceType.NONE;
        }
        int n = volumes.size();
        double lastAvg = 0.0;
        double prevAvg = 0.0;
        for (int i = 0; i < 5; i++) {
            lastAvg += volumes.get(n - 5 + i).relativeVolume();
            prevAvg += volumes.get(n - 10 + i).relativeVolume();
        }
        lastAvg /= 5.0;
        prevAvg /= 5.0;

        int m = candles.size();
        double priceChange = candles.get(m - 1).close() - candles.get(m - 5).close();

        if (priceChange < 0 && lastAvg > prevAvg * 1.1) return DivergenceType.BULLISH;
        if (priceChange > 0 && lastAvg < prevAvg * 0.9) return DivergenceType.BEARISH;
        return DivergenceType.NONE;
    }

    private static double rangePosition(List<Candle> window) {
        double low = Double.POSITIVE_INFINITY;
        double high = Double.NEGATIVE_INFINITY;
        for (Candle c : window) {
            low = Math.min(low, c.low());
            high = Math.max(high, c.high());
        }
        double range = high - low;
        return range > 0 ? (window.get(window.size() - 1).close() - low) / range : 0.5;
    }

    private static double confirmation(VolumeAnalysis current, boolean divergence,
                                       boolean accumulation, boolean distribution) {
        double score = 0.5;

        if (current.relativeVolume() > 1.5) score += 0.2;
        else if (current.relativeVolume() > 1.2) score += 0.1;
        else if (current.relativeVolume() < 0.8) score -= 0.15;

        if (current.isVolumeIncreasing()) score += 0.15;

        switch (current.quality()) {
            case EXCELLENT:
                score += 0.15;
                break;
            case GOOD:
                score += 0.10;
                break;
            case POOR:
                score -= 0.15;
                break;
            default:
                break;
        }

        if (divergence) score -= 0.1;
        if (accumulation) score += 0.1;
        if (distribution) score -= 0.1;

        return Math.max(0.0, Math.min(1.0, score));
    }

    private VolumeConfluenceAnalyzer() {}
}
