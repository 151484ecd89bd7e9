package in.zonecast.service.analysis;

import in.zonecast.domain.analysis.TechnicalAnalysis;
import in.zonecast.domain.data.Candle;

import java.util.List;

/**
 * Computes the full technical analysis for the last candle of a window.
 *
 * Stateless. The same window always produces the same result.
 */
public class TechnicalAnalysisEngine {

    public TechnicalAnalysis analyze(List<Candle> window) {
        Smoothing.requireCandles(window);
        long timestamp = window.get(window.size() - 1).timestamp();

        return new TechnicalAnalysis(
            timestamp,
            TrendCalculator.analyze(window),
            MomentumCalculator.analyze(window),
            VolatilityCalculator.analyze(window),
            VolumeCalculator.analyze(window)
        );
    }
}
