package in.zonecast.service.analysis;

import in.zonecast.domain.data.Candle;

import java.util.List;

/**
 * Shared numeric helpers for the indicator calculators.
 */
final class Smoothing {

    /**
     * Wilder's smoothing: seed with the mean of the first {@code period} values, then
     * {@code s = (s * (period - 1) + v) / period}. Fewer values than the period yields their mean.
     */
    static double wilders(double[] values, int period) {
        if (values.length == 0) return 0.0;
        if (values.length < period) return mean(values, 0, values.length);

        double smoothed = mean(values, 0, period);
        for (int i = period; i < values.length; i++) {
            smoothed = (smoothed * (period - 1) + values[i]) / period;
        }
        return smoothed;
    }

    static double mean(double[] values, int from, int to) {
        if (to <= from) return 0.0;
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    /**
     * TR = max(H - L, |H - PC|, |L - PC|)
     */
    static double trueRange(Candle current, Candle previous) {
        double highLow = current.high() - current.low();
        double highPrevClose = Math.abs(current.high() - previous.close());
        double lowPrevClose = Math.abs(current.low() - previous.close());
        return Math.max(highLow, Math.max(highPrevClose, lowPrevClose));
    }

    static double[] closes(List<Candle> candles) {
        double[] closes = new double[candles.size()];
        for (int i = 0; i < closes.length; i++) {
            closes[i] = candles.get(i).close();
        }
        return closes;
    }

    static <T> List<T> takeRight(List<T> list, int count) {
        int size = list.size();
        return count >= size ? list : list.subList(size - count, size);
    }

    static void requireCandles(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            throw new IllegalArgumentException("Candles list cannot be empty");
        }
    }

    private Smoothing() {}
}
