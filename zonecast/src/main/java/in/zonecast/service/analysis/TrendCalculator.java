package in.zonecast.service.analysis;

import in.zonecast.domain.analysis.TrendAnalysis;
import in.zonecast.domain.data.Candle;

import java.util.List;

/**
 * Trend Calculator - moving averages and the directional movement system.
 *
 * Neutral values on short windows:
 * - DMI: +DI = -DI = 50 when fewer than period + 1 candles
 * - ADX: 25 when fewer than 2 x period candles
 */
public final class TrendCalculator {

    public static final int PERIOD = 14;
    public static final int SHORT_PERIOD = 9;
    public static final int LONG_PERIOD = 21;

    static final double NEUTRAL_DI = 50.0;
    static final double NEUTRAL_ADX = 25.0;

    /**
     * +DI, -DI and the unsmoothed DX for one window.
     */
    public record DirectionalMovement(double plusDI, double minusDI, double dx) {
    }

    public static TrendAnalysis analyze(List<Candle> candles) {
        Smoothing.requireCandles(candles);

        DirectionalMovement dmi = dmi(candles, PERIOD);
        return new TrendAnalysis(
            candles.get(candles.size() - 1).timestamp(),
            sma(candles, PERIOD),
            ema(candles, PERIOD),
            ema(candles, SHORT_PERIOD),
            ema(candles, LONG_PERIOD),
            dmi.plusDI(),
            dmi.minusDI(),
            adx(candles, PERIOD)
        );
    }

    /**
     * Simple average of the last {@code depth} closes, or of all closes when fewer are available.
     */
    public static double sma(List<Candle> candles, int depth) {
        Smoothing.requireCandles(candles);
        int actualDepth = Math.min(depth, candles.size());
        double[] closes = Smoothing.closes(Smoothing.takeRight(candles, actualDepth));
        return Smoothing.mean(closes, 0, closes.length);
    }

    /**
     * EMA over a bounded recent slice of max(2 x depth, 10) closes, seeded with the
     * mean of the first min(3, n - 1) closes of that slice.
     */
    public static double ema(List<Candle> candles, int depth) {
        Smoothing.requireCandles(candles);
        double multiplier = 2.0 / (depth + 1);

        int requiredLength = Math.min(candles.size(), Math.max(depth * 2, 10));
        double[] closes = Smoothing.closes(Smoothing.takeRight(candles, requiredLength));
        if (closes.length == 1) return closes[0];

        int initLength = Math.min(3, closes.length - 1);
        double ema = Smoothing.mean(closes, 0, initLength);
        for (int i = initLength; i < closes.length; i++) {
            ema = closes[i] * multiplier + ema * (1 - multiplier);
        }
        return ema;
    }

    public static DirectionalMovement dmi(List<Candle> candles, int period) {
        Smoothing.requireCandles(candles);
        if (candles.size() < period + 1) {
            return new DirectionalMovement(NEUTRAL_DI, NEUTRAL_DI, NEUTRAL_ADX);
        }

        int n = candles.size() - 1;
        double[] trueRanges = new double[n];
        double[] plusDMs = new double[n];
        double[] minusDMs = new double[n];

        for (int i = 1; i < candles.size(); i++) {
            Candle current = candles.get(i);
            Candle previous = candles.get(i - 1);

            trueRanges[i - 1] = Smoothing.trueRange(current, previous);

            double upMove = current.high() - previous.high();
            double downMove = previous.low() - current.low();
            plusDMs[i - 1] = upMove > downMove && upMove > 0 ? upMove : 0.0;
            minusDMs[i - 1] = downMove > upMove && downMove > 0 ? downMove : 0.0;
        }

        double smoothedTR = Smoothing.wilders(trueRanges, period);
        double smoothedPlusDM = Smoothing.wilders(plusDMs, period);
        double smoothedMinusDM = Smoothing.wilders(minusDMs, period);

        double plusDI = smoothedTR != 0 ? smoothedPlusDM / smoothedTR * 100 : 0.0;
        double minusDI = smoothedTR != 0 ? smoothedMinusDM / smoothedTR * 100 : 0.0;
        return new DirectionalMovement(plusDI, minusDI, dx(plusDI, minusDI));
    }

    /**
     * ADX as Wilder-smoothed DX, one DX per sliding window of period + 2 candles.
     */
    public static double adx(List<Candle> candles, int period) {
        Smoothing.requireCandles(candles);
        if (candles.size() < period * 2) {
            return NEUTRAL_ADX;
        }

        int windowSize = period + 1;
        double[] dxValues = new double[candles.size() - windowSize];
        for (int i = windowSize; i < candles.size(); i++) {
            DirectionalMovement window = dmi(candles.subList(i - windowSize, i + 1), period);
            dxValues[i - windowSize] = dx(window.plusDI(), window.minusDI());
        }

        return dxValues.length > 0 ? Smoothing.wilders(dxValues, period) : NEUTRAL_ADX;
    }

    private static double dx(double plusDI, double minusDI) {
        double sum = plusDI + minusDI;
        return sum != 0 ? Math.abs(plusDI - minusDI) / sum * 100 : 0.0;
    }

    private TrendCalculator() {}
}
