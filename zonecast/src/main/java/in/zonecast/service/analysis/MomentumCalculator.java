package in.zonecast.service.analysis;

import in.zonecast.domain.analysis.MomentumAnalysis;
import in.zonecast.domain.data.Candle;

import java.util.List;

/**
 * Momentum oscillators: RSI, Stochastics, Williams %R and CCI.
 *
 * Each returns its neutral value when the window is shorter than the period:
 * RSI 50, Stochastics 50/50, Williams %R -50, CCI 0.
 */
public final class MomentumCalculator {

    public static final int RSI_PERIOD = 14;
    public static final int STOCH_K_PERIOD = 14;
    public static final int STOCH_D_PERIOD = 3;
    public static final int WILLIAMS_PERIOD = 14;
    public static final int CCI_PERIOD = 20;

    static final double NEUTRAL_RSI = 50.0;
    static final double NEUTRAL_STOCH = 50.0;
    static final double NEUTRAL_WILLIAMS = -50.0;
    static final double NEUTRAL_CCI = 0.0;

    private static final double CCI_CONSTANT = 0.015;

    public record Stochastics(double percentK, double percentD) {
    }

    public static MomentumAnalysis analyze(List<Candle> candles) {
        Smoothing.requireCandles(candles);

        Stochastics stochastics = stochastics(candles, STOCH_K_PERIOD, STOCH_D_PERIOD);
        return new MomentumAnalysis(
            candles.get(candles.size() - 1).timestamp(),
            rsi(candles, RSI_PERIOD),
            stochastics.percentK(),
            stochastics.percentD(),
            williamsR(candles, WILLIAMS_PERIOD),
            cci(candles, CCI_PERIOD)
        );
    }

    public static double rsi(List<Candle> candles, int period) {
        Smoothing.requireCandles(candles);
        if (candles.size() < period + 1) {
            return NEUTRAL_RSI;
        }

        int n = candles.size() - 1;
        double[] gains = new double[n];
        double[] losses = new double[n];
        for (int i = 1; i < candles.size(); i++) {
            double change = candles.get(i).close() - candles.get(i - 1).close();
            gains[i - 1] = change > 0 ? change : 0.0;
            losses[i - 1] = change < 0 ? -change : 0.0;
        }

        double avgGain = Smoothing.wilders(gains, period);
        double avgLoss = Smoothing.wilders(losses, period);
        if (avgLoss == 0.0) return 100.0;

        double rs = avgGain / avgLoss;
        return 100.0 - 100.0 / (1.0 + rs);
    }

    /**
     * %K over every sliding window of kPeriod candles, %D as the mean of the last dPeriod %K values.
     */
    public static Stochastics stochastics(List<Candle> candles, int kPeriod, int dPeriod) {
        Smoothing.requireCandles(candles);
        if (candles.size() < kPeriod) {
            return new Stochastics(NEUTRAL_STOCH, NEUTRAL_STOCH);
        }

        double[] kValues = new double[candles.size() - kPeriod + 1];
        for (int start = 0; start < kValues.length; start++) {
            List<Candle> window = candles.subList(start, start + kPeriod);
            double highestHigh = highestHigh(window);
            double lowestLow = lowestLow(window);
            double close = window.get(window.size() - 1).close();

            kValues[start] = highestHigh == lowestLow
                ? NEUTRAL_STOCH
                : (close - lowestLow) / (highestHigh - lowestLow) * 100.0;
        }

        double percentK = kValues[kValues.length - 1];
        double percentD = Smoothing.mean(kValues, Math.max(0, kValues.length - dPeriod), kValues.length);
        return new Stochastics(percentK, percentD);
    }

    public static double williamsR(List<Candle> candles, int period) {
        Smoothing.requireCandles(candles);
        if (candles.size() < period) {
            return NEUTRAL_WILLIAMS;
        }

        List<Candle> recent = Smoothing.takeRight(candles, period);
        double highestHigh = highestHigh(recent);
        double lowestLow = lowestLow(recent);
        double close = candles.get(candles.size() - 1).close();

        if (highestHigh == lowestLow) return NEUTRAL_WILLIAMS;
        return (highestHigh - close) / (highestHigh - lowestLow) * -100.0;
    }

    public static double cci(List<Candle> candles, int period) {
        Smoothing.requireCandles(candles);
        if (candles.size() < period) {
            return NEUTRAL_CCI;
        }

        List<Candle> recent = Smoothing.takeRight(candles, period);
        double[] typical = new double[recent.size()];
        for (int i = 0; i < typical.length; i++) {
            typical[i] = recent.get(i).typicalPrice();
        }

        double smaTypical = Smoothing.mean(typical, 0, typical.length);
        double deviationSum = 0.0;
        for (double tp : typical) {
            deviationSum += Math.abs(tp - smaTypical);
        }
        double meanDeviation = deviationSum / typical.length;

        if (meanDeviation == 0.0) return NEUTRAL_CCI;
        return (typical[typical.length - 1] - smaTypical) / (CCI_CONSTANT * meanDeviation);
    }

    private static double highestHigh(List<Candle> window) {
        double max = Double.NEGATIVE_INFINITY;
        for (Candle c : window) {
            max = Math.max(max, c.high());
        }
        return max;
    }

    private static double lowestLow(List<Candle> window) {
        double min = Double.POSITIVE_INFINITY;
        for (Candle c : window) {
            min = Math.min(min, c.low());
        }
        return min;
    }

    private MomentumCalculator() {}
}
