package in.zonecast.service.analysis;

import in.zonecast.domain.analysis.AtrTrend;
import in.zonecast.domain.analysis.BandPosition;
import in.zonecast.domain.analysis.BollingerBand;
import in.zonecast.domain.analysis.KeltnerChannel;
import in.zonecast.domain.analysis.StdDevBands;
import in.zonecast.domain.analysis.TrueRangeAnalysis;
import in.zonecast.domain.analysis.VolatilityAnalysis;
import in.zonecast.domain.analysis.VolatilityLevel;
import in.zonecast.domain.data.Candle;

import java.util.Arrays;
import java.util.List;

/**
 * Volatility Calculator - ATR, Keltner channels, Bollinger bands and standard deviation bands.
 *
 * ATR uses Wilder's smoothing over all true ranges in the window:
 *   ATR_t = ((ATR_{t-1} x (n-1)) + TR_t) / n
 *
 * Short windows:
 * - TR analysis with fewer than period + 1 candles: ATR = last TR, STABLE, NORMAL
 * - Keltner / Bollinger with fewer than period candles: price x 1.02 / price / price x 0.98
 */
public final class VolatilityCalculator {

    public static final int ATR_PERIOD = 14;
    public static final int KELTNER_PERIOD = 20;
    public static final double KELTNER_MULTIPLIER = 1.5;
    public static final int BOLLINGER_PERIOD = 20;
    public static final double BOLLINGER_MULTIPLIER = 2.0;
    public static final int STD_DEV_PERIOD = 20;

    public static VolatilityAnalysis analyze(List<Candle> candles) {
        Smoothing.requireCandles(candles);
        return new VolatilityAnalysis(
            candles.get(candles.size() - 1).timestamp(),
            trueRange(candles, ATR_PERIOD),
            keltner(candles, KELTNER_PERIOD, KELTNER_MULTIPLIER),
            bollinger(candles, BOLLINGER_PERIOD, BOLLINGER_MULTIPLIER),
            stdDevBands(candles, STD_DEV_PERIOD)
        );
    }

    public static TrueRangeAnalysis trueRange(List<Candle> candles, int period) {
        Smoothing.requireCandles(candles);

        if (candles.size() < period + 1) {
            Candle current = candles.get(candles.size() - 1);
            Candle previous = candles.size() >= 2 ? candles.get(candles.size() - 2) : current;
            double tr = Smoothing.trueRange(current, previous);
            return new TrueRangeAnalysis(tr, tr, AtrTrend.STABLE, VolatilityLevel.NORMAL);
        }

        double[] trueRanges = new double[candles.size() - 1];
        for (int i = 1; i < candles.size(); i++) {
            trueRanges[i - 1] = Smoothing.trueRange(candles.get(i), candles.get(i - 1));
        }

        double atr = Smoothing.wilders(trueRanges, period);
        double currentTR = trueRanges[trueRanges.length - 1];

        return new TrueRangeAnalysis(currentTR, atr, atrTrend(trueRanges, period), level(currentTR, atr));
    }

    /**
     * Compares the ATR of the last period TRs with the ATR of the period TRs ending period/2 bars earlier.
     */
    private static AtrTrend atrTrend(double[] trueRanges, int period) {
        if (trueRanges.length < period * 2) {
            return AtrTrend.STABLE;
        }

        int n = trueRanges.length;
        double[] recent = Arrays.copyOfRange(trueRanges, n - period, n);
        int olderEnd = n - period / 2;
        double[] older = Arrays.copyOfRange(trueRanges, olderEnd - period, olderEnd);

        double recentAtr = Smoothing.wilders(recent, period);
        double olderAtr = Smoothing.wilders(older, period);

        if (recentAtr > olderAtr * 1.1) return AtrTrend.INCREASING;
        if (recentAtr < olderAtr * 0.9) return AtrTrend.DECREASING;
        return AtrTrend.STABLE;
    }

    private static VolatilityLevel level(double currentTR, double atr) {
        if (atr == 0.0) return VolatilityLevel.NORMAL;

        double ratio = currentTR / atr;
        if (ratio > 2.0) return VolatilityLevel.EXTREME;
        if (ratio > 1.5) return VolatilityLevel.HIGH;
        if (ratio < 0.5) return VolatilityLevel.LOW;
        return VolatilityLevel.NORMAL;
    }

    /**
     * SMA center with ATR(min(14, period)) x multiplier bands.
     */
    public static KeltnerChannel keltner(List<Candle> candles, int period, double atrMultiplier) {
        Smoothing.requireCandles(candles);
        double price = candles.get(candles.size() - 1).close();

        if (candles.size() < period) {
            return new KeltnerChannel(price * 1.02, price, price * 0.98, 0.04, BandPosition.INSIDE);
        }

        double[] closes = Smoothing.closes(Smoothing.takeRight(candles, period));
        double center = Smoothing.mean(closes, 0, closes.length);
        double atr = trueRange(candles, Math.min(ATR_PERIOD, period)).atr();

        double upper = center + atr * atrMultiplier;
        double lower = center - atr * atrMultiplier;
        double width = center != 0 ? (upper - lower) / center : 0.0;

        return new KeltnerChannel(upper, center, lower, width, position(price, upper, lower));
    }

    public static BollingerBand bollinger(List<Candle> candles, int period, double stdDevMultiplier) {
        Smoothing.requireCandles(candles);
        double price = candles.get(candles.size() - 1).close();

        if (candles.size() < period) {
            return new BollingerBand(price * 1.02, price, price * 0.98, 0.04, 0.5, BandPosition.INSIDE);
        }

        double[] closes = Smoothing.closes(Smoothing.takeRight(candles, period));
        double sma = Smoothing.mean(closes, 0, closes.length);
        double stdDev = populationStdDev(closes, sma);

        double upper = sma + stdDev * stdDevMultiplier;
        double lower = sma - stdDev * stdDevMultiplier;
        double bandwidth = sma != 0 ? (upper - lower) / sma : 0.0;
        double percentB = upper != lower ? (price - lower) / (upper - lower) : 0.5;

        return new BollingerBand(upper, sma, lower, bandwidth, percentB, position(price, upper, lower));
    }

    /**
     * 1 and 2 sigma bands over the last min(period, n) closes.
     */
    public static StdDevBands stdDevBands(List<Candle> candles, int period) {
        Smoothing.requireCandles(candles);

        double[] closes = Smoothing.closes(Smoothing.takeRight(candles, Math.min(period, candles.size())));
        double mean = Smoothing.mean(closes, 0, closes.length);
        double stdDev = populationStdDev(closes, mean);

        double upper1 = mean + stdDev;
        double lower1 = mean - stdDev;
        double upper2 = mean + 2 * stdDev;
        double lower2 = mean - 2 * stdDev;

        double price = candles.get(candles.size() - 1).close();
        int priceLevel;
        if (price >= upper2 || price <= lower2) {
            priceLevel = 2;
        } else if (price >= upper1 || price <= lower1) {
            priceLevel = 1;
        } else {
            priceLevel = 0;
        }

        return new StdDevBands(mean, stdDev, upper1, lower1, upper2, lower2, priceLevel);
    }

    private static double populationStdDev(double[] values, double mean) {
        double variance = 0.0;
        for (double v : values) {
            variance += (v - mean) * (v - mean);
        }
        return Math.sqrt(variance / values.length);
    }

    private static BandPosition position(double price, double upper, double lower) {
        if (price > upper) return BandPosition.ABOVE;
        if (price < lower) return BandPosition.BELOW;
        return BandPosition.INSIDE;
    }

    private VolatilityCalculator() {}
}
