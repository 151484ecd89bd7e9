package in.zonecast.service.analysis;

import in.zonecast.domain.analysis.VolumeAnalysis;
import in.zonecast.domain.analysis.VolumeProfile;
import in.zonecast.domain.analysis.VolumeProfileLevel;
import in.zonecast.domain.analysis.VolumeTrend;
import in.zonecast.domain.analysis.VwapAnalysis;
import in.zonecast.domain.data.Candle;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Volume analytics: volume profile, VWAP, OBV, VPT, relative volume and volume trend.
 */
public final class VolumeCalculator {

    public static final int PRICE_LEVELS = 30;
    public static final int RELATIVE_VOLUME_LOOKBACK = 20;
    public static final int VOLUME_TREND_PERIODS = 5;

    private static final int VOLUME_TREND_WINDOW = 30;
    private static final int OBV_WINDOW = 200;
    private static final int VWAP_SLOPE_POINTS = 5;
    private static final double VALUE_AREA_SHARE = 0.70;

    public static VolumeAnalysis analyze(List<Candle> candles) {
        Smoothing.requireCandles(candles);

        List<Candle> obvWindow = Smoothing.takeRight(candles, OBV_WINDOW);
        return new VolumeAnalysis(
            candles.get(candles.size() - 1).timestamp(),
            profile(candles, PRICE_LEVELS),
            vwap(candles),
            relativeVolume(candles, Math.min(candles.size(), RELATIVE_VOLUME_LOOKBACK)),
            volumeTrend(Smoothing.takeRight(candles, VOLUME_TREND_WINDOW), VOLUME_TREND_PERIODS),
            onBalanceVolume(obvWindow),
            volumePriceTrend(obvWindow)
        );
    }

    /**
     * Volume-at-price histogram. Each candle's volume is spread across the levels it covers,
     * weighted toward its close and typical price.
     */
    public static VolumeProfile profile(List<Candle> candles, int priceLevels) {
        Smoothing.requireCandles(candles);

        if (candles.size() < 2) {
            Candle candle = candles.get(0);
            double price = candle.typicalPrice();
            VolumeProfileLevel level = new VolumeProfileLevel(price, candle.volume(), 100.0);
            return new VolumeProfile(List.of(level), price, candle.high(), candle.low(), candle.volume());
        }

        double minPrice = Double.POSITIVE_INFINITY;
        double maxPrice = Double.NEGATIVE_INFINITY;
        long totalVolume = 0L;
        for (Candle c : candles) {
            minPrice = Math.min(minPrice, c.low());
            maxPrice = Math.max(maxPrice, c.high());
            totalVolume += c.volume();
        }

        double priceStep = (maxPrice - minPrice) / priceLevels;
        if (priceStep <= 0.0) {
            // Every candle printed at one price
            VolumeProfileLevel level = new VolumeProfileLevel(minPrice, totalVolume, totalVolume > 0 ? 100.0 : 0.0);
            return new VolumeProfile(List.of(level), minPrice, minPrice, minPrice, totalVolume);
        }

        TreeMap<Double, Long> distribution = new TreeMap<>();
        for (Candle candle : candles) {
            distribute(candle, priceStep, distribution);
        }

        List<VolumeProfileLevel> levels = new ArrayList<>(distribution.size());
        for (Map.Entry<Double, Long> entry : distribution.entrySet()) {
            double percent = totalVolume > 0 ? entry.getValue() * 100.0 / totalVolume : 0.0;
            levels.add(new VolumeProfileLevel(entry.getKey(), entry.getValue(), percent));
        }

        VolumeProfileLevel poc = levels.get(0);
        for (VolumeProfileLevel level : levels) {
            if (level.volume() > poc.volume()) poc = level;
        }

        double[] valueArea = valueArea(levels, totalVolume);
        return new VolumeProfile(levels, poc.price(), valueArea[0], valueArea[1], totalVolume);
    }

    private static void distribute(Candle candle, double priceStep, Map<Double, Long> distribution) {
        double range = candle.range();
        int levelsInCandle = Math.max(1, (int) (range / priceStep));

        if (levelsInCandle == 1) {
            distribution.merge(roundToStep(candle.typicalPrice(), priceStep), candle.volume(), Long::sum);
            return;
        }

        double levelStep = range / levelsInCandle;
        double[] weights = new double[levelsInCandle + 1];
        double weightSum = 0.0;
        for (int i = 0; i <= levelsInCandle; i++) {
            double levelPrice = candle.low() + i * levelStep;
            weights[i] = volumeWeight(
                Math.abs(levelPrice - candle.typicalPrice()),
                Math.abs(levelPrice - candle.close()),
                range);
            weightSum += weights[i];
        }

        TreeMap<Double, Long> local = new TreeMap<>();
        for (int i = 0; i <= levelsInCandle; i++) {
            double rounded = roundToStep(candle.low() + i * levelStep, priceStep);
            local.merge(rounded, (long) (candle.volume() * weights[i] / weightSum), Long::sum);
        }

        // Rounding remainder goes to the heaviest level of this candle
        long distributed = local.values().stream().mapToLong(Long::longValue).sum();
        if (distributed != candle.volume()) {
            Map.Entry<Double, Long> heaviest = local.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .orElseThrow();
            local.put(heaviest.getKey(), heaviest.getValue() + candle.volume() - distributed);
        }

        local.forEach((price, volume) -> distribution.merge(price, volume, Long::sum));
    }

    private static double volumeWeight(double distanceFromTypical, double distanceFromClose, double range) {
        if (range == 0) return 1.0;
        double typicalWeight = 1.0 - distanceFromTypical / (range + 0.01);
        double closeWeight = 1.0 - distanceFromClose / (range + 0.01);
        return Math.max(typicalWeight * 0.3 + closeWeight * 0.7, 0.1);
    }

    private static double roundToStep(double price, double step) {
        return Math.round(price / step) * step;
    }

    /**
     * Highest-volume levels until 70% of the total is covered. Returns {high, low}.
     */
    private static double[] valueArea(List<VolumeProfileLevel> levels, long totalVolume) {
        List<VolumeProfileLevel> byVolume = new ArrayList<>(levels);
        byVolume.sort(Comparator.comparingLong(VolumeProfileLevel::volume).reversed());

        double target = totalVolume * VALUE_AREA_SHARE;
        long accumulated = 0L;
        double high = Double.NEGATIVE_INFINITY;
        double low = Double.POSITIVE_INFINITY;
        for (VolumeProfileLevel level : byVolume) {
            if (accumulated >= target) break;
            accumulated += level.volume();
            high = Math.max(high, level.price());
            low = Math.min(low, level.price());
        }

        if (high == Double.NEGATIVE_INFINITY) {
            high = levels.get(levels.size() - 1).price();
            low = levels.get(0).price();
        }
        return new double[] {high, low};
    }

    /**
     * Cumulative VWAP on the typical price. Slope is taken over the last five VWAP points.
     */
    public static VwapAnalysis vwap(List<Candle> candles) {
        Smoothing.requireCandles(candles);

        if (candles.size() == 1) {
            return new VwapAnalysis(candles.get(0).typicalPrice(), 0.0, 0.0);
        }

        double cumulativePV = 0.0;
        double cumulativePV2 = 0.0;
        long cumulativeVolume = 0L;
        double[] progression = new double[candles.size()];

        for (int i = 0; i < candles.size(); i++) {
            Candle candle = candles.get(i);
            double typical = candle.typicalPrice();
            cumulativePV += typical * candle.volume();
            cumulativePV2 += typical * typical * candle.volume();
            cumulativeVolume += candle.volume();
            progression[i] = cumulativeVolume > 0 ? cumulativePV / cumulativeVolume : typical;
        }

        double vwap = progression[progression.length - 1];
        double variance = cumulativeVolume > 0 ? cumulativePV2 / cumulativeVolume - vwap * vwap : 0.0;
        double stdDev = Math.sqrt(Math.max(variance, 0.0));

        int points = Math.min(VWAP_SLOPE_POINTS, progression.length);
        double first = progression[progression.length - points];
        double slope = (vwap - first) / points;

        return new VwapAnalysis(vwap, stdDev, slope);
    }

    public static double onBalanceVolume(List<Candle> candles) {
        Smoothing.requireCandles(candles);
        if (candles.size() < 2) return candles.get(0).volume();

        double obv = 0.0;
        for (int i = 1; i < candles.size(); i++) {
            double close = candles.get(i).close();
            double previousClose = candles.get(i - 1).close();
            if (close > previousClose) {
                obv += candles.get(i).volume();
            } else if (close < previousClose) {
                obv -= candles.get(i).volume();
            }
        }
        return obv;
    }

    public static double volumePriceTrend(List<Candle> candles) {
        Smoothing.requireCandles(candles);

        double vpt = 0.0;
        for (int i = 1; i < candles.size(); i++) {
            double previousClose = candles.get(i - 1).close();
            if (previousClose != 0) {
                double change = (candles.get(i).close() - previousClose) / previousClose;
                vpt += candles.get(i).volume() * change;
            }
        }
        return vpt;
    }

    /**
     * Last volume divided by the mean of up to {@code lookback} preceding volumes. 1.0 when undefined.
     */
    public static double relativeVolume(List<Candle> candles, int lookback) {
        Smoothing.requireCandles(candles);
        if (candles.size() < 2) return 1.0;

        double current = candles.get(candles.size() - 1).volume();
        List<Candle> history = Smoothing.takeRight(candles.subList(0, candles.size() - 1), lookback);
        if (history.isEmpty()) return 1.0;

        double sum = 0.0;
        for (Candle c : history) {
            sum += c.volume();
        }
        double average = sum / history.size();
        return average > 0 ? current / average : 1.0;
    }

    /**
     * Splits the last {@code periods} volumes in two halves and compares their means, +/-20%.
     */
    public static VolumeTrend volumeTrend(List<Candle> candles, int periods) {
        Smoothing.requireCandles(candles);
        if (candles.size() < periods) return VolumeTrend.STABLE;

        List<Candle> recent = Smoothing.takeRight(candles, periods);
        int split = periods / 2;
        double firstAvg = 0.0;
        double secondAvg = 0.0;
        for (int i = 0; i < recent.size(); i++) {
            if (i < split) {
                firstAvg += recent.get(i).volume();
            } else {
                secondAvg += recent.get(i).volume();
            }
        }
        firstAvg /= split;
        secondAvg /= recent.size() - split;

        if (firstAvg == 0.0) {
            return secondAvg > 0.0 ? VolumeTrend.INCREASING : VolumeTrend.STABLE;
        }
        double ratio = secondAvg / firstAvg;
        if (ratio > 1.2) return VolumeTrend.INCREASING;
        if (ratio < 0.8) return VolumeTrend.DECREASING;
        return VolumeTrend.STABLE;
    }

    private VolumeCalculator() {}
}
