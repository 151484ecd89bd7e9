package in.zonecast.service.decision;

import in.zonecast.domain.analysis.AtrTrend;
import in.zonecast.domain.analysis.TrendAnalysis;
import in.zonecast.domain.analysis.VolatilityAnalysis;
import in.zonecast.domain.analysis.VolumeAnalysis;
import in.zonecast.domain.regime.MarketRegime;
import in.zonecast.domain.regime.RegimeClassification;

import java.util.List;

/**
 * Classifies the market regime from recent analytics.
 *
 * Scores (0-100):
 * - trend: ADX * 0.5 + direction consistency over 5 bars * 30 + MA crossover strength * 20
 * - volatility: ATR as a share of the window's max ATR, +/-10 for the ATR trend, -20 in a squeeze
 * - volume: 50 adjusted by relative volume, volume trend and OBV direction
 *
 * Classification:
 * 1. Squeeze with increasing ATR: BREAKOUT
 * 2. Trend score above 50: TRENDING_HIGH above 60 volatility, else TRENDING_LOW
 * 3. Otherwise RANGING_WIDE above 50 volatility, else RANGING_TIGHT
 */
public final class RegimeDetector {

    public static final int MIN_SAMPLES = 5;
    private static final int CONSISTENCY_BARS = 5;

    public static RegimeClassification detect(
            List<TrendAnalysis> trends,
            List<VolatilityAnalysis> volatilities,
            List<VolumeAnalysis> volumes) {

        long timestamp = trends.isEmpty() ? 0L : trends.get(trends.size() - 1).timestamp();
        if (trends.size() < MIN_SAMPLES || volatilities.size() < MIN_SAMPLES) {
            return RegimeClassification.unknown(timestamp);
        }

        TrendAnalysis currentTrend = trends.get(trends.size() - 1);
        VolatilityAnalysis currentVol = volatilities.get(volatilities.size() - 1);

        double trendScore = trendScore(currentTrend, trends);
        double volatilityScore = volatilityScore(currentVol, volatilities);
        double volumeScore = volumes.isEmpty() ? 50.0 : volumeScore(volumes);

        MarketRegime regime = classify(trendScore, volatilityScore, currentVol);
        double confidence = confidence(trendScore, volatilityScore, volumeScore, trends.size());
        boolean transitioning = isTransitioning(trends, volatilities);

        return new RegimeClassification(regime, trendScore, volatilityScore, volumeScore,
            confidence, transitioning, timestamp);
    }

    static double trendScore(TrendAnalysis current, List<TrendAnalysis> recent) {
        double score = Math.min(current.adx(), 100.0) * 0.5;

        List<TrendAnalysis> lastFive = recent.subList(recent.size() - CONSISTENCY_BARS, recent.size());
        int up = 0;
        int down = 0;
        for (TrendAnalysis trend : lastFive) {
            if (trend.isUptrend()) up++;
            if (trend.isDowntrend()) down++;
        }
        score += Math.max(up, down) / (double) CONSISTENCY_BARS * 30.0;
        score += current.maCrossoverStrength() * 20.0;

        return Math.min(score, 100.0);
    }

    static double volatilityScore(VolatilityAnalysis current, List<VolatilityAnalysis> recent) {
        double atr = current.atr();
        double maxAtr = atr;
        for (VolatilityAnalysis v : recent) {
            maxAtr = Math.max(maxAtr, v.atr());
        }
        double normalized = maxAtr > 0 ? atr / maxAtr * 100.0 : 50.0;

        double trendBonus = switch (current.trueRange().atrTrend()) {
            case INCREASING -> 10.0;
            case DECREASING -> -10.0;
            case STABLE -> 0.0;
        };
        double squeeze = current.bollingerBand().isSqueezing() ? -20.0 : 0.0;

        return clamp(normalized + trendBonus + squeeze);
    }

    static double volumeScore(List<VolumeAnalysis> recent) {
        VolumeAnalysis current = recent.get(recent.size() - 1);
        double score = 50.0;

        if (current.relativeVolume() > 1.5) score += 20.0;
        else if (current.relativeVolume() > 1.2) score += 10.0;
        else if (current.relativeVolume() < 0.7) score -= 15.0;

        if (current.isVolumeIncreasing()) score += 15.0;

        if (recent.size() >= 2) {
            double previousObv = recent.get(recent.size() - 2).onBalanceVolume();
            if (current.onBalanceVolume() > previousObv) score += 15.0;
            else if (current.onBalanceVolume() < previousObv) score -= 10.0;
        }
        return clamp(score);
    }

    private static MarketRegime classify(double trendScore, double volatilityScore, VolatilityAnalysis current) {
        if (current.bollingerBand().isSqueezing() && current.trueRange().atrTrend() == AtrTrend.INCREASING) {
            return MarketRegime.BREAKOUT;
        }
        if (trendScore > 50.0) {
            return volatilityScore > 60.0 ? MarketRegime.TRENDING_HIGH : MarketRegime.TRENDING_LOW;
        }
        return volatilityScore > 50.0 ? MarketRegime.RANGING_WIDE : MarketRegime.RANGING_TIGHT;
    }

    private static double confidence(double trendScore, double volatilityScore, double volumeScore, int samples) {
        double average = (Math.abs(trendScore - 50.0) / 50.0
            + Math.abs(volatilityScore - 50.0) / 50.0
            + Math.abs(volumeScore - 50.0) / 50.0) / 3.0;
        double penalty = samples < 10 ? 0.7 : samples < 20 ? 0.85 : 1.0;
        return average * penalty;
    }

    private static boolean isTransitioning(List<TrendAnalysis> trends, List<VolatilityAnalysis> volatilities) {
        TrendAnalysis firstTrend = trends.get(trends.size() - CONSISTENCY_BARS);
        TrendAnalysis lastTrend = trends.get(trends.size() - 1);
        VolatilityAnalysis firstVol = volatilities.get(volatilities.size() - CONSISTENCY_BARS);
        VolatilityAnalysis lastVol = volatilities.get(volatilities.size() - 1);

        boolean adxChanging = Math.abs(lastTrend.adx() - firstTrend.adx()) > 5.0;
        boolean levelChanging = firstVol.trueRange().volatilityLevel() != lastVol.trueRange().volatilityLevel();
        boolean directionFlip = firstTrend.isUptrend() != lastTrend.isUptrend();

        return adxChanging || levelChanging || directionFlip;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(value, 100.0));
    }

    private RegimeDetector() {}
}
