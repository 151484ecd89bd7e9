package in.zonecast.service.decision;

import in.zonecast.domain.analysis.BandPosition;
import in.zonecast.domain.analysis.BollingerBand;
import in.zonecast.domain.analysis.MomentumAnalysis;
import in.zonecast.domain.analysis.TrendAnalysis;
import in.zonecast.domain.analysis.VolatilityAnalysis;
import in.zonecast.domain.order.OrderType;
import in.zonecast.domain.regime.DivergenceType;
import in.zonecast.domain.regime.RegimeClassification;
import in.zonecast.domain.regime.SignalScore;
import in.zonecast.domain.regime.VolumeConfluenceSignal;

/**
 * Scores a candidate entry on five components of 0-20 points each.
 *
 * Each component is computed independently and clamped, so the total is always in [0, 100].
 */
public final class SignalScorer {

    public static SignalScore score(
            OrderType side,
            TrendAnalysis trend,
            MomentumAnalysis momentum,
            VolatilityAnalysis volatility,
            RegimeClassification regime,
            VolumeConfluenceSignal volume) {

        return new SignalScore(
            trendAlignment(side, trend),
            volumeConfirmation(side, volume),
            momentumConvergence(side, momentum),
            volatilityContext(volatility),
            regimeFit(regime)
        );
    }

    static int trendAlignment(OrderType side, TrendAnalysis trend) {
        int score = 0;
        if (trend.adx() > 40.0) score += 10;
        else if (trend.adx() > 35.0) score += 9;
        else if (trend.adx() > 30.0) score += 7;
        else if (trend.adx() > 25.0) score += 5;

        boolean isLong = side == OrderType.LONG;
        if (isLong ? trend.isUptrend() : trend.isDowntrend()) score += 6;
        if (isLong ? trend.isGoldenCross() : trend.isDeathCross()) score += 4;
        return score;
    }

    static int volumeConfirmation(OrderType side, VolumeConfluenceSignal volume) {
        int score = 0;
        if (volume.confirmation() > 0.8) score += 10;
        else if (volume.confirmation() > 0.6) score += 7;
        else if (volume.confirmation() > 0.4) score += 4;

        if (volume.massiveSpike()) score += 5;
        else if (volume.volumeSpike()) score += 3;

        boolean aligned = side == OrderType.LONG
            ? volume.accumulation() && !volume.distribution()
            : volume.distribution() && !volume.accumulation();
        if (aligned) score += 5;

        DivergenceType opposing = side == OrderType.LONG ? DivergenceType.BEARISH : DivergenceType.BULLISH;
        if (volume.divergence() == opposing) score -= 5;
        return score;
    }

    static int momentumConvergence(OrderType side, MomentumAnalysis m) {
        int score = 0;
        if (side == OrderType.LONG) {
            if (m.rsi() < 35.0) score += 5;
            else if (m.rsi() < 45.0) score += 4;
            else if (m.rsi() < 50.0) score += 2;

            if (m.isStochasticsOversold()) score += 5;
            else if (m.stochasticsK() < 40.0) score += 4;
            else if (m.stochasticsK() < 50.0) score += 2;

            if (m.isWilliamsROversold()) score += 5;
            else if (m.williamsR() < -60.0) score += 4;
            else if (m.williamsR() < -50.0) score += 2;

            if (m.isCciOversold()) score += 5;
            else if (m.cci() < 0.0) score += 4;
        } else {
            if (m.rsi() > 65.0) score += 5;
            else if (m.rsi() > 55.0) score += 4;
            else if (m.rsi() > 50.0) score += 2;

            if (m.isStochasticsOverbought()) score += 5;
            else if (m.stochasticsK() > 60.0) score += 4;
            else if (m.stochasticsK() > 50.0) score += 2;

            if (m.isWilliamsROverbought()) score += 5;
            else if (m.williamsR() > -40.0) score += 4;
            else if (m.williamsR() > -50.0) score += 2;

            if (m.isCciOverbought()) score += 5;
            else if (m.cci() > 0.0) score += 4;
        }
        return score;
    }

    static int volatilityContext(VolatilityAnalysis volatility) {
        int score = switch (volatility.trueRange().volatilityLevel()) {
            case NORMAL -> 10;
            case HIGH -> 7;
            case LOW -> 5;
            case EXTREME -> 3;
        };

        BollingerBand bb = volatility.bollingerBand();
        if (bb.isSqueezing()) {
            score += 3;
        } else if (bb.percentB() > 0.2 && bb.percentB() < 0.8) {
            score += 5;
        } else if (bb.percentB() > 0.1 && bb.percentB() < 0.9) {
            score += 3;
        }

        score += volatility.keltnerChannel().pricePosition() == BandPosition.INSIDE ? 5 : 2;
        return score;
    }

    static int regimeFit(RegimeClassification regime) {
        int score = 0;
        if (regime.confidence() > 0.7) score += 10;
        else if (regime.confidence() > 0.5) score += 7;
        else if (regime.confidence() > 0.3) score += 4;

        score += switch (regime.regime()) {
            case TRENDING_HIGH, TRENDING_LOW -> 10;
            case BREAKOUT -> 8;
            case RANGING_TIGHT -> 3;
            case RANGING_WIDE -> 2;
            case UNKNOWN -> 0;
        };

        if (regime.transitioning()) score -= 5;
        return score;
    }

    private SignalScorer() {}
}
