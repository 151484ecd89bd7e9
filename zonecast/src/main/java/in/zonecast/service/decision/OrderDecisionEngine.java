package in.zonecast.service.decision;

import in.zonecast.domain.analysis.BollingerBand;
import in.zonecast.domain.analysis.MomentumAnalysis;
import in.zonecast.domain.analysis.TrendAnalysis;
import in.zonecast.domain.analysis.VolatilityAnalysis;
import in.zonecast.domain.analysis.VolumeAnalysis;
import in.zonecast.domain.data.Candle;
import in.zonecast.domain.order.Order;
import in.zonecast.domain.order.OrderType;
import in.zonecast.domain.regime.MarketRegime;
import in.zonecast.domain.regime.RegimeClassification;
import in.zonecast.domain.regime.SignalScore;
import in.zonecast.domain.regime.VolumeConfluenceSignal;
import in.zonecast.service.state.StreamSnapshot;
import in.zonecast.service.zone.SessionClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides once per candle whether to open a trade, choosing the strategy by regime.
 *
 * Skips when an order is active, inside the 10:00-12:00 blackout, near the close, once the
 * day's realized R reaches the cap, or with too little history.
 *
 * Strategies:
 * - Trending: recent MA cross, ADX >= 30, RSI not extreme, volume confirmation >= 0.4. Stop 2.0 ATR.
 * - Breakout: squeeze on the previous bar, relative volume above 2.0 now, score >= 85. Stop 2.5 ATR.
 * - Ranging tight: ADX < 25, band extreme with RSI, oscillator agreement. Stop 1.5 ATR.
 * - Ranging wide and unknown: no trade.
 *
 * Targets are 2.5R in every strategy.
 */
public class OrderDecisionEngine {
    private static final Logger log = LoggerFactory.getLogger(OrderDecisionEngine.class);

    public static final int MIN_CANDLES = 20;
    public static final int MIN_ANALYSES = 10;
    public static final double PROFIT_MULTIPLIER = 2.5;
    private static final int CROSS_LOOKBACK = 10;
    private static final int BREAKOUT_MIN_SCORE = 85;
    private static final int RANGING_MIN_SCORE = 75;

    private final DecisionConfig config;

    public OrderDecisionEngine(DecisionConfig config) {
        this.config = config;
    }

    public Optional<Order> evaluate(StreamSnapshot snapshot) {
        Optional<Candle> last = snapshot.lastCandle();
        if (last.isEmpty()) return Optional.empty();
        long ts = last.get().timestamp();

        if (snapshot.activeOrder().isPresent()) {
            log.debug("[DECISION] Skipping: order already active");
            return Optional.empty();
        }
        if (SessionClock.isInBlackout(ts)) {
            log.debug("[DECISION] Skipping: blackout window");
            return Optional.empty();
        }
        if (SessionClock.isNearClose(ts)) {
            log.debug("[DECISION] Skipping: near close");
            return Optional.empty();
        }
        if (dailyRealizedR(snapshot) >= config.dailyRCap()) {
            log.debug("[DECISION] Skipping: daily R cap {} reached", config.dailyRCap());
            return Optional.empty();
        }
        if (snapshot.candles().size() < MIN_CANDLES
                || snapshot.trends().size() < MIN_ANALYSES
                || snapshot.momentums().size() < MIN_ANALYSES
                || snapshot.volatilities().size() < MIN_ANALYSES) {
            log.debug("[DECISION] Insufficient history: candles={}", snapshot.candles().size());
            return Optional.empty();
        }

        RegimeClassification regime = RegimeDetector.detect(
            snapshot.trends(), snapshot.volatilities(), snapshot.volumes());
        VolumeConfluenceSignal volume = snapshot.volumes().isEmpty()
            ? VolumeConfluenceSignal.neutral(ts)
            : VolumeConfluenceAnalyzer.analyze(snapshot.volumes(), snapshot.candles());

        log.debug("[DECISION] Regime {} confidence {}", regime.regime(), String.format("%.2f", regime.confidence()));

        switch (regime.regime()) {
            case TRENDING_HIGH:
            case TRENDING_LOW:
                return trending(snapshot, regime, volume);
            case BREAKOUT:
                return breakout(snapshot, regime, volume);
            case RANGING_TIGHT:
                return rangingTight(snapshot, regime, volume);
            default:
                return Optional.empty();
        }
    }

    /**
     * Sum of realized R over orders closed on the snapshot's trading day.
     */
    static double dailyRealizedR(StreamSnapshot snapshot) {
        double total = 0.0;
        for (Order order : snapshot.orders()) {
            if (order.closeTimestamp() == null || order.exitPrice() == null) continue;
            if (!SessionClock.tradingDateOf(order.closeTimestamp()).equals(snapshot.tradingDay())) continue;
            total += order.realizedR();
        }
        return total;
    }

    private Optional<Order> trending(StreamSnapshot s, RegimeClassification regime, VolumeConfluenceSignal volume) {
        TrendAnalysis trend = last(s.trends());
        MomentumAnalysis momentum = last(s.momentums());
        VolatilityAnalysis volatility = last(s.volatilities());

        OrderType side = trend.isUptrend() ? OrderType.LONG : OrderType.SHORT;
        if (!hasRecentCross(s.trends(), side)) {
            log.debug("[DECISION] Trending: no recent {} cross", side == OrderType.LONG ? "golden" : "death");
            return Optional.empty();
        }
        if (trend.adx() < 30.0) {
            log.debug("[DECISION] Trending: weak ADX {}", trend.adx());
            return Optional.empty();
        }
        boolean momentumOk = side == OrderType.LONG
            ? momentum.rsi() > 25.0 && momentum.rsi() < 65.0
            : momentum.rsi() > 35.0 && momentum.rsi() < 75.0;
        if (!momentumOk) {
            log.debug("[DECISION] Trending: RSI extreme {}", momentum.rsi());
            return Optional.empty();
        }
        if (volume.confirmation() < 0.4) {
            log.debug("[DECISION] Trending: volume confirmation {}", volume.confirmation());
            return Optional.empty();
        }

        SignalScore score = SignalScorer.score(side, trend, momentum, volatility, regime, volume);
        if (!score.passes(config.minSignalScore())) {
            log.debug("[DECISION] Trending: score {} below {}", score.total(), config.minSignalScore());
            return Optional.empty();
        }
        return build(s, side, volatility, score, regime.regime(), "TrendRiding", 2.0);
    }

    private Optional<Order> breakout(StreamSnapshot s, RegimeClassification regime, VolumeConfluenceSignal volume) {
        List<VolatilityAnalysis> vols = s.volatilities();
        VolatilityAnalysis volatility = last(vols);
        VolatilityAnalysis previous = vols.get(vols.size() - 2);
        VolumeAnalysis currentVolume = s.volumes().isEmpty() ? null : last(s.volumes());
        MomentumAnalysis momentum = last(s.momentums());

        if (!previous.bollingerBand().isSqueezing()) {
            log.debug("[DECISION] Breakout: no squeeze on previous bar");
            return Optional.empty();
        }
        if (currentVolume == null || currentVolume.relativeVolume() <= 2.0) {
            log.debug("[DECISION] Breakout: no volume expansion");
            return Optional.empty();
        }

        BollingerBand bb = volatility.bollingerBand();
        OrderType side;
        if (bb.percentB() > 0.5 && momentum.rsi() > 50.0) {
            side = OrderType.LONG;
        } else if (bb.percentB() < 0.5 && momentum.rsi() < 50.0) {
            side = OrderType.SHORT;
        } else {
            return Optional.empty();
        }

        SignalScore score = SignalScorer.score(side, last(s.trends()), momentum, volatility, regime, volume);
        if (!score.passes(Math.max(BREAKOUT_MIN_SCORE, config.minSignalScore()))) {
            log.debug("[DECISION] Breakout: score {} too low", score.total());
            return Optional.empty();
        }
        return build(s, side, volatility, score, regime.regime(), "Breakout", 2.5);
    }

    private Optional<Order> rangingTight(StreamSnapshot s, RegimeClassification regime, VolumeConfluenceSignal volume) {
        TrendAnalysis trend = last(s.trends());
        MomentumAnalysis momentum = last(s.momentums());
        VolatilityAnalysis volatility = last(s.volatilities());

        if (trend.adx() >= 25.0) {
            log.debug("[DECISION] Ranging: ADX {} too high", trend.adx());
            return Optional.empty();
        }

        BollingerBand bb = volatility.bollingerBand();
        OrderType side;
        if (bb.percentB() < 0.2 && momentum.rsi() < 35.0) {
            side = OrderType.LONG;
        } else if (bb.percentB() > 0.8 && momentum.rsi() > 65.0) {
            side = OrderType.SHORT;
        } else {
            return Optional.empty();
        }

        boolean agreement = side == OrderType.LONG
            ? momentum.isStochasticsOversold() && momentum.isWilliamsROversold()
            : momentum.isStochasticsOverbought() && momentum.isWilliamsROverbought();
        if (!agreement) {
            log.debug("[DECISION] Ranging: oscillators disagree");
            return Optional.empty();
        }

        SignalScore score = SignalScorer.score(side, trend, momentum, volatility, regime, volume);
        if (!score.passes(RANGING_MIN_SCORE)) {
            log.debug("[DECISION] Ranging: score {} too low", score.total());
            return Optional.empty();
        }
        return build(s, side, volatility, score, regime.regime(), "MeanReversion", 1.5);
    }

    private Optional<Order> build(StreamSnapshot s, OrderType side, VolatilityAnalysis volatility,
                                  SignalScore score, MarketRegime regime, String strategy, double atrMultiplier) {
        Candle candle = s.lastCandle().orElseThrow();
        double entry = candle.close();
        double riskPoints = volatility.atr() * atrMultiplier;
        if (riskPoints <= 0) {
            log.debug("[DECISION] Zero ATR, no order");
            return Optional.empty();
        }

        double stop = side == OrderType.LONG ? entry - riskPoints : entry + riskPoints;
        double target = side == OrderType.LONG
            ? entry + riskPoints * PROFIT_MULTIPLIER
            : entry - riskPoints * PROFIT_MULTIPLIER;

        List<Order> closed = new ArrayList<>();
        for (Order order : s.orders()) {
            if (order.exitPrice() != null) closed.add(order);
        }
        double riskMultiplier = RiskSizer.riskMultiplier(closed, config.accountBalance());
        RiskSizer.ContractSize size = RiskSizer.contractsFor(
            riskMultiplier * RiskSizer.BASE_RISK_DOLLARS, riskPoints, config.contractSymbol());
        if (size.contracts() <= 0) {
            log.info("[DECISION] {} {} skipped: risk {} points too wide for budget", strategy, side, riskPoints);
            return Optional.empty();
        }

        String entryStrategy = "Adaptive-" + strategy + "-" + score.bucket();
        Order order = Order.planned("ORD-" + candle.timestamp(), side, entry, stop, target, entryStrategy,
            riskMultiplier, PROFIT_MULTIPLIER, regime, score.total(), size.contract(), size.contracts(),
            candle.timestamp());

        log.info("[DECISION] {} {} @ {} sl={} tp={} score={} {} x{}", entryStrategy, side, entry, stop, target,
            score.total(), size.contract(), size.contracts());
        return Optional.of(order);
    }

    private static boolean hasRecentCross(List<TrendAnalysis> trends, OrderType side) {
        int from = Math.max(1, trends.size() - CROSS_LOOKBACK);
        for (int i = from; i < trends.size(); i++) {
            TrendAnalysis prev = trends.get(i - 1);
            TrendAnalysis curr = trends.get(i);
            if (side == OrderType.LONG && !prev.isGoldenCross() && curr.isGoldenCross()) return true;
            if (side == OrderType.SHORT && !prev.isDeathCross() && curr.isDeathCross()) return true;
        }
        return false;
    }

    private static <T> T last(List<T> list) {
        return list.get(list.size() - 1);
    }
}
