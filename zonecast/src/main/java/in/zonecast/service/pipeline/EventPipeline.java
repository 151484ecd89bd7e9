package in.zonecast.service.pipeline;

import in.zonecast.domain.analysis.TechnicalAnalysis;
import in.zonecast.domain.data.Candle;
import in.zonecast.domain.event.CandleEvent;
import in.zonecast.domain.event.Event;
import in.zonecast.domain.event.LiquidityExtremeEvent;
import in.zonecast.domain.event.OrderEvent;
import in.zonecast.domain.event.PlanZoneEvent;
import in.zonecast.domain.event.SwingPointEvent;
import in.zonecast.domain.event.TechnicalAnalysisEvent;
import in.zonecast.domain.order.Order;
import in.zonecast.domain.zone.SwingPoint;
import in.zonecast.infrastructure.metrics.PipelineMetrics;
import in.zonecast.service.analysis.TechnicalAnalysisEngine;
import in.zonecast.service.decision.OrderDecisionEngine;
import in.zonecast.service.execution.OrderLifecycle;
import in.zonecast.service.state.StreamState;
import in.zonecast.service.zone.LiquidityZoneTracker;
import in.zonecast.service.zone.PlanZoneTracker;
import in.zonecast.service.zone.SessionClock;
import in.zonecast.service.zone.SwingPointDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Turns candles into events for one stream. Owns the stream's detectors and is the only
 * writer of its {@link StreamState}.
 *
 * Per candle: rollover check, liquidity extremes, technical analysis, swing points, plan zones,
 * then (when trading is enabled) the order lifecycle and decision engine. Events come out as
 * Candle, SwingPoint, LiquidityExtreme, PlanZone, TechnicalAnalysis, Order.
 */
public class EventPipeline {
    private static final Logger log = LoggerFactory.getLogger(EventPipeline.class);

    private final StreamState state;
    private final PipelineMetrics metrics;
    private volatile StreamMode mode;

    private final TechnicalAnalysisEngine analysisEngine = new TechnicalAnalysisEngine();
    private final SwingPointDetector swingDetector = new SwingPointDetector();
    private final PlanZoneTracker planZones = new PlanZoneTracker();
    private final LiquidityZoneTracker liquidity;

    private final OrderDecisionEngine decisionEngine;
    private final OrderLifecycle lifecycle;
    private volatile boolean tradingEnabled;

    public EventPipeline(StreamState state, PipelineMetrics metrics, StreamMode mode) {
        this(state, metrics, mode, null, null);
    }

    public EventPipeline(StreamState state, PipelineMetrics metrics, StreamMode mode,
                         OrderDecisionEngine decisionEngine, OrderLifecycle lifecycle) {
        this.state = state;
        this.metrics = metrics;
        this.mode = mode;
        this.decisionEngine = decisionEngine;
        this.lifecycle = lifecycle;
        this.liquidity = new LiquidityZoneTracker(state.getTradingDay());
        this.tradingEnabled = decisionEngine != null && lifecycle != null;
    }

    /**
     * Processes one candle. Out-of-order candles are dropped with a warning and yield no events.
     */
    public List<Event> onCandle(Candle candle) {
        long ts = candle.timestamp();
        if (ts < state.lastTimestamp()) {
            log.warn("[PIPELINE] Dropping out-of-order candle {} (last {})", ts, state.lastTimestamp());
            metrics.candleSkipped();
            return Collections.emptyList();
        }

        List<Order> orderChanges = new ArrayList<>();
        if (lifecycle != null) {
            orderChanges.addAll(lifecycle.drain(state));
        }

        List<LiquidityExtremeEvent> extremeEvents = new ArrayList<>(rolloverIfNeeded(ts));

        state.appendCandle(candle);

        try {
            extremeEvents.addAll(liquidity.onCandle(candle));
        } catch (DateTimeException e) {
            log.warn("[PIPELINE] Session window computation failed at {}: {}", ts, e.getMessage());
        }
        for (LiquidityExtremeEvent event : extremeEvents) {
            state.applyExtreme(event.extreme());
        }

        TechnicalAnalysis analysis = analysisEngine.analyze(state.candles());
        state.appendAnalysis(analysis);

        Optional<SwingPoint> swing = swingDetector.onCandle(state.candles());
        swing.ifPresent(state::addSwingPoint);

        List<PlanZoneEvent> zoneEvents = planZones.onCandle(candle, state.swingPoints());
        for (PlanZoneEvent event : zoneEvents) {
            state.applyPlanZone(event.zone());
        }

        if (tradingEnabled) {
            orderChanges.addAll(lifecycle.onCandle(state, candle));
            orderChanges.addAll(lifecycle.drain(state));
            Optional<Order> decision = decisionEngine.evaluate(state.snapshot());
            if (decision.isPresent()) {
                Order order = decision.get();
                state.applyOrder(order);
                orderChanges.add(order);
                lifecycle.submit(order, ts);
                orderChanges.addAll(lifecycle.drain(state));
                // Republish so readers see the new order
                state.snapshot();
            }
            lifecycle.requestReconcile(ts);
        } else {
            state.snapshot();
        }

        metrics.candleProcessed(mode.label());

        List<Event> events = new ArrayList<>();
        events.add(new CandleEvent(candle));
        swing.ifPresent(s -> events.add(new SwingPointEvent(s, ts)));
        events.addAll(extremeEvents);
        events.addAll(zoneEvents);
        events.add(new TechnicalAnalysisEvent(analysis));
        for (Order order : orderChanges) {
            events.add(new OrderEvent(order, ts));
            metrics.orderStatus(order.status());
        }
        for (Event event : events) {
            metrics.eventEmitted(event.eventType());
        }
        return events;
    }

    public StreamState getState() {
        return state;
    }

    public StreamMode getMode() {
        return mode;
    }

    /**
     * Switches the metrics label and cancel behaviour, e.g. when a warmed-up replay pipeline goes live.
     */
    public void setMode(StreamMode mode) {
        this.mode = mode;
    }

    public boolean isTradingEnabled() {
        return tradingEnabled;
    }

    public void setTradingEnabled(boolean tradingEnabled) {
        if (tradingEnabled && (decisionEngine == null || lifecycle == null)) {
            throw new IllegalStateException("Trading needs a decision engine and an order lifecycle");
        }
        this.tradingEnabled = tradingEnabled;
    }

    private List<LiquidityExtremeEvent> rolloverIfNeeded(long ts) {
        LocalDate sessionDay;
        try {
            sessionDay = SessionClock.tradingDateOf(ts);
        } catch (DateTimeException e) {
            log.warn("[PIPELINE] Trading date computation failed at {}: {}", ts, e.getMessage());
            return Collections.emptyList();
        }
        if (!sessionDay.isAfter(state.getTradingDay())) {
            return Collections.emptyList();
        }
        log.info("[PIPELINE] Trading day rollover {} -> {} ({})", state.getTradingDay(), sessionDay, mode.label());
        state.setTradingDay(sessionDay);
        return liquidity.rollover(sessionDay, ts, state.candles());
    }
}
