package in.zonecast.service.core;

import in.zonecast.application.port.input.CandleSource;
import in.zonecast.application.port.output.EventStore;
import in.zonecast.domain.common.Phase;
import in.zonecast.domain.data.Resolution;
import in.zonecast.domain.event.CandleEvent;
import in.zonecast.domain.event.LiquidityExtremeEvent;
import in.zonecast.domain.event.PhaseEvent;
import in.zonecast.domain.event.PlanZoneEvent;
import in.zonecast.domain.zone.LiquidityExtreme;
import in.zonecast.domain.zone.PlanZone;
import in.zonecast.domain.zone.ZoneChange;
import in.zonecast.infrastructure.metrics.PipelineMetrics;
import in.zonecast.service.decision.DecisionConfig;
import in.zonecast.service.decision.OrderDecisionEngine;
import in.zonecast.service.execution.OrderLifecycle;
import in.zonecast.service.pipeline.EventPipeline;
import in.zonecast.service.pipeline.StreamMode;
import in.zonecast.service.pipeline.StreamStatus;
import in.zonecast.service.pipeline.StreamTask;
import in.zonecast.service.state.StreamSnapshot;
import in.zonecast.service.state.StreamState;
import in.zonecast.service.zone.MarketCalendar;
import in.zonecast.service.zone.SessionClock;
import in.zonecast.transport.ws.ControlListener;
import in.zonecast.transport.ws.EventDistributor;
import in.zonecast.transport.ws.EventJsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

/**
 * Runs the three phases of a trading day.
 *
 * PLANNING replays the prior trading days in one-minute candles up to the 09:30 open.
 * PREPARING replays five-minute candles before the open, re-announcing the zones and
 * extremes planning left open. TRADING continues the preparing pipeline on the live
 * stream with order decisions enabled.
 *
 * Every event is serialized once, stored per (date, phase) and published to subscribers.
 */
public class CoreService implements ControlListener {
    private static final Logger log = LoggerFactory.getLogger(CoreService.class);

    static final LocalTime OPEN = LocalTime.of(9, 30);
    static final Duration PREPARING_LEAD = Duration.ofHours(1);
    static final Duration PREPARING_DEFAULT_LOOKBACK = Duration.ofHours(12);

    private final CandleSource candleSource;
    private final EventStore eventStore;
    private final EventDistributor distributor;
    private final PipelineMetrics metrics;
    private final DecisionConfig decisionConfig;
    private final OrderLifecycle lifecycle;
    private final ExecutorService streamExecutor;
    private final int windowCap;
    private final Clock clock;

    private final Map<Phase, StreamTask> running = new EnumMap<>(Phase.class);
    private final Map<Phase, LocalDate> runningDates = new EnumMap<>(Phase.class);
    private StreamState planningState;
    private EventPipeline preparedPipeline;
    private LocalDate preparedDate;

    public CoreService(CandleSource candleSource, EventStore eventStore, EventDistributor distributor,
                       PipelineMetrics metrics, DecisionConfig decisionConfig, OrderLifecycle lifecycle,
                       ExecutorService streamExecutor, int windowCap, Clock clock) {
        this.candleSource = candleSource;
        this.eventStore = eventStore;
        this.distributor = distributor;
        this.metrics = metrics;
        this.decisionConfig = decisionConfig;
        this.lifecycle = lifecycle;
        this.streamExecutor = streamExecutor;
        this.windowCap = windowCap;
        this.clock = clock;
    }

    /**
     * Replays {@code days} trading days before {@code tradingDate}, from midnight NY to the open.
     */
    public synchronized StreamTask startPlanning(LocalDate tradingDate, int days) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be at least 1: " + days);
        }
        LocalDate firstDay = MarketCalendar.tradingDaysBack(tradingDate, days);
        long from = SessionClock.at(firstDay, LocalTime.MIDNIGHT);
        long to = SessionClock.at(tradingDate, OPEN);

        StreamState state = new StreamState(SessionClock.tradingDateOf(from), windowCap);
        EventPipeline pipeline = new EventPipeline(state, metrics, StreamMode.REPLAY);
        planningState = state;

        log.info("[CORE] Planning {} over {} trading days from {}", tradingDate, days, firstDay);
        StreamTask task = new StreamTask("planning-" + tradingDate, Phase.PLANNING,
            () -> candleSource.stream(from, to, Resolution.ONE_MINUTE), pipeline,
            sinkFor(tradingDate, Phase.PLANNING));
        return launch(tradingDate, task);
    }

    /**
     * Warm-up replay before the open. Zones and extremes still open after planning are
     * re-emitted when the replay reaches their start.
     */
    public synchronized StreamTask startPreparing(LocalDate tradingDate) {
        List<PhaseEvent> carried = carriedOver();
        long to = SessionClock.at(tradingDate, OPEN);
        long from = carried.isEmpty()
            ? to - PREPARING_DEFAULT_LOOKBACK.toMillis()
            : carried.get(0).timestamp() - PREPARING_LEAD.toMillis();

        StreamState state = new StreamState(SessionClock.tradingDateOf(from), windowCap);
        OrderDecisionEngine engine = new OrderDecisionEngine(decisionConfig);
        EventPipeline pipeline = new EventPipeline(state, metrics, StreamMode.REPLAY, engine, lifecycle);
        pipeline.setTradingEnabled(false);
        preparedPipeline = pipeline;
        preparedDate = tradingDate;

        log.info("[CORE] Preparing {} from {} with {} carried zones/extremes",
            tradingDate, SessionClock.formatNewYork(from), carried.size());
        Consumer<PhaseEvent> sink = new CarryOverSink(carried, sinkFor(tradingDate, Phase.PREPARING));
        StreamTask task = new StreamTask("preparing-" + tradingDate, Phase.PREPARING,
            () -> candleSource.stream(from, to, Resolution.FIVE_MINUTES), pipeline, sink);
        return launch(tradingDate, task);
    }

    /**
     * Live stream from the open with the decision engine enabled. Reuses the pipeline warmed up
     * by PREPARING for the same date, or starts cold.
     */
    public synchronized StreamTask startTrading(LocalDate tradingDate) {
        EventPipeline pipeline;
        if (preparedPipeline != null && tradingDate.equals(preparedDate)) {
            pipeline = preparedPipeline;
        } else {
            log.warn("[CORE] No preparing run for {}, trading starts without warm-up", tradingDate);
            StreamState state = new StreamState(tradingDate, windowCap);
            pipeline = new EventPipeline(state, metrics, StreamMode.REPLAY,
                new OrderDecisionEngine(decisionConfig), lifecycle);
        }
        pipeline.setMode(StreamMode.LIVE);
        pipeline.setTradingEnabled(true);
        preparedPipeline = null;

        long from = SessionClock.at(tradingDate, OPEN);
        StreamTask task = new StreamTask("trading-" + tradingDate, Phase.TRADING,
            () -> candleSource.live(from), pipeline, sinkFor(tradingDate, Phase.TRADING));
        return launch(tradingDate, task);
    }

    public synchronized boolean stop(Phase phase) {
        StreamTask task = running.get(phase);
        if (task == null || task.getStatus().isFinished()) {
            return false;
        }
        log.info("[CORE] Stopping {}", task.getName());
        task.cancel();
        return true;
    }

    public synchronized void stopAll() {
        for (Phase phase : Phase.values()) {
            stop(phase);
        }
    }

    public synchronized Optional<StreamTask> task(Phase phase) {
        return Optional.ofNullable(running.get(phase));
    }

    public synchronized Optional<LocalDate> runningDate(Phase phase) {
        return Optional.ofNullable(runningDates.get(phase));
    }

    public List<String> events(LocalDate tradingDate, Phase phase) {
        return eventStore.events(tradingDate, phase);
    }

    public boolean isComplete(LocalDate tradingDate, Phase phase) {
        return eventStore.isComplete(tradingDate, phase);
    }

    @Override
    public void onPlan(LocalDate date, int days) {
        startPlanning(date, days);
    }

    /**
     * Warm-up for the planned date (or the current trading date), then trading once it completes.
     */
    @Override
    public void onTrade() {
        LocalDate date;
        synchronized (this) {
            date = runningDates.getOrDefault(Phase.PLANNING, currentTradingDate());
        }
        StreamTask preparing = startPreparing(date);
        preparing.completion().thenAccept(status -> {
            if (status == StreamStatus.COMPLETED) {
                startTrading(date);
            }
        });
    }

    LocalDate currentTradingDate() {
        return SessionClock.tradingDateOf(clock.millis());
    }

    private StreamTask launch(LocalDate tradingDate, StreamTask task) {
        Phase phase = task.getPhase();
        StreamTask previous = running.get(phase);
        if (previous != null && !previous.getStatus().isFinished()) {
            log.info("[CORE] Replacing running {}", previous.getName());
            previous.cancel();
        }
        eventStore.clear(tradingDate, phase);
        running.put(phase, task);
        runningDates.put(phase, tradingDate);

        distributor.publish(EventJsonCodec.lifecycle(phase.wireName(), "started", clock.millis()));
        task.completion().whenComplete((status, error) -> {
            if (error != null) {
                distributor.publish(EventJsonCodec.lifecycle(phase.wireName(), "failed", clock.millis()));
                return;
            }
            if (status == StreamStatus.COMPLETED) {
                eventStore.markComplete(tradingDate, phase);
            }
            distributor.publish(EventJsonCodec.lifecycle(phase.wireName(),
                status.name().toLowerCase(Locale.ROOT), clock.millis()));
        });
        streamExecutor.execute(task);
        return task;
    }

    private Consumer<PhaseEvent> sinkFor(LocalDate tradingDate, Phase phase) {
        return phaseEvent -> {
            String json = EventJsonCodec.encode(phaseEvent);
            eventStore.append(tradingDate, phase, json);
            distributor.publish(json);
        };
    }

    private List<PhaseEvent> carriedOver() {
        List<PhaseEvent> carried = new ArrayList<>();
        StreamState source = planningState;
        if (source == null) {
            return carried;
        }
        StreamSnapshot snapshot = source.latest();
        for (PlanZone zone : snapshot.activePlanZones()) {
            carried.add(new PhaseEvent(Phase.PREPARING,
                new PlanZoneEvent(zone, ZoneChange.CREATED, zone.startTimestamp())));
        }
        for (LiquidityExtreme extreme : snapshot.activeExtremes()) {
            carried.add(new PhaseEvent(Phase.PREPARING,
                new LiquidityExtremeEvent(extreme, ZoneChange.CREATED, extreme.startTimestamp())));
        }
        carried.sort(Comparator.comparingLong(PhaseEvent::timestamp));
        return carried;
    }

    /**
     * Replaces the replay's own zone and extreme events with the carried-over ones, each released
     * after the first candle at or past its start.
     */
    static final class CarryOverSink implements Consumer<PhaseEvent> {
        private final List<PhaseEvent> carried;
        private final Consumer<PhaseEvent> downstream;
        private int next;

        CarryOverSink(List<PhaseEvent> carried, Consumer<PhaseEvent> downstream) {
            this.carried = carried;
            this.downstream = downstream;
        }

        @Override
        public void accept(PhaseEvent phaseEvent) {
            if (phaseEvent.event() instanceof PlanZoneEvent || phaseEvent.event() instanceof LiquidityExtremeEvent) {
                return;
            }
            downstream.accept(phaseEvent);
            if (phaseEvent.event() instanceof CandleEvent) {
                long ts = phaseEvent.event().timestamp();
                while (next < carried.size() && carried.get(next).timestamp() <= ts) {
                    downstream.accept(carried.get(next++));
                }
            }
        }
    }
}
