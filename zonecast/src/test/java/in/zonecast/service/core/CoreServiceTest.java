package in.zonecast.service.core;

import com.fasterxml.jackson.databind.JsonNode;
import in.zonecast.domain.common.Phase;
import in.zonecast.domain.event.CandleEvent;
import in.zonecast.domain.event.PhaseEvent;
import in.zonecast.domain.event.PlanZoneEvent;
import in.zonecast.domain.zone.PlanZone;
import in.zonecast.domain.zone.PlanZoneKind;
import in.zonecast.domain.zone.ZoneChange;
import in.zonecast.infrastructure.metrics.PipelineMetrics;
import in.zonecast.infrastructure.persistence.InMemoryCandleSource;
import in.zonecast.infrastructure.persistence.InMemoryEventStore;
import in.zonecast.service.decision.DecisionConfig;
import in.zonecast.service.execution.OrderLifecycle;
import in.zonecast.service.execution.SimulatedBrokerGateway;
import in.zonecast.service.pipeline.StreamMode;
import in.zonecast.service.pipeline.StreamStatus;
import in.zonecast.service.pipeline.StreamTask;
import in.zonecast.service.state.StreamSnapshot;
import in.zonecast.service.zone.SessionClock;
import in.zonecast.support.TestCandles;
import in.zonecast.transport.ws.EventDistributor;
import in.zonecast.transport.ws.EventJsonCodec;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CoreServiceTest {

    private static final LocalDate DAY = TestCandles.TRADING_DAY;
    private static final LocalDate MONDAY = LocalDate.of(2024, 3, 4);
    private static final long LONDON_OPEN = SessionClock.at(MONDAY, LocalTime.of(3, 0));

    @Mock
    private EventDistributor distributor;

    private InMemoryCandleSource source;
    private InMemoryEventStore store;
    private ExecutorService executor;
    private CoreService core;

    @BeforeEach
    void setUp() {
        source = new InMemoryCandleSource(TestCandles.walk(LONDON_OPEN, 120, 17L));
        store = new InMemoryEventStore();
        executor = Executors.newSingleThreadExecutor();
        Clock clock = Clock.fixed(Instant.ofEpochMilli(SessionClock.at(DAY, LocalTime.of(8, 0))), ZoneOffset.UTC);
        core = new CoreService(source, store, distributor, new PipelineMetrics(new CollectorRegistry()),
            DecisionConfig.defaults(), new OrderLifecycle(new SimulatedBrokerGateway(), Runnable::run),
            executor, 500, clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    /**
     * Waits for the task and for the completion callbacks that run on the stream thread.
     */
    private StreamStatus finish(StreamTask task) throws Exception {
        StreamStatus status = task.completion().get(10, TimeUnit.SECONDS);
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        return status;
    }

    private static List<JsonNode> parse(List<String> events) throws Exception {
        List<JsonNode> nodes = new ArrayList<>();
        for (String json : events) {
            nodes.add(EventJsonCodec.mapper().readTree(json));
        }
        return nodes;
    }

    @Test
    @DisplayName("Planning replays the prior trading days, stores every event and marks completion")
    void startPlanning_replaysAndCompletes() throws Exception {
        // Act
        StreamTask task = core.startPlanning(DAY, 2);
        StreamStatus status = finish(task);

        // Assert
        assertEquals(StreamStatus.COMPLETED, status);
        assertTrue(core.isComplete(DAY, Phase.PLANNING));
        assertEquals(DAY, core.runningDate(Phase.PLANNING).orElseThrow());

        List<JsonNode> events = parse(core.events(DAY, Phase.PLANNING));
        assertEquals(120, events.stream().filter(e -> "Candle".equals(e.get("eventType").asText())).count());
        assertTrue(events.stream().allMatch(e -> "planning".equals(e.get("phase").asText())));

        ArgumentCaptor<String> published = ArgumentCaptor.forClass(String.class);
        verify(distributor, atLeast(events.size() + 2)).publish(published.capture());
        JsonNode first = EventJsonCodec.mapper().readTree(published.getAllValues().get(0));
        JsonNode last = EventJsonCodec.mapper().readTree(published.getValue());
        assertEquals("started", first.get("status").asText());
        assertEquals("completed", last.get("status").asText());
    }

    @Test
    void startPlanning_rejectsNonPositiveDays() {
        assertThrows(IllegalArgumentException.class, () -> core.startPlanning(DAY, 0));
        verifyNoInteractions(distributor);
    }

    @Test
    @DisplayName("Preparing re-announces the zones and extremes planning left open")
    void startPreparing_carriesOpenZones() throws Exception {
        // Arrange
        StreamTask planning = core.startPlanning(DAY, 2);
        planning.completion().get(10, TimeUnit.SECONDS);
        StreamSnapshot planned = planning.getPipeline().getState().latest();

        // Act
        StreamTask preparing = core.startPreparing(DAY);
        StreamStatus status = finish(preparing);

        // Assert
        assertEquals(StreamStatus.COMPLETED, status);
        assertEquals(2, planned.activeExtremes().size(), "London extremes should still be open");
        List<JsonNode> events = parse(core.events(DAY, Phase.PREPARING));
        List<JsonNode> extremes = new ArrayList<>();
        List<JsonNode> zones = new ArrayList<>();
        for (JsonNode e : events) {
            String type = e.get("eventType").asText();
            if ("LiquidityExtreme".equals(type)) extremes.add(e);
            if ("PlanZone".equals(type)) zones.add(e);
        }
        assertEquals(planned.activeExtremes().size(), extremes.size());
        assertTrue(zones.size() <= planned.activePlanZones().size());
        assertTrue(extremes.stream().allMatch(e -> "CREATED".equals(e.get("change").asText())));
        assertTrue(zones.stream().allMatch(e -> "CREATED".equals(e.get("change").asText())));
        assertTrue(events.stream().allMatch(e -> "preparing".equals(e.get("phase").asText())));
        assertEquals("Candle", events.get(0).get("eventType").asText());
        assertFalse(preparing.getPipeline().isTradingEnabled());
    }

    @Test
    @DisplayName("Trading without warm-up starts cold, goes live and stops on request")
    void startTrading_coldStartAndStop() throws Exception {
        // Act
        StreamTask trading = core.startTrading(DAY);
        boolean stopped = core.stop(Phase.TRADING);
        StreamStatus status = finish(trading);

        // Assert
        assertTrue(stopped);
        assertEquals(StreamStatus.CANCELLED, status);
        assertEquals(StreamMode.LIVE, trading.getPipeline().getMode());
        assertTrue(trading.getPipeline().isTradingEnabled());
        assertFalse(core.isComplete(DAY, Phase.TRADING));
        assertFalse(core.stop(Phase.TRADING));
    }

    @Test
    void stop_withoutRunningTask() {
        assertFalse(core.stop(Phase.PLANNING));
        assertTrue(core.task(Phase.PLANNING).isEmpty());
    }

    @Test
    @DisplayName("Carried events are released after the first candle at or past their start")
    void carryOverSink_releasesAfterCandle() {
        long start = TestCandles.at(LocalTime.of(6, 0));
        PhaseEvent carried = new PhaseEvent(Phase.PREPARING, new PlanZoneEvent(
            PlanZone.open(PlanZoneKind.SUPPLY, 5000.0, 5010.0, start), ZoneChange.CREATED, start));
        List<PhaseEvent> out = new ArrayList<>();
        CoreService.CarryOverSink sink = new CoreService.CarryOverSink(List.of(carried), out::add);

        PhaseEvent before = new PhaseEvent(Phase.PREPARING, new CandleEvent(TestCandles.candle(start - 300_000L, 5000.0)));
        PhaseEvent replayZone = new PhaseEvent(Phase.PREPARING, new PlanZoneEvent(
            PlanZone.open(PlanZoneKind.DEMAND, 4990.0, 4995.0, start), ZoneChange.CREATED, start));
        PhaseEvent at = new PhaseEvent(Phase.PREPARING, new CandleEvent(TestCandles.candle(start, 5001.0)));

        sink.accept(before);
        sink.accept(replayZone);
        sink.accept(at);

        assertEquals(List.of(before, at, carried), out);
    }
}
