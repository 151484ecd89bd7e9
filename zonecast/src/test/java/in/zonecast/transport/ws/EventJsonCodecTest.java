package in.zonecast.transport.ws;

import com.fasterxml.jackson.databind.JsonNode;
import in.zonecast.domain.common.Phase;
import in.zonecast.domain.event.CandleEvent;
import in.zonecast.domain.event.PhaseEvent;
import in.zonecast.domain.event.PlanZoneEvent;
import in.zonecast.domain.zone.PlanZone;
import in.zonecast.domain.zone.PlanZoneKind;
import in.zonecast.domain.zone.ZoneChange;
import in.zonecast.support.TestCandles;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

class EventJsonCodecTest {

    private static final long TS = TestCandles.at(LocalTime.of(9, 30));

    private static JsonNode read(String json) throws Exception {
        return EventJsonCodec.mapper().readTree(json);
    }

    @Test
    void testCandleEvent() throws Exception {
        JsonNode node = read(EventJsonCodec.encode(
            new PhaseEvent(Phase.PLANNING, new CandleEvent(TestCandles.candle(TS, 5000.0)))));

        assertEquals("event", node.get("type").asText());
        assertEquals("Candle", node.get("eventType").asText());
        assertEquals("planning", node.get("phase").asText());
        assertEquals(TS, node.get("timestamp").asLong());
        assertEquals(5000.5, node.get("candle").get("high").asDouble());
        assertFalse(node.has("change"));
    }

    @Test
    void testPlanZoneCarriesChange() throws Exception {
        PlanZone zone = PlanZone.open(PlanZoneKind.DEMAND, 4990.0, 4995.0, TS);

        JsonNode node = read(EventJsonCodec.encode(
            new PhaseEvent(Phase.PREPARING, new PlanZoneEvent(zone, ZoneChange.CREATED, TS + 60_000L))));

        assertEquals("PlanZone", node.get("eventType").asText());
        assertEquals("CREATED", node.get("change").asText());
        assertEquals("DEMAND-" + TS, node.get("planZone").get("id").asText());
        assertTrue(node.get("planZone").get("endTimestamp").isNull());
    }

    @Test
    void testLifecycleAndError() throws Exception {
        JsonNode lifecycle = read(EventJsonCodec.lifecycle("trading", "started", TS));
        JsonNode error = read(EventJsonCodec.error("Missing 'cmd'", TS));

        assertEquals("lifecycle", lifecycle.get("type").asText());
        assertEquals("trading", lifecycle.get("phase").asText());
        assertEquals("started", lifecycle.get("status").asText());
        assertEquals("error", error.get("type").asText());
        assertEquals("Missing 'cmd'", error.get("message").asText());
    }
}
