package in.zonecast.transport.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.zonecast.domain.event.Event;
import in.zonecast.domain.event.LiquidityExtremeEvent;
import in.zonecast.domain.event.PhaseEvent;
import in.zonecast.domain.event.PlanZoneEvent;

import java.io.UncheckedIOException;

/**
 * Wire format of server messages. Three shapes, told apart by {@code type}:
 * <pre>
 * {"type":"event","eventType":"Candle","timestamp":..,"phase":"planning","candle":{..}}
 * {"type":"lifecycle","phase":"trading","status":"started","timestamp":..}
 * {"type":"error","message":"..","timestamp":..}
 * </pre>
 * Zone and extreme events also carry {@code change} (CREATED, UPDATED, CLOSED).
 */
public final class EventJsonCodec {

    private static final ObjectMapper MAPPER = createMapper();

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String encode(PhaseEvent phaseEvent) {
        Event event = phaseEvent.event();
        ObjectNode root = MAPPER.createObjectNode();
        root.put("type", "event");
        root.put("eventType", event.eventType().wireName());
        root.put("timestamp", event.timestamp());
        root.put("phase", phaseEvent.phase().wireName());
        root.set(event.eventType().payloadField(), MAPPER.valueToTree(event.payload()));

        if (event instanceof PlanZoneEvent) {
            root.put("change", ((PlanZoneEvent) event).change().name());
        } else if (event instanceof LiquidityExtremeEvent) {
            root.put("change", ((LiquidityExtremeEvent) event).change().name());
        }
        return write(root);
    }

    public static String lifecycle(String phase, String status, long timestamp) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("type", "lifecycle");
        root.put("phase", phase);
        root.put("status", status);
        root.put("timestamp", timestamp);
        return write(root);
    }

    public static String error(String message, long timestamp) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("type", "error");
        root.put("message", message);
        root.put("timestamp", timestamp);
        return write(root);
    }

    private static String write(ObjectNode root) {
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize message", e);
        }
    }

    private static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    private EventJsonCodec() {}
}
