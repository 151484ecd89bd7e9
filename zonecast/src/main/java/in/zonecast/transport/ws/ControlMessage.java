package in.zonecast.transport.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Commands a subscriber may send.
 */
public interface ControlMessage {

    int DEFAULT_PLAN_DAYS = 2;

    record Ready() implements ControlMessage {}

    record Plan(LocalDate date, int days) implements ControlMessage {
        public Plan {
            if (days < 1) {
                throw new IllegalArgumentException("days must be at least 1: " + days);
            }
        }
    }

    record Trade() implements ControlMessage {}

    record Speed(double speed) implements ControlMessage {}

    /**
     * Accepts plain {@code READY} or a JSON object with a {@code cmd} field.
     *
     * @throws ControlMessageException when the text is malformed or the command unknown
     */
    static ControlMessage parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ControlMessageException("Empty control message", raw);
        }
        String text = raw.trim();
        if ("READY".equalsIgnoreCase(text)) {
            return new Ready();
        }

        JsonNode node;
        try {
            node = EventJsonCodec.mapper().readTree(text);
        } catch (JsonProcessingException e) {
            throw new ControlMessageException("Invalid JSON: " + e.getOriginalMessage(), raw, e);
        }
        if (node == null || !node.isObject() || !node.path("cmd").isTextual()) {
            throw new ControlMessageException("Missing 'cmd'", raw);
        }

        String cmd = node.get("cmd").asText().toUpperCase(Locale.ROOT);
        switch (cmd) {
            case "READY":
                return new Ready();
            case "TRADE":
                return new Trade();
            case "PLAN":
                return parsePlan(node, raw);
            case "SPEED":
                if (!node.path("speed").isNumber()) {
                    throw new ControlMessageException("SPEED needs a numeric 'speed'", raw);
                }
                return new Speed(node.get("speed").asDouble());
            default:
                throw new ControlMessageException("Unknown command: " + cmd, raw);
        }
    }

    private static Plan parsePlan(JsonNode node, String raw) {
        if (!node.path("date").isTextual()) {
            throw new ControlMessageException("PLAN needs 'date' as YYYY-MM-DD", raw);
        }
        LocalDate date;
        try {
            date = LocalDate.parse(node.get("date").asText());
        } catch (DateTimeParseException e) {
            throw new ControlMessageException("Invalid date: " + node.get("date").asText(), raw, e);
        }
        JsonNode days = node.path("days");
        if (days.isMissingNode() || days.isNull()) {
            return new Plan(date, DEFAULT_PLAN_DAYS);
        }
        if (!days.canConvertToInt() || days.asInt() < 1) {
            throw new ControlMessageException("'days' must be a positive integer", raw);
        }
        return new Plan(date, days.asInt());
    }
}
