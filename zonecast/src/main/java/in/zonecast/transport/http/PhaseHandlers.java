package in.zonecast.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.zonecast.domain.common.Phase;
import in.zonecast.service.core.CoreService;
import in.zonecast.service.pipeline.StreamTask;
import in.zonecast.service.report.OrderReport;
import in.zonecast.service.report.ReportService;
import in.zonecast.service.zone.MarketCalendar;
import in.zonecast.transport.ws.EventJsonCodec;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Deque;
import java.util.List;

/**
 * HTTP control surface: phase start/stop, stored events, reports and the market calendar.
 */
public final class PhaseHandlers {
    private static final Logger log = LoggerFactory.getLogger(PhaseHandlers.class);
    private static final ObjectMapper MAPPER = EventJsonCodec.mapper();

    private static final int DEFAULT_PLANNING_DAYS = 2;

    private final CoreService coreService;
    private final ReportService reportService;

    public PhaseHandlers(CoreService coreService, ReportService reportService) {
        this.coreService = coreService;
        this.reportService = reportService;
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        try {
            ObjectNode response = MAPPER.createObjectNode();
            response.put("status", "UP");
            ObjectNode phases = response.putObject("phases");
            for (Phase phase : Phase.values()) {
                phases.put(phase.wireName(), coreService.task(phase)
                    .map(task -> task.getStatus().name())
                    .orElse("IDLE"));
            }
            sendJson(exchange, response);
        } catch (Exception e) {
            log.error("Failed to build health response: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Health check failed: " + e.getMessage());
        }
    }

    /**
     * PUT /api/phase/start with {"phase":"planning|preparing|trading","tradingDate":"YYYY-MM-DD","days":N}
     */
    public void startPhase(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                PhaseRequest request = PhaseRequest.parse(MAPPER.readTree(body));
                StreamTask task = switch (request.phase()) {
                    case PLANNING -> coreService.startPlanning(request.tradingDate(), request.days());
                    case PREPARING -> coreService.startPreparing(request.tradingDate());
                    case TRADING -> coreService.startTrading(request.tradingDate());
                };

                ObjectNode response = MAPPER.createObjectNode();
                response.put("success", true);
                response.put("phase", request.phase().wireName());
                response.put("tradingDate", request.tradingDate().toString());
                response.put("task", task.getName());
                sendJson(ex, response);
            } catch (IllegalArgumentException | DateTimeParseException e) {
                sendError(ex, StatusCodes.BAD_REQUEST, e.getMessage());
            } catch (Exception e) {
                log.error("Failed to start phase: {}", e.getMessage(), e);
                sendError(ex, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to start phase: " + e.getMessage());
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * PUT /api/phase/stop with an optional {"phase":..}; stops every phase when absent.
     */
    public void stopPhase(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                JsonNode json = body == null || body.isBlank() ? MAPPER.createObjectNode() : MAPPER.readTree(body);
                ObjectNode response = MAPPER.createObjectNode();
                if (json.hasNonNull("phase")) {
                    Phase phase = Phase.fromWire(json.get("phase").asText());
                    response.put("stopped", coreService.stop(phase));
                } else {
                    coreService.stopAll();
                    response.put("stopped", true);
                }
                response.put("success", true);
                sendJson(ex, response);
            } catch (IllegalArgumentException e) {
                sendError(ex, StatusCodes.BAD_REQUEST, e.getMessage());
            } catch (Exception e) {
                log.error("Failed to stop phase: {}", e.getMessage(), e);
                sendError(ex, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to stop phase: " + e.getMessage());
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * GET /api/phase/events?tradingDate=&phase=
     */
    public void events(HttpServerExchange exchange) {
        try {
            LocalDate date = LocalDate.parse(requireParam(exchange, "tradingDate"));
            Phase phase = Phase.fromWire(requireParam(exchange, "phase"));

            List<String> events = coreService.events(date, phase);
            ObjectNode response = MAPPER.createObjectNode();
            response.put("tradingDate", date.toString());
            response.put("phase", phase.wireName());
            response.put("complete", coreService.isComplete(date, phase));
            ArrayNode array = response.putArray("events");
            for (String json : events) {
                array.add(MAPPER.readTree(json));
            }
            sendJson(exchange, response);
        } catch (IllegalArgumentException | DateTimeParseException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            log.error("Failed to load events: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to load events: " + e.getMessage());
        }
    }

    /**
     * GET /api/report?tradingDate=
     */
    public void report(HttpServerExchange exchange) {
        try {
            LocalDate date = LocalDate.parse(requireParam(exchange, "tradingDate"));
            OrderReport report = reportService.report(date);
            sendJson(exchange, report);
        } catch (IllegalArgumentException | DateTimeParseException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            log.error("Failed to build report: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to build report: " + e.getMessage());
        }
    }

    /**
     * GET /api/calendar/isTradingDay?date=
     */
    public void isTradingDay(HttpServerExchange exchange) {
        try {
            LocalDate date = LocalDate.parse(requireParam(exchange, "date"));
            ObjectNode response = MAPPER.createObjectNode();
            response.put("date", date.toString());
            response.put("isTradingDay", MarketCalendar.isTradingDay(date));
            response.put("isHoliday", MarketCalendar.isMarketHoliday(date));
            response.put("isEarlyClose", MarketCalendar.isEarlyCloseDay(date));
            sendJson(exchange, response);
        } catch (IllegalArgumentException | DateTimeParseException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            log.error("Calendar lookup failed: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Calendar lookup failed: " + e.getMessage());
        }
    }

    /**
     * Parsed body of a phase start request.
     */
    record PhaseRequest(Phase phase, LocalDate tradingDate, int days) {

        static PhaseRequest parse(JsonNode json) {
            if (json == null || !json.hasNonNull("phase")) {
                throw new IllegalArgumentException("Missing 'phase'");
            }
            if (!json.hasNonNull("tradingDate")) {
                throw new IllegalArgumentException("Missing 'tradingDate'");
            }
            Phase phase = Phase.fromWire(json.get("phase").asText());
            LocalDate date = LocalDate.parse(json.get("tradingDate").asText());
            int days = json.hasNonNull("days") ? json.get("days").asInt() : DEFAULT_PLANNING_DAYS;
            if (days < 1) {
                throw new IllegalArgumentException("'days' must be a positive integer");
            }
            return new PhaseRequest(phase, date, days);
        }
    }

    private static String requireParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty() || values.getFirst().isBlank()) {
            throw new IllegalArgumentException("Missing query parameter '" + name + "'");
        }
        return values.getFirst();
    }

    private void sendJson(HttpServerExchange exchange, Object data) throws Exception {
        String json = MAPPER.writeValueAsString(data);
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message == null ? "" : message, StandardCharsets.UTF_8);
    }
}
