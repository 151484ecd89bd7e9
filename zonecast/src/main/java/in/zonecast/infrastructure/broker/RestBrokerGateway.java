package in.zonecast.infrastructure.broker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.zonecast.domain.order.Order;
import in.zonecast.infrastructure.broker.metrics.BrokerMetrics;
import in.zonecast.service.execution.BrokerFill;
import in.zonecast.service.execution.BrokerGateway;
import in.zonecast.service.execution.BrokerOrder;
import in.zonecast.service.execution.BrokerOrderStatus;
import in.zonecast.service.execution.BrokerPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bracket-order REST client with bearer auth.
 *
 * Endpoints:
 * - POST /order/placeoso (entry + take-profit limit + stop-loss stop)
 * - POST /order/cancelorder
 * - GET /order/list, /position/list, /fill/list
 * - GET /contract/item (contract names, cached)
 *
 * HTTP 429 and 503 are retried per {@link RetryPolicy}; other non-2xx answers throw
 * {@link BrokerRequestException}; exhausted retries throw {@link BrokerUnavailableException}.
 * Reads and cancels also retry I/O errors. Placement retries an I/O error only when the
 * connection was never made, so a bracket is not sent twice after a lost response.
 */
public class RestBrokerGateway implements BrokerGateway {
    private static final Logger log = LoggerFactory.getLogger(RestBrokerGateway.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);
    private static final String NAME = "REST";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final BrokerConfig config;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final BrokerMetrics metrics;

    private final Map<Long, String> contractNames = new ConcurrentHashMap<>();

    public RestBrokerGateway(BrokerConfig config, BrokerMetrics metrics) {
        this(HttpClient.newBuilder().connectTimeout(REQUEST_TIMEOUT).build(),
            config, RetryPolicy.forBroker(), Sleeper.SYSTEM, metrics);
    }

    public RestBrokerGateway(HttpClient httpClient, BrokerConfig config, RetryPolicy retryPolicy,
                             Sleeper sleeper, BrokerMetrics metrics) {
        this.httpClient = httpClient;
        this.config = config;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    @Override
    public String placeBracketOrder(Order order) {
        String exitAction = order.orderType().exitAction();

        ObjectNode takeProfit = objectMapper.createObjectNode();
        takeProfit.put("action", exitAction);
        takeProfit.put("orderType", "Limit");
        takeProfit.put("price", order.takeProfit());

        ObjectNode stopLoss = objectMapper.createObjectNode();
        stopLoss.put("action", exitAction);
        stopLoss.put("orderType", "Stop");
        stopLoss.put("stopPrice", order.stopLoss());

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("accountSpec", config.accountSpec());
        payload.put("accountId", config.accountId());
        payload.put("action", order.orderType().brokerAction());
        payload.put("symbol", order.contract());
        payload.put("orderQty", order.contracts());
        payload.put("orderType", "Limit");
        payload.put("price", order.entryPrice());
        payload.put("isAutomated", true);
        payload.set("bracket1", takeProfit);
        payload.set("bracket2", stopLoss);

        Instant start = Instant.now();
        String body;
        try {
            body = execute("/order/placeoso", post("/order/placeoso", payload), false);
        } catch (BrokerRequestException e) {
            metrics.recordOrderFailure(NAME, "REJECTED", Duration.between(start, Instant.now()));
            throw e;
        } catch (BrokerUnavailableException e) {
            metrics.recordOrderFailure(NAME, "UNAVAILABLE", Duration.between(start, Instant.now()));
            throw e;
        }

        JsonNode response = readTree("/order/placeoso", body);
        String failure = response.path("failureReason").asText("");
        if (!failure.isEmpty() && !"Success".equalsIgnoreCase(failure)) {
            metrics.recordOrderFailure(NAME, "REJECTED", Duration.between(start, Instant.now()));
            throw new OrderPlacementException(order.id(), order.contract(),
                failure + " " + response.path("failureText").asText(""));
        }
        if (!response.hasNonNull("orderId")) {
            metrics.recordOrderFailure(NAME, "INVALID_RESPONSE", Duration.between(start, Instant.now()));
            throw new OrderPlacementException(order.id(), order.contract(), "No orderId in response: " + body);
        }

        String brokerId = response.get("orderId").asText();
        metrics.recordOrderSuccess(NAME, Duration.between(start, Instant.now()));
        log.info("[BROKER] Placed bracket {} as {} (tp={}, sl={})", order.id(), brokerId,
            response.path("oso1Id").asText("-"), response.path("oso2Id").asText("-"));
        return brokerId;
    }

    @Override
    public void cancelOrder(String brokerOrderId) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("orderId", Long.parseLong(brokerOrderId));
        payload.put("isAutomated", true);

        try {
            String body = execute("/order/cancelorder", post("/order/cancelorder", payload), true);
            JsonNode response = readTree("/order/cancelorder", body);
            String failure = response.path("failureReason").asText("");
            boolean success = failure.isEmpty() || "Success".equalsIgnoreCase(failure);
            metrics.recordOrderCancellation(NAME, success);
            if (!success) {
                log.warn("[BROKER] Cancel of {} refused: {} {}", brokerOrderId, failure,
                    response.path("failureText").asText(""));
            }
        } catch (BrokerRequestException | BrokerUnavailableException e) {
            metrics.recordOrderCancellation(NAME, false);
            throw e;
        }
    }

    @Override
    public List<BrokerOrder> listOrders() {
        JsonNode array = getArray("/order/list");
        List<BrokerOrder> orders = new ArrayList<>();
        for (JsonNode node : array) {
            orders.add(new BrokerOrder(
                node.path("id").asText(),
                contractName(node.path("contractId").asLong()),
                node.path("action").asText(),
                BrokerOrderStatus.fromWire(node.path("ordStatus").asText(null)),
                parseTimestamp(node.path("timestamp").asText(null))
            ));
        }
        return orders;
    }

    @Override
    public List<BrokerPosition> listPositions() {
        JsonNode array = getArray("/position/list");
        List<BrokerPosition> positions = new ArrayList<>();
        for (JsonNode node : array) {
            positions.add(new BrokerPosition(
                contractName(node.path("contractId").asLong()),
                node.path("netPos").asInt(),
                parseTimestamp(node.path("timestamp").asText(null))
            ));
        }
        return positions;
    }

    @Override
    public List<BrokerFill> listFills() {
        JsonNode array = getArray("/fill/list");
        List<BrokerFill> fills = new ArrayList<>();
        for (JsonNode node : array) {
            if (!node.path("active").asBoolean(true)) continue;
            fills.add(new BrokerFill(
                node.path("id").asText(),
                node.path("orderId").asText(),
                contractName(node.path("contractId").asLong()),
                node.path("action").asText(),
                node.path("qty").asInt(),
                node.path("price").asDouble(),
                parseTimestamp(node.path("timestamp").asText(null))
            ));
        }
        return fills;
    }

    @Override
    public String name() {
        return NAME;
    }

    private String contractName(long contractId) {
        return contractNames.computeIfAbsent(contractId, id -> {
            String path = "/contract/item?id=" + id;
            JsonNode node = readTree(path, execute(path, get(path), true));
            return node.path("name").asText(String.valueOf(id));
        });
    }

    private JsonNode getArray(String path) {
        JsonNode node = readTree(path, execute(path, get(path), true));
        if (!node.isArray()) {
            throw new BrokerRequestException(path, 200, "Expected a JSON array");
        }
        return node;
    }

    /**
     * Sends with retry. Only 429, 503 and I/O errors are retried.
     *
     * @param replayable false when a request that reached the broker must not be sent again
     */
    private String execute(String path, HttpRequest request, boolean replayable) {
        String lastError = null;
        IOException lastCause = null;

        for (int attempt = 1; ; attempt++) {
            try {
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                int status = response.statusCode();
                if (status >= 200 && status < 300) {
                    return response.body();
                }
                if (status != 429 && status != 503) {
                    log.error("[BROKER] {} HTTP {}: {}", path, status, response.body());
                    throw new BrokerRequestException(path, status, response.body());
                }
                if (status == 429) {
                    metrics.recordRateLimitHit(NAME);
                }
                lastError = "HTTP " + status;
                lastCause = null;
            } catch (IOException e) {
                lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
                lastCause = e;
                if (!replayable && !neverSent(e)) {
                    log.error("[BROKER] {} outcome unknown after attempt {}: {}", path, attempt, lastError);
                    throw new BrokerUnavailableException(path, attempt, lastError, e);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BrokerUnavailableException(path, attempt, "interrupted", e);
            }

            if (!retryPolicy.shouldRetry(attempt)) {
                log.error("[BROKER] {} gave up after {} attempts: {}", path, attempt, lastError);
                throw new BrokerUnavailableException(path, attempt, lastError, lastCause);
            }

            Duration delay = retryPolicy.delayAfter(attempt);
            metrics.recordRetry(NAME, attempt, lastError);
            log.warn("[BROKER] {} attempt {} failed ({}), retrying in {} ms", path, attempt, lastError, delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BrokerUnavailableException(path, attempt, "interrupted during backoff", e);
            }
        }
    }

    private static boolean neverSent(IOException e) {
        return e instanceof ConnectException || e instanceof HttpConnectTimeoutException;
    }

    private HttpRequest post(String path, JsonNode payload) {
        return HttpRequest.newBuilder()
            .uri(URI.create(config.baseUrl() + path))
            .header("Authorization", "Bearer " + config.token())
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .timeout(REQUEST_TIMEOUT)
            .POST(HttpRequest.BodyPublishers.ofString(payload.toString()))
            .build();
    }

    private HttpRequest get(String path) {
        return HttpRequest.newBuilder()
            .uri(URI.create(config.baseUrl() + path))
            .header("Authorization", "Bearer " + config.token())
            .header("Accept", "application/json")
            .timeout(REQUEST_TIMEOUT)
            .GET()
            .build();
    }

    private JsonNode readTree(String path, String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new BrokerRequestException(path, 200, "Unreadable response: " + e.getOriginalMessage());
        }
    }

    private static long parseTimestamp(String text) {
        if (text == null || text.isEmpty()) return 0L;
        try {
            return Instant.parse(text).toEpochMilli();
        } catch (DateTimeParseException e) {
            log.warn("[BROKER] Unparseable timestamp '{}'", text);
            return 0L;
        }
    }
}
