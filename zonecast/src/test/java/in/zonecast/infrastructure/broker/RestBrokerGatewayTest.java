package in.zonecast.infrastructure.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.zonecast.domain.order.Order;
import in.zonecast.domain.order.OrderStatus;
import in.zonecast.domain.order.OrderType;
import in.zonecast.domain.regime.MarketRegime;
import in.zonecast.infrastructure.broker.metrics.BrokerMetrics;
import in.zonecast.service.execution.BrokerOrder;
import in.zonecast.service.execution.BrokerOrderStatus;
import in.zonecast.service.execution.OrderLifecycle;
import in.zonecast.service.state.StreamState;
import in.zonecast.support.TestCandles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Flow;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RestBrokerGatewayTest {

    private static final BrokerConfig CONFIG = new BrokerConfig("https://broker.test/v1", "token-1", 7L, "DEMO7");
    private static final long CREATED = TestCandles.at(LocalTime.of(12, 59));

    @Mock
    private HttpClient httpClient;
    @Mock
    private BrokerMetrics metrics;
    @Mock
    private HttpResponse<String> tooManyRequests;
    @Mock
    private HttpResponse<String> ok;

    private final List<Duration> sleeps = new ArrayList<>();
    private RestBrokerGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new RestBrokerGateway(httpClient, CONFIG, RetryPolicy.forBroker(), sleeps::add, metrics);
    }

    private static Order order() {
        return Order.planned("ORD-1", OrderType.SHORT, 5000.0, 5010.0, 4975.0, "Adaptive-Breakout-Score85-89",
            1.0, 2.5, MarketRegime.BREAKOUT, 86, "MES", 3, CREATED);
    }

    @Test
    @DisplayName("Four 429s then success: backoff 1s, 2s, 4s, 8s and the order ends PLACED")
    void placeBracketOrder_retriesRateLimitThenPlaces() throws Exception {
        // Arrange
        when(tooManyRequests.statusCode()).thenReturn(429);
        when(ok.statusCode()).thenReturn(200);
        when(ok.body()).thenReturn("{\"orderId\": 9001, \"oso1Id\": 9002, \"oso2Id\": 9003}");
        doReturn(tooManyRequests, tooManyRequests, tooManyRequests, tooManyRequests, ok)
            .when(httpClient).send(any(HttpRequest.class), any());

        StreamState state = new StreamState(TestCandles.TRADING_DAY);
        state.applyOrder(order());
        OrderLifecycle lifecycle = new OrderLifecycle(gateway, Runnable::run);

        // Act
        lifecycle.submit(order(), CREATED);
        Order placed = lifecycle.drain(state).get(0);

        // Assert
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8)),
            sleeps);
        verify(httpClient, times(5)).send(any(HttpRequest.class), any());
        verify(metrics, times(4)).recordRateLimitHit("REST");
        verify(metrics).recordOrderSuccess(eq("REST"), any(Duration.class));
        assertEquals(OrderStatus.PLACED, placed.status());
        assertEquals("9001", placed.brokerOrderId());
    }

    @Test
    @DisplayName("Bracket request carries entry, take-profit limit and stop-loss stop")
    void placeBracketOrder_sendsBracketPayload() throws Exception {
        when(ok.statusCode()).thenReturn(200);
        when(ok.body()).thenReturn("{\"orderId\": 1}");
        doReturn(ok).when(httpClient).send(any(HttpRequest.class), any());

        gateway.placeBracketOrder(order());

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        HttpRequest request = captor.getValue();
        assertEquals("https://broker.test/v1/order/placeoso", request.uri().toString());
        assertEquals("Bearer token-1", request.headers().firstValue("Authorization").orElseThrow());

        JsonNode payload = new ObjectMapper().readTree(bodyOf(request));
        assertEquals("Sell", payload.get("action").asText());
        assertEquals("MES", payload.get("symbol").asText());
        assertEquals(3, payload.get("orderQty").asInt());
        assertEquals(5000.0, payload.get("price").asDouble());
        assertEquals("Buy", payload.get("bracket1").get("action").asText());
        assertEquals("Limit", payload.get("bracket1").get("orderType").asText());
        assertEquals(4975.0, payload.get("bracket1").get("price").asDouble());
        assertEquals("Stop", payload.get("bracket2").get("orderType").asText());
        assertEquals(5010.0, payload.get("bracket2").get("stopPrice").asDouble());
    }

    @Test
    void placeBracketOrder_badRequestIsNotRetried() throws Exception {
        when(ok.statusCode()).thenReturn(400);
        when(ok.body()).thenReturn("Invalid symbol");
        doReturn(ok).when(httpClient).send(any(HttpRequest.class), any());

        BrokerRequestException e = assertThrows(BrokerRequestException.class, () -> gateway.placeBracketOrder(order()));

        assertEquals(400, e.getStatusCode());
        assertTrue(sleeps.isEmpty());
        verify(httpClient, times(1)).send(any(HttpRequest.class), any());
        verify(metrics).recordOrderFailure(eq("REST"), eq("REJECTED"), any(Duration.class));
    }

    @Test
    @DisplayName("Five transient failures exhaust the policy")
    void placeBracketOrder_exhaustsRetries() throws Exception {
        when(tooManyRequests.statusCode()).thenReturn(503);
        doReturn(tooManyRequests).when(httpClient).send(any(HttpRequest.class), any());

        BrokerUnavailableException e = assertThrows(BrokerUnavailableException.class,
            () -> gateway.placeBracketOrder(order()));

        assertEquals(5, e.getAttempts());
        assertEquals(4, sleeps.size());
        verify(metrics, times(4)).recordRetry(eq("REST"), anyInt(), anyString());
        verify(metrics, never()).recordRateLimitHit(anyString());
    }

    @Test
    @DisplayName("A refused connection never reached the broker, so placement retries it")
    void placeBracketOrder_connectErrorsAreRetried() throws Exception {
        when(ok.statusCode()).thenReturn(200);
        when(ok.body()).thenReturn("{\"orderId\": 5}");
        doThrow(new ConnectException("connection refused")).doReturn(ok)
            .when(httpClient).send(any(HttpRequest.class), any());

        assertEquals("5", gateway.placeBracketOrder(order()));
        assertEquals(List.of(Duration.ofSeconds(1)), sleeps);
    }

    @Test
    @DisplayName("A read timeout after the bracket was sent is not replayed")
    void placeBracketOrder_timeoutAfterSendIsNotRetried() throws Exception {
        // Arrange
        doThrow(new HttpTimeoutException("request timed out"))
            .when(httpClient).send(any(HttpRequest.class), any());

        // Act
        BrokerUnavailableException e = assertThrows(BrokerUnavailableException.class,
            () -> gateway.placeBracketOrder(order()));

        // Assert
        assertEquals(1, e.getAttempts());
        assertTrue(sleeps.isEmpty());
        verify(httpClient, times(1)).send(any(HttpRequest.class), any());
        verify(metrics, never()).recordRetry(anyString(), anyInt(), anyString());
        verify(metrics).recordOrderFailure(eq("REST"), eq("UNAVAILABLE"), any(Duration.class));
    }

    @Test
    void placeBracketOrder_connectionResetIsNotRetried() throws Exception {
        doThrow(new IOException("connection reset"))
            .when(httpClient).send(any(HttpRequest.class), any());

        assertThrows(BrokerUnavailableException.class, () -> gateway.placeBracketOrder(order()));
        verify(httpClient, times(1)).send(any(HttpRequest.class), any());
    }

    @Test
    @DisplayName("Reads retry any I/O error")
    void listPositions_ioErrorsAreRetried() throws Exception {
        when(ok.statusCode()).thenReturn(200);
        when(ok.body()).thenReturn("[]");
        doThrow(new HttpTimeoutException("request timed out")).doReturn(ok)
            .when(httpClient).send(any(HttpRequest.class), any());

        assertTrue(gateway.listPositions().isEmpty());
        assertEquals(List.of(Duration.ofSeconds(1)), sleeps);
        verify(httpClient, times(2)).send(any(HttpRequest.class), any());
    }

    @Test
    void placeBracketOrder_failureReasonThrows() throws Exception {
        when(ok.statusCode()).thenReturn(200);
        when(ok.body()).thenReturn("{\"failureReason\": \"AccountClosed\", \"failureText\": \"closed\"}");
        doReturn(ok).when(httpClient).send(any(HttpRequest.class), any());

        assertThrows(OrderPlacementException.class, () -> gateway.placeBracketOrder(order()));
    }

    @Test
    @DisplayName("Order list resolves contract names once and maps broker statuses")
    void listOrders_mapsStatusesAndCachesContracts() throws Exception {
        @SuppressWarnings("unchecked")
        HttpResponse<String> contract = mock(HttpResponse.class);
        when(ok.statusCode()).thenReturn(200);
        when(ok.body()).thenReturn("[{\"id\": 11, \"contractId\": 3, \"action\": \"Buy\", \"ordStatus\": \"Working\","
            + " \"timestamp\": \"2024-03-05T18:00:00Z\"},"
            + " {\"id\": 12, \"contractId\": 3, \"action\": \"Sell\", \"ordStatus\": \"Canceled\"}]");
        when(contract.statusCode()).thenReturn(200);
        when(contract.body()).thenReturn("{\"id\": 3, \"name\": \"MESH4\"}");
        doReturn(ok, contract).when(httpClient).send(any(HttpRequest.class), any());

        List<BrokerOrder> orders = gateway.listOrders();

        assertEquals(2, orders.size());
        assertEquals("MESH4", orders.get(0).contract());
        assertEquals(BrokerOrderStatus.WORKING, orders.get(0).status());
        assertEquals(BrokerOrderStatus.CANCELLED, orders.get(1).status());
        assertEquals(Instant.parse("2024-03-05T18:00:00Z").toEpochMilli(), orders.get(0).timestamp());
        verify(httpClient, times(2)).send(any(HttpRequest.class), any());
    }

    private static String bodyOf(HttpRequest request) {
        StringBuilder body = new StringBuilder();
        request.bodyPublisher().orElseThrow().subscribe(new Flow.Subscriber<ByteBuffer>() {
            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                subscription.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(ByteBuffer item) {
                byte[] bytes = new byte[item.remaining()];
                item.get(bytes);
                body.append(new String(bytes, StandardCharsets.UTF_8));
            }

            @Override
            public void onError(Throwable throwable) {
                fail(throwable);
            }

            @Override
            public void onComplete() {
            }
        });
        return body.toString();
    }
}
