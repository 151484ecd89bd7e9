package in.zonecast.service.execution;

import in.zonecast.domain.order.CancelReason;
import in.zonecast.domain.order.IllegalOrderTransitionException;
import in.zonecast.domain.order.Order;
import in.zonecast.domain.order.OrderStatus;
import in.zonecast.domain.order.OrderType;
import in.zonecast.domain.regime.MarketRegime;
import in.zonecast.infrastructure.broker.BrokerRequestException;
import in.zonecast.infrastructure.broker.BrokerUnavailableException;
import in.zonecast.service.state.StreamState;
import in.zonecast.support.TestCandles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class OrderLifecycleTest {

    private static final long CREATED = TestCandles.at(LocalTime.of(12, 59));
    private static final long T1 = TestCandles.at(LocalTime.of(13, 0));
    private static final long T2 = TestCandles.at(LocalTime.of(13, 1));

    private static Order longOrder() {
        return Order.planned("ORD-" + CREATED, OrderType.LONG, 5000.0, 4990.0, 5025.0,
            "Adaptive-TrendRiding-Score80-84", 1.0, 2.5, MarketRegime.TRENDING_LOW, 82, "MES", 2, CREATED);
    }

    private static StreamState stateWith(Order order) {
        StreamState state = new StreamState(TestCandles.TRADING_DAY);
        state.applyOrder(order);
        return state;
    }

    @Nested
    @DisplayName("With simulated fills")
    class Simulated {

        private OrderLifecycle lifecycle;

        @BeforeEach
        void setUp() {
            lifecycle = new OrderLifecycle(new SimulatedBrokerGateway(), Runnable::run);
        }

        private Order placed(StreamState state) {
            lifecycle.submit(longOrder(), CREATED);
            return lifecycle.drain(state).get(0);
        }

        @Test
        void testSubmitPlacesOrder() {
            // Arrange
            StreamState state = stateWith(longOrder());

            // Act
            Order placed = placed(state);

            // Assert
            assertEquals(OrderStatus.PLACED, placed.status());
            assertEquals("SIM-1", placed.brokerOrderId());
            assertEquals(CREATED, placed.placedTimestamp());
            assertEquals(placed, state.order(placed.id()).orElseThrow());
        }

        @Test
        void testSubmitRejectsNonPlanned() {
            Order order = longOrder().placed(CREATED, "SIM-9");

            assertThrows(IllegalArgumentException.class, () -> lifecycle.submit(order, CREATED));
        }

        @Test
        @DisplayName("Entry touch fills, target touch closes in profit at the target")
        void testFillThenProfit() {
            StreamState state = stateWith(longOrder());
            placed(state);

            List<Order> filled = lifecycle.onCandle(state, TestCandles.candle(T1, 5000.0));
            List<Order> closed = lifecycle.onCandle(state, TestCandles.candle(T2, 5020.0, 5026.0, 5019.0, 5024.0));

            assertEquals(OrderStatus.FILLED, filled.get(0).status());
            assertEquals(T1, filled.get(0).filledTimestamp());
            assertEquals(OrderStatus.PROFIT, closed.get(0).status());
            assertEquals(5025.0, closed.get(0).exitPrice());
            assertEquals(2.5, closed.get(0).realizedR(), 1e-9);
            assertTrue(state.activeOrders().isEmpty());
        }

        @Test
        @DisplayName("A candle touching both stop and target closes as a loss")
        void testStopWinsOverTarget() {
            StreamState state = stateWith(longOrder());
            placed(state);
            lifecycle.onCandle(state, TestCandles.candle(T1, 5000.0));

            List<Order> closed = lifecycle.onCandle(state, TestCandles.candle(T2, 5000.0, 5030.0, 4985.0, 5010.0));

            assertEquals(OrderStatus.LOSS, closed.get(0).status());
            assertEquals(4990.0, closed.get(0).exitPrice());
            assertEquals(-1.0, closed.get(0).realizedR(), 1e-9);
        }

        @Test
        void testFullCandleBeyondTargetCancels() {
            StreamState state = stateWith(longOrder());
            placed(state);

            List<Order> changed = lifecycle.onCandle(state, TestCandles.candle(T1, 5030.0));

            assertEquals(OrderStatus.CANCELLED, changed.get(0).status());
            assertEquals(CancelReason.FULL_CANDLE_OUTSIDE, changed.get(0).cancelReason());
        }

        @Test
        @DisplayName("Near the close open orders cancel and filled orders exit at the close")
        void testEndOfDay() {
            long nearClose = TestCandles.at(LocalTime.of(15, 50));
            StreamState placedState = stateWith(longOrder());
            placed(placedState);

            Order filled = longOrder().placed(CREATED, "SIM-2").filled(T1);
            StreamState filledState = stateWith(filled);

            Order cancelled = lifecycle.onCandle(placedState, TestCandles.candle(nearClose, 5010.0)).get(0);
            Order exited = lifecycle.onCandle(filledState, TestCandles.candle(nearClose, 4995.0)).get(0);

            assertEquals(OrderStatus.CANCELLED, cancelled.status());
            assertEquals(CancelReason.END_OF_DAY, cancelled.cancelReason());
            assertEquals(OrderStatus.LOSS, exited.status());
            assertEquals(4995.0, exited.exitPrice());
        }

        @Test
        void testManualCancel() {
            StreamState state = stateWith(longOrder());

            Order cancelled = lifecycle.cancel(state, longOrder().id(), T1, CancelReason.MANUAL).orElseThrow();

            assertEquals(OrderStatus.CANCELLED, cancelled.status());
            assertTrue(lifecycle.cancel(state, longOrder().id(), T2, CancelReason.MANUAL).isEmpty());
            assertTrue(lifecycle.cancel(state, "ORD-missing", T2, CancelReason.MANUAL).isEmpty());
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Against a reporting broker")
    class Reporting {

        @Mock
        private BrokerGateway gateway;

        private OrderLifecycle lifecycle;

        @BeforeEach
        void setUp() {
            lifecycle = new OrderLifecycle(gateway, Runnable::run);
        }

        @Test
        @DisplayName("A definitive refusal cancels the order with the broker's reason")
        void testRejectedCancels() {
            StreamState state = stateWith(longOrder());
            when(gateway.placeBracketOrder(any())).thenThrow(new BrokerRequestException("/order/placeoso", 400, "bad qty"));

            lifecycle.submit(longOrder(), CREATED);
            Order order = lifecycle.drain(state).get(0);

            assertEquals(OrderStatus.CANCELLED, order.status());
            assertTrue(order.cancelReason().startsWith(CancelReason.BROKER_REJECTED));
            assertTrue(order.cancelReason().contains("bad qty"));
        }

        @Test
        @DisplayName("Exhausted retries keep the order PLANNED with the failure recorded")
        void testUnavailableStaysPlanned() {
            StreamState state = stateWith(longOrder());
            when(gateway.placeBracketOrder(any())).thenThrow(
                new BrokerUnavailableException("/order/placeoso", 5, "HTTP 503"));

            lifecycle.submit(longOrder(), CREATED);
            Order order = lifecycle.drain(state).get(0);

            assertEquals(OrderStatus.PLANNED, order.status());
            assertTrue(order.cancelReason().contains("HTTP 503"));
            assertTrue(order.isActive());
        }

        @Test
        @DisplayName("A placement landing after a local cancel is cancelled at the broker")
        void testLatePlacementCancelledAtBroker() {
            StreamState state = stateWith(longOrder());
            when(gateway.placeBracketOrder(any())).thenReturn("77");

            lifecycle.submit(longOrder(), CREATED);
            lifecycle.cancel(state, longOrder().id(), T1, CancelReason.MANUAL);
            List<Order> changed = lifecycle.drain(state);

            assertTrue(changed.isEmpty());
            assertEquals(OrderStatus.CANCELLED, state.order(longOrder().id()).orElseThrow().status());
            verify(gateway).cancelOrder("77");
        }

        @Test
        @DisplayName("Reconciliation moves local orders to what the broker reports")
        void testReconcileBrokerWins() {
            // Arrange
            StreamState state = stateWith(longOrder().placed(CREATED, "42"));
            when(gateway.listOrders()).thenReturn(List.of(
                new BrokerOrder("42", "MES", "Buy", BrokerOrderStatus.FILLED, T1)));
            when(gateway.listPositions()).thenReturn(List.of(new BrokerPosition("MES", 0, T2)));
            when(gateway.listFills()).thenReturn(List.of(
                new BrokerFill("F1", "42", "MES", "Buy", 2, 5000.0, T1),
                new BrokerFill("F2", "43", "MES", "Sell", 2, 5025.0, T2)));

            // Act
            lifecycle.requestReconcile(T2);
            List<Order> changed = lifecycle.drain(state);

            // Assert
            assertEquals(1, changed.size());
            Order order = changed.get(0);
            assertEquals(OrderStatus.PROFIT, order.status());
            assertEquals(T1, order.filledTimestamp());
            assertEquals(5025.0, order.exitPrice());
        }

        @Test
        void testReconcileBrokerRejection() {
            StreamState state = stateWith(longOrder().placed(CREATED, "42"));
            BrokerAccountState account = new BrokerAccountState(
                List.of(new BrokerOrder("42", "MES", "Buy", BrokerOrderStatus.REJECTED, T1)), List.of(), List.of(), T2);

            List<Order> changed = lifecycle.reconcile(state, account);

            assertEquals(OrderStatus.CANCELLED, changed.get(0).status());
            assertEquals(CancelReason.BROKER_REJECTED, changed.get(0).cancelReason());
        }

        @Test
        void testCandlesDoNotFillReportedOrders() {
            StreamState state = stateWith(longOrder().placed(CREATED, "42"));

            assertTrue(lifecycle.onCandle(state, TestCandles.candle(T1, 5000.0)).isEmpty());
        }
    }

    @Test
    void testIllegalTransitionsThrow() {
        Order placed = longOrder().placed(CREATED, "SIM-1");
        Order cancelled = placed.cancelled(T1, CancelReason.MANUAL);

        IllegalOrderTransitionException e = assertThrows(IllegalOrderTransitionException.class,
            () -> placed.closed(OrderStatus.PROFIT, T1, 5025.0));
        assertEquals(OrderStatus.PLACED, e.getFrom());
        assertThrows(IllegalOrderTransitionException.class, () -> cancelled.filled(T2));
        assertThrows(IllegalOrderTransitionException.class, () -> placed.filled(T1).placed(T2, "x"));
    }
}
