package in.zonecast.service.execution;

import in.zonecast.domain.data.Candle;
import in.zonecast.domain.order.CancelReason;
import in.zonecast.domain.order.Order;
import in.zonecast.domain.order.OrderStatus;
import in.zonecast.infrastructure.broker.BrokerRequestException;
import in.zonecast.infrastructure.broker.BrokerUnavailableException;
import in.zonecast.infrastructure.broker.OrderPlacementException;
import in.zonecast.service.state.StreamState;
import in.zonecast.service.zone.SessionClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;

/**
 * Moves orders through PLANNED, PLACED, FILLED and a terminal status.
 *
 * Broker calls run on the broker executor. Their outcomes are queued and applied by
 * {@link #drain(StreamState)} on the stream thread, which stays the only writer of the state.
 *
 * Candle-driven rules ({@link #onCandle}):
 * 1. Near the close: PLANNED and PLACED cancel with END_OF_DAY, FILLED exits at the close.
 * 2. Simulated fills only: PLACED fills when the candle touches the entry, or cancels when a
 *    whole candle trades beyond the target or the stop first.
 * 3. Simulated fills only: FILLED closes as LOSS when the stop is touched, else PROFIT when
 *    the target is touched. The stop wins when both are touched by one candle.
 */
public class OrderLifecycle {
    private static final Logger log = LoggerFactory.getLogger(OrderLifecycle.class);

    private final BrokerGateway gateway;
    private final Executor brokerExecutor;
    private final Queue<BrokerOutcome> outcomes = new ConcurrentLinkedQueue<>();

    public OrderLifecycle(BrokerGateway gateway, Executor brokerExecutor) {
        this.gateway = gateway;
        this.brokerExecutor = brokerExecutor;
    }

    /**
     * Sends a PLANNED order to the broker. The outcome is queued for {@link #drain}.
     */
    public CompletableFuture<BrokerOutcome> submit(Order order, long timestamp) {
        if (order.status() != OrderStatus.PLANNED) {
            throw new IllegalArgumentException("Only PLANNED orders can be submitted: " + order.id() + " is " + order.status());
        }
        return CompletableFuture.supplyAsync(() -> place(order, timestamp), brokerExecutor)
            .whenComplete((outcome, error) -> {
                if (error != null) {
                    log.error("[LIFECYCLE] Placement task for {} failed: {}", order.id(), error.getMessage(), error);
                    outcomes.add(new BrokerOutcome.Unavailable(order.id(), error.getMessage(), timestamp));
                } else {
                    outcomes.add(outcome);
                }
            });
    }

    /**
     * Fetches broker orders, positions and fills. Skipped for simulated fills.
     */
    public CompletableFuture<Void> requestReconcile(long timestamp) {
        if (gateway.simulatesFills()) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> {
            try {
                BrokerAccountState account = new BrokerAccountState(
                    gateway.listOrders(), gateway.listPositions(), gateway.listFills(), timestamp);
                outcomes.add(new BrokerOutcome.Reconciled(account, timestamp));
            } catch (BrokerRequestException | BrokerUnavailableException e) {
                log.warn("[LIFECYCLE] Reconciliation fetch failed: {}", e.getMessage());
            }
        }, brokerExecutor);
    }

    /**
     * Applies queued broker outcomes. Must run on the stream thread.
     *
     * @return orders that changed, in application order
     */
    public List<Order> drain(StreamState state) {
        List<Order> changed = new ArrayList<>();
        BrokerOutcome outcome;
        while ((outcome = outcomes.poll()) != null) {
            if (outcome instanceof BrokerOutcome.Reconciled) {
                changed.addAll(reconcile(state, ((BrokerOutcome.Reconciled) outcome).account()));
            } else {
                applyPlacement(state, outcome).ifPresent(changed::add);
            }
        }
        return changed;
    }

    public List<Order> onCandle(StreamState state, Candle candle) {
        List<Order> changed = new ArrayList<>();
        long ts = candle.timestamp();
        boolean nearClose = SessionClock.isNearClose(ts);

        for (Order order : state.activeOrders()) {
            Order next = nearClose ? endOfDay(order, candle) : simulate(order, candle);
            if (next != order) {
                state.applyOrder(next);
                changed.add(next);
            }
        }
        return changed;
    }

    /**
     * Cancels an order that has not filled yet.
     */
    public Optional<Order> cancel(StreamState state, String orderId, long timestamp, String reason) {
        Optional<Order> existing = state.order(orderId);
        if (existing.isEmpty() || !existing.get().status().canTransitionTo(OrderStatus.CANCELLED)) {
            return Optional.empty();
        }
        Order cancelled = existing.get().cancelled(timestamp, reason);
        state.applyOrder(cancelled);
        cancelAtBroker(cancelled.brokerOrderId());
        log.info("[LIFECYCLE] Cancelled {}: {}", orderId, reason);
        return Optional.of(cancelled);
    }

    /**
     * Brings local orders forward to what the broker reports. The broker wins on conflicts.
     */
    public List<Order> reconcile(StreamState state, BrokerAccountState account) {
        List<Order> changed = new ArrayList<>();
        for (Order order : state.activeOrders()) {
            if (order.brokerOrderId() == null) continue;
            Order next = order;

            Optional<BrokerOrder> brokerOrder = account.order(order.brokerOrderId());
            Optional<BrokerFill> entryFill = account.fillFor(order.brokerOrderId());

            if (next.status() != OrderStatus.FILLED) {
                if (entryFill.isPresent() || brokerOrder.map(o -> o.status() == BrokerOrderStatus.FILLED).orElse(false)) {
                    long filledAt = entryFill.map(BrokerFill::timestamp)
                        .orElse(brokerOrder.map(BrokerOrder::timestamp).orElse(account.fetchedAt()));
                    next = next.filled(filledAt);
                } else if (brokerOrder.isPresent() && brokerOrder.get().status().isDead()) {
                    String reason = brokerOrder.get().status() == BrokerOrderStatus.REJECTED
                        ? CancelReason.BROKER_REJECTED
                        : CancelReason.BROKER_CANCELLED;
                    next = next.cancelled(brokerOrder.get().timestamp(), reason);
                }
            }

            if (next.status() == OrderStatus.FILLED && account.isFlat(next.contract())) {
                Optional<BrokerFill> exit = account.latestFill(next.contract(), next.orderType().exitAction(),
                    next.filledTimestamp());
                if (exit.isPresent()) {
                    double price = exit.get().price();
                    OrderStatus outcome = next.pointsGained(price) >= 0 ? OrderStatus.PROFIT : OrderStatus.LOSS;
                    next = next.closed(outcome, exit.get().timestamp(), price);
                } else {
                    log.warn("[LIFECYCLE] {} is FILLED locally but the broker is flat with no exit fill", next.id());
                }
            }

            if (next != order) {
                log.info("[LIFECYCLE] Reconciled {} {} -> {}", order.id(), order.status(), next.status());
                state.applyOrder(next);
                changed.add(next);
            }
        }
        return changed;
    }

    public boolean simulatesFills() {
        return gateway.simulatesFills();
    }

    private BrokerOutcome place(Order order, long timestamp) {
        try {
            String brokerId = gateway.placeBracketOrder(order);
            return new BrokerOutcome.Placed(order.id(), brokerId, timestamp);
        } catch (BrokerUnavailableException e) {
            log.error("[LIFECYCLE] Broker unavailable for {}: {}", order.id(), e.getMessage());
            return new BrokerOutcome.Unavailable(order.id(), e.getMessage(), timestamp);
        } catch (BrokerRequestException | OrderPlacementException e) {
            log.error("[LIFECYCLE] Broker refused {}: {}", order.id(), e.getMessage());
            return new BrokerOutcome.Rejected(order.id(), e.getMessage(), timestamp);
        }
    }

    private Optional<Order> applyPlacement(StreamState state, BrokerOutcome outcome) {
        String orderId;
        if (outcome instanceof BrokerOutcome.Placed) {
            orderId = ((BrokerOutcome.Placed) outcome).orderId();
        } else if (outcome instanceof BrokerOutcome.Rejected) {
            orderId = ((BrokerOutcome.Rejected) outcome).orderId();
        } else if (outcome instanceof BrokerOutcome.Unavailable) {
            orderId = ((BrokerOutcome.Unavailable) outcome).orderId();
        } else {
            return Optional.empty();
        }

        Optional<Order> existing = state.order(orderId);
        if (existing.isEmpty()) {
            log.warn("[LIFECYCLE] Outcome for unknown order {}", orderId);
            return Optional.empty();
        }
        Order order = existing.get();

        if (order.status() != OrderStatus.PLANNED) {
            // Local state moved on (end of day, manual cancel) while the request was in flight
            log.warn("[LIFECYCLE] Outcome for {} arrived in status {}", orderId, order.status());
            if (outcome instanceof BrokerOutcome.Placed && !order.isActive()) {
                cancelAtBroker(((BrokerOutcome.Placed) outcome).brokerOrderId());
            }
            return Optional.empty();
        }

        Order next;
        if (outcome instanceof BrokerOutcome.Placed) {
            BrokerOutcome.Placed placed = (BrokerOutcome.Placed) outcome;
            next = order.placed(placed.timestamp(), placed.brokerOrderId());
            log.info("[LIFECYCLE] {} PLACED as {}", orderId, placed.brokerOrderId());
        } else if (outcome instanceof BrokerOutcome.Rejected) {
            BrokerOutcome.Rejected rejected = (BrokerOutcome.Rejected) outcome;
            next = order.cancelled(rejected.timestamp(), CancelReason.BROKER_REJECTED + ": " + rejected.reason());
        } else {
            next = order.withFailure(((BrokerOutcome.Unavailable) outcome).reason());
        }
        state.applyOrder(next);
        return Optional.of(next);
    }

    private Order endOfDay(Order order, Candle candle) {
        if (order.status() == OrderStatus.FILLED) {
            double exit = candle.close();
            OrderStatus outcome = order.pointsGained(exit) >= 0 ? OrderStatus.PROFIT : OrderStatus.LOSS;
            log.info("[LIFECYCLE] {} closed at end of day: {} at {}", order.id(), outcome, exit);
            return order.closed(outcome, candle.timestamp(), exit);
        }
        Order cancelled = order.cancelled(candle.timestamp(), CancelReason.END_OF_DAY);
        cancelAtBroker(cancelled.brokerOrderId());
        return cancelled;
    }

    private Order simulate(Order order, Candle candle) {
        if (!gateway.simulatesFills()) {
            return order;
        }
        long ts = candle.timestamp();
        switch (order.status()) {
            case PLACED:
                if (order.entryTouchedBy(candle.high(), candle.low())) {
                    return order.filled(ts);
                }
                if (fullCandleOutside(order, candle)) {
                    return order.cancelled(ts, CancelReason.FULL_CANDLE_OUTSIDE);
                }
                return order;
            case FILLED:
                if (order.stopTouchedBy(candle.high(), candle.low())) {
                    return order.closed(OrderStatus.LOSS, ts, order.stopLoss());
                }
                if (order.targetTouchedBy(candle.high(), candle.low())) {
                    return order.closed(OrderStatus.PROFIT, ts, order.takeProfit());
                }
                return order;
            default:
                return order;
        }
    }

    private static boolean fullCandleOutside(Order order, Candle candle) {
        if (order.isLong()) {
            return candle.low() > order.takeProfit() || candle.high() < order.stopLoss();
        }
        return candle.high() < order.takeProfit() || candle.low() > order.stopLoss();
    }

    private void cancelAtBroker(String brokerOrderId) {
        if (brokerOrderId == null || gateway.simulatesFills()) {
            return;
        }
        CompletableFuture.runAsync(() -> gateway.cancelOrder(brokerOrderId), brokerExecutor)
            .exceptionally(e -> {
                log.warn("[LIFECYCLE] Broker cancel of {} failed: {}", brokerOrderId, e.getMessage());
                return null;
            });
    }
}
