package in.zonecast.infrastructure.metrics;

import in.zonecast.domain.common.EventType;
import in.zonecast.domain.order.OrderStatus;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

/**
 * Prometheus metrics for candle processing and event distribution.
 *
 * Metrics:
 * - zonecast_candles_processed_total{mode}
 * - zonecast_candles_skipped_total
 * - zonecast_events_emitted_total{type}
 * - zonecast_orders_total{status}
 * - zonecast_pending_buffer_size
 * - zonecast_pending_evictions_total
 * - zonecast_subscribers_connected
 * - zonecast_control_errors_total
 */
public class PipelineMetrics {

    private final CollectorRegistry registry;

    private final Counter candlesProcessed;
    private final Counter candlesSkipped;
    private final Counter eventsEmitted;
    private final Counter orders;
    private final Gauge pendingSize;
    private final Counter pendingEvictions;
    private final Gauge subscribers;
    private final Counter controlErrors;

    public PipelineMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PipelineMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.candlesProcessed = Counter.build()
            .name("zonecast_candles_processed_total")
            .help("Candles processed by the pipeline")
            .labelNames("mode")
            .register(registry);

        this.candlesSkipped = Counter.build()
            .name("zonecast_candles_skipped_total")
            .help("Candles dropped for arriving out of order")
            .register(registry);

        this.eventsEmitted = Counter.build()
            .name("zonecast_events_emitted_total")
            .help("Events emitted by type")
            .labelNames("type")
            .register(registry);

        this.orders = Counter.build()
            .name("zonecast_orders_total")
            .help("Order status changes")
            .labelNames("status")
            .register(registry);

        this.pendingSize = Gauge.build()
            .name("zonecast_pending_buffer_size")
            .help("Events waiting for a ready subscriber")
            .register(registry);

        this.pendingEvictions = Counter.build()
            .name("zonecast_pending_evictions_total")
            .help("Events evicted from a full pending buffer")
            .register(registry);

        this.subscribers = Gauge.build()
            .name("zonecast_subscribers_connected")
            .help("Connected WebSocket subscribers")
            .register(registry);

        this.controlErrors = Counter.build()
            .name("zonecast_control_errors_total")
            .help("Malformed or unknown control messages")
            .register(registry);
    }

    public void candleProcessed(String mode) {
        candlesProcessed.labels(mode).inc();
    }

    public void candleSkipped() {
        candlesSkipped.inc();
    }

    public void eventEmitted(EventType type) {
        eventsEmitted.labels(type.wireName()).inc();
    }

    public void orderStatus(OrderStatus status) {
        orders.labels(status.name()).inc();
    }

    public void pendingSize(int size) {
        pendingSize.set(size);
    }

    public void pendingEvicted() {
        pendingEvictions.inc();
    }

    public double pendingEvictions() {
        return pendingEvictions.get();
    }

    public void subscribers(int count) {
        subscribers.set(count);
    }

    public void controlError() {
        controlErrors.inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
