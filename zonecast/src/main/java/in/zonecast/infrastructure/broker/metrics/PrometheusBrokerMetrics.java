package in.zonecast.infrastructure.broker.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of BrokerMetrics.
 *
 * Metrics:
 * - broker_orders_total{broker, status}
 * - broker_order_latency_seconds{broker}
 * - broker_order_cancellations_total{broker, status}
 * - broker_rate_limit_hits_total{broker}
 * - broker_retries_total{broker, reason}
 */
public class PrometheusBrokerMetrics implements BrokerMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusBrokerMetrics.class);

    private final CollectorRegistry registry;

    private final Counter orderCounter;
    private final Histogram orderLatency;
    private final Counter cancellationCounter;
    private final Counter rateLimitHitCounter;
    private final Counter retryCounter;

    public PrometheusBrokerMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusBrokerMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.orderCounter = Counter.build()
            .name("broker_orders_total")
            .help("Total number of bracket orders sent to the broker")
            .labelNames("broker", "status")
            .register(registry);

        this.orderLatency = Histogram.build()
            .name("broker_order_latency_seconds")
            .help("Order placement latency in seconds, retries included")
            .labelNames("broker")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.0, 5.0, 15.0, 35.0)
            .register(registry);

        this.cancellationCounter = Counter.build()
            .name("broker_order_cancellations_total")
            .help("Total number of order cancellations")
            .labelNames("broker", "status")
            .register(registry);

        this.rateLimitHitCounter = Counter.build()
            .name("broker_rate_limit_hits_total")
            .help("Total number of HTTP 429 answers")
            .labelNames("broker")
            .register(registry);

        this.retryCounter = Counter.build()
            .name("broker_retries_total")
            .help("Total number of retry attempts")
            .labelNames("broker", "reason")
            .register(registry);

        log.info("[PrometheusBrokerMetrics] Initialized broker metrics");
    }

    @Override
    public void recordOrderSuccess(String broker, Duration latency) {
        orderCounter.labels(broker, "success").inc();
        orderLatency.labels(broker).observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordOrderFailure(String broker, String errorType, Duration latency) {
        orderCounter.labels(broker, "failure").inc();
        orderLatency.labels(broker).observe(latency.toMillis() / 1000.0);
        log.debug("[PrometheusBrokerMetrics] Order failure on {}: {}", broker, errorType);
    }

    @Override
    public void recordOrderCancellation(String broker, boolean success) {
        cancellationCounter.labels(broker, success ? "success" : "failure").inc();
    }

    @Override
    public void recordRateLimitHit(String broker) {
        rateLimitHitCounter.labels(broker).inc();
    }

    @Override
    public void recordRetry(String broker, int attemptNumber, String retryReason) {
        retryCounter.labels(broker, retryReason).inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
