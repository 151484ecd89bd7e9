package in.zonecast.infrastructure.broker.metrics;

import java.time.Duration;

/**
 * Broker metrics for monitoring and alerting.
 *
 * Key metrics:
 * - Order success/failure rates
 * - Order latency
 * - Rate limit hits
 * - Retry counts
 */
public interface BrokerMetrics {

    /**
     * Record successful order placement.
     *
     * @param broker Broker name
     * @param latency Placement latency including retries
     */
    void recordOrderSuccess(String broker, Duration latency);

    /**
     * Record failed order placement.
     *
     * @param broker Broker name
     * @param errorType REJECTED, UNAVAILABLE or INVALID_RESPONSE
     * @param latency Time to failure
     */
    void recordOrderFailure(String broker, String errorType, Duration latency);

    void recordOrderCancellation(String broker, boolean success);

    /**
     * Record a 429 answer.
     */
    void recordRateLimitHit(String broker);

    /**
     * Record a retry.
     *
     * @param broker Broker name
     * @param attemptNumber The attempt that failed (1, 2, 3...)
     * @param retryReason HTTP status or exception type
     */
    void recordRetry(String broker, int attemptNumber, String retryReason);
}
