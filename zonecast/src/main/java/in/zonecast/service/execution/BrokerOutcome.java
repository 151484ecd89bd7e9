package in.zonecast.service.execution;

/**
 * Result of a broker call made off the stream thread, applied later by the stream owner.
 */
public interface BrokerOutcome {

    long timestamp();

    record Placed(String orderId, String brokerOrderId, long timestamp) implements BrokerOutcome {
    }

    /** Definitive refusal; the order is cancelled. */
    record Rejected(String orderId, String reason, long timestamp) implements BrokerOutcome {
    }

    /** Retries exhausted; the order stays PLANNED with the failure recorded. */
    record Unavailable(String orderId, String reason, long timestamp) implements BrokerOutcome {
    }

    record Reconciled(BrokerAccountState account, long timestamp) implements BrokerOutcome {
    }
}
