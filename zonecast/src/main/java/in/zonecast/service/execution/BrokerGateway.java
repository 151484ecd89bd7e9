package in.zonecast.service.execution;

import in.zonecast.domain.order.Order;

import java.util.List;

/**
 * Broker seam used by the order lifecycle.
 *
 * Implementations block on the calling thread; callers run them on the broker executor.
 * Failures surface as {@code BrokerRequestException} (definitive),
 * {@code BrokerUnavailableException} (retries exhausted) or {@code OrderPlacementException}.
 */
public interface BrokerGateway {

    /**
     * Places entry, take-profit limit and stop-loss stop as one OSO request.
     *
     * @return broker id of the entry order
     */
    String placeBracketOrder(Order order);

    void cancelOrder(String brokerOrderId);

    List<BrokerOrder> listOrders();

    List<BrokerPosition> listPositions();

    List<BrokerFill> listFills();

    /**
     * True when fills are derived locally from candles instead of reported by the broker.
     */
    default boolean simulatesFills() {
        return false;
    }

    /**
     * Short name used in logs and metric labels.
     */
    String name();
}
