package in.zonecast.service.execution;

import java.util.List;
import java.util.Optional;

/**
 * Orders, positions and fills fetched from the broker in one reconciliation pass.
 */
public record BrokerAccountState(
    List<BrokerOrder> orders,
    List<BrokerPosition> positions,
    List<BrokerFill> fills,
    long fetchedAt
) {
    public BrokerAccountState {
        orders = List.copyOf(orders);
        positions = List.copyOf(positions);
        fills = List.copyOf(fills);
    }

    public Optional<BrokerOrder> order(String id) {
        return orders.stream().filter(o -> o.id().equals(id)).findFirst();
    }

    public Optional<BrokerFill> fillFor(String orderId) {
        return fills.stream().filter(f -> f.orderId().equals(orderId)).findFirst();
    }

    /**
     * True when the broker holds no position in the contract. An unlisted contract counts as flat.
     */
    public boolean isFlat(String contract) {
        return positions.stream()
            .filter(p -> p.contract().equals(contract))
            .allMatch(BrokerPosition::isFlat);
    }

    /**
     * Latest fill on the contract with the given action at or after {@code since}.
     */
    public Optional<BrokerFill> latestFill(String contract, String action, long since) {
        BrokerFill latest = null;
        for (BrokerFill fill : fills) {
            if (!fill.contract().equals(contract) || !fill.action().equalsIgnoreCase(action)) continue;
            if (fill.timestamp() < since) continue;
            if (latest == null || fill.timestamp() > latest.timestamp()) latest = fill;
        }
        return Optional.ofNullable(latest);
    }
}
