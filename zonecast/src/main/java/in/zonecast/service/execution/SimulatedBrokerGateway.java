package in.zonecast.service.execution;

import in.zonecast.domain.order.Order;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process broker for replays and tests. Accepts every bracket; fills come from candles.
 */
public class SimulatedBrokerGateway implements BrokerGateway {
    private static final Logger log = LoggerFactory.getLogger(SimulatedBrokerGateway.class);

    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, BrokerOrder> orders = new ConcurrentHashMap<>();

    @Override
    public String placeBracketOrder(Order order) {
        String brokerId = "SIM-" + sequence.incrementAndGet();
        orders.put(brokerId, new BrokerOrder(brokerId, order.contract(), order.orderType().brokerAction(),
            BrokerOrderStatus.WORKING, order.createdTimestamp()));
        log.info("[SIM_BROKER] Accepted {} {} x{} entry={} tp={} sl={} as {}",
            order.orderType(), order.contract(), order.contracts(),
            order.entryPrice(), order.takeProfit(), order.stopLoss(), brokerId);
        return brokerId;
    }

    @Override
    public void cancelOrder(String brokerOrderId) {
        BrokerOrder existing = orders.get(brokerOrderId);
        if (existing == null) {
            log.warn("[SIM_BROKER] Cancel for unknown order {}", brokerOrderId);
            return;
        }
        orders.put(brokerOrderId, new BrokerOrder(existing.id(), existing.contract(), existing.action(),
            BrokerOrderStatus.CANCELLED, existing.timestamp()));
        log.info("[SIM_BROKER] Cancelled {}", brokerOrderId);
    }

    @Override
    public List<BrokerOrder> listOrders() {
        return new ArrayList<>(orders.values());
    }

    @Override
    public List<BrokerPosition> listPositions() {
        return List.of();
    }

    @Override
    public List<BrokerFill> listFills() {
        return List.of();
    }

    @Override
    public boolean simulatesFills() {
        return true;
    }

    @Override
    public String name() {
        return "SIMULATED";
    }
}
