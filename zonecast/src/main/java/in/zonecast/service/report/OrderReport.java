package in.zonecast.service.report;

import in.zonecast.domain.order.Order;
import in.zonecast.domain.order.OrderStatus;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of closed orders. Dollar figures use {@link Order#realizedDollars()}.
 *
 * @param averageLossDollars positive magnitude of the average losing trade
 * @param maxDrawdownDollars largest peak-to-trough drop of cumulative P&L, in close order
 */
public record OrderReport(
    List<Order> orders,
    int winning,
    int losing,
    double averageWinDollars,
    double averageLossDollars,
    double averageR,
    double maxDrawdownDollars,
    double totalPnL,
    List<StrategyWinRate> winRates
) {
    public OrderReport {
        orders = List.copyOf(orders);
        winRates = List.copyOf(winRates);
    }

    public record StrategyWinRate(String entryStrategy, int winning, int losing) {
        public double winRate() {
            int total = winning + losing;
            return total == 0 ? 0.0 : (double) winning / total;
        }
    }

    public static OrderReport of(List<Order> orders) {
        List<Order> closed = new ArrayList<>();
        for (Order order : orders) {
            if (order.status() == OrderStatus.PROFIT || order.status() == OrderStatus.LOSS) {
                closed.add(order);
            }
        }
        closed.sort(Comparator.comparingLong(o -> o.closeTimestamp() == null ? 0L : o.closeTimestamp()));

        int winning = 0;
        int losing = 0;
        double winDollars = 0.0;
        double lossDollars = 0.0;
        double totalR = 0.0;
        double running = 0.0;
        double peak = 0.0;
        double maxDrawdown = 0.0;
        Map<String, int[]> byStrategy = new LinkedHashMap<>();

        for (Order order : closed) {
            double pnl = order.realizedDollars();
            int[] counts = byStrategy.computeIfAbsent(order.entryStrategy(), k -> new int[2]);
            if (order.status() == OrderStatus.PROFIT) {
                winning++;
                winDollars += pnl;
                counts[0]++;
            } else {
                losing++;
                lossDollars += pnl;
                counts[1]++;
            }
            totalR += order.realizedR();

            running += pnl;
            peak = Math.max(peak, running);
            maxDrawdown = Math.max(maxDrawdown, peak - running);
        }

        List<StrategyWinRate> winRates = new ArrayList<>();
        byStrategy.forEach((strategy, counts) -> winRates.add(new StrategyWinRate(strategy, counts[0], counts[1])));
        winRates.sort(Comparator.comparingDouble(StrategyWinRate::winRate).reversed());

        return new OrderReport(
            orders,
            winning,
            losing,
            winning == 0 ? 0.0 : winDollars / winning,
            losing == 0 ? 0.0 : -lossDollars / losing,
            closed.isEmpty() ? 0.0 : totalR / closed.size(),
            maxDrawdown,
            winDollars + lossDollars,
            winRates
        );
    }

    /**
     * TRUE when the day made money, FALSE when it lost, null when flat or empty.
     */
    public Boolean profitable() {
        if (totalPnL > 0) return Boolean.TRUE;
        if (totalPnL < 0) return Boolean.FALSE;
        return null;
    }
}
