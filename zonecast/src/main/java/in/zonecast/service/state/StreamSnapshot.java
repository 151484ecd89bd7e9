package in.zonecast.service.state;

import in.zonecast.domain.analysis.MomentumAnalysis;
import in.zonecast.domain.analysis.TrendAnalysis;
import in.zonecast.domain.analysis.VolatilityAnalysis;
import in.zonecast.domain.analysis.VolumeAnalysis;
import in.zonecast.domain.data.Candle;
import in.zonecast.domain.order.Order;
import in.zonecast.domain.zone.LiquidityExtreme;
import in.zonecast.domain.zone.PlanZone;
import in.zonecast.domain.zone.SwingPoint;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable view of a {@link StreamState}, safe to share across threads.
 *
 * Analytics lists are index-aligned with {@code candles}.
 */
public record StreamSnapshot(
    LocalDate tradingDay,
    List<Candle> candles,
    List<TrendAnalysis> trends,
    List<MomentumAnalysis> momentums,
    List<VolatilityAnalysis> volatilities,
    List<VolumeAnalysis> volumes,
    List<SwingPoint> swingPoints,
    List<LiquidityExtreme> liquidityExtremes,
    List<PlanZone> planZones,
    List<Order> orders
) {
    public StreamSnapshot {
        candles = List.copyOf(candles);
        trends = List.copyOf(trends);
        momentums = List.copyOf(momentums);
        volatilities = List.copyOf(volatilities);
        volumes = List.copyOf(volumes);
        swingPoints = List.copyOf(swingPoints);
        liquidityExtremes = List.copyOf(liquidityExtremes);
        planZones = List.copyOf(planZones);
        orders = List.copyOf(orders);
    }

    public static StreamSnapshot empty(LocalDate tradingDay) {
        return new StreamSnapshot(tradingDay, List.of(), List.of(), List.of(), List.of(), List.of(),
            List.of(), List.of(), List.of(), List.of());
    }

    public int size() {
        return candles.size();
    }

    public Optional<Candle> lastCandle() {
        return candles.isEmpty() ? Optional.empty() : Optional.of(candles.get(candles.size() - 1));
    }

    public Optional<Order> activeOrder() {
        return orders.stream().filter(Order::isActive).findFirst();
    }

    /**
     * Sum of realized R over orders closed so far in this snapshot.
     */
    public double realizedR() {
        double sum = 0.0;
        for (Order order : orders) {
            sum += order.realizedR();
        }
        return sum;
    }

    public List<PlanZone> activePlanZones() {
        List<PlanZone> result = new ArrayList<>();
        for (PlanZone zone : planZones) {
            if (zone.isActive()) result.add(zone);
        }
        return result;
    }

    public List<LiquidityExtreme> activeExtremes() {
        List<LiquidityExtreme> result = new ArrayList<>();
        for (LiquidityExtreme extreme : liquidityExtremes) {
            if (extreme.isActive()) result.add(extreme);
        }
        return result;
    }
}
