package in.zonecast.service.state;

import in.zonecast.domain.analysis.TechnicalAnalysis;
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
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Rolling state of one candle stream.
 *
 * Single writer: only the task driving the stream may call mutating methods. Other threads
 * read {@link #latest()}, which returns the last published immutable snapshot.
 *
 * Invariants:
 * - candle timestamps never decrease
 * - the analytics lists always have the same length as the candle window
 * - closed extremes, closed plan zones and terminal orders are kept up to a fixed cap each,
 *   oldest dropped first; active ones are never dropped
 */
public class StreamState {

    public static final int DEFAULT_WINDOW_CAP = 500;
    private static final int SWING_CAP = 500;
    static final int CLOSED_EXTREME_CAP = 50;
    static final int CLOSED_ZONE_CAP = 100;
    static final int CLOSED_ORDER_CAP = 100;

    private final int windowCap;
    private LocalDate tradingDay;

    private final List<Candle> candles = new ArrayList<>();
    private final List<TrendAnalysis> trends = new ArrayList<>();
    private final List<MomentumAnalysis> momentums = new ArrayList<>();
    private final List<VolatilityAnalysis> volatilities = new ArrayList<>();
    private final List<VolumeAnalysis> volumes = new ArrayList<>();
    private final List<SwingPoint> swingPoints = new ArrayList<>();

    private final Map<String, LiquidityExtreme> extremes = new LinkedHashMap<>();
    private final Map<String, PlanZone> planZones = new LinkedHashMap<>();
    private final Map<String, Order> orders = new LinkedHashMap<>();

    private volatile StreamSnapshot published;

    public StreamState(LocalDate tradingDay) {
        this(tradingDay, DEFAULT_WINDOW_CAP);
    }

    public StreamState(LocalDate tradingDay, int windowCap) {
        if (windowCap <= 0) {
            throw new IllegalArgumentException("windowCap must be positive: " + windowCap);
        }
        this.tradingDay = tradingDay;
        this.windowCap = windowCap;
        this.published = StreamSnapshot.empty(tradingDay);
    }

    /**
     * Appends a candle. Returns false, leaving the state untouched, when it is older than the last one.
     */
    public boolean appendCandle(Candle candle) {
        if (!candles.isEmpty() && candle.timestamp() < lastTimestamp()) {
            return false;
        }
        candles.add(candle);
        return true;
    }

    /**
     * Records the analytics of the last appended candle and prunes the window to its cap.
     */
    public void appendAnalysis(TechnicalAnalysis analysis) {
        if (trends.size() != candles.size() - 1) {
            throw new IllegalStateException("Analysis appended out of step with candles: "
                + trends.size() + " analyses for " + candles.size() + " candles");
        }
        trends.add(analysis.trend());
        momentums.add(analysis.momentum());
        volatilities.add(analysis.volatility());
        volumes.add(analysis.volume());

        while (candles.size() > windowCap) {
            candles.remove(0);
            trends.remove(0);
            momentums.remove(0);
            volatilities.remove(0);
            volumes.remove(0);
        }
    }

    public void addSwingPoint(SwingPoint swingPoint) {
        swingPoints.add(swingPoint);
        if (swingPoints.size() > SWING_CAP) {
            swingPoints.remove(0);
        }
    }

    public void applyExtreme(LiquidityExtreme extreme) {
        extremes.put(extreme.market() + ":" + extreme.kind() + ":" + extreme.startTimestamp(), extreme);
        if (!extreme.isActive()) {
            pruneInactive(extremes, e -> !e.isActive(), CLOSED_EXTREME_CAP);
        }
    }

    public void applyPlanZone(PlanZone zone) {
        planZones.put(zone.id(), zone);
        if (!zone.isActive()) {
            pruneInactive(planZones, z -> !z.isActive(), CLOSED_ZONE_CAP);
        }
    }

    public void applyOrder(Order order) {
        orders.put(order.id(), order);
        if (!order.isActive()) {
            pruneInactive(orders, o -> !o.isActive(), CLOSED_ORDER_CAP);
        }
    }

    public Optional<Order> order(String id) {
        return Optional.ofNullable(orders.get(id));
    }

    public List<Order> activeOrders() {
        List<Order> result = new ArrayList<>();
        for (Order order : orders.values()) {
            if (order.isActive()) result.add(order);
        }
        return result;
    }

    private static <T> void pruneInactive(Map<String, T> items, Predicate<T> inactive, int cap) {
        int count = 0;
        for (T item : items.values()) {
            if (inactive.test(item)) count++;
        }
        Iterator<T> it = items.values().iterator();
        while (count > cap && it.hasNext()) {
            if (inactive.test(it.next())) {
                it.remove();
                count--;
            }
        }
    }

    /**
     * Candle window, read-only. Valid only on the writer thread until the next mutation.
     */
    public List<Candle> candles() {
        return Collections.unmodifiableList(candles);
    }

    public List<SwingPoint> swingPoints() {
        return Collections.unmodifiableList(swingPoints);
    }

    public long lastTimestamp() {
        return candles.isEmpty() ? Long.MIN_VALUE : candles.get(candles.size() - 1).timestamp();
    }

    public LocalDate getTradingDay() {
        return tradingDay;
    }

    public void setTradingDay(LocalDate tradingDay) {
        this.tradingDay = tradingDay;
    }

    public int getWindowCap() {
        return windowCap;
    }

    /**
     * Builds an immutable snapshot and publishes it for readers on other threads.
     */
    public StreamSnapshot snapshot() {
        StreamSnapshot snapshot = new StreamSnapshot(
            tradingDay,
            candles,
            trends,
            momentums,
            volatilities,
            volumes,
            swingPoints,
            new ArrayList<>(extremes.values()),
            new ArrayList<>(planZones.values()),
            new ArrayList<>(orders.values())
        );
        published = snapshot;
        return snapshot;
    }

    /**
     * Last published snapshot. Safe from any thread.
     */
    public StreamSnapshot latest() {
        return published;
    }
}
