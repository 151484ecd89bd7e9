package in.zonecast.service.zone;

import in.zonecast.domain.data.Candle;
import in.zonecast.domain.event.LiquidityExtremeEvent;
import in.zonecast.domain.zone.ExtremeKind;
import in.zonecast.domain.zone.LiquidityExtreme;
import in.zonecast.domain.zone.Market;
import in.zonecast.domain.zone.ZoneChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks the running high and low of the New York, Asia and London sessions.
 *
 * Rules per candle:
 * 1. An open extreme is closed when the candle surpasses it from outside the extreme's own window.
 * 2. Inside a market's window the HIGH only grows and the LOW only shrinks.
 *
 * Candles that already fall in the next trading day's windows (the New York session of the
 * current day) are staged as running levels and promoted at rollover.
 *
 * At most one open extreme exists per (market, kind). Not thread-safe: owned by one stream.
 */
public class LiquidityZoneTracker {
    private static final Logger log = LoggerFactory.getLogger(LiquidityZoneTracker.class);

    private static final int MAX_CLOSED_HISTORY = 200;

    private final Map<Market, Map<ExtremeKind, LiquidityExtreme>> open = new EnumMap<>(Market.class);
    private final List<LiquidityExtreme> closed = new ArrayList<>();
    private final Map<Market, SessionClock.SessionWindow> windows = new EnumMap<>(Market.class);
    private final Map<Market, SessionClock.SessionWindow> nextWindows = new EnumMap<>(Market.class);
    private Map<Market, Map<ExtremeKind, LiquidityExtreme>> staged = emptyLevels();
    private LocalDate tradingDay;
    private LocalDate nextTradingDay;

    public LiquidityZoneTracker(LocalDate tradingDay) {
        for (Market market : Market.values()) {
            open.put(market, new EnumMap<>(ExtremeKind.class));
        }
        setTradingDay(tradingDay);
    }

    public List<LiquidityExtremeEvent> onCandle(Candle candle) {
        List<LiquidityExtremeEvent> events = new ArrayList<>();
        long ts = candle.timestamp();

        for (Market market : Market.values()) {
            Map<ExtremeKind, LiquidityExtreme> byKind = open.get(market);
            for (ExtremeKind kind : ExtremeKind.values()) {
                LiquidityExtreme extreme = byKind.get(kind);
                if (extreme != null && !inWindow(market, ts) && extreme.isSurpassedBy(candle.high(), candle.low())) {
                    LiquidityExtreme done = extreme.closedAt(ts);
                    byKind.remove(kind);
                    remember(done);
                    events.add(new LiquidityExtremeEvent(done, ZoneChange.CLOSED, ts));
                }
            }
        }

        for (Market market : Market.values()) {
            if (!inWindow(market, ts)) continue;
            extend(market, ExtremeKind.HIGH, candle.high(), ts, events);
            extend(market, ExtremeKind.LOW, candle.low(), ts, events);
        }

        for (Market market : Market.values()) {
            SessionClock.SessionWindow next = nextWindows.get(market);
            if (next == null || !next.contains(ts)) continue;
            stage(staged, market, ExtremeKind.HIGH, candle.high(), ts);
            stage(staged, market, ExtremeKind.LOW, candle.low(), ts);
        }

        return events;
    }

    /**
     * Moves to a new trading day: closes every open extreme at {@code timestamp}, then opens the
     * levels staged for the new day. When the new day is not the one staged for (a gap in the
     * data), the levels are rebuilt from the retained candles instead.
     *
     * Every event is stamped {@code timestamp}; the extremes keep their own start.
     */
    public List<LiquidityExtremeEvent> rollover(LocalDate newTradingDay, long timestamp, List<Candle> retained) {
        List<LiquidityExtremeEvent> events = new ArrayList<>();
        for (Map<ExtremeKind, LiquidityExtreme> byKind : open.values()) {
            for (LiquidityExtreme extreme : byKind.values()) {
                LiquidityExtreme done = extreme.closedAt(Math.max(timestamp, extreme.startTimestamp()));
                remember(done);
                events.add(new LiquidityExtremeEvent(done, ZoneChange.CLOSED, timestamp));
            }
            byKind.clear();
        }

        log.info("[LIQUIDITY] Rollover {} -> {}, closed {} open extremes", tradingDay, newTradingDay, events.size());
        Map<Market, Map<ExtremeKind, LiquidityExtreme>> seeds = newTradingDay.equals(nextTradingDay) ? staged : null;
        setTradingDay(newTradingDay);

        if (seeds == null) {
            log.warn("[LIQUIDITY] No levels staged for {}, rebuilding from {} retained candles",
                newTradingDay, retained.size());
            seeds = emptyLevels();
            for (Candle candle : retained) {
                if (candle.timestamp() >= timestamp) break;
                for (Market market : Market.values()) {
                    if (!inWindow(market, candle.timestamp())) continue;
                    stage(seeds, market, ExtremeKind.HIGH, candle.high(), candle.timestamp());
                    stage(seeds, market, ExtremeKind.LOW, candle.low(), candle.timestamp());
                }
            }
        }

        for (Map.Entry<Market, Map<ExtremeKind, LiquidityExtreme>> entry : seeds.entrySet()) {
            for (LiquidityExtreme seed : entry.getValue().values()) {
                open.get(entry.getKey()).put(seed.kind(), seed);
                events.add(new LiquidityExtremeEvent(seed, ZoneChange.CREATED, timestamp));
            }
        }
        return events;
    }

    public List<LiquidityExtreme> openExtremes() {
        List<LiquidityExtreme> result = new ArrayList<>();
        for (Map<ExtremeKind, LiquidityExtreme> byKind : open.values()) {
            result.addAll(byKind.values());
        }
        return result;
    }

    public List<LiquidityExtreme> closedExtremes() {
        return List.copyOf(closed);
    }

    public LocalDate getTradingDay() {
        return tradingDay;
    }

    private void extend(Market market, ExtremeKind kind, double price, long ts, List<LiquidityExtremeEvent> events) {
        Map<ExtremeKind, LiquidityExtreme> byKind = open.get(market);
        LiquidityExtreme current = byKind.get(kind);

        if (current == null) {
            LiquidityExtreme created = LiquidityExtreme.open(market, kind, price, ts);
            byKind.put(kind, created);
            events.add(new LiquidityExtremeEvent(created, ZoneChange.CREATED, ts));
            return;
        }

        boolean extendsLevel = kind == ExtremeKind.HIGH ? price > current.level() : price < current.level();
        if (extendsLevel) {
            LiquidityExtreme updated = current.withLevel(price);
            byKind.put(kind, updated);
            events.add(new LiquidityExtremeEvent(updated, ZoneChange.UPDATED, ts));
        }
    }

    private static void stage(Map<Market, Map<ExtremeKind, LiquidityExtreme>> levels,
                              Market market, ExtremeKind kind, double price, long ts) {
        Map<ExtremeKind, LiquidityExtreme> byKind = levels.get(market);
        LiquidityExtreme current = byKind.get(kind);
        if (current == null) {
            byKind.put(kind, LiquidityExtreme.open(market, kind, price, ts));
        } else if (kind == ExtremeKind.HIGH ? price > current.level() : price < current.level()) {
            byKind.put(kind, current.withLevel(price));
        }
    }

    private static Map<Market, Map<ExtremeKind, LiquidityExtreme>> emptyLevels() {
        Map<Market, Map<ExtremeKind, LiquidityExtreme>> levels = new EnumMap<>(Market.class);
        for (Market market : Market.values()) {
            levels.put(market, new EnumMap<>(ExtremeKind.class));
        }
        return levels;
    }

    private boolean inWindow(Market market, long ts) {
        SessionClock.SessionWindow window = windows.get(market);
        return window != null && window.contains(ts);
    }

    private void setTradingDay(LocalDate day) {
        this.tradingDay = day;
        this.nextTradingDay = MarketCalendar.onOrAfter(day.plusDays(1));
        this.staged = emptyLevels();
        computeWindows(day, windows);
        computeWindows(nextTradingDay, nextWindows);
    }

    private void computeWindows(LocalDate day, Map<Market, SessionClock.SessionWindow> target) {
        target.clear();
        for (Market market : Market.values()) {
            try {
                target.put(market, SessionClock.window(market, day));
            } catch (DateTimeException e) {
                // Skip the market for this day; its extremes are not tracked
                log.warn("[LIQUIDITY] Cannot compute {} window for {}: {}", market, day, e.getMessage());
            }
        }
    }

    private void remember(LiquidityExtreme extreme) {
        closed.add(extreme);
        if (closed.size() > MAX_CLOSED_HISTORY) {
            closed.remove(0);
        }
    }
}
