package in.zonecast.support;

import in.zonecast.domain.data.Candle;
import in.zonecast.service.zone.SessionClock;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Candle fixtures for tests. Timestamps are one minute apart.
 */
public final class TestCandles {

    /** A plain Tuesday. */
    public static final LocalDate TRADING_DAY = LocalDate.of(2024, 3, 5);
    public static final long MINUTE = 60_000L;

    public static long at(LocalTime time) {
        return SessionClock.at(TRADING_DAY, time);
    }

    public static Candle candle(long timestamp, double close) {
        return new Candle(timestamp, close, close + 0.5, close - 0.5, close, 1_000);
    }

    public static Candle candle(long timestamp, double open, double high, double low, double close) {
        return new Candle(timestamp, open, high, low, close, 1_000);
    }

    /**
     * One candle per close, starting at {@code start}.
     */
    public static List<Candle> closes(long start, double... closes) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            candles.add(candle(start + i * MINUTE, closes[i]));
        }
        return candles;
    }

    /**
     * Strictly increasing closes from {@code first} in steps of one point.
     */
    public static List<Candle> rising(long start, int count, double first) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            candles.add(candle(start + i * MINUTE, first + i));
        }
        return candles;
    }

    /**
     * Deterministic zig-zag walk, varied enough to exercise every indicator branch.
     */
    public static List<Candle> walk(long start, int count, long seed) {
        Random random = new Random(seed);
        List<Candle> candles = new ArrayList<>();
        double price = 5000.0;
        for (int i = 0; i < count; i++) {
            double open = price;
            double close = open + (random.nextDouble() - 0.5) * 6.0;
            double high = Math.max(open, close) + random.nextDouble() * 2.0;
            double low = Math.min(open, close) - random.nextDouble() * 2.0;
            long volume = 500 + random.nextInt(3_000);
            candles.add(new Candle(start + i * MINUTE, open, high, low, close, volume));
            price = close;
        }
        return candles;
    }

    private TestCandles() {}
}
