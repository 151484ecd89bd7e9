package in.zonecast.domain.data;

import java.time.Instant;

/**
 * OHLCV candle. Timestamp is the candle open time in epoch milliseconds.
 */
public record Candle(
    long timestamp,
    double open,
    double high,
    double low,
    double close,
    long volume
) {
    public Candle {
        if (high < low) {
            throw new IllegalArgumentException("Candle high " + high + " below low " + low + " at " + timestamp);
        }
        if (volume < 0) {
            throw new IllegalArgumentException("Candle volume cannot be negative: " + volume);
        }
    }

    public double range() {
        return high - low;
    }

    public double body() {
        return Math.abs(close - open);
    }

    public boolean isBullish() {
        return close > open;
    }

    public boolean isBearish() {
        return close < open;
    }

    /**
     * (high + low + close) / 3
     */
    public double typicalPrice() {
        return (high + low + close) / 3.0;
    }

    public Instant instant() {
        return Instant.ofEpochMilli(timestamp);
    }
}
