package in.zonecast.infrastructure.persistence;

import in.zonecast.domain.data.Candle;
import in.zonecast.domain.data.Resolution;

import java.util.ArrayList;
import java.util.List;

/**
 * Rolls one-minute candles up to a coarser resolution. Buckets align to epoch multiples.
 */
final class CandleAggregator {

    static List<Candle> aggregate(List<Candle> oneMinute, Resolution resolution) {
        if (resolution == Resolution.ONE_MINUTE || oneMinute.isEmpty()) {
            return oneMinute;
        }
        long size = resolution.millis();
        List<Candle> result = new ArrayList<>();

        long bucket = Long.MIN_VALUE;
        double open = 0, high = 0, low = 0, close = 0;
        long volume = 0;
        for (Candle c : oneMinute) {
            long start = Math.floorDiv(c.timestamp(), size) * size;
            if (start != bucket) {
                if (bucket != Long.MIN_VALUE) {
                    result.add(new Candle(bucket, open, high, low, close, volume));
                }
                bucket = start;
                open = c.open();
                high = c.high();
                low = c.low();
                volume = 0;
            }
            high = Math.max(high, c.high());
            low = Math.min(low, c.low());
            close = c.close();
            volume += c.volume();
        }
        result.add(new Candle(bucket, open, high, low, close, volume));
        return result;
    }

    private CandleAggregator() {}
}
