package in.zonecast.infrastructure.persistence;

import in.zonecast.application.port.input.CandleStream;
import in.zonecast.domain.data.Candle;
import in.zonecast.domain.data.Resolution;
import in.zonecast.support.TestCandles;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCandleSourceTest {

    private static final long START = TestCandles.at(LocalTime.of(9, 30));

    private static List<Candle> drain(CandleStream stream) {
        List<Candle> result = new ArrayList<>();
        try (stream) {
            while (stream.hasNext()) result.add(stream.next());
        }
        return result;
    }

    @Test
    @DisplayName("Range is half-open and sorted regardless of insertion order")
    void testRange() {
        InMemoryCandleSource source = new InMemoryCandleSource();
        List<Candle> candles = TestCandles.rising(START, 10, 100.0);
        for (int i = candles.size() - 1; i >= 0; i--) {
            source.add(candles.get(i));
        }

        List<Candle> range = drain(source.stream(START + TestCandles.MINUTE, START + 4 * TestCandles.MINUTE,
            Resolution.ONE_MINUTE));

        assertEquals(candles.subList(1, 4), range);
    }

    @Test
    @DisplayName("Five-minute candles aggregate OHLCV of their bucket")
    void testFiveMinuteAggregation() {
        InMemoryCandleSource source = new InMemoryCandleSource(TestCandles.rising(START, 10, 100.0));

        List<Candle> fives = drain(source.stream(START, START + 10 * TestCandles.MINUTE, Resolution.FIVE_MINUTES));

        assertEquals(2, fives.size());
        Candle first = fives.get(0);
        assertEquals(START, first.timestamp());
        assertEquals(100.0, first.open());
        assertEquals(104.5, first.high());
        assertEquals(99.5, first.low());
        assertEquals(104.0, first.close());
        assertEquals(5_000, first.volume());
        assertEquals(START + 5 * TestCandles.MINUTE, fives.get(1).timestamp());
    }

    @Test
    void testEmptyRange() {
        InMemoryCandleSource source = new InMemoryCandleSource(TestCandles.rising(START, 3, 100.0));

        assertTrue(drain(source.stream(0, START, Resolution.FIVE_MINUTES)).isEmpty());
    }

    @Test
    @DisplayName("Live stream replays history, follows publishes and ends on close")
    void testLiveStream() throws Exception {
        InMemoryCandleSource source = new InMemoryCandleSource(TestCandles.rising(START, 2, 100.0));
        CandleStream live = source.live(START + TestCandles.MINUTE);
        CompletableFuture<List<Candle>> received = CompletableFuture.supplyAsync(() -> drain(live));

        source.publish(TestCandles.candle(START + 2 * TestCandles.MINUTE, 102.0));
        source.close();

        List<Candle> candles = received.get(5, TimeUnit.SECONDS);
        assertEquals(2, candles.size());
        assertEquals(START + TestCandles.MINUTE, candles.get(0).timestamp());
        assertEquals(102.0, candles.get(1).close());
    }
}
