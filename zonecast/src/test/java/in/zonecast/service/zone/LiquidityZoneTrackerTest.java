package in.zonecast.service.zone;

import in.zonecast.domain.data.Candle;
import in.zonecast.domain.event.LiquidityExtremeEvent;
import in.zonecast.domain.zone.ExtremeKind;
import in.zonecast.domain.zone.LiquidityExtreme;
import in.zonecast.domain.zone.Market;
import in.zonecast.domain.zone.ZoneChange;
import in.zonecast.support.TestCandles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LiquidityZoneTrackerTest {

    private LiquidityZoneTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new LiquidityZoneTracker(TestCandles.TRADING_DAY);
    }

    @Test
    @DisplayName("London window creates one HIGH and one LOW and extends them in place")
    void testLondonExtremesExtend() {
        long start = TestCandles.at(LocalTime.of(3, 0));

        List<LiquidityExtremeEvent> first = tracker.onCandle(TestCandles.candle(start, 100.0));
        List<LiquidityExtremeEvent> second = tracker.onCandle(TestCandles.candle(start + TestCandles.MINUTE, 102.0));

        assertEquals(2, first.size());
        assertTrue(first.stream().allMatch(e -> e.change() == ZoneChange.CREATED));
        assertEquals(1, second.size(), "Only the HIGH extends on a higher candle");
        LiquidityExtreme high = second.get(0).extreme();
        assertEquals(ExtremeKind.HIGH, high.kind());
        assertEquals(Market.LONDON, high.market());
        assertEquals(102.5, high.level(), 0.0);
        assertEquals(start, high.startTimestamp(), "Extending keeps the original start");
    }

    @Test
    @DisplayName("At most one open extreme per (market, kind) across a full day")
    void testOneOpenExtremePerMarketAndKind() {
        long start = SessionClock.at(TestCandles.TRADING_DAY.minusDays(1), LocalTime.of(17, 0));
        List<Candle> candles = TestCandles.walk(start, 24 * 60, 3L);

        for (Candle candle : candles) {
            tracker.onCandle(candle);

            Set<String> keys = new HashSet<>();
            for (LiquidityExtreme extreme : tracker.openExtremes()) {
                assertTrue(extreme.isActive());
                assertTrue(keys.add(extreme.market() + ":" + extreme.kind()),
                    "Duplicate open extreme " + extreme.market() + " " + extreme.kind());
            }
        }
    }

    @Test
    @DisplayName("A candle outside the window that trades through a level closes it")
    void testSurpassedOutsideWindowCloses() {
        long london = TestCandles.at(LocalTime.of(3, 0));
        tracker.onCandle(TestCandles.candle(london, 100.0));

        long afterOpen = TestCandles.at(LocalTime.of(10, 0));
        List<LiquidityExtremeEvent> events = tracker.onCandle(TestCandles.candle(afterOpen, 105.0));

        List<LiquidityExtremeEvent> closed = new ArrayList<>();
        for (LiquidityExtremeEvent event : events) {
            if (event.change() == ZoneChange.CLOSED) closed.add(event);
        }
        assertEquals(1, closed.size());
        assertEquals(ExtremeKind.HIGH, closed.get(0).extreme().kind());
        assertEquals(afterOpen, closed.get(0).extreme().endTimestamp());
        assertTrue(tracker.openExtremes().stream()
            .noneMatch(e -> e.market() == Market.LONDON && e.kind() == ExtremeKind.HIGH));
    }

    @Test
    @DisplayName("Rollover closes open extremes and moves the tracker to the new day")
    void testRolloverClosesOpenExtremes() {
        long london = TestCandles.at(LocalTime.of(3, 0));
        tracker.onCandle(TestCandles.candle(london, 100.0));
        assertEquals(2, tracker.openExtremes().size());

        long evening = TestCandles.at(LocalTime.of(18, 0));
        List<LiquidityExtremeEvent> events = tracker.rollover(TestCandles.TRADING_DAY.plusDays(1), evening, List.of());

        assertEquals(2, events.size());
        assertTrue(events.stream().allMatch(e -> e.change() == ZoneChange.CLOSED));
        assertTrue(tracker.openExtremes().isEmpty());
        assertEquals(TestCandles.TRADING_DAY.plusDays(1), tracker.getTradingDay());
        assertEquals(2, tracker.closedExtremes().size());
    }

    @Test
    @DisplayName("The New York session of the day is carried into the next day whole, stamped at the rollover")
    void testNewYorkSessionCarriedAcrossRollover() {
        // Arrange
        long open = TestCandles.at(LocalTime.of(9, 30));
        long evening = TestCandles.at(LocalTime.of(18, 0));
        for (long ts = open; ts < evening; ts += TestCandles.MINUTE) {
            Candle candle = ts == open + TestCandles.MINUTE
                ? TestCandles.candle(ts, 5000.0, 9000.0, 4999.5, 5000.0)
                : TestCandles.candle(ts, 5000.0);
            tracker.onCandle(candle);
        }

        // Act
        List<LiquidityExtremeEvent> events = tracker.rollover(TestCandles.TRADING_DAY.plusDays(1), evening, List.of());

        // Assert
        LiquidityExtreme high = tracker.openExtremes().stream()
            .filter(e -> e.market() == Market.NEW_YORK && e.kind() == ExtremeKind.HIGH)
            .findFirst().orElseThrow();
        assertEquals(9000.0, high.level(), 0.0);
        assertEquals(open, high.startTimestamp());
        LiquidityExtreme low = tracker.openExtremes().stream()
            .filter(e -> e.market() == Market.NEW_YORK && e.kind() == ExtremeKind.LOW)
            .findFirst().orElseThrow();
        assertEquals(4999.5, low.level(), 0.0);
        assertTrue(events.stream().allMatch(e -> e.timestamp() == evening), "Every rollover event is stamped at the rollover");
        assertEquals(2, events.stream().filter(e -> e.change() == ZoneChange.CREATED).count());
    }

    @Test
    @DisplayName("After a gap in the data the new day is rebuilt from the retained candles")
    void testRolloverAfterGapUsesRetainedCandles() {
        LocalDate thursday = TestCandles.TRADING_DAY.plusDays(2);
        long sessionCandle = SessionClock.at(thursday.minusDays(1), LocalTime.of(10, 0));
        long evening = SessionClock.at(thursday.minusDays(1), LocalTime.of(18, 0));
        List<Candle> retained = List.of(TestCandles.candle(sessionCandle, 5100.0));

        List<LiquidityExtremeEvent> events = tracker.rollover(thursday, evening, retained);

        assertEquals(2, events.size());
        assertTrue(events.stream().allMatch(e -> e.change() == ZoneChange.CREATED && e.timestamp() == evening));
        assertTrue(tracker.openExtremes().stream()
            .allMatch(e -> e.market() == Market.NEW_YORK && e.startTimestamp() == sessionCandle));
    }
}
