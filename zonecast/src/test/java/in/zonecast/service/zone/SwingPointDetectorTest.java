package in.zonecast.service.zone;

import in.zonecast.domain.data.Candle;
import in.zonecast.domain.zone.SwingKind;
import in.zonecast.domain.zone.SwingPoint;
import in.zonecast.support.TestCandles;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SwingPointDetectorTest {

    private static final long START = TestCandles.at(LocalTime.of(13, 0));

    @Test
    @DisplayName("Closes 100, 101, 99 confirm one swing high at the middle candle's high, only after the third candle")
    void testSwingHighConfirmedOnThirdCandle() {
        SwingPointDetector detector = new SwingPointDetector(1);
        List<Candle> candles = TestCandles.closes(START, 100.0, 101.0, 99.0);
        List<Candle> window = new ArrayList<>();
        List<SwingPoint> emitted = new ArrayList<>();

        window.add(candles.get(0));
        assertTrue(detector.onCandle(window).isEmpty(), "Nothing after the first candle");
        window.add(candles.get(1));
        assertTrue(detector.onCandle(window).isEmpty(), "Nothing after the second candle");
        window.add(candles.get(2));
        detector.onCandle(window).ifPresent(emitted::add);

        assertEquals(1, emitted.size());
        SwingPoint swing = emitted.get(0);
        assertEquals(SwingKind.HIGH, swing.kind());
        assertEquals(candles.get(1).high(), swing.price(), 0.0);
        assertEquals(candles.get(1).timestamp(), swing.timestamp());
    }

    @Test
    void testSwingLow() {
        SwingPointDetector detector = new SwingPointDetector();
        List<Candle> candles = TestCandles.closes(START, 100.0, 98.0, 99.0);

        Optional<SwingPoint> swing = detector.onCandle(candles);

        assertTrue(swing.isPresent());
        assertEquals(SwingKind.LOW, swing.get().kind());
        assertEquals(97.5, swing.get().price(), 0.0);
    }

    @Test
    @DisplayName("Equal highs are not a strict pivot")
    void testEqualHighsIgnored() {
        SwingPointDetector detector = new SwingPointDetector();
        List<Candle> candles = TestCandles.closes(START, 100.0, 100.0, 99.0);

        assertTrue(detector.onCandle(candles).isEmpty());
    }

    @Test
    @DisplayName("Each pivot index is judged once as the window grows")
    void testPivotEmittedOnce() {
        SwingPointDetector detector = new SwingPointDetector(2);
        List<Candle> candles = TestCandles.closes(START, 100.0, 101.0, 103.0, 102.0, 101.0, 100.5, 100.2);
        List<SwingPoint> emitted = new ArrayList<>();

        for (int i = 1; i <= candles.size(); i++) {
            detector.onCandle(candles.subList(0, i)).ifPresent(emitted::add);
        }

        assertEquals(1, emitted.size());
        assertEquals(103.5, emitted.get(0).price(), 0.0);
    }

    @Test
    void testRejectsNonPositiveConfirmations() {
        assertThrows(IllegalArgumentException.class, () -> new SwingPointDetector(0));
    }
}
