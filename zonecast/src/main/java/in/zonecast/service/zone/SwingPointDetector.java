package in.zonecast.service.zone;

import in.zonecast.domain.data.Candle;
import in.zonecast.domain.zone.SwingKind;
import in.zonecast.domain.zone.SwingPoint;

import java.util.List;
import java.util.Optional;

/**
 * Confirms local pivots over a symmetric window of {@code confirmations} candles each side.
 *
 * Evaluated once per new candle for index {@code last - confirmations}, so each index is
 * judged exactly once and a pivot is never revised.
 */
public class SwingPointDetector {

    private final int confirmations;

    public SwingPointDetector() {
        this(1);
    }

    public SwingPointDetector(int confirmations) {
        if (confirmations <= 0) {
            throw new IllegalArgumentException("confirmations must be positive: " + confirmations);
        }
        this.confirmations = confirmations;
    }

    public Optional<SwingPoint> onCandle(List<Candle> window) {
        if (window.size() < 2 * confirmations + 1) {
            return Optional.empty();
        }

        int i = window.size() - 1 - confirmations;
        Candle pivot = window.get(i);

        double maxOtherHigh = Double.NEGATIVE_INFINITY;
        double minOtherLow = Double.POSITIVE_INFINITY;
        for (int j = i - confirmations; j <= i + confirmations; j++) {
            if (j == i) continue;
            maxOtherHigh = Math.max(maxOtherHigh, window.get(j).high());
            minOtherLow = Math.min(minOtherLow, window.get(j).low());
        }

        if (pivot.high() > maxOtherHigh) {
            return Optional.of(new SwingPoint(pivot.timestamp(), pivot.high(), SwingKind.HIGH));
        }
        if (pivot.low() < minOtherLow) {
            return Optional.of(new SwingPoint(pivot.timestamp(), pivot.low(), SwingKind.LOW));
        }
        return Optional.empty();
    }

    public int getConfirmations() {
        return confirmations;
    }
}
