package in.zonecast.domain.zone;

/**
 * Confirmed local pivot. Immutable once emitted.
 */
public record SwingPoint(long timestamp, double price, SwingKind kind) {

    public boolean isHigh() {
        return kind == SwingKind.HIGH;
    }

    public boolean isLow() {
        return kind == SwingKind.LOW;
    }
}
