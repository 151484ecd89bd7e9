package in.zonecast.domain.analysis;

/**
 * Bollinger bands. {@code percentB} is the close position inside the bands (0 = lower, 1 = upper).
 */
public record BollingerBand(
    double upper,
    double center,
    double lower,
    double bandwidth,
    double percentB,
    BandPosition pricePosition
) {
    public boolean isSqueezing() {
        return bandwidth < 0.1;
    }

    public boolean isExpanding() {
        return bandwidth > 0.2;
    }

    public boolean isOverbought() {
        return percentB > 0.8;
    }

    public boolean isOversold() {
        return percentB < 0.2;
    }
}
