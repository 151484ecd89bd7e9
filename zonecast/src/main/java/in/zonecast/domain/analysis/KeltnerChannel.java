package in.zonecast.domain.analysis;

/**
 * Keltner channel around an SMA center, width relative to the center.
 */
public record KeltnerChannel(
    double upper,
    double center,
    double lower,
    double width,
    BandPosition pricePosition
) {
}
