package in.zonecast.domain.analysis;

/**
 * Standard deviation bands around the mean close. {@code priceLevel} is 0, 1 or 2 sigma.
 */
public record StdDevBands(
    double mean,
    double stdDev,
    double upper1,
    double lower1,
    double upper2,
    double lower2,
    int priceLevel
) {
}
