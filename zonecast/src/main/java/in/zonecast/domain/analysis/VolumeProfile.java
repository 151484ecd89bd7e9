package in.zonecast.domain.analysis;

import java.util.List;

/**
 * Volume-at-price histogram with point of control and the 70% value area.
 */
public record VolumeProfile(
    List<VolumeProfileLevel> levels,
    double pointOfControl,
    double valueAreaHigh,
    double valueAreaLow,
    long totalVolume
) {
    public VolumeProfile {
        levels = List.copyOf(levels);
    }

    public boolean isInValueArea(double price) {
        return price >= valueAreaLow && price <= valueAreaHigh;
    }
}
