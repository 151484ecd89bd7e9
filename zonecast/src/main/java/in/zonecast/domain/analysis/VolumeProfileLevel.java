package in.zonecast.domain.analysis;

public record VolumeProfileLevel(double price, long volume, double percentOfTotal) {
}
