package in.zonecast.domain.analysis;

public enum VolumeTrend {
    INCREASING,
    DECREASING,
    STABLE
}
