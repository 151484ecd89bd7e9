package in.zonecast.domain.analysis;

public enum AtrTrend {
    INCREASING,
    DECREASING,
    STABLE
}
