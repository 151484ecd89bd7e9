package in.zonecast.domain.analysis;

public enum VolatilityLevel {
    LOW,
    NORMAL,
    HIGH,
    EXTREME
}
