package in.zonecast.domain.analysis;

public enum VolumeQuality {
    EXCELLENT,
    GOOD,
    NEUTRAL,
    POOR
}
