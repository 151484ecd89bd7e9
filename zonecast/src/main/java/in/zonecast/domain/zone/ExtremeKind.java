package in.zonecast.domain.zone;

public enum ExtremeKind {
    HIGH,
    LOW
}
