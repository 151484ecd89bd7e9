package in.zonecast.domain.zone;

public enum SwingKind {
    HIGH,
    LOW
}
