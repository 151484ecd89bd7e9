package in.zonecast.domain.zone;

public enum PlanZoneKind {
    DEMAND,
    SUPPLY
}
