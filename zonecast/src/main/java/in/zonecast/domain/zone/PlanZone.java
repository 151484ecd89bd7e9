package in.zonecast.domain.zone;

/**
 * Supply or demand band between two swing points.
 *
 * The id is stable for the lifetime of the zone: kind plus start timestamp.
 */
public record PlanZone(
    String id,
    PlanZoneKind kind,
    double low,
    double high,
    long startTimestamp,
    Long endTimestamp
) {
    public static PlanZone open(PlanZoneKind kind, double low, double high, long startTimestamp) {
        return new PlanZone(idFor(kind, startTimestamp), kind, low, high, startTimestamp, null);
    }

    public static String idFor(PlanZoneKind kind, long startTimestamp) {
        return kind.name() + "-" + startTimestamp;
    }

    public boolean isActive() {
        return endTimestamp == null;
    }

    public PlanZone closedAt(long timestamp) {
        return new PlanZone(id, kind, low, high, startTimestamp, timestamp);
    }

    /**
     * Supply is invalidated by a close above the band, demand by a close below it.
     */
    public boolean isInvalidatedBy(double close) {
        return kind == PlanZoneKind.SUPPLY ? close > high : close < low;
    }

    /**
     * Same kind, both active, and this band fully covers the other.
     */
    public boolean engulfs(PlanZone other) {
        return kind == other.kind
            && isActive() && other.isActive()
            && high >= other.high && low <= other.low;
    }
}
