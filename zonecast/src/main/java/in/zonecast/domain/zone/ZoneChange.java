package in.zonecast.domain.zone;

/**
 * What happened to a zone or extreme in the step that emitted it.
 */
public enum ZoneChange {
    CREATED,
    UPDATED,
    CLOSED
}
