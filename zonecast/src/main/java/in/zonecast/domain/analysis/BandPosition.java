package in.zonecast.domain.analysis;

/**
 * Where the last close sits relative to a channel.
 */
public enum BandPosition {
    ABOVE,
    INSIDE,
    BELOW
}
