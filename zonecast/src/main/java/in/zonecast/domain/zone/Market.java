package in.zonecast.domain.zone;

/**
 * Market sessions whose daytime extremes are tracked as liquidity levels.
 */
public enum Market {
    NEW_YORK,
    ASIA,
    LONDON
}
