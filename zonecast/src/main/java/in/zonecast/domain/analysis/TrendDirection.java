package in.zonecast.domain.analysis;

/**
 * Trend direction derived from DI dominance and ADX strength.
 */
public enum TrendDirection {
    UP,
    DOWN,
    DOJI
}
