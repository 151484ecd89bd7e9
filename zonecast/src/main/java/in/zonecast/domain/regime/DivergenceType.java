package in.zonecast.domain.regime;

public enum DivergenceType {
    NONE,
    BULLISH,
    BEARISH
}
