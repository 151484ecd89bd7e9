package in.zonecast.domain.regime;

/**
 * Market regimes used for strategy selection.
 */
public enum MarketRegime {
    TRENDING_HIGH(true),    // strong trend, high volatility
    TRENDING_LOW(true),     // strong trend, low volatility
    RANGING_TIGHT(true),    // weak trend, low volatility
    RANGING_WIDE(false),    // weak trend, high volatility (chop)
    BREAKOUT(true),         // band squeeze with rising ATR
    UNKNOWN(false);         // not enough history

    private final boolean tradable;

    MarketRegime(boolean tradable) {
        this.tradable = tradable;
    }

    public boolean isTradable() {
        return tradable;
    }

    public boolean isTrending() {
        return this == TRENDING_HIGH || this == TRENDING_LOW;
    }

    public boolean isRanging() {
        return this == RANGING_TIGHT || this == RANGING_WIDE;
    }
}
