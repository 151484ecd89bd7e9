package in.zonecast.domain.regime;

/**
 * Five-component setup score. Each component is clamped to [0, 20], so the total is in [0, 100].
 */
public record SignalScore(
    int trendAlignment,
    int volumeConfirmation,
    int momentumConvergence,
    int volatilityContext,
    int regimeFit
) {
    public static final int COMPONENT_MAX = 20;

    public SignalScore {
        trendAlignment = clamp(trendAlignment);
        volumeConfirmation = clamp(volumeConfirmation);
        momentumConvergence = clamp(momentumConvergence);
        volatilityContext = clamp(volatilityContext);
        regimeFit = clamp(regimeFit);
    }

    public int total() {
        return trendAlignment + volumeConfirmation + momentumConvergence + volatilityContext + regimeFit;
    }

    public boolean passes(int threshold) {
        return total() >= threshold;
    }

    /**
     * Bucket label used to group orders by score in reports.
     */
    public String bucket() {
        int total = total();
        if (total >= 90) return "Score90+";
        if (total >= 85) return "Score85-89";
        if (total >= 80) return "Score80-84";
        if (total >= 75) return "Score75-79";
        return "Score<75";
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(COMPONENT_MAX, value));
    }
}
