package in.zonecast.domain.regime;

/**
 * Volume-based confirmation for a candidate trade. {@code confirmation} is 0-1.
 */
public record VolumeConfluenceSignal(
    boolean volumeSpike,
    boolean massiveSpike,
    DivergenceType divergence,
    boolean accumulation,
    boolean distribution,
    double confirmation,
    long timestamp
) {
    public static VolumeConfluenceSignal neutral(long timestamp) {
        return new VolumeConfluenceSignal(false, false, DivergenceType.NONE, false, false, 0.5, timestamp);
    }

    public boolean hasDivergence() {
        return divergence != DivergenceType.NONE;
    }
}
