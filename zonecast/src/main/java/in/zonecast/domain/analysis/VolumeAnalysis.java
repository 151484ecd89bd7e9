package in.zonecast.domain.analysis;

public record VolumeAnalysis(
    long timestamp,
    VolumeProfile volumeProfile,
    VwapAnalysis vwap,
    double relativeVolume,
    VolumeTrend volumeTrend,
    double onBalanceVolume,
    double volumePriceTrend
) {
    public boolean isHighVolume() {
        return relativeVolume > 1.5;
    }

    public boolean isLowVolume() {
        return relativeVolume < 0.5;
    }

    public boolean isVolumeIncreasing() {
        return volumeTrend == VolumeTrend.INCREASING;
    }

    public VolumeQuality quality() {
        if (isHighVolume() && isVolumeIncreasing()) return VolumeQuality.EXCELLENT;
        if (isHighVolume() || isVolumeIncreasing()) return VolumeQuality.GOOD;
        if (isLowVolume()) return VolumeQuality.POOR;
        return VolumeQuality.NEUTRAL;
    }
}
