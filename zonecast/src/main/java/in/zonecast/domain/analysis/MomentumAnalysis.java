package in.zonecast.domain.analysis;

/**
 * Momentum oscillators for one candle.
 */
public record MomentumAnalysis(
    long timestamp,
    double rsi,
    double stochasticsK,
    double stochasticsD,
    double williamsR,
    double cci
) {
    public boolean isRsiOverbought() {
        return rsi > 70.0;
    }

    public boolean isRsiOversold() {
        return rsi < 30.0;
    }

    public boolean isStochasticsOverbought() {
        return stochasticsK > 80.0 || stochasticsD > 80.0;
    }

    public boolean isStochasticsOversold() {
        return stochasticsK < 20.0 || stochasticsD < 20.0;
    }

    public boolean isWilliamsROverbought() {
        return williamsR > -20.0;
    }

    public boolean isWilliamsROversold() {
        return williamsR < -80.0;
    }

    public boolean isCciOverbought() {
        return cci > 100.0;
    }

    public boolean isCciOversold() {
        return cci < -100.0;
    }
}
