package in.zonecast.domain.data;

import java.time.Duration;

/**
 * Candle resolutions requested from a CandleSource.
 */
public enum Resolution {
    ONE_MINUTE(Duration.ofMinutes(1)),
    FIVE_MINUTES(Duration.ofMinutes(5));

    private final Duration duration;

    Resolution(Duration duration) {
        this.duration = duration;
    }

    public Duration duration() {
        return duration;
    }

    public long millis() {
        return duration.toMillis();
    }
}
