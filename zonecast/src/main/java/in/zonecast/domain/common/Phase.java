package in.zonecast.domain.common;

import java.util.Locale;

/**
 * Logical phase label attached to distributed events.
 */
public enum Phase {
    PLANNING,
    PREPARING,
    TRADING;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Phase fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("phase is required");
        }
        return Phase.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
