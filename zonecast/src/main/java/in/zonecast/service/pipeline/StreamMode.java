package in.zonecast.service.pipeline;

import java.util.Locale;

public enum StreamMode {
    LIVE,
    REPLAY;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
