package in.zonecast.domain.event;

import in.zonecast.domain.common.Phase;

/**
 * An event tagged with the phase that produced it.
 */
public record PhaseEvent(Phase phase, Event event) {

    public long timestamp() {
        return event.timestamp();
    }
}
