package in.zonecast.domain.event;

import in.zonecast.domain.common.EventType;

/**
 * Event produced by the pipeline. Each variant is tagged by one {@link EventType} constant.
 */
public interface Event {

    EventType eventType();

    long timestamp();

    /**
     * The domain object serialized under {@link EventType#payloadField()}.
     */
    Object payload();
}
