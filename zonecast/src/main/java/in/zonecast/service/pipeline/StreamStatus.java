package in.zonecast.service.pipeline;

/**
 * IDLE, then STREAMING, then COMPLETED or CANCELLED.
 */
public enum StreamStatus {
    IDLE,
    STREAMING,
    COMPLETED,
    CANCELLED;

    public boolean isFinished() {
        return this == COMPLETED || this == CANCELLED;
    }
}
