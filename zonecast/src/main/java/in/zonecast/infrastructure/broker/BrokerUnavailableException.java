package in.zonecast.infrastructure.broker;

/**
 * Transient broker failure that persisted through every retry attempt.
 */
public class BrokerUnavailableException extends RuntimeException {

    private final String path;
    private final int attempts;

    public BrokerUnavailableException(String path, int attempts, String lastError) {
        super(String.format("Broker request %s unavailable after %d attempts: %s", path, attempts, lastError));
        this.path = path;
        this.attempts = attempts;
    }

    public BrokerUnavailableException(String path, int attempts, String lastError, Throwable cause) {
        super(String.format("Broker request %s unavailable after %d attempts: %s", path, attempts, lastError), cause);
        this.path = path;
        this.attempts = attempts;
    }

    public String getPath() {
        return path;
    }

    public int getAttempts() {
        return attempts;
    }
}
