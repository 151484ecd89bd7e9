package in.zonecast.transport.ws;

/**
 * Inbound control text that cannot be parsed or names an unknown command.
 */
public class ControlMessageException extends RuntimeException {

    private final String raw;

    public ControlMessageException(String message, String raw) {
        super(message);
        this.raw = raw;
    }

    public ControlMessageException(String message, String raw, Throwable cause) {
        super(message, cause);
        this.raw = raw;
    }

    public String getRaw() {
        return raw;
    }
}
