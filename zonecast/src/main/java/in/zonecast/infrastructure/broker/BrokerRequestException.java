package in.zonecast.infrastructure.broker;

/**
 * Definitive broker failure: a non-retryable HTTP status. The request must not be repeated.
 */
public class BrokerRequestException extends RuntimeException {

    private final String path;
    private final int statusCode;
    private final String responseBody;

    public BrokerRequestException(String path, int statusCode, String responseBody) {
        super(String.format("Broker request %s failed with HTTP %d: %s", path, statusCode, responseBody));
        this.path = path;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public String getPath() {
        return path;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
