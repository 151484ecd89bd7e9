package in.zonecast.transport.ws;

import java.io.IOException;

/**
 * A connected client of the {@link EventDistributor}. Only the distributor thread calls these.
 */
public interface Subscriber {

    String id();

    void send(String message) throws IOException;

    void close();
}
