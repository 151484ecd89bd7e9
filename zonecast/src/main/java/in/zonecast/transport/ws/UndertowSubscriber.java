package in.zonecast.transport.ws;

import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Subscriber backed by an Undertow WebSocket channel.
 */
final class UndertowSubscriber implements Subscriber {
    private static final Logger log = LoggerFactory.getLogger(UndertowSubscriber.class);

    private final String id;
    private final WebSocketChannel channel;

    UndertowSubscriber(String id, WebSocketChannel channel) {
        this.id = id;
        this.channel = channel;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(String message) throws IOException {
        if (!channel.isOpen()) {
            throw new IOException("Channel closed");
        }
        WebSockets.sendTextBlocking(message, channel);
    }

    @Override
    public void close() {
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("WS close failed for {}: {}", id, e.getMessage());
        }
    }
}
