package in.zonecast.transport.ws;

import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Undertow WebSocket handler. Each callback only forwards a command to the distributor.
 */
public final class WsEndpoint {
    private static final Logger log = LoggerFactory.getLogger(WsEndpoint.class);

    private final EventDistributor distributor;

    public WsEndpoint(EventDistributor distributor) {
        this.distributor = distributor;
    }

    public WebSocketProtocolHandshakeHandler websocketHandler() {
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                String subscriberId = UUID.randomUUID().toString();
                log.info("WS connected: {} (subscriber={})", channel.getSourceAddress(), subscriberId);
                distributor.connect(new UndertowSubscriber(subscriberId, channel));

                channel.getReceiveSetter().set(new AbstractReceiveListener() {
                    @Override
                    protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                        distributor.inbound(subscriberId, message.getData());
                    }

                    @Override
                    protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                        log.info("WS disconnected: {} (subscriber={})", ch.getSourceAddress(), subscriberId);
                        distributor.disconnect(subscriberId);
                        super.onCloseMessage(cm, ch);
                    }

                    @Override
                    protected void onError(WebSocketChannel ch, Throwable error) {
                        log.warn("WS error on {}: {}", subscriberId, error.toString());
                        distributor.disconnect(subscriberId);
                    }
                });

                channel.resumeReceives();
            }
        });
    }
}
