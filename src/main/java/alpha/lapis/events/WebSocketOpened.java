package alpha.lapis.events;

import alpha.lapis.message.RawRequest;
import alpha.lapis.websocket.Portal;

/**
 * The WebSocket opening handshake succeeded and the route's WebSocket handler
 * is about to be invoked.<p>
 *
 * The first attachment is the {@link RawRequest} that asked for the upgrade
 * and the second attachment is the {@link Portal}.
 */
public enum WebSocketOpened {
    /**
     * A singleton instance representing the event.
     */
    INSTANCE;
}
