package alpha.lapis.events;

import alpha.lapis.message.RawRequest;

/**
 * A WebSocket handler returned, or threw, and the portal has been closed.<p>
 *
 * The first attachment is the {@link RawRequest} that asked for the upgrade.
 * The second attachment is the {@link Throwable} thrown by the handler, or
 * {@code null} if the handler returned normally.
 */
public enum WebSocketClosed {
    /**
     * A singleton instance representing the event.
     */
    INSTANCE;
}
