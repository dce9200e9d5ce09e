package alpha.lapis.events;

import alpha.lapis.handler.HandlerExecutionException;
import alpha.lapis.message.RawRequest;

/**
 * A request handler threw an exception, completed its stage exceptionally,
 * or timed out. Also emitted when a WebSocket handler throws.<p>
 *
 * The first attachment is the {@link RawRequest} and the second attachment
 * is the {@link HandlerExecutionException}, whose cause is the failure.
 */
public enum HandlerFailed {
    /**
     * A singleton instance representing the event.
     */
    INSTANCE;
}
