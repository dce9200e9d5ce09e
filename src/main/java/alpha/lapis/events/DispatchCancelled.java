package alpha.lapis.events;

import alpha.lapis.message.RawRequest;

/**
 * The client disconnected before the response was sent. The handler's stage
 * was cancelled and no response is written.<p>
 *
 * The attachment is the {@link RawRequest}.
 */
public enum DispatchCancelled {
    /**
     * A singleton instance representing the event.
     */
    INSTANCE;
}
