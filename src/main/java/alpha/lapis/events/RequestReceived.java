package alpha.lapis.events;

import alpha.lapis.message.RawRequest;

/**
 * A request was received and is about to be dispatched.<p>
 *
 * The attachment is the {@link RawRequest}.
 */
public enum RequestReceived {
    /**
     * A singleton instance representing the event.
     */
    INSTANCE;
}
