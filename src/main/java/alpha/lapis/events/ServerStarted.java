package alpha.lapis.events;

import java.time.Instant;

/**
 * Server started.<p>
 *
 * The event is emitted as soon as the server's listening port has opened. It
 * has one {@link Instant} attachment which is when the server started.
 */
public enum ServerStarted {
    /**
     * A singleton instance representing the event.
     */
    INSTANCE;
}
