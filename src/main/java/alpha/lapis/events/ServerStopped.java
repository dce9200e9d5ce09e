package alpha.lapis.events;

import java.time.Instant;

/**
 * Server stopped.<p>
 *
 * The event is emitted after the listening port has closed and all
 * dispatches have completed or been abandoned. The first attachment is the
 * {@link Instant} when the server stopped and the second attachment the
 * {@link Instant} when the server started.
 */
public enum ServerStopped {
    /**
     * A singleton instance representing the event.
     */
    INSTANCE;
}
