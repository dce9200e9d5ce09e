package alpha.lapis.events;

import alpha.lapis.message.RawRequest;

/**
 * A dispatch was still running when the server's graceful stop period
 * elapsed. The handler's stage was cancelled and no response is written.<p>
 *
 * The attachment is the {@link RawRequest}.
 */
public enum DispatchAbandoned {
    /**
     * A singleton instance representing the event.
     */
    INSTANCE;
}
