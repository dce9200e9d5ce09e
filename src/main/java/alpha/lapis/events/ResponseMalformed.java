package alpha.lapis.events;

import alpha.lapis.message.MalformedResponseException;
import alpha.lapis.message.RawRequest;

/**
 * A request handler produced a response that violates the handler
 * contract; the response will be "500 Internal Server Error".<p>
 *
 * The first attachment is the {@link RawRequest} and the second attachment
 * is the {@link MalformedResponseException}.
 */
public enum ResponseMalformed {
    /**
     * A singleton instance representing the event.
     */
    INSTANCE;
}
