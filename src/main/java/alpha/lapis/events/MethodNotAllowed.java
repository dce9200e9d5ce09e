package alpha.lapis.events;

import alpha.lapis.message.RawRequest;
import alpha.lapis.route.MethodNotAllowedException;

/**
 * A request path matched a route, but the route has no handler bound to the
 * request method; the response will be "405 Method Not Allowed".<p>
 *
 * The first attachment is the {@link RawRequest} and the second attachment
 * is the {@link MethodNotAllowedException}.
 */
public enum MethodNotAllowed {
    /**
     * A singleton instance representing the event.
     */
    INSTANCE;
}
