package alpha.lapis.events;

import alpha.lapis.message.RawRequest;
import alpha.lapis.route.NoRouteFoundException;

/**
 * No route was found for a request path; the response will be "404 Not
 * Found".<p>
 *
 * The first attachment is the {@link RawRequest} and the second attachment
 * is the {@link NoRouteFoundException}.
 */
public enum RouteNotFound {
    /**
     * A singleton instance representing the event.
     */
    INSTANCE;
}
