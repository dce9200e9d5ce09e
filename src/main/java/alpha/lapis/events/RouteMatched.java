package alpha.lapis.events;

import alpha.lapis.message.RawRequest;
import alpha.lapis.route.Match;

/**
 * A request path matched a bound route.<p>
 *
 * The first attachment is the {@link RawRequest} and the second attachment
 * is the {@link Match}.
 */
public enum RouteMatched {
    /**
     * A singleton instance representing the event.
     */
    INSTANCE;
}
