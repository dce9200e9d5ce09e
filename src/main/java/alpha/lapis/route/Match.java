package alpha.lapis.route;

import alpha.lapis.HttpConstants.Method;
import alpha.lapis.handler.RequestHandler;
import alpha.lapis.websocket.WebSocketHandler;

import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The result of a successful {@link PathMatcher#match(RouteTree, String)
 * match}; a bound node and the path parameters extracted from the request
 * path.
 */
public final class Match
{
    private final RouteNode node;
    private final Map<String, String> params;

    Match(RouteNode node, Map<String, String> params) {
        this.node = requireNonNull(node);
        this.params = Map.copyOf(params);
    }

    /**
     * Returns the matched node.
     *
     * @return the matched node (always bound)
     */
    public RouteNode node() {
        return node;
    }

    /**
     * Returns the percent-decoded path parameters, keyed by name.<p>
     *
     * The value of a catch-all parameter is all remaining request path
     * segments joined with '/', without a leading '/'.
     *
     * @return path parameters (unmodifiable)
     */
    public Map<String, String> params() {
        return params;
    }

    /**
     * Returns the handler bound to the given method token.
     *
     * @param method token of request (case-sensitive)
     * @return the handler
     * @throws MethodNotAllowedException
     *             if the token is not a known method, or
     *             no handler is bound to it
     */
    public RequestHandler handler(String method) {
        return Method.of(method)
                .flatMap(node.bindings()::get)
                .orElseThrow(() -> new MethodNotAllowedException(
                        method, node.pattern(), node.bindings().allowed()));
    }

    /**
     * Returns the WebSocket handler of the matched node.
     *
     * @return the WebSocket handler, or empty if none is bound
     */
    public Optional<WebSocketHandler> webSocketHandler() {
        return node.bindings().webSocket();
    }

    @Override
    public String toString() {
        return Match.class.getSimpleName() + "{" +
                "pattern='" + node.pattern() + '\'' +
                ", params=" + params + '}';
    }
}
