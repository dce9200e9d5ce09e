package alpha.lapis.route;

import alpha.lapis.HttpConstants.Method;
import alpha.lapis.handler.RequestHandler;
import alpha.lapis.websocket.WebSocketHandler;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The handlers bound to a route node; one per HTTP method, and at most one
 * WebSocket handler.<p>
 *
 * Iteration order is the declaration order of {@link Method}. The bindings
 * are immutable.
 */
public final class HandlerBindings
{
    static final HandlerBindings EMPTY = new HandlerBindings(new EnumMap<>(Method.class), null);

    private final Map<Method, RequestHandler> handlers;
    private final WebSocketHandler webSocket;

    HandlerBindings(EnumMap<Method, RequestHandler> handlers, WebSocketHandler webSocket) {
        this.handlers = Collections.unmodifiableMap(new EnumMap<>(handlers));
        this.webSocket = webSocket;
    }

    /**
     * Returns the handler bound to the given method.
     *
     * @param method of request
     * @return the handler, or empty if none is bound
     */
    public Optional<RequestHandler> get(Method method) {
        return Optional.ofNullable(handlers.get(method));
    }

    /**
     * Returns the WebSocket handler.
     *
     * @return the WebSocket handler, or empty if none is bound
     */
    public Optional<WebSocketHandler> webSocket() {
        return Optional.ofNullable(webSocket);
    }

    /**
     * Returns the methods that have a handler bound.<p>
     *
     * A bound WebSocket handler is not a method and not included.
     *
     * @return bound methods (unmodifiable, in {@link Method} order)
     */
    public Set<Method> allowed() {
        return handlers.keySet();
    }

    /**
     * Returns {@code true} if no handler is bound, including no WebSocket
     * handler.
     *
     * @return {@code true} if no handler is bound
     */
    public boolean isEmpty() {
        return handlers.isEmpty() && webSocket == null;
    }

    /**
     * Returns all method bindings.
     *
     * @return all method bindings (unmodifiable, in {@link Method} order)
     */
    public Map<Method, RequestHandler> asMap() {
        return handlers;
    }

    @Override
    public String toString() {
        return webSocket == null ? allowed().toString() :
                allowed() + "+" + HandlerDeclaration.WEBSOCKET;
    }
}
