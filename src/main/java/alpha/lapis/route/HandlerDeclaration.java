package alpha.lapis.route;

import alpha.lapis.handler.RequestHandler;
import alpha.lapis.websocket.WebSocketHandler;

import static java.util.Objects.requireNonNull;

/**
 * One handler declared by a leaf; a key and the handler.<p>
 *
 * The key of a {@link RequestHandler} is an HTTP method token, which is
 * validated by the {@link RouteCompiler}, not by this class. A {@link
 * WebSocketHandler} is always declared with the key {@value #WEBSOCKET}.
 * Exactly one of the two handlers is present.
 *
 * @param method key as declared (case-sensitive)
 * @param handler the request handler, or {@code null} if this declares a
 *                WebSocket handler
 * @param webSocketHandler the WebSocket handler, or {@code null}
 */
public record HandlerDeclaration(
        String method, RequestHandler handler, WebSocketHandler webSocketHandler)
{
    /** The leaf key of a WebSocket handler. */
    public static final String WEBSOCKET = "WEBSOCKET";

    /**
     * Constructs a {@code HandlerDeclaration}.
     *
     * @param method key as declared (case-sensitive)
     * @param handler the request handler
     * @param webSocketHandler the WebSocket handler
     * @throws NullPointerException if {@code method} is {@code null}
     * @throws IllegalArgumentException
     *             if not exactly one handler is given, or if a WebSocket
     *             handler is declared with another key than {@value #WEBSOCKET}
     */
    public HandlerDeclaration {
        requireNonNull(method);
        if ((handler == null) == (webSocketHandler == null)) {
            throw new IllegalArgumentException("Exactly one handler must be given.");
        }
        if (webSocketHandler != null && !method.equals(WEBSOCKET)) {
            throw new IllegalArgumentException(
                    "WebSocket handler declared with key \"" + method + "\".");
        }
    }

    /**
     * Constructs a {@code HandlerDeclaration} of a request handler.
     *
     * @param method token as declared (case-sensitive)
     * @param handler the handler
     * @throws NullPointerException if any argument is {@code null}
     */
    public HandlerDeclaration(String method, RequestHandler handler) {
        this(method, requireNonNull(handler), null);
    }

    /**
     * Constructs a {@code HandlerDeclaration} of a WebSocket handler.
     *
     * @param handler the handler
     * @return a new declaration
     * @throws NullPointerException if {@code handler} is {@code null}
     */
    public static HandlerDeclaration webSocket(WebSocketHandler handler) {
        return new HandlerDeclaration(WEBSOCKET, null, requireNonNull(handler));
    }

    /**
     * Returns {@code true} if this declares a WebSocket handler.
     *
     * @return {@code true} if this declares a WebSocket handler
     */
    public boolean isWebSocket() {
        return webSocketHandler != null;
    }
}
