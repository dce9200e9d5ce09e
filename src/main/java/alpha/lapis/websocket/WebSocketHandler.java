package alpha.lapis.websocket;

/**
 * Application logic conversing with a client over a WebSocket.<p>
 *
 * The handler is bound to a route using the key "WEBSOCKET". It is invoked
 * once per upgraded connection, on a server thread, and may block on the
 * {@link Portal} for as long as the conversation lasts:
 *
 * <pre>{@code
 *   WebSocketHandler echo = portal -> {
 *       while (!portal.isClosed()) {
 *           Message m = portal.receive();
 *           if (m.isText()) {
 *               portal.send(m.text());
 *           } else {
 *               portal.send(m.bytes());
 *           }
 *       }
 *   };
 * }</pre>
 *
 * When the handler returns, the server closes the portal with {@link
 * CloseCode#NORMAL_CLOSURE} unless it is already closed. If the handler
 * throws, the portal is closed with {@link CloseCode#INTERNAL_ERROR}, except
 * for a {@link PortalClosedException} or an {@link InvalidFrameException}
 * thrown out of the handler; the client ended the conversation, and the
 * exception is only logged at debug level.<p>
 *
 * The handler may be invoked concurrently for different connections and
 * must be thread-safe.
 */
@FunctionalInterface
public interface WebSocketHandler
{
    /**
     * Converse with the client.
     *
     * @param portal to the client
     * @throws Exception for any reason
     */
    void handle(Portal portal) throws Exception;
}
