/**
 * WebSocket (RFC 6455) conversations.<p>
 *
 * A route binds a {@link alpha.lapis.websocket.WebSocketHandler
 * WebSocketHandler} with the key "WEBSOCKET" in its leaf. A request to the
 * route that asks to upgrade the connection goes through the {@link
 * alpha.lapis.websocket.WebSocketHandshake opening handshake}, after which
 * the handler talks to the client through a {@link
 * alpha.lapis.websocket.Portal Portal}.<p>
 *
 * Extensions and subprotocols are not negotiated.
 */
package alpha.lapis.websocket;
