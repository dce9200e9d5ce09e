package alpha.lapis.transport;

import alpha.lapis.message.RawRequest;
import alpha.lapis.message.SerializedResponse;
import alpha.lapis.websocket.Portal;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * One request/response pair delivered by a {@link Transport}.<p>
 *
 * The server reads the request, dispatches it, and writes at most one
 * response, unless the exchange is {@link #upgrade(RawRequest, Map)
 * upgraded} to a WebSocket. The exchange is closed by the server when
 * done.<p>
 *
 * {@link #read()} and {@link #write(SerializedResponse)} are called by the
 * same dispatch unit, never concurrently. {@link #disconnected()} and {@link
 * #close()} may be called by any thread.
 */
public interface Exchange extends Closeable
{
    /**
     * Read the request.<p>
     *
     * An empty optional is returned if the transport rejected the request
     * (for example because it was malformed or too large), in which case the
     * transport has already written an error response and closed the
     * exchange. An empty optional is also returned if the client closed the
     * connection before sending a complete request.
     *
     * @return the request, or empty if there's nothing to dispatch
     * @throws IOException if an I/O error occurs
     */
    Optional<RawRequest> read() throws IOException;

    /**
     * Write the response.
     *
     * @param response to write
     * @return the number of bytes written
     * @throws IOException if an I/O error occurs
     */
    long write(SerializedResponse response) throws IOException;

    /**
     * Perform the WebSocket opening handshake and switch the connection to
     * WebSocket frames.<p>
     *
     * The handshake response is written by this method. If the handshake is
     * rejected, an empty optional is returned and the exchange is closed.
     * Otherwise the returned portal owns the connection, and {@link
     * #write(SerializedResponse)} must not be called again.
     *
     * @param request that asked for the upgrade
     * @param params path parameters of the matched route
     * @return the portal, or empty if the handshake was rejected
     * @throws IOException if an I/O error occurs
     * @see alpha.lapis.websocket.WebSocketHandshake
     */
    Optional<Portal> upgrade(RawRequest request, Map<String, String> params) throws IOException;

    /**
     * Returns {@code true} if the exchange is open.
     *
     * @return {@code true} if the exchange is open
     */
    boolean isOpen();

    /**
     * Returns a stage that completes when the client disconnects or the
     * exchange is closed.<p>
     *
     * Must only be called after a request has been {@link #read()}.
     * Detection of a client disconnect is best-effort.
     *
     * @return a stage that completes on disconnect
     */
    CompletionStage<Void> disconnected();

    /**
     * Close the exchange.<p>
     *
     * This method is idempotent.
     */
    @Override
    void close();
}
