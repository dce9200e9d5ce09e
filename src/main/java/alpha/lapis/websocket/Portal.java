package alpha.lapis.websocket;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * The server's end of a WebSocket conversation, as given to a {@link
 * WebSocketHandler}.<p>
 *
 * The portal reads frames from the client in the background. A PING from the
 * client is answered with a PONG, and a fragmented message is reassembled
 * before it is made available to {@link #receive()}. A close frame from the
 * client is answered with a close frame carrying the same code, after which
 * the portal is closed.<p>
 *
 * If the client breaks the protocol, the portal closes itself with the close
 * code that describes the failure (for example {@link
 * CloseCode#PROTOCOL_ERROR}) and the next receive throws an {@link
 * InvalidFrameException}.<p>
 *
 * Messages received before the portal closed can still be received. Once
 * they are drained, receiving throws a {@link PortalClosedException}, and so
 * does sending through a closed portal.<p>
 *
 * The portal is thread-safe. Frames sent concurrently are never interleaved.
 */
public interface Portal
{
    /**
     * Returns the percent-decoded path parameters of the route.
     *
     * @return path parameters (unmodifiable)
     */
    Map<String, String> params();

    /**
     * Receive the next message, waiting for as long as it takes.
     *
     * @return the next message
     * @throws PortalClosedException if the portal is closed
     * @throws InvalidFrameException if the portal closed on an invalid frame
     * @throws InterruptedException if interrupted while waiting
     */
    Message receive() throws InterruptedException;

    /**
     * Receive the next message, waiting at most the given duration.
     *
     * @param timeout max time to wait
     * @return the next message
     * @throws NullPointerException if {@code timeout} is {@code null}
     * @throws ReceiveTimeoutException if no message arrives in time
     * @throws PortalClosedException if the portal is closed
     * @throws InvalidFrameException if the portal closed on an invalid frame
     * @throws InterruptedException if interrupted while waiting
     */
    Message receive(Duration timeout) throws InterruptedException;

    /**
     * Send a text message, in one frame.
     *
     * @param text to send
     * @throws NullPointerException if {@code text} is {@code null}
     * @throws PortalClosedException if the portal is closed
     * @throws IOException if an I/O error occurs
     */
    void send(String text) throws IOException;

    /**
     * Send a binary message, in one frame.
     *
     * @param bytes to send
     * @throws NullPointerException if {@code bytes} is {@code null}
     * @throws PortalClosedException if the portal is closed
     * @throws IOException if an I/O error occurs
     */
    void send(byte[] bytes) throws IOException;

    /**
     * Send a PING and wait for a PONG.<p>
     *
     * Any PONG received while waiting counts as the answer, including an
     * unsolicited one.
     *
     * @param timeout max time to wait for the PONG
     * @return {@code true} if a PONG arrived in time, otherwise {@code false}
     *         (which includes the portal closing while waiting)
     * @throws NullPointerException if {@code timeout} is {@code null}
     * @throws PortalClosedException if the portal is closed
     * @throws IOException if an I/O error occurs
     * @throws InterruptedException if interrupted while waiting
     */
    boolean ping(Duration timeout) throws IOException, InterruptedException;

    /**
     * Close the portal with {@link CloseCode#NORMAL_CLOSURE}.<p>
     *
     * This method is idempotent.
     */
    void close();

    /**
     * Close the portal.<p>
     *
     * A close frame with the given code is sent, best-effort, and the
     * connection is closed. This method has no effect if the portal is
     * already closed.
     *
     * @param code sent to the client
     * @throws IllegalArgumentException
     *             if {@code code} may not be sent in a close frame
     * @see CloseCode#isSendable(int)
     */
    void close(int code);

    /**
     * Returns {@code true} if the portal is closed.
     *
     * @return {@code true} if the portal is closed
     */
    boolean isClosed();
}
