package alpha.lapis.websocket;

/**
 * The client sent a frame that breaks the protocol, or a message the server
 * will not accept. The portal was closed with the {@link #closeCode() close
 * code} of this exception.
 */
public class InvalidFrameException extends WebSocketException
{
    private static final long serialVersionUID = 1L;

    private final int closeCode;

    /**
     * Constructs an {@code InvalidFrameException}.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     * @param closeCode sent to the client
     */
    public InvalidFrameException(String message, int closeCode) {
        super(message);
        this.closeCode = closeCode;
    }

    /**
     * Returns the close code sent to the client.
     *
     * @return the close code sent to the client
     * @see CloseCode
     */
    public int closeCode() {
        return closeCode;
    }
}
