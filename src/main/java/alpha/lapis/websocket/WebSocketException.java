package alpha.lapis.websocket;

/**
 * Base class of the exceptions thrown by a {@link Portal}.
 */
public class WebSocketException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a {@code WebSocketException}.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public WebSocketException(String message) {
        super(message);
    }
}
