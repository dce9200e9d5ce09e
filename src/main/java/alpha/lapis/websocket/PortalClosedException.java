package alpha.lapis.websocket;

/**
 * Thrown when receiving from or sending through a {@link Portal} that is
 * closed.
 */
public class PortalClosedException extends WebSocketException
{
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a {@code PortalClosedException}.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public PortalClosedException(String message) {
        super(message);
    }
}
