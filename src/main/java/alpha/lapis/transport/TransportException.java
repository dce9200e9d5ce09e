package alpha.lapis.transport;

/**
 * The connection of an exchange was lost while the request was being
 * dispatched, or the exchange was abandoned by the server.<p>
 *
 * The dispatch is abandoned and never retried. No response is written.
 */
public class TransportException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a {@code TransportException}.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public TransportException(String message) {
        super(message);
    }

    /**
     * Constructs a {@code TransportException}.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String, Throwable)}
     * @param cause passed as-is to {@link Throwable#Throwable(String, Throwable)}
     */
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
