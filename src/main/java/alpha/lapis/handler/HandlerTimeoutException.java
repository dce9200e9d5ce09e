package alpha.lapis.handler;

import java.time.Duration;

/**
 * A {@link RequestHandler} did not complete within the configured handler
 * timeout.
 *
 * @see alpha.lapis.Config#timeoutHandler()
 */
public class HandlerTimeoutException extends HandlerExecutionException
{
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a {@code HandlerTimeoutException}.
     *
     * @param timeout that elapsed
     * @param cause of the timeout (typically a {@code TimeoutException})
     */
    public HandlerTimeoutException(Duration timeout, Throwable cause) {
        super("Handler timed out after " + timeout + ".", cause);
    }
}
