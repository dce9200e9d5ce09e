package alpha.lapis.handler;

/**
 * A {@link RequestHandler} failed to produce a response.<p>
 *
 * The exception thrown by the handler, or used to complete the handler's
 * stage exceptionally, is available as the cause. {@link ErrorHandler#DEFAULT}
 * translates this exception to a "500 Internal Server Error" response.
 */
public class HandlerExecutionException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a {@code HandlerExecutionException}.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String, Throwable)}
     * @param cause passed as-is to {@link Throwable#Throwable(String, Throwable)}
     */
    public HandlerExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
