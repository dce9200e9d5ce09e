package alpha.lapis.message;

import alpha.lapis.handler.ErrorHandler;

/**
 * Thrown by the server if the request could not be interpreted, for example
 * because the request path has a malformed percent-encoding.<p>
 *
 * {@link ErrorHandler#DEFAULT} translates this exception to a "400 Bad
 * Request" response.
 */
public class BadRequestException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a {@code BadRequestException}.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String, Throwable)}
     * @param cause passed as-is to {@link Throwable#Throwable(String, Throwable)}
     */
    public BadRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
