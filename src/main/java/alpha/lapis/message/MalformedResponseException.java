package alpha.lapis.message;

import alpha.lapis.handler.ErrorHandler;
import alpha.lapis.handler.RequestHandler;

/**
 * Thrown by the dispatcher if a {@link RequestHandler} produced a response
 * that can not be sent. For example, the handler returned {@code null}, the
 * status code is out of range, a header has a line break in it, or the
 * response has a body although the status code forbids one.<p>
 *
 * This is a violation of the handler contract, as opposed to the handler
 * failing. {@link ErrorHandler#DEFAULT} translates this exception to a "500
 * Internal Server Error" response.
 */
public class MalformedResponseException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    private final transient Response response;

    /**
     * Constructs a {@code MalformedResponseException}.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     * @param response the offending response (may be {@code null})
     */
    public MalformedResponseException(String message, Response response) {
        super(message);
        this.response = response;
    }

    /**
     * Returns the offending response.
     *
     * @return the offending response (may be {@code null})
     */
    public Response getResponse() {
        return response;
    }
}
