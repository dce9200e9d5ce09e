package alpha.lapis.transport;

import alpha.lapis.message.Response;

/**
 * Thrown by the {@link RequestReader} if the request can not be accepted. The
 * exception carries the response to send before closing the connection.
 */
final class RequestRejectedException extends Exception
{
    private static final long serialVersionUID = 1L;

    private final transient Response response;

    RequestRejectedException(String message, Response response) {
        super(message);
        this.response = response;
    }

    Response response() {
        return response;
    }
}
