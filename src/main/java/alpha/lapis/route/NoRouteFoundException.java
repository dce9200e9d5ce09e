package alpha.lapis.route;

import alpha.lapis.handler.ErrorHandler;

/**
 * Thrown by the {@link PathMatcher} if no bound node matches the request
 * path. {@link ErrorHandler#DEFAULT} maps this exception to a "404 Not Found"
 * response.
 */
public class NoRouteFoundException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    private final String path;

    /**
     * Constructs a {@code NoRouteFoundException}.
     *
     * @param path of request (normalized)
     */
    public NoRouteFoundException(String path) {
        super("No route found for path \"" + path + "\".");
        this.path = path;
    }

    /**
     * Returns the normalized request path for which no route was found.
     *
     * @return the request path (never {@code null} or the empty string)
     */
    public String getPath() {
        return path;
    }
}
