package alpha.lapis.route;

import alpha.lapis.HttpConstants.Method;
import alpha.lapis.handler.ErrorHandler;

import java.util.Set;

/**
 * Thrown by {@link Match#handler(String)} if the requested HTTP method has no
 * handler bound to the matched route.<p>
 *
 * {@link ErrorHandler#DEFAULT} maps this exception to a "405 Method Not
 * Allowed" response with an "Allow" header listing {@link #getAllowed()}.
 */
public class MethodNotAllowedException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    private final String method;
    private final String pattern;
    private final transient Set<Method> allowed;

    /**
     * Constructs a {@code MethodNotAllowedException}.
     *
     * @param method token of the request
     * @param pattern of the matched route
     * @param allowed methods of the matched route (iteration order retained)
     */
    public MethodNotAllowedException(String method, String pattern, Set<Method> allowed) {
        super("No handler bound for method token \"" + method + "\" on route \"" + pattern + "\".");
        this.method = method;
        this.pattern = pattern;
        this.allowed = allowed;
    }

    /**
     * Returns the method token of the request.
     *
     * @return the method token of the request
     */
    public String getMethod() {
        return method;
    }

    /**
     * Returns the pattern of the matched route.
     *
     * @return the pattern of the matched route
     */
    public String getPattern() {
        return pattern;
    }

    /**
     * Returns the methods that the matched route has handlers for, in the
     * declaration order of {@link Method}.
     *
     * @return allowed methods (empty if the route only binds a WebSocket
     *         handler)
     */
    public Set<Method> getAllowed() {
        return allowed;
    }
}
