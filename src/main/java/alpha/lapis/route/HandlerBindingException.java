package alpha.lapis.route;

/**
 * Thrown by the {@link RouteCompiler} if a leaf declares a handler that can
 * not be bound.<p>
 *
 * This happens if the leaf names an unrecognized HTTP method, declares the
 * same method twice, or names a handler class that can not be loaded.
 */
public class HandlerBindingException extends RouteCompilationException
{
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a {@code HandlerBindingException}.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public HandlerBindingException(String message) {
        super(message);
    }

    /**
     * Constructs a {@code HandlerBindingException}.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String, Throwable)}
     * @param cause passed as-is to {@link Throwable#Throwable(String, Throwable)}
     */
    public HandlerBindingException(String message, Throwable cause) {
        super(message, cause);
    }
}
