package alpha.lapis.route;

/**
 * Thrown by the {@link RouteCompiler} if a route tree could not be compiled.
 * No partial tree is ever produced.<p>
 *
 * This exception is used as-is if reading the {@link RouteSource} failed, in
 * which case the cause is the {@code IOException}. Validation failures are
 * reported using a subclass.
 *
 * @see RouteAmbiguityException
 * @see HandlerBindingException
 */
public class RouteCompilationException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a {@code RouteCompilationException}.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public RouteCompilationException(String message) {
        super(message);
    }

    /**
     * Constructs a {@code RouteCompilationException}.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String, Throwable)}
     * @param cause passed as-is to {@link Throwable#Throwable(String, Throwable)}
     */
    public RouteCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
