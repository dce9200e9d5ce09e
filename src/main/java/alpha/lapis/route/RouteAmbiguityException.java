package alpha.lapis.route;

/**
 * Thrown by the {@link RouteCompiler} if the directory layout describes routes
 * that can not be told apart, or a catch-all segment that is not terminal.<p>
 *
 * For example, two sibling directories "[id]" and "[name]" both match any
 * segment in the same position, and a catch-all directory "[...rest]" with a
 * subdirectory could never have the subdirectory reached.
 */
public class RouteAmbiguityException extends RouteCompilationException
{
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a {@code RouteAmbiguityException}.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public RouteAmbiguityException(String message) {
        super(message);
    }
}
