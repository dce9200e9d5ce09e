package alpha.lapis;

/**
 * Thrown by {@link Config#load(java.nio.file.Path)} if a configuration value
 * is of the wrong type or out of range.
 */
public class BadConfigException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a {@code BadConfigException}.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public BadConfigException(String message) {
        super(message);
    }

    /**
     * Constructs a {@code BadConfigException}.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String, Throwable)}
     * @param cause passed as-is to {@link Throwable#Throwable(String, Throwable)}
     */
    public BadConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
