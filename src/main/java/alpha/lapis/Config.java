package alpha.lapis;

import alpha.lapis.handler.HandlerTimeoutException;
import alpha.lapis.route.FileSystemRouteSource;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.Properties;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Server configuration.<p>
 *
 * The implementation is immutable and thread-safe.<p>
 *
 * The implementation used if none is specified is {@link #DEFAULT}.<p>
 *
 * Any configuration object can be turned into a builder for customization. The
 * static method {@link #configuration()} is a shortcut for {@code
 * Config.DEFAULT.toBuilder()}.<p>
 *
 * A configuration may also be loaded from a properties file, see {@link
 * #load(Path)}.
 */
public interface Config
{
    /**
     * Values used:<p>
     *
     * Max request head size = 8 000 <br>
     * Max request body size = 20 971 520 (20 MB) <br>
     * Timeout handler = none <br>
     * Timeout graceful stop = 5 seconds <br>
     * Verbose errors = false <br>
     * Server name = none <br>
     * Leaf file name = "route.properties"
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();

    /**
     * Returns the max number of bytes the default transport reads while
     * parsing a request head before giving up.<p>
     *
     * The default value corresponds to <a
     * href="https://tools.ietf.org/html/rfc7230#section-3.1.1">RFC 7230 §3.1.1</a>.
     *
     * @return number of request head bytes processed before rejection
     */
    int maxRequestHeadSize();

    /**
     * Returns the max number of request body bytes the default transport
     * accepts to buffer.<p>
     *
     * A request declaring a larger {@code Content-Length} is answered with
     * "413 Entity Too Large" and never reaches the dispatcher.
     *
     * @return max request body size in bytes
     */
    int maxRequestBodySize();

    /**
     * Returns the max duration a request handler may take to complete its
     * response.<p>
     *
     * There is no timeout by default. If a timeout is configured and elapses,
     * the handler's result stage is cancelled and the dispatch ends with a
     * {@link HandlerTimeoutException}, which by default is translated to a
     * "500 Internal Server Error".
     *
     * @return the handler timeout, if configured
     */
    Optional<Duration> timeoutHandler();

    /**
     * Returns the max duration the server waits for in-flight dispatches to
     * complete after having been asked to stop.<p>
     *
     * Dispatches still running when the duration elapses are cancelled and
     * reported as abandoned.
     *
     * @return graceful stop timeout (default is 5 seconds)
     */
    Duration timeoutGracefulStop();

    /**
     * Returns whether error responses carry details of the failure.<p>
     *
     * If {@code false} (the default), error responses have a body consisting
     * only of the reason phrase. If {@code true}, the exception type and
     * message is appended. This should never be enabled in production.
     *
     * @return whether error responses carry failure details
     */
    boolean verboseErrors();

    /**
     * Returns the value of the {@code Server} header added to each response.
     *
     * @return server name, if configured
     */
    Optional<String> serverName();

    /**
     * Returns the name of the file which declares the handlers of a directory
     * in a {@link FileSystemRouteSource}.
     *
     * @return leaf file name (default is "route.properties")
     */
    String leafFileName();

    /**
     * Returns this object as a builder, for customization.
     *
     * @return this object as a builder
     */
    Config.Builder toBuilder();

    /**
     * Returns the builder used to build the default configuration.
     *
     * @return the builder used to build the default configuration
     * @see #toBuilder()
     */
    static Config.Builder configuration() {
        return DEFAULT.toBuilder();
    }

    /**
     * Loads a configuration from a properties file.<p>
     *
     * Each key is the name of a method in this interface. Keys not recognized
     * are ignored, and values not present retain the {@link #DEFAULT}
     * value. Durations are specified using the ISO-8601 format accepted by
     * {@link Duration#parse(CharSequence)}, for example "PT5S". Booleans must
     * be exactly "true" or "false".
     *
     * <pre>
     *   maxRequestHeadSize = 16000
     *   timeoutHandler     = PT30S
     *   serverName         = Lapis
     * </pre>
     *
     * @param file to load
     * @return the configuration
     * @throws IOException if an I/O error occurs
     * @throws BadConfigException if a value is invalid
     */
    static Config load(Path file) throws IOException {
        Properties p = new Properties();
        try (Reader r = Files.newBufferedReader(file, UTF_8)) {
            p.load(r);
        }
        Builder b = configuration();
        for (String key : p.stringPropertyNames()) {
            final String val = p.getProperty(key).strip();
            switch (key) {
                case "maxRequestHeadSize":
                    b = b.maxRequestHeadSize(toInt(key, val));
                    break;
                case "maxRequestBodySize":
                    b = b.maxRequestBodySize(toInt(key, val));
                    break;
                case "timeoutHandler":
                    b = b.timeoutHandler(toDuration(key, val));
                    break;
                case "timeoutGracefulStop":
                    b = b.timeoutGracefulStop(toDuration(key, val));
                    break;
                case "verboseErrors":
                    b = b.verboseErrors(toBoolean(key, val));
                    break;
                case "serverName":
                    try {
                        b = b.serverName(val);
                    } catch (IllegalArgumentException e) {
                        throw new BadConfigException(
                                "\"serverName\" is not a valid header value.", e);
                    }
                    break;
                case "leafFileName":
                    if (val.isEmpty()) {
                        throw new BadConfigException("\"leafFileName\" must not be empty.");
                    }
                    b = b.leafFileName(val);
                    break;
                default:
                    // Ignored
                    break;
            }
        }
        return b.build();
    }

    private static int toInt(String key, String val) {
        final int i;
        try {
            i = Integer.parseInt(val);
        } catch (NumberFormatException e) {
            throw new BadConfigException("\"" + key + "\" must be of type int.", e);
        }
        if (i <= 0) {
            throw new BadConfigException("\"" + key + "\" must be positive.");
        }
        return i;
    }

    private static Duration toDuration(String key, String val) {
        final Duration d;
        try {
            d = Duration.parse(val);
        } catch (DateTimeParseException e) {
            throw new BadConfigException("\"" + key + "\" must be of type Duration.", e);
        }
        if (d.isNegative() || d.isZero()) {
            throw new BadConfigException("\"" + key + "\" must be positive.");
        }
        return d;
    }

    private static boolean toBoolean(String key, String val) {
        if (val.equals("true")) {
            return true;
        }
        if (val.equals("false")) {
            return false;
        }
        throw new BadConfigException("\"" + key + "\" must be of type boolean.");
    }

    /**
     * Builder of a {@link Config}.<p>
     *
     * The builder is immutable. All setter-like methods return a new builder
     * instance representing the new state. The builder can be used as a
     * template to build many configurations.
     */
    interface Builder {
        /**
         * Set a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#maxRequestHeadSize()
         */
        Builder maxRequestHeadSize(int newVal);

        /**
         * Set a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#maxRequestBodySize()
         */
        Builder maxRequestBodySize(int newVal);

        /**
         * Set a new value.
         *
         * @param newVal new value ({@code null} disables the timeout)
         * @return a new builder representing the new state
         * @see Config#timeoutHandler()
         */
        Builder timeoutHandler(Duration newVal);

        /**
         * Set a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @see Config#timeoutGracefulStop()
         */
        Builder timeoutGracefulStop(Duration newVal);

        /**
         * Set a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#verboseErrors()
         */
        Builder verboseErrors(boolean newVal);

        /**
         * Set a new value.
         *
         * @param newVal new value ({@code null} removes the header)
         * @return a new builder representing the new state
         * @throws IllegalArgumentException
         *             if {@code newVal} is not a valid header value
         * @see Config#serverName()
         */
        Builder serverName(String newVal);

        /**
         * Set a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @see Config#leafFileName()
         */
        Builder leafFileName(String newVal);

        /**
         * Builds the configuration.
         *
         * @return a configuration
         */
        Config build();
    }
}
