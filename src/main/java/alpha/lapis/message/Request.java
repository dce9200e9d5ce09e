package alpha.lapis.message;

import alpha.lapis.handler.RequestHandler;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * An inbound HTTP request, as given to a {@link RequestHandler}.<p>
 *
 * The request is constructed by the server's dispatcher after the request path
 * has been matched against a route. A new instance is created for each request
 * and it is never shared with another dispatch.<p>
 *
 * Path parameters are bound by name from the matched route's dynamic and
 * catch-all segments. A dynamic segment binds exactly one percent-decoded
 * path segment. A catch-all segment binds all remaining percent-decoded path
 * segments joined with '/', without a leading '/'. E.g., route {@code
 * "/files/*path"} and request path {@code "/files/a/b%20c.txt"} yields {@code
 * path = "a/b c.txt"}.<p>
 *
 * The query is parsed into a map of key to all values given for that key, in
 * order of occurrence. Keys and values are percent-decoded, and '+' is
 * decoded as a space. A key without a value ("?flag") is mapped to the empty
 * string.<p>
 *
 * The implementation is immutable and thread-safe.
 */
public interface Request
{
    /**
     * Returns the request method token, e.g. "GET".
     *
     * @return the request method token (never {@code null})
     */
    String method();

    /**
     * Returns the normalized request path.<p>
     *
     * The path is not percent-decoded. Normalization removes at most one
     * trailing slash, unless the path is the root "/".
     *
     * @return the normalized request path (never {@code null} or empty)
     */
    String path();

    /**
     * Returns the request headers.<p>
     *
     * The map is unmodifiable and its keys are compared ignoring case.
     *
     * @return the request headers (never {@code null})
     */
    Map<String, List<String>> headers();

    /**
     * Returns the first value of the given header.
     *
     * @param name of header (case-insensitive)
     * @return the first value, if present
     */
    default Optional<String> header(String name) {
        List<String> v = headers().get(name);
        return v == null || v.isEmpty() ? Optional.empty() : Optional.of(v.get(0));
    }

    /**
     * Returns the raw query component of the request-target.
     *
     * @return the raw query, possibly empty (never {@code null})
     */
    String rawQuery();

    /**
     * Returns the query parameters.
     *
     * @return an unmodifiable map of query keys to values (never {@code null})
     */
    Map<String, List<String>> query();

    /**
     * Returns all values of a query parameter.
     *
     * @param key of parameter
     * @return all values, possibly empty (never {@code null})
     */
    default List<String> queryList(String key) {
        return query().getOrDefault(key, List.of());
    }

    /**
     * Returns the first value of a query parameter.
     *
     * @param key of parameter
     * @return the first value, if present
     */
    default Optional<String> queryFirst(String key) {
        return queryList(key).stream().findFirst();
    }

    /**
     * Returns the path parameters.
     *
     * @return an unmodifiable map of path parameter names to values
     *         (never {@code null})
     */
    Map<String, String> params();

    /**
     * Returns the value of a path parameter.
     *
     * @param name of parameter
     * @return the value, or {@code null} if the route declares no such name
     */
    default String param(String name) {
        return params().get(name);
    }

    /**
     * Returns the request body.<p>
     *
     * Each invocation returns a new copy.
     *
     * @return the request body, possibly empty (never {@code null})
     */
    byte[] body();

    /**
     * Returns the request body decoded using UTF-8.
     *
     * @return the request body as a string
     */
    default String bodyAsString() {
        return new String(body(), UTF_8);
    }
}
