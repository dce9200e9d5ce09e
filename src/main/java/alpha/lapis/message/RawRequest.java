package alpha.lapis.message;

import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * A request as delivered by the transport, before routing.<p>
 *
 * The path is the raw, not yet normalized and not percent-decoded path
 * component of the request-target. The query is the raw query component,
 * without the leading '?' (empty if absent). Header names retain their
 * original casing and the map iteration order is the order in which the
 * headers were received.<p>
 *
 * The record's components are copied on construction, and {@link #body()}
 * returns a new copy on each invocation.
 *
 * @param method   request method token
 * @param path     raw path
 * @param rawQuery raw query, possibly empty
 * @param headers  request headers (ordered)
 * @param body     request body, possibly empty
 */
public record RawRequest(
        String method,
        String path,
        String rawQuery,
        Map<String, List<String>> headers,
        byte[] body)
{
    private static final byte[] EMPTY = new byte[0];

    /**
     * Constructs a {@code RawRequest}.
     *
     * @throws NullPointerException if {@code method} or {@code path} is {@code null}
     */
    public RawRequest {
        requireNonNull(method, "method");
        requireNonNull(path, "path");
        rawQuery = rawQuery == null ? "" : rawQuery;
        headers = headers == null ? Map.of() : Headers.ordered(headers);
        body = body == null || body.length == 0 ? EMPTY : body.clone();
    }

    /**
     * Returns the body.
     *
     * @return a copy of the body
     */
    @Override
    public byte[] body() {
        return body.length == 0 ? body : body.clone();
    }

    /**
     * Constructs a {@code RawRequest} without query, headers or body.
     *
     * @param method request method token
     * @param path raw path
     * @return a new raw request
     */
    public static RawRequest of(String method, String path) {
        return new RawRequest(method, path, "", Map.of(), EMPTY);
    }

    @Override
    public String toString() {
        return RawRequest.class.getSimpleName() + "{" +
                "method=" + method +
                ", path=" + path +
                ", rawQuery=" + rawQuery +
                ", headers=" + headers.keySet() +
                ", body=" + body.length + " bytes}";
    }
}
