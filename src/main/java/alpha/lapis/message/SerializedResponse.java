package alpha.lapis.message;

import alpha.lapis.HttpConstants.HeaderName;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Collections.unmodifiableList;

/**
 * A response ready to be written to the wire.<p>
 *
 * Created by the dispatcher from a validated {@link Response}. The header list
 * is final; it includes {@code Content-Length} (unless the status code
 * forbids a body), a default {@code Content-Type} for non-empty bodies that
 * lack one, and the {@code Server} header if a server name is configured.<p>
 *
 * {@link #toBytes()} renders the HTTP/1.1 message. The output is a pure
 * function of the response; no {@code Date} or other time-variant header is
 * added.
 */
public final class SerializedResponse
{
    private static final String CRLF = "\r\n";

    private static final String DEFAULT_CONTENT_TYPE = "text/plain; charset=utf-8";

    /**
     * Serialize a response.<p>
     *
     * The response is assumed to have been validated already.
     *
     * @param rsp response to serialize
     * @param serverName value of the {@code Server} header (optional)
     * @return the serialized response
     */
    public static SerializedResponse of(Response rsp, Optional<String> serverName) {
        final byte[] body = rsp.body();
        final List<Map.Entry<String, String>> h = new ArrayList<>();

        rsp.headers().forEach((name, values) -> {
            if (name.equalsIgnoreCase(HeaderName.CONTENT_LENGTH)) {
                // We compute our own
                return;
            }
            values.forEach(v -> h.add(Map.entry(name, v)));
        });

        if (body.length > 0 && !Headers.contains(rsp.headers(), HeaderName.CONTENT_TYPE)) {
            h.add(Map.entry(HeaderName.CONTENT_TYPE, DEFAULT_CONTENT_TYPE));
        }
        if (mayHaveBody(rsp.statusCode())) {
            h.add(Map.entry(HeaderName.CONTENT_LENGTH, Integer.toString(body.length)));
        }
        serverName.ifPresent(n -> {
            if (!Headers.contains(rsp.headers(), HeaderName.SERVER)) {
                h.add(Map.entry(HeaderName.SERVER, n));
            }
        });

        return new SerializedResponse(
                rsp.statusCode(), rsp.reasonPhrase(), unmodifiableList(h), body);
    }

    /**
     * Returns {@code true} if a response of the given status code may carry a
     * body, otherwise {@code false}.
     *
     * @param statusCode of response
     * @return see JavaDoc
     */
    public static boolean mayHaveBody(int statusCode) {
        return statusCode >= 200 && statusCode != 204 && statusCode != 304;
    }

    private final int statusCode;
    private final String reasonPhrase;
    private final List<Map.Entry<String, String>> headers;
    private final byte[] body;

    private SerializedResponse(
            int statusCode,
            String reasonPhrase,
            List<Map.Entry<String, String>> headers,
            byte[] body)
    {
        this.statusCode = statusCode;
        this.reasonPhrase = reasonPhrase;
        this.headers = headers;
        this.body = body;
    }

    /**
     * Returns the status code.
     *
     * @return the status code
     */
    public int statusCode() {
        return statusCode;
    }

    /**
     * Returns the reason phrase.
     *
     * @return the reason phrase
     */
    public String reasonPhrase() {
        return reasonPhrase;
    }

    /**
     * Returns all headers, in the order they will be written.
     *
     * @return an unmodifiable list of headers
     */
    public List<Map.Entry<String, String>> headers() {
        return headers;
    }

    /**
     * Returns the first value of a header.
     *
     * @param name of header (case-insensitive)
     * @return the first value, if present
     */
    public Optional<String> header(String name) {
        return headers.stream()
                      .filter(e -> e.getKey().equalsIgnoreCase(name))
                      .map(Map.Entry::getValue)
                      .findFirst();
    }

    /**
     * Returns a copy of this response with a header appended, unless the
     * response already has a header of the same name.<p>
     *
     * Used by transports to add connection-level headers.
     *
     * @param name of header
     * @param value of header
     * @return a response with the header
     */
    public SerializedResponse withHeaderIfAbsent(String name, String value) {
        if (header(name).isPresent()) {
            return this;
        }
        List<Map.Entry<String, String>> h = new ArrayList<>(headers);
        h.add(Map.entry(name, value));
        return new SerializedResponse(statusCode, reasonPhrase, unmodifiableList(h), body);
    }

    /**
     * Returns the body.
     *
     * @return a copy of the body
     */
    public byte[] body() {
        return body.clone();
    }

    /**
     * Returns the body decoded using UTF-8.
     *
     * @return the body as a string
     */
    public String bodyAsString() {
        return new String(body, UTF_8);
    }

    /**
     * Render the HTTP/1.1 message.
     *
     * @return the response as bytes
     */
    public byte[] toBytes() {
        StringBuilder head = new StringBuilder()
                .append("HTTP/1.1 ")
                .append(statusCode).append(' ')
                .append(reasonPhrase).append(CRLF);
        for (var e : headers) {
            head.append(e.getKey()).append(": ").append(e.getValue()).append(CRLF);
        }
        head.append(CRLF);

        byte[] h = head.toString().getBytes(US_ASCII);
        var out = new ByteArrayOutputStream(h.length + body.length);
        out.writeBytes(h);
        out.writeBytes(body);
        return out.toByteArray();
    }

    @Override
    public String toString() {
        return SerializedResponse.class.getSimpleName() + "{" +
                "statusCode=" + statusCode +
                ", reasonPhrase='" + reasonPhrase + '\'' +
                ", headers=" + headers +
                ", body=" + body.length + " bytes}";
    }
}
