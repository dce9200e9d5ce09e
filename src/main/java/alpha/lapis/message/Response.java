package alpha.lapis.message;

import alpha.lapis.HttpConstants;
import alpha.lapis.handler.RequestHandler;

import java.nio.charset.Charset;
import java.util.List;
import java.util.Map;

/**
 * An HTTP response, as produced by a {@link RequestHandler}.<p>
 *
 * A response is most easily created using the static factories in {@link
 * Responses}, or built from scratch using {@link #builder(int)}:
 *
 * <pre>{@code
 *   Response r = Response.builder(201)
 *                        .header("Location", "/users/42")
 *                        .body("created")
 *                        .build();
 * }</pre>
 *
 * The server's dispatcher serializes the response. It adds a {@code
 * Content-Length} header computed from the body (any such header set by the
 * application is replaced), and a {@code Content-Type} of "text/plain;
 * charset=utf-8" if the body is not empty and no content type was given.<p>
 *
 * A response whose status code is outside the range 100 to 599, or which
 * carries a body although the status code forbids one (1XX, 204, 304), is
 * rejected by the dispatcher and replaced with a "500 Internal Server
 * Error".<p>
 *
 * The implementation is immutable and thread-safe.
 */
public interface Response
{
    /**
     * Returns a builder with the given status code already set.<p>
     *
     * The reason phrase defaults to the phrase registered in {@link
     * HttpConstants.ReasonPhrase} for the code.
     *
     * @param statusCode of response
     * @return a builder
     */
    static Builder builder(int statusCode) {
        return DefaultResponse.DefaultBuilder.ROOT.statusCode(statusCode);
    }

    /**
     * Returns a builder with the given status code and reason phrase already
     * set.
     *
     * @param statusCode of response
     * @param reasonPhrase of response
     * @return a builder
     * @throws NullPointerException if {@code reasonPhrase} is {@code null}
     */
    static Builder builder(int statusCode, String reasonPhrase) {
        return builder(statusCode).reasonPhrase(reasonPhrase);
    }

    /**
     * Returns the status code.
     *
     * @return the status code
     */
    int statusCode();

    /**
     * Returns the reason phrase.
     *
     * @return the reason phrase (never {@code null})
     */
    String reasonPhrase();

    /**
     * Returns the response headers, in insertion order.
     *
     * @return an unmodifiable map of headers (never {@code null})
     */
    Map<String, List<String>> headers();

    /**
     * Returns the response body.<p>
     *
     * Each invocation returns a new copy.
     *
     * @return the body, possibly empty (never {@code null})
     */
    byte[] body();

    /**
     * Returns a builder representing the state of this response.
     *
     * @return a builder
     */
    Builder toBuilder();

    /**
     * Builder of a {@link Response}.<p>
     *
     * The builder is immutable. All methods return a new builder instance
     * representing the new state.
     */
    interface Builder
    {
        /**
         * Set the status code.
         *
         * @param statusCode of response
         * @return a new builder representing the new state
         */
        Builder statusCode(int statusCode);

        /**
         * Set the reason phrase.
         *
         * @param reasonPhrase of response
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code reasonPhrase} is {@code null}
         * @throws IllegalArgumentException
         *             if {@code reasonPhrase} has a control character (such as
         *             CR or LF) or a non-ASCII character
         */
        Builder reasonPhrase(String reasonPhrase);

        /**
         * Set a header, replacing all present values of the header.
         *
         * @param name of header
         * @param value of header
         * @return a new builder representing the new state
         * @throws NullPointerException if any argument is {@code null}
         * @throws IllegalArgumentException
         *             if {@code name} is not a token, or {@code value} has a
         *             control character (such as CR or LF) or a non-ASCII
         *             character
         * @see Headers#isValidName(String)
         * @see Headers#isValidValue(String)
         */
        Builder header(String name, String value);

        /**
         * Add a header value, keeping present values of the header.
         *
         * @param name of header
         * @param value of header
         * @return a new builder representing the new state
         * @throws NullPointerException if any argument is {@code null}
         * @throws IllegalArgumentException
         *             if {@code name} is not a token, or {@code value} has a
         *             control character (such as CR or LF) or a non-ASCII
         *             character
         */
        Builder addHeader(String name, String value);

        /**
         * Add a cookie.<p>
         *
         * The cookie is written as a "Set-Cookie: name=value" header. Each
         * call adds one header; cookies of the same name are not merged.
         * Attributes such as "Path" or "Max-Age" are not supported by this
         * method; use {@link #addHeader(String, String)} for those.
         *
         * @param name of cookie
         * @param value of cookie (may be empty)
         * @return a new builder representing the new state
         * @throws NullPointerException if any argument is {@code null}
         * @throws IllegalArgumentException
         *             if {@code name} is not a token, or {@code value} has a
         *             character not allowed in a cookie value (such as
         *             whitespace, a double quote, a comma, a semicolon or a
         *             backslash)
         */
        Builder addCookie(String name, String value);

        /**
         * Remove all values of a header.
         *
         * @param name of header (case-insensitive)
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code name} is {@code null}
         */
        Builder removeHeader(String name);

        /**
         * Set the body.
         *
         * @param body of response
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code body} is {@code null}
         */
        Builder body(byte[] body);

        /**
         * Set the body, encoded using UTF-8.
         *
         * @param body of response
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code body} is {@code null}
         */
        Builder body(String body);

        /**
         * Set the body, encoded using the given charset.
         *
         * @param body of response
         * @param charset to encode with
         * @return a new builder representing the new state
         * @throws NullPointerException if any argument is {@code null}
         */
        Builder body(String body, Charset charset);

        /**
         * Builds the response.
         *
         * @return a response
         * @throws IllegalStateException if the status code has not been set
         */
        Response build();
    }
}
