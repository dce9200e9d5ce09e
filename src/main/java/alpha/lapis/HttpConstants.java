package alpha.lapis;

import java.util.Map;
import java.util.Optional;

import static java.util.Map.entry;

/**
 * Constants of the HTTP protocol used by the library.
 *
 * @see Method
 * @see StatusCode
 * @see ReasonPhrase
 * @see HeaderName
 */
public final class HttpConstants {
    private HttpConstants() {
        // Empty
    }

    /**
     * The closed set of request methods a handler can be bound to.<p>
     *
     * A request may carry any method token, but only these can be declared by
     * a route's leaf. A request using a token not found in this enumeration
     * will never have a handler and is answered with "405 Method Not
     * Allowed" if the path matched a route.<p>
     *
     * The declaration order is significant; it is the order in which allowed
     * methods are listed in the {@code Allow} header.
     *
     * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3">RFC 7231 §4.3</a>
     * @see <a href="https://tools.ietf.org/html/rfc5789#section-2">RFC 5789 §2</a>
     */
    public enum Method {
        GET, HEAD, POST, PUT, PATCH, DELETE, OPTIONS, TRACE, CONNECT;

        /**
         * Lookup a method by its token.<p>
         *
         * Method tokens are case-sensitive.
         *
         * @param token to lookup
         * @return the method, or an empty optional if not found
         * @throws NullPointerException if {@code token} is {@code null}
         */
        public static Optional<Method> of(String token) {
            for (Method m : values()) {
                if (m.name().equals(token)) {
                    return Optional.of(m);
                }
            }
            return Optional.empty();
        }
    }

    /**
     * Status codes used by the library.
     */
    public static final class StatusCode {
        private StatusCode() {
            // Private
        }

        /** Lowest valid status code. */
        public static final int MIN = 100;

        public static final int ONE_HUNDRED_ONE = 101;

        /** Highest valid status code. */
        public static final int MAX = 599;

        public static final int TWO_HUNDRED = 200;

        public static final int TWO_HUNDRED_ONE = 201;

        public static final int TWO_HUNDRED_FOUR = 204;

        public static final int FOUR_HUNDRED = 400;

        public static final int FOUR_HUNDRED_FOUR = 404;

        public static final int FOUR_HUNDRED_FIVE = 405;

        public static final int FOUR_HUNDRED_THIRTEEN = 413;

        public static final int FOUR_HUNDRED_TWENTY_SIX = 426;

        public static final int FIVE_HUNDRED = 500;

        public static final int FIVE_HUNDRED_ONE = 501;

        public static final int FIVE_HUNDRED_THREE = 503;

        public static final int FIVE_HUNDRED_FIVE = 505;

        /**
         * Returns {@code true} if the given code is within the range of valid
         * status codes, otherwise {@code false}.
         *
         * @param code to test
         * @return see JavaDoc
         */
        public static boolean isValid(int code) {
            return code >= MIN && code <= MAX;
        }
    }

    /**
     * Reason phrases of the status codes.
     *
     * @see <a href="https://tools.ietf.org/html/rfc7231#section-6.1">RFC 7231 §6.1</a>
     */
    public static final class ReasonPhrase {
        private ReasonPhrase() {
            // Private
        }

        public static final String CONTINUE = "Continue";
        public static final String SWITCHING_PROTOCOLS = "Switching Protocols";
        public static final String OK = "OK";
        public static final String CREATED = "Created";
        public static final String ACCEPTED = "Accepted";
        public static final String NO_CONTENT = "No Content";
        public static final String MOVED_PERMANENTLY = "Moved Permanently";
        public static final String FOUND = "Found";
        public static final String SEE_OTHER = "See Other";
        public static final String NOT_MODIFIED = "Not Modified";
        public static final String TEMPORARY_REDIRECT = "Temporary Redirect";
        public static final String PERMANENT_REDIRECT = "Permanent Redirect";
        public static final String BAD_REQUEST = "Bad Request";
        public static final String UNAUTHORIZED = "Unauthorized";
        public static final String FORBIDDEN = "Forbidden";
        public static final String NOT_FOUND = "Not Found";
        public static final String METHOD_NOT_ALLOWED = "Method Not Allowed";
        public static final String NOT_ACCEPTABLE = "Not Acceptable";
        public static final String REQUEST_TIMEOUT = "Request Timeout";
        public static final String CONFLICT = "Conflict";
        public static final String GONE = "Gone";
        public static final String LENGTH_REQUIRED = "Length Required";
        public static final String ENTITY_TOO_LARGE = "Entity Too Large";
        public static final String UNSUPPORTED_MEDIA_TYPE = "Unsupported Media Type";
        public static final String UNPROCESSABLE_ENTITY = "Unprocessable Entity";
        public static final String UPGRADE_REQUIRED = "Upgrade Required";
        public static final String TOO_MANY_REQUESTS = "Too Many Requests";
        public static final String INTERNAL_SERVER_ERROR = "Internal Server Error";
        public static final String NOT_IMPLEMENTED = "Not Implemented";
        public static final String BAD_GATEWAY = "Bad Gateway";
        public static final String SERVICE_UNAVAILABLE = "Service Unavailable";
        public static final String GATEWAY_TIMEOUT = "Gateway Timeout";
        public static final String HTTP_VERSION_NOT_SUPPORTED = "HTTP Version Not Supported";

        /** Used for codes not known by this class. */
        public static final String UNKNOWN = "Unknown";

        private static final Map<Integer, String> BY_CODE = Map.ofEntries(
                entry(100, CONTINUE),
                entry(101, SWITCHING_PROTOCOLS),
                entry(200, OK),
                entry(201, CREATED),
                entry(202, ACCEPTED),
                entry(204, NO_CONTENT),
                entry(301, MOVED_PERMANENTLY),
                entry(302, FOUND),
                entry(303, SEE_OTHER),
                entry(304, NOT_MODIFIED),
                entry(307, TEMPORARY_REDIRECT),
                entry(308, PERMANENT_REDIRECT),
                entry(400, BAD_REQUEST),
                entry(401, UNAUTHORIZED),
                entry(403, FORBIDDEN),
                entry(404, NOT_FOUND),
                entry(405, METHOD_NOT_ALLOWED),
                entry(406, NOT_ACCEPTABLE),
                entry(408, REQUEST_TIMEOUT),
                entry(409, CONFLICT),
                entry(410, GONE),
                entry(411, LENGTH_REQUIRED),
                entry(413, ENTITY_TOO_LARGE),
                entry(415, UNSUPPORTED_MEDIA_TYPE),
                entry(422, UNPROCESSABLE_ENTITY),
                entry(426, UPGRADE_REQUIRED),
                entry(429, TOO_MANY_REQUESTS),
                entry(500, INTERNAL_SERVER_ERROR),
                entry(501, NOT_IMPLEMENTED),
                entry(502, BAD_GATEWAY),
                entry(503, SERVICE_UNAVAILABLE),
                entry(504, GATEWAY_TIMEOUT),
                entry(505, HTTP_VERSION_NOT_SUPPORTED));

        /**
         * Returns the reason phrase of the given status code.
         *
         * @param code status code
         * @return the reason phrase, or {@link #UNKNOWN} if not known
         */
        public static String of(int code) {
            return BY_CODE.getOrDefault(code, UNKNOWN);
        }
    }

    /**
     * Header names used by the library.
     */
    public static final class HeaderName {
        private HeaderName() {
            // Private
        }

        public static final String ALLOW = "Allow";
        public static final String CONNECTION = "Connection";
        public static final String CONTENT_LENGTH = "Content-Length";
        public static final String CONTENT_TYPE = "Content-Type";
        public static final String HOST = "Host";
        public static final String SEC_WEBSOCKET_ACCEPT = "Sec-WebSocket-Accept";
        public static final String SEC_WEBSOCKET_KEY = "Sec-WebSocket-Key";
        public static final String SEC_WEBSOCKET_VERSION = "Sec-WebSocket-Version";
        public static final String SERVER = "Server";
        public static final String SET_COOKIE = "Set-Cookie";
        public static final String TRANSFER_ENCODING = "Transfer-Encoding";
        public static final String UPGRADE = "Upgrade";
    }
}
