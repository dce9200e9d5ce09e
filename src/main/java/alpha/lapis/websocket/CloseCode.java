package alpha.lapis.websocket;

/**
 * Status codes of a WebSocket close frame, RFC 6455 section 7.4.1.
 */
public final class CloseCode
{
    private CloseCode() {
        // Empty
    }

    /** {@value} Normal Closure. */
    public static final int NORMAL_CLOSURE = 1000;

    /** {@value} Going Away; the server is stopping. */
    public static final int GOING_AWAY = 1001;

    /** {@value} Protocol Error. */
    public static final int PROTOCOL_ERROR = 1002;

    /** {@value} Invalid Frame Payload Data; a text message is not UTF-8. */
    public static final int INVALID_PAYLOAD = 1007;

    /** {@value} Message Too Big. */
    public static final int MESSAGE_TOO_BIG = 1009;

    /** {@value} Internal Error. */
    public static final int INTERNAL_ERROR = 1011;

    /**
     * Returns {@code true} if the code may be sent in a close frame.<p>
     *
     * The codes 1004, 1005, 1006 and 1015 are reserved, as is everything
     * below 1000 and above 4999.
     *
     * @param code to test
     * @return see JavaDoc
     */
    public static boolean isSendable(int code) {
        return code >= 1000 && code <= 4999 &&
               code != 1004 && code != 1005 && code != 1006 && code != 1015;
    }
}
