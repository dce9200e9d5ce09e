package alpha.lapis.websocket;

import alpha.lapis.HttpConstants.StatusCode;
import alpha.lapis.message.Headers;
import alpha.lapis.message.RawRequest;
import alpha.lapis.message.Response;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static alpha.lapis.HttpConstants.HeaderName.CONNECTION;
import static alpha.lapis.HttpConstants.HeaderName.HOST;
import static alpha.lapis.HttpConstants.HeaderName.SEC_WEBSOCKET_ACCEPT;
import static alpha.lapis.HttpConstants.HeaderName.SEC_WEBSOCKET_KEY;
import static alpha.lapis.HttpConstants.HeaderName.SEC_WEBSOCKET_VERSION;
import static alpha.lapis.HttpConstants.HeaderName.UPGRADE;
import static alpha.lapis.message.Responses.badRequest;
import static java.nio.charset.StandardCharsets.US_ASCII;

/**
 * The server side of the WebSocket opening handshake, RFC 6455 section
 * 4.2.<p>
 *
 * A request {@link #isUpgrade(RawRequest) asks for an upgrade} if its
 * "Connection" header has the token "Upgrade" and its "Upgrade" header has
 * the token "websocket", ignoring case. Whether the upgrade is accepted is
 * decided by {@link #respond(RawRequest)}:
 * <ul>
 *   <li>The method must be GET and the "Host" header present, otherwise the
 *       response is "400 Bad Request".</li>
 *   <li>"Sec-WebSocket-Version" must be "13", otherwise the response is "426
 *       Upgrade Required", advertising version 13.</li>
 *   <li>"Sec-WebSocket-Key" must be the Base64 encoding of 16 bytes,
 *       otherwise the response is "400 Bad Request".</li>
 * </ul>
 *
 * An accepted handshake is answered with "101 Switching Protocols" and the
 * {@link #acceptKey(String) accept key} computed from the client's key.
 */
public final class WebSocketHandshake
{
    /** The only protocol version supported. */
    public static final String VERSION = "13";

    private static final String GUID = "258EAFA5-E914-47DA-95CA-C5AB0DC85B11";

    private static final int KEY_LENGTH = 16;

    private WebSocketHandshake() {
        // Empty
    }

    /**
     * Returns {@code true} if the request asks to upgrade to WebSocket.
     *
     * @param request to test
     * @return see JavaDoc
     * @throws NullPointerException if {@code request} is {@code null}
     */
    public static boolean isUpgrade(RawRequest request) {
        Map<String, List<String>> h = request.headers();
        return hasToken(h, CONNECTION, "upgrade") && hasToken(h, UPGRADE, "websocket");
    }

    /**
     * Returns the response to an upgrade request.
     *
     * @param request asking for an upgrade
     * @return "101 Switching Protocols" if the upgrade is accepted,
     *         otherwise an error response (see class JavaDoc)
     * @throws NullPointerException if {@code request} is {@code null}
     */
    public static Response respond(RawRequest request) {
        final Map<String, List<String>> h = request.headers();
        if (!request.method().equals("GET") || !Headers.contains(h, HOST)) {
            return badRequest();
        }
        if (!Headers.first(h, SEC_WEBSOCKET_VERSION).map(String::strip).orElse("").equals(VERSION)) {
            return Response.builder(StatusCode.FOUR_HUNDRED_TWENTY_SIX)
                           .header(UPGRADE, "websocket")
                           .header(SEC_WEBSOCKET_VERSION, VERSION)
                           .build();
        }
        final Optional<String> key = Headers.first(h, SEC_WEBSOCKET_KEY).map(String::strip);
        if (key.isEmpty() || !isValidKey(key.get())) {
            return badRequest();
        }
        return Response.builder(StatusCode.ONE_HUNDRED_ONE)
                       .header(UPGRADE, "websocket")
                       .header(CONNECTION, "Upgrade")
                       .header(SEC_WEBSOCKET_ACCEPT, acceptKey(key.get()))
                       .build();
    }

    /**
     * Compute the "Sec-WebSocket-Accept" value; the Base64 encoded SHA-1 hash
     * of the key concatenated with the protocol's GUID.
     *
     * @param key of client
     * @return the accept key
     * @throws NullPointerException if {@code key} is {@code null}
     */
    public static String acceptKey(String key) {
        final MessageDigest sha1;
        try {
            sha1 = MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            // Every Java platform supports SHA-1
            throw new AssertionError(e);
        }
        return Base64.getEncoder().encodeToString(
                sha1.digest((key + GUID).getBytes(US_ASCII)));
    }

    private static boolean isValidKey(String key) {
        try {
            return Base64.getDecoder().decode(key).length == KEY_LENGTH;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static boolean hasToken(Map<String, List<String>> headers, String name, String token) {
        for (var e : headers.entrySet()) {
            if (!e.getKey().equalsIgnoreCase(name)) {
                continue;
            }
            for (String v : e.getValue()) {
                for (String t : v.split(",")) {
                    if (t.strip().equalsIgnoreCase(token)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }
}
