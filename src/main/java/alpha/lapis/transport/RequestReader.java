package alpha.lapis.transport;

import alpha.lapis.message.Headers;
import alpha.lapis.message.RawRequest;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static alpha.lapis.HttpConstants.HeaderName.CONTENT_LENGTH;
import static alpha.lapis.HttpConstants.HeaderName.HOST;
import static alpha.lapis.HttpConstants.HeaderName.TRANSFER_ENCODING;
import static alpha.lapis.message.Responses.badRequest;
import static alpha.lapis.message.Responses.entityTooLarge;
import static alpha.lapis.message.Responses.httpVersionNotSupported;
import static alpha.lapis.message.Responses.notImplemented;
import static java.nio.charset.StandardCharsets.ISO_8859_1;

/**
 * Reads one HTTP/1.x request from a blocking channel.<p>
 *
 * The request head (request line and headers) is read until the empty line.
 * The body is read if the request has a "Content-Length" header. Chunked
 * request bodies are not supported.
 */
final class RequestReader
{
    private static final Pattern VERSION = Pattern.compile("HTTP/(\\d)\\.(\\d)");

    private static final byte CR = '\r', LF = '\n';

    private final ReadableByteChannel ch;
    private final int maxHeadSize, maxBodySize;
    private final ByteBuffer buf;

    RequestReader(ReadableByteChannel ch, int maxHeadSize, int maxBodySize) {
        this.ch = ch;
        this.maxHeadSize = maxHeadSize;
        this.maxBodySize = maxBodySize;
        this.buf = ByteBuffer.allocate(4_096);
    }

    /**
     * Read the request.
     *
     * @return the request, or {@code null} if the channel reached end of
     *         stream before a complete request was received
     * @throws IOException if an I/O error occurs
     * @throws RequestRejectedException if the request is rejected
     */
    RawRequest read() throws IOException, RequestRejectedException {
        ByteArrayOutputStream head = new ByteArrayOutputStream();
        int end = -1;
        while (end == -1) {
            buf.clear();
            if (ch.read(buf) == -1) {
                return null;
            }
            buf.flip();
            int from = Math.max(0, head.size() - 3);
            head.write(buf.array(), 0, buf.limit());
            end = endOfHead(head.toByteArray(), from);
            if (end == -1 && head.size() > maxHeadSize) {
                throw new RequestRejectedException(
                        "Request head exceeds " + maxHeadSize + " bytes.", entityTooLarge());
            }
        }

        final byte[] all = head.toByteArray();
        final int bodyStart = end;
        int headEnd = end;
        while (headEnd > 0 && (all[headEnd - 1] == LF || all[headEnd - 1] == CR)) {
            --headEnd;
        }
        if (headEnd > maxHeadSize) {
            throw new RequestRejectedException(
                    "Request head exceeds " + maxHeadSize + " bytes.", entityTooLarge());
        }

        List<String> lines = lines(new String(all, 0, headEnd, ISO_8859_1));
        String[] line = lines.get(0).split(" ", -1);
        if (line.length != 3 || line[0].isEmpty() || line[1].isEmpty()) {
            throw new RequestRejectedException(
                    "Malformed request line: " + lines.get(0), badRequest());
        }
        final boolean http11 = version(line[2]);
        final Map<String, List<String>> headers = headers(lines.subList(1, lines.size()));

        if (http11 && !Headers.contains(headers, HOST)) {
            throw new RequestRejectedException("HTTP/1.1 request without Host.", badRequest());
        }
        if (Headers.contains(headers, TRANSFER_ENCODING)) {
            throw new RequestRejectedException(
                    "Transfer-Encoding is not supported.", notImplemented());
        }

        final int length = contentLength(headers);
        byte[] body = new byte[length];
        int have = Math.min(all.length - bodyStart, length);
        System.arraycopy(all, bodyStart, body, 0, have);
        ByteBuffer rest = ByteBuffer.wrap(body, have, length - have);
        while (rest.hasRemaining()) {
            if (ch.read(rest) == -1) {
                return null;
            }
        }

        String[] target = target(line[1]);
        return new RawRequest(line[0], target[0], target[1], headers, body);
    }

    private static int endOfHead(byte[] b, int from) {
        for (int i = from; i < b.length; ++i) {
            if (b[i] != LF) {
                continue;
            }
            if (i + 1 < b.length && b[i + 1] == LF) {
                return i + 2;
            }
            if (i + 2 < b.length && b[i + 1] == CR && b[i + 2] == LF) {
                return i + 3;
            }
        }
        return -1;
    }

    private static List<String> lines(String head) {
        List<String> l = new ArrayList<>();
        for (String s : head.split("\n", -1)) {
            l.add(s.endsWith("\r") ? s.substring(0, s.length() - 1) : s);
        }
        return l;
    }

    private static boolean version(String token) throws RequestRejectedException {
        Matcher m = VERSION.matcher(token);
        if (!m.matches()) {
            throw new RequestRejectedException(
                    "Malformed HTTP version: " + token, badRequest());
        }
        int major = Integer.parseInt(m.group(1)),
            minor = Integer.parseInt(m.group(2));
        if (major != 1) {
            throw new RequestRejectedException(
                    "Unsupported HTTP version: " + token, httpVersionNotSupported());
        }
        return minor >= 1;
    }

    private static Map<String, List<String>> headers(List<String> lines)
            throws RequestRejectedException
    {
        Map<String, List<String>> h = new LinkedHashMap<>();
        for (String l : lines) {
            if (l.startsWith(" ") || l.startsWith("\t")) {
                throw new RequestRejectedException(
                        "Obsolete line folding is not supported.", badRequest());
            }
            int colon = l.indexOf(':');
            if (colon <= 0) {
                throw new RequestRejectedException("Malformed header: " + l, badRequest());
            }
            String name = l.substring(0, colon);
            if (!name.strip().equals(name) || name.contains(" ")) {
                throw new RequestRejectedException(
                        "Whitespace in header name: " + name, badRequest());
            }
            h.computeIfAbsent(name, k -> new ArrayList<>(1))
             .add(l.substring(colon + 1).strip());
        }
        return h;
    }

    private int contentLength(Map<String, List<String>> headers)
            throws RequestRejectedException
    {
        List<String> values = new ArrayList<>();
        headers.forEach((k, v) -> {
            if (k.equalsIgnoreCase(CONTENT_LENGTH)) {
                values.addAll(v);
            }
        });
        if (values.isEmpty()) {
            return 0;
        }
        if (values.stream().distinct().count() > 1) {
            throw new RequestRejectedException(
                    "Conflicting Content-Length values: " + values, badRequest());
        }
        final long len;
        try {
            len = Long.parseLong(values.get(0));
        } catch (NumberFormatException e) {
            throw new RequestRejectedException(
                    "Malformed Content-Length: " + values.get(0), badRequest());
        }
        if (len < 0) {
            throw new RequestRejectedException(
                    "Negative Content-Length: " + len, badRequest());
        }
        if (len > maxBodySize) {
            throw new RequestRejectedException(
                    "Content-Length " + len + " exceeds " + maxBodySize + " bytes.",
                    entityTooLarge());
        }
        return (int) len;
    }

    /**
     * Split a request target into path and raw query. The fragment, if any,
     * is discarded. An absolute-form target has its scheme and authority
     * removed.
     */
    static String[] target(String raw) {
        String t = raw;
        int scheme = t.indexOf("://");
        if (scheme > 0 && !t.startsWith("/")) {
            int slash = t.indexOf('/', scheme + 3);
            t = slash == -1 ? "/" : t.substring(slash);
        }
        int hash = t.indexOf('#');
        if (hash != -1) {
            t = t.substring(0, hash);
        }
        int q = t.indexOf('?');
        return q == -1 ?
                new String[]{t, ""} :
                new String[]{t.substring(0, q), t.substring(q + 1)};
    }
}
