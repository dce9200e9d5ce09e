package alpha.lapis.transport;

import alpha.lapis.message.RawRequest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.channels.Channels;
import java.util.List;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link RequestReader}.
 */
class RequestReaderTest
{
    private static final String CRLF = "\r\n";

    @Test
    void get_with_query() throws Exception {
        RawRequest r = read(
                "GET /users/42?x=1&y=2 HTTP/1.1" + CRLF +
                "Host: localhost" + CRLF +
                "X-Trace: abc" + CRLF + CRLF);
        assertThat(r.method()).isEqualTo("GET");
        assertThat(r.path()).isEqualTo("/users/42");
        assertThat(r.rawQuery()).isEqualTo("x=1&y=2");
        assertThat(r.headers()).containsKeys("Host", "X-Trace");
        assertThat(r.headers().get("X-Trace")).containsExactly("abc");
        assertThat(r.body()).isEmpty();
    }

    @Test
    void post_with_body() throws Exception {
        RawRequest r = read(
                "POST /echo HTTP/1.1" + CRLF +
                "Host: localhost" + CRLF +
                "Content-Length: 5" + CRLF + CRLF +
                "hello");
        assertThat(new String(r.body(), UTF_8)).isEqualTo("hello");
    }

    @Test
    void header_order_and_repetition_kept() throws Exception {
        RawRequest r = read(
                "GET / HTTP/1.1" + CRLF +
                "Host: localhost" + CRLF +
                "B: 1" + CRLF +
                "A: 2" + CRLF +
                "B: 3" + CRLF + CRLF);
        assertThat(r.headers().keySet()).containsExactly("Host", "B", "A");
        assertThat(r.headers().get("B")).containsExactly("1", "3");
    }

    @Test
    void bare_line_feeds_accepted() throws Exception {
        RawRequest r = read("GET /a HTTP/1.0\n\n");
        assertThat(r.path()).isEqualTo("/a");
    }

    // HTTP/1.0 does not require Host
    @Test
    void http10_without_host() throws Exception {
        assertThat(read("GET / HTTP/1.0" + CRLF + CRLF).path()).isEqualTo("/");
    }

    @Test
    void absolute_form_target() throws Exception {
        RawRequest r = read(
                "GET http://example.com/a/b?q=1 HTTP/1.1" + CRLF +
                "Host: example.com" + CRLF + CRLF);
        assertThat(r.path()).isEqualTo("/a/b");
        assertThat(r.rawQuery()).isEqualTo("q=1");
    }

    @Test
    void target_fragment_dropped() {
        assertThat(RequestReader.target("/a#frag")).containsExactly("/a", "");
        assertThat(RequestReader.target("/a?x=1#frag")).containsExactly("/a", "x=1");
        assertThat(RequestReader.target("http://host")).containsExactly("/", "");
    }

    @Test
    void end_of_stream_before_request() throws Exception {
        assertThat(read("")).isNull();
        assertThat(read("GET / HTTP/1.1" + CRLF)).isNull();
    }

    @Test
    void end_of_stream_before_body() throws Exception {
        assertThat(read(
                "POST / HTTP/1.1" + CRLF +
                "Host: localhost" + CRLF +
                "Content-Length: 10" + CRLF + CRLF +
                "short")).isNull();
    }

    // Rejections
    // ----

    @ParameterizedTest
    @ValueSource(strings = {
        "GET /",
        "GET  / HTTP/1.1",
        " / HTTP/1.1",
        "GET / HTTX/1.1",
        "GET / HTTP/1"})
    void malformed_request_line(String line) {
        assertRejected(line + CRLF + "Host: x" + CRLF + CRLF, 400);
    }

    @Test
    void http11_without_host() {
        assertRejected("GET / HTTP/1.1" + CRLF + CRLF, 400);
    }

    @Test
    void malformed_header() {
        assertRejected("GET / HTTP/1.1" + CRLF + "Host: x" + CRLF + "NoColon" + CRLF + CRLF, 400);
        assertRejected("GET / HTTP/1.1" + CRLF + "Host: x" + CRLF + "Bad Name: v" + CRLF + CRLF, 400);
        assertRejected("GET / HTTP/1.1" + CRLF + "Host: x" + CRLF + " folded" + CRLF + CRLF, 400);
    }

    @Test
    void bad_content_length() {
        assertRejected(post("abc"), 400);
        assertRejected(post("-1"), 400);
        assertRejected("POST / HTTP/1.1" + CRLF + "Host: x" + CRLF +
                       "Content-Length: 1" + CRLF + "Content-Length: 2" + CRLF + CRLF, 400);
    }

    @Test
    void body_too_large() {
        assertRejected(post("101"), 413);
    }

    @Test
    void head_too_large() {
        assertRejected("GET / HTTP/1.1" + CRLF +
                       "Host: x" + CRLF +
                       "X-Long: " + "a".repeat(200) + CRLF + CRLF, 413);
    }

    @Test
    void head_too_large_without_terminator() {
        assertRejected("GET / HTTP/1.1" + CRLF +
                       "X-Long: " + "a".repeat(5_000), 413);
    }

    @Test
    void transfer_encoding_not_implemented() {
        assertRejected("POST / HTTP/1.1" + CRLF + "Host: x" + CRLF +
                       "Transfer-Encoding: chunked" + CRLF + CRLF, 501);
    }

    @ParameterizedTest
    @ValueSource(strings = {"HTTP/2.0", "HTTP/0.9"})
    void version_not_supported(String version) {
        assertRejected("GET / " + version + CRLF + "Host: x" + CRLF + CRLF, 505);
    }

    private static String post(String contentLength) {
        return "POST / HTTP/1.1" + CRLF +
               "Host: x" + CRLF +
               "Content-Length: " + contentLength + CRLF + CRLF;
    }

    private static RawRequest read(String request) throws IOException, RequestRejectedException {
        var ch = Channels.newChannel(new ByteArrayInputStream(request.getBytes(ISO_8859_1)));
        return new RequestReader(ch, 100, 100).read();
    }

    private static void assertRejected(String request, int statusCode) {
        assertThatThrownBy(() -> read(request))
                .isExactlyInstanceOf(RequestRejectedException.class)
                .satisfies(e -> assertThat(((RequestRejectedException) e).response().statusCode())
                        .isEqualTo(statusCode));
    }

    @Test
    void headers_are_unmodifiable() throws Exception {
        RawRequest r = read("GET / HTTP/1.1" + CRLF + "Host: x" + CRLF + CRLF);
        assertThatThrownBy(() -> r.headers().put("k", List.of()))
                .isExactlyInstanceOf(UnsupportedOperationException.class);
    }
}
