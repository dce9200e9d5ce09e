package alpha.lapis.message;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static alpha.lapis.message.Responses.noContent;
import static alpha.lapis.message.Responses.notFound;
import static alpha.lapis.message.Responses.text;
import static java.nio.charset.StandardCharsets.US_ASCII;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests for {@link SerializedResponse} and {@link Responses}.
 */
class SerializedResponseTest
{
    private static final String CRLF = "\r\n";

    @Test
    void text_response_on_the_wire() {
        var s = SerializedResponse.of(text("hello"), Optional.empty());
        assertThat(new String(s.toBytes(), US_ASCII)).isEqualTo(
                "HTTP/1.1 200 OK" + CRLF +
                "Content-Type: text/plain; charset=utf-8" + CRLF +
                "Content-Length: 5" + CRLF + CRLF +
                "hello");
    }

    @Test
    void default_content_type_only_with_body() {
        var withBody = SerializedResponse.of(
                Response.builder(200).body("x").build(), Optional.empty());
        assertThat(withBody.header("content-type")).contains("text/plain; charset=utf-8");

        var empty = SerializedResponse.of(Response.builder(200).build(), Optional.empty());
        assertThat(empty.header("Content-Type")).isEmpty();
        assertThat(empty.header("Content-Length")).contains("0");
    }

    @Test
    void no_content_length_for_204() {
        var s = SerializedResponse.of(noContent(), Optional.empty());
        assertThat(s.header("Content-Length")).isEmpty();
        assertThat(new String(s.toBytes(), US_ASCII)).isEqualTo(
                "HTTP/1.1 204 No Content" + CRLF + CRLF);
    }

    @Test
    void application_content_length_is_replaced() {
        var r = Response.builder(200)
                        .header("Content-Length", "999")
                        .body("abc")
                        .build();
        var s = SerializedResponse.of(r, Optional.empty());
        assertThat(s.headers())
                .filteredOn(e -> e.getKey().equals("Content-Length"))
                .containsExactly(Map.entry("Content-Length", "3"));
    }

    @Test
    void server_header() {
        var s = SerializedResponse.of(notFound(), Optional.of("lapis"));
        assertThat(s.header("Server")).contains("lapis");

        var own = Response.builder(200).header("Server", "mine").build();
        assertThat(SerializedResponse.of(own, Optional.of("lapis")).headers())
                .filteredOn(e -> e.getKey().equals("Server"))
                .containsExactly(Map.entry("Server", "mine"));
    }

    @Test
    void repeated_header_values_are_separate_lines() {
        var r = Response.builder(200)
                        .addHeader("Set-Cookie", "a=1")
                        .addHeader("Set-Cookie", "b=2")
                        .build();
        String wire = new String(SerializedResponse.of(r, Optional.empty()).toBytes(), US_ASCII);
        assertThat(wire).contains("Set-Cookie: a=1" + CRLF + "Set-Cookie: b=2" + CRLF);
    }

    @Test
    void with_header_if_absent() {
        var s = SerializedResponse.of(text("x"), Optional.empty());
        var c = s.withHeaderIfAbsent("Connection", "close");
        assertThat(c.header("Connection")).contains("close");
        assertThat(s.header("Connection")).isEmpty();
        assertThat(c.withHeaderIfAbsent("connection", "keep-alive")).isSameAs(c);
    }

    @Test
    void body_is_copied() {
        var s = SerializedResponse.of(text("abc"), Optional.empty());
        s.body()[0] = 'X';
        assertThat(s.bodyAsString()).isEqualTo("abc");
    }

    @Test
    void may_have_body() {
        assertThat(SerializedResponse.mayHaveBody(200)).isTrue();
        assertThat(SerializedResponse.mayHaveBody(404)).isTrue();
        assertThat(SerializedResponse.mayHaveBody(100)).isFalse();
        assertThat(SerializedResponse.mayHaveBody(204)).isFalse();
        assertThat(SerializedResponse.mayHaveBody(304)).isFalse();
    }

    // Responses
    // ----

    @Test
    void error_responses_carry_reason_as_body() {
        assertThat(Responses.badRequest().statusCode()).isEqualTo(400);
        assertThat(new String(Responses.methodNotAllowed().body(), US_ASCII))
                .isEqualTo("Method Not Allowed");
        assertThat(Responses.entityTooLarge().statusCode()).isEqualTo(413);
        assertThat(Responses.notImplemented().statusCode()).isEqualTo(501);
        assertThat(Responses.serviceUnavailable().statusCode()).isEqualTo(503);
        assertThat(Responses.httpVersionNotSupported().reasonPhrase())
                .isEqualTo("HTTP Version Not Supported");
    }

    @Test
    void content_types() {
        assertThat(Responses.json("{}").headers())
                .containsEntry("Content-Type", List.of("application/json; charset=utf-8"));
        assertThat(Responses.ok(new byte[]{1}).headers())
                .containsEntry("Content-Type", List.of("application/octet-stream"));
    }
}
