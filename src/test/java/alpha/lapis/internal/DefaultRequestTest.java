package alpha.lapis.internal;

import alpha.lapis.message.BadRequestException;
import alpha.lapis.message.RawRequest;
import alpha.lapis.message.Request;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link DefaultRequest}.
 */
class DefaultRequestTest
{
    @Test
    void query_empty() {
        assertThat(DefaultRequest.parseQuery("")).isEmpty();
    }

    @Test
    void query_repeated_key_keeps_order() {
        assertThat(DefaultRequest.parseQuery("a=1&b=2&a=3"))
                .containsExactly(
                        Map.entry("a", List.of("1", "3")),
                        Map.entry("b", List.of("2")));
    }

    @Test
    void query_key_without_value() {
        assertThat(DefaultRequest.parseQuery("flag&x="))
                .containsEntry("flag", List.of(""))
                .containsEntry("x", List.of(""));
    }

    @Test
    void query_empty_pairs_skipped() {
        assertThat(DefaultRequest.parseQuery("&&a=1&")).containsOnlyKeys("a");
    }

    @Test
    void query_decoded_plus_is_space() {
        assertThat(DefaultRequest.parseQuery("q=hello+world%21&%C3%A5=%C3%A4"))
                .containsEntry("q", List.of("hello world!"))
                .containsEntry("å", List.of("ä"));
    }

    @Test
    void query_value_with_equals() {
        assertThat(DefaultRequest.parseQuery("expr=a=b"))
                .containsEntry("expr", List.of("a=b"));
    }

    @Test
    void query_malformed() {
        assertThatThrownBy(() -> DefaultRequest.parseQuery("a=%2"))
                .isExactlyInstanceOf(BadRequestException.class);
    }

    @Test
    void query_is_unmodifiable() {
        var q = DefaultRequest.parseQuery("a=1");
        assertThatThrownBy(() -> q.get("a").add("2"))
                .isExactlyInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void headers_are_case_insensitive() {
        var raw = new RawRequest("GET", "/", "",
                Map.of("Content-Type", List.of("text/plain")), null);
        Request r = new DefaultRequest(raw, "/", Map.of());
        assertThat(r.header("content-type")).contains("text/plain");
        assertThat(r.header("CONTENT-TYPE")).contains("text/plain");
        assertThat(r.header("Accept")).isEmpty();
    }

    @Test
    void accessors() {
        var raw = new RawRequest("PUT", "/a/", "x=1", null, "body".getBytes(UTF_8));
        Request r = new DefaultRequest(raw, "/a", Map.of("id", "1"));
        assertThat(r.method()).isEqualTo("PUT");
        assertThat(r.path()).isEqualTo("/a");
        assertThat(r.rawQuery()).isEqualTo("x=1");
        assertThat(r.queryFirst("x")).contains("1");
        assertThat(r.queryFirst("y")).isEmpty();
        assertThat(r.param("id")).isEqualTo("1");
        assertThat(r.param("nope")).isNull();
        assertThat(r.bodyAsString()).isEqualTo("body");
    }

    @Test
    void body_is_copied() {
        var raw = new RawRequest("PUT", "/", "", null, "body".getBytes(UTF_8));
        Request r = new DefaultRequest(raw, "/", Map.of());
        r.body()[0] = 'X';
        assertThat(r.bodyAsString()).isEqualTo("body");
    }

    @Test
    void raw_body_is_copied_both_ways() {
        byte[] in = "body".getBytes(UTF_8);
        var raw = new RawRequest("PUT", "/", "", null, in);
        in[0] = 'X';
        raw.body()[1] = 'Y';
        assertThat(raw.body()).isEqualTo("body".getBytes(UTF_8))
                              .isNotSameAs(raw.body());
    }
}
