package alpha.lapis.route;

import alpha.lapis.handler.RequestHandler;
import alpha.lapis.message.BadRequestException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static alpha.lapis.message.Responses.noContent;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link PathMatcher}.
 */
class PathMatcherTest
{
    private static final RequestHandler NOOP = RequestHandler.respond(noContent());

    // Normalization
    // ----

    @ParameterizedTest
    @CsvSource({
        "'',     /",
        "/,      /",
        "a,      /a",
        "/a/,    /a",
        "a/b/,   /a/b",
        "/a//,   /a/"})
    void normalize(String path, String expected) {
        assertThat(PathMatcher.normalize(path)).isEqualTo(expected);
    }

    @Test
    void segments() {
        assertThat(PathMatcher.segments("/")).isEmpty();
        assertThat(PathMatcher.segments("/a")).containsExactly("a");
        assertThat(PathMatcher.segments("/a/b/c")).containsExactly("a", "b", "c");
        assertThat(PathMatcher.segments("/a//b")).containsExactly("a", "", "b");
    }

    // Matching
    // ----

    @Test
    void root() {
        RouteTree t = tree("/");
        assertMatch(t, "/", "/", Map.of());
        assertMatch(t, "", "/", Map.of());
        assertNoMatch(t, "/x");
    }

    @Test
    void trailing_slash_is_ignored() {
        RouteTree t = tree("/users");
        assertMatch(t, "/users/", "/users", Map.of());
        assertMatch(t, "users", "/users", Map.of());
    }

    @Test
    void dynamic_binds_segment() {
        RouteTree t = tree("/users/:id");
        assertMatch(t, "/users/42", "/users/:id", Map.of("id", "42"));
        assertNoMatch(t, "/users");
        assertNoMatch(t, "/users/42/x");
    }

    @Test
    void dynamic_needs_nonempty_segment() {
        RouteTree t = tree("/a/:x/b");
        assertMatch(t, "/a/1/b", "/a/:x/b", Map.of("x", "1"));
        assertNoMatch(t, "/a//b");
    }

    @Test
    void catch_all_joins_remainder() {
        RouteTree t = tree("/files/*path");
        assertMatch(t, "/files/a", "/files/*path", Map.of("path", "a"));
        assertMatch(t, "/files/a/b/c.txt", "/files/*path", Map.of("path", "a/b/c.txt"));
    }

    @Test
    void catch_all_needs_one_segment() {
        RouteTree t = tree("/files/*path");
        assertNoMatch(t, "/files");
        assertNoMatch(t, "/files/");
    }

    // Precedence
    // ----

    @Test
    void static_beats_dynamic() {
        RouteTree t = tree("/users/me", "/users/:id");
        assertMatch(t, "/users/me", "/users/me", Map.of());
        assertMatch(t, "/users/you", "/users/:id", Map.of("id", "you"));
    }

    @Test
    void static_beats_catch_all() {
        RouteTree t = tree("/files", "/*path");
        assertMatch(t, "/files", "/files", Map.of());
        assertMatch(t, "/other", "/*path", Map.of("path", "other"));
        assertMatch(t, "/other/x", "/*path", Map.of("path", "other/x"));
        // "files" is taken by the static child, which has no route for "x"
        assertNoMatch(t, "/files/x");
    }

    @Test
    void dynamic_beats_catch_all() {
        RouteTree t = tree("/:one", "/*rest");
        assertMatch(t, "/a", "/:one", Map.of("one", "a"));
        assertNoMatch(t, "/a/b");
    }

    @Test
    void static_prefix_is_final() {
        RouteTree t = tree("/users/me/settings", "/users/:id/posts");
        assertMatch(t, "/users/me/settings", "/users/me/settings", Map.of());
        assertMatch(t, "/users/you/posts", "/users/:id/posts", Map.of("id", "you"));
        assertNoMatch(t, "/users/me/posts");
    }

    @Test
    void static_node_without_bindings_is_final() {
        RouteTree t = tree("/files/x", "/*path");
        assertMatch(t, "/files/x", "/files/x", Map.of());
        assertNoMatch(t, "/files");
    }

    @Test
    void dynamic_prefix_is_final() {
        RouteTree t = tree("/:a/x", "/*rest");
        assertMatch(t, "/1/x", "/:a/x", Map.of("a", "1"));
        assertNoMatch(t, "/1/y");
    }

    @Test
    void unbound_intermediate_is_no_match() {
        RouteTree t = tree("/a/b");
        assertNoMatch(t, "/a");
        assertNoMatch(t, "/a/b/c");
    }

    // Decoding
    // ----

    @Test
    void static_matches_decoded_segment() {
        RouteTree t = tree("/hello world");
        assertMatch(t, "/hello%20world", "/hello world", Map.of());
    }

    @Test
    void param_is_decoded_and_plus_kept() {
        RouteTree t = tree("/q/:term");
        assertMatch(t, "/q/a+b%2Fc", "/q/:term", Map.of("term", "a+b/c"));
    }

    @Test
    void malformed_encoding_is_bad_request() {
        RouteTree t = tree("/q/:term");
        assertThatThrownBy(() -> PathMatcher.match(t, "/q/%zz"))
                .isExactlyInstanceOf(BadRequestException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    private static RouteTree tree(String... routes) {
        MemoryRouteSource.Builder b = MemoryRouteSource.builder();
        for (String r : routes) {
            b.handler(r, "GET", NOOP);
        }
        return RouteCompiler.compile(b.build());
    }

    private static void assertMatch(RouteTree t, String path, String pattern, Map<String, String> params) {
        Match m = PathMatcher.match(t, path);
        assertThat(m.node().pattern()).isEqualTo(pattern);
        assertThat(m.params()).isEqualTo(params);
    }

    private static void assertNoMatch(RouteTree t, String path) {
        assertThatThrownBy(() -> PathMatcher.match(t, path))
                .isExactlyInstanceOf(NoRouteFoundException.class);
    }

    @Test
    void patterns_in_tree_order() {
        RouteTree t = tree("/b", "/a", "/:x", "/a/*rest");
        assertThat(t.patterns()).isEqualTo(List.of("/a", "/a/*rest", "/b", "/:x"));
    }
}
