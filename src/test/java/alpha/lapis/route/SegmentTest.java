package alpha.lapis.route;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static alpha.lapis.route.Segment.Kind.CATCH_ALL;
import static alpha.lapis.route.Segment.Kind.DYNAMIC;
import static alpha.lapis.route.Segment.Kind.STATIC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link Segment}.
 */
class SegmentTest
{
    @Test
    void static_literal() {
        Segment s = Segment.parse("users");
        assertThat(s.kind()).isEqualTo(STATIC);
        assertThat(s.value()).isEqualTo("users");
        assertThat(s.pattern()).isEqualTo("users");
    }

    @ParameterizedTest
    @ValueSource(strings = {"[id]", ":id"})
    void dynamic(String dir) {
        Segment s = Segment.parse(dir);
        assertThat(s.kind()).isEqualTo(DYNAMIC);
        assertThat(s.value()).isEqualTo("id");
        assertThat(s.pattern()).isEqualTo(":id");
    }

    @ParameterizedTest
    @ValueSource(strings = {"[...path]", "*path"})
    void catch_all(String dir) {
        Segment s = Segment.parse(dir);
        assertThat(s.kind()).isEqualTo(CATCH_ALL);
        assertThat(s.value()).isEqualTo("path");
        assertThat(s.pattern()).isEqualTo("*path");
    }

    // Both syntaxes name the same segment
    @Test
    void equality() {
        assertThat(Segment.parse("[id]")).isEqualTo(Segment.parse(":id"));
        assertThat(Segment.parse("[id]")).hasSameHashCodeAs(Segment.parse(":id"));
        assertThat(Segment.parse("[...id]")).isNotEqualTo(Segment.parse(":id"));
        assertThat(Segment.parse("id")).isNotEqualTo(Segment.parse(":id"));
    }

    @Test
    void unclosed_bracket_is_static() {
        assertThat(Segment.parse("[id").kind()).isEqualTo(STATIC);
    }

    @ParameterizedTest
    @ValueSource(strings = {"[]", ":", "*", "[...]", ": "})
    void empty_param_name_fails(String dir) {
        assertThatThrownBy(() -> Segment.parse(dir))
                .isExactlyInstanceOf(RouteCompilationException.class)
                .hasMessageContaining("Parameter name is empty");
    }

    @Test
    void empty_name_fails() {
        assertThatThrownBy(() -> Segment.parse(""))
                .isExactlyInstanceOf(RouteCompilationException.class);
    }
}
