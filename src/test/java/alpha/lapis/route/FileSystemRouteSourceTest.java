package alpha.lapis.route;

import alpha.lapis.Config;
import alpha.lapis.handler.RequestHandler;
import alpha.lapis.message.Request;
import alpha.lapis.message.Response;
import alpha.lapis.websocket.Portal;
import alpha.lapis.websocket.WebSocketHandler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionStage;

import static alpha.lapis.HttpConstants.Method.GET;
import static alpha.lapis.HttpConstants.Method.POST;
import static alpha.lapis.message.Responses.text;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.CompletableFuture.completedStage;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link FileSystemRouteSource}.
 */
class FileSystemRouteSourceTest
{
    @TempDir
    Path root;

    @Test
    void compiles_directory_tree() throws IOException {
        leaf("users/[id]", "GET=" + Hello.class.getName(),
                           "POST = " + Echo.class.getName());
        leaf("files/[...path]", "GET=" + Hello.class.getName());
        leaf("", "GET=" + Hello.class.getName());

        RouteTree t = RouteCompiler.compile(testee());

        assertThat(t.patterns()).containsExactly("/", "/files/*path", "/users/:id");
        Match m = t.match("/users/42");
        assertThat(m.params()).containsEntry("id", "42");
        assertThat(m.node().bindings().allowed()).containsExactly(GET, POST);
        assertThat(m.handler("GET")).isInstanceOf(Hello.class);
        assertThat(m.handler("POST")).isInstanceOf(Echo.class);
    }

    @Test
    void lists_sorted_and_skips_hidden_and_files() throws IOException {
        Files.createDirectories(root.resolve("b"));
        Files.createDirectories(root.resolve("a"));
        Files.createDirectories(root.resolve(".git"));
        Files.writeString(root.resolve("c"), "not a directory");
        assertThat(testee().listDirectories(List.of())).containsExactly("a", "b");
    }

    @Test
    void no_leaf_file() throws IOException {
        Files.createDirectories(root.resolve("a"));
        assertThat(testee().readLeaf(List.of("a"))).isEmpty();
    }

    @Test
    void empty_leaf_file() throws IOException {
        leaf("a");
        assertThat(testee().readLeaf(List.of("a"))).contains(List.of());
    }

    @Test
    void declarations_keep_file_order() throws IOException {
        leaf("a", "POST=" + Echo.class.getName(),
                  "# comment",
                  "GET=" + Hello.class.getName());
        assertThat(testee().readLeaf(List.of("a")).orElseThrow())
                .extracting(HandlerDeclaration::method)
                .containsExactly("POST", "GET");
    }

    @Test
    void custom_leaf_file_name() throws IOException {
        Path d = Files.createDirectories(root.resolve("x"));
        Files.writeString(d.resolve("handlers.txt"), "GET=" + Hello.class.getName(), UTF_8);
        Files.writeString(d.resolve("route.properties"), "GET=does.not.Exist", UTF_8);
        Config c = Config.configuration().leafFileName("handlers.txt").build();
        RouteTree t = RouteCompiler.compile(FileSystemRouteSource.of(root, c));
        assertThat(t.patterns()).containsExactly("/x");
    }

    // Failures
    // ----

    @Test
    void duplicate_key_fails() throws IOException {
        leaf("a", "GET=" + Hello.class.getName(),
                  "GET=" + Echo.class.getName());
        assertThatThrownBy(() -> RouteCompiler.compile(testee()))
                .isExactlyInstanceOf(HandlerBindingException.class)
                .hasMessageContaining("bound twice");
    }

    @Test
    void class_not_found() throws IOException {
        leaf("a", "GET=com.example.Missing");
        assertThatThrownBy(() -> testee().readLeaf(List.of("a")))
                .isExactlyInstanceOf(HandlerBindingException.class)
                .hasMessageContaining("com.example.Missing")
                .hasCauseExactlyInstanceOf(ClassNotFoundException.class);
    }

    @Test
    void empty_class_name() throws IOException {
        leaf("a", "GET=");
        assertThatThrownBy(() -> testee().readLeaf(List.of("a")))
                .isExactlyInstanceOf(HandlerBindingException.class)
                .hasMessageContaining("No handler class");
    }

    @Test
    void not_a_request_handler() throws IOException {
        leaf("a", "GET=" + String.class.getName());
        assertThatThrownBy(() -> testee().readLeaf(List.of("a")))
                .isExactlyInstanceOf(HandlerBindingException.class)
                .hasMessageContaining("does not implement");
    }

    @Test
    void no_public_noarg_constructor() throws IOException {
        leaf("a", "GET=" + NeedsArgument.class.getName());
        assertThatThrownBy(() -> testee().readLeaf(List.of("a")))
                .isExactlyInstanceOf(HandlerBindingException.class)
                .hasMessageContaining("public no-arg constructor")
                .hasCauseExactlyInstanceOf(NoSuchMethodException.class);
    }

    @Test
    void constructor_throws() throws IOException {
        leaf("a", "GET=" + Explodes.class.getName());
        assertThatThrownBy(() -> testee().readLeaf(List.of("a")))
                .isExactlyInstanceOf(HandlerBindingException.class)
                .hasMessageContaining("Constructor of")
                .hasCauseExactlyInstanceOf(IllegalStateException.class);
    }

    @Test
    void websocket_key_loads_websocket_handler() throws IOException {
        leaf("chat", "GET=" + Hello.class.getName(),
                     "WEBSOCKET=" + Silent.class.getName());
        Match m = RouteCompiler.compile(testee()).match("/chat");
        assertThat(m.handler("GET")).isInstanceOf(Hello.class);
        assertThat(m.webSocketHandler()).containsInstanceOf(Silent.class);
    }

    @Test
    void websocket_key_with_request_handler_fails() throws IOException {
        leaf("chat", "WEBSOCKET=" + Hello.class.getName());
        assertThatThrownBy(() -> testee().readLeaf(List.of("chat")))
                .isExactlyInstanceOf(HandlerBindingException.class)
                .hasMessageContaining("does not implement " + WebSocketHandler.class.getName());
    }

    @Test
    void root_is_not_a_directory() throws IOException {
        Path file = Files.writeString(root.resolve("file"), "x");
        var src = new FileSystemRouteSource(file);
        assertThatThrownBy(() -> RouteCompiler.compile(src))
                .isExactlyInstanceOf(RouteCompilationException.class)
                .hasCauseExactlyInstanceOf(IOException.class);
    }

    private FileSystemRouteSource testee() {
        return new FileSystemRouteSource(root,
                FileSystemRouteSource.DEFAULT_LEAF_FILE_NAME,
                FileSystemRouteSourceTest.class.getClassLoader());
    }

    private void leaf(String dir, String... lines) throws IOException {
        Path d = Files.createDirectories(root.resolve(dir));
        Files.writeString(d.resolve(FileSystemRouteSource.DEFAULT_LEAF_FILE_NAME),
                String.join("\n", lines), UTF_8);
    }

    public static class Hello implements RequestHandler {
        @Override
        public CompletionStage<Response> apply(Request request) {
            return completedStage(text("Hello"));
        }
    }

    public static class Echo implements RequestHandler {
        @Override
        public CompletionStage<Response> apply(Request request) {
            return completedStage(text(request.bodyAsString()));
        }
    }

    public static class Silent implements WebSocketHandler {
        @Override
        public void handle(Portal portal) {
            portal.close();
        }
    }

    public static class NeedsArgument implements RequestHandler {
        private final String greeting;

        public NeedsArgument(String greeting) {
            this.greeting = greeting;
        }

        @Override
        public CompletionStage<Response> apply(Request request) {
            return completedStage(text(greeting));
        }
    }

    public static class Explodes implements RequestHandler {
        public Explodes() {
            throw new IllegalStateException("boom");
        }

        @Override
        public CompletionStage<Response> apply(Request request) {
            throw new AssertionError();
        }
    }
}
