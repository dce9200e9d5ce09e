package alpha.lapis;

import alpha.lapis.events.DispatchAbandoned;
import alpha.lapis.events.DispatchCancelled;
import alpha.lapis.events.HandlerFailed;
import alpha.lapis.events.ResponseSent;
import alpha.lapis.events.ServerStarted;
import alpha.lapis.events.ServerStopped;
import alpha.lapis.events.WebSocketClosed;
import alpha.lapis.events.WebSocketOpened;
import alpha.lapis.handler.ErrorHandler;
import alpha.lapis.handler.RequestHandler;
import alpha.lapis.message.Request;
import alpha.lapis.message.Response;
import alpha.lapis.message.SerializedResponse;
import alpha.lapis.route.MemoryRouteSource;
import alpha.lapis.route.RouteCompiler;
import alpha.lapis.testutil.Logging;
import alpha.lapis.testutil.TestClient;
import alpha.lapis.testutil.WebSocketClient;
import alpha.lapis.websocket.CloseCode;
import alpha.lapis.websocket.Portal;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

import static alpha.lapis.message.Responses.text;
import static alpha.lapis.testutil.TestClient.CRLF;
import static alpha.lapis.testutil.TestClient.get;
import static alpha.lapis.testutil.TestClient.request;
import static java.lang.System.Logger.Level.WARNING;
import static java.net.InetAddress.getLoopbackAddress;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.CompletableFuture.completedFuture;
import static java.util.concurrent.CompletableFuture.delayedExecutor;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests of {@link HttpServer}, running on a loopback port.
 */
class HttpServerTest
{
    private HttpServer server;

    @TempDir
    Path dir;

    @AfterEach
    void stopServer() throws IOException, InterruptedException {
        if (server != null) {
            server.stop();
        }
    }

    // Basic exchanges
    // ----

    @Test
    void get_dynamic_route() throws IOException {
        start(MemoryRouteSource.builder()
                .handler("/users/[id]", "GET", req -> completedFuture(text("user " + req.param("id")))));
        var rsp = client().writeRead(get("/users/42"));
        assertThat(rsp.statusLine()).isEqualTo("HTTP/1.1 200 OK");
        assertThat(rsp.header("Content-Length")).isEqualTo("7");
        assertThat(rsp.header("Connection")).isEqualTo("close");
        assertThat(rsp.body()).isEqualTo("user 42");
    }

    @Test
    void not_found_and_method_not_allowed() throws IOException {
        start(MemoryRouteSource.builder()
                .handler("/x", "GET", respond("x"))
                .handler("/x", "PUT", respond("x")));
        assertThat(client().writeRead(get("/y")).statusCode()).isEqualTo(404);
        var rsp = client().writeRead(request("DELETE", "/x"));
        assertThat(rsp.statusCode()).isEqualTo(405);
        assertThat(rsp.header("Allow")).isEqualTo("GET, PUT");
    }

    @Test
    void handler_failure_does_not_leak() throws IOException {
        start(MemoryRouteSource.builder()
                .handler("/boom", "GET", req -> { throw new IllegalStateException("password=hunter2"); }));
        var rsp = client().writeRead(get("/boom"));
        assertThat(rsp.statusCode()).isEqualTo(500);
        assertThat(rsp.body()).isEqualTo("Internal Server Error");
    }

    @Test
    void apache_client_get_and_post() throws IOException {
        start(MemoryRouteSource.builder()
                .handler("/files/[...path]", "GET", req -> completedFuture(text(req.param("path"))))
                .handler("/echo", "POST", req -> completedFuture(
                        text(req.bodyAsString() + "?" + req.queryFirst("q").orElse("")))));

        try (CloseableHttpClient cli = HttpClients.createDefault()) {
            assertThat(execute(cli, new HttpGet(uri("/files/a/b%20c.txt"))))
                    .isEqualTo("200 a/b c.txt");

            var post = new HttpPost(uri("/echo?q=x+y"));
            post.setEntity(new StringEntity("ping"));
            assertThat(execute(cli, post)).isEqualTo("200 ping?x y");
        }
    }

    @Test
    void file_system_routes() throws IOException {
        Files.writeString(Files.createDirectories(dir.resolve("hello/[name]"))
                .resolve("route.properties"), "GET=" + Hello.class.getName(), UTF_8);
        server = HttpServer.create(dir, Config.DEFAULT)
                          .start(new InetSocketAddress(getLoopbackAddress(), 0));
        assertThat(server.routes().patterns()).containsExactly("/hello/:name");
        assertThat(client().writeRead(get("/hello/World")).body()).isEqualTo("Hello, World!");
    }

    @Test
    void application_error_handler() throws IOException {
        ErrorHandler teapot = (exc, req) -> Response.builder(418, "I'm a teapot").build();
        server = HttpServer.create(
                RouteCompiler.compile(MemoryRouteSource.builder().build()), Config.DEFAULT, teapot)
                .start(new InetSocketAddress(getLoopbackAddress(), 0));
        assertThat(client().writeRead(get("/")).statusLine()).isEqualTo("HTTP/1.1 418 I'm a teapot");
    }

    // Rejected by the transport
    // ----

    @Test
    void missing_host_is_400() throws IOException {
        start(MemoryRouteSource.builder().handler("/", "GET", respond("x")));
        var rsp = client().writeRead("GET / HTTP/1.1" + CRLF + CRLF);
        assertThat(rsp.statusCode()).isEqualTo(400);
    }

    @Test
    void http2_is_505() throws IOException {
        start(MemoryRouteSource.builder().handler("/", "GET", respond("x")));
        var rsp = client().writeRead("GET / HTTP/2.0" + CRLF + "Host: x" + CRLF + CRLF);
        assertThat(rsp.statusCode()).isEqualTo(505);
    }

    @Test
    void chunked_is_501() throws IOException {
        start(MemoryRouteSource.builder().handler("/", "POST", respond("x")));
        var rsp = client().writeRead("POST / HTTP/1.1" + CRLF + "Host: x" + CRLF +
                                     "Transfer-Encoding: chunked" + CRLF + CRLF);
        assertThat(rsp.statusCode()).isEqualTo(501);
    }

    @Test
    void body_too_large_is_413() throws IOException {
        start(Config.configuration().maxRequestBodySize(10).build(),
              MemoryRouteSource.builder().handler("/", "POST", respond("x")));
        var rsp = client().writeRead("POST / HTTP/1.1" + CRLF + "Host: x" + CRLF +
                                     "Content-Length: 11" + CRLF + CRLF);
        assertThat(rsp.statusCode()).isEqualTo(413);
    }

    // WebSocket
    // ----

    @Test
    void websocket_echo() throws Exception {
        CountDownLatch opened = new CountDownLatch(1),
                       closed = new CountDownLatch(1);
        start(MemoryRouteSource.builder()
                .handler("/chat/[room]", "GET", respond("page"))
                .webSocket("/chat/[room]", portal -> {
                    portal.send("joined " + portal.params().get("room"));
                    for (;;) {
                        String text = portal.receive().text();
                        if (text.equals("bye")) {
                            return;
                        }
                        portal.send(text);
                    }
                }));
        server.events().on(WebSocketOpened.class, ev -> opened.countDown());
        server.events().on(WebSocketClosed.class, (ev, raw, thr) -> {
            if (thr == null) {
                closed.countDown();
            }
        });

        final String key = "dGhlIHNhbXBsZSBub25jZQ==";
        try (var ws = new WebSocketClient(client().openSocket())) {
            String head = ws.handshake(WebSocketClient.upgrade("/chat/lobby", key));
            assertThat(head).startsWith("HTTP/1.1 101 Switching Protocols" + CRLF)
                            .contains("Sec-WebSocket-Accept: s3pPLMBiTxaQ9kYGzzhZRbK+xOo=" + CRLF)
                            .contains("Connection: Upgrade" + CRLF)
                            .doesNotContain("Content-Length");
            assertThat(opened.await(3, SECONDS)).isTrue();
            assertThat(ws.read().text()).isEqualTo("joined lobby");

            ws.sendText("hi");
            assertThat(ws.read().text()).isEqualTo("hi");

            ws.sendText("bye");
            WebSocketClient.Frame f = ws.read();
            assertThat(f.opcode()).isEqualTo(WebSocketClient.CLOSE);
            assertThat(f.closeCode()).isEqualTo(CloseCode.NORMAL_CLOSURE);
            assertThat(ws.readUntilEOS()).isZero();
        }
        assertThat(closed.await(3, SECONDS)).isTrue();

        // Same route without upgrade
        assertThat(client().writeRead(get("/chat/lobby")).body()).isEqualTo("page");
    }

    @Test
    void websocket_handshake_rejected() throws IOException {
        start(MemoryRouteSource.builder().webSocket("/ws", Portal::close));
        String req = WebSocketClient.upgrade("/ws").replace(
                "Sec-WebSocket-Version: 13", "Sec-WebSocket-Version: 8");
        var rsp = client().writeRead(req);
        assertThat(rsp.statusCode()).isEqualTo(426);
        assertThat(rsp.header("Sec-WebSocket-Version")).isEqualTo("13");
        assertThat(rsp.header("Connection")).isEqualTo("close");
    }

    @Test
    void upgrade_without_websocket_handler_is_plain_http() throws IOException {
        start(MemoryRouteSource.builder().handler("/x", "GET", respond("x")));
        var rsp = client().writeRead(WebSocketClient.upgrade("/x"));
        assertThat(rsp.statusCode()).isEqualTo(200);
        assertThat(rsp.body()).isEqualTo("x");
    }

    @Test
    void websocket_only_route_without_upgrade_is_405() throws IOException {
        start(MemoryRouteSource.builder().webSocket("/ws", Portal::close));
        var rsp = client().writeRead(get("/ws"));
        assertThat(rsp.statusCode()).isEqualTo(405);
        assertThat(rsp.header("Allow")).isEmpty();
    }

    @Test
    void websocket_handler_failure_is_internal_error() throws Exception {
        CountDownLatch failed = new CountDownLatch(1);
        start(MemoryRouteSource.builder().webSocket("/ws", portal -> {
            throw new IllegalStateException("boom");
        }));
        server.events().on(HandlerFailed.class, ev -> failed.countDown());
        try (var rec = Logging.startRecording();
             var ws = new WebSocketClient(client().openSocket())) {
            assertThat(ws.handshake(WebSocketClient.upgrade("/ws"))).startsWith("HTTP/1.1 101 ");
            assertThat(ws.read().closeCode()).isEqualTo(CloseCode.INTERNAL_ERROR);
            assertThat(failed.await(3, SECONDS)).isTrue();
            assertThat(rec.await(WARNING, "WebSocket handler of /ws failed.")).isTrue();
        }
    }

    @Test
    void stop_closes_websocket_going_away() throws Exception {
        CountDownLatch opened = new CountDownLatch(1);
        start(Config.configuration().timeoutGracefulStop(Duration.ofMillis(100)).build(),
              MemoryRouteSource.builder().webSocket("/ws", portal -> {
                  opened.countDown();
                  portal.receive();
              }));
        try (var ws = new WebSocketClient(client().openSocket())) {
            ws.handshake(WebSocketClient.upgrade("/ws"));
            assertThat(opened.await(3, SECONDS)).isTrue();
            server.stop();
            assertThat(ws.read().closeCode()).isEqualTo(CloseCode.GOING_AWAY);
            assertThat(ws.readUntilEOS()).isZero();
        }
    }

    // Lifecycle
    // ----

    @Test
    void lifecycle_events_and_state() throws IOException, InterruptedException {
        List<Object> got = new CopyOnWriteArrayList<>();
        var hs = HttpServer.create(RouteCompiler.compile(MemoryRouteSource.builder()
                .handler("/", "GET", respond("x")).build()));
        hs.events().on(ServerStarted.class, ev -> got.add(ev));
        hs.events().on(ServerStopped.class, ev -> got.add(ev));
        CountDownLatch sent = new CountDownLatch(1);
        hs.events().on(ResponseSent.class, (ev, rsp, stats) -> {
            got.add(((SerializedResponse) rsp).statusCode());
            got.add(((ResponseSent.Stats) stats).bytes() > 0);
            sent.countDown();
        });

        assertThat(hs.isRunning()).isFalse();
        server = hs.start(new InetSocketAddress(getLoopbackAddress(), 0));
        assertThat(hs.isRunning()).isTrue();
        assertThat(hs.port()).isPositive();
        assertThatThrownBy(() -> hs.start(new InetSocketAddress(getLoopbackAddress(), 0)))
                .isExactlyInstanceOf(IllegalStateException.class);

        client().writeRead(get("/"));
        assertThat(sent.await(3, SECONDS)).isTrue();
        hs.stop();
        assertThat(hs.isRunning()).isFalse();
        // Idempotent
        hs.stop();

        assertThat(got).containsExactly(ServerStarted.INSTANCE, 200, true, ServerStopped.INSTANCE);
    }

    @Test
    void graceful_stop_waits_for_response() throws Exception {
        CountDownLatch invoked = new CountDownLatch(1);
        start(MemoryRouteSource.builder().handler("/slow", "GET", req -> {
            invoked.countDown();
            return CompletableFuture.supplyAsync(() -> text("done"),
                    delayedExecutor(300, MILLISECONDS));
        }));
        try (var conn = client().openConnection()) {
            conn.write(get("/slow"));
            assertThat(invoked.await(3, SECONDS)).isTrue();
            server.stop();
            assertThat(conn.readResponse().body()).isEqualTo("done");
        }
    }

    @Test
    void stop_abandons_after_grace_period() throws Exception {
        CountDownLatch invoked = new CountDownLatch(1),
                       abandoned = new CountDownLatch(1);
        var never = new CompletableFuture<Response>();
        start(Config.configuration().timeoutGracefulStop(Duration.ofMillis(100)).build(),
              MemoryRouteSource.builder().handler("/never", "GET", req -> {
                  invoked.countDown();
                  return never;
              }));
        server.events().on(DispatchAbandoned.class, ev -> abandoned.countDown());
        try (var rec = Logging.startRecording();
             var conn = client().openConnection()) {
            conn.write(get("/never"));
            assertThat(invoked.await(3, SECONDS)).isTrue();
            server.stop();
            assertThat(abandoned.await(3, SECONDS)).isTrue();
            assertThat(rec.await(WARNING, "Abandoned dispatch of")).isTrue();
            assertThat(conn.readUntilEOS()).isEmpty();
        }
        assertThat(never).isCancelled();
    }

    @Test
    void client_disconnect_cancels_handler() throws Exception {
        CountDownLatch invoked = new CountDownLatch(1),
                       cancelled = new CountDownLatch(1);
        var never = new CompletableFuture<Response>();
        start(MemoryRouteSource.builder().handler("/never", "GET", req -> {
            invoked.countDown();
            return never;
        }));
        server.events().on(DispatchCancelled.class, ev -> cancelled.countDown());
        try (var conn = client().openConnection()) {
            conn.write(get("/never"));
            assertThat(invoked.await(3, SECONDS)).isTrue();
        }
        assertThat(cancelled.await(3, SECONDS)).isTrue();
        assertThat(never).isCancelled();
    }

    @Test
    void many_concurrent_clients() throws Exception {
        start(MemoryRouteSource.builder().handler("/n/[i]", "GET", req ->
                CompletableFuture.supplyAsync(() -> text(req.param("i")),
                        delayedExecutor(50, MILLISECONDS))));
        List<CompletableFuture<String>> all = new CopyOnWriteArrayList<>();
        for (int i = 0; i < 20; ++i) {
            final String n = Integer.toString(i);
            all.add(CompletableFuture.supplyAsync(() -> {
                try {
                    return client().writeRead(get("/n/" + n)).body();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }));
        }
        for (int i = 0; i < 20; ++i) {
            assertThat(all.get(i).get(5, SECONDS)).isEqualTo(Integer.toString(i));
        }
    }

    private void start(MemoryRouteSource.Builder routes) throws IOException {
        start(Config.DEFAULT, routes);
    }

    private void start(Config config, MemoryRouteSource.Builder routes) throws IOException {
        server = HttpServer.create(RouteCompiler.compile(routes.build()), config)
                           .start(new InetSocketAddress(getLoopbackAddress(), 0));
    }

    private TestClient client() {
        return new TestClient(server);
    }

    private URI uri(String pathAndQuery) {
        return URI.create("http://" + getLoopbackAddress().getHostAddress() + ":" +
                          server.port() + pathAndQuery);
    }

    private static String execute(CloseableHttpClient cli, ClassicHttpRequest req) throws IOException {
        return cli.execute(req, rsp -> rsp.getCode() + " " + EntityUtils.toString(rsp.getEntity()));
    }

    private static RequestHandler respond(String body) {
        return RequestHandler.respond(text(body));
    }

    public static class Hello implements RequestHandler {
        @Override
        public CompletionStage<Response> apply(Request request) {
            return completedFuture(text("Hello, " + request.param("name") + "!"));
        }
    }
}
