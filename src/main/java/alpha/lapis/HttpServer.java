package alpha.lapis;

import alpha.lapis.events.EventHub;
import alpha.lapis.handler.ErrorHandler;
import alpha.lapis.handler.RequestHandler;
import alpha.lapis.internal.DefaultServer;
import alpha.lapis.route.FileSystemRouteSource;
import alpha.lapis.route.RouteCompiler;
import alpha.lapis.route.RouteTree;
import alpha.lapis.transport.SocketTransport;
import alpha.lapis.transport.Transport;

import java.io.IOException;
import java.net.SocketAddress;
import java.nio.file.Path;

/**
 * Listens on a port for HTTP requests and dispatches them to the {@link
 * RequestHandler}s of a compiled {@link RouteTree}.<p>
 *
 * The routes are compiled once, before the server is created, and never
 * change. A trivial example:
 * <pre>{@code
 *   RouteTree routes = RouteCompiler.compile(new FileSystemRouteSource(Path.of("api")));
 *   HttpServer s = HttpServer.create(routes).start("localhost", 8080);
 *   System.out.println("Listening on port " + s.port());
 * }</pre>
 *
 * {@link #start(SocketAddress)} opens the transport and returns. The accept
 * loop runs on a dedicated non-daemon thread until the server {@link #stop()
 * stops}, and each request is dispatched as an independent unit on an
 * elastic thread pool.<p>
 *
 * A server instance can not be recycled; it can only start and stop once.<p>
 *
 * The server's {@link #events()} hub receives all events the server emits.
 * The events are documented in package {@link alpha.lapis.events}.
 *
 * @see RouteCompiler
 * @see ErrorHandler
 */
public interface HttpServer
{
    /**
     * Create a server using the {@linkplain Config#DEFAULT default
     * configuration}.
     *
     * @param routes of server
     * @param eh error handlers, tried in order
     * @return an instance of {@link DefaultServer}
     * @throws NullPointerException if any argument is {@code null}
     */
    static HttpServer create(RouteTree routes, ErrorHandler... eh) {
        return create(routes, Config.DEFAULT, eh);
    }

    /**
     * Create a server using the {@link SocketTransport}.
     *
     * @param routes of server
     * @param config of server
     * @param eh error handlers, tried in order
     * @return an instance of {@link DefaultServer}
     * @throws NullPointerException if any argument is {@code null}
     */
    static HttpServer create(RouteTree routes, Config config, ErrorHandler... eh) {
        return create(routes, config, Transport.create(config), eh);
    }

    /**
     * Create a server.
     *
     * @param routes of server
     * @param config of server
     * @param transport of server
     * @param eh error handlers, tried in order
     * @return an instance of {@link DefaultServer}
     * @throws NullPointerException if any argument is {@code null}
     */
    static HttpServer create(
            RouteTree routes, Config config, Transport transport, ErrorHandler... eh)
    {
        return new DefaultServer(routes, config, transport, eh);
    }

    /**
     * Compile the routes of a directory and create a server.<p>
     *
     * The leaf file name is taken from {@link Config#leafFileName()}.
     *
     * @param directory of routes
     * @param config of server
     * @param eh error handlers, tried in order
     * @return an instance of {@link DefaultServer}
     * @throws alpha.lapis.route.RouteCompilationException
     *             if compilation fails
     */
    static HttpServer create(Path directory, Config config, ErrorHandler... eh) {
        RouteTree routes = RouteCompiler.compile(FileSystemRouteSource.of(directory, config));
        return create(routes, config, eh);
    }

    /**
     * Start the server on the given address and port.<p>
     *
     * Port 0 binds a system-picked port, which is then available through
     * {@link #port()}.
     *
     * @param address hostname or IP literal
     * @param port to listen on
     * @return this (for chaining)
     * @throws IOException if the transport fails to open
     * @throws IllegalStateException if the server has started before
     */
    HttpServer start(String address, int port) throws IOException;

    /**
     * Start the server on the given address.
     *
     * @param address to listen on
     * @return this (for chaining)
     * @throws IOException if the transport fails to open
     * @throws IllegalStateException if the server has started before
     */
    HttpServer start(SocketAddress address) throws IOException;

    /**
     * Stop the server.<p>
     *
     * The transport is closed and no new requests are accepted. In-flight
     * dispatches are given {@link Config#timeoutGracefulStop()} to complete,
     * after which their handlers are cancelled and their connections closed.
     * Each abandoned dispatch is logged and reported as a {@link
     * alpha.lapis.events.DispatchAbandoned} event.<p>
     *
     * This method is idempotent. Stopping a server that never started makes
     * it impossible to start.
     *
     * @throws IOException if closing the transport fails
     * @throws InterruptedException if interrupted while waiting
     */
    void stop() throws IOException, InterruptedException;

    /**
     * Returns {@code true} if the server is accepting requests.
     *
     * @return {@code true} if the server is accepting requests
     */
    boolean isRunning();

    /**
     * Returns the port the server is listening on.
     *
     * @return the port the server is listening on
     * @throws IllegalStateException if the server has not started, or
     *                               the transport address has no port
     */
    int port();

    /**
     * Returns the server's configuration.
     *
     * @return the server's configuration
     */
    Config config();

    /**
     * Returns the server's routes.
     *
     * @return the server's routes
     */
    RouteTree routes();

    /**
     * Returns the server's event hub.
     *
     * @return the server's event hub
     */
    EventHub events();
}
