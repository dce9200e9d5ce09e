package alpha.lapis.internal;

import alpha.lapis.Config;
import alpha.lapis.HttpServer;
import alpha.lapis.events.DefaultEventHub;
import alpha.lapis.events.DispatchAbandoned;
import alpha.lapis.events.EventHub;
import alpha.lapis.events.HandlerFailed;
import alpha.lapis.events.ResponseSent;
import alpha.lapis.events.ServerStarted;
import alpha.lapis.events.ServerStopped;
import alpha.lapis.events.WebSocketClosed;
import alpha.lapis.events.WebSocketOpened;
import alpha.lapis.handler.ErrorHandler;
import alpha.lapis.handler.HandlerExecutionException;
import alpha.lapis.message.RawRequest;
import alpha.lapis.message.SerializedResponse;
import alpha.lapis.route.Match;
import alpha.lapis.route.RouteTree;
import alpha.lapis.transport.Exchange;
import alpha.lapis.transport.Transport;
import alpha.lapis.websocket.CloseCode;
import alpha.lapis.websocket.InvalidFrameException;
import alpha.lapis.websocket.Portal;
import alpha.lapis.websocket.PortalClosedException;
import alpha.lapis.websocket.WebSocketHandler;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.channels.ClosedChannelException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;
import static java.time.Instant.now;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link HttpServer}.<p>
 *
 * A dedicated thread runs the accept loop. Each accepted exchange is served
 * by a task on an elastic (cached) thread pool; the task reads the request
 * and dispatches it. The response is written by a task on the same pool once
 * the handler's stage completes, so the threads of the pool are not held
 * while a handler is pending.<p>
 *
 * A request that upgrades to a WebSocket is instead served by running the
 * route's WebSocket handler on the pool thread, for as long as the
 * conversation lasts. A server that abandons the exchange on stop closes the
 * portal with {@link CloseCode#GOING_AWAY}.
 */
public final class DefaultServer implements HttpServer
{
    private static final int INITIAL_CAPACITY = 100;

    private static final System.Logger LOG
            = System.getLogger(DefaultServer.class.getPackageName());

    private final RouteTree routes;
    private final Config config;
    private final Transport transport;
    private final EventHub events;
    private final Dispatcher dispatcher;
    private final ExecutorService workers;
    private final Map<Exchange, Child> children;
    private final Object drained;
    private Instant started;
    private boolean stopped;
    private Thread acceptor;

    /**
     * Constructs a {@code DefaultServer}.
     *
     * @param routes of server
     * @param config of server
     * @param transport of server
     * @param eh error handlers
     */
    public DefaultServer(RouteTree routes, Config config, Transport transport, ErrorHandler... eh) {
        this.routes    = requireNonNull(routes);
        this.config    = requireNonNull(config);
        this.transport = requireNonNull(transport);
        this.events    = new DefaultEventHub();
        this.dispatcher = new Dispatcher(routes, config, events, List.of(eh));
        AtomicInteger n = new AtomicInteger();
        this.workers   = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "lapis-dispatch-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.children  = new ConcurrentHashMap<>(INITIAL_CAPACITY);
        this.drained   = new Object();
    }

    @Override
    public HttpServer start(String address, int port) throws IOException {
        return start(new InetSocketAddress(address, port));
    }

    @Override
    public HttpServer start(SocketAddress address) throws IOException {
        requireNonNull(address);
        synchronized (this) {
            if (started != null || stopped) {
                throw new IllegalStateException("Server has started once before.");
            }
            transport.open(address);
            started = now();
            acceptor = new Thread(this::runAcceptLoop, "lapis-acceptor");
            acceptor.start();
        }
        LOG.log(INFO, () -> "Server started on " + transport.localAddress() +
                          " with routes " + routes.patterns());
        emit(ServerStarted.INSTANCE, started, null);
        return this;
    }

    private void runAcceptLoop() {
        try {
            for (;;) {
                submit(transport.accept());
            }
        } catch (ClosedChannelException e) {
            LOG.log(DEBUG, "Transport closed; accept loop stopped.");
        } catch (IOException | RuntimeException e) {
            LOG.log(ERROR, "Accept loop failed; closing transport.", e);
            try {
                transport.close();
            } catch (IOException next) {
                e.addSuppressed(next);
                LOG.log(ERROR, "Failed to close transport.", next);
            }
        }
    }

    private void submit(Exchange x) {
        Child c = new Child();
        children.put(x, c);
        try {
            workers.execute(() -> serve(x, c));
        } catch (RejectedExecutionException e) {
            LOG.log(DEBUG, "Server stopping; closing new exchange.", e);
            finish(x);
        }
    }

    private void serve(Exchange x, Child c) {
        final Optional<RawRequest> r;
        try {
            r = x.read();
        } catch (IOException e) {
            LOG.log(DEBUG, () -> "Failed to read request from " + x + ": " + e);
            finish(x);
            return;
        } catch (RuntimeException e) {
            finish(x);
            throw e;
        }
        if (r.isEmpty()) {
            finish(x);
            return;
        }

        final RawRequest raw = c.raw = r.get();
        final Optional<Match> ws;
        try {
            ws = dispatcher.webSocket(raw);
        } catch (RuntimeException e) {
            finish(x);
            throw e;
        }
        if (ws.isPresent()) {
            converse(x, c, raw, ws.get());
            return;
        }
        final long start = System.nanoTime();
        x.disconnected().thenRun(() -> c.signal.complete(null));
        final CompletionStage<SerializedResponse> rsp;
        try {
            rsp = dispatcher.dispatch(raw, c.signal);
        } catch (RuntimeException e) {
            finish(x);
            throw e;
        }
        rsp.whenCompleteAsync((s, thr) -> respond(x, s, thr, start), workers);
    }

    private void converse(Exchange x, Child c, RawRequest raw, Match m) {
        final WebSocketHandler h = m.webSocketHandler().orElseThrow();
        try {
            final Optional<Portal> p = x.upgrade(raw, m.params());
            if (p.isEmpty()) {
                return;
            }
            final Portal portal = p.get();
            c.signal.whenComplete((ign1, ign2) -> portal.close(CloseCode.GOING_AWAY));
            emit(WebSocketOpened.INSTANCE, raw, portal);
            Throwable thr = null;
            try {
                h.handle(portal);
            } catch (PortalClosedException | InvalidFrameException e) {
                LOG.log(DEBUG, () -> "WebSocket of " + raw.path() + " closed: " + e.getMessage());
                thr = e;
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                LOG.log(WARNING, "WebSocket handler of " + raw.path() + " failed.", e);
                emit(HandlerFailed.INSTANCE, raw,
                        new HandlerExecutionException("WebSocket handler failed.", e));
                portal.close(CloseCode.INTERNAL_ERROR);
                thr = e;
            }
            portal.close();
            emit(WebSocketClosed.INSTANCE, raw, thr);
        } catch (IOException e) {
            LOG.log(DEBUG, () -> "WebSocket handshake with " + x + " failed: " + e);
        } finally {
            finish(x);
        }
    }

    private void respond(Exchange x, SerializedResponse rsp, Throwable thr, long start) {
        try {
            if (thr != null) {
                LOG.log(DEBUG, () -> "No response for " + x + ": " + thr);
                return;
            }
            if (!x.isOpen()) {
                LOG.log(DEBUG, () -> "Exchange closed; dropping response for " + x);
                return;
            }
            long n = x.write(rsp);
            emit(ResponseSent.INSTANCE, rsp, new ResponseSent.Stats(start, System.nanoTime(), n));
        } catch (IOException e) {
            LOG.log(DEBUG, () -> "Failed to write response to " + x + ": " + e);
        } finally {
            finish(x);
        }
    }

    private void finish(Exchange x) {
        x.close();
        children.remove(x);
        synchronized (drained) {
            drained.notifyAll();
        }
    }

    @Override
    public void stop() throws IOException, InterruptedException {
        final Thread a;
        synchronized (this) {
            if (started == null || stopped) {
                stopped = true;
                return;
            }
            stopped = true;
            a = acceptor;
        }
        try {
            transport.close();
            a.join();
            if (!awaitChildren(now().plus(config.timeoutGracefulStop()))) {
                abandonChildren();
            }
        } finally {
            workers.shutdownNow();
            Instant s = now();
            LOG.log(INFO, "Server stopped.");
            emit(ServerStopped.INSTANCE, s, started);
        }
    }

    private boolean awaitChildren(Instant deadline) throws InterruptedException {
        synchronized (drained) {
            while (!children.isEmpty()) {
                long ms = deadline.toEpochMilli() - now().toEpochMilli();
                if (ms <= 0) {
                    return false;
                }
                drained.wait(ms);
            }
        }
        LOG.log(DEBUG, "All exchanges finished within the graceful period.");
        return true;
    }

    private void abandonChildren() {
        LOG.log(DEBUG, "Graceful deadline expired; abandoning remaining exchanges.");
        children.forEach((x, c) -> {
            var e = new TimeoutException("Graceful stop period elapsed.");
            if (c.signal.completeExceptionally(e) && c.raw != null) {
                LOG.log(WARNING, () -> "Abandoned dispatch of " + c.raw);
                emit(DispatchAbandoned.INSTANCE, c.raw, null);
            }
            finish(x);
        });
    }

    @Override
    public synchronized boolean isRunning() {
        return started != null && !stopped && transport.isOpen();
    }

    @Override
    public int port() {
        SocketAddress a = transport.localAddress();
        if (a instanceof InetSocketAddress) {
            return ((InetSocketAddress) a).getPort();
        }
        throw new IllegalStateException("Not an internet address: " + a);
    }

    @Override
    public Config config() {
        return config;
    }

    @Override
    public RouteTree routes() {
        return routes;
    }

    @Override
    public EventHub events() {
        return events;
    }

    private void emit(Object event, Object att1, Object att2) {
        try {
            events.dispatch(event, att1, att2);
        } catch (RuntimeException e) {
            LOG.log(WARNING, "Event listener failed.", e);
        }
    }

    private static final class Child {
        final CompletableFuture<Void> signal = new CompletableFuture<>();
        volatile RawRequest raw;
    }
}
