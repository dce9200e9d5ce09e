package alpha.lapis.internal;

import alpha.lapis.Config;
import alpha.lapis.HttpConstants.StatusCode;
import alpha.lapis.events.DispatchCancelled;
import alpha.lapis.events.EventHub;
import alpha.lapis.events.HandlerFailed;
import alpha.lapis.events.MethodNotAllowed;
import alpha.lapis.events.RequestReceived;
import alpha.lapis.events.ResponseMalformed;
import alpha.lapis.events.RouteMatched;
import alpha.lapis.events.RouteNotFound;
import alpha.lapis.handler.ErrorHandler;
import alpha.lapis.handler.HandlerExecutionException;
import alpha.lapis.handler.HandlerTimeoutException;
import alpha.lapis.handler.RequestHandler;
import alpha.lapis.message.BadRequestException;
import alpha.lapis.message.Headers;
import alpha.lapis.message.MalformedResponseException;
import alpha.lapis.message.RawRequest;
import alpha.lapis.message.Request;
import alpha.lapis.message.Response;
import alpha.lapis.message.SerializedResponse;
import alpha.lapis.route.Match;
import alpha.lapis.route.MethodNotAllowedException;
import alpha.lapis.route.NoRouteFoundException;
import alpha.lapis.route.PathMatcher;
import alpha.lapis.route.RouteTree;
import alpha.lapis.transport.TransportException;
import alpha.lapis.websocket.WebSocketHandshake;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedFuture;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Dispatches a {@link RawRequest} to the handler of the matching route and
 * produces the serialized response.<p>
 *
 * Each dispatch goes through these steps:
 * <ol>
 *   <li>The path is normalized and matched against the route tree. If no
 *       bound route matches, the response is "404 Not Found".</li>
 *   <li>If the matched route has no handler for the request method, the
 *       response is "405 Method Not Allowed" with an "Allow" header.</li>
 *   <li>The {@link Request} is created and the handler invoked on the
 *       calling thread.</li>
 *   <li>When the handler's stage completes, the response is validated and
 *       serialized. A handler failure translates to "500 Internal Server
 *       Error", and so does a malformed response.</li>
 * </ol>
 *
 * Exceptions are translated to responses by the application's error
 * handlers, tried in order, and then by {@link ErrorHandler#base(Config)}.
 * Every stage returned by this class therefore completes normally with a
 * response, unless the dispatch was cancelled, in which case it completes
 * exceptionally with a {@link TransportException}.<p>
 *
 * A request asking to upgrade to a WebSocket is looked up with {@link
 * #webSocket(RawRequest)} before it is dispatched.<p>
 *
 * The dispatcher holds no mutable state and is safe to use concurrently.
 */
public final class Dispatcher
{
    private static final System.Logger LOG
            = System.getLogger(Dispatcher.class.getPackageName());

    private final RouteTree tree;
    private final Config config;
    private final EventHub events;
    private final List<ErrorHandler> errorHandlers;
    private final ErrorHandler base;

    /**
     * Constructs a {@code Dispatcher}.
     *
     * @param tree of routes
     * @param config of server
     * @param events receiver of dispatch events
     * @param errorHandlers of application, in order
     * @throws NullPointerException if any argument is {@code null}
     */
    public Dispatcher(
            RouteTree tree, Config config, EventHub events, List<ErrorHandler> errorHandlers)
    {
        this.tree = requireNonNull(tree);
        this.config = requireNonNull(config);
        this.events = requireNonNull(events);
        this.errorHandlers = List.copyOf(errorHandlers);
        this.base = ErrorHandler.base(config);
    }

    /**
     * Dispatch a request.
     *
     * @param raw request
     * @return the response
     * @throws NullPointerException if {@code raw} is {@code null}
     */
    public CompletionStage<SerializedResponse> dispatch(RawRequest raw) {
        return dispatch0(requireNonNull(raw), null);
    }

    /**
     * Dispatch a request that can be cancelled.<p>
     *
     * If the given {@code cancel} signal completes before the handler's stage
     * does, the handler's stage is cancelled (best-effort) and the returned
     * stage completes exceptionally with a {@link TransportException}. A
     * normally completed signal means that the client disconnected, which is
     * reported as a {@link DispatchCancelled} event. An exceptionally
     * completed signal means that the owner abandoned the dispatch; the cause
     * of the {@code TransportException} is the signal's exception.
     *
     * @param raw request
     * @param cancel signal
     * @return the response
     * @throws NullPointerException if any argument is {@code null}
     */
    public CompletionStage<SerializedResponse> dispatch(RawRequest raw, CompletionStage<?> cancel) {
        return dispatch0(requireNonNull(raw), requireNonNull(cancel));
    }

    /**
     * Find the WebSocket handler of a request that asks for an upgrade.<p>
     *
     * An empty optional is returned if the request does not ask for an
     * upgrade, or if the matched route has no WebSocket handler bound, in
     * which case the request should be {@link #dispatch(RawRequest,
     * CompletionStage) dispatched} as plain HTTP. A path that matches no
     * route, or fails to decode, also yields an empty optional; the dispatch
     * then reports the failure.
     *
     * @param raw request
     * @return the match of a route with a WebSocket handler, if any
     * @throws NullPointerException if {@code raw} is {@code null}
     * @see WebSocketHandshake#isUpgrade(RawRequest)
     */
    public Optional<Match> webSocket(RawRequest raw) {
        if (!WebSocketHandshake.isUpgrade(raw)) {
            return Optional.empty();
        }
        final String path = PathMatcher.normalize(raw.path());
        final Match m;
        try {
            m = tree.match(path);
        } catch (NoRouteFoundException | BadRequestException e) {
            return Optional.empty();
        }
        if (m.webSocketHandler().isEmpty()) {
            LOG.log(DEBUG, () -> "No WebSocket handler at " + m.node().pattern() + "; upgrade ignored.");
            return Optional.empty();
        }
        LOG.log(DEBUG, () -> "Matched WebSocket upgrade " + path + " to " + m.node().pattern());
        emit(RequestReceived.INSTANCE, raw, null);
        emit(RouteMatched.INSTANCE, raw, m);
        return Optional.of(m);
    }

    private CompletionStage<SerializedResponse> dispatch0(RawRequest raw, CompletionStage<?> cancel) {
        emit(RequestReceived.INSTANCE, raw, null);
        final String path = PathMatcher.normalize(raw.path());
        final RequestHandler handler;
        final Request req;
        try {
            Match m = tree.match(path);
            LOG.log(DEBUG, () -> "Matched " + raw.method() + " " + path + " to " + m.node().pattern());
            emit(RouteMatched.INSTANCE, raw, m);
            handler = m.handler(raw.method());
            req = new DefaultRequest(raw, path, m.params());
        } catch (NoRouteFoundException e) {
            emit(RouteNotFound.INSTANCE, raw, e);
            return completedFuture(error(e, raw));
        } catch (MethodNotAllowedException e) {
            emit(MethodNotAllowed.INSTANCE, raw, e);
            return completedFuture(error(e, raw));
        } catch (BadRequestException e) {
            return completedFuture(error(e, raw));
        }
        return invoke(handler, req, raw, cancel);
    }

    private CompletionStage<SerializedResponse> invoke(
            RequestHandler handler, Request req, RawRequest raw, CompletionStage<?> cancel)
    {
        final CompletionStage<Response> stage;
        try {
            stage = handler.apply(req);
        } catch (Exception e) {
            return completedFuture(failed(e, raw));
        }
        if (stage == null) {
            return completedFuture(malformed(
                    new MalformedResponseException("Handler returned a null stage.", null), raw));
        }

        final var result = new CompletableFuture<SerializedResponse>();
        final var rsp = new CompletableFuture<Response>();
        stage.whenComplete((r, thr) -> {
            if (thr == null) {
                rsp.complete(r);
            } else {
                rsp.completeExceptionally(thr);
            }
        });
        config.timeoutHandler().ifPresent(d -> rsp.orTimeout(d.toNanos(), NANOSECONDS));

        if (cancel != null) {
            cancel.whenComplete((ign, thr) -> {
                var e = thr == null ?
                        new TransportException("Client disconnected.") :
                        new TransportException("Dispatch abandoned.", thr);
                if (result.completeExceptionally(e)) {
                    cancel(stage);
                    LOG.log(DEBUG, () -> e.getMessage() + " Cancelled handler of " + req.path());
                    if (thr == null) {
                        emit(DispatchCancelled.INSTANCE, raw, null);
                    }
                }
            });
        }

        rsp.whenComplete((r, thr) -> {
            if (result.isDone()) {
                // Cancelled
                return;
            }
            final SerializedResponse s;
            if (thr == null) {
                s = validate(r, raw);
            } else {
                Throwable t = unwrap(thr);
                if (t instanceof TimeoutException) {
                    cancel(stage);
                    s = failed(new HandlerTimeoutException(config.timeoutHandler().orElseThrow(), t), raw);
                } else {
                    s = failed(t, raw);
                }
            }
            result.complete(s);
        });

        return result;
    }

    private SerializedResponse validate(Response r, RawRequest raw) {
        if (r == null) {
            return malformed(new MalformedResponseException(
                    "Handler completed with a null response.", null), raw);
        }
        final String problem = problem(r);
        return problem == null ? serialize(r) :
                malformed(new MalformedResponseException(problem, r), raw);
    }

    /**
     * Returns what makes the response unfit for the wire, or {@code null} if
     * nothing does.
     */
    private static String problem(Response r) {
        if (!StatusCode.isValid(r.statusCode())) {
            return "Status code out of range: " + r.statusCode();
        }
        if (r.reasonPhrase() == null || r.headers() == null || r.body() == null) {
            return "Response has a null component.";
        }
        if (!Headers.isValidValue(r.reasonPhrase())) {
            return "Invalid reason phrase: " + r.reasonPhrase();
        }
        for (var e : r.headers().entrySet()) {
            if (e.getKey() == null || !Headers.isValidName(e.getKey())) {
                return "Invalid header name: " + e.getKey();
            }
            if (e.getValue() == null) {
                return "Header \"" + e.getKey() + "\" has null values.";
            }
            for (String v : e.getValue()) {
                if (v == null || !Headers.isValidValue(v)) {
                    return "Invalid value of header \"" + e.getKey() + "\".";
                }
            }
        }
        if (r.body().length > 0 && !SerializedResponse.mayHaveBody(r.statusCode())) {
            return "Status code " + r.statusCode() + " does not allow a body.";
        }
        return null;
    }

    private SerializedResponse failed(Throwable t, RawRequest raw) {
        final HandlerExecutionException e = t instanceof HandlerExecutionException ?
                (HandlerExecutionException) t :
                new HandlerExecutionException("Request handler failed.", t);
        emit(HandlerFailed.INSTANCE, raw, e);
        return error(e, raw);
    }

    private SerializedResponse malformed(MalformedResponseException e, RawRequest raw) {
        emit(ResponseMalformed.INSTANCE, raw, e);
        return error(e, raw);
    }

    private SerializedResponse error(Exception exc, RawRequest raw) {
        for (ErrorHandler h : errorHandlers) {
            final Response r;
            try {
                r = h.apply(exc, raw);
            } catch (Exception next) {
                if (next != exc) {
                    LOG.log(WARNING, "Error handler failed.", next);
                    exc.addSuppressed(next);
                }
                continue;
            }
            if (r != null && problem(r) == null) {
                return serialize(r);
            }
            LOG.log(WARNING, () -> "Error handler returned an invalid response: " + r);
        }
        try {
            return serialize(base.apply(exc, raw));
        } catch (Exception e) {
            throw new AssertionError("Base error handler failed.", e);
        }
    }

    private SerializedResponse serialize(Response r) {
        return SerializedResponse.of(r, config.serverName());
    }

    private void emit(Object event, Object att1, Object att2) {
        try {
            events.dispatch(event, att1, att2);
        } catch (RuntimeException e) {
            LOG.log(WARNING, "Event listener failed.", e);
        }
    }

    private static void cancel(CompletionStage<?> stage) {
        if (stage instanceof Future) {
            ((Future<?>) stage).cancel(true);
        }
    }

    private static Throwable unwrap(Throwable thr) {
        return thr instanceof CompletionException && thr.getCause() != null ?
                thr.getCause() : thr;
    }
}
