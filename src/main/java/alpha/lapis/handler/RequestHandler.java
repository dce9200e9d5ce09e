package alpha.lapis.handler;

import alpha.lapis.HttpConstants.Method;
import alpha.lapis.message.Request;
import alpha.lapis.message.Response;
import alpha.lapis.route.RouteCompiler;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Application logic processing a {@link Request} into a {@link Response}.<p>
 *
 * A handler is bound to one {@link Method} of one route. The binding is
 * declared by the route's leaf and validated by the {@link RouteCompiler}.<p>
 *
 * The handler is asynchronous. It may complete the returned stage from any
 * thread and at any time. The server's thread that invoked the handler is
 * released as soon as the handler returns, and the server keeps accepting new
 * requests while the stage is pending. For example:
 *
 * <pre>{@code
 *   RequestHandler h = req ->
 *       userService.lookupAsync(req.param("id"))
 *                  .thenApply(user -> Responses.json(user.toJson()));
 * }</pre>
 *
 * A synchronous handler can use {@link #sync(Function)} to lift its result
 * into a completed stage.<p>
 *
 * The handler should treat a cancellation of the returned stage as a request
 * to stop working. The stage is cancelled when the client disconnects and
 * when the handler timeout elapses. A server that is stopping cancels it once
 * the graceful period has elapsed. Cancellation is best-effort; the server
 * never waits for the handler to acknowledge.<p>
 *
 * Any exception thrown by the handler, or used to complete the stage
 * exceptionally, is translated to a "500 Internal Server Error" response. The
 * handler may be invoked concurrently by many threads and must be
 * thread-safe.
 */
@FunctionalInterface
public interface RequestHandler
{
    /**
     * Process the request.
     *
     * @param request inbound request
     * @return the response stage (must not be {@code null})
     * @throws Exception for any reason
     */
    CompletionStage<Response> apply(Request request) throws Exception;

    /**
     * Create a handler from a synchronous function.
     *
     * @param logic of handler
     * @return a handler
     * @throws NullPointerException if {@code logic} is {@code null}
     */
    static RequestHandler sync(Function<Request, Response> logic) {
        requireNonNull(logic);
        return req -> CompletableFuture.completedFuture(logic.apply(req));
    }

    /**
     * Create a handler that always responds with the same response.
     *
     * @param response to respond
     * @return a handler
     * @throws NullPointerException if {@code response} is {@code null}
     */
    static RequestHandler respond(Response response) {
        requireNonNull(response);
        final CompletionStage<Response> stage = CompletableFuture.completedStage(response);
        return ignored -> stage;
    }
}
