package alpha.lapis.handler;

import alpha.lapis.Config;
import alpha.lapis.message.BadRequestException;
import alpha.lapis.message.MalformedResponseException;
import alpha.lapis.message.RawRequest;
import alpha.lapis.message.Response;
import alpha.lapis.route.MethodNotAllowedException;
import alpha.lapis.route.NoRouteFoundException;

import static alpha.lapis.HttpConstants.HeaderName.ALLOW;
import static alpha.lapis.HttpConstants.HeaderName.CONTENT_TYPE;
import static alpha.lapis.message.Responses.badRequest;
import static alpha.lapis.message.Responses.internalServerError;
import static alpha.lapis.message.Responses.methodNotAllowed;
import static alpha.lapis.message.Responses.notFound;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.stream.Collectors.joining;

/**
 * Handles an exception by translating it into a response.<p>
 *
 * The server keeps a list of error handlers supplied by the application,
 * invoked in order when a request could not be matched, the handler failed,
 * or the handler produced a malformed response. An error handler that does
 * not wish to handle the exception must rethrow it, which passes the
 * exception to the next handler in line.<p>
 *
 * For example:
 * <pre>{@code
 *   ErrorHandler onlyMine = (exc, req) -> {
 *       try {
 *           throw exc;
 *       } catch (HandlerExecutionException e) {
 *           if (e.getCause() instanceof InsufficientFundsException) {
 *               return Response.builder(402, "Payment Required").build();
 *           }
 *           throw e;
 *       }
 *   };
 * }</pre>
 *
 * If all error handlers rethrow, or if none were supplied, then {@link
 * #DEFAULT} is used. An error handler that throws a different exception than
 * the one it was given is considered to have failed. The new exception is
 * logged, added as suppressed to the original, and the next handler is given
 * the original.<p>
 *
 * The error handler may be invoked concurrently by many threads and must be
 * thread-safe.
 *
 * @see Config#verboseErrors()
 */
@FunctionalInterface
public interface ErrorHandler
{
    /**
     * Handle an exception.<p>
     *
     * The request may be used to customize the response, for example by
     * reading its path or headers. The request is never {@code null}.
     *
     * @param exc the exception to handle (never {@code null})
     * @param request the request being dispatched (never {@code null})
     *
     * @return a response (must not be {@code null})
     *
     * @throws Exception to pass the exception to the next handler
     */
    Response apply(Exception exc, RawRequest request) throws Exception;

    /**
     * The default error handler, which never leaks exception details.<p>
     *
     * The default error handler translates:
     *
     * <table class="striped">
     *   <caption style="display:none">Default Handlers</caption>
     *   <thead>
     *   <tr>
     *     <th scope="col">Exception Type</th>
     *     <th scope="col">Logged</th>
     *     <th scope="col">Response</th>
     *   </tr>
     *   </thead>
     *   <tbody>
     *   <tr>
     *     <th scope="row"> {@link BadRequestException} </th>
     *     <td> No </td>
     *     <td> 400 (Bad Request) </td>
     *   </tr>
     *   <tr>
     *     <th scope="row"> {@link NoRouteFoundException} </th>
     *     <td> No </td>
     *     <td> 404 (Not Found) </td>
     *   </tr>
     *   <tr>
     *     <th scope="row"> {@link MethodNotAllowedException} </th>
     *     <td> No </td>
     *     <td> 405 (Method Not Allowed) with an "Allow" header </td>
     *   </tr>
     *   <tr>
     *     <th scope="row"> {@link HandlerTimeoutException} </th>
     *     <td> Yes </td>
     *     <td> 500 (Internal Server Error) </td>
     *   </tr>
     *   <tr>
     *     <th scope="row"> {@link HandlerExecutionException} </th>
     *     <td> Yes </td>
     *     <td> 500 (Internal Server Error) </td>
     *   </tr>
     *   <tr>
     *     <th scope="row"> {@link MalformedResponseException} </th>
     *     <td> Yes </td>
     *     <td> 500 (Internal Server Error) </td>
     *   </tr>
     *   <tr>
     *     <th scope="row"> <i>Everything else</i> </th>
     *     <td> Yes </td>
     *     <td> 500 (Internal Server Error) </td>
     *   </tr>
     *   </tbody>
     * </table>
     *
     * The body of the response is the reason phrase.
     */
    ErrorHandler DEFAULT = (exc, req) -> translate(exc, req, false);

    /**
     * Same as {@link #DEFAULT}, except the body of the response also carries
     * the exception's class name and message.<p>
     *
     * Used instead of {@code DEFAULT} if {@link Config#verboseErrors()} is
     * {@code true}.
     */
    ErrorHandler VERBOSE = (exc, req) -> translate(exc, req, true);

    /**
     * Returns {@link #VERBOSE} if the given configuration asks for verbose
     * errors, otherwise {@link #DEFAULT}.
     *
     * @param config of server
     * @return the base error handler
     */
    static ErrorHandler base(Config config) {
        return config.verboseErrors() ? VERBOSE : DEFAULT;
    }

    private static Response translate(Exception exc, RawRequest req, boolean verbose) {
        final Response res;
        try {
            throw exc;
        } catch (BadRequestException e) {
            logger().log(DEBUG, () -> "Bad request: " + req.path());
            res = badRequest();
        } catch (NoRouteFoundException e) {
            logger().log(DEBUG, () -> "No route found: " + e.getPath());
            res = notFound();
        } catch (MethodNotAllowedException e) {
            logger().log(DEBUG, () -> "Method not allowed: " + req.method() + " " + req.path());
            res = methodNotAllowed().toBuilder()
                    .header(ALLOW, e.getAllowed().stream().map(Enum::name).collect(joining(", ")))
                    .build();
        } catch (HandlerTimeoutException e) {
            log(exc);
            res = internalServerError();
        } catch (HandlerExecutionException | MalformedResponseException e) {
            log(exc);
            res = internalServerError();
        } catch (Exception everythingElse) {
            // Expected
            //   TransportException (if the exchange is still open)
            //   RouteCompilationException (never at request time)
            log(exc);
            res = internalServerError();
        }
        return verbose ? withDetail(res, exc) : res;
    }

    private static Response withDetail(Response res, Exception exc) {
        String detail = res.reasonPhrase() + "\n" +
                exc.getClass().getName() + ": " + exc.getMessage();
        Throwable cause = exc.getCause();
        if (cause != null) {
            detail += "\nCaused by: " + cause.getClass().getName() + ": " + cause.getMessage();
        }
        return res.toBuilder()
                  .header(CONTENT_TYPE, "text/plain; charset=utf-8")
                  .body(detail.getBytes(UTF_8))
                  .build();
    }

    private static void log(Exception exc) {
        logger().log(ERROR, "Request failed.", exc);
    }

    private static System.Logger logger() {
        return System.getLogger(ErrorHandler.class.getPackageName());
    }
}
