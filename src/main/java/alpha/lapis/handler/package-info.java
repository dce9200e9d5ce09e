/**
 * Handlers make things happen.<p>
 *
 * A {@link alpha.lapis.handler.RequestHandler RequestHandler} processes a
 * {@link alpha.lapis.message.Request Request} into a {@link
 * alpha.lapis.message.Response Response}. An {@link
 * alpha.lapis.handler.ErrorHandler ErrorHandler} translates an exception into
 * a response.
 */
package alpha.lapis.handler;
