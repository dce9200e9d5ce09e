/**
 * Home of the {@code HttpServer}.<p>
 *
 * <strong>Architectural Overview</strong>. A {@link
 * alpha.lapis.route.RouteSource RouteSource}, typically a directory, is
 * compiled into an immutable {@link alpha.lapis.route.RouteTree RouteTree}.
 * Each directory is a path segment and a leaf file in the directory binds one
 * {@link alpha.lapis.handler.RequestHandler RequestHandler} per HTTP method.
 * The {@link alpha.lapis.HttpServer HttpServer} accepts exchanges from a
 * {@link alpha.lapis.transport.Transport Transport}, matches each request path
 * against the tree and invokes the handler, which processes a {@link
 * alpha.lapis.message.Request Request} into a {@link
 * alpha.lapis.message.Response Response}.
 */
package alpha.lapis;
