/**
 * The seam between the server and the network. The server consumes {@link
 * alpha.lapis.transport.Exchange Exchange}s from a {@link
 * alpha.lapis.transport.Transport Transport}; the default implementation is
 * {@link alpha.lapis.transport.SocketTransport SocketTransport}.
 */
package alpha.lapis.transport;
