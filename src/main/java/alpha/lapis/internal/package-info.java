/**
 * Server implementation.<p>
 *
 * Types in this package are public only so that other packages of the
 * library can use them. Applications should use the {@link
 * alpha.lapis.HttpServer HttpServer} interface.
 */
package alpha.lapis.internal;
