/**
 * HTTP message types.
 */
package alpha.lapis.message;
