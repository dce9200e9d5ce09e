/**
 * Compilation of a directory hierarchy into a {@link
 * alpha.lapis.route.RouteTree RouteTree}, and matching of request paths
 * against the tree.
 */
package alpha.lapis.route;
