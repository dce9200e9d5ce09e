package alpha.lapis.route;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An immutable tree of {@link RouteNode}s produced by the {@link
 * RouteCompiler}.<p>
 *
 * The tree is built once and is read-only thereafter. Any number of threads
 * may {@link PathMatcher#match(RouteTree, String) match} against it
 * concurrently without locking.
 */
public final class RouteTree
{
    private final RouteNode root;

    RouteTree(RouteNode root) {
        this.root = requireNonNull(root);
    }

    /**
     * Returns the root node, which corresponds to the path "/".
     *
     * @return the root node
     */
    public RouteNode root() {
        return root;
    }

    /**
     * Returns the patterns of all bound nodes, in depth-first order with
     * static children in sorted order, then the dynamic child, then the
     * catch-all child.<p>
     *
     * For example: {@code ["/", "/files", "/users/:id", "/*rest"]}.
     *
     * @return all bound patterns (unmodifiable)
     */
    public List<String> patterns() {
        List<String> p = new ArrayList<>();
        root.walk(n -> {
            if (n.isBound()) {
                p.add(n.pattern());
            }
        });
        return Collections.unmodifiableList(p);
    }

    /**
     * Match a request path against this tree.<p>
     *
     * Same as {@code PathMatcher.match(this, path)}.
     *
     * @param path of request
     * @return the match
     * @throws NoRouteFoundException if no bound node matches
     * @throws alpha.lapis.message.BadRequestException
     *             if the path has a malformed percent-encoding
     */
    public Match match(String path) {
        return PathMatcher.match(this, path);
    }

    @Override
    public String toString() {
        return RouteTree.class.getSimpleName() + patterns();
    }
}
