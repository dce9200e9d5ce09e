package alpha.lapis.route;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * A node in a compiled {@link RouteTree}.<p>
 *
 * Each node corresponds to one segment of a route pattern and optionally
 * holds {@link HandlerBindings}. A node has any number of static children
 * (iterated in sorted order), at most one dynamic child and at most one
 * catch-all child. A catch-all node never has children.<p>
 *
 * The node is immutable and safe to read concurrently without
 * synchronization.
 */
public final class RouteNode
{
    private final Segment segment;
    private final String pattern;
    private final NavigableMap<String, RouteNode> statics;
    private final RouteNode dynamic;
    private final RouteNode catchAll;
    private final HandlerBindings bindings;

    RouteNode(
            Segment segment,
            String pattern,
            NavigableMap<String, RouteNode> statics,
            RouteNode dynamic,
            RouteNode catchAll,
            HandlerBindings bindings)
    {
        this.segment  = requireNonNull(segment);
        this.pattern  = requireNonNull(pattern);
        this.statics  = Collections.unmodifiableNavigableMap(new TreeMap<>(statics));
        this.dynamic  = dynamic;
        this.catchAll = catchAll;
        this.bindings = requireNonNull(bindings);
        assert segment.kind() != Segment.Kind.CATCH_ALL ||
               (statics.isEmpty() && dynamic == null && catchAll == null);
    }

    /**
     * Returns the segment of this node.<p>
     *
     * The root node's segment is a static segment with the empty literal.
     *
     * @return the segment of this node
     */
    public Segment segment() {
        return segment;
    }

    /**
     * Returns the route pattern of this node, for example "/users/:id".
     *
     * @return the route pattern (never {@code null} or the empty string)
     */
    public String pattern() {
        return pattern;
    }

    /**
     * Returns the handler bindings of this node.
     *
     * @return the handler bindings (never {@code null}, may be empty)
     */
    public HandlerBindings bindings() {
        return bindings;
    }

    /**
     * Returns {@code true} if this node has at least one handler bound.
     *
     * @return {@code true} if this node has at least one handler bound
     */
    public boolean isBound() {
        return !bindings.isEmpty();
    }

    /**
     * Returns the children of this node; static children first in sorted
     * order, then the dynamic child, then the catch-all child.
     *
     * @return the children of this node (unmodifiable)
     */
    public List<RouteNode> children() {
        List<RouteNode> c = new ArrayList<>(statics.values());
        if (dynamic != null) {
            c.add(dynamic);
        }
        if (catchAll != null) {
            c.add(catchAll);
        }
        return Collections.unmodifiableList(c);
    }

    RouteNode staticChild(String literal) {
        return statics.get(literal);
    }

    RouteNode dynamicChild() {
        return dynamic;
    }

    RouteNode catchAllChild() {
        return catchAll;
    }

    /**
     * Visit this node and all descendants, depth-first in {@link #children()}
     * order.
     *
     * @param visitor of nodes
     */
    void walk(Consumer<RouteNode> visitor) {
        visitor.accept(this);
        children().forEach(c -> c.walk(visitor));
    }

    @Override
    public String toString() {
        return RouteNode.class.getSimpleName() + "{" +
                "pattern='" + pattern + '\'' +
                ", bindings=" + bindings + '}';
    }
}
