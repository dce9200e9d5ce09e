package alpha.lapis.route;

import alpha.lapis.message.BadRequestException;
import alpha.lapis.util.PercentDecoder;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Matches a request path against a {@link RouteTree}.<p>
 *
 * The path is first {@link #normalize(String) normalized}, then split into
 * segments which are percent-decoded. The decoding does not translate '+' to
 * a space; '+' is a literal character in the path component.<p>
 *
 * The tree is walked from the root. At each level, children are tried in
 * order of precedence:
 * <ol>
 *   <li>the static child whose literal equals the segment,</li>
 *   <li>the dynamic child (only if the segment is not empty), and</li>
 *   <li>the catch-all child, which consumes all remaining segments.</li>
 * </ol>
 *
 * The first child that matches a segment is final. The walk never returns to
 * a lower-precedence sibling, so a path whose segment equals a static literal
 * is never matched by the dynamic or catch-all sibling, even if the static
 * subtree has no route for the rest of the path.<p>
 *
 * The matcher holds no state and never locks.
 */
public final class PathMatcher
{
    private PathMatcher() {
        // Empty
    }

    /**
     * Normalize a request path.<p>
     *
     * A leading '/' is added if absent, and a single trailing '/' is removed
     * unless the path is the root "/". The path is not decoded.
     *
     * @param path of request ({@code null} is treated as the empty string)
     * @return the normalized path
     */
    public static String normalize(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        String p = path.charAt(0) == '/' ? path : "/" + path;
        if (p.length() > 1 && p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p;
    }

    /**
     * Split a normalized path into raw segments.<p>
     *
     * The root "/" has no segments. Empty segments between consecutive
     * slashes are retained.
     *
     * @param normalizedPath to split
     * @return raw segments (unmodifiable)
     */
    public static List<String> segments(String normalizedPath) {
        if (normalizedPath.equals("/")) {
            return List.of();
        }
        List<String> s = new ArrayList<>();
        int from = 1;
        for (;;) {
            int to = normalizedPath.indexOf('/', from);
            if (to == -1) {
                s.add(normalizedPath.substring(from));
                return List.copyOf(s);
            }
            s.add(normalizedPath.substring(from, to));
            from = to + 1;
        }
    }

    /**
     * Match a request path.
     *
     * @param tree to match against
     * @param path of request (not normalized, not decoded)
     *
     * @return the match
     *
     * @throws NoRouteFoundException
     *             if no bound node matches
     * @throws BadRequestException
     *             if a segment has a malformed percent-encoding
     */
    public static Match match(RouteTree tree, String path) {
        final String norm = normalize(path);
        final List<String> decoded;
        try {
            decoded = PercentDecoder.decode(segments(norm));
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Malformed percent-encoding in path \"" + norm + "\".", e);
        }
        final Map<String, String> params = new HashMap<>();
        RouteNode n = walk(tree.root(), decoded, 0, params);
        if (n == null) {
            throw new NoRouteFoundException(norm);
        }
        return new Match(n, params);
    }

    private static RouteNode walk(
            RouteNode node, List<String> segments, int pos, Map<String, String> params)
    {
        if (pos == segments.size()) {
            return node.isBound() ? node : null;
        }

        final String seg = segments.get(pos);
        RouteNode c;

        // The first child that matches the segment decides the outcome
        if ((c = node.staticChild(seg)) != null) {
            return walk(c, segments, pos + 1, params);
        }

        if ((c = node.dynamicChild()) != null && !seg.isEmpty()) {
            params.put(c.segment().value(), seg);
            return walk(c, segments, pos + 1, params);
        }

        if ((c = node.catchAllChild()) != null && c.isBound()) {
            String rest = String.join("/", segments.subList(pos, segments.size()));
            if (!rest.isEmpty()) {
                params.put(c.segment().value(), rest);
                return c;
            }
        }

        return null;
    }
}
