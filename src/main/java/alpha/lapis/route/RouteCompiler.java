package alpha.lapis.route;

import alpha.lapis.HttpConstants.Method;
import alpha.lapis.handler.RequestHandler;
import alpha.lapis.websocket.WebSocketHandler;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.util.Objects.requireNonNull;

/**
 * Compiles a {@link RouteSource} into a {@link RouteTree}.<p>
 *
 * Each directory is parsed into a {@link Segment} and a leaf in a directory
 * binds handlers to the node of that directory. The root directory may
 * itself hold a leaf, which binds the path "/".<p>
 *
 * The compiler fails fast with a {@link RouteCompilationException} (and never
 * produces a partial tree) if:
 * <ul>
 *   <li>two sibling directories are both dynamic, or both catch-all,</li>
 *   <li>a catch-all directory has subdirectories,</li>
 *   <li>a parameter name is declared twice on the same branch,</li>
 *   <li>a leaf declares an unrecognized method token, the same method
 *       twice, or more than one WebSocket handler, or</li>
 *   <li>the route source fails to read.</li>
 * </ul>
 *
 * Directories are visited in sorted name order. Directories with no leaf
 * anywhere in their subtree are validated, but are not part of the resulting
 * tree. Compiling the same input twice yields the same tree shape, and the
 * same exception message on failure.
 */
public final class RouteCompiler
{
    private static final System.Logger LOG
            = System.getLogger(RouteCompiler.class.getPackageName());

    /**
     * Compile a route source.
     *
     * @param source to compile
     *
     * @return a route tree
     *
     * @throws NullPointerException
     *             if {@code source} is {@code null}
     * @throws RouteCompilationException
     *             if compilation fails (see class javadoc)
     */
    public static RouteTree compile(RouteSource source) {
        RouteCompiler c = new RouteCompiler(requireNonNull(source));
        RouteNode root = c.node(List.of(), Segment.ROOT, "/", Set.of())
                          .orElseGet(() -> new RouteNode(
                                  Segment.ROOT, "/", new TreeMap<>(), null, null,
                                  HandlerBindings.EMPTY));
        RouteTree tree = new RouteTree(root);
        LOG.log(INFO, () -> "Compiled " + tree.patterns().size() + " route(s) from " + source + ".");
        return tree;
    }

    private final RouteSource source;

    private RouteCompiler(RouteSource source) {
        this.source = source;
    }

    private Optional<RouteNode> node(
            List<String> dir, Segment self, String pattern, Set<String> paramsAbove)
    {
        final Set<String> params = withParam(paramsAbove, self, pattern);
        final List<String> names = sorted(list(dir));

        if (self.kind() == Segment.Kind.CATCH_ALL && !names.isEmpty()) {
            throw new RouteAmbiguityException(
                    "Catch-all route \"" + pattern + "\" has subdirectories " + names + ".");
        }

        TreeMap<String, RouteNode> statics = new TreeMap<>();
        RouteNode dynamic = null, catchAll = null;
        String dynamicDir = null, catchAllDir = null;

        for (String n : names) {
            Segment s = Segment.parse(n);
            switch (s.kind()) {
                case DYNAMIC:
                    if (dynamicDir != null) {
                        throw siblings("dynamic", pattern, dynamicDir, n);
                    }
                    dynamicDir = n;
                    break;
                case CATCH_ALL:
                    if (catchAllDir != null) {
                        throw siblings("catch-all", pattern, catchAllDir, n);
                    }
                    catchAllDir = n;
                    break;
                default:
                    break;
            }
        }

        for (String n : names) {
            Segment s = Segment.parse(n);
            Optional<RouteNode> c = node(append(dir, n), s, append(pattern, s), params);
            if (c.isEmpty()) {
                continue;
            }
            switch (s.kind()) {
                case DYNAMIC:
                    dynamic = c.get();
                    break;
                case CATCH_ALL:
                    catchAll = c.get();
                    break;
                default:
                    statics.put(s.value(), c.get());
            }
        }

        final Optional<List<HandlerDeclaration>> leaf = leaf(dir);
        if (leaf.isEmpty() && statics.isEmpty() && dynamic == null && catchAll == null) {
            return Optional.empty();
        }

        HandlerBindings b = leaf.map(l -> bind(pattern, l)).orElse(HandlerBindings.EMPTY);
        if (!b.isEmpty()) {
            LOG.log(DEBUG, () -> "Bound " + pattern + " " + b.allowed());
        }
        return Optional.of(new RouteNode(self, pattern, statics, dynamic, catchAll, b));
    }

    private static Set<String> withParam(Set<String> above, Segment self, String pattern) {
        if (self.kind() == Segment.Kind.STATIC) {
            return above;
        }
        if (above.contains(self.value())) {
            throw new RouteAmbiguityException(
                    "Parameter name \"" + self.value() + "\" declared twice in route \"" + pattern + "\".");
        }
        Set<String> s = new HashSet<>(above);
        s.add(self.value());
        return s;
    }

    private static HandlerBindings bind(String pattern, List<HandlerDeclaration> leaf) {
        EnumMap<Method, RequestHandler> m = new EnumMap<>(Method.class);
        WebSocketHandler ws = null;
        for (HandlerDeclaration d : leaf) {
            if (d.isWebSocket()) {
                if (ws != null) {
                    throw new HandlerBindingException(
                            "WebSocket handler bound twice in route \"" + pattern + "\".");
                }
                ws = d.webSocketHandler();
                continue;
            }
            Method method = Method.of(d.method()).orElseThrow(() ->
                    new HandlerBindingException(
                            "Unrecognized method \"" + d.method() + "\" in route \"" + pattern + "\"."));
            if (m.putIfAbsent(method, d.handler()) != null) {
                throw new HandlerBindingException(
                        "Method " + method + " bound twice in route \"" + pattern + "\".");
            }
        }
        return new HandlerBindings(m, ws);
    }

    private List<String> list(List<String> dir) {
        try {
            return source.listDirectories(dir);
        } catch (IOException e) {
            throw new RouteCompilationException("Failed to list directory " + dir + ".", e);
        }
    }

    private Optional<List<HandlerDeclaration>> leaf(List<String> dir) {
        try {
            return source.readLeaf(dir);
        } catch (IOException e) {
            throw new RouteCompilationException("Failed to read leaf of directory " + dir + ".", e);
        }
    }

    private static RouteAmbiguityException siblings(
            String kind, String pattern, String first, String second)
    {
        return new RouteAmbiguityException(
                "Route \"" + pattern + "\" has more than one " + kind +
                " subdirectory: \"" + first + "\" and \"" + second + "\".");
    }

    private static List<String> sorted(List<String> names) {
        List<String> s = new ArrayList<>(names);
        s.sort(null);
        return s;
    }

    private static List<String> append(List<String> dir, String name) {
        List<String> l = new ArrayList<>(dir);
        l.add(name);
        return List.copyOf(l);
    }

    private static String append(String pattern, Segment s) {
        return pattern.equals("/") ? "/" + s.pattern() : pattern + "/" + s.pattern();
    }
}
