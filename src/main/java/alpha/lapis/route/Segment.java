package alpha.lapis.route;

import static java.util.Objects.requireNonNull;

/**
 * One segment of a route pattern.<p>
 *
 * A segment is derived from a directory name by {@link #parse(String)}:
 *
 * <table class="striped">
 *   <caption style="display:none">Directory naming conventions</caption>
 *   <thead>
 *   <tr><th scope="col">Directory</th><th scope="col">Kind</th><th scope="col">Pattern</th></tr>
 *   </thead>
 *   <tbody>
 *   <tr><td>{@code users}</td><td>{@link Kind#STATIC STATIC}</td><td>{@code users}</td></tr>
 *   <tr><td>{@code [id]}</td><td>{@link Kind#DYNAMIC DYNAMIC}</td><td>{@code :id}</td></tr>
 *   <tr><td>{@code :id}</td><td>{@link Kind#DYNAMIC DYNAMIC}</td><td>{@code :id}</td></tr>
 *   <tr><td>{@code [...rest]}</td><td>{@link Kind#CATCH_ALL CATCH_ALL}</td><td>{@code *rest}</td></tr>
 *   <tr><td>{@code *rest}</td><td>{@link Kind#CATCH_ALL CATCH_ALL}</td><td>{@code *rest}</td></tr>
 *   </tbody>
 * </table>
 *
 * A static segment is matched by exact equality with a percent-decoded
 * request path segment. A dynamic segment matches any non-empty request path
 * segment and binds it to the parameter name. A catch-all segment matches all
 * remaining request path segments, and must therefore be the last segment of
 * a route.
 */
public final class Segment
{
    /**
     * The kind of segment.
     */
    public enum Kind {
        /** Matched by literal equality. */
        STATIC,
        /** Matches one non-empty segment, bound to a named parameter. */
        DYNAMIC,
        /** Matches all remaining segments, bound to a named parameter. */
        CATCH_ALL
    }

    static final Segment ROOT = new Segment(Kind.STATIC, "");

    /**
     * Parse a directory name.
     *
     * @param directoryName to parse
     *
     * @return the segment
     *
     * @throws NullPointerException
     *             if {@code directoryName} is {@code null}
     * @throws RouteCompilationException
     *             if {@code directoryName} is empty, or
     *             declares a parameter without a name
     */
    public static Segment parse(String directoryName) {
        final String d = requireNonNull(directoryName);
        if (d.isEmpty()) {
            throw new RouteCompilationException("Empty directory name.");
        }
        if (d.startsWith("[...") && d.endsWith("]")) {
            return param(Kind.CATCH_ALL, d, d.substring(4, d.length() - 1));
        }
        if (d.length() >= 2 && d.startsWith("[") && d.endsWith("]")) {
            return param(Kind.DYNAMIC, d, d.substring(1, d.length() - 1));
        }
        switch (d.charAt(0)) {
            case ':':
                return param(Kind.DYNAMIC, d, d.substring(1));
            case '*':
                return param(Kind.CATCH_ALL, d, d.substring(1));
            default:
                return new Segment(Kind.STATIC, d);
        }
    }

    private static Segment param(Kind kind, String directoryName, String name) {
        if (name.isBlank()) {
            throw new RouteCompilationException(
                    "Parameter name is empty in directory \"" + directoryName + "\".");
        }
        return new Segment(kind, name);
    }

    private final Kind kind;
    private final String value;

    private Segment(Kind kind, String value) {
        this.kind = kind;
        this.value = value;
    }

    /**
     * Returns the kind of this segment.
     *
     * @return the kind of this segment
     */
    public Kind kind() {
        return kind;
    }

    /**
     * Returns the literal of a static segment, or the parameter name of a
     * dynamic or catch-all segment.
     *
     * @return the literal or parameter name (never {@code null})
     */
    public String value() {
        return value;
    }

    /**
     * Returns the pattern form of this segment.<p>
     *
     * The pattern form of a static segment is the literal, a dynamic
     * parameter is prefixed with ':' and a catch-all parameter is prefixed
     * with '*'.
     *
     * @return the pattern form of this segment
     */
    public String pattern() {
        switch (kind) {
            case DYNAMIC:
                return ":" + value;
            case CATCH_ALL:
                return "*" + value;
            default:
                return value;
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Segment other = (Segment) obj;
        return kind == other.kind && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + value.hashCode();
    }

    @Override
    public String toString() {
        return pattern();
    }
}
