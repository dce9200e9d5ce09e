package alpha.lapis.message;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static java.lang.String.CASE_INSENSITIVE_ORDER;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

/**
 * Utility methods for HTTP header maps.<p>
 *
 * A header map is a {@code Map<String, List<String>>} where the key is the
 * header name and the value is all values of that header, in the order they
 * occurred.
 */
public final class Headers
{
    private static final String TOKEN_SYMBOLS = "!#$%&'*+-.^_`|~";

    private Headers() {
        // Empty
    }

    /**
     * Returns an unmodifiable header map whose keys are compared ignoring
     * case.<p>
     *
     * Names that differ only in case are merged into one entry, keyed by the
     * first occurrence. Value order is preserved.
     *
     * @param headers source
     * @return an unmodifiable, case-insensitive copy
     * @throws NullPointerException if {@code headers} is {@code null}
     */
    public static Map<String, List<String>> caseInsensitive(Map<String, List<String>> headers) {
        if (headers.isEmpty()) {
            return Map.of();
        }
        var m = new TreeMap<String, List<String>>(CASE_INSENSITIVE_ORDER);
        headers.forEach((k, v) ->
            m.computeIfAbsent(k, ign -> new ArrayList<>(v.size())).addAll(v));
        m.entrySet().forEach(e ->
            e.setValue(unmodifiableList(e.getValue())));
        return unmodifiableMap(m);
    }

    /**
     * Returns an unmodifiable header map preserving the iteration order of the
     * given map.
     *
     * @param headers source
     * @return an unmodifiable copy
     * @throws NullPointerException if {@code headers} is {@code null}
     */
    public static Map<String, List<String>> ordered(Map<String, List<String>> headers) {
        if (headers.isEmpty()) {
            return Map.of();
        }
        var m = new LinkedHashMap<String, List<String>>();
        headers.forEach((k, v) -> m.put(k, List.copyOf(v)));
        return unmodifiableMap(m);
    }

    /**
     * Returns the first value of a header, searching the name ignoring case.
     *
     * @param headers to search
     * @param name of header
     * @return the first value, if present
     * @throws NullPointerException if any argument is {@code null}
     */
    public static Optional<String> first(Map<String, List<String>> headers, String name) {
        for (var e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name) && !e.getValue().isEmpty()) {
                return Optional.of(e.getValue().get(0));
            }
        }
        return Optional.empty();
    }

    /**
     * Returns {@code true} if the given string is a valid header name.<p>
     *
     * A header name is a non-empty token of the characters allowed by RFC
     * 9110 section 5.6.2.
     *
     * @param name to test
     * @return see JavaDoc
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public static boolean isValidName(String name) {
        if (name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); ++i) {
            char c = name.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')) {
                continue;
            }
            if (TOKEN_SYMBOLS.indexOf(c) == -1) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns {@code true} if the given string is a valid header value.<p>
     *
     * Only visible US-ASCII characters, space and horizontal tab are
     * accepted. In particular, CR and LF are rejected.
     *
     * @param value to test
     * @return see JavaDoc
     * @throws NullPointerException if {@code value} is {@code null}
     */
    public static boolean isValidValue(String value) {
        for (int i = 0; i < value.length(); ++i) {
            char c = value.charAt(i);
            if (c != '\t' && (c < ' ' || c > '~')) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the given header name if valid.
     *
     * @param name of header
     * @return the name
     * @throws NullPointerException if {@code name} is {@code null}
     * @throws IllegalArgumentException if {@code name} is not valid
     * @see #isValidName(String)
     */
    public static String requireValidName(String name) {
        if (!isValidName(name)) {
            throw new IllegalArgumentException("Invalid header name: \"" + name + "\"");
        }
        return name;
    }

    /**
     * Returns the given header value if valid.
     *
     * @param value of header
     * @return the value
     * @throws NullPointerException if {@code value} is {@code null}
     * @throws IllegalArgumentException if {@code value} is not valid
     * @see #isValidValue(String)
     */
    public static String requireValidValue(String value) {
        if (!isValidValue(value)) {
            throw new IllegalArgumentException("Invalid header value: \"" + value + "\"");
        }
        return value;
    }

    /**
     * Returns {@code true} if the header map contains the given header name,
     * ignoring case, otherwise {@code false}.
     *
     * @param headers to search
     * @param name of header
     * @return see JavaDoc
     */
    public static boolean contains(Map<String, List<String>> headers, String name) {
        return headers.keySet().stream().anyMatch(name::equalsIgnoreCase);
    }
}
