package alpha.lapis.util;

import java.net.URLDecoder;
import java.util.ArrayList;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Collections.unmodifiableList;

/**
 * Percent-decodes strings.<p>
 *
 * Path segments are decoded as if using {@link URLDecoder#decode(String,
 * java.nio.charset.Charset) URLDecoder.decode(segment, UTF_8)} <i>except</i>
 * the plus sign ('+') is not converted to a space character (standard
 * <a href="https://tools.ietf.org/html/rfc3986#section-2.1">RFC 3986</a>
 * behavior). Query components are decoded using the form-encoding rules, where
 * '+' is a space.
 */
public final class PercentDecoder
{
    private PercentDecoder() {
        // Empty
    }

    /**
     * Percent-decode a path segment, keeping '+' as-is.
     *
     * @param str to decode
     * @return the decoded string
     * @throws NullPointerException if {@code str} is {@code null}
     * @throws IllegalArgumentException if the string has a malformed escape
     */
    public static String decode(String str) {
        final int p = str.indexOf('+');
        if (p == -1) {
            // No plus characters? JDK-decode the entire string
            return URLDecoder.decode(str, UTF_8);
        } else {
            // Else decode chunks in-between
            return decode(str.substring(0, p)) + "+" + decode(str.substring(p + 1));
        }
    }

    /**
     * Percent-decode all given path segments.
     *
     * @param strings to decode
     * @return an unmodifiable list of decoded strings
     * @throws IllegalArgumentException if a string has a malformed escape
     */
    public static List<String> decode(Iterable<String> strings) {
        List<String> l = new ArrayList<>();
        strings.forEach(s -> l.add(decode(s)));
        return unmodifiableList(l);
    }

    /**
     * Percent-decode a query key or value; '+' becomes a space.
     *
     * @param str to decode
     * @return the decoded string
     * @throws IllegalArgumentException if the string has a malformed escape
     */
    public static String decodeQuery(String str) {
        return URLDecoder.decode(str, UTF_8);
    }
}
