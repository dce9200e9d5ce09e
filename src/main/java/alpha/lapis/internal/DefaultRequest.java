package alpha.lapis.internal;

import alpha.lapis.message.BadRequestException;
import alpha.lapis.message.Headers;
import alpha.lapis.message.RawRequest;
import alpha.lapis.message.Request;
import alpha.lapis.util.PercentDecoder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

/**
 * Default implementation of {@link Request}, created by the dispatcher for
 * each matched request.
 */
final class DefaultRequest implements Request
{
    private final RawRequest raw;
    private final String path;
    private final Map<String, List<String>> headers;
    private final Map<String, List<String>> query;
    private final Map<String, String> params;

    /**
     * Constructs a {@code DefaultRequest}.
     *
     * @param raw request
     * @param path normalized
     * @param params of matched route
     * @throws BadRequestException if the query has a malformed percent-encoding
     */
    DefaultRequest(RawRequest raw, String path, Map<String, String> params) {
        this.raw = raw;
        this.path = path;
        this.headers = Headers.caseInsensitive(raw.headers());
        this.query = parseQuery(raw.rawQuery());
        this.params = params;
    }

    @Override
    public String method() {
        return raw.method();
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public Map<String, List<String>> headers() {
        return headers;
    }

    @Override
    public String rawQuery() {
        return raw.rawQuery();
    }

    @Override
    public Map<String, List<String>> query() {
        return query;
    }

    @Override
    public Map<String, String> params() {
        return params;
    }

    @Override
    public byte[] body() {
        return raw.body();
    }

    /**
     * Parse a raw query into a map of decoded keys and values.<p>
     *
     * Pairs are separated by '&amp;' and the key from the value by the first
     * '='. A key without '=' has the empty string as value. Empty pairs are
     * skipped. Both key and value are decoded with '+' as space.
     *
     * @param rawQuery not decoded
     * @return an unmodifiable map in order of first key occurrence
     * @throws BadRequestException on a malformed percent-encoding
     */
    static Map<String, List<String>> parseQuery(String rawQuery) {
        if (rawQuery.isEmpty()) {
            return Map.of();
        }
        final var m = new LinkedHashMap<String, List<String>>();
        for (String p : rawQuery.split("&")) {
            if (p.isEmpty()) {
                continue;
            }
            int i = p.indexOf('=');
            // note: value may be the empty string!
            String k = p.substring(0, i == -1 ? p.length() : i),
                   v = i == -1 ? "" : p.substring(i + 1);
            try {
                k = PercentDecoder.decodeQuery(k);
                v = PercentDecoder.decodeQuery(v);
            } catch (IllegalArgumentException e) {
                throw new BadRequestException("Malformed percent-encoding in query \"" + rawQuery + "\".", e);
            }
            m.computeIfAbsent(k, key -> new ArrayList<>(1)).add(v);
        }
        m.entrySet().forEach(e ->
            e.setValue(unmodifiableList(e.getValue())));
        return unmodifiableMap(m);
    }

    @Override
    public String toString() {
        return DefaultRequest.class.getSimpleName() + "{" +
                "method='" + method() + '\'' +
                ", path='" + path + '\'' +
                ", params=" + params +
                ", query=" + query + '}';
    }
}
