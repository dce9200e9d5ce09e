package alpha.lapis.message;

import alpha.lapis.HttpConstants.ReasonPhrase;
import alpha.lapis.util.AbstractImmutableBuilder;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static alpha.lapis.HttpConstants.HeaderName.SET_COOKIE;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Response}.
 */
final class DefaultResponse implements Response
{
    private static final int INITIAL_CAPACITY = 1;

    private static final byte[] EMPTY = new byte[0];

    private final int statusCode;
    private final String reasonPhrase;
    private final Map<String, List<String>> headers;
    private final byte[] body;
    private final DefaultBuilder origin;

    private DefaultResponse(
            int statusCode,
            String reasonPhrase,
            // Is unmodifiable
            Map<String, List<String>> headers,
            byte[] body,
            DefaultBuilder origin)
    {
        this.statusCode = statusCode;
        this.reasonPhrase = reasonPhrase;
        this.headers = headers;
        this.body = body;
        this.origin = origin;
    }

    @Override
    public int statusCode() {
        return statusCode;
    }

    @Override
    public String reasonPhrase() {
        return reasonPhrase;
    }

    @Override
    public Map<String, List<String>> headers() {
        return headers;
    }

    @Override
    public byte[] body() {
        return body.length == 0 ? body : body.clone();
    }

    @Override
    public Response.Builder toBuilder() {
        return origin;
    }

    @Override
    public String toString() {
        return DefaultResponse.class.getSimpleName() + "{" +
                "statusCode=" + statusCode +
                ", reasonPhrase='" + reasonPhrase + '\'' +
                ", headers=" + headers +
                ", body=" + body.length + " bytes}";
    }

    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Response.Builder
    {
        private static class MutableState {
            Integer statusCode;
            String reasonPhrase;
            LinkedHashMap<String, List<String>> headers;
            byte[] body;

            void removeHeader(String name) {
                if (headers == null) {
                    return;
                }
                headers.entrySet().removeIf(e ->
                    e.getKey().equalsIgnoreCase(name));
            }

            void addHeader(boolean clearFirst, String name, String value) {
                if (clearFirst) {
                    removeHeader(name);
                }
                getOrCreateHeaders().computeIfAbsent(
                        name, k -> new ArrayList<>(INITIAL_CAPACITY)).add(value);
            }

            private Map<String, List<String>> getOrCreateHeaders() {
                var h = headers;
                return h == null ? (headers = new LinkedHashMap<>()) : h;
            }
        }

        static final DefaultBuilder ROOT = new DefaultBuilder();

        private DefaultBuilder() {
            // super()
        }

        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }

        @Override
        public Response.Builder statusCode(int statusCode) {
            return new DefaultBuilder(this, s -> s.statusCode = statusCode);
        }

        @Override
        public Response.Builder reasonPhrase(String reasonPhrase) {
            requireNonNull(reasonPhrase, "reasonPhrase");
            if (!Headers.isValidValue(reasonPhrase)) {
                throw new IllegalArgumentException("Invalid reason phrase: \"" + reasonPhrase + "\"");
            }
            return new DefaultBuilder(this, s -> s.reasonPhrase = reasonPhrase);
        }

        @Override
        public Response.Builder header(String name, String value) {
            final String key = Headers.requireValidName(name),
                         val = Headers.requireValidValue(value);
            return new DefaultBuilder(this, s -> s.addHeader(true, key, val));
        }

        @Override
        public Response.Builder addHeader(String name, String value) {
            final String key = Headers.requireValidName(name),
                         val = Headers.requireValidValue(value);
            return new DefaultBuilder(this, s -> s.addHeader(false, key, val));
        }

        @Override
        public Response.Builder addCookie(String name, String value) {
            Headers.requireValidName(name);
            requireNonNull(value, "value");
            for (int i = 0; i < value.length(); ++i) {
                if (!isCookieOctet(value.charAt(i))) {
                    throw new IllegalArgumentException("Invalid cookie value: \"" + value + "\"");
                }
            }
            return addHeader(SET_COOKIE, name + "=" + value);
        }

        // RFC 6265 section 4.1.1
        private static boolean isCookieOctet(char c) {
            return c == 0x21 ||
                   (c >= 0x23 && c <= 0x2B) ||
                   (c >= 0x2D && c <= 0x3A) ||
                   (c >= 0x3C && c <= 0x5B) ||
                   (c >= 0x5D && c <= 0x7E);
        }

        @Override
        public Response.Builder removeHeader(String name) {
            requireNonNull(name, "name");
            return new DefaultBuilder(this, s -> s.removeHeader(name));
        }

        @Override
        public Response.Builder body(byte[] body) {
            final byte[] copy = body.clone();
            return new DefaultBuilder(this, s -> s.body = copy);
        }

        @Override
        public Response.Builder body(String body) {
            return body(body, UTF_8);
        }

        @Override
        public Response.Builder body(String body, Charset charset) {
            return body(body.getBytes(charset));
        }

        @Override
        public Response build() {
            MutableState s = constructState(MutableState::new);

            if (s.statusCode == null) {
                throw new IllegalStateException("Status code not set.");
            }

            String phrase = s.reasonPhrase != null ?
                    s.reasonPhrase : ReasonPhrase.of(s.statusCode);

            Map<String, List<String>> headers;
            if (s.headers == null) {
                headers = Map.of();
            } else {
                s.headers.entrySet().forEach(e ->
                    e.setValue(List.copyOf(e.getValue())));
                headers = unmodifiableMap(s.headers);
            }

            return new DefaultResponse(
                    s.statusCode,
                    phrase,
                    headers,
                    s.body == null ? EMPTY : s.body,
                    this);
        }
    }
}
