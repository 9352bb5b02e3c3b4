package alpha.nomagicdispatch.message;

import alpha.nomagicdispatch.HttpConstants.ReasonPhrase;
import alpha.nomagicdispatch.util.AbstractImmutableBuilder;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

import static alpha.nomagicdispatch.HttpConstants.StatusCode.THREE_HUNDRED_FOUR;
import static alpha.nomagicdispatch.HttpConstants.StatusCode.TWO_HUNDRED_FOUR;
import static alpha.nomagicdispatch.util.Strings.requireNoSurroundingWS;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@code Response}.
 */
final class DefaultResponse implements Response
{
    /** Initial capacity of the list of a header map value. */
    private static final int INITIAL_CAPACITY = 1;
    
    private static final byte[] EMPTY = {};
    
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
    public ByteBuffer body() {
        return ByteBuffer.wrap(body).asReadOnlyBuffer();
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
                ", body=" + body.length + " bytes" +
                '}';
    }
    
    /**
     * Default implementation of {@code Response.Builder}.
     */
    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Response.Builder
    {
        private static class MutableState {
            Integer statusCode;
            String reasonPhrase;
            LinkedHashMap<String, List<String>> headers;
            byte[] body;
            
            void addHeader(boolean clearFirst, String name, String value) {
                var vals = getOrCreateHeaders().computeIfAbsent(
                        name, k -> new ArrayList<>(INITIAL_CAPACITY));
                if (clearFirst) {
                    vals.clear();
                }
                vals.add(value);
            }
            
            void removeHeader(String name) {
                if (headers != null) {
                    headers.keySet().removeIf(k -> k.equalsIgnoreCase(name));
                }
            }
            
            private Map<String, List<String>> getOrCreateHeaders() {
                var h = headers;
                return h == null ? (headers = new LinkedHashMap<>()) : h;
            }
        }
        
        static final Response.Builder ROOT = new DefaultBuilder();
        
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
            return new DefaultBuilder(this, s -> s.reasonPhrase = reasonPhrase);
        }
        
        @Override
        public Response.Builder header(String name, String value) {
            final String key = requireNotEmpty(requireNoSurroundingWS(name)),
                         val = requireNoSurroundingWS(value);
            return new DefaultBuilder(this, s -> s.addHeader(true, key, val));
        }
        
        @Override
        public Response.Builder addHeader(String name, String value) {
            final String key = requireNotEmpty(requireNoSurroundingWS(name)),
                         val = requireNoSurroundingWS(value);
            return new DefaultBuilder(this, s -> s.addHeader(false, key, val));
        }
        
        @Override
        public Response.Builder addHeaders(String name, String value, String... morePairs) {
            final String key1 = requireNotEmpty(requireNoSurroundingWS(name)),
                         val1 = requireNoSurroundingWS(value);
            if (morePairs.length % 2 != 0) {
                throw new IllegalArgumentException("morePairs.length is not even");
            }
            final String[] copy = morePairs.clone();
            for (int i = 0; i < copy.length; ++i) {
                requireNoSurroundingWS(copy[i]);
                if (i % 2 == 0) {
                    requireNotEmpty(copy[i]);
                }
            }
            return new DefaultBuilder(this, s -> {
                s.addHeader(false, key1, val1);
                for (int i = 0; i < copy.length - 1; i += 2) {
                    s.addHeader(false, copy[i], copy[i + 1]);
                }
            });
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
        public Response build() {
            MutableState s = constructState(MutableState::new);
            if (s.statusCode == null) {
                throw new IllegalStateException("Status code is not set.");
            }
            setDefaults(s);
            Response r = new DefaultResponse(
                    s.statusCode,
                    s.reasonPhrase,
                    toUnmodifiable(s.headers),
                    s.body,
                    this);
            if ((r.isInformational() ||
                 r.statusCode() == TWO_HUNDRED_FOUR ||
                 r.statusCode() == THREE_HUNDRED_FOUR) && s.body.length > 0) {
                throw new IllegalResponseBodyException(
                        "Presumably a body in a " + r.statusCode() +
                        " (" + r.reasonPhrase() + ") response.", r);
            }
            return r;
        }
        
        private static Map<String, List<String>> toUnmodifiable(
                LinkedHashMap<String, List<String>> headers) {
            if (headers == null) {
                return Map.of();
            }
            var seen = new HashMap<String, String>();
            var copy = new LinkedHashMap<String, List<String>>();
            headers.forEach((k, v) -> {
                var prev = seen.put(k.toLowerCase(Locale.ROOT), k);
                if (prev != null) {
                    throw new IllegalStateException(
                            "Header name repeated with different casing: " + prev + ", " + k);
                }
                copy.put(k, List.copyOf(v));
            });
            return unmodifiableMap(copy);
        }
        
        private static String requireNotEmpty(String name) {
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Empty header name");
            }
            return name;
        }
        
        private static void setDefaults(MutableState s) {
            if (s.reasonPhrase == null) {
                s.reasonPhrase = ReasonPhrase.of(s.statusCode); }
            
            if (s.body == null) {
                s.body = EMPTY; }
        }
    }
}
