package alpha.nomagicdispatch.internal;

import alpha.nomagicdispatch.HttpConstants.HeaderName;
import alpha.nomagicdispatch.HttpConstants.Version;
import alpha.nomagicdispatch.message.Request;
import alpha.nomagicdispatch.util.Attributes;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpHeaders;
import java.nio.charset.Charset;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Request}.<p>
 * 
 * Created by {@link RequestAdapter}, which has validated all components.
 */
final class DefaultRequest implements Request
{
    private final String method;
    private final Target target;
    private final Version version;
    private final HttpHeaders headers;
    private final Body body;
    private final InetSocketAddress remoteAddress;
    private final Attributes attributes;
    
    DefaultRequest(
            String method,
            Target target,
            Version version,
            HttpHeaders headers,
            byte[] body,
            InetSocketAddress remoteAddress)
    {
        this.method        = method;
        this.target        = target;
        this.version       = version;
        this.headers       = headers;
        this.body          = new DefaultBody(body, headers);
        this.remoteAddress = remoteAddress;
        this.attributes    = new DefaultAttributes();
    }
    
    @Override
    public String method() {
        return method;
    }
    
    @Override
    public Target target() {
        return target;
    }
    
    @Override
    public Version httpVersion() {
        return version;
    }
    
    @Override
    public HttpHeaders headers() {
        return headers;
    }
    
    @Override
    public Body body() {
        return body;
    }
    
    @Override
    public InetSocketAddress remoteAddress() {
        return remoteAddress;
    }
    
    @Override
    public Attributes attributes() {
        return attributes;
    }
    
    @Override
    public String toString() {
        return "Request{" +
                "method=" + method +
                ", uri=" + target.uri() +
                ", version=" + version +
                ", remoteAddress=" + remoteAddress +
                ", body=" + body.length() + " bytes" +
                '}';
    }
    
    static final class DefaultTarget implements Target
    {
        private final String raw;
        private final URI uri;
        
        DefaultTarget(String raw, URI uri) {
            this.raw = raw;
            this.uri = uri;
        }
        
        @Override
        public String raw() {
            return raw;
        }
        
        @Override
        public URI uri() {
            return uri;
        }
        
        @Override
        public String path() {
            var p = uri.getPath();
            return p == null || p.isEmpty() ? "/" : p;
        }
        
        @Override
        public Optional<String> query() {
            return Optional.ofNullable(uri.getRawQuery());
        }
        
        @Override
        public String toString() {
            return raw;
        }
    }
    
    private static final class DefaultBody implements Body
    {
        private final byte[] bytes;
        private final HttpHeaders headers;
        
        DefaultBody(byte[] bytes, HttpHeaders headers) {
            this.bytes = bytes;
            this.headers = headers;
        }
        
        @Override
        public long length() {
            return bytes.length;
        }
        
        @Override
        public byte[] bytes() {
            return bytes.clone();
        }
        
        @Override
        public String toText() {
            return toText(charset());
        }
        
        @Override
        public String toText(Charset charset) {
            requireNonNull(charset);
            return new String(bytes, charset);
        }
        
        private Charset charset() {
            return headers.firstValue(HeaderName.CONTENT_TYPE)
                    .flatMap(DefaultBody::charsetParam)
                    .map(Charset::forName)
                    .orElse(UTF_8);
        }
        
        // E.g. "text/plain; charset=\"iso-8859-1\""
        private static Optional<String> charsetParam(String contentType) {
            String[] tokens = contentType.split(";");
            for (int i = 1; i < tokens.length; ++i) {
                String t = tokens[i].strip();
                int eq = t.indexOf('=');
                if (eq > 0 && t.substring(0, eq).strip().equalsIgnoreCase("charset")) {
                    String v = t.substring(eq + 1).strip();
                    if (v.length() >= 2 && v.startsWith("\"") && v.endsWith("\"")) {
                        v = v.substring(1, v.length() - 1);
                    }
                    return v.isEmpty() ? Optional.empty() : Optional.of(v);
                }
            }
            return Optional.empty();
        }
    }
}
