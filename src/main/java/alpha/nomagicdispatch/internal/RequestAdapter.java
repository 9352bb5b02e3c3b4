package alpha.nomagicdispatch.internal;

import alpha.nomagicdispatch.Config;
import alpha.nomagicdispatch.HttpConstants.HeaderName;
import alpha.nomagicdispatch.HttpConstants.Version;
import alpha.nomagicdispatch.message.HeaderParseException;
import alpha.nomagicdispatch.message.HttpVersionTooOldException;
import alpha.nomagicdispatch.message.MaxRequestBodyBufferSizeException;
import alpha.nomagicdispatch.message.Request;
import alpha.nomagicdispatch.message.RequestAdaptationException;
import alpha.nomagicdispatch.message.RequestLineParseException;
import alpha.nomagicdispatch.message.RequestTargetUnsupportedException;
import alpha.nomagicdispatch.transport.RawRequest;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpHeaders;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static alpha.nomagicdispatch.util.Strings.containsControlBreak;
import static alpha.nomagicdispatch.util.Strings.isToken;
import static java.lang.String.CASE_INSENSITIVE_ORDER;
import static java.util.Objects.requireNonNull;

/**
 * Translates a {@link RawRequest} into a {@link Request}.<p>
 * 
 * Validation happens in this order: the method, the request-target syntax,
 * the HTTP version, the headers, the request-target resolution (which may
 * need the Host header) and finally the body size. The first violation
 * found is thrown. A request is never partially constructed.<p>
 * 
 * The adapter is stateless apart from its configuration, and thread-safe.
 */
final class RequestAdapter
{
    private final Config config;
    private final InetSocketAddress bindAddress;
    
    /**
     * Constructs a {@code RequestAdapter}.
     * 
     * @param config of server
     * @param bindAddress used to resolve a target when no better address is known
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    RequestAdapter(Config config, InetSocketAddress bindAddress) {
        this.config = requireNonNull(config);
        this.bindAddress = requireNonNull(bindAddress);
    }
    
    /**
     * Creates a request.
     * 
     * @param raw request
     * 
     * @return a request
     * 
     * @throws NullPointerException
     *             if {@code raw} is {@code null}
     * @throws RequestLineParseException
     *             if the method or the request-target is malformed
     * @throws RequestTargetUnsupportedException
     *             if the request-target has an unsupported form
     * @throws alpha.nomagicdispatch.message.HttpVersionParseException
     *             if the HTTP version can not be parsed
     * @throws HttpVersionTooOldException
     *             if the HTTP version is older than configured minimum
     * @throws HeaderParseException
     *             if a header is malformed
     * @throws MaxRequestBodyBufferSizeException
     *             if the body is too large
     */
    DefaultRequest fromRaw(RawRequest raw) throws RequestAdaptationException {
        final String method = requireMethod(raw.method());
        final String target = requireTargetSyntax(raw.target());
        final Version version = requireVersion(raw.httpVersion());
        final HttpHeaders headers = toHeaders(raw.headers());
        final URI uri = resolve(target, headers, raw.localAddress());
        requireBodySize(raw.body(), headers);
        return new DefaultRequest(
                method,
                new DefaultRequest.DefaultTarget(target, uri),
                version,
                headers,
                raw.body(),
                raw.remoteAddress());
    }
    
    private static String requireMethod(String method)
            throws RequestLineParseException {
        if (!isToken(method)) {
            throw new RequestLineParseException(
                    "Method is not a token: \"" + method + "\".");
        }
        return method;
    }
    
    private static String requireTargetSyntax(String target)
            throws RequestLineParseException {
        if (target.isEmpty()) {
            throw new RequestLineParseException("Empty request-target.");
        }
        for (int i = 0; i < target.length(); ++i) {
            if (target.charAt(i) <= ' ') {
                throw new RequestLineParseException(
                        "Whitespace or control character in request-target.");
            }
        }
        return target;
    }
    
    private Version requireVersion(String version)
            throws RequestAdaptationException {
        final Version v = Version.parse(version),
                    min = config.minHttpVersion();
        if (v.isLessThan(min)) {
            throw new HttpVersionTooOldException(v, min);
        }
        return v;
    }
    
    private static HttpHeaders toHeaders(List<RawRequest.Field> fields)
            throws HeaderParseException {
        // First casing seen is kept
        final Map<String, List<String>> map = new TreeMap<>(CASE_INSENSITIVE_ORDER);
        for (RawRequest.Field f : fields) {
            final String n = f.name(), v = f.value();
            if (!isToken(n)) {
                throw new HeaderParseException(n, "Header name is not a token.");
            }
            if (containsControlBreak(v)) {
                throw new HeaderParseException(n, "Header value contains CR, LF or NUL.");
            }
            if (!v.equals(v.strip())) {
                throw new HeaderParseException(n, "Header value has surrounding whitespace.");
            }
            map.computeIfAbsent(n, k -> new ArrayList<>()).add(v);
        }
        return HttpHeaders.of(map, (n, v) -> true);
    }
    
    private URI resolve(String target, HttpHeaders headers, InetSocketAddress local)
            throws RequestAdaptationException
    {
        if (target.equals("*")) {
            throw new RequestTargetUnsupportedException(target,
                    "Asterisk-form is not supported.");
        }
        if (target.startsWith("/")) {
            final var host = headers.firstValue(HeaderName.HOST)
                    .filter(h -> !h.isEmpty());
            final String authority = host.isPresent() ?
                    requireAuthority(host.get()) :
                    authority(local != null ? local : bindAddress);
            return parse(target, "http://" + authority + target);
        }
        if (!target.contains("://")) {
            throw new RequestTargetUnsupportedException(target,
                    "Authority-form is not supported.");
        }
        final URI uri = parse(target, target);
        final String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new RequestTargetUnsupportedException(target,
                    "Scheme is not http or https.");
        }
        if (uri.getHost() == null) {
            throw new RequestLineParseException(
                    "No host in absolute-form request-target.");
        }
        return uri;
    }
    
    // uri-host [ ":" port ], nothing more
    private static String requireAuthority(String host)
            throws HeaderParseException {
        final URI uri;
        try {
            uri = new URI("http://" + host);
        } catch (URISyntaxException e) {
            throw new HeaderParseException(HeaderName.HOST,
                    "Host is not an authority: \"" + host + "\".", e);
        }
        if (uri.getHost() == null ||
            uri.getRawUserInfo() != null ||
            !host.equals(uri.getRawAuthority()) ||
            !uri.getRawPath().isEmpty() ||
            uri.getRawQuery() != null ||
            uri.getRawFragment() != null) {
            throw new HeaderParseException(HeaderName.HOST,
                    "Host is not an authority: \"" + host + "\".");
        }
        return host;
    }
    
    private static URI parse(String target, String absolute)
            throws RequestLineParseException {
        try {
            return new URI(absolute);
        } catch (URISyntaxException e) {
            throw new RequestLineParseException(
                    "Can not parse request-target \"" + target + "\".", e);
        }
    }
    
    private static String authority(InetSocketAddress addr) {
        final InetAddress ip = addr.getAddress();
        if (ip == null) {
            return addr.getHostString() + ":" + addr.getPort();
        }
        String host = ip.getHostAddress();
        if (ip instanceof Inet6Address) {
            int scope = host.indexOf('%');
            host = "[" + (scope == -1 ? host : host.substring(0, scope)) + "]";
        }
        return host + ":" + addr.getPort();
    }
    
    private void requireBodySize(byte[] body, HttpHeaders headers)
            throws MaxRequestBodyBufferSizeException {
        final int max = config.maxRequestBodyBufferSize();
        if (body.length <= Math.max(max, 0)) {
            return;
        }
        // The transport may have stopped reading early
        long declared;
        try {
            declared = headers.firstValueAsLong(HeaderName.CONTENT_LENGTH)
                              .orElse(-1);
        } catch (NumberFormatException e) {
            declared = -1;
        }
        throw new MaxRequestBodyBufferSizeException(
                Math.max(declared, body.length), max);
    }
}
