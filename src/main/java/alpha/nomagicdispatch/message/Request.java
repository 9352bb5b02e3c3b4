package alpha.nomagicdispatch.message;

import alpha.nomagicdispatch.HttpConstants.Version;
import alpha.nomagicdispatch.handler.Handler;
import alpha.nomagicdispatch.util.Attributes;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpHeaders;
import java.nio.charset.Charset;
import java.util.Optional;

/**
 * An inbound HTTP request.<p>
 * 
 * The server creates a request from what the transport received, and passes
 * it to the {@link Handler}. By the time the handler is called, the request
 * line has been parsed, the headers validated and the body fully read into
 * memory. The handler never observes a malformed request; such requests fail
 * before the handler is called.<p>
 * 
 * The request is owned by the handler invocation it was created for. Apart
 * from the {@link #attributes()}, it is immutable and therefore also
 * thread-safe.<p>
 * 
 * The string representation is meant for logging, and has the form
 * {@code Request{method=GET, uri=http://host/path, version=HTTP/1.1,
 * remoteAddress=/127.0.0.1:5678, body=0 bytes}}. Headers and body content are
 * not included.
 */
public interface Request
{
    /**
     * Returns the request method, for example "GET".<p>
     * 
     * The value is case-sensitive, and is an RFC 7230 token.
     * 
     * @return the request method (never {@code null} or empty)
     */
    String method();
    
    /**
     * Returns the request target.
     * 
     * @return the request target (never {@code null})
     */
    Target target();
    
    /**
     * Returns the HTTP version of the request.
     * 
     * @return the HTTP version (never {@code null})
     */
    Version httpVersion();
    
    /**
     * Returns the request headers.<p>
     * 
     * Lookup is case-insensitive. Repeated headers are available as multiple
     * values in the order received.
     * 
     * @return the request headers (never {@code null})
     */
    HttpHeaders headers();
    
    /**
     * Returns the request body.
     * 
     * @return the request body (never {@code null})
     */
    Body body();
    
    /**
     * Returns the address of the client.
     * 
     * @return the address of the client ({@code null} if unknown)
     */
    InetSocketAddress remoteAddress();
    
    /**
     * Returns the attributes of this request.<p>
     * 
     * The attributes are mutable and shared by everyone that has a reference
     * to this request.
     * 
     * @return the attributes (never {@code null})
     */
    Attributes attributes();
    
    /**
     * The target of a request.<p>
     * 
     * The raw string as received is retained, together with an absolute URI
     * resolved from it. An origin-form target ("/path?query") is resolved
     * against the Host header, or against the server's bind address if the
     * request has no Host header. An absolute-form target
     * ("http://host/path") is used as-is.
     */
    interface Target {
        /**
         * {@return the target as it appeared in the request line}
         */
        String raw();
        
        /**
         * {@return the absolute URI of the target}
         */
        URI uri();
        
        /**
         * Returns the path of the target, percent-decoded.
         * 
         * @return the path (never {@code null}, at least "/")
         */
        String path();
        
        /**
         * Returns the raw query string, if present.
         * 
         * @return the query (never {@code null}, possibly empty)
         */
        Optional<String> query();
    }
    
    /**
     * The body of a request.<p>
     * 
     * The entire body has been received and buffered in memory by the time
     * the handler is invoked. The maximum size is configured using
     * {@link alpha.nomagicdispatch.Config#maxRequestBodyBufferSize()}.
     */
    interface Body {
        /**
         * {@return the number of bytes in the body}
         */
        long length();
        
        /**
         * {@return {@code true} if the body has no bytes}
         */
        default boolean isEmpty() {
            return length() == 0;
        }
        
        /**
         * Returns a copy of the body.
         * 
         * @return the bytes of the body (never {@code null}, possibly empty)
         */
        byte[] bytes();
        
        /**
         * Decodes the body into a string.<p>
         * 
         * The charset is taken from the "charset" parameter of the
         * Content-Type header. If the parameter is absent, UTF-8 is used.
         * 
         * @return the body as text
         * 
         * @throws java.nio.charset.IllegalCharsetNameException
         *             if the charset parameter is not a legal name
         * @throws java.nio.charset.UnsupportedCharsetException
         *             if the charset is not supported by the JVM
         */
        String toText();
        
        /**
         * Decodes the body into a string using the given charset.
         * 
         * @param charset to use
         * 
         * @return the body as text
         * 
         * @throws NullPointerException if {@code charset} is {@code null}
         */
        String toText(Charset charset);
    }
}
