package alpha.nomagicdispatch.message;

import alpha.nomagicdispatch.HttpConstants;
import alpha.nomagicdispatch.HttpConstants.StatusCode;
import alpha.nomagicdispatch.handler.Handler;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;

/**
 * A status line, followed by optional headers and body.<p>
 * 
 * Returned by a {@link Handler} and written back to the client verbatim: the
 * server adds nothing to, and removes nothing from, the status line, the
 * headers or the body. Message framing (for example, the
 * {@value HttpConstants.HeaderName#CONTENT_LENGTH} header) is handled by the
 * transport.<p>
 * 
 * Can be built using a {@link Response.Builder}:
 * 
 * <pre>{@code
 *   Response r = Response.builder(201)
 *                        .header("Location", "/items/123")
 *                        .build();
 * }</pre>
 * 
 * The {@code Response} object is immutable, and the builder that built it can
 * be retrieved using {@link #toBuilder()}, which makes any response a
 * template. {@link Responses} is a repository of commonly used responses.<p>
 * 
 * The implementation is thread-safe. It does not necessarily implement
 * {@code hashCode} and {@code equals}.
 * 
 * @see Responses
 */
public interface Response
{
    /**
     * Returns a {@code Response} builder.<p>
     * 
     * If not set, the reason phrase will be that of the status code as
     * declared in {@link HttpConstants.ReasonPhrase}, or "Unknown".
     * 
     * @param statusCode response status code
     * 
     * @return a builder (doesn't have to be a new instance)
     */
    static Builder builder(int statusCode) {
        return Responses.status(statusCode).toBuilder();
    }
    
    /**
     * Returns a {@code Response} builder.
     * 
     * @param statusCode response status code
     * @param reasonPhrase response reason phrase
     * 
     * @return a builder (doesn't have to be a new instance)
     * 
     * @throws NullPointerException
     *             if {@code reasonPhrase} is {@code null}
     */
    static Builder builder(int statusCode, String reasonPhrase) {
        return builder(statusCode).reasonPhrase(reasonPhrase);
    }
    
    /**
     * Returns the status code.
     * 
     * @return the status code
     * 
     * @see HttpConstants.StatusCode
     */
    int statusCode();
    
    /**
     * Returns the reason phrase.
     * 
     * @return the reason phrase (never {@code null}, may be empty)
     * 
     * @see HttpConstants.ReasonPhrase
     */
    String reasonPhrase();
    
    /**
     * Returns the headers.<p>
     * 
     * The map is unmodifiable. Iteration order is the order in which header
     * names were first added, and name casing is preserved.
     * 
     * @return the headers (never {@code null})
     */
    Map<String, List<String>> headers();
    
    /**
     * Returns the message body.<p>
     * 
     * The returned buffer is a read-only view, positioned at zero. Each call
     * returns a new view.
     * 
     * @return the message body (never {@code null}, possibly empty)
     */
    ByteBuffer body();
    
    /**
     * Returns {@code true} if the status-code is 1XX (Informational).
     * 
     * @return see JavaDoc
     */
    default boolean isInformational() {
        return StatusCode.isInformational(statusCode());
    }
    
    /**
     * Returns {@code true} if the status-code is 2XX (Successful).
     * 
     * @return see JavaDoc
     */
    default boolean isSuccessful() {
        return StatusCode.isSuccessful(statusCode());
    }
    
    /**
     * Returns the builder instance that built this response.<p>
     * 
     * The builder may be used for further response templating.
     * 
     * @return the builder instance that built this response
     */
    Builder toBuilder();
    
    /**
     * Builder of a {@link Response}.<p>
     * 
     * The builder is immutable. All builder-returning methods return a new
     * instance representing the new state.<p>
     * 
     * Status code is the only required field.<p>
     * 
     * Header names and values may not have leading or trailing whitespace (
     * <a href="https://tools.ietf.org/html/rfc7230#section-3.2.4">RFC 7230 §3.2.4</a>
     * ). Names may not be empty, values may be. Adding values to the same
     * header name replicates the header across multiple rows in the response;
     * values are never joined. {@link #build()} throws an
     * {@link IllegalStateException} if a header name has been duplicated using
     * different casing.<p>
     * 
     * The implementation is thread-safe and non-blocking.
     */
    interface Builder
    {
        /**
         * Sets a status code.
         * 
         * @param statusCode value (any integer value)
         * 
         * @return a new builder representing the new state
         */
        Builder statusCode(int statusCode);
        
        /**
         * Sets a reason phrase.
         * 
         * @param reasonPhrase value
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException
         *             if {@code reasonPhrase} is {@code null}
         */
        Builder reasonPhrase(String reasonPhrase);
        
        /**
         * Sets a header, replacing all previously set values for the
         * (case-sensitive) name.
         * 
         * @param name of header
         * @param value of header
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException
         *             if any argument is {@code null}
         * @throws IllegalArgumentException
         *             if any argument has leading or trailing whitespace,
         *             or {@code name} is empty
         */
        Builder header(String name, String value);
        
        /**
         * Adds a header.<p>
         * 
         * If the header is already present, then it will be repeated in the
         * response.
         * 
         * @param name of header
         * @param value of header
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException
         *             if any argument is {@code null}
         * @throws IllegalArgumentException
         *             if any argument has leading or trailing whitespace,
         *             or {@code name} is empty
         */
        Builder addHeader(String name, String value);
        
        /**
         * Adds header(s).<p>
         * 
         * Equivalent to calling {@link #addHeader(String, String) addHeader}
         * for each pair. The {@code morePairs} array alternates between names
         * and values.
         * 
         * @param name of header
         * @param value of header
         * @param morePairs of headers
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException
         *             if any argument or array element is {@code null}
         * @throws IllegalArgumentException
         *             if {@code morePairs.length} is odd, a string has
         *             surrounding whitespace, or a name is empty
         */
        Builder addHeaders(String name, String value, String... morePairs);
        
        /**
         * Removes all occurrences of a header, regardless of casing.
         * 
         * @param name of header
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException
         *             if {@code name} is {@code null}
         */
        Builder removeHeader(String name);
        
        /**
         * Sets a message body.<p>
         * 
         * The array is copied. An empty array removes a previously set body.
         * The application should also set the
         * {@value HttpConstants.HeaderName#CONTENT_TYPE} header.
         * 
         * @param body content
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException
         *             if {@code body} is {@code null}
         */
        Builder body(byte[] body);
        
        /**
         * Builds the response.
         * 
         * @return a new response
         * 
         * @throws IllegalStateException
         *             if a header name is repeated using different casing
         * @throws IllegalResponseBodyException
         *             if the body is not empty and the status code is one of
         *             1XX (Informational), 204 (No Content), 304 (Not Modified)
         */
        Response build();
    }
}
