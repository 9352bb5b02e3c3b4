package alpha.nomagicdispatch.message;

import alpha.nomagicdispatch.HttpConstants.HeaderName;
import alpha.nomagicdispatch.HttpConstants.ReasonPhrase;

import static alpha.nomagicdispatch.HttpConstants.StatusCode.FIVE_HUNDRED;
import static alpha.nomagicdispatch.HttpConstants.StatusCode.FOUR_HUNDRED;
import static alpha.nomagicdispatch.HttpConstants.StatusCode.FOUR_HUNDRED_FOUR;
import static alpha.nomagicdispatch.HttpConstants.StatusCode.TWO_HUNDRED;
import static alpha.nomagicdispatch.HttpConstants.StatusCode.TWO_HUNDRED_FOUR;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Factories of {@link Response}s.<p>
 * 
 * Responses without a body are cached and the same instance is returned on
 * each call. All responses are immutable, and so they may also be used as
 * templates:
 * 
 * <pre>{@code
 *   Response r = Responses.notFound().toBuilder()
 *                         .header("Cache-Control", "no-store")
 *                         .build();
 * }</pre>
 */
public final class Responses
{
    private static final String TEXT_PLAIN_UTF8 = "text/plain; charset=utf-8";
    
    private static final Response
            OK             = build(TWO_HUNDRED),
            NO_CONTENT     = build(TWO_HUNDRED_FOUR),
            BAD_REQUEST    = build(FOUR_HUNDRED),
            NOT_FOUND      = build(FOUR_HUNDRED_FOUR),
            INTERNAL_ERROR = DefaultResponse.DefaultBuilder.ROOT
                    .statusCode(FIVE_HUNDRED)
                    .header(HeaderName.CONTENT_TYPE, TEXT_PLAIN_UTF8)
                    .body(ReasonPhrase.INTERNAL_SERVER_ERROR.getBytes(UTF_8))
                    .build();
    
    private Responses() {
        // Empty
    }
    
    /**
     * Returns a response with the given status code, no headers and no body.
     * 
     * @param code status code
     * 
     * @return a response
     */
    public static Response status(int code) {
        switch (code) {
            case TWO_HUNDRED:       return OK;
            case TWO_HUNDRED_FOUR:  return NO_CONTENT;
            case FOUR_HUNDRED:      return BAD_REQUEST;
            case FOUR_HUNDRED_FOUR: return NOT_FOUND;
            default:                return build(code);
        }
    }
    
    /**
     * Returns a response with the given status code and reason phrase, no
     * headers and no body.
     * 
     * @param code status code
     * @param phrase reason phrase
     * 
     * @return a response
     * 
     * @throws NullPointerException if {@code phrase} is {@code null}
     */
    public static Response status(int code, String phrase) {
        return DefaultResponse.DefaultBuilder.ROOT
                .statusCode(code)
                .reasonPhrase(phrase)
                .build();
    }
    
    /**
     * {@return a cached "200 OK" response with no headers and no body}
     */
    public static Response ok() {
        return OK;
    }
    
    /**
     * Returns a "200 OK" response with a text body.<p>
     * 
     * The content type is "text/plain; charset=utf-8".
     * 
     * @param text body content
     * 
     * @return a response
     * 
     * @throws NullPointerException if {@code text} is {@code null}
     */
    public static Response text(String text) {
        return ok(TEXT_PLAIN_UTF8, text.getBytes(UTF_8));
    }
    
    /**
     * Returns a "200 OK" response with the given body.
     * 
     * @param contentType value of the Content-Type header
     * @param body content
     * 
     * @return a response
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static Response ok(String contentType, byte[] body) {
        requireNonNull(contentType, "contentType");
        return OK.toBuilder()
                 .header(HeaderName.CONTENT_TYPE, contentType)
                 .body(body)
                 .build();
    }
    
    /**
     * {@return a cached "204 No Content" response}
     */
    public static Response noContent() {
        return NO_CONTENT;
    }
    
    /**
     * {@return a cached "400 Bad Request" response with no body}
     */
    public static Response badRequest() {
        return BAD_REQUEST;
    }
    
    /**
     * {@return a cached "404 Not Found" response with no body}
     */
    public static Response notFound() {
        return NOT_FOUND;
    }
    
    /**
     * Returns a cached "500 Internal Server Error" response.<p>
     * 
     * This is the response the server writes when it fails to adapt a
     * request, or when the handler fails. The body is the text "Internal
     * Server Error", and the only header is
     * "Content-Type: text/plain; charset=utf-8".
     * 
     * @return a response
     */
    public static Response internalServerError() {
        return INTERNAL_ERROR;
    }
    
    private static Response build(int code) {
        return DefaultResponse.DefaultBuilder.ROOT.statusCode(code).build();
    }
}
