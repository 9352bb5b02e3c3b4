package alpha.nomagicdispatch.message;

import alpha.nomagicdispatch.HttpConstants;

import static java.util.Objects.requireNonNull;

/**
 * The HTTP-version field of a request-line could not be parsed into a
 * {@link HttpConstants.Version}.
 */
public class HttpVersionParseException extends RequestAdaptationException
{
    private static final long serialVersionUID = 1L;
    
    private final String requestFieldValue;
    
    /**
     * Constructs a {@code HttpVersionParseException}.
     * 
     * @param requestFieldValue which attempted to parse
     * @param cause passed as-is to {@link Throwable#Throwable(String, Throwable)}
     * 
     * @throws NullPointerException if {@code requestFieldValue} is {@code null}
     */
    public HttpVersionParseException(String requestFieldValue, Throwable cause) {
        super("Can not parse \"" + requestFieldValue + "\".", cause);
        this.requestFieldValue = requireNonNull(requestFieldValue);
    }
    
    /**
     * Constructs a {@code HttpVersionParseException}.
     * 
     * @param requestFieldValue which attempted to parse
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     * 
     * @throws NullPointerException if {@code requestFieldValue} is {@code null}
     */
    public HttpVersionParseException(String requestFieldValue, String message) {
        super(message);
        this.requestFieldValue = requireNonNull(requestFieldValue);
    }
    
    /**
     * Returns the HTTP-version field value from the request.
     * 
     * @return the HTTP-version field value (never {@code null})
     */
    public final String requestFieldValue() {
        return requestFieldValue;
    }
}
