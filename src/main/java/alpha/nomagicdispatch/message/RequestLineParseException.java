package alpha.nomagicdispatch.message;

/**
 * The method or request-target of a request-line is malformed.
 */
public class RequestLineParseException extends RequestAdaptationException
{
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a {@code RequestLineParseException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public RequestLineParseException(String message) {
        super(message);
    }
    
    /**
     * Constructs a {@code RequestLineParseException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String, Throwable)}
     * @param cause   passed as-is to {@link Throwable#Throwable(String, Throwable)}
     */
    public RequestLineParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
