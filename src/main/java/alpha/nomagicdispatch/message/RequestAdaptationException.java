package alpha.nomagicdispatch.message;

import alpha.nomagicdispatch.transport.RawRequest;

/**
 * A raw request could not be adapted into a {@link Request}.<p>
 * 
 * The server logs this exception and responds a
 * {@link Responses#internalServerError() 500 (Internal Server Error)}. The
 * handler is never called.<p>
 * 
 * Subclasses describe which part of the raw request was malformed.
 * 
 * @see RawRequest
 */
public class RequestAdaptationException extends Exception
{
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a {@code RequestAdaptationException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public RequestAdaptationException(String message) {
        super(message);
    }
    
    /**
     * Constructs a {@code RequestAdaptationException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String, Throwable)}
     * @param cause   passed as-is to {@link Throwable#Throwable(String, Throwable)}
     */
    public RequestAdaptationException(String message, Throwable cause) {
        super(message, cause);
    }
}
