package alpha.nomagicdispatch.message;

import static java.util.Objects.requireNonNull;

/**
 * Thrown by {@link Response.Builder#build()} if the response has a body but
 * its status code forbids one; 1XX (Informational), 204 (No Content) and
 * 304 (Not Modified).
 */
public class IllegalResponseBodyException extends IllegalStateException
{
    private static final long serialVersionUID = 1L;
    
    private final transient Response response;
    
    /**
     * Constructs a {@code IllegalResponseBodyException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     * @param response the offending response
     * 
     * @throws NullPointerException if {@code response} is {@code null}
     */
    public IllegalResponseBodyException(String message, Response response) {
        super(message);
        this.response = requireNonNull(response);
    }
    
    /**
     * Returns the offending response.
     * 
     * @return the offending response
     */
    public final Response response() {
        return response;
    }
}
