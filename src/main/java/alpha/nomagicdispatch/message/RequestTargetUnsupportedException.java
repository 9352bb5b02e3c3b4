package alpha.nomagicdispatch.message;

import static java.util.Objects.requireNonNull;

/**
 * The request-target is well-formed, but of a form that can not be turned
 * into an absolute {@code http} or {@code https} URI.<p>
 * 
 * The asterisk-form ({@code OPTIONS * HTTP/1.1}) and the authority-form
 * ({@code CONNECT example.com:443 HTTP/1.1}) are not supported (
 * <a href="https://tools.ietf.org/html/rfc7230#section-5.3">RFC 7230 §5.3</a>
 * ).
 */
public class RequestTargetUnsupportedException extends RequestAdaptationException
{
    private static final long serialVersionUID = 1L;
    
    private final String requestTarget;
    
    /**
     * Constructs a {@code RequestTargetUnsupportedException}.
     * 
     * @param requestTarget as received
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     * 
     * @throws NullPointerException if {@code requestTarget} is {@code null}
     */
    public RequestTargetUnsupportedException(String requestTarget, String message) {
        super(message);
        this.requestTarget = requireNonNull(requestTarget);
    }
    
    /**
     * Returns the request-target as received.
     * 
     * @return the request-target as received (never {@code null})
     */
    public final String requestTarget() {
        return requestTarget;
    }
}
