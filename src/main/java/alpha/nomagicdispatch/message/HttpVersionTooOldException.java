package alpha.nomagicdispatch.message;

import alpha.nomagicdispatch.Config;
import alpha.nomagicdispatch.HttpConstants.Version;

import static java.util.Objects.requireNonNull;

/**
 * The request's HTTP version is older than
 * {@link Config#minHttpVersion()}.
 */
public class HttpVersionTooOldException extends RequestAdaptationException
{
    private static final long serialVersionUID = 1L;
    
    private final Version version, minimum;
    
    /**
     * Constructs a {@code HttpVersionTooOldException}.
     * 
     * @param version of the request
     * @param minimum version accepted
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public HttpVersionTooOldException(Version version, Version minimum) {
        super(version + " is older than " + minimum + ".");
        this.version = requireNonNull(version);
        this.minimum = requireNonNull(minimum);
    }
    
    /**
     * Returns the version of the request.
     * 
     * @return the version of the request
     */
    public final Version version() {
        return version;
    }
    
    /**
     * Returns the minimum version accepted.
     * 
     * @return the minimum version accepted
     */
    public final Version minimum() {
        return minimum;
    }
}
