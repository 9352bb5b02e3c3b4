package alpha.nomagicdispatch.message;

import alpha.nomagicdispatch.Config;

/**
 * The raw request body is larger than
 * {@link Config#maxRequestBodyBufferSize()}.
 */
public class MaxRequestBodyBufferSizeException extends RequestAdaptationException
{
    private static final long serialVersionUID = 1L;
    
    private final long length;
    private final int max;
    
    /**
     * Constructs a {@code MaxRequestBodyBufferSizeException}.
     * 
     * @param length of body received (may be a lower bound)
     * @param max configured tolerance
     */
    public MaxRequestBodyBufferSizeException(long length, int max) {
        super("Body of " + length + " bytes exceeds the max of " + max + " bytes.");
        this.length = length;
        this.max = max;
    }
    
    /**
     * Returns the number of body bytes received.<p>
     * 
     * The transport stops reading one byte past the configured max, so the
     * actual body may be longer still.
     * 
     * @return the number of body bytes received
     */
    public final long length() {
        return length;
    }
    
    /**
     * Returns the configured max.
     * 
     * @return the configured max
     */
    public final int max() {
        return max;
    }
}
