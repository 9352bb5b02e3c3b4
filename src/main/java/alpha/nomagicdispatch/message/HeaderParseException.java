package alpha.nomagicdispatch.message;

import static java.util.Objects.requireNonNull;

/**
 * A raw header field has an invalid name or value.
 */
public class HeaderParseException extends RequestAdaptationException
{
    private static final long serialVersionUID = 1L;
    
    private final String name;
    
    /**
     * Constructs a {@code HeaderParseException}.
     * 
     * @param name of the offending header, as received
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public HeaderParseException(String name, String message) {
        super(message);
        this.name = requireNonNull(name);
    }
    
    /**
     * Constructs a {@code HeaderParseException}.
     * 
     * @param name of the offending header, as received
     * @param message passed as-is to {@link Throwable#Throwable(String, Throwable)}
     * @param cause passed as-is to {@link Throwable#Throwable(String, Throwable)}
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public HeaderParseException(String name, String message, Throwable cause) {
        super(message, cause);
        this.name = requireNonNull(name);
    }
    
    /**
     * Returns the name of the offending header, as received.
     * 
     * @return the header name (never {@code null}, possibly empty)
     */
    public final String name() {
        return name;
    }
}
