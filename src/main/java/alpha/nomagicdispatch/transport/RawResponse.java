package alpha.nomagicdispatch.transport;

import java.io.IOException;

/**
 * The writable sink of a response, provided by the {@link Transport}.<p>
 * 
 * A response is written in order: one status line, zero or more headers,
 * then the body. The call to {@link #write(byte[])} commits the response.
 * After that, every method throws {@link IllegalStateException}. The
 * transport guarantees that at most one response is committed per request.<p>
 * 
 * The sink is used by one thread at a time and is not thread-safe.
 */
public interface RawResponse
{
    /**
     * Sets the status line.<p>
     * 
     * Calling this method again replaces the previous status line.
     * 
     * @param code status code
     * @param reasonPhrase reason phrase
     * 
     * @throws NullPointerException
     *             if {@code reasonPhrase} is {@code null}
     * @throws IllegalStateException
     *             if the response has been committed
     */
    void status(int code, String reasonPhrase);
    
    /**
     * Adds a header.<p>
     * 
     * A repeated name produces a repeated header line.
     * 
     * @param name of header
     * @param value of header
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws IllegalStateException
     *             if the response has been committed
     */
    void header(String name, String value);
    
    /**
     * Writes the body and commits the response.<p>
     * 
     * An empty array commits a response without a body.
     * 
     * @param body content
     * 
     * @throws NullPointerException
     *             if {@code body} is {@code null}
     * @throws IllegalStateException
     *             if the status has not been set, or the response has been
     *             committed
     * @throws IOException
     *             if an I/O error occurs
     */
    void write(byte[] body) throws IOException;
    
    /**
     * {@return {@code true} if {@link #write(byte[])} has been called}
     */
    boolean isCommitted();
}
