package alpha.nomagicdispatch.transport;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * A listener that accepts connections, reads requests and hands each one to
 * a {@link TransportCallback}.<p>
 * 
 * The transport owns everything on the wire: connection management, request
 * framing, and response framing (for example, the Content-Length header).
 * Each request is handled on a worker thread.<p>
 * 
 * A transport instance may be started any number of times. Each start binds
 * a new listening socket.
 * 
 * @see JdkTransport
 */
public interface Transport
{
    /**
     * Binds the callback's address and serves requests forever.<p>
     * 
     * This method returns only exceptionally.
     * 
     * @param callback to invoke for each request
     * 
     * @return never
     * 
     * @throws NullPointerException
     *             if {@code callback} is {@code null}
     * @throws IOException
     *             if binding fails, e.g. {@link java.net.BindException}
     * @throws InterruptedException
     *             if the calling thread is interrupted while serving
     */
    Void serve(TransportCallback callback)
            throws IOException, InterruptedException;
    
    /**
     * Binds the callback's address and serves requests on background
     * threads.
     * 
     * @param callback to invoke for each request
     * 
     * @return a handle to the running transport
     * 
     * @throws NullPointerException
     *             if {@code callback} is {@code null}
     * @throws IOException
     *             if binding fails, e.g. {@link java.net.BindException}
     */
    Running start(TransportCallback callback) throws IOException;
    
    /**
     * A started transport.
     */
    interface Running {
        /**
         * Returns the address the transport is bound to.<p>
         * 
         * If the transport was asked to bind to port 0, then the returned
         * port is the one picked by the system.
         * 
         * @return the local address
         */
        InetSocketAddress localAddress();
        
        /**
         * Stops the transport.<p>
         * 
         * No new exchanges are accepted. In-flight exchanges are given a
         * grace period to complete. This method is NOP if the transport has
         * already been stopped.
         */
        void stop();
    }
}
