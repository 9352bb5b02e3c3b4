package alpha.nomagicdispatch;

import alpha.nomagicdispatch.handler.Handler;
import alpha.nomagicdispatch.internal.DefaultServer;
import alpha.nomagicdispatch.transport.JdkTransport;
import alpha.nomagicdispatch.transport.Transport;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;

/**
 * An HTTP server that calls one {@link Handler} for every request.<p>
 * 
 * A server is created using {@link #around(Handler)}, and started using one
 * of the listen methods:
 * 
 * <pre>{@code
 *   public static void main(String... ignored)
 *           throws IOException, InterruptedException {
 *       Handler h = req -> Responses.text("Hello, World!");
 *       Server.around(h).listen(InetAddress.getLoopbackAddress(), 8080);
 *   }
 * }</pre>
 * 
 * For every request, the server adapts what was received into a
 * {@link alpha.nomagicdispatch.message.Request Request}, calls the handler,
 * and writes the returned
 * {@link alpha.nomagicdispatch.message.Response Response} back to the client.
 * If the request can not be adapted, or the handler fails, then the error is
 * logged and the client receives a "500 Internal Server Error" response with
 * the text body "Internal Server Error". Both failure kinds look the same on
 * the wire. One failed request never affects another.<p>
 * 
 * The server value holds nothing but the handler, configuration and
 * transport. Each listen call creates everything it needs anew, and so the
 * same server may be started any number of times, also concurrently on
 * different ports.<p>
 * 
 * The implementation is immutable and thread-safe.
 */
public interface Server
{
    /**
     * Creates a server using {@link Config#DEFAULT}.
     * 
     * @param handler of requests
     * 
     * @return a server
     * 
     * @throws NullPointerException if {@code handler} is {@code null}
     */
    static Server around(Handler handler) {
        return around(handler, Config.DEFAULT);
    }
    
    /**
     * Creates a server.<p>
     * 
     * The server uses a {@link JdkTransport}.
     * 
     * @param handler of requests
     * @param config of server
     * 
     * @return a server
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    static Server around(Handler handler, Config config) {
        return around(handler, config, new JdkTransport(config));
    }
    
    /**
     * Creates a server using the given transport.
     * 
     * @param handler of requests
     * @param config of server
     * @param transport of server
     * 
     * @return a server
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    static Server around(Handler handler, Config config, Transport transport) {
        return new DefaultServer(handler, config, transport);
    }
    
    /**
     * {@return the handler of this server}
     */
    Handler handler();
    
    /**
     * {@return the configuration of this server}
     */
    Config config();
    
    /**
     * Listens on the given address and serves requests forever.<p>
     * 
     * This method blocks and does not return normally. It should be the last
     * statement of the program's start-up. The only ways out are a failure
     * to bind, or an interrupt of the calling thread.
     * 
     * @param ip address to bind
     * @param port to bind
     * 
     * @return never
     * 
     * @throws NullPointerException
     *             if {@code ip} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code port} is out of range
     * @throws IOException
     *             if binding fails, e.g. {@link java.net.BindException}
     * @throws InterruptedException
     *             if the calling thread is interrupted
     */
    Void listen(InetAddress ip, int port)
            throws IOException, InterruptedException;
    
    /**
     * Listens on the given address and serves requests forever.<p>
     * 
     * This method blocks and does not return normally.
     * 
     * @param address to bind
     * 
     * @return never
     * 
     * @throws NullPointerException
     *             if {@code address} is {@code null}
     * @throws IOException
     *             if binding fails, e.g. {@link java.net.BindException}
     * @throws InterruptedException
     *             if the calling thread is interrupted
     * 
     * @see #listen(InetAddress, int)
     */
    Void listen(InetSocketAddress address)
            throws IOException, InterruptedException;
    
    /**
     * Listens on the given address and serves requests on background
     * threads.<p>
     * 
     * Port 0 binds a port picked by the system, which can be retrieved using
     * {@link Listening#localAddress()}.
     * 
     * @param ip address to bind
     * @param port to bind
     * 
     * @return a handle to stop the server
     * 
     * @throws NullPointerException
     *             if {@code ip} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code port} is out of range
     * @throws IOException
     *             if binding fails, e.g. {@link java.net.BindException}
     */
    Listening listenAsync(InetAddress ip, int port) throws IOException;
    
    /**
     * A server listening in the background.<p>
     * 
     * Closing the listener is the same as stopping it.
     */
    interface Listening extends AutoCloseable
    {
        /**
         * {@return the address the server is bound to}
         */
        InetSocketAddress localAddress();
        
        /**
         * Stops the server.<p>
         * 
         * In-flight requests are given a grace period to complete (see
         * {@link Config#timeoutStop()}). This method is NOP if the server has
         * already been stopped.
         */
        void stop();
        
        @Override
        default void close() {
            stop();
        }
    }
}
