package alpha.nomagicdispatch.internal;

import alpha.nomagicdispatch.Config;
import alpha.nomagicdispatch.Server;
import alpha.nomagicdispatch.handler.Handler;
import alpha.nomagicdispatch.transport.Transport;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;

import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Server}.<p>
 * 
 * Each listen call constructs a new {@link Dispatcher} and passes it to the
 * transport. Nothing is retained between calls.
 */
public final class DefaultServer implements Server
{
    private final Handler handler;
    private final Config config;
    private final Transport transport;
    
    /**
     * Constructs a {@code DefaultServer}.
     * 
     * @param handler of requests
     * @param config of server
     * @param transport of server
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public DefaultServer(Handler handler, Config config, Transport transport) {
        this.handler   = requireNonNull(handler);
        this.config    = requireNonNull(config);
        this.transport = requireNonNull(transport);
    }
    
    @Override
    public Handler handler() {
        return handler;
    }
    
    @Override
    public Config config() {
        return config;
    }
    
    @Override
    public Void listen(InetAddress ip, int port)
            throws IOException, InterruptedException {
        return listen(new InetSocketAddress(requireNonNull(ip), port));
    }
    
    @Override
    public Void listen(InetSocketAddress address)
            throws IOException, InterruptedException {
        return transport.serve(newDispatcher(address));
    }
    
    @Override
    public Listening listenAsync(InetAddress ip, int port) throws IOException {
        var addr = new InetSocketAddress(requireNonNull(ip), port);
        var running = transport.start(newDispatcher(addr));
        return new Listening() {
            @Override
            public InetSocketAddress localAddress() {
                return running.localAddress();
            }
            
            @Override
            public void stop() {
                running.stop();
            }
        };
    }
    
    private Dispatcher newDispatcher(InetSocketAddress address) {
        return new Dispatcher(handler, config, requireNonNull(address));
    }
}
