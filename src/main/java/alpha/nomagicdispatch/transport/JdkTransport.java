package alpha.nomagicdispatch.transport;

import alpha.nomagicdispatch.Config;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static alpha.nomagicdispatch.HttpConstants.Method.HEAD;
import static alpha.nomagicdispatch.HttpConstants.StatusCode.FIVE_HUNDRED;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * A {@link Transport} built on the JDK's {@code com.sun.net.httpserver}
 * server.<p>
 * 
 * Each exchange is executed by a worker thread from a pool that is created
 * when the transport starts, and shut down when it stops. The pool is a
 * cached pool, unless {@link Config#workerThreads()} is positive, in which
 * case it is a fixed pool of that size.<p>
 * 
 * The request body is read into memory, but no more than
 * {@link Config#maxRequestBodyBufferSize()} plus one byte. One extra byte is
 * enough for the receiver to detect that the body is too large.<p>
 * 
 * Limitations imposed by the JDK server: header names are written with the
 * first letter capitalized and the rest in lowercase, the reason phrase is
 * always the one known by the JDK for the status code, and a Date header is
 * added to each response.<p>
 * 
 * Every exchange is closed when the callback returns. If the callback throws
 * or returns without committing a response, the problem is logged and, if
 * possible, a bare "500 Internal Server Error" is sent.
 */
public final class JdkTransport implements Transport
{
    private static final System.Logger LOG
            = System.getLogger(JdkTransport.class.getPackageName());
    
    private static final AtomicInteger POOL_SEQ = new AtomicInteger();
    
    private final Config config;
    
    /**
     * Constructs a {@code JdkTransport} using {@link Config#DEFAULT}.
     */
    public JdkTransport() {
        this(Config.DEFAULT);
    }
    
    /**
     * Constructs a {@code JdkTransport}.
     * 
     * @param config of transport
     * 
     * @throws NullPointerException if {@code config} is {@code null}
     */
    public JdkTransport(Config config) {
        this.config = requireNonNull(config);
    }
    
    @Override
    public Void serve(TransportCallback callback)
            throws IOException, InterruptedException
    {
        var running = start(callback);
        try {
            running.terminated.await();
        } finally {
            running.stop();
        }
        throw new IllegalStateException("Transport stopped.");
    }
    
    @Override
    public JdkRunning start(TransportCallback callback) throws IOException {
        requireNonNull(callback);
        final InetSocketAddress addr = requireNonNull(callback.bindAddress());
        final HttpServer server = HttpServer.create(addr, config.backlog());
        final ExecutorService workers = newWorkers();
        try {
            server.setExecutor(workers);
            server.createContext("/", ex -> exchange(callback, ex));
            server.start();
        } catch (Throwable t) {
            workers.shutdownNow();
            server.stop(0);
            throw t;
        }
        LOG.log(INFO, () -> "Listening on " + server.getAddress());
        return new JdkRunning(server, workers);
    }
    
    private ExecutorService newWorkers() {
        final int n = config.workerThreads();
        final ThreadFactory tf = newThreadFactory();
        return n > 0 ?
                Executors.newFixedThreadPool(n, tf) :
                Executors.newCachedThreadPool(tf);
    }
    
    private static ThreadFactory newThreadFactory() {
        final int pool = POOL_SEQ.incrementAndGet();
        final var thread = new AtomicInteger();
        return r -> {
            var t = new Thread(r,
                    "dispatch-" + pool + "-worker-" + thread.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
    
    private void exchange(TransportCallback callback, HttpExchange ex) {
        final var res = new ExchangeResponse(ex);
        try {
            callback.handle(toRawRequest(ex), res);
            if (!res.isCommitted()) {
                LOG.log(WARNING, "Callback returned without committing a response.");
                sendFallback(ex);
            }
        } catch (Throwable t) {
            LOG.log(ERROR, "Callback returned exceptionally.", t);
            if (!res.isCommitted()) {
                sendFallback(ex);
            }
        } finally {
            ex.close();
        }
    }
    
    private RawRequest toRawRequest(HttpExchange ex) throws IOException {
        final List<RawRequest.Field> fields = new ArrayList<>();
        ex.getRequestHeaders().forEach((name, values) ->
                values.forEach(v -> fields.add(new RawRequest.Field(name, v))));
        final byte[] body;
        try (InputStream in = ex.getRequestBody()) {
            body = in.readNBytes(readLimit());
        }
        return new RawRequest(
                ex.getRequestMethod(),
                ex.getRequestURI().toString(),
                ex.getProtocol(),
                fields,
                body,
                ex.getRemoteAddress(),
                ex.getLocalAddress());
    }
    
    private int readLimit() {
        long lim = (long) config.maxRequestBodyBufferSize() + 1;
        return (int) Math.max(0, Math.min(lim, Integer.MAX_VALUE - 8));
    }
    
    private static void sendFallback(HttpExchange ex) {
        try {
            ex.sendResponseHeaders(FIVE_HUNDRED, -1);
        } catch (IOException e) {
            LOG.log(DEBUG, "Failed to send fallback response.", e);
        }
    }
    
    /**
     * A running {@code JdkTransport}.
     */
    public final class JdkRunning implements Running
    {
        private final HttpServer server;
        private final ExecutorService workers;
        private final AtomicBoolean stopped;
        private final CountDownLatch terminated;
        
        private JdkRunning(HttpServer server, ExecutorService workers) {
            this.server     = server;
            this.workers    = workers;
            this.stopped    = new AtomicBoolean();
            this.terminated = new CountDownLatch(1);
        }
        
        @Override
        public InetSocketAddress localAddress() {
            return server.getAddress();
        }
        
        @Override
        public void stop() {
            if (!stopped.compareAndSet(false, true)) {
                return;
            }
            final long grace = config.timeoutStop().toMillis();
            LOG.log(INFO, () -> "Stopping " + server.getAddress());
            try {
                // The JDK server takes whole seconds
                server.stop((int) TimeUnit.MILLISECONDS.toSeconds(grace + 999));
                workers.shutdown();
                if (!workers.awaitTermination(grace, TimeUnit.MILLISECONDS)) {
                    LOG.log(DEBUG, "Grace period expired; interrupting workers.");
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            } finally {
                terminated.countDown();
            }
        }
    }
    
    private static final class ExchangeResponse implements RawResponse
    {
        private final HttpExchange ex;
        private final List<RawRequest.Field> headers;
        private int code;
        private boolean committed;
        
        ExchangeResponse(HttpExchange ex) {
            this.ex      = ex;
            this.headers = new ArrayList<>();
            this.code    = -1;
        }
        
        @Override
        public void status(int code, String reasonPhrase) {
            requireNonNull(reasonPhrase);
            requireNotCommitted();
            this.code = code;
        }
        
        @Override
        public void header(String name, String value) {
            var f = new RawRequest.Field(name, value);
            requireNotCommitted();
            headers.add(f);
        }
        
        @Override
        public void write(byte[] body) throws IOException {
            requireNonNull(body);
            requireNotCommitted();
            if (code == -1) {
                throw new IllegalStateException("Status not set.");
            }
            var h = ex.getResponseHeaders();
            headers.forEach(f -> h.add(f.name(), f.value()));
            final boolean noBody = body.length == 0 ||
                                   HEAD.equals(ex.getRequestMethod());
            committed = true;
            ex.sendResponseHeaders(code, noBody ? -1 : body.length);
            if (!noBody) {
                try (OutputStream out = ex.getResponseBody()) {
                    out.write(body);
                }
            }
        }
        
        @Override
        public boolean isCommitted() {
            return committed;
        }
        
        private void requireNotCommitted() {
            if (committed) {
                throw new IllegalStateException("Response already committed.");
            }
        }
    }
}
