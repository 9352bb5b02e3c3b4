package alpha.nomagicdispatch.internal;

import alpha.nomagicdispatch.Config;
import alpha.nomagicdispatch.handler.Handler;
import alpha.nomagicdispatch.message.Request;
import alpha.nomagicdispatch.message.RequestAdaptationException;
import alpha.nomagicdispatch.message.Response;
import alpha.nomagicdispatch.message.Responses;
import alpha.nomagicdispatch.transport.RawRequest;
import alpha.nomagicdispatch.transport.RawResponse;
import alpha.nomagicdispatch.transport.TransportCallback;

import java.net.InetSocketAddress;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.util.Objects.requireNonNull;

/**
 * The per-request callback of a listening server.<p>
 * 
 * For each raw request, the dispatcher adapts it into a {@link Request},
 * calls the handler, and writes the returned {@link Response} back to the
 * raw response sink. If adaptation fails, or the handler fails, then the
 * error is logged and {@link Responses#internalServerError()} is written
 * instead. The handler is not called if adaptation fails. Exactly one
 * response is written per call to {@link #handle(RawRequest, RawResponse)},
 * and nothing is thrown.<p>
 * 
 * All fields are final and the dispatcher holds no other state. One
 * instance is shared by all worker threads of a running transport, and the
 * handler is invoked concurrently without synchronization.<p>
 * 
 * The logger is given at construction and used for the dispatcher's
 * lifetime. Log records:
 * 
 * <ul>
 *   <li>{@code DEBUG} for each request dispatched to the handler</li>
 *   <li>{@code ERROR} "Error adapting request." if adaptation fails</li>
 *   <li>{@code ERROR} "Error handling " + request, if the handler fails</li>
 *   <li>{@code ERROR} "Error writing response." if the write fails</li>
 * </ul>
 */
public final class Dispatcher implements TransportCallback
{
    private final Handler handler;
    private final InetSocketAddress bindAddress;
    private final RequestAdapter requests;
    private final ResponseAdapter responses;
    private final System.Logger log;
    
    /**
     * Constructs a {@code Dispatcher} that logs to the logger of this
     * package.
     * 
     * @param handler of requests
     * @param config of server
     * @param bindAddress of server
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public Dispatcher(Handler handler, Config config, InetSocketAddress bindAddress) {
        this(handler, config, bindAddress,
             System.getLogger(Dispatcher.class.getPackageName()));
    }
    
    /**
     * Constructs a {@code Dispatcher}.
     * 
     * @param handler of requests
     * @param config of server
     * @param bindAddress of server
     * @param log where to log
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public Dispatcher(
            Handler handler, Config config,
            InetSocketAddress bindAddress, System.Logger log)
    {
        this.handler     = requireNonNull(handler);
        this.bindAddress = requireNonNull(bindAddress);
        this.requests    = new RequestAdapter(config, bindAddress);
        this.responses   = new ResponseAdapter(log);
        this.log         = log;
    }
    
    @Override
    public InetSocketAddress bindAddress() {
        return bindAddress;
    }
    
    @Override
    public void handle(RawRequest raw, RawResponse sink) {
        final Request req;
        try {
            req = requests.fromRaw(raw);
        } catch (RequestAdaptationException e) {
            log.log(ERROR, "Error adapting request.", e);
            responses.writeBack(Responses.internalServerError(), sink);
            return;
        }
        log.log(DEBUG, () -> "Dispatching " + req.method() + " " + req.target());
        responses.writeBack(call(req), sink);
    }
    
    private Response call(Request req) {
        try {
            return requireNonNull(handler.call(req), "Handler returned null.");
        } catch (Throwable t) {
            log.log(ERROR, "Error handling " + req, t);
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return Responses.internalServerError();
        }
    }
}
