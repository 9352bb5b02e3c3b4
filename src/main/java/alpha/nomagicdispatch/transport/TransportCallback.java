package alpha.nomagicdispatch.transport;

import java.net.InetSocketAddress;

/**
 * What a {@link Transport} calls, once per received request.<p>
 * 
 * The callback is invoked concurrently from the transport's worker threads,
 * and must be thread-safe. It is expected to always leave the response
 * committed and never throw. A transport nonetheless contains whatever the
 * callback throws.
 */
public interface TransportCallback
{
    /**
     * {@return the address the transport should bind to}
     */
    InetSocketAddress bindAddress();
    
    /**
     * Handles a request.
     * 
     * @param request what was received
     * @param response the sink to write to
     */
    void handle(RawRequest request, RawResponse response);
}
