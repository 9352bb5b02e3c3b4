package alpha.nomagicdispatch.internal;

import alpha.nomagicdispatch.message.Response;
import alpha.nomagicdispatch.transport.RawResponse;

import java.nio.ByteBuffer;

import static java.lang.System.Logger.Level.ERROR;
import static java.util.Objects.requireNonNull;

/**
 * Writes a {@link Response} to a {@link RawResponse}.<p>
 * 
 * The status line is written first, then each header in the order of
 * {@link Response#headers()}, then the body. Nothing is added or removed.<p>
 * 
 * A failure to write is logged, and not propagated. The response may be
 * partially written at that point, so there is no attempt to write another
 * one.
 */
final class ResponseAdapter
{
    private final System.Logger log;
    
    ResponseAdapter(System.Logger log) {
        this.log = requireNonNull(log);
    }
    
    /**
     * Writes the response.
     * 
     * @param response to write
     * @param sink to write to
     * 
     * @return {@code true} if the response was written, otherwise {@code false}
     */
    boolean writeBack(Response response, RawResponse sink) {
        try {
            sink.status(response.statusCode(), response.reasonPhrase());
            response.headers().forEach((name, values) ->
                    values.forEach(v -> sink.header(name, v)));
            sink.write(toArray(response.body()));
            return true;
        } catch (Exception e) {
            log.log(ERROR, "Error writing response.", e);
            return false;
        }
    }
    
    private static byte[] toArray(ByteBuffer buf) {
        byte[] arr = new byte[buf.remaining()];
        buf.get(arr);
        return arr;
    }
}
