package alpha.nomagicdispatch;

import alpha.nomagicdispatch.HttpConstants.Version;
import alpha.nomagicdispatch.message.HttpVersionTooOldException;
import alpha.nomagicdispatch.message.MaxRequestBodyBufferSizeException;
import alpha.nomagicdispatch.message.Request;

import java.time.Duration;

/**
 * Server configuration.<p>
 * 
 * The implementation is immutable and thread-safe.<p>
 * 
 * The implementation used if none is specified is {@link #DEFAULT}.<p>
 * 
 * Any configuration object can be turned into a builder for customization. The
 * static method {@link #configuration()} is a shortcut for {@code
 * Config.DEFAULT.toBuilder()}.
 * 
 * <pre>{@code
 *   Config c = Config.configuration()
 *                    .workerThreads(8)
 *                    .build();
 *   Server.around(handler, c).listen(InetAddress.getLoopbackAddress(), 8080);
 * }</pre>
 */
public interface Config
{
    /**
     * Values used:<p>
     * 
     * Max request body buffer size = 20 971 520 <br>
     * Min HTTP version = HTTP/1.0 <br>
     * Worker threads = 0 (cached pool) <br>
     * Backlog = 0 (system default) <br>
     * Timeout stop = 1 second
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();
    
    /**
     * Returns the max number of request body bytes the server accepts to
     * buffer.<p>
     * 
     * The body of a request is fully buffered in memory before the handler is
     * called; see {@link Request#body()}. A body that is longer than this
     * fails with a {@link MaxRequestBodyBufferSizeException}, and the handler
     * is not called.<p>
     * 
     * The default implementation returns {@code 20_971_520} (20 MB).
     * 
     * @return see JavaDoc
     */
    int maxRequestBodyBufferSize();
    
    /**
     * Returns the oldest HTTP version a request may use.<p>
     * 
     * A request using an older version fails with a
     * {@link HttpVersionTooOldException}, and the handler is not called.<p>
     * 
     * The default implementation returns {@link Version#HTTP_1_0}.
     * 
     * @return see JavaDoc
     */
    Version minHttpVersion();
    
    /**
     * Returns the number of worker threads that execute requests.<p>
     * 
     * Zero (or a negative value) means that threads are created on demand
     * and cached when idle. A positive value is the fixed size of the pool.<p>
     * 
     * The default implementation returns {@code 0}.
     * 
     * @return see JavaDoc
     */
    int workerThreads();
    
    /**
     * Returns the maximum number of queued incoming connections.<p>
     * 
     * Zero (or a negative value) means a system default.<p>
     * 
     * The default implementation returns {@code 0}.
     * 
     * @return see JavaDoc
     */
    int backlog();
    
    /**
     * Returns the max duration a stopping server waits for in-flight
     * exchanges to complete.<p>
     * 
     * The default implementation returns {@code Duration.ofSeconds(1)}.
     * 
     * @return see JavaDoc
     */
    Duration timeoutStop();
    
    /**
     * Returns this configuration as a builder.
     * 
     * @return this configuration as a builder
     */
    Builder toBuilder();
    
    /**
     * Is a shortcut for {@code DEFAULT.toBuilder()}.
     * 
     * @return a builder with default values
     */
    static Builder configuration() {
        return DEFAULT.toBuilder();
    }
    
    /**
     * Builder of a {@link Config}.<p>
     * 
     * The builder is immutable. All builder-returning methods return a new
     * builder instance representing the new state.
     */
    interface Builder {
        /**
         * Sets a new value.<p>
         * 
         * The value can be any integer, although a value too small (or
         * negative) will reject all requests with a body.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#maxRequestBodyBufferSize()
         */
        Builder maxRequestBodyBufferSize(int newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @see Config#minHttpVersion()
         */
        Builder minHttpVersion(Version newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#workerThreads()
         */
        Builder workerThreads(int newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#backlog()
         */
        Builder backlog(int newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @see Config#timeoutStop()
         */
        Builder timeoutStop(Duration newVal);
        
        /**
         * Builds a configuration object.
         * 
         * @return a configuration object
         */
        Config build();
    }
}
