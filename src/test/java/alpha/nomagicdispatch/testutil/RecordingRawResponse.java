package alpha.nomagicdispatch.testutil;

import alpha.nomagicdispatch.transport.RawRequest;
import alpha.nomagicdispatch.transport.RawResponse;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * A {@link RawResponse} that records what is written to it.<p>
 * 
 * Behaves like a real sink: after the response is committed, every method
 * throws {@code IllegalStateException}. The number of commits is counted
 * regardless, so a test can assert that exactly one response was written.<p>
 * 
 * A failure may be scheduled for the write call using
 * {@link #failWriteWith(IOException)}.
 */
public final class RecordingRawResponse implements RawResponse
{
    private final List<String> events = new ArrayList<>();
    private final List<RawRequest.Field> headers = new ArrayList<>();
    private final AtomicInteger commits = new AtomicInteger();
    private volatile boolean committed;
    private int status = -1;
    private String reasonPhrase;
    private byte[] body;
    private IOException failure;
    
    /**
     * Schedules a failure for the call to {@code write}.
     * 
     * @param exc to throw
     * 
     * @return this for chaining/fluency
     */
    public RecordingRawResponse failWriteWith(IOException exc) {
        this.failure = exc;
        return this;
    }
    
    @Override
    public void status(int code, String reasonPhrase) {
        requireNonNull(reasonPhrase);
        requireNotCommitted();
        events.add("status");
        this.status = code;
        this.reasonPhrase = reasonPhrase;
    }
    
    @Override
    public void header(String name, String value) {
        var f = new RawRequest.Field(name, value);
        requireNotCommitted();
        events.add("header");
        headers.add(f);
    }
    
    @Override
    public void write(byte[] body) throws IOException {
        requireNonNull(body);
        commits.incrementAndGet();
        requireNotCommitted();
        committed = true;
        events.add("write");
        if (failure != null) {
            throw failure;
        }
        this.body = body.clone();
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
    
    /** {@return the number of times write was called} */
    public int commits() {
        return commits.get();
    }
    
    /** {@return the status code, or -1 if not set} */
    public int status() {
        return status;
    }
    
    /** {@return the reason phrase, or {@code null} if not set} */
    public String reasonPhrase() {
        return reasonPhrase;
    }
    
    /** {@return the headers, in the order written} */
    public List<RawRequest.Field> headers() {
        return headers;
    }
    
    /** {@return the body, or {@code null} if not written} */
    public byte[] body() {
        return body;
    }
    
    /** {@return the body decoded as UTF-8, or {@code null} if not written} */
    public String bodyAsText() {
        return body == null ? null : new String(body, UTF_8);
    }
    
    /** {@return the names of the methods called, in order} */
    public List<String> events() {
        return events;
    }
}
