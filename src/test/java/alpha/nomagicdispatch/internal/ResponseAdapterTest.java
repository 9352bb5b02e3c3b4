package alpha.nomagicdispatch.internal;

import alpha.nomagicdispatch.message.Response;
import alpha.nomagicdispatch.testutil.RecordingRawResponse;
import alpha.nomagicdispatch.transport.RawResponse;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static java.lang.System.Logger.Level.ERROR;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Small tests of {@link ResponseAdapter}.
 */
class ResponseAdapterTest
{
    private final System.Logger log = mock(System.Logger.class);
    private final ResponseAdapter testee = new ResponseAdapter(log);
    
    @Test
    void writes_status_headers_body_in_order() throws IOException {
        var r = Response.builder(418)
                .header("B", "1")
                .header("A", "2")
                .addHeader("B", "3")
                .body("tea".getBytes(UTF_8))
                .build();
        var sink = mock(RawResponse.class);
        assertThat(testee.writeBack(r, sink)).isTrue();
        var order = inOrder(sink);
        order.verify(sink).status(418, "I'm a Teapot");
        order.verify(sink).header("B", "1");
        order.verify(sink).header("B", "3");
        order.verify(sink).header("A", "2");
        order.verify(sink).write("tea".getBytes(UTF_8));
        order.verifyNoMoreInteractions();
        verifyNoInteractions(log);
    }
    
    @Test
    void adds_nothing() {
        var sink = new RecordingRawResponse();
        testee.writeBack(Response.builder(200).build(), sink);
        assertThat(sink.headers()).isEmpty();
        assertThat(sink.body()).isEmpty();
        assertThat(sink.commits()).isOne();
    }
    
    @Test
    void header_casing_preserved() {
        var sink = new RecordingRawResponse();
        testee.writeBack(Response.builder(200).header("x-CuStOm", "v").build(), sink);
        assertThat(sink.headers()).extracting("name", "value")
                .containsExactly(tuple("x-CuStOm", "v"));
    }
    
    @Test
    void io_failure_logged() {
        var exc = new IOException("Broken pipe");
        var sink = new RecordingRawResponse().failWriteWith(exc);
        assertThat(testee.writeBack(Response.builder(200).build(), sink)).isFalse();
        assertThat(sink.commits()).isOne();
        verify(log).log(ERROR, "Error writing response.", exc);
    }
    
    @Test
    void unchecked_failure_logged_and_body_not_written() throws IOException {
        var sink = mock(RawResponse.class);
        var exc = new IllegalArgumentException("Illegal header");
        doThrow(exc).when(sink).header(anyString(), anyString());
        assertThat(testee.writeBack(
                Response.builder(200).header("X", "y").build(), sink)).isFalse();
        verify(sink).status(anyInt(), anyString());
        verify(sink, never()).write(any());
        verify(log).log(ERROR, "Error writing response.", exc);
    }
}
