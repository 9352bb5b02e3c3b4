package alpha.nomagicdispatch.message;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

/**
 * Small tests of {@link Responses}.
 */
class ResponsesTest
{
    @Test
    void internalServerError() {
        Response r = Responses.internalServerError();
        assertThat(r.statusCode()).isEqualTo(500);
        assertThat(r.reasonPhrase()).isEqualTo("Internal Server Error");
        assertThat(r.headers()).containsExactly(
                entry("Content-Type", List.of("text/plain; charset=utf-8")));
        assertThat(text(r.body())).isEqualTo("Internal Server Error");
        assertThat(Responses.internalServerError()).isSameAs(r);
    }
    
    @Test
    void cached() {
        assertThat(Responses.ok()).isSameAs(Responses.ok());
        assertThat(Responses.status(200)).isSameAs(Responses.ok());
        assertThat(Responses.status(204)).isSameAs(Responses.noContent());
        assertThat(Responses.status(400)).isSameAs(Responses.badRequest());
        assertThat(Responses.status(404)).isSameAs(Responses.notFound());
    }
    
    @Test
    void status_with_phrase() {
        Response r = Responses.status(599, "Custom");
        assertThat(r.statusCode()).isEqualTo(599);
        assertThat(r.reasonPhrase()).isEqualTo("Custom");
    }
    
    @Test
    void text() {
        Response r = Responses.text("Hej på dig");
        assertThat(r.statusCode()).isEqualTo(200);
        assertThat(r.headers()).containsExactly(
                entry("Content-Type", List.of("text/plain; charset=utf-8")));
        assertThat(text(r.body())).isEqualTo("Hej på dig");
    }
    
    @Test
    void ok_with_content_type() {
        Response r = Responses.ok("application/json", "{}".getBytes(UTF_8));
        assertThat(r.headers().get("Content-Type")).containsExactly("application/json");
        assertThat(text(r.body())).isEqualTo("{}");
        // Cached template not affected
        assertThat(Responses.ok().headers()).isEmpty();
    }
    
    private static String text(ByteBuffer buf) {
        return UTF_8.decode(buf).toString();
    }
}
