package alpha.nomagicdispatch.internal;

import alpha.nomagicdispatch.Config;
import alpha.nomagicdispatch.HttpConstants.Version;
import alpha.nomagicdispatch.message.HeaderParseException;
import alpha.nomagicdispatch.message.HttpVersionTooOldException;
import alpha.nomagicdispatch.message.MaxRequestBodyBufferSizeException;
import alpha.nomagicdispatch.message.RequestLineParseException;
import alpha.nomagicdispatch.message.RequestTargetUnsupportedException;
import alpha.nomagicdispatch.testutil.RawRequests;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.InetSocketAddress;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link RequestAdapter}.
 */
class RequestAdapterTest
{
    private static final InetSocketAddress BIND = new InetSocketAddress("0.0.0.0", 9999);
    
    private final RequestAdapter testee = new RequestAdapter(Config.DEFAULT, BIND);
    
    @Test
    void origin_form_resolved_against_host_header() throws Exception {
        var req = testee.fromRaw(RawRequests.builder()
                .noHeaders()
                .header("Host", "example.com:81")
                .target("/p?q")
                .build());
        assertThat(req.target().uri()).hasToString("http://example.com:81/p?q");
        assertThat(req.target().raw()).isEqualTo("/p?q");
    }
    
    @ParameterizedTest
    @ValueSource(strings = {
        "example.com?", "example.com/admin", "example.com#",
        "user@example.com/admin", "user@example.com", "exa mple.com"})
    void host_must_be_an_authority(String host) {
        var raw = RawRequests.builder()
                .noHeaders()
                .header("Host", host)
                .target("/secret")
                .build();
        assertThatThrownBy(() -> testee.fromRaw(raw))
                .isExactlyInstanceOf(HeaderParseException.class)
                .hasMessage("Host is not an authority: \"" + host + "\".")
                .extracting("name").isEqualTo("Host");
    }
    
    @Test
    void host_with_ipv6_literal_and_port() throws Exception {
        var req = testee.fromRaw(RawRequests.builder()
                .noHeaders()
                .header("Host", "[::1]:8080")
                .target("/secret?q")
                .build());
        assertThat(req.target().uri()).hasToString("http://[::1]:8080/secret?q");
        assertThat(req.target().path()).isEqualTo("/secret");
        assertThat(req.target().query()).contains("q");
    }
    
    @Test
    void origin_form_without_host_uses_local_address() throws Exception {
        var req = testee.fromRaw(RawRequests.builder().noHeaders().target("/p").build());
        assertThat(req.target().uri()).hasToString("http://127.0.0.1:8080/p");
    }
    
    @Test
    void origin_form_without_host_nor_local_uses_bind_address() throws Exception {
        var req = testee.fromRaw(RawRequests.builder()
                .noHeaders().local(null).target("/").build());
        assertThat(req.target().uri()).hasToString("http://0.0.0.0:9999/");
    }
    
    @Test
    void ipv6_local_address_is_bracketed() throws Exception {
        var req = testee.fromRaw(RawRequests.builder()
                .noHeaders()
                .local(new InetSocketAddress("::1", 80))
                .target("/")
                .build());
        assertThat(req.target().uri().getHost()).isEqualTo("[0:0:0:0:0:0:0:1]");
        assertThat(req.target().uri().getPort()).isEqualTo(80);
    }
    
    @ParameterizedTest
    @ValueSource(strings = {"http://other.com/x?y", "HTTPS://other.com/x?y"})
    void absolute_form_used_as_is(String target) throws Exception {
        var req = testee.fromRaw(RawRequests.get(target));
        assertThat(req.target().uri().getHost()).isEqualTo("other.com");
        assertThat(req.target().path()).isEqualTo("/x");
        assertThat(req.target().query()).contains("y");
    }
    
    @Test
    void path_defaults_to_slash() throws Exception {
        var req = testee.fromRaw(RawRequests.get("http://other.com"));
        assertThat(req.target().path()).isEqualTo("/");
        assertThat(req.target().query()).isEmpty();
    }
    
    @Test
    void asterisk_form_unsupported() {
        assertThatThrownBy(() -> testee.fromRaw(RawRequests.get("*")))
                .isExactlyInstanceOf(RequestTargetUnsupportedException.class)
                .hasMessage("Asterisk-form is not supported.")
                .extracting("requestTarget").isEqualTo("*");
    }
    
    @Test
    void authority_form_unsupported() {
        assertThatThrownBy(() -> testee.fromRaw(RawRequests.get("example.com:443")))
                .isExactlyInstanceOf(RequestTargetUnsupportedException.class)
                .hasMessage("Authority-form is not supported.");
    }
    
    @Test
    void absolute_form_without_host() {
        assertThatThrownBy(() -> testee.fromRaw(RawRequests.get("http:///x")))
                .isExactlyInstanceOf(RequestLineParseException.class);
    }
    
    @Test
    void empty_target() {
        assertThatThrownBy(() -> testee.fromRaw(RawRequests.get("")))
                .isExactlyInstanceOf(RequestLineParseException.class)
                .hasMessage("Empty request-target.");
    }
    
    @Test
    void method_is_case_sensitive_token() throws Exception {
        assertThat(testee.fromRaw(RawRequests.builder().method("get").build()).method())
                .isEqualTo("get");
        assertThatThrownBy(() -> testee.fromRaw(RawRequests.builder().method("GE T").build()))
                .isExactlyInstanceOf(RequestLineParseException.class)
                .hasMessage("Method is not a token: \"GE T\".");
    }
    
    @Test
    void version_parsed() throws Exception {
        assertThat(testee.fromRaw(RawRequests.builder().version("HTTP/1.0").build()).httpVersion())
                .isSameAs(Version.HTTP_1_0);
    }
    
    @Test
    void version_too_old_is_configurable() throws Exception {
        var strict = new RequestAdapter(
                Config.configuration().minHttpVersion(Version.HTTP_1_1).build(), BIND);
        assertThatThrownBy(() -> strict.fromRaw(RawRequests.builder().version("HTTP/1.0").build()))
                .isExactlyInstanceOf(HttpVersionTooOldException.class)
                .hasMessage("HTTP/1.0 is older than HTTP/1.1.");
        var lenient = new RequestAdapter(
                Config.configuration().minHttpVersion(Version.HTTP_0_9).build(), BIND);
        assertThat(lenient.fromRaw(RawRequests.builder().version("HTTP/0.9").build()).httpVersion())
                .isSameAs(Version.HTTP_0_9);
    }
    
    @ParameterizedTest
    @ValueSource(strings = {"", "Bad:Name", "Bad Name", "Bäd"})
    void header_name_not_token(String name) {
        assertThatThrownBy(() -> testee.fromRaw(RawRequests.builder().header(name, "v").build()))
                .isExactlyInstanceOf(HeaderParseException.class)
                .hasMessage("Header name is not a token.")
                .extracting("name").isEqualTo(name);
    }
    
    @ParameterizedTest
    @ValueSource(strings = {"a\rb", "a\nb", "a\0b"})
    void header_value_with_control_break(String value) {
        assertThatThrownBy(() -> testee.fromRaw(RawRequests.builder().header("X", value).build()))
                .isExactlyInstanceOf(HeaderParseException.class)
                .hasMessage("Header value contains CR, LF or NUL.");
    }
    
    @ParameterizedTest
    @ValueSource(strings = {" v", "v ", "\tv"})
    void header_value_with_surrounding_whitespace(String value) {
        assertThatThrownBy(() -> testee.fromRaw(RawRequests.builder().header("X", value).build()))
                .isExactlyInstanceOf(HeaderParseException.class)
                .hasMessage("Header value has surrounding whitespace.");
    }
    
    @Test
    void empty_header_value_is_ok() throws Exception {
        var req = testee.fromRaw(RawRequests.builder().header("X-Empty", "").build());
        assertThat(req.headers().firstValue("x-empty")).contains("");
    }
    
    @Test
    void body_at_max_is_ok() throws Exception {
        var t = new RequestAdapter(Config.configuration().maxRequestBodyBufferSize(3).build(), BIND);
        var req = t.fromRaw(RawRequests.builder().body("abc").build());
        assertThat(req.body().length()).isEqualTo(3);
        assertThat(req.body().bytes()).isEqualTo("abc".getBytes(UTF_8));
        assertThat(req.body().isEmpty()).isFalse();
    }
    
    @Test
    void body_exceeding_max() {
        var t = new RequestAdapter(Config.configuration().maxRequestBodyBufferSize(3).build(), BIND);
        assertThatThrownBy(() -> t.fromRaw(RawRequests.builder()
                    .header("Content-Length", "1000")
                    .body("abcd")
                    .build()))
                .isExactlyInstanceOf(MaxRequestBodyBufferSizeException.class)
                .hasMessage("Body of 1000 bytes exceeds the max of 3 bytes.");
    }
    
    @Test
    void toString_renders_request_line_and_client() throws Exception {
        var req = testee.fromRaw(RawRequests.builder().target("/x").body("12").build());
        assertThat(req).hasToString(
                "Request{method=GET, uri=http://example.com/x, version=HTTP/1.1, " +
                "remoteAddress=" + RawRequests.CLIENT + ", body=2 bytes}");
    }
    
    @Test
    void body_text_defaults_to_utf8() throws Exception {
        var req = testee.fromRaw(RawRequests.builder()
                .header("Content-Type", "text/plain")
                .body("hé")
                .build());
        assertThat(req.body().toText()).isEqualTo("hé");
    }
    
    @Test
    void body_text_quoted_charset() throws Exception {
        var req = testee.fromRaw(RawRequests.builder()
                .header("Content-Type", "text/plain; Charset=\"UTF-16BE\"")
                .body(new byte[]{0, 'h', 0, 'i'})
                .build());
        assertThat(req.body().toText()).isEqualTo("hi");
    }
}
