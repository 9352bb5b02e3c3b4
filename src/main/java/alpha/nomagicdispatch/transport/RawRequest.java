package alpha.nomagicdispatch.transport;

import java.net.InetSocketAddress;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A request as received by a {@link Transport}, before any validation.<p>
 * 
 * String components are exactly what the transport observed; they may be
 * empty or malformed. The header fields keep the order in which the
 * transport reported them, and a repeated header is represented by
 * repeated fields.<p>
 * 
 * The body array is owned by the record; the transport must not reuse it.
 * Either address may be {@code null} if the transport does not know it.
 * 
 * @param method request method
 * @param target request target
 * @param httpVersion HTTP version field
 * @param headers header fields
 * @param body request body
 * @param remoteAddress address of the client
 * @param localAddress address the request was received on
 */
public record RawRequest(
        String method,
        String target,
        String httpVersion,
        List<Field> headers,
        byte[] body,
        InetSocketAddress remoteAddress,
        InetSocketAddress localAddress)
{
    /**
     * Constructs a {@code RawRequest}.
     * 
     * @throws NullPointerException
     *             if any argument, other than an address, is {@code null}
     */
    public RawRequest {
        requireNonNull(method, "method");
        requireNonNull(target, "target");
        requireNonNull(httpVersion, "httpVersion");
        headers = List.copyOf(headers);
        requireNonNull(body, "body");
    }
    
    /**
     * A raw header field.
     * 
     * @param name of header
     * @param value of header
     */
    public record Field(String name, String value) {
        /**
         * Constructs a {@code Field}.
         * 
         * @throws NullPointerException if any argument is {@code null}
         */
        public Field {
            requireNonNull(name, "name");
            requireNonNull(value, "value");
        }
    }
    
    @Override
    public String toString() {
        return RawRequest.class.getSimpleName() + "{" +
                "method='" + method + '\'' +
                ", target='" + target + '\'' +
                ", httpVersion='" + httpVersion + '\'' +
                ", headers=" + headers +
                ", body=" + body.length + " bytes" +
                ", remoteAddress=" + remoteAddress +
                ", localAddress=" + localAddress +
                '}';
    }
}
