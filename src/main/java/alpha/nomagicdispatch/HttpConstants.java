package alpha.nomagicdispatch;

import alpha.nomagicdispatch.message.HttpVersionParseException;

import java.util.Map;
import java.util.OptionalInt;

import static java.lang.Integer.parseInt;
import static java.util.Map.entry;
import static java.util.OptionalInt.empty;
import static java.util.OptionalInt.of;

/**
 * Namespace of HTTP constants.<p>
 * 
 * Only the constants the dispatch core and its adapters work with are
 * declared here. A handler is free to use any method token, status code or
 * header name, declared or not.
 * 
 * @see <a href="https://tools.ietf.org/html/rfc7230">RFC 7230</a>
 * @see <a href="https://tools.ietf.org/html/rfc7231">RFC 7231</a>
 */
public final class HttpConstants {
    private HttpConstants() {
        // Empty
    }
    
    /**
     * Method tokens of RFC 7231 and RFC 5789.<p>
     * 
     * Method tokens are case-sensitive.
     * 
     * @see <a href="https://tools.ietf.org/html/rfc7231#section-4">RFC 7231 §4</a>
     */
    public static final class Method {
        private Method() {
            // Empty
        }
        
        /** Transfer a current representation of the target resource. */
        public static final String GET = "GET";
        /** Same as GET, but do not transfer the response body. */
        public static final String HEAD = "HEAD";
        /** Perform resource-specific processing on the request payload. */
        public static final String POST = "POST";
        /** Replace all current representations of the target resource. */
        public static final String PUT = "PUT";
        /** Apply partial modifications to a resource. */
        public static final String PATCH = "PATCH";
        /** Remove all current representations of the target resource. */
        public static final String DELETE = "DELETE";
        /** Establish a tunnel to the server identified by the target. */
        public static final String CONNECT = "CONNECT";
        /** Describe the communication options for the target resource. */
        public static final String OPTIONS = "OPTIONS";
        /** Perform a message loop-back test. */
        public static final String TRACE = "TRACE";
    }
    
    /**
     * Status codes.
     * 
     * @see <a href="https://tools.ietf.org/html/rfc7231#section-6">RFC 7231 §6</a>
     */
    public static final class StatusCode {
        private StatusCode() {
            // Empty
        }
        
        /** {@value} {@value ReasonPhrase#CONTINUE}. */
        public static final int ONE_HUNDRED = 100;
        /** {@value} {@value ReasonPhrase#OK}. */
        public static final int TWO_HUNDRED = 200;
        /** {@value} {@value ReasonPhrase#CREATED}. */
        public static final int TWO_HUNDRED_ONE = 201;
        /** {@value} {@value ReasonPhrase#ACCEPTED}. */
        public static final int TWO_HUNDRED_TWO = 202;
        /** {@value} {@value ReasonPhrase#NO_CONTENT}. */
        public static final int TWO_HUNDRED_FOUR = 204;
        /** {@value} {@value ReasonPhrase#MOVED_PERMANENTLY}. */
        public static final int THREE_HUNDRED_ONE = 301;
        /** {@value} {@value ReasonPhrase#FOUND}. */
        public static final int THREE_HUNDRED_TWO = 302;
        /** {@value} {@value ReasonPhrase#NOT_MODIFIED}. */
        public static final int THREE_HUNDRED_FOUR = 304;
        /** {@value} {@value ReasonPhrase#BAD_REQUEST}. */
        public static final int FOUR_HUNDRED = 400;
        /** {@value} {@value ReasonPhrase#UNAUTHORIZED}. */
        public static final int FOUR_HUNDRED_ONE = 401;
        /** {@value} {@value ReasonPhrase#FORBIDDEN}. */
        public static final int FOUR_HUNDRED_THREE = 403;
        /** {@value} {@value ReasonPhrase#NOT_FOUND}. */
        public static final int FOUR_HUNDRED_FOUR = 404;
        /** {@value} {@value ReasonPhrase#METHOD_NOT_ALLOWED}. */
        public static final int FOUR_HUNDRED_FIVE = 405;
        /** {@value} {@value ReasonPhrase#IM_A_TEAPOT}. */
        public static final int FOUR_HUNDRED_EIGHTEEN = 418;
        /**
         * {@value} {@value ReasonPhrase#INTERNAL_SERVER_ERROR}.<p>
         * 
         * The status of the fallback response written by the server when a
         * request could not be adapted or the handler failed.
         */
        public static final int FIVE_HUNDRED = 500;
        /** {@value} {@value ReasonPhrase#NOT_IMPLEMENTED}. */
        public static final int FIVE_HUNDRED_ONE = 501;
        /** {@value} {@value ReasonPhrase#SERVICE_UNAVAILABLE}. */
        public static final int FIVE_HUNDRED_THREE = 503;
        
        /**
         * Returns {@code true} if the given code is 1XX (Informational).
         * 
         * @param code status code
         * @return see JavaDoc
         */
        public static boolean isInformational(int code) {
            return code >= 100 && code < 200;
        }
        
        /**
         * Returns {@code true} if the given code is 2XX (Successful).
         * 
         * @param code status code
         * @return see JavaDoc
         */
        public static boolean isSuccessful(int code) {
            return code >= 200 && code < 300;
        }
        
        /**
         * Returns {@code true} if the given code is 5XX (Server Error).
         * 
         * @param code status code
         * @return see JavaDoc
         */
        public static boolean isServerError(int code) {
            return code >= 500 && code < 600;
        }
    }
    
    /**
     * Reason phrases.
     */
    public static final class ReasonPhrase {
        private ReasonPhrase() {
            // Empty
        }
        
        /** Used when no phrase is known for a status code. */
        public static final String UNKNOWN = "Unknown";
        /** {@value}. */
        public static final String CONTINUE = "Continue";
        /** {@value}. */
        public static final String OK = "OK";
        /** {@value}. */
        public static final String CREATED = "Created";
        /** {@value}. */
        public static final String ACCEPTED = "Accepted";
        /** {@value}. */
        public static final String NO_CONTENT = "No Content";
        /** {@value}. */
        public static final String MOVED_PERMANENTLY = "Moved Permanently";
        /** {@value}. */
        public static final String FOUND = "Found";
        /** {@value}. */
        public static final String NOT_MODIFIED = "Not Modified";
        /** {@value}. */
        public static final String BAD_REQUEST = "Bad Request";
        /** {@value}. */
        public static final String UNAUTHORIZED = "Unauthorized";
        /** {@value}. */
        public static final String FORBIDDEN = "Forbidden";
        /** {@value}. */
        public static final String NOT_FOUND = "Not Found";
        /** {@value}. */
        public static final String METHOD_NOT_ALLOWED = "Method Not Allowed";
        /** {@value}. */
        public static final String IM_A_TEAPOT = "I'm a Teapot";
        /** {@value}. */
        public static final String INTERNAL_SERVER_ERROR = "Internal Server Error";
        /** {@value}. */
        public static final String NOT_IMPLEMENTED = "Not Implemented";
        /** {@value}. */
        public static final String SERVICE_UNAVAILABLE = "Service Unavailable";
        
        private static final Map<Integer, String> BY_CODE = Map.ofEntries(
                entry(StatusCode.ONE_HUNDRED, CONTINUE),
                entry(StatusCode.TWO_HUNDRED, OK),
                entry(StatusCode.TWO_HUNDRED_ONE, CREATED),
                entry(StatusCode.TWO_HUNDRED_TWO, ACCEPTED),
                entry(StatusCode.TWO_HUNDRED_FOUR, NO_CONTENT),
                entry(StatusCode.THREE_HUNDRED_ONE, MOVED_PERMANENTLY),
                entry(StatusCode.THREE_HUNDRED_TWO, FOUND),
                entry(StatusCode.THREE_HUNDRED_FOUR, NOT_MODIFIED),
                entry(StatusCode.FOUR_HUNDRED, BAD_REQUEST),
                entry(StatusCode.FOUR_HUNDRED_ONE, UNAUTHORIZED),
                entry(StatusCode.FOUR_HUNDRED_THREE, FORBIDDEN),
                entry(StatusCode.FOUR_HUNDRED_FOUR, NOT_FOUND),
                entry(StatusCode.FOUR_HUNDRED_FIVE, METHOD_NOT_ALLOWED),
                entry(StatusCode.FOUR_HUNDRED_EIGHTEEN, IM_A_TEAPOT),
                entry(StatusCode.FIVE_HUNDRED, INTERNAL_SERVER_ERROR),
                entry(StatusCode.FIVE_HUNDRED_ONE, NOT_IMPLEMENTED),
                entry(StatusCode.FIVE_HUNDRED_THREE, SERVICE_UNAVAILABLE));
        
        /**
         * Returns the reason phrase of a status code declared in
         * {@link StatusCode}, or {@link #UNKNOWN}.
         * 
         * @param statusCode to look up
         * @return a reason phrase (never {@code null})
         */
        public static String of(int statusCode) {
            return BY_CODE.getOrDefault(statusCode, UNKNOWN);
        }
    }
    
    /**
     * Header names used by the library.<p>
     * 
     * Header names are case-insensitive.
     */
    public static final class HeaderName {
        private HeaderName() {
            // Empty
        }
        
        /** {@value}. */
        public static final String CONNECTION = "Connection";
        /** {@value}. */
        public static final String CONTENT_LENGTH = "Content-Length";
        /** {@value}. */
        public static final String CONTENT_TYPE = "Content-Type";
        /**
         * {@value}.<p>
         * 
         * Used to build the absolute URI of an origin-form request-target.
         */
        public static final String HOST = "Host";
        /** {@value}. */
        public static final String LOCATION = "Location";
    }
    
    /**
     * HTTP protocol versions.
     */
    public enum Version
    {
        /**
         * HTTP/0.9<p>
         * 
         * Never standardized. Rejected by the request adapter unless the
         * configured minimum version says otherwise.
         */
        HTTP_0_9 (0, of(9)),
        
        /**
         * HTTP/1.0
         * 
         * @see <a href="https://tools.ietf.org/html/rfc1945">RFC 1945</a>
         */
        HTTP_1_0 (1, of(0)),
        
        /**
         * HTTP/1.1
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7230">RFC 7230</a>
         */
        HTTP_1_1 (1, of(1)),
        
        /**
         * HTTP/2
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7540">RFC 7540</a>
         */
        HTTP_2 (2, empty());
        
        /**
         * Parses a version.
         * 
         * @param str to parse, e.g. "HTTP/1.1"
         * 
         * @return a version
         * 
         * @throws NullPointerException if {@code str} is {@code null}
         * @throws HttpVersionParseException if parsing failed
         */
        public static Version parse(String str) throws HttpVersionParseException {
            int slash = str.indexOf('/');
            if (slash == -1) {
                throw new HttpVersionParseException(str, "No forward slash.");
            }
            if (!str.substring(0, slash).equals("HTTP")) {
                throw new HttpVersionParseException(str,
                        "HTTP-name \"" + str.substring(0, slash) + "\" is not \"HTTP\".");
            }
            int dot = str.indexOf('.', slash + 1);
            final String major, minor;
            if (dot == -1) {
                major = str.substring(slash + 1);
                minor = null;
            } else {
                major = str.substring(slash + 1, dot);
                minor = str.substring(dot + 1);
            }
            try {
                return valueOf(str, parseInt(major), minor);
            } catch (NumberFormatException e) {
                throw new HttpVersionParseException(str, e);
            }
        }
        
        private static Version valueOf(String str, int major, String minor)
                throws HttpVersionParseException {
            switch (major) {
                case 0:
                    if (parseMinor(str, minor) == 9) {
                        return HTTP_0_9;
                    }
                    break;
                case 1:
                    int m = parseMinor(str, minor);
                    if (m == 0) {
                        return HTTP_1_0;
                    }
                    if (m == 1) {
                        return HTTP_1_1;
                    }
                    break;
                case 2:
                    if (minor == null || minor.equals("0")) {
                        return HTTP_2;
                    }
                    break;
                default:
                    throw new HttpVersionParseException(str,
                            "Have no literal for major version \"" + major + "\".");
            }
            throw new HttpVersionParseException(str,
                    "Have no literal for minor version \"" + minor + "\".");
        }
        
        private static int parseMinor(String str, String minor)
                throws HttpVersionParseException {
            if (minor == null) {
                throw new HttpVersionParseException(str,
                        "No minor version provided when one was expected.");
            }
            return parseInt(minor);
        }
        
        private final int major;
        private final OptionalInt minor;
        
        Version(int major, OptionalInt minor) {
            this.major = major;
            this.minor = minor;
        }
        
        /**
         * Returns the major protocol version.
         * 
         * @return the major protocol version
         */
        public int major() {
            return major;
        }
        
        /**
         * Returns the minor protocol version.<p>
         * 
         * Since HTTP/2, the minor version has been dropped.
         * 
         * @return the minor protocol version
         */
        public OptionalInt minor() {
            return minor;
        }
        
        /**
         * Returns {@code true} if this version is older than the given one.
         * 
         * @param other version
         * @return see JavaDoc
         */
        public boolean isLessThan(Version other) {
            return compareTo(other) < 0;
        }
        
        /**
         * Returns the HTTP-version field value, e.g. "HTTP/1.1".
         * 
         * @return the HTTP-version field value
         */
        @Override
        public String toString() {
            return "HTTP/" + major() + (minor().isEmpty() ? "" : "." + minor().getAsInt());
        }
    }
}
