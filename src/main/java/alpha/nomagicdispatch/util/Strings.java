package alpha.nomagicdispatch.util;

import java.util.Objects;

/**
 * String utilities.
 */
public final class Strings
{
    private Strings() {
        // Empty
    }
    
    /**
     * Returns {@code true} if the given string is an RFC 7230 token.<p>
     * 
     * A token is one or more visible US-ASCII characters, excluding
     * delimiters (
     * <a href="https://tools.ietf.org/html/rfc7230#section-3.2.6">RFC 7230 §3.2.6</a>
     * ). Method names and header field names are tokens.
     * 
     * @param str to test
     * 
     * @return see JavaDoc
     * 
     * @throws NullPointerException if {@code str} is {@code null}
     */
    public static boolean isToken(String str) {
        if (str.isEmpty()) {
            return false;
        }
        for (int i = 0; i < str.length(); ++i) {
            if (!isTokenChar(str.charAt(i))) {
                return false;
            }
        }
        return true;
    }
    
    private static boolean isTokenChar(char c) {
        if (c <= ' ' || c >= 127) {
            return false;
        }
        return "\"(),/:;<=>?@[\\]{}".indexOf(c) == -1;
    }
    
    /**
     * Returns {@code true} if the given string contains a carriage return,
     * line feed or NUL character.
     * 
     * @param str to test
     * 
     * @return see JavaDoc
     * 
     * @throws NullPointerException if {@code str} is {@code null}
     */
    public static boolean containsControlBreak(String str) {
        for (int i = 0; i < str.length(); ++i) {
            char c = str.charAt(i);
            if (c == '\r' || c == '\n' || c == '\0') {
                return true;
            }
        }
        return false;
    }
    
    /**
     * Requires the given string to not have leading or trailing whitespace.
     * 
     * @param str to check
     * 
     * @return the given string
     * 
     * @throws NullPointerException
     *             if {@code str} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code str} has leading or trailing whitespace
     */
    public static String requireNoSurroundingWS(String str) {
        requireNoEffect(str, str.stripLeading(), "Leading");
        requireNoEffect(str, str.stripTrailing(), "Trailing");
        return str;
    }
    
    private static void requireNoEffect(String org, String res, String prefix) {
        // String.strip() returns the same reference on NOP
        if (!Objects.equals(org, res)) {
            throw new IllegalArgumentException(
                    prefix + " whitespace in \"" + org + "\".");
        }
    }
}
