package alpha.waypoint.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.util.List;

import static java.nio.charset.CodingErrorAction.REPORT;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Percent-decoding of path segments and query string tokens.<p>
 * 
 * A run of consecutive escapes is decoded as one UTF-8 byte sequence. The
 * plus character has no special meaning; it is kept as a literal plus (this
 * is RFC 3986, not the {@code application/x-www-form-urlencoded} format).
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class PercentDecoder
{
    private PercentDecoder() {
        // Empty
    }
    
    /**
     * Percent-decode the given string.<p>
     * 
     * If the string contains no escape, the same instance is returned.
     * 
     * @param str string to decode
     * @return a decoded string
     * @throws NullPointerException
     *             if {@code str} is {@code null}
     * @throws IllegalArgumentException
     *             if an escape is truncated, is not hexadecimal, or the
     *             decoded bytes are not valid UTF-8
     */
    public static String decode(String str) {
        int pos = str.indexOf('%');
        if (pos == -1) {
            return str;
        }
        var out = new StringBuilder(str.length()).append(str, 0, pos);
        var bytes = ByteBuffer.allocate(str.length() / 3);
        while (pos < str.length()) {
            char c = str.charAt(pos);
            if (c != '%') {
                out.append(c);
                ++pos;
                continue;
            }
            bytes.clear();
            while (pos < str.length() && str.charAt(pos) == '%') {
                bytes.put(escaped(str, pos));
                pos += 3;
            }
            out.append(utf8(bytes.flip(), str));
        }
        return out.toString();
    }
    
    /**
     * Percent-decode all given strings.
     * 
     * @param strings to decode
     * @return an unmodifiable list of decoded strings
     * @throws NullPointerException
     *             if {@code strings} or any element thereof is {@code null}
     * @throws IllegalArgumentException
     *             if a string can not be decoded
     */
    public static List<String> decode(List<String> strings) {
        return strings.stream().map(PercentDecoder::decode).toList();
    }
    
    private static byte escaped(String str, int pos) {
        if (pos + 2 >= str.length()) {
            throw new IllegalArgumentException(
                    "Truncated escape at index " + pos + " in: " + str);
        }
        int hi = Character.digit(str.charAt(pos + 1), 16),
            lo = Character.digit(str.charAt(pos + 2), 16);
        if (hi == -1 || lo == -1) {
            throw new IllegalArgumentException(
                    "Illegal hex characters at index " + pos + " in: " + str);
        }
        return (byte) (hi << 4 | lo);
    }
    
    private static CharSequence utf8(ByteBuffer bytes, String str) {
        CharsetDecoder dec = UTF_8.newDecoder()
                .onMalformedInput(REPORT)
                .onUnmappableCharacter(REPORT);
        try {
            return dec.decode(bytes);
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("Not UTF-8: " + str, e);
        }
    }
}
