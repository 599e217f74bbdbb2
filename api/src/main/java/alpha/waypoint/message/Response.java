package alpha.waypoint.message;

import java.io.IOException;
import java.io.OutputStream;
import java.net.http.HttpHeaders;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * An HTTP response.<p>
 * 
 * Is built by a {@link Builder}, which is immutable, and a builder
 * representing the state of any response instance can be retrieved using
 * {@link #toBuilder()}. So, deriving a new response is cheap and does not
 * affect the original:
 * 
 * <pre>{@code
 *   Response notFound = Responses.notFound().toBuilder()
 *           .setHeader("Cache-Control", "no-store")
 *           .build();
 * }</pre>
 * 
 * The implementation is immutable and thread-safe.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * 
 * @see Responses
 */
public interface Response
{
    /**
     * Returns a builder with the given status code set.
     * 
     * @param statusCode of response
     * @return a builder
     * @throws IllegalArgumentException
     *             if {@code statusCode} is not a three-digit number
     */
    static Builder builder(int statusCode) {
        return DefaultResponse.DefaultBuilder.ROOT.statusCode(statusCode);
    }
    
    /**
     * Returns the status code.
     * 
     * @return the status code
     */
    int statusCode();
    
    /**
     * Returns the reason phrase.
     * 
     * @return the reason phrase (never {@code null})
     */
    String reasonPhrase();
    
    /**
     * Returns the response headers.
     * 
     * @return the response headers (never {@code null})
     */
    HttpHeaders headers();
    
    /**
     * Returns the first value of the given header.
     * 
     * @param name of header (case-insensitive)
     * @return the first value, if present
     * @throws NullPointerException if {@code name} is {@code null}
     */
    default Optional<String> header(String name) {
        return headers().firstValue(name);
    }
    
    /**
     * Returns the response body.
     * 
     * @return the response body (never {@code null})
     */
    Body body();
    
    /**
     * Returns a builder pre-populated with the state of this response.
     * 
     * @return a builder
     */
    Builder toBuilder();
    
    /**
     * A producer of the response body.<p>
     * 
     * Writing the body to a transport is the caller's business.
     */
    interface Body {
        /**
         * Returns an empty body.
         * 
         * @return an empty body
         */
        static Body empty() {
            return DefaultResponse.EMPTY_BODY;
        }
        
        /**
         * Returns a body of the UTF-8 encoded string.
         * 
         * @param str body
         * @return a body
         * @throws NullPointerException if {@code str} is {@code null}
         */
        static Body ofString(String str) {
            return ofBytes(str.getBytes(UTF_8));
        }
        
        /**
         * Returns a body of the given bytes.<p>
         * 
         * The array is not copied.
         * 
         * @param bytes of body
         * @return a body
         * @throws NullPointerException if {@code bytes} is {@code null}
         */
        static Body ofBytes(byte[] bytes) {
            requireNonNull(bytes);
            return new Body() {
                @Override
                public long length() {
                    return bytes.length;
                }
                @Override
                public void writeTo(OutputStream out) throws IOException {
                    out.write(bytes);
                }
            };
        }
        
        /**
         * Returns the number of bytes.
         * 
         * @return the number of bytes, or -1 if unknown
         */
        long length();
        
        /**
         * Writes the body.
         * 
         * @param out destination
         * @throws IOException if an I/O error occurs
         */
        void writeTo(OutputStream out) throws IOException;
        
        /**
         * Returns whether the body is known to be empty.
         * 
         * @return see JavaDoc
         */
        default boolean isEmpty() {
            return length() == 0;
        }
    }
    
    /**
     * Builder of a {@link Response}.<p>
     * 
     * The builder is immutable. All setter methods return a new builder
     * instance representing the new state.<p>
     * 
     * The implementation is thread-safe.
     */
    interface Builder {
        /**
         * Sets the status code.
         * 
         * @param statusCode of response
         * @return a new builder representing the new state
         * @throws IllegalArgumentException
         *             if {@code statusCode} is not a three-digit number
         */
        Builder statusCode(int statusCode);
        
        /**
         * Sets the reason phrase.<p>
         * 
         * If never set, the phrase is derived from the status code.
         * 
         * @param reasonPhrase of response
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code reasonPhrase} is {@code null}
         */
        Builder reasonPhrase(String reasonPhrase);
        
        /**
         * Sets a header, replacing all present values.
         * 
         * @param name of header
         * @param value of header
         * @return a new builder representing the new state
         * @throws NullPointerException if any argument is {@code null}
         */
        Builder setHeader(String name, String value);
        
        /**
         * Adds a header value.
         * 
         * @param name of header
         * @param value of header
         * @return a new builder representing the new state
         * @throws NullPointerException if any argument is {@code null}
         */
        Builder addHeader(String name, String value);
        
        /**
         * Removes all values of a header.
         * 
         * @param name of header
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code name} is {@code null}
         */
        Builder removeHeader(String name);
        
        /**
         * Sets the body.
         * 
         * @param body of response
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code body} is {@code null}
         */
        Builder body(Body body);
        
        /**
         * Builds the response.
         * 
         * @return a response
         * @throws IllegalStateException if the status code has not been set
         */
        Response build();
    }
}
