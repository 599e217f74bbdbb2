package alpha.waypoint.message;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpHeaders;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static java.lang.String.CASE_INSENSITIVE_ORDER;
import static java.util.Objects.requireNonNull;

/**
 * An inbound HTTP request, as parsed by the caller.<p>
 * 
 * The request-target is expected to be in origin-form, i.e. a path
 * optionally followed by a query. A fragment, if present, is dropped. The
 * path and the query are kept raw; the router decodes path segments and
 * {@link QueryParameters#parse(String)} decodes the query.<p>
 * 
 * Instances are immutable and thread-safe, but the body can only be consumed
 * as many times as the body implementation allows.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Request
{
    /**
     * Equivalent to {@code Request.builder(method, target).build()}.
     * 
     * @param method of request
     * @param target raw request-target
     * 
     * @return a request without headers and body
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static Request of(String method, String target) {
        return builder(method, target).build();
    }
    
    /**
     * Returns a new builder.
     * 
     * @param method of request
     * @param target raw request-target
     * 
     * @return a new builder
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static Builder builder(String method, String target) {
        return new Builder(method, target);
    }
    
    private final String method, target, path, query;
    private final HttpHeaders headers;
    private final Body body;
    
    private Request(Builder b) {
        method  = b.method;
        target  = b.target;
        headers = HttpHeaders.of(b.headers, (name, value) -> true);
        body    = b.body;
        
        String t = target;
        int hash = t.indexOf('#');
        if (hash != -1) {
            t = t.substring(0, hash);
        }
        int q = t.indexOf('?');
        String p = q == -1 ? t : t.substring(0, q);
        path  = p.isEmpty() ? "/" : p;
        query = q == -1 ? "" : t.substring(q + 1);
    }
    
    /**
     * Returns the request method token, e.g. "GET".
     * 
     * @return the request method token (never {@code null})
     */
    public String method() {
        return method;
    }
    
    /**
     * Returns the raw request-target, as given to the builder.
     * 
     * @return the raw request-target (never {@code null})
     */
    public String target() {
        return target;
    }
    
    /**
     * Returns the raw path of the request-target.<p>
     * 
     * The path is never empty; an empty path is "/".
     * 
     * @return the raw path (never {@code null})
     */
    public String path() {
        return path;
    }
    
    /**
     * Returns the raw query of the request-target, without the leading '?'.
     * 
     * @return the raw query (never {@code null}, may be empty)
     */
    public String rawQuery() {
        return query;
    }
    
    /**
     * Returns the request headers.
     * 
     * @return the request headers (never {@code null})
     */
    public HttpHeaders headers() {
        return headers;
    }
    
    /**
     * Returns the first value of the given header.
     * 
     * @param name of header (case-insensitive)
     * 
     * @return the first value, if present
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public Optional<String> header(String name) {
        return headers.firstValue(name);
    }
    
    /**
     * Returns the request body.
     * 
     * @return the request body (never {@code null})
     */
    public Body body() {
        return body;
    }
    
    @Override
    public String toString() {
        return "Request{" + method + ' ' + target + '}';
    }
    
    /**
     * A request body.<p>
     * 
     * Decoding the body into something meaningful is the application's
     * business.
     */
    @FunctionalInterface
    public interface Body {
        /**
         * Returns an empty body.
         * 
         * @return an empty body
         */
        static Body empty() {
            return InputStream::nullInputStream;
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
        static Body of(byte[] bytes) {
            requireNonNull(bytes);
            return () -> new ByteArrayInputStream(bytes);
        }
        
        /**
         * Opens a stream of the body bytes.
         * 
         * @return a stream of the body bytes
         * @throws IOException if an I/O error occurs
         */
        InputStream open() throws IOException;
    }
    
    /**
     * Builder of a {@link Request}.<p>
     * 
     * The builder is not thread-safe.
     */
    public static final class Builder
    {
        private final String method, target;
        private final Map<String, List<String>> headers;
        private Body body;
        
        private Builder(String method, String target) {
            this.method  = requireNonNull(method);
            this.target  = requireNonNull(target);
            this.headers = new TreeMap<>(CASE_INSENSITIVE_ORDER);
            this.body    = Body.empty();
        }
        
        /**
         * Adds a header value.
         * 
         * @param name of header
         * @param value of header
         * @return this for chaining/fluency
         * @throws NullPointerException if any argument is {@code null}
         */
        public Builder header(String name, String value) {
            requireNonNull(value);
            headers.computeIfAbsent(requireNonNull(name), k -> new ArrayList<>())
                   .add(value);
            return this;
        }
        
        /**
         * Sets the body.
         * 
         * @param body of request
         * @return this for chaining/fluency
         * @throws NullPointerException if {@code body} is {@code null}
         */
        public Builder body(Body body) {
            this.body = requireNonNull(body);
            return this;
        }
        
        /**
         * Builds the request.
         * 
         * @return a request
         */
        public Request build() {
            return new Request(this);
        }
    }
}
