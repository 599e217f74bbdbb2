package alpha.waypoint.message;

import alpha.waypoint.HttpConstants.ReasonPhrase;
import alpha.waypoint.util.AbstractImmutableBuilder;

import java.io.OutputStream;
import java.net.http.HttpHeaders;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;

import static java.lang.String.CASE_INSENSITIVE_ORDER;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Response}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultResponse implements Response
{
    static final Body EMPTY_BODY = new Body() {
        @Override
        public long length() {
            return 0;
        }
        @Override
        public void writeTo(OutputStream out) {
            // Empty
        }
    };
    
    private final int statusCode;
    private final String reasonPhrase;
    private final HttpHeaders headers;
    private final Body body;
    private final DefaultBuilder origin;
    
    private DefaultResponse(DefaultBuilder origin, DefaultBuilder.MutableState s) {
        this.statusCode   = s.statusCode;
        this.reasonPhrase = s.reasonPhrase != null ?
                            s.reasonPhrase : ReasonPhrase.of(s.statusCode);
        this.headers      = HttpHeaders.of(s.headers, (name, value) -> true);
        this.body         = s.body;
        this.origin       = origin;
    }
    
    @Override
    public int statusCode() {
        return statusCode;
    }
    
    @Override
    public String reasonPhrase() {
        return reasonPhrase;
    }
    
    @Override
    public HttpHeaders headers() {
        return headers;
    }
    
    @Override
    public Body body() {
        return body;
    }
    
    @Override
    public Builder toBuilder() {
        return origin;
    }
    
    @Override
    public String toString() {
        return DefaultResponse.class.getSimpleName() + "{" +
                "statusCode=" + statusCode +
                ", reasonPhrase=\"" + reasonPhrase + '"' +
                ", headers=" + headers.map() + '}';
    }
    
    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Response.Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();
        
        static final class MutableState {
            int statusCode = -1;
            String reasonPhrase;
            final Map<String, List<String>> headers
                    = new TreeMap<>(CASE_INSENSITIVE_ORDER);
            Body body = Body.empty();
        }
        
        private DefaultBuilder() {
            // super()
        }
        
        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }
        
        @Override
        public Builder statusCode(int statusCode) {
            if (statusCode < 100 || statusCode > 999) {
                throw new IllegalArgumentException(
                        "Not a three-digit status code: " + statusCode);
            }
            return new DefaultBuilder(this, s -> s.statusCode = statusCode);
        }
        
        @Override
        public Builder reasonPhrase(String reasonPhrase) {
            requireNonNull(reasonPhrase);
            return new DefaultBuilder(this, s -> s.reasonPhrase = reasonPhrase);
        }
        
        @Override
        public Builder setHeader(String name, String value) {
            requireNonNull(name);
            requireNonNull(value);
            return new DefaultBuilder(this, s -> {
                List<String> v = new ArrayList<>();
                v.add(value);
                s.headers.put(name, v);
            });
        }
        
        @Override
        public Builder addHeader(String name, String value) {
            requireNonNull(name);
            requireNonNull(value);
            return new DefaultBuilder(this, s ->
                    s.headers.computeIfAbsent(name, k -> new ArrayList<>())
                             .add(value));
        }
        
        @Override
        public Builder removeHeader(String name) {
            requireNonNull(name);
            return new DefaultBuilder(this, s -> s.headers.remove(name));
        }
        
        @Override
        public Builder body(Body body) {
            requireNonNull(body);
            return new DefaultBuilder(this, s -> s.body = body);
        }
        
        @Override
        public Response build() {
            var s = constructState(MutableState::new);
            if (s.statusCode == -1) {
                throw new IllegalStateException("Status code not set.");
            }
            return new DefaultResponse(this, s);
        }
    }
}
