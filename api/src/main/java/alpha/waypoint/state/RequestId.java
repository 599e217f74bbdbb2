package alpha.waypoint.state;

import alpha.waypoint.message.Request;

import java.util.Optional;
import java.util.UUID;

import static alpha.waypoint.HttpConstants.HeaderName.X_REQUEST_ID;
import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Objects.requireNonNull;

/**
 * A request identifier, unique within the scope of the running process.<p>
 * 
 * The dispatcher puts one in the {@link RequestState} of each request before
 * any other stage runs. The id is either the value of a client-provided
 * {@code X-Request-ID} header, or a random UUID.
 * 
 * @param value the id
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public record RequestId(String value)
{
    private static final System.Logger LOG
            = System.getLogger(RequestId.class.getPackageName());
    
    /**
     * Constructs this object.
     * 
     * @param value the id
     * @throws NullPointerException if {@code value} is {@code null}
     */
    public RequestId {
        requireNonNull(value);
    }
    
    /**
     * Returns the id of the request.
     * 
     * @param state of request
     * @return the id of the request
     * @throws StateValueAbsentException if the request has no id
     */
    public static RequestId of(RequestState state) {
        return state.borrow(RequestId.class);
    }
    
    /**
     * Puts a request id in the given state, unless one is already present.
     * 
     * @param state of request
     * @param request the request
     * @param acceptHeader whether to use the {@code X-Request-ID} header
     * 
     * @return the request id
     */
    public static RequestId set(RequestState state, Request request, boolean acceptHeader) {
        var present = state.tryBorrow(RequestId.class);
        if (present.isPresent()) {
            return present.get();
        }
        Optional<String> header = acceptHeader ?
                request.header(X_REQUEST_ID).filter(v -> !v.isBlank()) :
                Optional.empty();
        final RequestId id = header.map(v -> new RequestId(v.strip()))
                .orElseGet(() -> new RequestId(UUID.randomUUID().toString()));
        LOG.log(DEBUG, () -> "[" + id + "] " + (header.isPresent() ?
                "Using client-provided request id." : "Generated request id."));
        state.put(RequestId.class, id);
        return id;
    }
    
    @Override
    public String toString() {
        return value;
    }
}
