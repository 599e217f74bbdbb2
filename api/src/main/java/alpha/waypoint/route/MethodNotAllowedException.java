package alpha.waypoint.route;

import alpha.waypoint.handler.HasResponse;
import alpha.waypoint.message.Response;
import alpha.waypoint.message.Responses;

import java.io.Serial;
import java.util.Set;
import java.util.TreeSet;

import static alpha.waypoint.message.Responses.methodNotAllowed;
import static java.util.Collections.unmodifiableSet;

/**
 * Thrown by the dispatcher if routes matched the path of the request, but none
 * accepts the method.<p>
 * 
 * The {@linkplain alpha.waypoint.handler.ExceptionHandler#BASE base exception
 * handler} adds the {@code Allow} header to the response.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class MethodNotAllowedException extends RuntimeException implements HasResponse
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    private final String method;
    private final transient Set<String> allowed;
    
    /**
     * Constructs this object.
     * 
     * @param method of request
     * @param allowed methods of the path
     */
    public MethodNotAllowedException(String method, Set<String> allowed) {
        super("No route found for method token \"" + method + "\".");
        this.method = method;
        this.allowed = unmodifiableSet(new TreeSet<>(allowed));
    }
    
    /**
     * Returns the method of the request.
     * 
     * @return the method of the request
     */
    public String method() {
        return method;
    }
    
    /**
     * Returns the methods accepted by the routes of the path.<p>
     * 
     * The set iterates in a stable, sorted order.
     * 
     * @return the methods accepted by the routes of the path
     */
    public Set<String> allowedMethods() {
        return allowed;
    }
    
    /**
     * Returns {@link Responses#methodNotAllowed()}.
     * 
     * @return see Javadoc
     */
    @Override
    public Response getResponse() {
        return methodNotAllowed();
    }
}
