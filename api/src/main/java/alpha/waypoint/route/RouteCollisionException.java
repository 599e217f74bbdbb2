package alpha.waypoint.route;

import java.io.Serial;

import static java.text.MessageFormat.format;

/**
 * Thrown by {@link RouterBuilder} when a route is registered on the same
 * position in the route tree as an already registered route, and the two
 * accept a common method.<p>
 * 
 * Parameter names are not part of the position; "/user/:id" and
 * "/user/:name" collide if both accept GET.<p>
 * 
 * A delegation collides with another delegation, or a glob route, on the same
 * prefix. Such an exception has no routes and no method.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public class RouteCollisionException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    private final transient Route<?> added, existing;
    private final String method;
    
    /**
     * Constructs a {@code RouteCollisionException}.
     * 
     * @param added the rejected route
     * @param existing the already registered route
     * @param method accepted by both
     */
    public RouteCollisionException(Route<?> added, Route<?> existing, String method) {
        super(format("Route \"{0}\" collides with an already added route \"{1}\" on method {2}.",
                added, existing, method));
        this.added = added;
        this.existing = existing;
        this.method = method;
    }
    
    /**
     * Constructs a {@code RouteCollisionException} of a delegation.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public RouteCollisionException(String message) {
        super(message);
        this.added = null;
        this.existing = null;
        this.method = null;
    }
    
    /**
     * {@return the rejected route}<p>
     * 
     * Is {@code null} if this exception was deserialized, or is of a
     * delegation.
     */
    public Route<?> added() {
        return added;
    }
    
    /**
     * {@return the already registered route}<p>
     * 
     * Is {@code null} if this exception was deserialized, or is of a
     * delegation.
     */
    public Route<?> existing() {
        return existing;
    }
    
    /**
     * {@return the method accepted by both routes, or {@code null} if this
     * exception is of a delegation}
     */
    public String method() {
        return method;
    }
}
