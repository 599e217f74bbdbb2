package alpha.waypoint.route;

import alpha.waypoint.handler.HasResponse;
import alpha.waypoint.message.Response;
import alpha.waypoint.message.Responses;

import java.io.Serial;

import static alpha.waypoint.message.Responses.notFound;

/**
 * Thrown by the dispatcher if no route matched the path of the request.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class NoRouteFoundException extends RuntimeException implements HasResponse
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs this object.
     * 
     * @param path of request
     */
    public NoRouteFoundException(String path) {
        super("No route matches the path \"" + path + "\".");
    }
    
    /**
     * Returns {@link Responses#notFound()}.
     * 
     * @return see Javadoc
     */
    @Override
    public Response getResponse() {
        return notFound();
    }
}
