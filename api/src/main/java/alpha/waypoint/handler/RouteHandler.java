package alpha.waypoint.handler;

import alpha.waypoint.message.Response;
import alpha.waypoint.state.RequestState;

/**
 * The endpoint of a route; produces the response of a request.<p>
 * 
 * The handler is called last in the request processing chain, after all
 * middleware of the route's pipelines have proceeded. The given state holds
 * the request, the path and query parameters, and whatever values the
 * extractors and the middleware have put.<p>
 * 
 * A handler is free to throw any exception, which is then handed to the
 * nearest fault boundary.<p>
 * 
 * The handler must be thread-safe, as it may be called concurrently.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public interface RouteHandler
{
    /**
     * Produces the response.
     * 
     * @param state of request
     * @return the response (must not be {@code null})
     * @throws Exception anything
     */
    Response apply(RequestState state) throws Exception;
}
