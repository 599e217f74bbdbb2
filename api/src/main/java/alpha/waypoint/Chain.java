package alpha.waypoint;

import alpha.waypoint.handler.RouteHandler;
import alpha.waypoint.message.Response;
import alpha.waypoint.pipeline.Middleware;

/**
 * An API for proceeding the active processing chain.<p>
 * 
 * The request processing chain is made up of zero or more {@link Middleware}
 * leading up to a {@link RouteHandler}. Each middleware is given a chain
 * object, which calls the rest of the chain.<p>
 * 
 * The middleware can short-circuit the rest of the chain by <i>not</i> calling
 * {@link #proceed()}, and return a response of its own.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public interface Chain
{
    /**
     * Calls the next entity in the processing chain.
     * 
     * @return the response returned from the next entity
     * 
     * @throws UnsupportedOperationException
     *             if not called from within the processing chain, or
     *             if called more than once (by the same executing entity)
     * @throws Exception
     *             as propagated from the rest of the chain
     */
    Response proceed() throws Exception;
}
