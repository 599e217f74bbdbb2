package alpha.waypoint.pipeline;

import alpha.waypoint.Chain;
import alpha.waypoint.message.Response;
import alpha.waypoint.state.RequestState;

/**
 * A stage of the request processing chain, which wraps the rest of the
 * chain.<p>
 * 
 * The middleware may do work before calling {@link Chain#proceed()}, and may
 * inspect or replace the response returned from it. Or, it may short-circuit
 * the chain by returning a response without proceeding; the rest of the chain,
 * route handler included, is then never called, but outer middleware still
 * see the response on their way out.
 * 
 * <pre>{@code
 *   Middleware requireApiKey = (state, chain) -> {
 *       var req = state.borrow(Request.class);
 *       if (req.header("X-Api-Key").isEmpty()) {
 *           return Responses.forbidden();
 *       }
 *       return chain.proceed();
 *   };
 * }</pre>
 * 
 * {@code proceed()} can be called at most once. Calling it again throws
 * {@link UnsupportedOperationException}.<p>
 * 
 * Middleware are assembled into a {@link Pipeline}. The middleware must be
 * thread-safe, as it may be called concurrently.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public interface Middleware
{
    /**
     * Processes the request.
     * 
     * @param state of request
     * @param chain the rest of the chain
     * 
     * @return the response (must not be {@code null})
     * 
     * @throws Exception anything
     */
    Response apply(RequestState state, Chain chain) throws Exception;
}
