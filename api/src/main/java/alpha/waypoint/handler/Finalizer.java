package alpha.waypoint.handler;

import alpha.waypoint.message.Response;
import alpha.waypoint.state.RequestState;

import static java.util.Objects.requireNonNull;

/**
 * Runs after the request processing chain, with the final response.<p>
 * 
 * Finalizers are registered with the dispatcher, and they run in the reverse
 * order of registration; the first registered finalizer is the outermost and
 * runs last. Each finalizer is given the response returned from the previous
 * one, and may return it as-is, or replace it.<p>
 * 
 * Finalizers always run, whether the response came from the route handler, a
 * short-circuiting middleware, or an exception handler. If the request failed
 * or was cancelled, the failure is given. A finalizer that throws an exception
 * is logged and skipped; the response remains what it was.
 * 
 * <pre>{@code
 *   Finalizer poweredBy = (state, rsp, failure) ->
 *       rsp.toBuilder().setHeader("X-Powered-By", "Waypoint").build();
 * }</pre>
 * 
 * The finalizer must be thread-safe, as it may be called concurrently.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public interface Finalizer
{
    /**
     * Finalizes the response.
     * 
     * @param state of request (never {@code null})
     * @param response so far (never {@code null})
     * @param failure the exception which produced the response, or {@code null}
     * 
     * @return the final response (must not be {@code null})
     * 
     * @throws Exception anything, which is logged and ignored
     */
    Response apply(RequestState state, Response response, Throwable failure)
            throws Exception;
    
    /**
     * Returns a finalizer which applies the given finalizer only if the
     * response has the given status code.
     * 
     * <pre>{@code
     *   Finalizer.forStatus(404, (state, rsp, failure) ->
     *       rsp.toBuilder().body(Response.Body.ofString("Nothing here.")).build());
     * }</pre>
     * 
     * @param statusCode of response
     * @param delegate finalizer
     * 
     * @return a finalizer
     * 
     * @throws NullPointerException if {@code delegate} is {@code null}
     */
    static Finalizer forStatus(int statusCode, Finalizer delegate) {
        requireNonNull(delegate);
        return (state, rsp, failure) -> rsp.statusCode() == statusCode ?
                delegate.apply(state, rsp, failure) : rsp;
    }
}
