package alpha.waypoint.pipeline;

import alpha.waypoint.Chain;
import alpha.waypoint.RequestCancelledException;
import alpha.waypoint.handler.ExceptionHandler;
import alpha.waypoint.handler.ExceptionHandlerChain;
import alpha.waypoint.message.Response;
import alpha.waypoint.state.RequestState;

import java.util.ArrayList;
import java.util.List;

/**
 * A middleware which handles the exceptions of the rest of the chain.<p>
 * 
 * An exception thrown by a middleware after the boundary, or by the route
 * handler, is given to the boundary's exception handlers, in order. The first
 * response produced becomes the response of the boundary, as if the rest of
 * the chain had returned it. Middleware before the boundary are unaffected.<p>
 * 
 * If all handlers yield, the exception propagates to the next enclosing
 * boundary, and finally to the dispatcher's exception handlers.
 * 
 * <pre>{@code
 *   Pipeline api = Pipeline.of(
 *       requestLogger,
 *       FaultBoundary.of((exc, chain, state) ->
 *           exc instanceof ValidationException ? Responses.badRequest() : chain.proceed()),
 *       apiKey);
 * }</pre>
 * 
 * A {@link RequestCancelledException} or an {@link InterruptedException} is
 * never handled.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class FaultBoundary implements Middleware
{
    /**
     * Returns a fault boundary of the given exception handlers.
     * 
     * @param first exception handler
     * @param more exception handlers
     * 
     * @return a fault boundary
     * 
     * @throws NullPointerException if an argument is {@code null}
     */
    public static FaultBoundary of(ExceptionHandler first, ExceptionHandler... more) {
        var l = new ArrayList<ExceptionHandler>();
        l.add(first);
        l.addAll(List.of(more));
        return new FaultBoundary(ExceptionHandlerChain.open(l));
    }
    
    private final ExceptionHandlerChain handlers;
    
    private FaultBoundary(ExceptionHandlerChain handlers) {
        this.handlers = handlers;
    }
    
    @Override
    public Response apply(RequestState state, Chain chain) throws Exception {
        try {
            return chain.proceed();
        } catch (RequestCancelledException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        } catch (Exception e) {
            var rsp = handlers.handle(e, state);
            if (rsp == null) {
                throw e;
            }
            return rsp;
        }
    }
}
