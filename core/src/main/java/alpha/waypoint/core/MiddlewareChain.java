package alpha.waypoint.core;

import alpha.waypoint.Cancellation;
import alpha.waypoint.Chain;
import alpha.waypoint.handler.RouteHandler;
import alpha.waypoint.message.Response;
import alpha.waypoint.pipeline.Middleware;
import alpha.waypoint.state.RequestState;

import java.util.List;

import static java.lang.System.Logger.Level.DEBUG;

/**
 * Runs middleware around a route handler.<p>
 * 
 * The chain calls the first middleware, which may call {@link Chain#proceed()}
 * to call the next one, and so on, until there are no more middleware, which is
 * when the route handler executes.<p>
 * 
 * Each {@code Chain} instance given to a middleware may be used once, and only
 * for as long as the middleware executes. Before each stage is entered and
 * after it returns, the cancellation signal is checked.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class MiddlewareChain
{
    private static final System.Logger LOG
            = System.getLogger(MiddlewareChain.class.getPackageName());
    
    private final List<Middleware> middleware;
    private final RouteHandler handler;
    private final RequestState state;
    private final Cancellation cancellation;
    private final String prefix;
    
    MiddlewareChain(
            List<Middleware> middleware, RouteHandler handler,
            RequestState state, Cancellation cancellation, String logPrefix) {
        this.middleware   = middleware;
        this.handler      = handler;
        this.state        = state;
        this.cancellation = cancellation;
        this.prefix       = logPrefix;
    }
    
    /**
     * Calls the first stage.
     * 
     * @return the response of the first stage
     * 
     * @throws Exception from a stage
     */
    Response ignite() throws Exception {
        return call(0);
    }
    
    private Response call(int i) throws Exception {
        final String stage = i == middleware.size() ?
                "route handler" : "middleware #" + i;
        cancellation.throwIfCancelled("before " + stage);
        LOG.log(DEBUG, () -> prefix + "Entering " + stage + ".");
        final Response rsp;
        if (i == middleware.size()) {
            rsp = handler.apply(state);
        } else {
            var link = new Link(i + 1);
            try {
                rsp = middleware.get(i).apply(state, link);
            } finally {
                link.open = false;
            }
        }
        if (rsp == null) {
            throw new NullPointerException("Response from " + stage + " is null.");
        }
        LOG.log(DEBUG, () -> prefix + "Exited " + stage + " with status " + rsp.statusCode() + ".");
        cancellation.throwIfCancelled("after " + stage);
        return rsp;
    }
    
    private final class Link implements Chain {
        private final int next;
        private boolean open = true,
                        called;
        
        Link(int next) {
            this.next = next;
        }
        
        @Override
        public Response proceed() throws Exception {
            if (!open) {
                throw new UnsupportedOperationException(Chain.class.getSimpleName() +
                        ".proceed() not called from within the processing chain");
            }
            if (called) {
                throw new UnsupportedOperationException(Chain.class.getSimpleName() +
                        ".proceed() was already called");
            }
            called = true;
            return call(next);
        }
    }
}
