package alpha.waypoint;

import alpha.waypoint.handler.ExceptionHandler;
import alpha.waypoint.handler.Finalizer;
import alpha.waypoint.message.Request;
import alpha.waypoint.message.Response;
import alpha.waypoint.route.MatchOutcome;
import alpha.waypoint.route.Router;
import alpha.waypoint.state.RequestState;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Executes requests against the routes of a {@link Router}.<p>
 * 
 * For each request, the dispatcher
 * 
 * <ol>
 *   <li>puts the {@link Request}, a {@link alpha.waypoint.state.RequestId}
 *       and the {@link Config} in the request state,</li>
 *   <li>matches the request; if no route matched, the request is answered
 *       "404 Not Found", or "405 Method Not Allowed" with an {@code Allow}
 *       header, without running any middleware,</li>
 *   <li>puts the {@link alpha.waypoint.route.Route}, its
 *       {@link alpha.waypoint.route.PathParameters} and the request's
 *       {@link alpha.waypoint.message.QueryParameters} in the state,</li>
 *   <li>runs the route's path and query string extractors, and puts their
 *       values in the state; a failure is answered "400 Bad Request",
 *       without running any middleware,</li>
 *   <li>runs the middleware of the route's pipeline chain, in order, and
 *       lastly the route handler; each middleware wraps the rest of the
 *       chain,</li>
 *   <li>hands an exception from the chain to the exception handlers, ending
 *       with {@link ExceptionHandler#BASE}, and</li>
 *   <li>runs the finalizers, in reverse order of registration.</li>
 * </ol>
 * 
 * Given the middleware A then B and the handler H, the order of execution is
 * A-enter, B-enter, H, B-exit, A-exit. If B returns without proceeding, H is
 * never called, but A-exit still runs.<p>
 * 
 * Every outcome, except for a cancelled request, produces a response.<p>
 * 
 * The dispatcher is immutable and thread-safe. It runs each request to
 * completion on the calling thread.
 * 
 * @param <L> lineage of the pipeline set
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Dispatcher<L>
{
    /**
     * Returns a new builder.
     * 
     * @param router of routes
     * @param <L> lineage of the pipeline set
     * 
     * @return a new builder
     * 
     * @throws NullPointerException if {@code router} is {@code null}
     */
    static <L> Builder<L> builder(Router<L> router) {
        return new Builder<>(router);
    }
    
    /**
     * Dispatches a request.<p>
     * 
     * Equivalent to {@code dispatch(request, new RequestState(),
     * Cancellation.create())}.
     * 
     * @param request to dispatch
     * 
     * @return the response (never {@code null})
     * 
     * @throws NullPointerException
     *             if {@code request} is {@code null}
     * @throws RequestCancelledException
     *             if the dispatching thread is interrupted
     */
    default Response dispatch(Request request) {
        return dispatch(request, new RequestState(), Cancellation.create());
    }
    
    /**
     * Dispatches a request.<p>
     * 
     * Equivalent to {@code dispatch(request, new RequestState(),
     * cancellation)}.
     * 
     * @param request to dispatch
     * @param cancellation signal
     * 
     * @return the response (never {@code null})
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws RequestCancelledException
     *             if the request is cancelled, or the thread interrupted
     */
    default Response dispatch(Request request, Cancellation cancellation) {
        return dispatch(request, new RequestState(), cancellation);
    }
    
    /**
     * Matches and dispatches a request.<p>
     * 
     * The given state is the state of the request, and it holds the final
     * state after the dispatch has returned. Values present in the state
     * before the call are visible to all stages. Except for a request id,
     * which is used as-is if present, the dispatcher replaces the values it
     * puts.
     * 
     * @param request to dispatch
     * @param state of request
     * @param cancellation signal
     * 
     * @return the response (never {@code null})
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws RequestCancelledException
     *             if the request is cancelled, or the thread interrupted
     */
    Response dispatch(Request request, RequestState state, Cancellation cancellation);
    
    /**
     * Dispatches a request, given an outcome of the router.<p>
     * 
     * The outcome must have been produced by the router of this dispatcher.
     * 
     * @param request to dispatch
     * @param outcome of matching the request
     * @param state of request
     * @param cancellation signal
     * 
     * @return the response (never {@code null})
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws RequestCancelledException
     *             if the request is cancelled, or the thread interrupted
     */
    Response dispatch(Request request, MatchOutcome<L> outcome, RequestState state, Cancellation cancellation);
    
    /**
     * Returns the router.
     * 
     * @return the router
     */
    Router<L> router();
    
    /**
     * Builder of a {@link Dispatcher}.<p>
     * 
     * The builder is not thread-safe.
     * 
     * @param <L> lineage of the pipeline set
     */
    final class Builder<L>
    {
        private final Router<L> router;
        private final List<ExceptionHandler> handlers;
        private final List<Finalizer> finalizers;
        
        private Builder(Router<L> router) {
            this.router     = requireNonNull(router);
            this.handlers   = new ArrayList<>();
            this.finalizers = new ArrayList<>();
        }
        
        /**
         * Adds exception handlers.<p>
         * 
         * The handlers are called in order of registration, and before
         * {@link ExceptionHandler#BASE}.
         * 
         * @param handlers to add
         * @return this for chaining/fluency
         * @throws NullPointerException if an argument is {@code null}
         */
        public Builder<L> exceptionHandler(ExceptionHandler... handlers) {
            this.handlers.addAll(List.of(handlers));
            return this;
        }
        
        /**
         * Adds finalizers.<p>
         * 
         * The finalizers run in reverse order of registration.
         * 
         * @param finalizers to add
         * @return this for chaining/fluency
         * @throws NullPointerException if an argument is {@code null}
         */
        public Builder<L> finalizer(Finalizer... finalizers) {
            this.finalizers.addAll(List.of(finalizers));
            return this;
        }
        
        /**
         * Builds the dispatcher.<p>
         * 
         * The dispatcher uses the configuration of the router.
         * 
         * @return a dispatcher
         */
        public Dispatcher<L> build() {
            return RoutingFactory.load().newDispatcher(router, handlers, finalizers);
        }
    }
}
