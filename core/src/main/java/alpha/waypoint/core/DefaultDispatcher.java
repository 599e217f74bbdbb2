package alpha.waypoint.core;

import alpha.waypoint.Cancellation;
import alpha.waypoint.Config;
import alpha.waypoint.Dispatcher;
import alpha.waypoint.RequestCancelledException;
import alpha.waypoint.extract.ExtractionException;
import alpha.waypoint.extract.PathExtractor;
import alpha.waypoint.extract.QueryStringExtractor;
import alpha.waypoint.handler.ExceptionHandler;
import alpha.waypoint.handler.ExceptionHandlerChain;
import alpha.waypoint.handler.Finalizer;
import alpha.waypoint.message.QueryParameters;
import alpha.waypoint.message.Request;
import alpha.waypoint.message.Response;
import alpha.waypoint.route.MalformedPathException;
import alpha.waypoint.route.MatchOutcome;
import alpha.waypoint.route.MatchOutcome.Matched;
import alpha.waypoint.route.MatchOutcome.PathMatchedNoVerb;
import alpha.waypoint.route.MethodNotAllowedException;
import alpha.waypoint.route.NoRouteFoundException;
import alpha.waypoint.route.PathParameters;
import alpha.waypoint.route.Route;
import alpha.waypoint.route.Router;
import alpha.waypoint.state.RequestId;
import alpha.waypoint.state.RequestState;

import java.util.List;

import static alpha.waypoint.HttpConstants.Method.HEAD;
import static alpha.waypoint.message.Responses.internalServerError;
import static alpha.waypoint.message.Responses.serviceUnavailable;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Dispatcher}.
 * 
 * @param <L> lineage of the pipeline set
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultDispatcher<L> implements Dispatcher<L>
{
    private static final System.Logger LOG
            = System.getLogger(DefaultDispatcher.class.getPackageName());
    
    private final Router<L> router;
    private final Config config;
    private final ExceptionHandlerChain handlers;
    private final List<Finalizer> finalizers;
    
    DefaultDispatcher(Router<L> router, List<ExceptionHandler> handlers, List<Finalizer> finalizers) {
        this.router     = requireNonNull(router);
        this.config     = router.config();
        this.handlers   = ExceptionHandlerChain.withBase(handlers);
        this.finalizers = List.copyOf(finalizers);
    }
    
    @Override
    public Response dispatch(Request request, RequestState state, Cancellation cancellation) {
        requireNonNull(cancellation);
        initialize(request, state);
        final MatchOutcome<L> outcome;
        try {
            outcome = router.match(request.method(), request.path());
        } catch (MalformedPathException e) {
            return finish(state, handlers.handle(e, state), e);
        }
        return execute(request, outcome, state, cancellation);
    }
    
    @Override
    public Response dispatch(
            Request request, MatchOutcome<L> outcome,
            RequestState state, Cancellation cancellation)
    {
        requireNonNull(outcome);
        requireNonNull(cancellation);
        if (outcome instanceof Matched<L> m) {
            router.pipelines().requireOwned(m.route().chain());
        }
        initialize(request, state);
        return execute(request, outcome, state, cancellation);
    }
    
    @Override
    public Router<L> router() {
        return router;
    }
    
    private void initialize(Request request, RequestState state) {
        state.put(Request.class, request)
             .put(Config.class, config);
        RequestId.set(state, request, config.acceptRequestIdHeader());
    }
    
    private Response execute(
            Request request, MatchOutcome<L> outcome,
            RequestState state, Cancellation cancellation)
    {
        final Response rsp;
        try {
            rsp = process(request, outcome, state, cancellation);
        } catch (RequestCancelledException e) {
            throw cancelled(state, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            var exc = new RequestCancelledException("by interrupt");
            exc.initCause(e);
            throw cancelled(state, exc);
        } catch (Exception e) {
            return finish(state, handlers.handle(e, state), e);
        } catch (Error e) {
            // Finalizers run, but the error is not handled
            finish(state, internalServerError(), e);
            throw e;
        }
        return finish(state, rsp, null);
    }
    
    private Response process(
            Request request, MatchOutcome<L> outcome,
            RequestState state, Cancellation cancellation) throws Exception
    {
        cancellation.throwIfCancelled("before routing");
        if (outcome instanceof PathMatchedNoVerb<L> p) {
            throw new MethodNotAllowedException(request.method(), p.allowed());
        }
        if (!(outcome instanceof Matched<L> m)) {
            throw new NoRouteFoundException(request.path());
        }
        final Route<L> route = m.route();
        final String prefix = prefix(state);
        LOG.log(DEBUG, () -> prefix + "Dispatching to " + route + ".");
        var query = QueryParameters.parse(request.rawQuery());
        state.put(Route.class, route)
             .put(PathParameters.class, m.parameters())
             .put(QueryParameters.class, query);
        extract(route.pathExtractor(), m.parameters(), state);
        extract(route.queryExtractor(), query, state);
        var chain = new MiddlewareChain(
                router.pipelines().resolve(route.chain()),
                route.handler(),
                state,
                cancellation,
                prefix);
        Response rsp = chain.ignite();
        if (request.method().equals(HEAD) && !route.accepts(HEAD) && !rsp.body().isEmpty()) {
            // GET route serving HEAD
            rsp = rsp.toBuilder().body(Response.Body.empty()).build();
        }
        return rsp;
    }
    
    private static <T> void extract(PathExtractor<T> e, PathParameters params, RequestState state) {
        final T val;
        try {
            val = requireNonNull(e.extract(params), "Extracted value is null.");
        } catch (Exception x) {
            throw new ExtractionException(
                    "Path extraction into " + e.type().getSimpleName() + " failed.",
                    x, e.onFailure(x));
        }
        state.put(e.type(), val);
    }
    
    private static <T> void extract(QueryStringExtractor<T> e, QueryParameters params, RequestState state) {
        final T val;
        try {
            val = requireNonNull(e.extract(params), "Extracted value is null.");
        } catch (Exception x) {
            throw new ExtractionException(
                    "Query string extraction into " + e.type().getSimpleName() + " failed.",
                    x, e.onFailure(x));
        }
        state.put(e.type(), val);
    }
    
    private RequestCancelledException cancelled(RequestState state, RequestCancelledException e) {
        LOG.log(DEBUG, () -> prefix(state) + e.getMessage());
        finish(state, serviceUnavailable(), e);
        return e;
    }
    
    private Response finish(RequestState state, Response response, Throwable failure) {
        Response rsp = response;
        for (int i = finalizers.size() - 1; i >= 0; --i) {
            final Response r;
            try {
                r = finalizers.get(i).apply(state, rsp, failure);
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                LOG.log(WARNING, () -> prefix(state) + "Finalizer failed, ignoring.", e);
                continue;
            }
            if (r == null) {
                LOG.log(WARNING, () -> prefix(state) + "Finalizer returned null, ignoring.");
            } else {
                rsp = r;
            }
        }
        return rsp;
    }
    
    private static String prefix(RequestState state) {
        return state.tryBorrow(RequestId.class)
                    .map(id -> "[" + id + "] ")
                    .orElse("");
    }
}
