package alpha.waypoint.core;

import alpha.waypoint.Config;
import alpha.waypoint.extract.PathExtractor;
import alpha.waypoint.extract.QueryStringExtractor;
import alpha.waypoint.handler.RouteHandler;
import alpha.waypoint.pipeline.PipelineChain;
import alpha.waypoint.pipeline.PipelineSet;
import alpha.waypoint.route.Route;
import alpha.waypoint.route.RoutePattern;
import alpha.waypoint.route.RoutePatternInvalidException;
import alpha.waypoint.route.Segment;
import alpha.waypoint.route.Router;
import alpha.waypoint.route.RouterBuilder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link RouterBuilder}.<p>
 * 
 * Scopes are kept on a stack. Each entry holds the complete path prefix and
 * pipeline chain that a route registered within the scope is given.
 * 
 * @param <L> lineage of the pipeline set
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultRouterBuilder<L> implements RouterBuilder<L>
{
    private static final System.Logger LOG
            = System.getLogger(DefaultRouterBuilder.class.getPackageName());
    
    private record Scope<L>(RoutePattern prefix, PipelineChain<L> chain) {
        // Empty
    }
    
    private final PipelineSet<L> pipelines;
    private final Config config;
    private final RouteTree<L> tree;
    private final List<Route<L>> routes;
    private final Deque<Scope<L>> scopes;
    private boolean built;
    
    DefaultRouterBuilder(PipelineSet<L> pipelines, Config config) {
        this.pipelines = requireNonNull(pipelines);
        this.config    = requireNonNull(config);
        this.tree      = new RouteTree<>();
        this.routes    = new ArrayList<>();
        this.scopes    = new ArrayDeque<>();
        scopes.push(new Scope<>(RoutePattern.root(), PipelineChain.empty()));
    }
    
    @Override
    public RouterBuilder<L> register(
            Set<String> methods,
            String pattern,
            PipelineChain<L> chain,
            PathExtractor<?> pathExtractor,
            QueryStringExtractor<?> queryExtractor,
            RouteHandler handler)
    {
        requireNotBuilt();
        var s = scopes.peek();
        var r = new Route<>(
                s.prefix().concat(RoutePattern.parse(pattern)),
                methods,
                pipelines.requireOwned(s.chain().concat(chain)),
                pathExtractor,
                queryExtractor,
                handler);
        tree.add(r);
        routes.add(r);
        LOG.log(DEBUG, () -> "Registered " + r + ".");
        return this;
    }
    
    @Override
    public RouterBuilder<L> scope(String prefix, Consumer<? super RouterBuilder<L>> body) {
        requireNotBuilt();
        var s = scopes.peek();
        return within(new Scope<>(s.prefix().concat(RoutePattern.parse(prefix)), s.chain()), body);
    }
    
    @Override
    public RouterBuilder<L> withPipelineChain(
            PipelineChain<L> chain, Consumer<? super RouterBuilder<L>> body) {
        requireNotBuilt();
        var s = scopes.peek();
        return within(new Scope<>(s.prefix(), pipelines.requireOwned(s.chain().concat(chain))), body);
    }
    
    @Override
    public RouterBuilder<L> delegate(String prefix, Router<L> target) {
        return delegate(prefix, target, true);
    }
    
    @Override
    public RouterBuilder<L> delegateWithoutPipelines(String prefix, Router<L> target) {
        return delegate(prefix, target, false);
    }
    
    private RouterBuilder<L> delegate(String prefix, Router<L> target, boolean inherit) {
        requireNotBuilt();
        requireNonNull(target);
        if (!(target instanceof DefaultRouter<L> d)) {
            throw new IllegalArgumentException(
                "Can not delegate to a router of a different factory: " + target.getClass());
        }
        var s = scopes.peek();
        var at = s.prefix().concat(RoutePattern.parse(prefix));
        var segments = at.segments();
        if (!segments.isEmpty() && segments.get(segments.size() - 1) instanceof Segment.Glob) {
            throw new RoutePatternInvalidException(prefix, "Delegation prefix ends with a glob.");
        }
        var base = inherit ? s.chain() : PipelineChain.<L>empty();
        Map<Route<L>, Route<L>> rewrites = new IdentityHashMap<>();
        List<Route<L>> added = new ArrayList<>();
        for (var r : d.routes()) {
            var full = new Route<>(
                    at.concat(r.pattern()),
                    r.methods(),
                    pipelines.requireOwned(base.concat(r.chain())),
                    r.pathExtractor(),
                    r.queryExtractor(),
                    r.handler());
            rewrites.put(r, full);
            added.add(full);
        }
        tree.delegate(at, d.tree(), rewrites);
        routes.addAll(added);
        LOG.log(DEBUG, () -> "Delegated " + at + " to a router of " + added.size() + " route(s).");
        return this;
    }
    
    private RouterBuilder<L> within(Scope<L> scope, Consumer<? super RouterBuilder<L>> body) {
        requireNonNull(body);
        scopes.push(scope);
        try {
            body.accept(this);
        } finally {
            scopes.pop();
        }
        return this;
    }
    
    @Override
    public Router<L> build() {
        requireNotBuilt();
        if (scopes.size() > 1) {
            throw new IllegalStateException("Can not build router from within a scope.");
        }
        built = true;
        if (config.warnShadowedRoutes()) {
            tree.warnShadowed();
        }
        return new DefaultRouter<>(pipelines, config, tree, routes);
    }
    
    private void requireNotBuilt() {
        if (built) {
            throw new IllegalStateException("Router already built.");
        }
    }
}
