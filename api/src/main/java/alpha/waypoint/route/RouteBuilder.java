package alpha.waypoint.route;

import alpha.waypoint.extract.PathExtractor;
import alpha.waypoint.extract.QueryStringExtractor;
import alpha.waypoint.handler.RouteHandler;
import alpha.waypoint.pipeline.PipelineChain;

import java.util.LinkedHashSet;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * A fluent registration of one route.<p>
 * 
 * The route is registered when {@link #to(RouteHandler)} is called, which
 * returns the router builder.
 * 
 * <pre>{@code
 *   builder.get("/products/:id")
 *          .withPipelineChain(PipelineChain.of(api))
 *          .withPathExtractor(PathExtractor.intoRecord(ProductPath.class))
 *          .to(productHandler);
 * }</pre>
 * 
 * The builder is not thread-safe.
 * 
 * @param <L> lineage of the pipeline set
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class RouteBuilder<L>
{
    private final RouterBuilder<L> router;
    private final Set<String> methods;
    private final String pattern;
    private PipelineChain<L> chain;
    private PathExtractor<?> path;
    private QueryStringExtractor<?> query;
    
    RouteBuilder(RouterBuilder<L> router, Set<String> methods, String pattern) {
        this.router  = requireNonNull(router);
        this.methods = new LinkedHashSet<>(methods);
        this.pattern = requireNonNull(pattern);
        this.chain   = PipelineChain.empty();
        this.path    = PathExtractor.none();
        this.query   = QueryStringExtractor.none();
    }
    
    /**
     * Sets the pipeline chain of the route.
     * 
     * @param chain of pipelines, appended to that of the current scope
     * @return this for chaining/fluency
     * @throws NullPointerException if {@code chain} is {@code null}
     */
    public RouteBuilder<L> withPipelineChain(PipelineChain<L> chain) {
        this.chain = requireNonNull(chain);
        return this;
    }
    
    /**
     * Sets the path extractor of the route.
     * 
     * @param extractor of path parameters
     * @return this for chaining/fluency
     * @throws NullPointerException if {@code extractor} is {@code null}
     */
    public RouteBuilder<L> withPathExtractor(PathExtractor<?> extractor) {
        this.path = requireNonNull(extractor);
        return this;
    }
    
    /**
     * Sets the query string extractor of the route.
     * 
     * @param extractor of query parameters
     * @return this for chaining/fluency
     * @throws NullPointerException if {@code extractor} is {@code null}
     */
    public RouteBuilder<L> withQueryStringExtractor(QueryStringExtractor<?> extractor) {
        this.query = requireNonNull(extractor);
        return this;
    }
    
    /**
     * Registers the route.
     * 
     * @param handler of request
     * 
     * @return the router builder
     * 
     * @throws NullPointerException
     *             if {@code handler} is {@code null}
     * @throws RoutePatternInvalidException
     *             if the pattern is invalid
     * @throws RouteCollisionException
     *             if the route collides with a registered route
     * 
     * @see RouterBuilder#register(Set, String, PipelineChain, PathExtractor, QueryStringExtractor, RouteHandler)
     */
    public RouterBuilder<L> to(RouteHandler handler) {
        return router.register(methods, pattern, chain, path, query, handler);
    }
}
