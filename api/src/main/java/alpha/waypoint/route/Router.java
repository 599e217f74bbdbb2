package alpha.waypoint.route;

import alpha.waypoint.Config;
import alpha.waypoint.RoutingFactory;
import alpha.waypoint.pipeline.PipelineSet;

import java.util.List;

/**
 * Matches a request method and path against a frozen tree of routes.<p>
 * 
 * A router is built once, using a {@link RouterBuilder}, and is then shared
 * read-only by all request threads.
 * 
 * <pre>{@code
 *   Router<Pipes> router = Router.builder(pipelines)
 *       .get("/").to(index)
 *       .scope("/checkout", r -> r
 *           .get("/start").to(start)
 *           .post("/complete").to(complete))
 *       .get("/products/:id|[0-9]+").withPathExtractor(PathExtractor.intoRecord(ProductId.class)).to(product)
 *       .get("/assets/*path").to(assets)
 *       .build();
 * }</pre>
 * 
 * <h2>Matching</h2>
 * 
 * The path is split into segments, after having removed the leading forward
 * slash, and one trailing forward slash. Empty segments in between are kept;
 * "/a//b" has the three segments "a", "", and "b". Each segment is
 * percent-decoded.<p>
 * 
 * Starting from the root, at each node of the tree, the alternatives for the
 * next segment are tried in this order:
 * 
 * <ol>
 *   <li>a literal child equal to the segment,</li>
 *   <li>the regex-constrained children, in order of registration,</li>
 *   <li>the single-segment parameter child, if the segment is not empty,</li>
 *   <li>the catch-all child, which consumes all remaining segments, even
 *       zero.</li>
 * </ol>
 * 
 * If an alternative fails to match the rest of the path, the next alternative
 * is tried (backtracking). A node reached with no remaining segments matches
 * if a route terminates there; the first such route that accepts the method
 * wins. If routes terminate there, but none accepts the method, the search
 * continues, and if no other node accepts the method, the outcome is
 * {@link MatchOutcome.PathMatchedNoVerb} with the methods of the first node
 * found.
 * 
 * @param <L> lineage of the pipeline set
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Router<L>
{
    /**
     * Returns a new router builder with the {@linkplain Config#DEFAULT default
     * configuration}.
     * 
     * @param pipelines of the routes
     * @param <L> lineage of the pipeline set
     * 
     * @return a new router builder
     * 
     * @throws NullPointerException if {@code pipelines} is {@code null}
     */
    static <L> RouterBuilder<L> builder(PipelineSet<L> pipelines) {
        return builder(pipelines, Config.DEFAULT);
    }
    
    /**
     * Returns a new router builder.
     * 
     * @param pipelines of the routes
     * @param config of router
     * @param <L> lineage of the pipeline set
     * 
     * @return a new router builder
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    static <L> RouterBuilder<L> builder(PipelineSet<L> pipelines, Config config) {
        return RoutingFactory.load().newRouterBuilder(pipelines, config);
    }
    
    /**
     * Matches the given method and path.
     * 
     * @param method of request
     * @param path of request; raw, i.e. not percent-decoded
     * 
     * @return the outcome (never {@code null})
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws MalformedPathException
     *             if a path segment has a malformed percent-escape
     */
    MatchOutcome<L> match(String method, String path);
    
    /**
     * Returns the pipeline set of the routes.
     * 
     * @return the pipeline set of the routes
     */
    PipelineSet<L> pipelines();
    
    /**
     * Returns the configuration.
     * 
     * @return the configuration
     */
    Config config();
    
    /**
     * Returns all routes, in order of registration.
     * 
     * @return an unmodifiable list of all routes
     */
    List<Route<L>> routes();
}
