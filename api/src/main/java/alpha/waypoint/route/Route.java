package alpha.waypoint.route;

import alpha.waypoint.extract.PathExtractor;
import alpha.waypoint.extract.QueryStringExtractor;
import alpha.waypoint.handler.RouteHandler;
import alpha.waypoint.pipeline.PipelineChain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * A registered route.<p>
 * 
 * A route is what the router matches a request against, and what the
 * dispatcher executes; the extractors, then the middleware of the pipeline
 * chain, and lastly the handler.<p>
 * 
 * Routes are created by a {@link RouterBuilder}.
 * 
 * @param pattern the path pattern
 * @param methods accepted request methods (never empty)
 * @param chain pipelines to run before the handler
 * @param pathExtractor of path parameters
 * @param queryExtractor of query parameters
 * @param handler of request
 * @param <L> lineage of the pipeline set
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public record Route<L>(
        RoutePattern pattern,
        Set<String> methods,
        PipelineChain<L> chain,
        PathExtractor<?> pathExtractor,
        QueryStringExtractor<?> queryExtractor,
        RouteHandler handler)
{
    /**
     * Constructs this object.<p>
     * 
     * The methods are copied; the iteration order is kept.
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws IllegalArgumentException
     *             if {@code methods} is empty
     */
    public Route {
        requireNonNull(pattern);
        requireNonNull(chain);
        requireNonNull(pathExtractor);
        requireNonNull(queryExtractor);
        requireNonNull(handler);
        if (methods.isEmpty()) {
            throw new IllegalArgumentException("No methods.");
        }
        methods.forEach(Objects::requireNonNull);
        methods = Collections.unmodifiableSet(new LinkedHashSet<>(methods));
    }
    
    /**
     * Returns {@code true} if the route accepts the given method.
     * 
     * @param method of request
     * @return see JavaDoc
     */
    public boolean accepts(String method) {
        return methods.contains(method);
    }
    
    @Override
    public String toString() {
        return "Route{" + methods + ' ' + pattern + '}';
    }
}
