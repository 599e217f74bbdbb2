package alpha.waypoint.route;

import alpha.waypoint.extract.PathExtractor;
import alpha.waypoint.extract.QueryStringExtractor;
import alpha.waypoint.handler.RouteHandler;
import alpha.waypoint.pipeline.PipelineChain;

import java.util.Set;
import java.util.function.Consumer;

import static alpha.waypoint.HttpConstants.Method.DELETE;
import static alpha.waypoint.HttpConstants.Method.GET;
import static alpha.waypoint.HttpConstants.Method.HEAD;
import static alpha.waypoint.HttpConstants.Method.OPTIONS;
import static alpha.waypoint.HttpConstants.Method.PATCH;
import static alpha.waypoint.HttpConstants.Method.POST;
import static alpha.waypoint.HttpConstants.Method.PUT;

/**
 * Registers routes, then builds a {@link Router}.<p>
 * 
 * Routes are registered with a pattern relative to the current scope, see
 * {@link #scope(String, Consumer)}, and with a pipeline chain that is
 * appended to that of the current scope, see
 * {@link #withPipelineChain(PipelineChain, Consumer)}.<p>
 * 
 * Two routes collide if their patterns are equivalent and they accept a
 * common method; the second registration fails with a
 * {@link RouteCollisionException}.<p>
 * 
 * The builder is not thread-safe, and it can only be used to build one
 * router. After {@link #build()}, all methods throw
 * {@link IllegalStateException}.
 * 
 * @param <L> lineage of the pipeline set
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface RouterBuilder<L>
{
    /**
     * Registers a route.
     * 
     * @param methods accepted request methods
     * @param pattern path pattern, relative to the current scope
     * @param chain pipelines, appended to those of the current scope
     * @param pathExtractor of path parameters
     * @param queryExtractor of query parameters
     * @param handler of request
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws IllegalArgumentException
     *             if {@code methods} is empty
     * @throws RoutePatternInvalidException
     *             if the pattern is invalid
     * @throws RouteCollisionException
     *             if the route collides with a registered route
     * @throws alpha.waypoint.store.ForeignHandleException
     *             if a handle of the chain is not of the router's pipeline set
     * @throws IllegalStateException
     *             if the router has already been built
     */
    RouterBuilder<L> register(
            Set<String> methods,
            String pattern,
            PipelineChain<L> chain,
            PathExtractor<?> pathExtractor,
            QueryStringExtractor<?> queryExtractor,
            RouteHandler handler);
    
    /**
     * Runs the given body with a scope of the given path prefix.<p>
     * 
     * All routes registered within the body have their pattern prefixed.
     * Scopes can be nested.
     * 
     * @param prefix pattern
     * @param body to run
     * 
     * @return this for chaining/fluency
     * 
     * @throws RoutePatternInvalidException
     *             if the prefix is invalid, or ends with a catch-all segment
     */
    RouterBuilder<L> scope(String prefix, Consumer<? super RouterBuilder<L>> body);
    
    /**
     * Runs the given body with a scope of the given pipeline chain.<p>
     * 
     * All routes registered within the body have the chain appended to that
     * of the enclosing scope.
     * 
     * @param chain of pipelines
     * @param body to run
     * 
     * @return this for chaining/fluency
     * 
     * @throws alpha.waypoint.store.ForeignHandleException
     *             if a handle of the chain is not of the router's pipeline set
     */
    RouterBuilder<L> withPipelineChain(PipelineChain<L> chain, Consumer<? super RouterBuilder<L>> body);
    
    /**
     * Forwards requests below the given prefix to another router.<p>
     * 
     * The path segments after the prefix are matched by {@code target}. A
     * route matched this way runs the pipeline chain of the current scope,
     * followed by its own chain. Path parameters of the prefix and of the
     * target's route are both available.<p>
     * 
     * Routes of this router below the prefix are tried before the delegation.
     * If {@code target} finds no route, the search goes on in this router.<p>
     * 
     * <pre>{@code
     *   Router<App> admin = Router.builder(pipelines)
     *           .get("/users").to(listUsers)
     *           .build();
     *   Router<App> root = Router.builder(pipelines)
     *           .withPipelineChain(PipelineChain.of(secured), b -> b
     *               .delegate("/admin", admin))
     *           .build();
     *   // "GET /admin/users" runs "secured", then listUsers
     * }</pre>
     * 
     * Routes added to {@code target} are part of {@link Router#routes()} of
     * the router built here, with their full pattern and chain.
     * 
     * @param prefix path pattern, relative to the current scope
     * @param target router
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws IllegalArgumentException
     *             if {@code target} was not built by the same factory
     * @throws RoutePatternInvalidException
     *             if the prefix is invalid or ends with a glob, or a route of
     *             {@code target} repeats a parameter name of the prefix
     * @throws RouteCollisionException
     *             if the prefix already delegates or has a glob route
     * @throws alpha.waypoint.store.ForeignHandleException
     *             if {@code target} has a different pipeline set
     */
    RouterBuilder<L> delegate(String prefix, Router<L> target);
    
    /**
     * Forwards requests below the given prefix to another router, without
     * the pipeline chain of the current scope.<p>
     * 
     * A route matched by {@code target} runs its own chain only. Otherwise,
     * this method is the same as {@link #delegate(String, Router)}.
     * 
     * @param prefix path pattern, relative to the current scope
     * @param target router
     * 
     * @return this for chaining/fluency
     * 
     * @see #delegate(String, Router)
     */
    RouterBuilder<L> delegateWithoutPipelines(String prefix, Router<L> target);
    
    /**
     * Builds the router.
     * 
     * @return a frozen router
     * 
     * @throws IllegalStateException
     *             if the router has already been built, or
     *             if called from within a scope
     */
    Router<L> build();
    
    /**
     * Starts the registration of a route.
     * 
     * @param methods accepted request methods
     * @param pattern path pattern, relative to the current scope
     * 
     * @return a route builder
     */
    default RouteBuilder<L> request(Set<String> methods, String pattern) {
        return new RouteBuilder<>(this, methods, pattern);
    }
    
    /**
     * Starts the registration of a {@code GET} route.
     * 
     * @param pattern path pattern, relative to the current scope
     * @return a route builder
     */
    default RouteBuilder<L> get(String pattern) {
        return request(Set.of(GET), pattern);
    }
    
    /**
     * Starts the registration of a route accepting {@code GET} and
     * {@code HEAD}.
     * 
     * @param pattern path pattern, relative to the current scope
     * @return a route builder
     */
    default RouteBuilder<L> getOrHead(String pattern) {
        return request(Set.of(GET, HEAD), pattern);
    }
    
    /**
     * Starts the registration of a {@code HEAD} route.
     * 
     * @param pattern path pattern, relative to the current scope
     * @return a route builder
     */
    default RouteBuilder<L> head(String pattern) {
        return request(Set.of(HEAD), pattern);
    }
    
    /**
     * Starts the registration of a {@code POST} route.
     * 
     * @param pattern path pattern, relative to the current scope
     * @return a route builder
     */
    default RouteBuilder<L> post(String pattern) {
        return request(Set.of(POST), pattern);
    }
    
    /**
     * Starts the registration of a {@code PUT} route.
     * 
     * @param pattern path pattern, relative to the current scope
     * @return a route builder
     */
    default RouteBuilder<L> put(String pattern) {
        return request(Set.of(PUT), pattern);
    }
    
    /**
     * Starts the registration of a {@code PATCH} route.
     * 
     * @param pattern path pattern, relative to the current scope
     * @return a route builder
     */
    default RouteBuilder<L> patch(String pattern) {
        return request(Set.of(PATCH), pattern);
    }
    
    /**
     * Starts the registration of a {@code DELETE} route.
     * 
     * @param pattern path pattern, relative to the current scope
     * @return a route builder
     */
    default RouteBuilder<L> delete(String pattern) {
        return request(Set.of(DELETE), pattern);
    }
    
    /**
     * Starts the registration of an {@code OPTIONS} route.
     * 
     * @param pattern path pattern, relative to the current scope
     * @return a route builder
     */
    default RouteBuilder<L> options(String pattern) {
        return request(Set.of(OPTIONS), pattern);
    }
}
