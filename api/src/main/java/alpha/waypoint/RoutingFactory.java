package alpha.waypoint;

import alpha.waypoint.handler.ExceptionHandler;
import alpha.waypoint.handler.Finalizer;
import alpha.waypoint.pipeline.PipelineSet;
import alpha.waypoint.route.Router;
import alpha.waypoint.route.RouterBuilder;

import java.util.List;
import java.util.ServiceLoader;

/**
 * Creates router builders and dispatchers.<p>
 * 
 * The implementation is provided by the core module, and is located using
 * {@link ServiceLoader}. Applications use {@link Router#builder(PipelineSet)}
 * and {@link Dispatcher#builder(Router)} instead.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface RoutingFactory
{
    /**
     * Loads the factory.
     * 
     * @return the factory
     * @throws AssertionError if not exactly one factory is found
     */
    static RoutingFactory load() {
        var loader = ServiceLoader.load(RoutingFactory.class);
        var factories = loader.stream().toList();
        if (factories.size() != 1) {
            throw new AssertionError(
                "Expected 1 factory, saw: " + factories.size());
        }
        return factories.get(0).get();
    }
    
    /**
     * Creates a new router builder.
     * 
     * @param pipelines of the routes
     * @param config of router
     * @param <L> lineage of the pipeline set
     * 
     * @return a new router builder
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    <L> RouterBuilder<L> newRouterBuilder(PipelineSet<L> pipelines, Config config);
    
    /**
     * Creates a new dispatcher.
     * 
     * @param router of routes
     * @param exceptionHandlers in order of execution
     * @param finalizers in order of registration
     * @param <L> lineage of the pipeline set
     * 
     * @return a new dispatcher
     * 
     * @throws NullPointerException
     *             if an argument or an element is {@code null}
     */
    <L> Dispatcher<L> newDispatcher(
            Router<L> router,
            List<ExceptionHandler> exceptionHandlers,
            List<Finalizer> finalizers);
}
