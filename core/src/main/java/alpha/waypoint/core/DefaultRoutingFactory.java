package alpha.waypoint.core;

import alpha.waypoint.Config;
import alpha.waypoint.Dispatcher;
import alpha.waypoint.RoutingFactory;
import alpha.waypoint.handler.ExceptionHandler;
import alpha.waypoint.handler.Finalizer;
import alpha.waypoint.pipeline.PipelineSet;
import alpha.waypoint.route.Router;
import alpha.waypoint.route.RouterBuilder;

import java.util.List;

/**
 * Default {@code RoutingFactory}.<p>
 * 
 * This class is specified in the provider configuration file
 * {@code META-INF/services/alpha.waypoint.RoutingFactory}, which requires a
 * public class with a public no-arg constructor.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class DefaultRoutingFactory implements RoutingFactory
{
    /**
     * Constructs this object.
     */
    public DefaultRoutingFactory() {
        // Empty
    }
    
    @Override
    public <L> RouterBuilder<L> newRouterBuilder(PipelineSet<L> pipelines, Config config) {
        return new DefaultRouterBuilder<>(pipelines, config);
    }
    
    @Override
    public <L> Dispatcher<L> newDispatcher(
            Router<L> router,
            List<ExceptionHandler> exceptionHandlers,
            List<Finalizer> finalizers)
    {
        return new DefaultDispatcher<>(router, exceptionHandlers, finalizers);
    }
}
