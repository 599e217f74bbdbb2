package alpha.waypoint.core;

import alpha.waypoint.Config;
import alpha.waypoint.pipeline.PipelineSet;
import alpha.waypoint.route.MatchOutcome;
import alpha.waypoint.route.Route;
import alpha.waypoint.route.Router;

import java.util.List;

import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Router}.
 * 
 * @param <L> lineage of the pipeline set
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultRouter<L> implements Router<L>
{
    private static final System.Logger LOG
            = System.getLogger(DefaultRouter.class.getPackageName());
    
    private final PipelineSet<L> pipelines;
    private final Config config;
    private final RouteTree<L> tree;
    private final List<Route<L>> routes;
    
    DefaultRouter(PipelineSet<L> pipelines, Config config, RouteTree<L> tree, List<Route<L>> routes) {
        this.pipelines = pipelines;
        this.config    = config;
        this.tree      = tree;
        this.routes    = List.copyOf(routes);
    }
    
    @Override
    public MatchOutcome<L> match(String method, String path) {
        requireNonNull(method);
        var segments = RequestPath.segments(path);
        var outcome = tree.lookup(method, segments, config.implementHeadFromGet());
        LOG.log(DEBUG, () -> "Matched " + method + " " + path + " to: " + outcome);
        return outcome;
    }
    
    @Override
    public PipelineSet<L> pipelines() {
        return pipelines;
    }
    
    @Override
    public Config config() {
        return config;
    }
    
    @Override
    public List<Route<L>> routes() {
        return routes;
    }
    
    RouteTree<L> tree() {
        return tree;
    }
    
    @Override
    public String toString() {
        return "DefaultRouter{routes=" + routes + '}';
    }
}
