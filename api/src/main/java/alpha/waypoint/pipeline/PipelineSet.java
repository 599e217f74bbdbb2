package alpha.waypoint.pipeline;

import alpha.waypoint.store.ForeignHandleException;
import alpha.waypoint.store.Store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A frozen registry of pipelines.<p>
 * 
 * Pipelines are added to a {@link Builder}, each add yielding a
 * {@link PipelineHandle}. Routes reference pipelines by a
 * {@link PipelineChain} of such handles. The router owns the set, and the
 * dispatcher resolves the chain of a matched route against it.
 * 
 * <pre>{@code
 *   enum Pipes {}
 *   
 *   PipelineSet.Builder<Pipes> b = PipelineSet.builder();
 *   PipelineHandle<Pipes> web = b.add(Pipeline.of(sessions, csrf));
 *   PipelineHandle<Pipes> api = b.add(Pipeline.of(apiKey));
 *   PipelineSet<Pipes> set = b.build();
 * }</pre>
 * 
 * Because the set is frozen before any route is registered, the handle of a
 * route always resolves. A handle of another set of the same lineage type is
 * rejected when the route is registered.
 * 
 * @param <L> lineage
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class PipelineSet<L>
{
    /**
     * Returns a new builder.
     * 
     * @param <L> lineage
     * @return a new builder
     */
    public static <L> Builder<L> builder() {
        return new Builder<>();
    }
    
    private final Store<L> store;
    
    private PipelineSet(Store<L> store) {
        this.store = store;
    }
    
    /**
     * Returns the pipeline of the given handle.
     * 
     * @param handle of pipeline
     * @return the pipeline
     * @throws ForeignHandleException if the handle is not of this set
     */
    public Pipeline get(PipelineHandle<L> handle) {
        return store.get(handle.slot());
    }
    
    /**
     * Returns {@code true} if the handle is of this set.
     * 
     * @param handle to test
     * @return see JavaDoc
     */
    public boolean owns(PipelineHandle<L> handle) {
        return store.owns(handle.slot());
    }
    
    /**
     * Requires all handles of the chain to be of this set.
     * 
     * @param chain to validate
     * @return the chain
     * @throws ForeignHandleException if a handle is not of this set
     */
    public PipelineChain<L> requireOwned(PipelineChain<L> chain) {
        for (var h : chain.handles()) {
            if (!owns(h)) {
                throw new ForeignHandleException(h.slot());
            }
        }
        return chain;
    }
    
    /**
     * Returns all middleware of the chain's pipelines, concatenated.
     * 
     * @param chain of pipelines
     * @return an unmodifiable list of middleware, in order of execution
     * @throws ForeignHandleException if a handle is not of this set
     */
    public List<Middleware> resolve(PipelineChain<L> chain) {
        var h = chain.handles();
        if (h.isEmpty()) {
            return List.of();
        }
        if (h.size() == 1) {
            return get(h.get(0)).middleware();
        }
        var all = new ArrayList<Middleware>();
        h.forEach(x -> all.addAll(get(x).middleware()));
        return Collections.unmodifiableList(all);
    }
    
    /**
     * Returns the number of pipelines.
     * 
     * @return the number of pipelines
     */
    public int size() {
        return store.size();
    }
    
    /**
     * Builder of a {@link PipelineSet}.<p>
     * 
     * The builder is not thread-safe, and it can only be used to build one
     * set.
     * 
     * @param <L> lineage
     */
    public static final class Builder<L>
    {
        private final Store.Builder<L> store = Store.builder();
        
        private Builder() {
            // Empty
        }
        
        /**
         * Adds a pipeline.
         * 
         * @param pipeline to add
         * @return a handle of the pipeline
         * @throws NullPointerException if {@code pipeline} is {@code null}
         * @throws IllegalStateException if the set has already been built
         */
        public PipelineHandle<L> add(Pipeline pipeline) {
            return new PipelineHandle<>(store.add(pipeline));
        }
        
        /**
         * Freezes the set.<p>
         * 
         * The builder is spent afterwards.
         * 
         * @return a frozen set
         * @throws IllegalStateException if the set has already been built
         */
        public PipelineSet<L> build() {
            return new PipelineSet<>(store.build());
        }
    }
}
