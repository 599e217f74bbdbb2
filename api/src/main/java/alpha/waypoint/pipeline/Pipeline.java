package alpha.waypoint.pipeline;

import alpha.waypoint.store.Handle;
import alpha.waypoint.store.Store;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An ordered, frozen sequence of middleware.<p>
 * 
 * A pipeline is built from the middleware of a {@link Store}. The order of
 * execution is the order in which the handles were added to the builder.
 * 
 * <pre>{@code
 *   Store.Builder<App> mw = Store.builder();
 *   var log  = mw.add(new RequestLogger());
 *   var auth = mw.add(new RequireApiKey());
 *   Store<App> store = mw.build();
 *   
 *   Pipeline api = Pipeline.builder(store).add(log).add(auth).build();
 * }</pre>
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Pipeline
{
    private static final Pipeline EMPTY = new Pipeline(List.of());
    
    /**
     * Returns a builder of a pipeline with middleware from the given store.
     * 
     * @param store of middleware
     * @param <M> lineage of the store
     * 
     * @return a new builder
     * 
     * @throws NullPointerException if {@code store} is {@code null}
     */
    public static <M> Builder<M> builder(Store<M> store) {
        return new Builder<>(store);
    }
    
    /**
     * Returns a pipeline of the given middleware.
     * 
     * @param middleware in order of execution
     * @return a pipeline
     * @throws NullPointerException if an argument is {@code null}
     */
    public static Pipeline of(Middleware... middleware) {
        return new Pipeline(List.of(middleware));
    }
    
    /**
     * Returns a pipeline without middleware.
     * 
     * @return an empty pipeline
     */
    public static Pipeline empty() {
        return EMPTY;
    }
    
    private final List<Middleware> middleware;
    
    private Pipeline(List<Middleware> middleware) {
        this.middleware = middleware;
    }
    
    /**
     * Returns the middleware of this pipeline.
     * 
     * @return an unmodifiable list, in order of execution
     */
    public List<Middleware> middleware() {
        return middleware;
    }
    
    /**
     * Returns the number of middleware.
     * 
     * @return the number of middleware
     */
    public int size() {
        return middleware.size();
    }
    
    @Override
    public String toString() {
        return "Pipeline{size=" + middleware.size() + '}';
    }
    
    /**
     * Builder of a {@link Pipeline}.<p>
     * 
     * The builder is not thread-safe.
     * 
     * @param <M> lineage of the middleware store
     */
    public static final class Builder<M>
    {
        private final Store<M> store;
        private final List<Middleware> middleware;
        
        private Builder(Store<M> store) {
            this.store = requireNonNull(store);
            this.middleware = new ArrayList<>();
        }
        
        /**
         * Appends the middleware of the given handle.<p>
         * 
         * The handle is resolved immediately.
         * 
         * @param handle of middleware
         * 
         * @return this for chaining/fluency
         * 
         * @throws NullPointerException
         *             if {@code handle} is {@code null}
         * @throws alpha.waypoint.store.ForeignHandleException
         *             if the handle was not issued by the store
         */
        public Builder<M> add(Handle<M, ? extends Middleware> handle) {
            middleware.add(store.get(handle));
            return this;
        }
        
        /**
         * Builds the pipeline.
         * 
         * @return a pipeline
         */
        public Pipeline build() {
            return middleware.isEmpty() ? EMPTY : new Pipeline(List.copyOf(middleware));
        }
    }
}
