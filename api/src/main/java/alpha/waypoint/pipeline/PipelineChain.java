package alpha.waypoint.pipeline;

import java.util.ArrayList;
import java.util.List;

/**
 * An ordered list of pipeline handles, attached to a route.<p>
 * 
 * The pipelines of the chain run in order; all middleware of the first
 * pipeline, then all middleware of the second, and so forth, before the route
 * handler.<p>
 * 
 * Instances are immutable.
 * 
 * @param <L> lineage of the pipeline set
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class PipelineChain<L>
{
    private static final PipelineChain<?> EMPTY = new PipelineChain<>(List.of());
    
    /**
     * Returns an empty chain.
     * 
     * @param <L> lineage of the pipeline set
     * @return an empty chain
     */
    @SuppressWarnings("unchecked")
    public static <L> PipelineChain<L> empty() {
        return (PipelineChain<L>) EMPTY;
    }
    
    /**
     * Returns a chain of the given handles.
     * 
     * @param handles in order of execution
     * @param <L> lineage of the pipeline set
     * 
     * @return a chain
     * 
     * @throws NullPointerException if an argument is {@code null}
     */
    @SafeVarargs
    public static <L> PipelineChain<L> of(PipelineHandle<L>... handles) {
        return new PipelineChain<>(List.of(handles));
    }
    
    private final List<PipelineHandle<L>> handles;
    
    private PipelineChain(List<PipelineHandle<L>> handles) {
        this.handles = handles;
    }
    
    /**
     * Returns a chain of the handles of this chain followed by those of the
     * given chain.
     * 
     * @param other chain
     * @return a concatenated chain
     * @throws NullPointerException if {@code other} is {@code null}
     */
    public PipelineChain<L> concat(PipelineChain<L> other) {
        if (other.handles.isEmpty()) {
            return this;
        }
        if (handles.isEmpty()) {
            return other;
        }
        var l = new ArrayList<>(handles);
        l.addAll(other.handles);
        return new PipelineChain<>(List.copyOf(l));
    }
    
    /**
     * Returns the handles.
     * 
     * @return an unmodifiable list, in order of execution
     */
    public List<PipelineHandle<L>> handles() {
        return handles;
    }
    
    /**
     * Returns {@code true} if the chain is empty.
     * 
     * @return see JavaDoc
     */
    public boolean isEmpty() {
        return handles.isEmpty();
    }
    
    @Override
    public boolean equals(Object obj) {
        return obj instanceof PipelineChain<?> other && handles.equals(other.handles);
    }
    
    @Override
    public int hashCode() {
        return handles.hashCode();
    }
    
    @Override
    public String toString() {
        return "PipelineChain" + handles;
    }
}
