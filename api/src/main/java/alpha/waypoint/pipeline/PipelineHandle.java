package alpha.waypoint.pipeline;

import alpha.waypoint.store.Handle;

import static java.util.Objects.requireNonNull;

/**
 * A handle of a {@link Pipeline} in a {@link PipelineSet}.
 * 
 * @param slot the handle of the pipeline set's underlying store
 * @param <L> lineage of the pipeline set
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public record PipelineHandle<L>(Handle<L, Pipeline> slot)
{
    /**
     * Constructs this object.
     * 
     * @param slot the handle of the pipeline set's underlying store
     * @throws NullPointerException if {@code slot} is {@code null}
     */
    public PipelineHandle {
        requireNonNull(slot);
    }
}
