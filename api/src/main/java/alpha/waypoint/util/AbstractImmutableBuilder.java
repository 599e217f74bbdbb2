package alpha.waypoint.util;

import java.util.function.Consumer;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Base class of a builder where each setter returns a new builder.<p>
 * 
 * A builder instance holds one setter call, as a modifier of a mutable state,
 * and a link to the builder it was derived from. Many builders may derive from
 * the same one; they share the common part of the link.
 * {@link #constructState(Supplier)} creates a fresh state and applies the
 * modifiers from the root onwards, so a later setter overrides an earlier
 * one.<p>
 * 
 * Extended by the builders of {@link alpha.waypoint.Config} and
 * {@link alpha.waypoint.message.Response}.
 * 
 * @param <S> type of mutable state
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public abstract class AbstractImmutableBuilder<S>
{
    private final AbstractImmutableBuilder<S> parent;
    private final Consumer<? super S> step;
    private final int depth;
    
    /**
     * Creates a root, holding no modifier.
     */
    protected AbstractImmutableBuilder() {
        parent = null;
        step = null;
        depth = 0;
    }
    
    /**
     * Creates a builder derived from {@code parent}.
     * 
     * @param parent builder
     * @param step modifier of state
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    protected AbstractImmutableBuilder(AbstractImmutableBuilder<S> parent, Consumer<? super S> step) {
        this.parent = requireNonNull(parent);
        this.step = requireNonNull(step);
        this.depth = parent.depth + 1;
    }
    
    /**
     * Returns a new state, modified by all setter calls leading up to this
     * builder.
     * 
     * @param factory of an unmodified state
     * 
     * @return the modified state
     */
    protected final S constructState(Supplier<? extends S> factory) {
        @SuppressWarnings("unchecked")
        Consumer<? super S>[] steps = new Consumer[depth];
        var b = this;
        for (int i = depth - 1; i >= 0; --i, b = b.parent) {
            steps[i] = b.step;
        }
        S s = factory.get();
        for (var m : steps) {
            m.accept(s);
        }
        return s;
    }
}
