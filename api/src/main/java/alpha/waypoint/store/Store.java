package alpha.waypoint.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An add-only, heterogeneous, and frozen container of values.<p>
 * 
 * A store is built once using a {@link Builder}. Each value added to the
 * builder yields a {@link Handle}, typed with the value's static type. The
 * built store then serves the value of any such handle, with no casts and no
 * lookup failure; the only way to obtain a handle is to add a value.
 * 
 * <pre>{@code
 *   enum Demo {}
 *   
 *   Store.Builder<Demo> b = Store.builder();
 *   Handle<Demo, String> greeting = b.add("Hello");
 *   Handle<Demo, Integer> answer  = b.add(42);
 *   Store<Demo> store = b.build();
 *   
 *   String s = store.get(greeting);
 *   int i    = store.get(answer);
 * }</pre>
 * 
 * A built store never changes. To add more values, {@link #toBuilder()}
 * creates a builder of a descendant store, populated with all values of this
 * store. Handles of the ancestor remain valid in the descendant, but not the
 * other way around.<p>
 * 
 * The store is thread-safe, and reads are lock-free.
 * 
 * @param <L> lineage; a type which names the family of stores
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Store<L>
{
    /**
     * Returns a new builder of an empty store.
     * 
     * @param <L> lineage of the store
     * @return a new builder
     */
    public static <L> Builder<L> builder() {
        return new Builder<>(new Generation(null), List.of());
    }
    
    private final Generation gen;
    private final Object[] slots;
    
    private Store(Generation gen, Object[] slots) {
        this.gen = gen;
        this.slots = slots;
    }
    
    /**
     * Returns the value of the given handle.<p>
     * 
     * The check which rejects a foreign handle walks the lineage back to the
     * handle's issuer, and so is constant for a store without descendants.
     * 
     * @param handle a handle issued by this store, or an ancestor
     * @param <T> value type
     * 
     * @return the value (never {@code null})
     * 
     * @throws NullPointerException
     *             if {@code handle} is {@code null}
     * @throws ForeignHandleException
     *             if the handle was not issued by this store or an ancestor
     */
    public <T> T get(Handle<L, T> handle) {
        if (!owns(handle)) {
            throw new ForeignHandleException(handle);
        }
        @SuppressWarnings("unchecked")
        T t = (T) slots[handle.slot()];
        return t;
    }
    
    /**
     * Returns {@code true} if the given handle can be redeemed against this
     * store, otherwise {@code false}.
     * 
     * @param handle to test
     * @return see JavaDoc
     * @throws NullPointerException if {@code handle} is {@code null}
     */
    public boolean owns(Handle<L, ?> handle) {
        return gen.descendsFrom(handle.issuer()) && handle.slot() < slots.length;
    }
    
    /**
     * Returns the number of values in this store.
     * 
     * @return the number of values in this store
     */
    public int size() {
        return slots.length;
    }
    
    /**
     * Returns a builder of a descendant store.<p>
     * 
     * The builder starts out with all the values of this store.
     * 
     * @return a new builder
     */
    public Builder<L> toBuilder() {
        return new Builder<>(new Generation(gen), Arrays.asList(slots));
    }
    
    @Override
    public String toString() {
        return "Store{size=" + slots.length + '}';
    }
    
    /**
     * Builder of a {@link Store}.<p>
     * 
     * The builder is not thread-safe, and it can only be used to build one
     * store. After {@link #build()}, all methods throw
     * {@link IllegalStateException}.
     * 
     * @param <L> lineage of the store
     */
    public static final class Builder<L>
    {
        private final Generation gen;
        private final List<Object> slots;
        private boolean spent;
        
        private Builder(Generation gen, List<Object> init) {
            this.gen = gen;
            this.slots = new ArrayList<>(init);
        }
        
        /**
         * Adds a value.
         * 
         * @param value to add
         * @param <T> value type
         * 
         * @return a handle of the value
         * 
         * @throws NullPointerException
         *             if {@code value} is {@code null}
         * @throws IllegalStateException
         *             if the store has already been built
         */
        public <T> Handle<L, T> add(T value) {
            requireNonNull(value);
            requireNotSpent();
            slots.add(value);
            return new Handle<>(gen, slots.size() - 1);
        }
        
        /**
         * Returns the number of values added so far, including any values
         * inherited from an ancestor.
         * 
         * @return see JavaDoc
         * @throws IllegalStateException if the store has already been built
         */
        public int size() {
            requireNotSpent();
            return slots.size();
        }
        
        /**
         * Builds the store.
         * 
         * @return a frozen store
         * @throws IllegalStateException if the store has already been built
         */
        public Store<L> build() {
            requireNotSpent();
            spent = true;
            return new Store<>(gen, slots.toArray());
        }
        
        private void requireNotSpent() {
            if (spent) {
                throw new IllegalStateException("Store already built.");
            }
        }
    }
    
    /**
     * Identity of a builder; each handle references the generation that
     * issued it.
     */
    static final class Generation {
        private final Generation parent;
        private final int depth;
        
        Generation(Generation parent) {
            this.parent = parent;
            this.depth = parent == null ? 0 : parent.depth + 1;
        }
        
        boolean descendsFrom(Generation other) {
            Generation g = this;
            while (g != null && g.depth >= other.depth) {
                if (g == other) {
                    return true;
                }
                g = g.parent;
            }
            return false;
        }
    }
}
