package alpha.waypoint.state;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;

/**
 * A per-request container of values keyed by their type.<p>
 * 
 * The container holds at most one value per type. The type is the exact class
 * given as key; {@link #put(Object)} uses the runtime class of the value. To
 * store a value under a supertype, use {@link #put(Class, Object)}.<p>
 * 
 * The dispatcher creates one state per request, and populates it with the
 * request, the request id, the parameters of the matched route, and the values
 * produced by the route's extractors. Middleware and the route handler then
 * read and write the state.
 * 
 * <pre>{@code
 *   Middleware counter = (state, chain) -> {
 *       state.put(new Visits(1));
 *       return chain.proceed();
 *   };
 *   RouteHandler handler = state -> {
 *       int n = state.borrow(Visits.class).count();
 *       return Responses.text("Visits: " + n);
 *   };
 * }</pre>
 * 
 * A state is owned by the request being processed, and it is not
 * thread-safe. A stage which hands work to another thread should give it a
 * {@link #copy()}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class RequestState
{
    private final Map<Class<?>, Object> values;
    
    /**
     * Creates an empty state.
     */
    public RequestState() {
        this(new HashMap<>());
    }
    
    private RequestState(Map<Class<?>, Object> values) {
        this.values = values;
    }
    
    /**
     * Puts a value, replacing any present value of the type.
     * 
     * @param type of value
     * @param value to put
     * @param <T> type of value
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     */
    public <T> RequestState put(Class<T> type, T value) {
        values.put(requireNonNull(type), requireNonNull(value));
        return this;
    }
    
    /**
     * Puts a value keyed by its runtime class, replacing any present value of
     * the class.
     * 
     * @param value to put
     * @param <T> type of value
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if {@code value} is {@code null}
     */
    public <T> RequestState put(T value) {
        values.put(value.getClass(), value);
        return this;
    }
    
    /**
     * Returns {@code true} if a value of the given type is present.
     * 
     * @param type of value
     * @return see JavaDoc
     */
    public boolean has(Class<?> type) {
        return values.containsKey(type);
    }
    
    /**
     * Returns the value of the given type.
     * 
     * @param type of value
     * @param <T> type of value
     * 
     * @return the value (never {@code null})
     * 
     * @throws StateValueAbsentException
     *             if no value of the type is present
     */
    public <T> T borrow(Class<T> type) {
        return tryBorrow(type).orElseThrow(() ->
                new StateValueAbsentException(type));
    }
    
    /**
     * Returns the value of the given type, if present.
     * 
     * @param type of value
     * @param <T> type of value
     * 
     * @return the value, if present
     */
    public <T> Optional<T> tryBorrow(Class<T> type) {
        return Optional.ofNullable(type.cast(values.get(type)));
    }
    
    /**
     * Replaces the value of the given type with the result of the given
     * function.<p>
     * 
     * The function is given the present value, and must return a non-null
     * value. For a mutable value type, the function may just as well mutate
     * and return its argument.
     * 
     * @param type of value
     * @param mutator of value
     * @param <T> type of value
     * 
     * @return the new value
     * 
     * @throws StateValueAbsentException
     *             if no value of the type is present
     * @throws NullPointerException
     *             if {@code mutator} returns {@code null}
     */
    public <T> T borrowMut(Class<T> type, UnaryOperator<T> mutator) {
        T t = requireNonNull(mutator.apply(borrow(type)));
        values.put(type, t);
        return t;
    }
    
    /**
     * Removes and returns the value of the given type.
     * 
     * @param type of value
     * @param <T> type of value
     * 
     * @return the value (never {@code null})
     * 
     * @throws StateValueAbsentException
     *             if no value of the type is present
     */
    public <T> T take(Class<T> type) {
        return tryTake(type).orElseThrow(() ->
                new StateValueAbsentException(type));
    }
    
    /**
     * Removes and returns the value of the given type, if present.
     * 
     * @param type of value
     * @param <T> type of value
     * 
     * @return the value, if present
     */
    public <T> Optional<T> tryTake(Class<T> type) {
        return Optional.ofNullable(type.cast(values.remove(type)));
    }
    
    /**
     * Returns a shallow copy of this state.<p>
     * 
     * The copy is independently owned; changes to one does not affect the
     * other. The values themselves are not copied.
     * 
     * @return a shallow copy of this state
     */
    public RequestState copy() {
        return new RequestState(new HashMap<>(values));
    }
    
    /**
     * Returns the types of all present values.
     * 
     * @return an unmodifiable view of the types of all present values
     */
    public Set<Class<?>> types() {
        return unmodifiableSet(values.keySet());
    }
    
    @Override
    public String toString() {
        return "RequestState" + values.keySet();
    }
}
