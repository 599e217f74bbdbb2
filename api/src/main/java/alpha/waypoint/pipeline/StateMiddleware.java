package alpha.waypoint.pipeline;

import alpha.waypoint.Chain;
import alpha.waypoint.message.Response;
import alpha.waypoint.state.RequestState;

import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * A middleware which puts a value into the request state, then proceeds.<p>
 * 
 * Useful for sharing a service, a repository or some other application object
 * with the middleware and route handlers that come after it.
 * 
 * <pre>{@code
 *   Pipeline app = Pipeline.of(
 *       StateMiddleware.of(UserRepository.class, repo),
 *       StateMiddleware.supplying(Clock.class, Clock::systemUTC));
 *   ...
 *   RouteHandler h = state -> {
 *       var users = state.borrow(UserRepository.class);
 *       ...
 *   };
 * }</pre>
 * 
 * A present value of the same type is replaced. The value is put for every
 * request, so a shared value must be thread-safe.
 * 
 * @param <T> type of value
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class StateMiddleware<T> implements Middleware
{
    /**
     * Returns a middleware which puts the given value.
     * 
     * @param type of value, the key
     * @param value to put
     * @param <T> type of value
     * 
     * @return a middleware
     * 
     * @throws NullPointerException if an argument is {@code null}
     */
    public static <T> StateMiddleware<T> of(Class<T> type, T value) {
        requireNonNull(value);
        return new StateMiddleware<>(type, () -> value);
    }
    
    /**
     * Returns a middleware which puts the given value keyed by its runtime
     * class.
     * 
     * @param value to put
     * @param <T> type of value
     * 
     * @return a middleware
     * 
     * @throws NullPointerException if {@code value} is {@code null}
     */
    @SuppressWarnings("unchecked")
    public static <T> StateMiddleware<T> of(T value) {
        return of((Class<T>) value.getClass(), value);
    }
    
    /**
     * Returns a middleware which puts a value from the given supplier.<p>
     * 
     * The supplier is called once per request.
     * 
     * @param type of value, the key
     * @param supplier of value
     * @param <T> type of value
     * 
     * @return a middleware
     * 
     * @throws NullPointerException if an argument is {@code null}
     */
    public static <T> StateMiddleware<T> supplying(Class<T> type, Supplier<? extends T> supplier) {
        return new StateMiddleware<>(type, supplier);
    }
    
    private final Class<T> type;
    private final Supplier<? extends T> supplier;
    
    private StateMiddleware(Class<T> type, Supplier<? extends T> supplier) {
        this.type = requireNonNull(type);
        this.supplier = requireNonNull(supplier);
    }
    
    /**
     * Returns the type of value.
     * 
     * @return the type of value
     */
    public Class<T> type() {
        return type;
    }
    
    /**
     * {@inheritDoc}
     * 
     * @throws NullPointerException
     *             if the supplier returns {@code null}
     */
    @Override
    public Response apply(RequestState state, Chain chain) throws Exception {
        state.put(type, supplier.get());
        return chain.proceed();
    }
    
    @Override
    public String toString() {
        return "StateMiddleware{type=" + type.getName() + "}";
    }
}
