package alpha.waypoint.extract;

import alpha.waypoint.message.Response;
import alpha.waypoint.message.Responses;
import alpha.waypoint.route.PathParameters;

import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Converts the path parameters of a matched route into a typed value.<p>
 * 
 * The dispatcher runs the extractor before any middleware, and puts the
 * value in the request state keyed by {@link #type()}. If the extractor throws
 * an exception, the request is answered with {@link #onFailure(Exception)}
 * ("400 Bad Request" by default), and the route's middleware never run.
 * 
 * <pre>{@code
 *   record ProductPath(long id) {}
 *   
 *   router.get("/products/:id")
 *         .withPathExtractor(PathExtractor.intoRecord(ProductPath.class))
 *         .to(state -> {
 *             long id = state.borrow(ProductPath.class).id();
 *             ...
 *         });
 * }</pre>
 * 
 * The extractor must be thread-safe.
 * 
 * @param <T> type of extracted value
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface PathExtractor<T>
{
    /**
     * Returns an extractor of the path parameters as-is.<p>
     * 
     * This is the extractor of a route which does not specify one.
     * 
     * @return an extractor of the path parameters as-is
     */
    static PathExtractor<PathParameters> none() {
        return of(PathParameters.class, p -> p);
    }
    
    /**
     * Returns an extractor of the given function.
     * 
     * @param type of value
     * @param function conversion
     * @param <T> type of value
     * 
     * @return an extractor
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    static <T> PathExtractor<T> of(
            Class<T> type,
            Conversion<? super PathParameters, ? extends T> function) {
        requireNonNull(type);
        requireNonNull(function);
        return new PathExtractor<>() {
            @Override
            public Class<T> type() {
                return type;
            }
            @Override
            public T extract(PathParameters params) throws Exception {
                return function.apply(params);
            }
        };
    }
    
    /**
     * Returns an extractor which binds the path parameters to the components
     * of a record, by name.<p>
     * 
     * A component of type {@code String}, a primitive or its box,
     * {@code UUID}, or an enum, binds a single-segment parameter. A component
     * of type {@code List} of the same binds a catch-all parameter. A
     * component of type {@code Optional} of the same is optional; all others
     * are required.<p>
     * 
     * A missing required parameter, or a value that fails to convert, fails
     * the extraction.
     * 
     * @param type of record
     * @param <R> type of record
     * 
     * @return an extractor
     * 
     * @throws NullPointerException
     *             if {@code type} is {@code null}
     * @throws IllegalArgumentException
     *             if a component is of an unsupported type
     */
    static <R extends Record> PathExtractor<R> intoRecord(Class<R> type) {
        var binder = RecordBinder.of(type);
        return of(type, p -> binder.bind(p::values));
    }
    
    /**
     * Returns the type of the extracted value.
     * 
     * @return the type of the extracted value
     */
    Class<T> type();
    
    /**
     * Extracts the value.
     * 
     * @param params of the matched route
     * @return the value (must not be {@code null})
     * @throws Exception if extraction fails
     */
    T extract(PathParameters params) throws Exception;
    
    /**
     * Returns the response of a failed extraction.<p>
     * 
     * The default implementation returns {@link Responses#badRequest()}.
     * 
     * @param cause of failure
     * @return the response of a failed extraction
     */
    default Response onFailure(Exception cause) {
        return Responses.badRequest();
    }
    
    /**
     * Returns an extractor that responds to a failure with the result of the
     * given function.
     * 
     * @param response factory
     * @return a new extractor
     * @throws NullPointerException if {@code response} is {@code null}
     */
    default PathExtractor<T> onFailureRespond(Function<? super Exception, ? extends Response> response) {
        requireNonNull(response);
        var self = this;
        return new PathExtractor<>() {
            @Override
            public Class<T> type() {
                return self.type();
            }
            @Override
            public T extract(PathParameters params) throws Exception {
                return self.extract(params);
            }
            @Override
            public Response onFailure(Exception cause) {
                return response.apply(cause);
            }
        };
    }
}
