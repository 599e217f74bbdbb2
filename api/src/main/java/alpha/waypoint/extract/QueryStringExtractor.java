package alpha.waypoint.extract;

import alpha.waypoint.message.QueryParameters;
import alpha.waypoint.message.Response;
import alpha.waypoint.message.Responses;

import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Converts the query parameters of a request into a typed value.<p>
 * 
 * Works the same as {@link PathExtractor}; the dispatcher runs the path
 * extractor first, then the query string extractor. For a record, a
 * multi-valued query parameter binds to a component of type {@code List}.
 * 
 * <pre>{@code
 *   record Paging(Optional<Integer> page, List<String> tag) {}
 *   
 *   router.get("/products")
 *         .withQueryStringExtractor(QueryStringExtractor.intoRecord(Paging.class))
 *         .to(listProducts);
 * }</pre>
 * 
 * @param <T> type of extracted value
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface QueryStringExtractor<T>
{
    /**
     * Returns an extractor of the query parameters as-is.<p>
     * 
     * This is the extractor of a route which does not specify one.
     * 
     * @return an extractor of the query parameters as-is
     */
    static QueryStringExtractor<QueryParameters> none() {
        return of(QueryParameters.class, q -> q);
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
    static <T> QueryStringExtractor<T> of(
            Class<T> type,
            Conversion<? super QueryParameters, ? extends T> function) {
        requireNonNull(type);
        requireNonNull(function);
        return new QueryStringExtractor<>() {
            @Override
            public Class<T> type() {
                return type;
            }
            @Override
            public T extract(QueryParameters params) throws Exception {
                return function.apply(params);
            }
        };
    }
    
    /**
     * Returns an extractor which binds the query parameters to the components
     * of a record, by name.
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
     * 
     * @see PathExtractor#intoRecord(Class)
     */
    static <R extends Record> QueryStringExtractor<R> intoRecord(Class<R> type) {
        var binder = RecordBinder.of(type);
        return of(type, q -> binder.bind(q::all));
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
     * @param params of the request
     * @return the value (must not be {@code null})
     * @throws Exception if extraction fails
     */
    T extract(QueryParameters params) throws Exception;
    
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
    default QueryStringExtractor<T> onFailureRespond(Function<? super Exception, ? extends Response> response) {
        requireNonNull(response);
        var self = this;
        return new QueryStringExtractor<>() {
            @Override
            public Class<T> type() {
                return self.type();
            }
            @Override
            public T extract(QueryParameters params) throws Exception {
                return self.extract(params);
            }
            @Override
            public Response onFailure(Exception cause) {
                return response.apply(cause);
            }
        };
    }
}
