package alpha.waypoint.extract;

/**
 * Converts route parameters into a typed value.<p>
 * 
 * Any exception thrown fails the extraction, which the dispatcher answers
 * with the extractor's failure response.
 * 
 * @param <P> type of parameters
 * @param <T> type of value
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * @see PathExtractor#of(Class, Conversion)
 * @see QueryStringExtractor#of(Class, Conversion)
 */
@FunctionalInterface
public interface Conversion<P, T>
{
    /**
     * Converts the parameters.
     * 
     * @param params to convert
     * @return the value (must not be {@code null})
     * @throws Exception if the parameters do not convert
     */
    T apply(P params) throws Exception;
}
