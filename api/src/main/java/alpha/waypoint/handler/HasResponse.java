package alpha.waypoint.handler;

import alpha.waypoint.message.Response;
import alpha.waypoint.message.Responses;

/**
 * An exception that knows which response it should produce.<p>
 * 
 * The response is advisory; an exception handler may return something else.
 * Only exceptions are expected to implement this interface.<p>
 * 
 * The {@linkplain ExceptionHandler#BASE base exception handler}, if given an
 * exception that implements {@code HasResponse}, returns the response
 * provided. The library's exceptions that implement this interface are:
 * 
 * <ul>
 *   <li>{@link alpha.waypoint.route.NoRouteFoundException} (404)</li>
 *   <li>{@link alpha.waypoint.route.MethodNotAllowedException} (405)</li>
 *   <li>{@link alpha.waypoint.route.MalformedPathException} (400)</li>
 *   <li>{@link alpha.waypoint.extract.ExtractionException} (400, or what
 *       the failed extractor says)</li>
 * </ul>
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface HasResponse {
    /**
     * Returns an advisory, fallback response for the exception handler.<p>
     * 
     * The exception class should never return a response indicating success.
     * The base handler responds {@link Responses#teapot()}, if the response
     * returned from this method has a status code which is not in the 3XX
     * (Redirection), 4XX (Client Error), nor 5XX (Server Error) series.
     * 
     * @apiNote
     * The "get" prefix is to be consistent with {@code Throwable}'s API design.
     * 
     * @return an advisory fallback response (never {@code null})
     */
    Response getResponse();
}
