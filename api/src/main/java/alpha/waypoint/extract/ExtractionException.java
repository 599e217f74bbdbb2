package alpha.waypoint.extract;

import alpha.waypoint.handler.HasResponse;
import alpha.waypoint.message.Response;

import java.io.Serial;

import static java.util.Objects.requireNonNull;

/**
 * Thrown by the dispatcher if an extractor of the matched route failed.<p>
 * 
 * The response is that of the failed extractor's {@code onFailure} method,
 * which by default is "400 Bad Request". No middleware of the route has run
 * when this exception is thrown.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * 
 * @see PathExtractor#onFailure(Exception)
 * @see QueryStringExtractor#onFailure(Exception)
 */
public final class ExtractionException extends RuntimeException implements HasResponse
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    private final transient Response response;
    
    /**
     * Constructs this object.
     * 
     * @param message detail
     * @param cause the extractor's failure
     * @param response advisory response
     * @throws NullPointerException if {@code response} is {@code null}
     */
    public ExtractionException(String message, Throwable cause, Response response) {
        super(message, cause);
        this.response = requireNonNull(response);
    }
    
    /**
     * Returns the response of the failed extractor.
     * 
     * @return the response of the failed extractor
     */
    @Override
    public Response getResponse() {
        return response;
    }
}
