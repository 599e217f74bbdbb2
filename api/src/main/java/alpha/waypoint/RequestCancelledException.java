package alpha.waypoint;

import java.io.Serial;
import java.util.concurrent.CancellationException;

/**
 * Thrown by the dispatcher if the request was cancelled.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * 
 * @see Cancellation
 */
public final class RequestCancelledException extends CancellationException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs this object.
     * 
     * @param when a description of the point in processing
     */
    public RequestCancelledException(String when) {
        super("Request cancelled " + when + ".");
    }
}
