package alpha.waypoint.route;

import alpha.waypoint.handler.HasResponse;
import alpha.waypoint.message.Response;

import java.io.Serial;

import static alpha.waypoint.message.Responses.badRequest;

/**
 * Thrown by {@link Router#match(String, String)} if a path segment has a
 * malformed percent-escape.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class MalformedPathException extends RuntimeException implements HasResponse
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs this object.
     * 
     * @param path of request
     * @param cause from the decoder
     */
    public MalformedPathException(String path, IllegalArgumentException cause) {
        super("Malformed path \"" + path + "\".", cause);
    }
    
    /**
     * Returns {@link alpha.waypoint.message.Responses#badRequest()}.
     * 
     * @return see Javadoc
     */
    @Override
    public Response getResponse() {
        return badRequest();
    }
}
