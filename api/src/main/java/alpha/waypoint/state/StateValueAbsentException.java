package alpha.waypoint.state;

import java.io.Serial;

/**
 * Thrown by {@link RequestState} if a value of the requested type is absent.<p>
 * 
 * The dispatcher responds "500 Internal Server Error" for this exception,
 * because it signals a mismatch between what a stage expects, and what
 * earlier stages provided; a programming error.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class StateValueAbsentException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    private final transient Class<?> type;
    
    /**
     * Constructs this object.
     * 
     * @param type of absent value
     */
    public StateValueAbsentException(Class<?> type) {
        super("No value of type " + type.getName() + " in request state.");
        this.type = type;
    }
    
    /**
     * Returns the type of the absent value.
     * 
     * @return the type of the absent value
     */
    public Class<?> type() {
        return type;
    }
}
