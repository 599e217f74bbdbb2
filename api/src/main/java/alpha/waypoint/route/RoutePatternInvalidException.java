package alpha.waypoint.route;

import java.io.Serial;

/**
 * Thrown when a route pattern is syntactically invalid.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * 
 * @see RoutePattern
 */
public final class RoutePatternInvalidException extends IllegalArgumentException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    private final String pattern;
    
    /**
     * Constructs this object.
     * 
     * @param pattern the invalid pattern
     * @param reason what is wrong
     */
    public RoutePatternInvalidException(String pattern, String reason) {
        this(pattern, reason, null);
    }
    
    /**
     * Constructs this object.
     * 
     * @param pattern the invalid pattern
     * @param reason what is wrong
     * @param cause the cause
     */
    public RoutePatternInvalidException(String pattern, String reason, Throwable cause) {
        super("Invalid route pattern \"" + pattern + "\": " + reason, cause);
        this.pattern = pattern;
    }
    
    /**
     * Returns the invalid pattern.
     * 
     * @return the invalid pattern
     */
    public String pattern() {
        return pattern;
    }
}
