package alpha.waypoint;

import alpha.waypoint.handler.ExceptionHandler;
import alpha.waypoint.message.Response;

/**
 * A {@link Chain} that does not throw {@code Exception}.<p>
 * 
 * Given to an {@link ExceptionHandler}, to yield control to the next handler
 * in the exception processing chain.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public interface NonThrowingChain extends Chain
{
    /**
     * Calls the next exception handler.
     * 
     * @return the response returned from the next exception handler
     * 
     * @throws UnsupportedOperationException
     *             if called more than once (by the same executing entity)
     */
    @Override
    Response proceed();
}
