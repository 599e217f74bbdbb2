package alpha.waypoint.handler;

import alpha.waypoint.NonThrowingChain;
import alpha.waypoint.message.Response;
import alpha.waypoint.state.RequestId;
import alpha.waypoint.state.RequestState;

import java.util.List;

import static java.lang.System.Logger.Level.WARNING;

/**
 * Runs exception handlers, in order.<p>
 * 
 * A chain is either terminated by {@link ExceptionHandler#BASE}, in which case
 * it always produces a response, or open-ended, in which case
 * {@link #handle(Exception, RequestState)} returns {@code null} if all
 * handlers yielded.<p>
 * 
 * A handler that throws an exception, or returns {@code null}, is logged and
 * skipped; the next handler is given the original exception.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class ExceptionHandlerChain
{
    private static final System.Logger LOG
            = System.getLogger(ExceptionHandlerChain.class.getPackageName());
    
    /**
     * Returns a chain terminated by {@link ExceptionHandler#BASE}.
     * 
     * @param handlers application handlers
     * @return a chain
     * @throws NullPointerException if {@code handlers} or an element is {@code null}
     */
    public static ExceptionHandlerChain withBase(List<ExceptionHandler> handlers) {
        return new ExceptionHandlerChain(List.copyOf(handlers), ExceptionHandler.BASE);
    }
    
    /**
     * Returns an open-ended chain.
     * 
     * @param handlers application handlers
     * @return a chain
     * @throws NullPointerException if {@code handlers} or an element is {@code null}
     */
    public static ExceptionHandlerChain open(List<ExceptionHandler> handlers) {
        return new ExceptionHandlerChain(List.copyOf(handlers), null);
    }
    
    private final List<ExceptionHandler> handlers;
    private final ExceptionHandler last;
    
    private ExceptionHandlerChain(List<ExceptionHandler> handlers, ExceptionHandler last) {
        this.handlers = handlers;
        this.last = last;
    }
    
    /**
     * Produces a response of the given exception.
     * 
     * @param exc to handle
     * @param state of request
     * 
     * @return the response, or {@code null} if the chain is open-ended and
     *         no handler produced a response
     */
    public Response handle(Exception exc, RequestState state) {
        return call(0, exc, state);
    }
    
    private Response call(int i, Exception exc, RequestState state) {
        if (i == handlers.size()) {
            return last == null ? null : last.apply(exc, null, state);
        }
        var next = new Link(i + 1, exc, state);
        Response rsp;
        try {
            rsp = handlers.get(i).apply(exc, next, state);
        } catch (RuntimeException e) {
            LOG.log(WARNING, () -> prefix(state) +
                    "Exception handler failed, trying the next one.", e);
            return next.called ? next.result : call(i + 1, exc, state);
        }
        if (rsp == null) {
            LOG.log(WARNING, () -> prefix(state) +
                    "Exception handler returned null, trying the next one.");
            return next.called ? next.result : call(i + 1, exc, state);
        }
        return rsp;
    }
    
    private static String prefix(RequestState state) {
        return state.tryBorrow(RequestId.class)
                    .map(id -> "[" + id + "] ")
                    .orElse("");
    }
    
    private final class Link implements NonThrowingChain {
        private final int index;
        private final Exception exc;
        private final RequestState state;
        private boolean called;
        private Response result;
        
        Link(int index, Exception exc, RequestState state) {
            this.index = index;
            this.exc = exc;
            this.state = state;
        }
        
        @Override
        public Response proceed() {
            if (called) {
                throw new UnsupportedOperationException(
                        "Exception handler chain already proceeded.");
            }
            called = true;
            return result = call(index, exc, state);
        }
    }
}
