package alpha.waypoint;

/**
 * A cooperative cancellation signal of a request.<p>
 * 
 * The dispatcher polls the signal before and after each stage of the
 * processing chain. Once cancelled, no further stage is entered, finalizers
 * run best-effort, and the dispatch ends with a
 * {@link RequestCancelledException}.<p>
 * 
 * Interrupting the dispatching thread has the same effect.<p>
 * 
 * This class is thread-safe; a request is typically cancelled by another
 * thread than the one dispatching.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Cancellation
{
    /**
     * Creates a new, un-cancelled signal.
     * 
     * @return a new signal
     */
    public static Cancellation create() {
        return new Cancellation();
    }
    
    private volatile boolean cancelled;
    
    private Cancellation() {
        // Empty
    }
    
    /**
     * Cancels the request.<p>
     * 
     * This method is idempotent.
     */
    public void cancel() {
        cancelled = true;
    }
    
    /**
     * Returns whether the request has been cancelled.
     * 
     * @return see JavaDoc
     */
    public boolean isCancelled() {
        return cancelled;
    }
    
    /**
     * Throws {@link RequestCancelledException}, if the request is cancelled or
     * the current thread is interrupted.<p>
     * 
     * The interrupt flag is left untouched.
     * 
     * @param when a description of the point in processing
     * 
     * @throws RequestCancelledException
     *             if the request is cancelled, or the thread interrupted
     */
    public void throwIfCancelled(String when) {
        if (cancelled || Thread.currentThread().isInterrupted()) {
            throw new RequestCancelledException(when);
        }
    }
}
