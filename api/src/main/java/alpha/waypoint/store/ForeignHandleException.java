package alpha.waypoint.store;

import java.io.Serial;

/**
 * Thrown by {@link Store#get(Handle)} if the handle was not issued by the
 * store, nor by one of its ancestors.<p>
 * 
 * The compiler rejects handles of a different lineage type. This exception
 * covers the remaining case; two stores declared with the same lineage type.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class ForeignHandleException extends IllegalArgumentException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs this object.
     * 
     * @param handle the foreign handle
     */
    public ForeignHandleException(Handle<?, ?> handle) {
        super(handle + " was not issued by this store or any of its ancestors.");
    }
}
