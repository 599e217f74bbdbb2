package alpha.waypoint.store;

/**
 * A witness of a slot in a {@link Store}.<p>
 * 
 * A handle is only issued by {@link Store.Builder#add(Object)}, and it is
 * redeemed against the store built by that builder, or any descendant thereof,
 * using {@link Store#get(Handle)}. No other code can produce a handle.<p>
 * 
 * The type parameter {@code L} is the store's lineage. It has no runtime
 * representation, and is commonly an application-declared marker type, e.g.
 * {@code enum Middlewares {}}. A handle of one lineage does not compile
 * against a store of another lineage. Two stores of the same declared lineage
 * are told apart at runtime; redeeming the handle of one against the other
 * throws {@link ForeignHandleException}.<p>
 * 
 * Handles are immutable, thread-safe, and compared by identity.
 * 
 * @param <L> the lineage of the store
 * @param <T> the type of the stored value
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Handle<L, T>
{
    private final Store.Generation issuer;
    private final int slot;
    
    Handle(Store.Generation issuer, int slot) {
        this.issuer = issuer;
        this.slot = slot;
    }
    
    Store.Generation issuer() {
        return issuer;
    }
    
    int slot() {
        return slot;
    }
    
    @Override
    public String toString() {
        return "Handle{slot=" + slot + '}';
    }
}
