package alpha.waypoint.store;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link Store}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class StoreTest
{
    enum App {}
    
    @Test
    void happyPath() {
        Store.Builder<App> b = Store.builder();
        Handle<App, String> s = b.add("hello");
        Handle<App, Integer> i = b.add(123);
        var store = b.build();
        String str = store.get(s);
        int num = store.get(i);
        assertThat(str).isEqualTo("hello");
        assertThat(num).isEqualTo(123);
        assertThat(store.size()).isEqualTo(2);
    }
    
    @Test
    void builderIsSpent() {
        Store.Builder<App> b = Store.builder();
        b.build();
        assertThatThrownBy(() -> b.add("x"))
            .isExactlyInstanceOf(IllegalStateException.class)
            .hasMessage("Store already built.");
        assertThatThrownBy(b::build)
            .isExactlyInstanceOf(IllegalStateException.class);
    }
    
    @Test
    void nullValue() {
        assertThatThrownBy(() -> Store.<App>builder().add(null))
            .isExactlyInstanceOf(NullPointerException.class);
    }
    
    @Test
    void foreignHandle_otherStoreOfSameLineage() {
        Store.Builder<App> b1 = Store.builder(),
                           b2 = Store.builder();
        var h = b1.add("one");
        b2.add("two");
        var s2 = b2.build();
        assertThat(s2.owns(h)).isFalse();
        assertThatThrownBy(() -> s2.get(h))
            .isExactlyInstanceOf(ForeignHandleException.class);
    }
    
    @Test
    void descendant_acceptsAncestorHandles() {
        Store.Builder<App> b = Store.builder();
        var a = b.add("a");
        var parent = b.build();
        var child = parent.toBuilder();
        var c = child.add("c");
        assertThat(child.size()).isEqualTo(2);
        var store = child.build();
        assertThat(store.get(a)).isEqualTo("a");
        assertThat(store.get(c)).isEqualTo("c");
        // But not the other way around
        assertThat(parent.owns(c)).isFalse();
        assertThatThrownBy(() -> parent.get(c))
            .isExactlyInstanceOf(ForeignHandleException.class);
    }
    
    @Test
    void siblingDescendants_rejectEachOther() {
        var parent = Store.<App>builder().build();
        var left = parent.toBuilder();
        var right = parent.toBuilder();
        var l = left.add("left");
        right.add("right");
        var r = right.build();
        assertThat(r.owns(l)).isFalse();
    }
    
    @Test
    void handleToString() {
        Store.Builder<App> b = Store.builder();
        b.add("a");
        assertThat(b.add("b")).hasToString("Handle{slot=1}");
    }
}
