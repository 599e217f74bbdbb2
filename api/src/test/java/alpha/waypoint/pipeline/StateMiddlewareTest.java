package alpha.waypoint.pipeline;

import alpha.waypoint.message.Response;
import alpha.waypoint.message.Responses;
import alpha.waypoint.state.RequestState;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link StateMiddleware}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class StateMiddlewareTest
{
    interface Repo {}
    
    record Greeting(String text) {}
    
    private final RequestState state = new RequestState();
    
    @Test
    void putBeforeProceeding() throws Exception {
        Repo repo = new Repo() {};
        var testee = StateMiddleware.of(Repo.class, repo);
        Response rsp = testee.apply(state, () -> {
            assertThat(state.borrow(Repo.class)).isSameAs(repo);
            return Responses.noContent();
        });
        assertThat(rsp).isSameAs(Responses.noContent());
    }
    
    @Test
    void keyedByRuntimeClass() throws Exception {
        var testee = StateMiddleware.of(new Greeting("hi"));
        assertThat(testee.type()).isEqualTo(Greeting.class);
        testee.apply(state, Responses::ok);
        assertThat(state.borrow(Greeting.class).text()).isEqualTo("hi");
    }
    
    @Test
    void replacesPresentValue() throws Exception {
        state.put(new Greeting("old"));
        StateMiddleware.of(new Greeting("new")).apply(state, Responses::ok);
        assertThat(state.borrow(Greeting.class).text()).isEqualTo("new");
    }
    
    @Test
    void supplierCalledPerRequest() throws Exception {
        var n = new AtomicInteger();
        var testee = StateMiddleware.supplying(Integer.class, n::incrementAndGet);
        testee.apply(state, Responses::ok);
        var other = new RequestState();
        testee.apply(other, Responses::ok);
        assertThat(state.borrow(Integer.class)).isEqualTo(1);
        assertThat(other.borrow(Integer.class)).isEqualTo(2);
    }
    
    @Test
    void supplierReturnsNull_chainNotCalled() {
        var testee = StateMiddleware.supplying(Greeting.class, () -> null);
        assertThatThrownBy(() -> testee.apply(state, () -> {
                throw new AssertionError("Not called");
            }))
            .isExactlyInstanceOf(NullPointerException.class);
        assertThat(state.has(Greeting.class)).isFalse();
    }
    
    @Test
    void nullArguments() {
        assertThatThrownBy(() -> StateMiddleware.of(Greeting.class, null))
            .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> StateMiddleware.supplying(null, () -> "x"))
            .isExactlyInstanceOf(NullPointerException.class);
    }
}
