package alpha.waypoint.core;

import alpha.waypoint.Cancellation;
import alpha.waypoint.Chain;
import alpha.waypoint.RequestCancelledException;
import alpha.waypoint.handler.RouteHandler;
import alpha.waypoint.message.Response;
import alpha.waypoint.message.Responses;
import alpha.waypoint.pipeline.Middleware;
import alpha.waypoint.state.RequestState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link MiddlewareChain}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class MiddlewareChainTest
{
    private final List<String> trace = new ArrayList<>();
    private final RequestState state = new RequestState();
    private final Cancellation cancellation = Cancellation.create();
    
    private Middleware around(String name) {
        return (s, chain) -> {
            trace.add(name + "-enter");
            Response r = chain.proceed();
            trace.add(name + "-exit");
            return r;
        };
    }
    
    private final RouteHandler handler = s -> {
        trace.add("H");
        return Responses.ok();
    };
    
    private Response run(List<Middleware> middleware, RouteHandler h) throws Exception {
        return new MiddlewareChain(middleware, h, state, cancellation, "").ignite();
    }
    
    @Test
    void onionOrder() throws Exception {
        var rsp = run(List.of(around("A"), around("B")), handler);
        assertThat(rsp).isSameAs(Responses.ok());
        assertThat(trace).containsExactly("A-enter", "B-enter", "H", "B-exit", "A-exit");
    }
    
    @Test
    void noMiddleware() throws Exception {
        assertThat(run(List.of(), handler)).isSameAs(Responses.ok());
        assertThat(trace).containsExactly("H");
    }
    
    @Test
    void shortCircuit() throws Exception {
        Middleware deny = (s, chain) -> {
            trace.add("B");
            return Responses.forbidden();
        };
        var rsp = run(List.of(around("A"), deny), handler);
        assertThat(rsp).isSameAs(Responses.forbidden());
        assertThat(trace).containsExactly("A-enter", "B", "A-exit");
    }
    
    @Test
    void middlewareReplacesResponse() throws Exception {
        Middleware tag = (s, chain) ->
            chain.proceed().toBuilder().setHeader("X-Tag", "1").build();
        var rsp = run(List.of(tag), handler);
        assertThat(rsp.header("X-Tag")).contains("1");
    }
    
    @Test
    void proceedTwice() {
        Middleware twice = (s, chain) -> {
            chain.proceed();
            return chain.proceed();
        };
        assertThatThrownBy(() -> run(List.of(twice), handler))
            .isExactlyInstanceOf(UnsupportedOperationException.class)
            .hasMessage("Chain.proceed() was already called");
        assertThat(trace).containsExactly("H");
    }
    
    @Test
    void proceedOutsideOfChain() throws Exception {
        var escaped = new AtomicReference<Chain>();
        Middleware leak = (s, chain) -> {
            escaped.set(chain);
            return Responses.noContent();
        };
        run(List.of(leak), handler);
        assertThatThrownBy(() -> escaped.get().proceed())
            .isExactlyInstanceOf(UnsupportedOperationException.class)
            .hasMessage("Chain.proceed() not called from within the processing chain");
        assertThat(trace).isEmpty();
    }
    
    @Test
    void nullResponse() {
        assertThatThrownBy(() -> run(List.of(around("A")), s -> null))
            .isExactlyInstanceOf(NullPointerException.class)
            .hasMessage("Response from route handler is null.");
        assertThat(trace).containsExactly("A-enter");
    }
    
    @Test
    void cancelledInStage_noFurtherStageEntered() {
        Middleware cancel = (s, chain) -> {
            trace.add("C");
            cancellation.cancel();
            return chain.proceed();
        };
        assertThatThrownBy(() -> run(List.of(around("A"), cancel), handler))
            .isExactlyInstanceOf(RequestCancelledException.class)
            .hasMessage("Request cancelled before route handler.");
        assertThat(trace).containsExactly("A-enter", "C");
    }
    
    @Test
    void cancelledAfterHandler() {
        RouteHandler h = s -> {
            trace.add("H");
            cancellation.cancel();
            return Responses.ok();
        };
        assertThatThrownBy(() -> run(List.of(around("A")), h))
            .isExactlyInstanceOf(RequestCancelledException.class)
            .hasMessage("Request cancelled after route handler.");
        assertThat(trace).containsExactly("A-enter", "H");
    }
}
