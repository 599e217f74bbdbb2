package alpha.waypoint.pipeline;

import alpha.waypoint.RequestCancelledException;
import alpha.waypoint.message.Response;
import alpha.waypoint.message.Responses;
import alpha.waypoint.state.RequestState;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link FaultBoundary}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class FaultBoundaryTest
{
    private final RequestState state = new RequestState();
    
    @Test
    void passThrough() throws Exception {
        var testee = FaultBoundary.of((exc, ch, st) -> Responses.teapot());
        Response rsp = testee.apply(state, Responses::ok);
        assertThat(rsp).isSameAs(Responses.ok());
    }
    
    @Test
    void handled() throws Exception {
        var testee = FaultBoundary.of(
            (exc, ch, st) -> exc instanceof IOException ?
                    Responses.serviceUnavailable() : ch.proceed());
        Response rsp = testee.apply(state, () -> { throw new IOException(); });
        assertThat(rsp).isSameAs(Responses.serviceUnavailable());
    }
    
    @Test
    void secondHandler() throws Exception {
        var testee = FaultBoundary.of(
            (exc, ch, st) -> ch.proceed(),
            (exc, ch, st) -> Responses.forbidden());
        Response rsp = testee.apply(state, () -> { throw new IllegalStateException(); });
        assertThat(rsp).isSameAs(Responses.forbidden());
    }
    
    @Test
    void allYield_propagates() {
        var testee = FaultBoundary.of((exc, ch, st) -> ch.proceed());
        var exc = new IOException("boom");
        assertThatThrownBy(() -> testee.apply(state, () -> { throw exc; }))
            .isSameAs(exc);
    }
    
    @Test
    void cancellationIsNeverHandled() {
        var testee = FaultBoundary.of((exc, ch, st) -> Responses.ok());
        var exc = new RequestCancelledException("during test");
        assertThatThrownBy(() -> testee.apply(state, () -> { throw exc; }))
            .isSameAs(exc);
    }
    
    @Test
    void interruptIsNeverHandled() {
        var testee = FaultBoundary.of((exc, ch, st) -> Responses.ok());
        try {
            assertThatThrownBy(() -> testee.apply(state, () -> {
                    throw new InterruptedException(); }))
                .isExactlyInstanceOf(InterruptedException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            // Clear flag
            Thread.interrupted();
        }
    }
}
