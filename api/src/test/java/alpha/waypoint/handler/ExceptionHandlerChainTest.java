package alpha.waypoint.handler;

import alpha.waypoint.message.Responses;
import alpha.waypoint.state.RequestState;
import alpha.waypoint.testutil.LogRecorder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static java.lang.System.Logger.Level.WARNING;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Small tests of {@link ExceptionHandlerChain}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class ExceptionHandlerChainTest
{
    private final RequestState state = new RequestState();
    private final Exception exc = new Exception("test");
    
    @Test
    void firstHandlerWins() {
        ExceptionHandler second = mock(ExceptionHandler.class);
        var testee = ExceptionHandlerChain.withBase(List.of(
                (e, ch, st) -> Responses.forbidden(), second));
        assertThat(testee.handle(exc, state)).isSameAs(Responses.forbidden());
        verifyNoInteractions(second);
    }
    
    @Test
    void handlersRunInOrder_thenBase() {
        List<String> seen = new ArrayList<>();
        var testee = ExceptionHandlerChain.withBase(List.of(
                (e, ch, st) -> { seen.add("a"); return ch.proceed(); },
                (e, ch, st) -> { seen.add("b"); return ch.proceed(); }));
        var logs = LogRecorder.startRecording(ExceptionHandler.class);
        try {
            assertThat(testee.handle(exc, state)).isSameAs(Responses.internalServerError());
        } finally {
            logs.stopRecording();
        }
        assertThat(seen).containsExactly("a", "b");
    }
    
    @Test
    void handlerMayReplaceResultOfNext() {
        var testee = ExceptionHandlerChain.withBase(List.of(
                (e, ch, st) -> ch.proceed().toBuilder().setHeader("X-Wrapped", "yes").build(),
                (e, ch, st) -> Responses.teapot()));
        var rsp = testee.handle(exc, state);
        assertThat(rsp.statusCode()).isEqualTo(418);
        assertThat(rsp.header("X-Wrapped")).contains("yes");
    }
    
    @Test
    void throwingHandlerIsSkipped() {
        ExceptionHandler next = mock(ExceptionHandler.class);
        when(next.apply(any(), any(), any())).thenReturn(Responses.noContent());
        var testee = ExceptionHandlerChain.withBase(List.of(
                (e, ch, st) -> { throw new IllegalStateException("bug"); }, next));
        var logs = LogRecorder.startRecording(ExceptionHandlerChain.class);
        try {
            assertThat(testee.handle(exc, state)).isSameAs(Responses.noContent());
            logs.assertRemove(WARNING, "Exception handler failed, trying the next one.",
                        IllegalStateException.class)
                .hasMessage("bug");
        } finally {
            logs.stopRecording();
        }
        verify(next).apply(any(), any(), any());
    }
    
    @Test
    void nullIsSkipped() {
        var testee = ExceptionHandlerChain.withBase(List.of(
                (e, ch, st) -> null,
                (e, ch, st) -> Responses.ok()));
        var logs = LogRecorder.startRecording(ExceptionHandlerChain.class);
        try {
            assertThat(testee.handle(exc, state)).isSameAs(Responses.ok());
            logs.assertRemove(WARNING, "Exception handler returned null");
        } finally {
            logs.stopRecording();
        }
    }
    
    @Test
    void open_fallsThrough() {
        var testee = ExceptionHandlerChain.open(List.of((e, ch, st) -> ch.proceed()));
        assertThat(testee.handle(exc, state)).isNull();
    }
    
    @Test
    void proceedTwice() {
        var testee = ExceptionHandlerChain.withBase(List.of(
                (e, ch, st) -> { ch.proceed(); return ch.proceed(); },
                (e, ch, st) -> Responses.ok()));
        var logs = LogRecorder.startRecording(ExceptionHandlerChain.class);
        try {
            // The failing handler is skipped, and the result of its first proceed is used
            assertThat(testee.handle(exc, state)).isSameAs(Responses.ok());
            logs.assertRemove(WARNING, "Exception handler failed", UnsupportedOperationException.class)
                .hasMessage("Exception handler chain already proceeded.");
        } finally {
            logs.stopRecording();
        }
    }
    
    @Test
    void nullList() {
        assertThatThrownBy(() -> ExceptionHandlerChain.withBase(null))
            .isExactlyInstanceOf(NullPointerException.class);
    }
}
