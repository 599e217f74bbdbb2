package alpha.waypoint.handler;

import alpha.waypoint.Config;
import alpha.waypoint.message.Response;
import alpha.waypoint.message.Responses;
import alpha.waypoint.route.MethodNotAllowedException;
import alpha.waypoint.route.NoRouteFoundException;
import alpha.waypoint.state.RequestId;
import alpha.waypoint.state.RequestState;
import alpha.waypoint.testutil.LogRecorder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.Serial;
import java.util.Set;

import static alpha.waypoint.HttpConstants.HeaderName.ALLOW;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Unit tests of {@link ExceptionHandler#BASE}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class ExceptionHandlerTest
{
    private final RequestState state = new RequestState().put(new RequestId("xyz"));
    private LogRecorder logs;
    
    @BeforeEach
    void startRecording() {
        logs = LogRecorder.startRecording(ExceptionHandler.class);
    }
    
    @AfterEach
    void stopRecording() {
        logs.stopRecording();
    }
    
    @Test
    void weirdResponseFromExceptionClass() {
        class DumbException extends Exception implements HasResponse {
            @Serial private static final long serialVersionUID = 1L;
            @Override public Response getResponse() {
                return Responses.status(123, "Interim!");
            }
        }
        var actual = ExceptionHandler.BASE.apply(new DumbException(), null, state);
        assertSame(actual, Responses.teapot());
        logs.assertContainsOnlyOnce(WARNING, """
                For being an advisory fallback response, \
                the status code 123 makes no sense.""");
    }
    
    @Test
    void advisoryResponse() {
        var actual = ExceptionHandler.BASE.apply(new NoRouteFoundException("/x"), null, state);
        assertSame(actual, Responses.notFound());
        logs.assertRemove(DEBUG, "[xyz] Advisory response of NoRouteFoundException");
    }
    
    @Test
    void unknownException() {
        var exc = new IllegalStateException("oops");
        var actual = ExceptionHandler.BASE.apply(exc, null, state);
        assertSame(actual, Responses.internalServerError());
        logs.assertRemove(ERROR, "[xyz] Request processing failed.", IllegalStateException.class)
            .isSameAs(exc);
    }
    
    @Test
    void methodNotAllowed() {
        var exc = new MethodNotAllowedException("PUT", Set.of("POST", "GET"));
        var actual = ExceptionHandler.BASE.apply(exc, null, state);
        assertThat(actual.statusCode()).isEqualTo(405);
        assertThat(actual.header(ALLOW)).contains("GET, POST");
    }
    
    @Test
    void options_implemented() {
        var exc = new MethodNotAllowedException("OPTIONS", Set.of("GET"));
        var actual = ExceptionHandler.BASE.apply(exc, null, state);
        assertThat(actual.statusCode()).isEqualTo(204);
        assertThat(actual.header(ALLOW)).contains("OPTIONS, GET");
    }
    
    @Test
    void options_notImplemented() {
        state.put(Config.class, Config.configuration()
                                      .implementMissingOptions(false)
                                      .build());
        var exc = new MethodNotAllowedException("OPTIONS", Set.of("GET"));
        var actual = ExceptionHandler.BASE.apply(exc, null, state);
        assertThat(actual.statusCode()).isEqualTo(405);
        assertThat(actual.header(ALLOW)).contains("GET");
    }
}
