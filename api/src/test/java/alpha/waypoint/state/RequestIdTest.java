package alpha.waypoint.state;

import alpha.waypoint.message.Request;
import alpha.waypoint.testutil.LogRecorder;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static alpha.waypoint.HttpConstants.HeaderName.X_REQUEST_ID;
import static java.lang.System.Logger.Level.DEBUG;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests of {@link RequestId}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class RequestIdTest
{
    private final RequestState state = new RequestState();
    
    @Test
    void clientProvided() {
        var req = Request.builder("GET", "/").header(X_REQUEST_ID, " abc ").build();
        var logs = LogRecorder.startRecording(RequestId.class);
        try {
            var id = RequestId.set(state, req, true);
            assertThat(id.value()).isEqualTo("abc");
            assertThat(RequestId.of(state)).isSameAs(id);
            logs.assertRemove(DEBUG, "[abc] Using client-provided request id.");
        } finally {
            logs.stopRecording();
        }
    }
    
    @Test
    void clientProvided_notAccepted() {
        var req = Request.builder("GET", "/").header(X_REQUEST_ID, "abc").build();
        var id = RequestId.set(state, req, false);
        assertThat(id.value()).isNotEqualTo("abc");
        // Does not throw
        UUID.fromString(id.value());
    }
    
    @Test
    void blankHeaderIsIgnored() {
        var req = Request.builder("GET", "/").header(X_REQUEST_ID, "  ").build();
        assertThat(RequestId.set(state, req, true).value()).isNotBlank();
    }
    
    @Test
    void presentIdIsKept() {
        state.put(new RequestId("preset"));
        var req = Request.builder("GET", "/").header(X_REQUEST_ID, "abc").build();
        assertThat(RequestId.set(state, req, true).value()).isEqualTo("preset");
    }
    
    @Test
    void toStringIsValue() {
        assertThat(new RequestId("x")).hasToString("x");
    }
}
