package alpha.waypoint;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link Cancellation}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class CancellationTest
{
    @Test
    void cancel() {
        var c = Cancellation.create();
        assertThat(c.isCancelled()).isFalse();
        assertThatCode(() -> c.throwIfCancelled("early")).doesNotThrowAnyException();
        c.cancel();
        assertThat(c.isCancelled()).isTrue();
        assertThatThrownBy(() -> c.throwIfCancelled("before routing"))
            .isExactlyInstanceOf(RequestCancelledException.class)
            .isInstanceOf(CancellationException.class)
            .hasMessage("Request cancelled before routing.");
    }
    
    @Test
    void interrupt() {
        var c = Cancellation.create();
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> c.throwIfCancelled("now"))
                .isExactlyInstanceOf(RequestCancelledException.class);
            // Flag is not cleared
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
