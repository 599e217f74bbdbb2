package alpha.waypoint.message;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests of {@link Request}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class RequestTest
{
    @ParameterizedTest
    @CsvSource({
        "/a/b?x=1#frag, /a/b, x=1",
        "/a?,           /a,   ''",
        "'',            /,    ''",
        "?q,            /,    q",
        "/a#f?x=1,      /a,   ''"})
    void pathAndQuery(String target, String path, String query) {
        var r = Request.of("GET", target);
        assertThat(r.target()).isEqualTo(target);
        assertThat(r.path()).isEqualTo(path);
        assertThat(r.rawQuery()).isEqualTo(query);
    }
    
    @Test
    void headers_caseInsensitive() {
        var r = Request.builder("GET", "/")
                       .header("Content-Type", "text/plain")
                       .header("x-many", "1")
                       .header("X-Many", "2")
                       .build();
        assertThat(r.header("content-type")).contains("text/plain");
        assertThat(r.headers().allValues("X-MANY")).containsExactly("1", "2");
        assertThat(r.header("missing")).isEmpty();
    }
    
    @Test
    void body() throws IOException {
        var r = Request.builder("POST", "/").body(Request.Body.of("hi".getBytes(UTF_8))).build();
        try (var in = r.body().open()) {
            assertThat(new String(in.readAllBytes(), UTF_8)).isEqualTo("hi");
        }
        try (var in = Request.of("GET", "/").body().open()) {
            assertThat(in.read()).isEqualTo(-1);
        }
    }
}
