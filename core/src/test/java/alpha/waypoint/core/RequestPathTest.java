package alpha.waypoint.core;

import alpha.waypoint.route.MalformedPathException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link RequestPath}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class RequestPathTest
{
    @ParameterizedTest
    @ValueSource(strings = {"", "/", "/?x=1", "/#frag"})
    void root(String path) {
        assertThat(RequestPath.segments(path)).isEmpty();
    }
    
    @Test
    void trailingSlashIsDropped() {
        assertThat(RequestPath.segments("/a/b/")).containsExactly("a", "b");
    }
    
    @Test
    void interiorEmptySegmentsAreKept() {
        assertThat(RequestPath.segments("/a//b")).containsExactly("a", "", "b");
        assertThat(RequestPath.segments("//")).containsExactly("");
    }
    
    @Test
    void queryAndFragmentAreIgnored() {
        assertThat(RequestPath.segments("/a/b?c=/d#e/f")).containsExactly("a", "b");
        assertThat(RequestPath.segments("/a#b?c")).containsExactly("a");
    }
    
    @Test
    void decoded() {
        assertThat(RequestPath.segments("/hello%20world/a+b/x%2Fy"))
            .containsExactly("hello world", "a+b", "x/y");
    }
    
    @Test
    void malformed() {
        assertThatThrownBy(() -> RequestPath.segments("/a/%zz"))
            .isExactlyInstanceOf(MalformedPathException.class)
            .hasMessage("Malformed path \"/a/%zz\".")
            .hasCauseInstanceOf(IllegalArgumentException.class);
    }
}
