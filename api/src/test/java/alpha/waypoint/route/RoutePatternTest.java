package alpha.waypoint.route;

import alpha.waypoint.route.Segment.Constrained;
import alpha.waypoint.route.Segment.Dynamic;
import alpha.waypoint.route.Segment.Glob;
import alpha.waypoint.route.Segment.Literal;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.regex.PatternSyntaxException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link RoutePattern}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class RoutePatternTest
{
    @Test
    void everything() {
        var p = RoutePattern.parse("/user/:id|\\d+/file/:name/*rest");
        assertThat(p.segments()).hasSize(5);
        assertThat(p.segments().get(0)).isEqualTo(new Literal("user"));
        assertThat(p.segments().get(1)).isInstanceOf(Constrained.class);
        assertThat(((Constrained) p.segments().get(1)).matches("123")).isTrue();
        assertThat(((Constrained) p.segments().get(1)).matches("12a")).isFalse();
        assertThat(p.segments().get(3)).isEqualTo(new Dynamic("name"));
        assertThat(p.segments().get(4)).isEqualTo(new Glob("rest"));
        assertThat(p.parameterNames()).containsExactly("id", "name", "rest");
        assertThat(p).hasToString("/user/:id|\\d+/file/:name/*rest");
    }
    
    @ParameterizedTest
    @ValueSource(strings = {"", "/"})
    void root(String pattern) {
        assertThat(RoutePattern.parse(pattern)).isSameAs(RoutePattern.root());
        assertThat(RoutePattern.root()).hasToString("/");
    }
    
    @Test
    void leadingAndTrailingSlashAreOptional() {
        assertThat(RoutePattern.parse("a/b/"))
            .isEqualTo(RoutePattern.parse("/a/b"));
    }
    
    @Test
    void regexIsFullMatch() {
        var c = (Constrained) RoutePattern.parse("/:x|[a-z]").segments().get(0);
        assertThat(c.matches("a")).isTrue();
        assertThat(c.matches("ab")).isFalse();
    }
    
    @Test
    void emptyInteriorSegment() {
        assertInvalid("/a//b", "Segment is empty.");
    }
    
    @Test
    void emptyName() {
        assertInvalid("/:", "Parameter name of segment \":\" is empty.");
        assertInvalid("/*", "Parameter name of segment \"*\" is empty.");
    }
    
    @Test
    void duplicatedName() {
        assertInvalid("/:a/*a", "Duplicated parameter name: \"a\"");
    }
    
    @Test
    void globNotLast() {
        assertInvalid("/*a/b", "Catch-all path parameter must be the last segment.");
    }
    
    @Test
    void emptyRegex() {
        assertInvalid("/:a|", "Regex of segment \":a|\" is empty.");
    }
    
    @Test
    void badRegex() {
        assertThatThrownBy(() -> RoutePattern.parse("/:a|[x"))
            .isExactlyInstanceOf(RoutePatternInvalidException.class)
            .hasCauseExactlyInstanceOf(PatternSyntaxException.class);
    }
    
    @Test
    void concat() {
        var p = RoutePattern.parse("/checkout").concat(RoutePattern.parse("/:step"));
        assertThat(p).hasToString("/checkout/:step");
        assertThat(RoutePattern.root().concat(p)).isSameAs(p);
        assertThat(p.concat(RoutePattern.root())).isSameAs(p);
    }
    
    @Test
    void concat_duplicatedName() {
        var prefix = RoutePattern.parse("/:id");
        var suffix = RoutePattern.parse("/:id");
        assertThatThrownBy(() -> prefix.concat(suffix))
            .isExactlyInstanceOf(RoutePatternInvalidException.class);
    }
    
    @Test
    void regexEqualityBySource() {
        assertThat(RoutePattern.parse("/:a|\\d+"))
            .isEqualTo(RoutePattern.parse("/:a|\\d+"))
            .isNotEqualTo(RoutePattern.parse("/:a|\\d*"));
    }
    
    private static void assertInvalid(String pattern, String reason) {
        assertThatThrownBy(() -> RoutePattern.parse(pattern))
            .isExactlyInstanceOf(RoutePatternInvalidException.class)
            .hasMessageContaining(reason)
            .extracting(e -> ((RoutePatternInvalidException) e).pattern())
            .isEqualTo(pattern);
    }
}
