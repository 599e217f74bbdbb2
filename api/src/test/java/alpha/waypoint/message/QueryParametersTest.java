package alpha.waypoint.message;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link QueryParameters}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class QueryParametersTest
{
    @Test
    void empty() {
        assertThat(QueryParameters.parse("")).isSameAs(QueryParameters.empty());
        assertThat(QueryParameters.empty().isEmpty()).isTrue();
        assertThat(QueryParameters.empty().all("x")).isEmpty();
        assertThat(QueryParameters.empty().first("x")).isEmpty();
    }
    
    @Test
    void multiValued_inOrder() {
        var q = QueryParameters.parse("b=2&a=1&b=3");
        assertThat(q.names()).containsExactly("b", "a");
        assertThat(q.all("b")).containsExactly("2", "3");
        assertThat(q.first("b")).contains("2");
    }
    
    @Test
    void valueMissing() {
        var q = QueryParameters.parse("flag&x=");
        assertThat(q.all("flag")).containsExactly("");
        assertThat(q.all("x")).containsExactly("");
    }
    
    @Test
    void emptyPairsAreSkipped() {
        assertThat(QueryParameters.parse("&&a=1&").asMap())
            .containsExactly(org.assertj.core.api.Assertions.entry("a", List.of("1")));
    }
    
    @Test
    void decoded_plusIsLiteral() {
        var q = QueryParameters.parse("n%20ame=a+b%21");
        assertThat(q.first("n ame")).contains("a+b!");
    }
    
    @Test
    void malformed() {
        assertThatThrownBy(() -> QueryParameters.parse("a=%zz"))
            .isInstanceOf(IllegalArgumentException.class);
    }
    
    @Test
    void equality() {
        assertThat(QueryParameters.parse("a=1&b=2"))
            .isEqualTo(QueryParameters.parse("a=1&b=2"))
            .isNotEqualTo(QueryParameters.parse("a=1"));
    }
}
