package alpha.waypoint.extract;

import alpha.waypoint.message.QueryParameters;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link QueryStringExtractor}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class QueryStringExtractorTest
{
    record Search(String q, Optional<Integer> limit, List<String> tag, boolean exact) {}
    
    @Test
    void none() throws Exception {
        var q = QueryParameters.parse("a=1");
        assertThat(QueryStringExtractor.none().extract(q)).isSameAs(q);
    }
    
    @Test
    void intoRecord() throws Exception {
        var q = QueryParameters.parse("q=hello%20world&tag=a&tag=b&exact=TRUE&limit=10");
        var s = QueryStringExtractor.intoRecord(Search.class).extract(q);
        assertThat(s).isEqualTo(new Search("hello world", Optional.of(10), List.of("a", "b"), true));
    }
    
    @Test
    void intoRecord_badBoolean() {
        var q = QueryParameters.parse("q=x&exact=yes");
        assertThatThrownBy(() -> QueryStringExtractor.intoRecord(Search.class).extract(q))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessage("Parameter \"exact\" can not be converted to boolean: \"yes\".");
    }
    
    @Test
    void notARecordType() {
        @SuppressWarnings({"unchecked", "rawtypes"})
        Class<Record> fake = (Class) String.class;
        assertThatThrownBy(() -> QueryStringExtractor.intoRecord(fake))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessageEndingWith("is not a record.");
    }
}
