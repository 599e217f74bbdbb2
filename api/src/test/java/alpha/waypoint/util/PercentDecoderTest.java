package alpha.waypoint.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link PercentDecoder}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class PercentDecoderTest
{
    @ParameterizedTest
    @CsvSource({
        "abc,       abc",
        "a%20b,     a b",
        "a+b,       a+b",
        "a+%20+b,   a+ +b",
        "%C3%A9,    é",
        "%e2%82%ac, €",
        "x%2F%2Fy,  x//y",
        "'',        ''"})
    void decode(String input, String expected) {
        assertThat(PercentDecoder.decode(input)).isEqualTo(expected);
    }
    
    @Test
    void noEscapeReturnsSameInstance() {
        String s = "hello";
        assertThat(PercentDecoder.decode(s)).isSameAs(s);
    }
    
    @Test
    void malformed() {
        assertThatThrownBy(() -> PercentDecoder.decode("%zz"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PercentDecoder.decode("%2"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PercentDecoder.decode("a%C3"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Not UTF-8: a%C3");
    }
    
    @Test
    void many() {
        assertThat(PercentDecoder.decode(List.of("a%2Fb", "c")))
            .containsExactly("a/b", "c");
    }
}
