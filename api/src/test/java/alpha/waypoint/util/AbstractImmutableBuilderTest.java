package alpha.waypoint.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link AbstractImmutableBuilder}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class AbstractImmutableBuilderTest
{
    private static final class Words extends AbstractImmutableBuilder<List<String>> {
        Words() {
            // super()
        }
        
        private Words(Words parent, Consumer<List<String>> step) {
            super(parent, step);
        }
        
        Words add(String w) {
            return new Words(this, l -> l.add(w));
        }
        
        List<String> build() {
            return constructState(ArrayList::new);
        }
    }
    
    @Test
    void root_unmodified() {
        assertThat(new Words().build()).isEmpty();
    }
    
    @Test
    void appliedInCallOrder() {
        assertThat(new Words().add("a").add("b").add("c").build())
            .containsExactly("a", "b", "c");
    }
    
    @Test
    void siblingsAreIndependent() {
        var common = new Words().add("a");
        var left = common.add("l");
        var right = common.add("r");
        assertThat(left.build()).containsExactly("a", "l");
        assertThat(right.build()).containsExactly("a", "r");
        assertThat(common.build()).containsExactly("a");
    }
    
    @Test
    void nullStep() {
        assertThatThrownBy(() -> new Words(new Words(), null))
            .isExactlyInstanceOf(NullPointerException.class);
    }
    
    @Test
    void freshStatePerBuild() {
        var b = new Words().add("x");
        assertThat(b.build()).isNotSameAs(b.build());
    }
}
