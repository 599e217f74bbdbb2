package alpha.waypoint.pipeline;

import alpha.waypoint.message.Responses;
import alpha.waypoint.store.ForeignHandleException;
import alpha.waypoint.store.Store;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link Pipeline}, {@link PipelineChain} and
 * {@link PipelineSet}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class PipelineSetTest
{
    enum Components {}
    enum Pipelines {}
    
    private static final Middleware
            A = (s, c) -> c.proceed(),
            B = (s, c) -> c.proceed(),
            C = (s, c) -> Responses.noContent();
    
    @Test
    void pipelineFromStore() {
        Store.Builder<Components> b = Store.builder();
        var a = b.add(A);
        var c = b.add(C);
        var store = b.build();
        var p = Pipeline.builder(store).add(c).add(a).build();
        assertThat(p.middleware()).containsExactly(C, A);
        assertThat(p.size()).isEqualTo(2);
    }
    
    @Test
    void pipelineFromStore_foreignHandle() {
        var h = Store.<Components>builder().add(A);
        var other = Store.<Components>builder().build();
        var b = Pipeline.builder(other);
        assertThatThrownBy(() -> b.add(h))
            .isExactlyInstanceOf(ForeignHandleException.class);
    }
    
    @Test
    void resolve_concatenatesInOrder() {
        PipelineSet.Builder<Pipelines> b = PipelineSet.builder();
        var first  = b.add(Pipeline.of(A, B));
        var second = b.add(Pipeline.of(C));
        var set = b.build();
        assertThat(set.size()).isEqualTo(2);
        assertThat(set.resolve(PipelineChain.of(first, second)))
            .containsExactly(A, B, C);
        assertThat(set.resolve(PipelineChain.of(second, first)))
            .containsExactly(C, A, B);
        assertThat(set.resolve(PipelineChain.empty())).isEmpty();
    }
    
    @Test
    void chainConcat() {
        PipelineSet.Builder<Pipelines> b = PipelineSet.builder();
        var x = b.add(Pipeline.empty());
        var y = b.add(Pipeline.of(A));
        var xy = PipelineChain.of(x).concat(PipelineChain.of(y));
        assertThat(xy).isEqualTo(PipelineChain.of(x, y));
        assertThat(xy.handles()).containsExactly(x, y);
        assertThat(PipelineChain.<Pipelines>empty().isEmpty()).isTrue();
    }
    
    @Test
    void requireOwned_foreignChain() {
        PipelineSet.Builder<Pipelines> b1 = PipelineSet.builder(),
                                       b2 = PipelineSet.builder();
        var h = b1.add(Pipeline.of(A));
        b2.add(Pipeline.of(B));
        var set2 = b2.build();
        var chain = PipelineChain.of(h);
        assertThat(set2.owns(h)).isFalse();
        assertThatThrownBy(() -> set2.requireOwned(chain))
            .isExactlyInstanceOf(ForeignHandleException.class);
        assertThatThrownBy(() -> set2.resolve(chain))
            .isExactlyInstanceOf(ForeignHandleException.class);
    }
    
    @Test
    void middlewareListIsUnmodifiable() {
        List<Middleware> l = Pipeline.of(A).middleware();
        assertThatThrownBy(() -> l.add(B))
            .isExactlyInstanceOf(UnsupportedOperationException.class);
    }
}
