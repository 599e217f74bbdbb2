package alpha.waypoint.core;

import alpha.waypoint.Cancellation;
import alpha.waypoint.Dispatcher;
import alpha.waypoint.handler.RouteHandler;
import alpha.waypoint.message.Request;
import alpha.waypoint.message.Response;
import alpha.waypoint.message.Responses;
import alpha.waypoint.pipeline.Middleware;
import alpha.waypoint.pipeline.Pipeline;
import alpha.waypoint.pipeline.PipelineChain;
import alpha.waypoint.pipeline.PipelineSet;
import alpha.waypoint.route.MatchOutcome.Matched;
import alpha.waypoint.route.PathParameters;
import alpha.waypoint.route.Route;
import alpha.waypoint.route.Router;
import alpha.waypoint.state.RequestState;
import alpha.waypoint.store.Store;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Map;
import java.util.Set;

import static alpha.waypoint.HttpConstants.HeaderName.ALLOW;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end examples of how an application wires components, pipelines,
 * routes and a dispatcher together.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class ExampleTest
{
    /** Lineage of the application's component store. */
    enum Components {}
    
    /** Lineage of the application's pipelines. */
    enum Pipelines {}
    
    record User(String name) {}
    
    private static String text(Response rsp) throws IOException {
        var out = new ByteArrayOutputStream();
        rsp.body().writeTo(out);
        return out.toString(UTF_8);
    }
    
    private static RouteHandler reply(String body) {
        return state -> Responses.text(body);
    }
    
    @Test
    void checkout() throws IOException {
        Store.Builder<Components> components = Store.builder();
        var auth = components.add((Middleware) (state, chain) -> {
            var req = state.borrow(Request.class);
            if (req.header("Authorization").isEmpty()) {
                return Responses.forbidden();
            }
            state.put(new User(req.header("Authorization").get()));
            return chain.proceed();
        });
        var store = components.build();
        
        PipelineSet.Builder<Pipelines> pipelines = PipelineSet.builder();
        var secured = pipelines.add(Pipeline.builder(store).add(auth).build());
        
        var router = Router.builder(pipelines.build())
                .scope("/checkout", b -> b
                    .withPipelineChain(PipelineChain.of(secured), s -> s
                        .get("/start").to(state ->
                            Responses.text("start " + state.borrow(User.class).name()))
                        .get("/:step").to(reply("step"))))
                .build();
        var dispatcher = Dispatcher.builder(router).build();
        
        var start = dispatcher.dispatch(
                Request.builder("GET", "/checkout/start").header("Authorization", "bob").build());
        assertThat(text(start)).isEqualTo("start bob");
        
        var anonymous = dispatcher.dispatch(Request.of("GET", "/checkout/start"));
        assertThat(anonymous).isSameAs(Responses.forbidden());
        
        var post = dispatcher.dispatch(Request.of("POST", "/checkout/start"));
        assertThat(post.statusCode()).isEqualTo(405);
        assertThat(post.header(ALLOW)).contains("GET");
    }
    
    @Test
    void parts() {
        var state = new RequestState();
        var router = Router.builder(PipelineSet.<Pipelines>builder().build())
                .get("/parts/*rest").to(reply("parts"))
                .build();
        Dispatcher.builder(router).build()
                  .dispatch(Request.of("GET", "/parts/a/b/c"), state, Cancellation.create());
        assertThat(state.borrow(PathParameters.class).glob("rest"))
            .containsExactly("a", "b", "c");
    }
    
    @Test
    void everyRouteMatchesItself() {
        PipelineSet.Builder<Pipelines> b = PipelineSet.builder();
        var p1 = b.add(Pipeline.empty());
        var p2 = b.add(Pipeline.empty());
        Map<String, String> requests = Map.of(
                "/a/b",            "/a/b",
                "/a/x",            "/a/:x",
                "/a/7/c",          "/a/:n|\\d+/c",
                "/admin/users",    "/admin/users",
                "/admin/users/9",  "/admin/users/:id",
                "/shop/users",     "/shop/users",
                "/shop/f/g/h",     "/shop/*rest");
        var router = Router.builder(b.build())
                .get("/a/b").to(reply(""))
                .get("/a/:x").to(reply(""))
                .get("/a/:n|\\d+/c").to(reply(""))
                .scope("/admin", s -> s
                    .withPipelineChain(PipelineChain.of(p1), x -> x
                        .get("/users").to(reply(""))
                        .get("/users/:id").to(reply(""))))
                .scope("/shop", s -> s
                    .withPipelineChain(PipelineChain.of(p2), x -> x
                        .get("/users").to(reply(""))
                        .get("/*rest").to(reply(""))))
                .build();
        
        requests.forEach((path, pattern) -> {
            var out = router.match("GET", path);
            assertThat(out).as(path).isInstanceOf(Matched.class);
            Route<Pipelines> r = ((Matched<Pipelines>) out).route();
            assertThat(r.pattern()).as(path).hasToString(pattern);
            if (pattern.startsWith("/admin")) {
                assertThat(r.chain()).isEqualTo(PipelineChain.of(p1));
            } else if (pattern.startsWith("/shop")) {
                assertThat(r.chain()).isEqualTo(PipelineChain.of(p2));
            } else {
                assertThat(r.chain().isEmpty()).isTrue();
            }
        });
        
        assertThat(router.routes()).hasSize(requests.size());
        assertThat(router.routes()).extracting(Route::methods)
                                   .containsOnly(Set.of("GET"));
    }
}
