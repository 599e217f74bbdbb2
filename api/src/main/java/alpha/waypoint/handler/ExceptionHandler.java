package alpha.waypoint.handler;

import alpha.waypoint.Config;
import alpha.waypoint.NonThrowingChain;
import alpha.waypoint.message.Request;
import alpha.waypoint.message.Response;
import alpha.waypoint.route.MethodNotAllowedException;
import alpha.waypoint.state.RequestId;
import alpha.waypoint.state.RequestState;

import java.util.stream.Stream;

import static alpha.waypoint.HttpConstants.HeaderName.ALLOW;
import static alpha.waypoint.HttpConstants.Method.OPTIONS;
import static alpha.waypoint.HttpConstants.StatusCode.isClientError;
import static alpha.waypoint.HttpConstants.StatusCode.isRedirection;
import static alpha.waypoint.HttpConstants.StatusCode.isServerError;
import static alpha.waypoint.message.Responses.internalServerError;
import static alpha.waypoint.message.Responses.noContent;
import static alpha.waypoint.message.Responses.teapot;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.stream.Collectors.joining;
import static java.util.stream.Stream.concat;
import static java.util.stream.Stream.of;

/**
 * Optionally translates an {@code Exception} into a response.<p>
 * 
 * The dispatcher hands to its exception handlers every exception that escapes
 * the middleware chain, as well as the 400, 404 and 405 conditions of
 * requests that never entered it. A handler either returns a response, or
 * yields to the next handler. The last handler is always {@link #BASE}, so a
 * response is guaranteed.
 * 
 * <pre>{@code
 *   ExceptionHandler outOfStock = (exc, chain, state) ->
 *       exc instanceof OutOfStockException ?
 *           Responses.status(409, "Out of stock") :
 *           chain.proceed();
 * }</pre>
 * 
 * Handlers are called in registration order. This is the order given to
 * {@link alpha.waypoint.Dispatcher.Builder#exceptionHandler(ExceptionHandler...)},
 * or to a {@link alpha.waypoint.pipeline.FaultBoundary}.<p>
 * 
 * A handler that throws, or returns {@code null}, is logged and skipped. The
 * next handler gets the original exception.<p>
 * 
 * Handlers are shared by all requests and must be thread-safe.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public interface ExceptionHandler
{
    /**
     * Produces a response, or yields to {@code chain}.<p>
     * 
     * The state has at least the {@link Request} and its {@link RequestId}.
     * What else it has depends on how far the dispatch got.
     * 
     * @param exc to handle (never null)
     * @param chain the remaining handlers (never null)
     * @param state of request (never null)
     * 
     * @return a response
     */
    Response apply(Exception exc, NonThrowingChain chain, RequestState state);
    
    /**
     * Is the last handler in the exception-processing chain.<p>
     * 
     * Firstly, this handler implements {@link Config#implementMissingOptions()}
     * and adds the {@code Allow} header to the response of a
     * {@link MethodNotAllowedException}.<p>
     * 
     * Secondly, if the exception implements {@link HasResponse}, the handler
     * calls {@link HasResponse#getResponse()} and returns the provided
     * response.<p>
     * 
     * Lastly, the exception is logged and
     * {@link alpha.waypoint.message.Responses#internalServerError()} is
     * returned.<p>
     * 
     * The configuration is read from the state, if present, else
     * {@link Config#DEFAULT} is used.
     */
    ExceptionHandler BASE = (exc, chainIsNull, state) -> {
        if (exc instanceof MethodNotAllowedException e) {
            Response status = e.getResponse();
            assert isProblem(status.statusCode());
            Stream<String> allow = e.allowedMethods().stream();
            var cfg = state.tryBorrow(Config.class).orElse(Config.DEFAULT);
            if (e.method().equals(OPTIONS) && cfg.implementMissingOptions()) {
                status = noContent();
                // Now OPTIONS is a supported method lol
                allow = concat(of(OPTIONS), allow);
            }
            return status.toBuilder()
                         .setHeader(ALLOW, allow.collect(joining(", ")))
                         .build();
        }
        if (exc instanceof HasResponse trait) {
            logger().log(DEBUG, () -> prefix(state) + "Advisory response of " +
                    exc.getClass().getSimpleName() + ": " + exc.getMessage());
            var rsp = trait.getResponse();
            int code = rsp.statusCode();
            if (!isProblem(code)) {
                logger().log(WARNING, () -> """
                    For being an advisory fallback response, \
                    the status code %s makes no sense.""".formatted(code));
                rsp = teapot();
            }
            return rsp;
        }
        logger().log(ERROR, prefix(state) + "Request processing failed.", exc);
        return internalServerError();
    };
    
    private static boolean isProblem(int code) {
        return isRedirection(code) || isClientError(code) || isServerError(code);
    }
    
    private static String prefix(RequestState state) {
        return state.tryBorrow(RequestId.class)
                    .map(id -> "[" + id + "] ")
                    .orElse("");
    }
    
    private static System.Logger logger() {
        return System.getLogger(ExceptionHandler.class.getPackageName());
    }
}
