package alpha.waypoint.message;

import alpha.waypoint.HttpConstants.StatusCode;

import java.util.Map;

import static alpha.waypoint.HttpConstants.HeaderName.CONTENT_LENGTH;
import static alpha.waypoint.HttpConstants.HeaderName.CONTENT_TYPE;
import static alpha.waypoint.HttpConstants.StatusCode.FIVE_HUNDRED;
import static alpha.waypoint.HttpConstants.StatusCode.FIVE_HUNDRED_THREE;
import static alpha.waypoint.HttpConstants.StatusCode.FOUR_HUNDRED;
import static alpha.waypoint.HttpConstants.StatusCode.FOUR_HUNDRED_EIGHTEEN;
import static alpha.waypoint.HttpConstants.StatusCode.FOUR_HUNDRED_FIVE;
import static alpha.waypoint.HttpConstants.StatusCode.FOUR_HUNDRED_FOUR;
import static alpha.waypoint.HttpConstants.StatusCode.FOUR_HUNDRED_THREE;
import static alpha.waypoint.HttpConstants.StatusCode.TWO_HUNDRED;
import static alpha.waypoint.HttpConstants.StatusCode.TWO_HUNDRED_FOUR;
import static java.util.function.Function.identity;
import static java.util.stream.Collectors.toUnmodifiableMap;
import static java.util.stream.IntStream.of;

/**
 * Factories of responses.<p>
 * 
 * All responses without a body, of a status code declared in
 * {@link StatusCode}, are cached.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Responses
{
    // Declaration of methods after status() follows ascending status-code order
    
    private Responses() {
        // Empty
    }
    
    private static final Map<Integer, Response> CACHE = of(
                TWO_HUNDRED, TWO_HUNDRED_FOUR,
                FOUR_HUNDRED, FOUR_HUNDRED_THREE, FOUR_HUNDRED_FOUR,
                FOUR_HUNDRED_FIVE, FOUR_HUNDRED_EIGHTEEN,
                FIVE_HUNDRED, FIVE_HUNDRED_THREE)
            .boxed()
            .collect(toUnmodifiableMap(identity(),
                    c -> Response.builder(c).build()));
    
    /**
     * {@return a response with the specified status code}<p>
     * 
     * The reason phrase is derived from the status code.
     * 
     * @param code status code
     * @throws IllegalArgumentException
     *             if {@code code} is not a three-digit number
     */
    public static Response status(int code) {
        var cached = CACHE.get(code);
        return cached != null ? cached : Response.builder(code).build();
    }
    
    /**
     * {@return a response with the specified status code and reason phrase}
     * 
     * @param code status code
     * @param phrase reason phrase
     * @throws IllegalArgumentException
     *             if {@code code} is not a three-digit number
     * @throws NullPointerException
     *             if {@code phrase} is {@code null}
     */
    public static Response status(int code, String phrase) {
        return Response.builder(code).reasonPhrase(phrase).build();
    }
    
    /**
     * {@return "200 OK" with a "text/plain; charset=utf-8" body}
     * 
     * @param textPlain body
     * @throws NullPointerException if {@code textPlain} is {@code null}
     */
    public static Response text(String textPlain) {
        var body = Response.Body.ofString(textPlain);
        return ok().toBuilder()
                   .setHeader(CONTENT_TYPE, "text/plain; charset=utf-8")
                   .setHeader(CONTENT_LENGTH, Long.toString(body.length()))
                   .body(body)
                   .build();
    }
    
    /**
     * {@return "200 OK", without a body}
     */
    public static Response ok() {
        return CACHE.get(TWO_HUNDRED);
    }
    
    /**
     * {@return "204 No Content"}
     */
    public static Response noContent() {
        return CACHE.get(TWO_HUNDRED_FOUR);
    }
    
    /**
     * {@return "400 Bad Request"}
     */
    public static Response badRequest() {
        return CACHE.get(FOUR_HUNDRED);
    }
    
    /**
     * {@return "403 Forbidden"}
     */
    public static Response forbidden() {
        return CACHE.get(FOUR_HUNDRED_THREE);
    }
    
    /**
     * {@return "404 Not Found"}
     */
    public static Response notFound() {
        return CACHE.get(FOUR_HUNDRED_FOUR);
    }
    
    /**
     * {@return "405 Method Not Allowed"}<p>
     * 
     * The response does not have the {@code Allow} header, which the
     * {@linkplain alpha.waypoint.handler.ExceptionHandler#BASE base exception
     * handler} adds.
     */
    public static Response methodNotAllowed() {
        return CACHE.get(FOUR_HUNDRED_FIVE);
    }
    
    /**
     * {@return "418 I'm a teapot"}
     */
    public static Response teapot() {
        return CACHE.get(FOUR_HUNDRED_EIGHTEEN);
    }
    
    /**
     * {@return "500 Internal Server Error"}
     */
    public static Response internalServerError() {
        return CACHE.get(FIVE_HUNDRED);
    }
    
    /**
     * {@return "503 Service Unavailable"}
     */
    public static Response serviceUnavailable() {
        return CACHE.get(FIVE_HUNDRED_THREE);
    }
}
