package alpha.waypoint;

import java.util.Map;

/**
 * Namespace of HTTP constants used by the router and the dispatcher.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class HttpConstants {
    private HttpConstants() {
        // Empty
    }
    
    /**
     * Method tokens.<p>
     * 
     * Method tokens are case-sensitive.
     * 
     * @see <a href="https://tools.ietf.org/html/rfc7231#section-4">RFC 7231 §4</a>
     */
    public static final class Method {
        private Method() {
            // Private
        }
        
        /** {@code GET} */
        public static final String GET = "GET";
        /** {@code HEAD}; same as {@code GET}, except without a response body. */
        public static final String HEAD = "HEAD";
        /** {@code POST} */
        public static final String POST = "POST";
        /** {@code PUT} */
        public static final String PUT = "PUT";
        /** {@code PATCH} */
        public static final String PATCH = "PATCH";
        /** {@code DELETE} */
        public static final String DELETE = "DELETE";
        /** {@code OPTIONS} */
        public static final String OPTIONS = "OPTIONS";
        /** {@code TRACE} */
        public static final String TRACE = "TRACE";
        /** {@code CONNECT} */
        public static final String CONNECT = "CONNECT";
    }
    
    /**
     * Status codes, and utilities to classify them.
     */
    public static final class StatusCode {
        private StatusCode() {
            // Private
        }
        
        /** {@code 200 OK} */
        public static final int TWO_HUNDRED = 200;
        /** {@code 204 No Content} */
        public static final int TWO_HUNDRED_FOUR = 204;
        /** {@code 400 Bad Request} */
        public static final int FOUR_HUNDRED = 400;
        /** {@code 403 Forbidden} */
        public static final int FOUR_HUNDRED_THREE = 403;
        /** {@code 404 Not Found} */
        public static final int FOUR_HUNDRED_FOUR = 404;
        /** {@code 405 Method Not Allowed} */
        public static final int FOUR_HUNDRED_FIVE = 405;
        /** {@code 418 I'm a teapot} */
        public static final int FOUR_HUNDRED_EIGHTEEN = 418;
        /** {@code 500 Internal Server Error} */
        public static final int FIVE_HUNDRED = 500;
        /** {@code 503 Service Unavailable} */
        public static final int FIVE_HUNDRED_THREE = 503;
        
        /**
         * Returns {@code true} if the code is in the 2XX series.
         * 
         * @param code status code
         * @return see JavaDoc
         */
        public static boolean isSuccessful(int code) {
            return code >= 200 && code <= 299;
        }
        
        /**
         * Returns {@code true} if the code is in the 3XX series.
         * 
         * @param code status code
         * @return see JavaDoc
         */
        public static boolean isRedirection(int code) {
            return code >= 300 && code <= 399;
        }
        
        /**
         * Returns {@code true} if the code is in the 4XX series.
         * 
         * @param code status code
         * @return see JavaDoc
         */
        public static boolean isClientError(int code) {
            return code >= 400 && code <= 499;
        }
        
        /**
         * Returns {@code true} if the code is in the 5XX series.
         * 
         * @param code status code
         * @return see JavaDoc
         */
        public static boolean isServerError(int code) {
            return code >= 500 && code <= 599;
        }
    }
    
    /**
     * Reason phrases of the status codes declared in {@link StatusCode}.
     */
    public static final class ReasonPhrase {
        private ReasonPhrase() {
            // Private
        }
        
        /** {@code OK} */
        public static final String OK = "OK";
        /** {@code No Content} */
        public static final String NO_CONTENT = "No Content";
        /** {@code Bad Request} */
        public static final String BAD_REQUEST = "Bad Request";
        /** {@code Forbidden} */
        public static final String FORBIDDEN = "Forbidden";
        /** {@code Not Found} */
        public static final String NOT_FOUND = "Not Found";
        /** {@code Method Not Allowed} */
        public static final String METHOD_NOT_ALLOWED = "Method Not Allowed";
        /** {@code I'm a teapot} */
        public static final String IM_A_TEAPOT = "I'm a teapot";
        /** {@code Internal Server Error} */
        public static final String INTERNAL_SERVER_ERROR = "Internal Server Error";
        /** {@code Service Unavailable} */
        public static final String SERVICE_UNAVAILABLE = "Service Unavailable";
        /** {@code Unknown} */
        public static final String UNKNOWN = "Unknown";
        
        private static final Map<Integer, String> BY_CODE = Map.of(
                StatusCode.TWO_HUNDRED,           OK,
                StatusCode.TWO_HUNDRED_FOUR,      NO_CONTENT,
                StatusCode.FOUR_HUNDRED,          BAD_REQUEST,
                StatusCode.FOUR_HUNDRED_THREE,    FORBIDDEN,
                StatusCode.FOUR_HUNDRED_FOUR,     NOT_FOUND,
                StatusCode.FOUR_HUNDRED_FIVE,     METHOD_NOT_ALLOWED,
                StatusCode.FOUR_HUNDRED_EIGHTEEN, IM_A_TEAPOT,
                StatusCode.FIVE_HUNDRED,          INTERNAL_SERVER_ERROR,
                StatusCode.FIVE_HUNDRED_THREE,    SERVICE_UNAVAILABLE);
        
        /**
         * Returns the reason phrase of the given code.
         * 
         * @param code status code
         * @return the phrase, or {@link #UNKNOWN} if the code is not declared
         */
        public static String of(int code) {
            return BY_CODE.getOrDefault(code, UNKNOWN);
        }
    }
    
    /**
     * Header names.<p>
     * 
     * Header names are case-insensitive.
     */
    public static final class HeaderName {
        private HeaderName() {
            // Private
        }
        
        /** Lists the methods a resource supports. */
        public static final String ALLOW = "Allow";
        /** {@code Content-Length} */
        public static final String CONTENT_LENGTH = "Content-Length";
        /** {@code Content-Type} */
        public static final String CONTENT_TYPE = "Content-Type";
        /** Correlates a request across systems. */
        public static final String X_REQUEST_ID = "X-Request-ID";
    }
}
