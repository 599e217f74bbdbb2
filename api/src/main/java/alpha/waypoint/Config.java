package alpha.waypoint;

import alpha.waypoint.handler.ExceptionHandler;

/**
 * Router and dispatcher configuration.<p>
 * 
 * The implementation is immutable and thread-safe.<p>
 * 
 * Any configuration object can be turned into a builder for a derived
 * configuration. The static method {@link #configuration()} is a shortcut for
 * {@code Config.}{@link #DEFAULT}{@code .toBuilder()}:
 * 
 * <pre>{@code
 *   Config config = Config.configuration()
 *                         .implementHeadFromGet(true)
 *                         .build();
 * }</pre>
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Config
{
    /**
     * Values used:<p>
     * 
     * Accept request id header: true<br>
     * Implement missing OPTIONS: true<br>
     * Implement HEAD from GET: false<br>
     * Warn shadowed routes: true
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();
    
    /**
     * Returns whether to reuse the value of a client-provided
     * {@code X-Request-ID} header as the request id.<p>
     * 
     * If {@code false}, or the header is absent or blank, a random UUID is
     * generated.<p>
     * 
     * The default implementation returns {@code true}.
     * 
     * @return see JavaDoc
     */
    boolean acceptRequestIdHeader();
    
    /**
     * Returns whether to respond {@code 204 No Content} to an {@code OPTIONS}
     * request for a path, for which no route accepts the method.<p>
     * 
     * The {@code Allow} header lists the methods of the path's routes, and
     * {@code OPTIONS} itself. The response is produced by
     * {@link ExceptionHandler#BASE}.<p>
     * 
     * The default implementation returns {@code true}.
     * 
     * @return see JavaDoc
     */
    boolean implementMissingOptions();
    
    /**
     * Returns whether a {@code HEAD} request may be served by a route which
     * accepts {@code GET}, if there is no route accepting {@code HEAD} for the
     * same path.<p>
     * 
     * The default implementation returns {@code false}.
     * 
     * @return see JavaDoc
     */
    boolean implementHeadFromGet();
    
    /**
     * Returns whether the router logs a warning when a route is registered
     * that can never be matched.<p>
     * 
     * For instance, a regex-constrained segment matching anything (e.g.
     * {@code :all|.*}) shadows all subsequent siblings of the same tree
     * node.<p>
     * 
     * The default implementation returns {@code true}.
     * 
     * @return see JavaDoc
     */
    boolean warnShadowedRoutes();
    
    /**
     * Returns a builder pre-populated with the values of this configuration.
     * 
     * @return a builder
     */
    Config.Builder toBuilder();
    
    /**
     * Returns {@code Config.DEFAULT.toBuilder()}.
     * 
     * @return a builder
     */
    static Config.Builder configuration() {
        return DEFAULT.toBuilder();
    }
    
    /**
     * Builder of a {@link Config}.<p>
     * 
     * The builder is immutable. All setter methods return a new builder
     * instance representing the new state. The builder can be used as a
     * template to build many configurations.<p>
     * 
     * The implementation is thread-safe.
     */
    interface Builder {
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#acceptRequestIdHeader()
         */
        Builder acceptRequestIdHeader(boolean newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#implementMissingOptions()
         */
        Builder implementMissingOptions(boolean newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#implementHeadFromGet()
         */
        Builder implementHeadFromGet(boolean newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#warnShadowedRoutes()
         */
        Builder warnShadowedRoutes(boolean newVal);
        
        /**
         * Builds the configuration.
         * 
         * @return a configuration
         */
        Config build();
    }
}
