package alpha.waypoint;

import alpha.waypoint.util.AbstractImmutableBuilder;

import java.util.function.Consumer;

/**
 * Default implementation of {@link Config}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultConfig implements Config {
    private final Builder builder;
    private final boolean acceptRequestIdHeader,
                          implementMissingOptions,
                          implementHeadFromGet,
                          warnShadowedRoutes;
    
    DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder                 = b;
        acceptRequestIdHeader   = s.acceptRequestIdHeader;
        implementMissingOptions = s.implementMissingOptions;
        implementHeadFromGet    = s.implementHeadFromGet;
        warnShadowedRoutes      = s.warnShadowedRoutes;
    }
    
    @Override
    public boolean acceptRequestIdHeader() {
        return acceptRequestIdHeader;
    }
    
    @Override
    public boolean implementMissingOptions() {
        return implementMissingOptions;
    }
    
    @Override
    public boolean implementHeadFromGet() {
        return implementHeadFromGet;
    }
    
    @Override
    public boolean warnShadowedRoutes() {
        return warnShadowedRoutes;
    }
    
    @Override
    public Builder toBuilder() {
        return builder;
    }
    
    @Override
    public String toString() {
        return "Config{" +
               "acceptRequestIdHeader="   + acceptRequestIdHeader   + ", " +
               "implementMissingOptions=" + implementMissingOptions + ", " +
               "implementHeadFromGet="    + implementHeadFromGet    + ", " +
               "warnShadowedRoutes="      + warnShadowedRoutes      + '}';
    }
    
    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();
        
        static class MutableState {
            boolean acceptRequestIdHeader   = true,
                    implementMissingOptions = true,
                    implementHeadFromGet    = false,
                    warnShadowedRoutes      = true;
        }
        
        private DefaultBuilder() {
            // super()
        }
        
        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }
        
        @Override
        public Builder acceptRequestIdHeader(boolean newVal) {
            return new DefaultBuilder(this, s -> s.acceptRequestIdHeader = newVal);
        }
        
        @Override
        public Builder implementMissingOptions(boolean newVal) {
            return new DefaultBuilder(this, s -> s.implementMissingOptions = newVal);
        }
        
        @Override
        public Builder implementHeadFromGet(boolean newVal) {
            return new DefaultBuilder(this, s -> s.implementHeadFromGet = newVal);
        }
        
        @Override
        public Builder warnShadowedRoutes(boolean newVal) {
            return new DefaultBuilder(this, s -> s.warnShadowedRoutes = newVal);
        }
        
        @Override
        public Config build() {
            return new DefaultConfig(this, constructState(MutableState::new));
        }
    }
}
