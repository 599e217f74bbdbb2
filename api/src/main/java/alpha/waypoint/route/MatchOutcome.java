package alpha.waypoint.route;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of {@link Router#match(String, String)}.
 * 
 * @param <L> lineage of the pipeline set
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public sealed interface MatchOutcome<L>
{
    /**
     * Returns the outcome of no match.
     * 
     * @param <L> lineage of the pipeline set
     * @return the outcome of no match
     */
    @SuppressWarnings("unchecked")
    static <L> MatchOutcome<L> noMatch() {
        return (MatchOutcome<L>) NoMatch.INSTANCE;
    }
    
    /**
     * A route matched both the path and the method.
     * 
     * @param route matched
     * @param parameters bound by the route's pattern
     * @param <L> lineage of the pipeline set
     */
    record Matched<L>(Route<L> route, PathParameters parameters) implements MatchOutcome<L> {
        /**
         * Constructs this object.
         * 
         * @param route matched
         * @param parameters bound by the route's pattern
         * @throws NullPointerException if any argument is {@code null}
         */
        public Matched {
            requireNonNull(route);
            requireNonNull(parameters);
        }
    }
    
    /**
     * One or more routes matched the path, but none accepts the method.
     * 
     * @param allowed the methods accepted by the routes of the path
     * @param <L> lineage of the pipeline set
     */
    record PathMatchedNoVerb<L>(Set<String> allowed) implements MatchOutcome<L> {
        /**
         * Constructs this object.
         * 
         * @param allowed the methods accepted by the routes of the path
         * @throws NullPointerException if {@code allowed} is {@code null}
         */
        public PathMatchedNoVerb {
            allowed = Collections.unmodifiableSet(new LinkedHashSet<>(allowed));
        }
    }
    
    /**
     * No route matched the path.
     * 
     * @param <L> lineage of the pipeline set
     */
    record NoMatch<L>() implements MatchOutcome<L> {
        private static final NoMatch<?> INSTANCE = new NoMatch<>();
    }
}
