package alpha.waypoint.route;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * The parameter values of a matched route.<p>
 * 
 * A single-segment parameter ({@code :name}, {@code :name|regex}) binds one
 * percent-decoded segment, retrieved using {@link #get(String)}. A catch-all
 * parameter ({@code *name}) binds the list of zero or more remaining
 * percent-decoded segments, retrieved using {@link #glob(String)}.<p>
 * 
 * For example, route "/files/:owner/*path" matched against the request path
 * "/files/alice/a/b%20c" yields "alice" for {@code get("owner")}, and
 * ["a", "b c"] for {@code glob("path")}.<p>
 * 
 * Instances are immutable and thread-safe.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class PathParameters
{
    private static final PathParameters EMPTY = new PathParameters(Map.of(), Map.of());
    
    /**
     * Returns an instance without parameters.
     * 
     * @return an instance without parameters
     */
    public static PathParameters empty() {
        return EMPTY;
    }
    
    /**
     * Returns a new builder.
     * 
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }
    
    private final Map<String, String> single;
    private final Map<String, List<String>> glob;
    
    private PathParameters(Map<String, String> single, Map<String, List<String>> glob) {
        this.single = single;
        this.glob = glob;
    }
    
    /**
     * Returns the value of a single-segment parameter.
     * 
     * @param name of parameter
     * @return the value, if bound
     */
    public Optional<String> get(String name) {
        return Optional.ofNullable(single.get(name));
    }
    
    /**
     * Returns the value of a single-segment parameter.
     * 
     * @param name of parameter
     * @return the value
     * @throws NoSuchElementException if the parameter is not bound
     */
    public String require(String name) {
        return get(name).orElseThrow(() -> new NoSuchElementException(
                "No path parameter named \"" + name + "\"."));
    }
    
    /**
     * Returns the segments of a catch-all parameter.
     * 
     * @param name of parameter
     * @return the segments (empty if not bound, or bound to zero segments)
     */
    public List<String> glob(String name) {
        return glob.getOrDefault(name, List.of());
    }
    
    /**
     * Returns the value(s) of the given parameter, regardless of its kind.
     * 
     * @param name of parameter
     * @return the value(s) (empty if not bound)
     */
    public List<String> values(String name) {
        var s = single.get(name);
        return s != null ? List.of(s) : glob(name);
    }
    
    /**
     * Returns {@code true} if the parameter is bound.
     * 
     * @param name of parameter
     * @return see JavaDoc
     */
    public boolean has(String name) {
        return single.containsKey(name) || glob.containsKey(name);
    }
    
    /**
     * Returns the names of all bound single-segment parameters.
     * 
     * @return the names of all bound single-segment parameters
     */
    public Set<String> singleNames() {
        return single.keySet();
    }
    
    /**
     * Returns the names of all bound catch-all parameters.
     * 
     * @return the names of all bound catch-all parameters
     */
    public Set<String> globNames() {
        return glob.keySet();
    }
    
    /**
     * Returns {@code true} if no parameter is bound.
     * 
     * @return see JavaDoc
     */
    public boolean isEmpty() {
        return single.isEmpty() && glob.isEmpty();
    }
    
    @Override
    public boolean equals(Object obj) {
        return obj instanceof PathParameters other &&
               single.equals(other.single) &&
               glob.equals(other.glob);
    }
    
    @Override
    public int hashCode() {
        return 31 * single.hashCode() + glob.hashCode();
    }
    
    @Override
    public String toString() {
        return "PathParameters{single=" + single + ", glob=" + glob + '}';
    }
    
    /**
     * Builder of {@link PathParameters}.<p>
     * 
     * The builder is not thread-safe.
     */
    public static final class Builder
    {
        private final Map<String, String> single = new LinkedHashMap<>();
        private final Map<String, List<String>> glob = new LinkedHashMap<>();
        
        private Builder() {
            // Empty
        }
        
        /**
         * Binds a single-segment parameter.
         * 
         * @param name of parameter
         * @param value of parameter
         * @return this for chaining/fluency
         * @throws NullPointerException if any argument is {@code null}
         */
        public Builder single(String name, String value) {
            single.put(requireNonNull(name), requireNonNull(value));
            return this;
        }
        
        /**
         * Binds a catch-all parameter.
         * 
         * @param name of parameter
         * @param segments of parameter
         * @return this for chaining/fluency
         * @throws NullPointerException
         *             if any argument, or an element, is {@code null}
         */
        public Builder glob(String name, List<String> segments) {
            glob.put(requireNonNull(name), List.copyOf(segments));
            return this;
        }
        
        /**
         * Builds the parameters.
         * 
         * @return parameters
         */
        public PathParameters build() {
            if (single.isEmpty() && glob.isEmpty()) {
                return EMPTY;
            }
            return new PathParameters(
                    unmodifiableMap(new LinkedHashMap<>(single)),
                    unmodifiableMap(new LinkedHashMap<>(glob)));
        }
    }
}
