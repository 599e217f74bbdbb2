package alpha.waypoint.message;

import alpha.waypoint.util.PercentDecoder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The decoded parameters of a query string.<p>
 * 
 * A query string "?a=1&b=2&a=3" yields the names "a" and "b" in that order,
 * with the values ["1", "3"] and ["2"] respectively. A parameter without a
 * '=' has the empty string as its value. Empty pairs ("&&") are skipped.<p>
 * 
 * Names and values are percent-decoded. A '+' character is kept as a literal
 * plus; it is not translated to a space.<p>
 * 
 * Instances are immutable and thread-safe.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class QueryParameters
{
    private static final QueryParameters EMPTY = new QueryParameters(Map.of());
    
    /**
     * Returns an empty instance.
     * 
     * @return an empty instance
     */
    public static QueryParameters empty() {
        return EMPTY;
    }
    
    /**
     * Parses the given raw query.
     * 
     * @param rawQuery the query, without the leading '?'
     * 
     * @return parsed parameters
     * 
     * @throws NullPointerException
     *             if {@code rawQuery} is {@code null}
     * @throws IllegalArgumentException
     *             if a name or a value has a malformed percent-escape
     */
    public static QueryParameters parse(String rawQuery) {
        if (rawQuery.isEmpty()) {
            return EMPTY;
        }
        Map<String, List<String>> m = new LinkedHashMap<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String k = eq == -1 ? pair : pair.substring(0, eq),
                   v = eq == -1 ? "" : pair.substring(eq + 1);
            m.computeIfAbsent(PercentDecoder.decode(k), x -> new ArrayList<>())
             .add(PercentDecoder.decode(v));
        }
        m.replaceAll((k, v) -> Collections.unmodifiableList(v));
        return new QueryParameters(Collections.unmodifiableMap(m));
    }
    
    private final Map<String, List<String>> params;
    
    private QueryParameters(Map<String, List<String>> params) {
        this.params = params;
    }
    
    /**
     * Returns the first value of the given parameter.
     * 
     * @param name of parameter
     * @return the first value, if present
     */
    public Optional<String> first(String name) {
        var v = params.get(name);
        return v == null ? Optional.empty() : Optional.of(v.get(0));
    }
    
    /**
     * Returns all values of the given parameter.
     * 
     * @param name of parameter
     * @return all values, in order of appearance (never {@code null})
     */
    public List<String> all(String name) {
        return params.getOrDefault(name, List.of());
    }
    
    /**
     * Returns all parameter names.
     * 
     * @return all parameter names, in order of first appearance
     */
    public Set<String> names() {
        return params.keySet();
    }
    
    /**
     * Returns {@code true} if there are no parameters.
     * 
     * @return see JavaDoc
     */
    public boolean isEmpty() {
        return params.isEmpty();
    }
    
    /**
     * Returns an unmodifiable map view of the parameters.
     * 
     * @return an unmodifiable map view of the parameters
     */
    public Map<String, List<String>> asMap() {
        return params;
    }
    
    @Override
    public boolean equals(Object obj) {
        return obj instanceof QueryParameters other && params.equals(other.params);
    }
    
    @Override
    public int hashCode() {
        return params.hashCode();
    }
    
    @Override
    public String toString() {
        return "QueryParameters" + params;
    }
}
