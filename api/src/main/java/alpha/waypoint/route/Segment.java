package alpha.waypoint.route;

import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * A segment of a {@link RoutePattern}.
 * 
 * <table class="striped">
 *   <caption style="display:none">Segment types</caption>
 *   <thead>
 *   <tr>
 *     <th scope="col">Syntax</th>
 *     <th scope="col">Type</th>
 *     <th scope="col">Matches</th>
 *   </tr>
 *   </thead>
 *   <tbody>
 *   <tr>
 *     <th scope="row">{@code text}</th>
 *     <td>{@link Literal}</td>
 *     <td>exactly one segment equal to the text</td>
 *   </tr>
 *   <tr>
 *     <th scope="row">{@code :name}</th>
 *     <td>{@link Dynamic}</td>
 *     <td>exactly one non-empty segment</td>
 *   </tr>
 *   <tr>
 *     <th scope="row">{@code :name|regex}</th>
 *     <td>{@link Constrained}</td>
 *     <td>exactly one segment which the regex matches entirely</td>
 *   </tr>
 *   <tr>
 *     <th scope="row">{@code *name}</th>
 *     <td>{@link Glob}</td>
 *     <td>zero or more segments; must be the last segment</td>
 *   </tr>
 *   </tbody>
 * </table>
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public sealed interface Segment
{
    /**
     * A static segment.
     * 
     * @param text of segment
     */
    record Literal(String text) implements Segment {
        /**
         * Constructs this object.
         * 
         * @param text of segment
         * @throws NullPointerException if {@code text} is {@code null}
         */
        public Literal {
            requireNonNull(text);
        }
        
        @Override
        public String toString() {
            return text;
        }
    }
    
    /**
     * A single-segment parameter.
     * 
     * @param name of parameter
     */
    record Dynamic(String name) implements Segment {
        /**
         * Constructs this object.
         * 
         * @param name of parameter
         * @throws NullPointerException if {@code name} is {@code null}
         */
        public Dynamic {
            requireNonNull(name);
        }
        
        @Override
        public String toString() {
            return ":" + name;
        }
    }
    
    /**
     * A single-segment parameter, constrained by a regular expression.<p>
     * 
     * Two instances are equal if the parameter names and the sources of the
     * regular expressions are equal.
     * 
     * @param name of parameter
     * @param regex constraint
     */
    record Constrained(String name, Pattern regex) implements Segment {
        /**
         * Constructs this object.
         * 
         * @param name of parameter
         * @param regex constraint
         * @throws NullPointerException if any argument is {@code null}
         */
        public Constrained {
            requireNonNull(name);
            requireNonNull(regex);
        }
        
        /**
         * Returns {@code true} if the regex matches the entire segment.
         * 
         * @param segment decoded segment
         * @return see JavaDoc
         */
        public boolean matches(String segment) {
            return regex.matcher(segment).matches();
        }
        
        @Override
        public boolean equals(Object obj) {
            return obj instanceof Constrained other &&
                   name.equals(other.name) &&
                   regex.pattern().equals(other.regex.pattern());
        }
        
        @Override
        public int hashCode() {
            return 31 * name.hashCode() + regex.pattern().hashCode();
        }
        
        @Override
        public String toString() {
            return ":" + name + "|" + regex.pattern();
        }
    }
    
    /**
     * A parameter of the remaining zero or more segments.
     * 
     * @param name of parameter
     */
    record Glob(String name) implements Segment {
        /**
         * Constructs this object.
         * 
         * @param name of parameter
         * @throws NullPointerException if {@code name} is {@code null}
         */
        public Glob {
            requireNonNull(name);
        }
        
        @Override
        public String toString() {
            return "*" + name;
        }
    }
}
