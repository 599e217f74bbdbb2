package alpha.waypoint.route;

import alpha.waypoint.route.Segment.Constrained;
import alpha.waypoint.route.Segment.Dynamic;
import alpha.waypoint.route.Segment.Glob;
import alpha.waypoint.route.Segment.Literal;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static java.util.stream.Collectors.joining;

/**
 * A parsed route pattern; a list of {@link Segment}s.<p>
 * 
 * For example, {@code "/download/:user/*filepath"} has the three segments
 * {@code download}, {@code :user} and {@code *filepath}. The root "/" has no
 * segments.<p>
 * 
 * The leading forward slash is optional, and a trailing slash is ignored. The
 * pattern is invalid if
 * 
 * <ul>
 *   <li>a segment is empty ("//"),</li>
 *   <li>a parameter name is empty, or repeated,</li>
 *   <li>a regular expression is empty or does not compile, or</li>
 *   <li>a glob is not the last segment.</li>
 * </ul>
 * 
 * A regular expression can not contain a forward slash, as the pattern is
 * split into segments first.<p>
 * 
 * Instances are immutable and thread-safe.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class RoutePattern
{
    private static final char SINGLE    = ':',
                              CATCH_ALL = '*',
                              REGEX     = '|';
    
    private static final RoutePattern ROOT = new RoutePattern(List.of());
    
    /**
     * Returns the root pattern "/".
     * 
     * @return the root pattern
     */
    public static RoutePattern root() {
        return ROOT;
    }
    
    /**
     * Parses a pattern.
     * 
     * @param pattern to parse
     * 
     * @return the parsed pattern
     * 
     * @throws NullPointerException
     *             if {@code pattern} is {@code null}
     * @throws RoutePatternInvalidException
     *             if the pattern is invalid
     */
    public static RoutePattern parse(String pattern) {
        if (pattern.contains("//")) {
            throw new RoutePatternInvalidException(pattern, "Segment is empty.");
        }
        String p = pattern.startsWith("/") ? pattern.substring(1) : pattern;
        if (p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        if (p.isEmpty()) {
            return ROOT;
        }
        List<Segment> segments = new ArrayList<>();
        for (String t : p.split("/")) {
            segments.add(toSegment(pattern, t));
        }
        return validate(pattern, segments);
    }
    
    private static Segment toSegment(String pattern, String token) {
        switch (token.charAt(0)) {
            case SINGLE -> {
                int bar = token.indexOf(REGEX);
                if (bar == -1) {
                    return new Dynamic(token.substring(1));
                }
                String regex = token.substring(bar + 1);
                if (regex.isEmpty()) {
                    throw new RoutePatternInvalidException(pattern,
                            "Regex of segment \"" + token + "\" is empty.");
                }
                try {
                    return new Constrained(token.substring(1, bar), Pattern.compile(regex));
                } catch (PatternSyntaxException e) {
                    throw new RoutePatternInvalidException(pattern,
                            "Regex of segment \"" + token + "\" does not compile.", e);
                }
            }
            case CATCH_ALL -> {
                return new Glob(token.substring(1));
            }
            default -> {
                return new Literal(token);
            }
        }
    }
    
    private static RoutePattern validate(String pattern, List<Segment> segments) {
        Set<String> names = new HashSet<>();
        for (int i = 0; i < segments.size(); ++i) {
            var s = segments.get(i);
            String name = nameOf(s);
            if (name == null) {
                continue;
            }
            if (name.isEmpty()) {
                throw new RoutePatternInvalidException(pattern,
                        "Parameter name of segment \"" + s + "\" is empty.");
            }
            if (!names.add(name)) {
                throw new RoutePatternInvalidException(pattern,
                        "Duplicated parameter name: \"" + name + "\"");
            }
            if (s instanceof Glob && i != segments.size() - 1) {
                throw new RoutePatternInvalidException(pattern,
                        "Catch-all path parameter must be the last segment.");
            }
        }
        return new RoutePattern(List.copyOf(segments));
    }
    
    private static String nameOf(Segment s) {
        if (s instanceof Dynamic d) {
            return d.name();
        }
        if (s instanceof Constrained c) {
            return c.name();
        }
        if (s instanceof Glob g) {
            return g.name();
        }
        return null;
    }
    
    private final List<Segment> segments;
    
    private RoutePattern(List<Segment> segments) {
        this.segments = segments;
    }
    
    /**
     * Returns a pattern of this pattern's segments followed by the given
     * pattern's segments.
     * 
     * @param suffix pattern
     * 
     * @return a concatenated pattern
     * 
     * @throws NullPointerException
     *             if {@code suffix} is {@code null}
     * @throws RoutePatternInvalidException
     *             if the concatenated pattern is invalid
     */
    public RoutePattern concat(RoutePattern suffix) {
        if (suffix.segments.isEmpty()) {
            return this;
        }
        if (segments.isEmpty()) {
            return suffix;
        }
        var all = new ArrayList<>(segments);
        all.addAll(suffix.segments);
        return validate(this + suffix.toString(), all);
    }
    
    /**
     * Returns the segments.
     * 
     * @return an unmodifiable list of segments
     */
    public List<Segment> segments() {
        return segments;
    }
    
    /**
     * Returns all parameter names.
     * 
     * @return all parameter names, in order of appearance
     */
    public List<String> parameterNames() {
        return segments.stream()
                       .map(RoutePattern::nameOf)
                       .filter(n -> n != null)
                       .toList();
    }
    
    @Override
    public boolean equals(Object obj) {
        return obj instanceof RoutePattern other && segments.equals(other.segments);
    }
    
    @Override
    public int hashCode() {
        return segments.hashCode();
    }
    
    /**
     * Returns the normalized pattern, e.g. "/a/:b/*c".
     * 
     * @return the normalized pattern
     */
    @Override
    public String toString() {
        return segments.stream()
                       .map(Segment::toString)
                       .collect(joining("/", "/", ""));
    }
}
