package alpha.waypoint.core;

import alpha.waypoint.route.MalformedPathException;
import alpha.waypoint.util.PercentDecoder;

import java.util.Arrays;
import java.util.List;

/**
 * Splits a request path into percent-decoded segments.<p>
 * 
 * The root is not a segment, and a trailing empty segment is dropped, so the
 * paths "", "/" and "/a/" have zero, zero and one segment respectively.
 * Interior empty segments are kept; "/a//b" has three segments ("a", "" and
 * "b"). A query and a fragment, if present, are ignored.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class RequestPath
{
    private RequestPath() {
        // Empty
    }
    
    /**
     * Returns the decoded segments of the given path.
     * 
     * @param path to split
     * 
     * @return the segments (unmodifiable)
     * 
     * @throws MalformedPathException
     *             if a segment has a malformed percent-encoding
     */
    static List<String> segments(String path) {
        String p = strip(path);
        if (p.startsWith("/")) {
            p = p.substring(1);
        }
        if (p.isEmpty()) {
            return List.of();
        }
        List<String> raw = Arrays.asList(p.split("/", -1));
        if (raw.get(raw.size() - 1).isEmpty()) {
            raw = raw.subList(0, raw.size() - 1);
        }
        try {
            return PercentDecoder.decode(raw);
        } catch (IllegalArgumentException e) {
            throw new MalformedPathException(path, e);
        }
    }
    
    private static String strip(String path) {
        int end = path.length();
        int q = path.indexOf('?'),
            f = path.indexOf('#');
        if (q != -1) {
            end = q;
        }
        if (f != -1 && f < end) {
            end = f;
        }
        return path.substring(0, end);
    }
}
