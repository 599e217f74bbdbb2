package alpha.waypoint.core;

import alpha.waypoint.route.MatchOutcome;
import alpha.waypoint.route.PathParameters;
import alpha.waypoint.route.Route;
import alpha.waypoint.route.RouteCollisionException;
import alpha.waypoint.route.RoutePattern;
import alpha.waypoint.route.Segment;
import alpha.waypoint.route.Segment.Constrained;
import alpha.waypoint.route.Segment.Dynamic;
import alpha.waypoint.route.Segment.Glob;
import alpha.waypoint.route.Segment.Literal;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static alpha.waypoint.HttpConstants.Method.GET;
import static alpha.waypoint.HttpConstants.Method.HEAD;
import static java.lang.System.Logger.Level.WARNING;
import static java.text.MessageFormat.format;

/**
 * A segment tree of routes.<p>
 * 
 * Each node of the tree may have literal children keyed by the segment text,
 * regex children in order of registration keyed by the source text of the
 * regex, one dynamic child and one glob child. A node also holds the routes
 * that terminate at its position. Parameter names are not stored in the tree,
 * they belong to the route. I.e., route "/user/:id/file/*path" is stored
 * as:
 * 
 * <pre>
 *   root -> "user" -> dynamic -> "file" -> glob -> route object
 * </pre>
 * 
 * A node may also delegate the rest of the path to the tree of another
 * router. A delegated match is translated into a route of this tree, whose
 * pattern is the delegation prefix followed by the pattern of the matched
 * route.<p>
 * 
 * The tree is written to by one thread only, during the build of a router.
 * After that, the tree is only read, and may be shared across threads.
 * 
 * @param <L> lineage of the pipeline set
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class RouteTree<L>
{
    private static final System.Logger LOG
            = System.getLogger(RouteTree.class.getPackageName());
    
    /**
     * Regexes known to match every non-empty segment.
     */
    private static final Set<String> MATCH_ANYTHING = Set.of(
            ".*", ".+", ".*?", ".+?", "\\S+", "\\S*");
    
    private final Node<L> root = new Node<>();
    
    /**
     * Adds a route.
     * 
     * @param route to add
     * 
     * @throws RouteCollisionException
     *             if the route's position has a route with an intersecting
     *             method
     */
    void add(Route<L> route) {
        Node<L> n = root;
        for (Segment s : route.pattern().segments()) {
            n = n.nextOrCreate(s);
        }
        n.addRoute(route);
    }
    
    /**
     * Delegates paths below the given prefix to another tree.
     * 
     * @param prefix of delegation
     * @param target tree
     * @param rewrites of the target's routes, as seen from this tree
     * 
     * @throws RouteCollisionException
     *             if the prefix already delegates, or has a glob child
     */
    void delegate(RoutePattern prefix, RouteTree<L> target, Map<Route<L>, Route<L>> rewrites) {
        Node<L> n = root;
        for (Segment s : prefix.segments()) {
            n = n.nextOrCreate(s);
        }
        if (n.delegate != null || n.glob != null) {
            throw new RouteCollisionException(format(
                "Delegation on \"{0}\" collides with an already added {1}.",
                prefix, n.delegate != null ? "delegation" : "glob route"));
        }
        n.delegate = new Delegation<>(target, rewrites);
    }
    
    /**
     * Logs a warning for each child of a node that comes after a
     * match-anything regex child.
     */
    void warnShadowed() {
        root.warnShadowed("");
    }
    
    /**
     * Finds a route.
     * 
     * @param method of request
     * @param segments of request path, percent-decoded
     * @param headFromGet whether to let HEAD match a GET route
     * 
     * @return the outcome (never {@code null})
     */
    MatchOutcome<L> lookup(String method, List<String> segments, boolean headFromGet) {
        var s = new Search<L>(method, segments, headFromGet);
        if (s.visit(root, 0)) {
            return s.matched;
        }
        return s.noVerb != null ? s.noVerb : MatchOutcome.noMatch();
    }
    
    private record Delegation<L>(RouteTree<L> target, Map<Route<L>, Route<L>> rewrites) {
        // Empty
    }
    
    private static final class Node<L> {
        final Map<String, Node<L>> literals = new HashMap<>();
        // Ordered by registration, keyed by regex
        final List<Map.Entry<Constrained, Node<L>>> regex = new ArrayList<>();
        Node<L> dynamic, glob;
        Delegation<L> delegate;
        final List<Route<L>> routes = new ArrayList<>();
        
        Node<L> nextOrCreate(Segment s) {
            if (s instanceof Literal l) {
                return literals.computeIfAbsent(l.text(), k -> new Node<>());
            }
            if (s instanceof Constrained c) {
                for (var e : regex) {
                    if (e.getKey().regex().pattern().equals(c.regex().pattern())) {
                        return e.getValue();
                    }
                }
                var n = new Node<L>();
                regex.add(Map.entry(c, n));
                return n;
            }
            if (s instanceof Dynamic) {
                return dynamic != null ? dynamic : (dynamic = new Node<>());
            }
            assert s instanceof Glob;
            if (delegate != null) {
                throw new RouteCollisionException(
                    "Glob segment \"" + s + "\" collides with an already added delegation.");
            }
            return glob != null ? glob : (glob = new Node<>());
        }
        
        void addRoute(Route<L> r) {
            for (var old : routes) {
                for (String m : r.methods()) {
                    if (old.accepts(m)) {
                        throw new RouteCollisionException(r, old, m);
                    }
                }
            }
            routes.add(r);
        }
        
        void warnShadowed(String path) {
            Constrained anything = null;
            for (var e : regex) {
                var c = e.getKey();
                if (anything != null) {
                    warn(path + "/" + anything, path + "/" + c);
                } else if (MATCH_ANYTHING.contains(c.regex().pattern())) {
                    anything = c;
                }
            }
            if (anything != null && dynamic != null) {
                warn(path + "/" + anything, path + "/:");
            }
            literals.forEach((k, n) -> n.warnShadowed(path + "/" + k));
            regex.forEach(e -> e.getValue().warnShadowed(path + "/" + e.getKey()));
            if (dynamic != null) {
                dynamic.warnShadowed(path + "/:");
            }
            if (glob != null) {
                glob.warnShadowed(path + "/*");
            }
        }
        
        private static void warn(String by, String shadowed) {
            LOG.log(WARNING, () -> format(
                "Regex segment \"{0}\" matches any segment, routes below \"{1}\" are reachable only by backtracking.",
                by, shadowed));
        }
    }
    
    private static final class Search<L> {
        final String method;
        final List<String> segments;
        final boolean headFromGet;
        MatchOutcome.Matched<L> matched;
        MatchOutcome.PathMatchedNoVerb<L> noVerb;
        
        Search(String method, List<String> segments, boolean headFromGet) {
            this.method = method;
            this.segments = segments;
            this.headFromGet = headFromGet;
        }
        
        boolean visit(Node<L> n, int i) {
            if (i == segments.size()) {
                if (terminal(n.routes)) {
                    return true;
                }
            } else {
                final String s = segments.get(i);
                Node<L> c = n.literals.get(s);
                if (c != null && visit(c, i + 1)) {
                    return true;
                }
                // Parameters capture one non-empty segment
                if (!s.isEmpty()) {
                    for (var e : n.regex) {
                        if (e.getKey().matches(s) && visit(e.getValue(), i + 1)) {
                            return true;
                        }
                    }
                    if (n.dynamic != null && visit(n.dynamic, i + 1)) {
                        return true;
                    }
                }
            }
            // Glob and delegation consume the rest, zero or more segments
            if (n.glob != null && terminal(n.glob.routes)) {
                return true;
            }
            return n.delegate != null && delegated(n.delegate, i);
        }
        
        private boolean delegated(Delegation<L> d, int i) {
            var inner = d.target().lookup(
                    method, segments.subList(i, segments.size()), headFromGet);
            if (inner instanceof MatchOutcome.Matched<L> m) {
                Route<L> r = d.rewrites().get(m.route());
                assert r != null;
                matched = new MatchOutcome.Matched<>(r, parameters(r));
                return true;
            }
            if (inner instanceof MatchOutcome.PathMatchedNoVerb<L> p && noVerb == null) {
                noVerb = p;
            }
            return false;
        }
        
        private boolean terminal(List<Route<L>> routes) {
            if (routes.isEmpty()) {
                return false;
            }
            Route<L> hit = find(routes, method);
            if (hit == null && headFromGet && method.equals(HEAD)) {
                hit = find(routes, GET);
            }
            if (hit != null) {
                matched = new MatchOutcome.Matched<>(hit, parameters(hit));
                return true;
            }
            if (noVerb == null) {
                Set<String> allowed = new LinkedHashSet<>();
                routes.forEach(r -> allowed.addAll(r.methods()));
                if (headFromGet && allowed.contains(GET)) {
                    allowed.add(HEAD);
                }
                noVerb = new MatchOutcome.PathMatchedNoVerb<>(allowed);
            }
            return false;
        }
        
        private static <T> Route<T> find(List<Route<T>> routes, String method) {
            for (var r : routes) {
                if (r.accepts(method)) {
                    return r;
                }
            }
            return null;
        }
        
        // Each pattern segment before a glob consumes exactly one path segment
        private PathParameters parameters(Route<L> r) {
            var b = PathParameters.builder();
            var pattern = r.pattern().segments();
            for (int i = 0; i < pattern.size(); ++i) {
                Segment s = pattern.get(i);
                if (s instanceof Dynamic d) {
                    b.single(d.name(), segments.get(i));
                } else if (s instanceof Constrained c) {
                    b.single(c.name(), segments.get(i));
                } else if (s instanceof Glob g) {
                    b.glob(g.name(), segments.subList(i, segments.size()));
                }
            }
            return b.build();
        }
    }
}
