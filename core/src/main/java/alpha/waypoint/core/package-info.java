/**
 * Home of the library-provided router and dispatcher implementation.<p>
 * 
 * The only public type in this package is {@link
 * alpha.waypoint.core.DefaultRoutingFactory}, which is loaded by {@link
 * alpha.waypoint.RoutingFactory#load()}. All other types in this package can
 * therefore be regarded as an implementation detail.<p>
 * 
 * Implementations of public interfaces use the "Default" name-prefix. For
 * example, {@code DefaultRouter} implements {@code Router}.<p>
 * 
 * Unless documented differently, all methods within this package expect to be
 * given non-null arguments and will return non-null results.
 */
package alpha.waypoint.core;
