package com.nyct.transitgraph;

import com.google.common.collect.ImmutableSet;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;

import java.util.Collection;

/**
 * Which route types take part in assembly: an allow-set of codes, or every route.
 */
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class RouteTypeFilter {
    private static final RouteTypeFilter ALL = new RouteTypeFilter(null);

    private final ImmutableSet<Integer> allowedTypes;

    public static RouteTypeFilter all() {
        return ALL;
    }

    public static RouteTypeFilter of(Integer... routeTypes) {
        return new RouteTypeFilter(ImmutableSet.copyOf(routeTypes));
    }

    public static RouteTypeFilter of(Collection<Integer> routeTypes) {
        return new RouteTypeFilter(ImmutableSet.copyOf(routeTypes));
    }

    public boolean accepts(RouteRecord route) {
        return allowedTypes == null || allowedTypes.contains(route.getRouteType());
    }

    @Override
    public String toString() {
        return allowedTypes == null ? "all route types" : "route types " + allowedTypes;
    }
}
