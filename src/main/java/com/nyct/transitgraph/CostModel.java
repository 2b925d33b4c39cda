package com.nyct.transitgraph;

/**
 * How a scalar edge weight is derived from edge attributes.
 */
public enum CostModel {
    /** Haversine great-circle distance between station centroids, km. */
    GEOGRAPHIC,
    /** Fastest scheduled traversal observed on the segment, seconds. */
    TRAVEL_TIME,
    /** WGS84 geodesic distance between station centroids, km. */
    ELLIPSOIDAL
}
