package org.disasterops.routing.search;

/**
 * Route search strategy selector.
 */
public enum RoutingAlgorithm {
    DIJKSTRA,
    A_STAR
}
