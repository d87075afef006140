package org.disasterops.routing.heuristic;

/**
 * Supported heuristic modes.
 *
 * <p>{@code NONE} disables guidance (Dijkstra behavior). {@code GEOGRAPHIC} scales
 * great-circle distance by a calibrated lower-bound cost per kilometre.</p>
 */
public enum HeuristicType {
    NONE,
    GEOGRAPHIC
}
