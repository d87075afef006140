package org.disasterops.routing.engine;

import org.disasterops.network.SegmentKey;

/**
 * One change applied by {@link ConditionSimulator}.
 *
 * @param segment affected segment.
 * @param value new {@code RoadCondition} or {@code TrafficLevel}.
 */
public record SimulatedChange(SegmentKey segment, Enum<?> value) {
}
