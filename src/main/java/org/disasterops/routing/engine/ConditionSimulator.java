package org.disasterops.routing.engine;

import lombok.extern.slf4j.Slf4j;
import org.disasterops.network.RoadCondition;
import org.disasterops.network.SegmentKey;
import org.disasterops.network.TrafficLevel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Caller-triggered traffic and incident generator for drills and demos.
 *
 * <p>Every change goes through the engine's public update operations, so invalidation and
 * recalculation behave exactly as for real reports.</p>
 */
@Slf4j
public final class ConditionSimulator {
    static final int TRAFFIC_SAMPLE_SIZE = 3;
    static final int INCIDENT_SAMPLE_SIZE = 2;
    static final double DEGRADED_PROBABILITY = 0.7d;

    private static final RoadCondition[] DEGRADED = {RoadCondition.POOR, RoadCondition.DAMAGED};

    private final DynamicRoutingEngine engine;
    private final Random random;

    public ConditionSimulator(DynamicRoutingEngine engine, Random random) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Assigns a random traffic level to up to three distinct random segments.
     */
    public List<SimulatedChange> simulateTraffic() {
        List<SimulatedChange> changes = new ArrayList<>();
        TrafficLevel[] levels = TrafficLevel.values();
        for (SegmentKey key : sample(TRAFFIC_SAMPLE_SIZE)) {
            TrafficLevel level = levels[random.nextInt(levels.length)];
            if (engine.updateTraffic(key.from(), key.to(), level)) {
                changes.add(new SimulatedChange(key, level));
            }
        }
        log.debug("Simulated {} traffic changes", changes.size());
        return changes;
    }

    /**
     * Degrades up to two distinct random segments: POOR or DAMAGED with probability 0.7,
     * otherwise BLOCKED.
     */
    public List<SimulatedChange> simulateIncidents() {
        List<SimulatedChange> changes = new ArrayList<>();
        for (SegmentKey key : sample(INCIDENT_SAMPLE_SIZE)) {
            RoadCondition condition = random.nextDouble() < DEGRADED_PROBABILITY
                    ? DEGRADED[random.nextInt(DEGRADED.length)]
                    : RoadCondition.BLOCKED;
            if (engine.updateCondition(key.from(), key.to(), condition)) {
                changes.add(new SimulatedChange(key, condition));
            }
        }
        log.debug("Simulated {} road incidents", changes.size());
        return changes;
    }

    private List<SegmentKey> sample(int size) {
        List<SegmentKey> keys = new ArrayList<>(engine.segmentKeys());
        Collections.shuffle(keys, random);
        return keys.subList(0, Math.min(size, keys.size()));
    }
}
