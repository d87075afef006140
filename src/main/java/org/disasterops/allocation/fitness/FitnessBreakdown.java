package org.disasterops.allocation.fitness;

/**
 * Components of one fitness evaluation.
 *
 * @param totalDistance travel cost of reachable pairs plus the penalty of unreachable ones.
 * @param coverage sum over reachable pairs of {@code priority / 5 * match}.
 * @param resourceEfficiency sum over reachable pairs of the resource match.
 * @param fitness weighted score, higher is better.
 * @param unreachablePairs assigned pairs without a path.
 */
public record FitnessBreakdown(
        double totalDistance,
        double coverage,
        double resourceEfficiency,
        double fitness,
        int unreachablePairs
) {
}
