package org.disasterops.allocation.fitness;

/**
 * Minimized objectives of the Pareto search: total cost, negated coverage, negated speed.
 */
public record ObjectiveVector(double totalCost, double negatedCoverage, double negatedSpeed) {
    public static final int SIZE = 3;

    public double get(int objective) {
        return switch (objective) {
            case 0 -> totalCost;
            case 1 -> negatedCoverage;
            case 2 -> negatedSpeed;
            default -> throw new IndexOutOfBoundsException("objective " + objective + " not in [0," + SIZE + ")");
        };
    }

    /**
     * @return true when this vector is no worse on every objective and strictly better on one.
     */
    public boolean dominates(ObjectiveVector other) {
        boolean strictlyBetter = false;
        for (int i = 0; i < SIZE; i++) {
            double mine = get(i);
            double theirs = other.get(i);
            if (mine > theirs) {
                return false;
            }
            if (mine < theirs) {
                strictlyBetter = true;
            }
        }
        return strictlyBetter;
    }
}
