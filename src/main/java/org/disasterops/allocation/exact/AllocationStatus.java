package org.disasterops.allocation.exact;

/**
 * Outcome of the linear-programming allocator.
 */
public enum AllocationStatus {
    OPTIMAL,
    INFEASIBLE
}
