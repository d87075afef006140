package org.disasterops.allocation.optimizer;

import lombok.experimental.UtilityClass;
import org.disasterops.allocation.fitness.ObjectiveVector;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * NSGA-II crowding distance within one front.
 *
 * <p>Per objective, the two extreme members get {@code +INF}; interior members accumulate
 * the gap between their neighbours divided by the objective's range. Objectives with zero
 * range add nothing.</p>
 */
@UtilityClass
public class CrowdingDistance {

    public static double[] compute(List<ObjectiveVector> front) {
        int n = front.size();
        double[] distance = new double[n];
        if (n == 0) {
            return distance;
        }
        List<Integer> order = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            order.add(i);
        }
        for (int objective = 0; objective < ObjectiveVector.SIZE; objective++) {
            final int m = objective;
            order.sort(Comparator.comparingDouble((Integer i) -> front.get(i).get(m)).thenComparingInt(i -> i));
            int first = order.get(0);
            int last = order.get(n - 1);
            distance[first] = Double.POSITIVE_INFINITY;
            distance[last] = Double.POSITIVE_INFINITY;
            double range = front.get(last).get(m) - front.get(first).get(m);
            if (range > 0.0d) {
                for (int k = 1; k < n - 1; k++) {
                    int i = order.get(k);
                    distance[i] += (front.get(order.get(k + 1)).get(m) - front.get(order.get(k - 1)).get(m)) / range;
                }
            }
        }
        return distance;
    }
}
