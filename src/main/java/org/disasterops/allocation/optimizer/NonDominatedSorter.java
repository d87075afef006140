package org.disasterops.allocation.optimizer;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.experimental.UtilityClass;
import org.disasterops.allocation.fitness.ObjectiveVector;

import java.util.ArrayList;
import java.util.List;

/**
 * Fast non-dominated sort with domination counts.
 *
 * <p>Front {@code k} holds the indexes dominated only by members of fronts {@code < k}.
 * Fronts are non-empty and partition {@code [0, n)}.</p>
 */
@UtilityClass
public class NonDominatedSorter {

    public static List<IntArrayList> sort(List<ObjectiveVector> objectives) {
        int n = objectives.size();
        int[] dominationCount = new int[n];
        IntArrayList[] dominated = new IntArrayList[n];
        List<IntArrayList> fronts = new ArrayList<>();
        IntArrayList current = new IntArrayList();

        for (int i = 0; i < n; i++) {
            dominated[i] = new IntArrayList();
            for (int j = 0; j < n; j++) {
                if (i == j) {
                    continue;
                }
                if (objectives.get(i).dominates(objectives.get(j))) {
                    dominated[i].add(j);
                } else if (objectives.get(j).dominates(objectives.get(i))) {
                    dominationCount[i]++;
                }
            }
            if (dominationCount[i] == 0) {
                current.add(i);
            }
        }

        while (!current.isEmpty()) {
            fronts.add(current);
            IntArrayList next = new IntArrayList();
            for (int k = 0; k < current.size(); k++) {
                IntArrayList dominatedByI = dominated[current.getInt(k)];
                for (int m = 0; m < dominatedByI.size(); m++) {
                    int j = dominatedByI.getInt(m);
                    if (--dominationCount[j] == 0) {
                        next.add(j);
                    }
                }
            }
            current = next;
        }
        return fronts;
    }

    /**
     * @return rank per index: 0 for the first front, 1 for the second, and so on.
     */
    public static int[] ranks(List<IntArrayList> fronts, int size) {
        int[] rank = new int[size];
        for (int f = 0; f < fronts.size(); f++) {
            IntArrayList front = fronts.get(f);
            for (int k = 0; k < front.size(); k++) {
                rank[front.getInt(k)] = f;
            }
        }
        return rank;
    }
}
