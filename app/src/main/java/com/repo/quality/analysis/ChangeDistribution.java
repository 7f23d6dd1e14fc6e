package com.repo.quality.analysis;

import java.util.Collection;

/**
 * Histogram of how often files changed: 1-5, 6-15, 16-30 and more than 30 times.
 */
public record ChangeDistribution(int low, int medium, int high, int veryHigh) {

    public static ChangeDistribution of(Collection<Integer> changeCounts) {
        int low = 0;
        int medium = 0;
        int high = 0;
        int veryHigh = 0;
        for (int count : changeCounts) {
            if (count <= 5)
                low++;
            else if (count <= 15)
                medium++;
            else if (count <= 30)
                high++;
            else
                veryHigh++;
        }
        return new ChangeDistribution(low, medium, high, veryHigh);
    }

    public int total() {
        return low + medium + high + veryHigh;
    }
}
