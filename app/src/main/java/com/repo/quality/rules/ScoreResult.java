package com.repo.quality.rules;

import com.repo.quality.metrics.DerivedMetrics;

/**
 * Score of one author, with the metrics it was computed from.
 */
public record ScoreResult(
        String author,

        /** 0-40 */
        int commitBehavior,

        /** 0-30 */
        int qualityAndScope,

        /** 0-30 */
        int activity,

        /** 0-100 */
        int total,

        Grade grade,

        DerivedMetrics metrics) {
}
