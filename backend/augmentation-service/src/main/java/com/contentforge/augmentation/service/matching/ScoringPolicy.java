package com.contentforge.augmentation.service.matching;

import com.contentforge.augmentation.config.AugmentationProperties;

/**
 * Immutable snapshot of the confidence-weighting policy.
 */
public record ScoringPolicy(
        double textSimilarityWeight,
        double numberOverlapWeight,
        double keywordOverlapWeight,
        double typeBonusWeight,
        double closeNumberCredit,
        double smallNumberLimit,
        double smallNumberTolerance,
        double relativeTolerance
) {

    public static ScoringPolicy defaults() {
        return from(new AugmentationProperties.Scoring());
    }

    public static ScoringPolicy from(AugmentationProperties.Scoring scoring) {
        return new ScoringPolicy(
                scoring.getTextSimilarityWeight(),
                scoring.getNumberOverlapWeight(),
                scoring.getKeywordOverlapWeight(),
                scoring.getTypeBonusWeight(),
                scoring.getCloseNumberCredit(),
                scoring.getSmallNumberLimit(),
                scoring.getSmallNumberTolerance(),
                scoring.getRelativeTolerance());
    }
}
