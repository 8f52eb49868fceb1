package com.contentforge.augmentation.service.matching;

/**
 * Unweighted sub-scores of one claim/evidence comparison, each in [0, 1].
 *
 * @param textSimilarity LCS ratio of the lower-cased texts
 * @param numberOverlap  mean per-claim-number credit (1.0 exact, close credit otherwise)
 * @param keywordOverlap |claim keywords ∩ evidence keywords| / |claim keywords|
 * @param typeBonus      1.0 when the claim type agrees with the evidence type
 */
public record ScoreBreakdown(
        double textSimilarity,
        double numberOverlap,
        double keywordOverlap,
        double typeBonus
) {}
