package com.contentforge.augmentation.service.matching;

import com.contentforge.augmentation.service.evidence.EvidenceItem;

import java.util.List;

/**
 * Best evidence found for one claim.
 *
 * @param confidence weighted score in [0, 1]
 */
public record MatchResult(
        int claimId,
        EvidenceItem evidence,
        double confidence,
        ScoreBreakdown breakdown,
        List<String> matchingNumbers,
        List<String> matchingKeywords
) {}
