package com.contentforge.augmentation.service.claim;

import com.contentforge.augmentation.config.AugmentationProperties;

/**
 * Mode-specific validity bounds for extracted claims.
 */
public record ExtractionPolicy(int minLength, int maxLength, int dedupWindow, int maxKeywords) {

    public static ExtractionPolicy forFactCheck(AugmentationProperties properties) {
        return new ExtractionPolicy(
                properties.getFactCheck().getMinClaimLength(),
                properties.getFactCheck().getMaxClaimLength(),
                properties.getExtraction().getDedupWindow(),
                properties.getExtraction().getMaxKeywords());
    }

    /** Citation mode has no upper bound on claim length. */
    public static ExtractionPolicy forCitation(AugmentationProperties properties) {
        return new ExtractionPolicy(
                properties.getCitation().getMinClaimLength(),
                Integer.MAX_VALUE,
                properties.getExtraction().getDedupWindow(),
                properties.getExtraction().getMaxKeywords());
    }

    public boolean acceptsLength(int length) {
        return length >= minLength && length <= maxLength;
    }
}
