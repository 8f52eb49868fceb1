package com.contentforge.augmentation.service.factcheck;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VerificationStatus {
    VERIFIED("verified"),
    NEEDS_REVIEW("needs_review"),
    UNSUPPORTED("unsupported");

    private final String code;

    VerificationStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static VerificationStatus classify(double confidence, double verifiedThreshold, double reviewThreshold) {
        if (confidence >= verifiedThreshold) return VERIFIED;
        if (confidence >= reviewThreshold) return NEEDS_REVIEW;
        return UNSUPPORTED;
    }
}
