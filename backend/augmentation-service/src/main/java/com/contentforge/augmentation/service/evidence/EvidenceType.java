package com.contentforge.augmentation.service.evidence;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EvidenceType {
    STATISTIC("statistic"),
    EXPERT_OPINION("expert_opinion"),
    RESEARCH_FINDING("research_finding");

    private final String code;

    EvidenceType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
