package com.contentforge.augmentation.service.claim;

import com.contentforge.augmentation.service.evidence.EvidenceType;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of verifiable statement. Each type names the evidence type that counts as
 * agreeing with it for the type bonus; statistical shapes all agree with statistic evidence.
 */
public enum ClaimType {
    STATISTIC("statistic", EvidenceType.STATISTIC),
    FINANCIAL("financial", EvidenceType.STATISTIC),
    GROWTH("growth", EvidenceType.STATISTIC),
    MARKET("market", EvidenceType.STATISTIC),
    TEMPORAL("temporal", null),
    RESEARCH("research", EvidenceType.RESEARCH_FINDING),
    QUANTITATIVE("quantitative", EvidenceType.STATISTIC),
    COMPARATIVE("comparative", EvidenceType.STATISTIC),
    ATTRIBUTION("attribution", EvidenceType.EXPERT_OPINION),
    TREND("trend", null);

    private final String code;
    private final EvidenceType affinity;

    ClaimType(String code, EvidenceType affinity) {
        this.code = code;
        this.affinity = affinity;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean agreesWith(EvidenceType evidenceType) {
        return affinity != null && affinity == evidenceType;
    }
}
