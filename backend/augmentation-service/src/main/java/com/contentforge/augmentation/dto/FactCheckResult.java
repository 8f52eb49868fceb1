package com.contentforge.augmentation.dto;

import com.contentforge.augmentation.service.claim.ClaimType;
import com.contentforge.augmentation.service.evidence.EvidenceType;
import com.contentforge.augmentation.service.factcheck.VerificationStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result of the fact-check stage
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FactCheckResult {

    private List<VerifiedClaim> verifiedClaims;

    private VerificationStatistics statistics;

    private List<String> recommendations;

    /** Priority-weighted accuracy in [0, 1] */
    private double accuracyScore;

    private FactCheckMetadata metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VerifiedClaim {
        private int id;
        private String text;
        private ClaimType type;
        private String patternName;
        /** 1 = highest */
        private int priority;
        private int startPos;
        private int endPos;
        /** Heading the claim falls under */
        private String location;
        private List<String> extractedNumbers;
        private List<String> extractedDates;
        private List<String> keywords;
        private VerificationStatus status;
        private double confidence;
        private String supportingSource;
        private String supportingTextExcerpt;
        private VerificationDetails verificationDetails;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VerificationDetails {
        private double bestMatchConfidence;
        private EvidenceType matchType;
        private List<String> matchingNumbers;
        private List<String> matchingKeywords;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VerificationStatistics {
        private int totalClaims;
        private int verified;
        private int unsupported;
        private int needsReview;

        public static VerificationStatistics none() {
            return new VerificationStatistics(0, 0, 0, 0);
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class FactCheckMetadata {
        private double processingTimeSeconds;
        private Integer claimsExtracted;
        private Double confidenceThreshold;
        private boolean verificationComplete;
        private boolean noResearchData;
        private String error;
    }
}
