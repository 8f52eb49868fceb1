package com.contentforge.augmentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result of the citation stage
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CitationResult {

    /** Content with inline [n] markers and the appended References section */
    private String citedContent;

    private List<CitationEntry> bibliography;

    /** Number of bibliography entries */
    private int citationCount;

    private List<UncitedClaim> uncitedClaims;

    private CitationMetadata metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UncitedClaim {
        private String text;
        private String type;
        /** "No matching source found" or "Low confidence match" */
        private String reason;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CitationMetadata {
        private double processingTimeSeconds;
        private Integer totalClaimsIdentified;
        private Integer claimsWithSources;
        private String citationStyle;
        private Double successRate;
        private boolean noResearchData;
        private String error;
    }
}
