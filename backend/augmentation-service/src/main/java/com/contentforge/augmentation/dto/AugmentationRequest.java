package com.contentforge.augmentation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request for the combined citation + fact-check run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AugmentationRequest {

    private String content;

    private ResearchData researchData;

    /** apa | mla | chicago; null uses the configured default */
    private String citationStyle;

    @Builder.Default
    private boolean includeCitations = true;

    @Builder.Default
    private boolean includeFactCheck = true;

    /** Fact-check the cited content instead of the original when citations were added */
    @Builder.Default
    private boolean factCheckCitedContent = true;
}
