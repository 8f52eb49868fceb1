package com.contentforge.augmentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AugmentationResult {

    /** Cited content when citations were added, otherwise the original content */
    private String finalContent;

    /** Null when the citation stage was not requested */
    private CitationResult citations;

    /** Null when the fact-check stage was not requested */
    private FactCheckResult factCheck;
}
