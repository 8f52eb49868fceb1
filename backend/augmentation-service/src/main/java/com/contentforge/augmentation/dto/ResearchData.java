package com.contentforge.augmentation.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Research bundle produced by the upstream research stage.
 *
 * Every field may be null or empty; readers treat that as "no evidence".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResearchData {

    /** Freestanding statistic sentences */
    private List<String> statistics;

    /** Quoted expert opinions */
    @JsonAlias("expert_quotes")
    private List<String> expertQuotes;

    /** Query/answer records from the research step */
    private List<ResearchResult> results;

    /** Bundle-wide source URLs, used when a record carries none */
    private List<String> sources;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResearchResult {
        private String query;
        private String answer;
        private List<String> sources;
    }

    public static ResearchData empty() {
        return new ResearchData();
    }
}
