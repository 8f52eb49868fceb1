package com.contentforge.augmentation.service.evidence;

import com.contentforge.augmentation.dto.ResearchData;
import com.contentforge.augmentation.dto.ResearchData.ResearchResult;
import com.contentforge.augmentation.util.TextFeatures;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Flattens the research bundle (statistics, expert quotes, query/answer records)
 * into one evidence pool.
 */
@Component
@Slf4j
public class EvidenceIndexer {

    static final String STATISTICS_SOURCE = "research_statistics";
    static final String QUOTES_SOURCE = "expert_quotes";
    static final String QUERY_SOURCE = "research_query";

    /**
     * @param data          research bundle; null and missing fields are read as empty
     * @param fallbackLabel source key used when no URL is known for an item
     * @return evidence items in bundle order: statistics, quotes, then results
     */
    public List<EvidenceItem> index(ResearchData data, String fallbackLabel) {
        if (data == null) {
            return List.of();
        }

        List<ResearchResult> results = nullSafe(data.getResults()).stream()
                .filter(Objects::nonNull)
                .toList();
        String bundleSource = firstNonBlank(nullSafe(data.getSources()));
        List<EvidenceItem> items = new ArrayList<>();

        for (String stat : nullSafe(data.getStatistics())) {
            if (isBlank(stat)) continue;
            String key = keyFromResults(stat, results, bundleSource, fallbackLabel);
            items.add(item(items.size(), stat, EvidenceType.STATISTIC, STATISTICS_SOURCE, key));
        }

        for (String quote : nullSafe(data.getExpertQuotes())) {
            if (isBlank(quote)) continue;
            String key = keyFromResults(quote, results, bundleSource, fallbackLabel);
            items.add(item(items.size(), quote, EvidenceType.EXPERT_OPINION, QUOTES_SOURCE, key));
        }

        for (ResearchResult result : results) {
            if (isBlank(result.getAnswer())) continue;
            String citation = firstNonBlank(nullSafe(result.getSources()));
            String source = !isBlank(result.getQuery()) ? result.getQuery()
                    : citation != null ? citation : QUERY_SOURCE;
            String key = citation != null ? citation
                    : bundleSource != null ? bundleSource : fallbackLabel;
            items.add(item(items.size(), result.getAnswer(), EvidenceType.RESEARCH_FINDING, source, key));
        }

        log.debug("Indexed {} evidence items", items.size());
        return items;
    }

    // 통계/인용문이 특정 리서치 답변에 포함되어 있으면 그 답변의 첫 출처를 사용
    private String keyFromResults(String text, List<ResearchResult> results,
                                  String bundleSource, String fallbackLabel) {
        for (ResearchResult result : results) {
            if (result.getAnswer() != null && result.getAnswer().contains(text)) {
                String citation = firstNonBlank(nullSafe(result.getSources()));
                if (citation != null) {
                    return citation;
                }
            }
        }
        return bundleSource != null ? bundleSource : fallbackLabel;
    }

    private EvidenceItem item(int ordinal, String text, EvidenceType type, String source, String sourceKey) {
        return EvidenceItem.builder()
                .ordinal(ordinal)
                .text(text)
                .type(type)
                .source(source)
                .sourceKey(sourceKey)
                .numbers(TextFeatures.numbers(text))
                .dates(TextFeatures.dates(text))
                .keywords(TextFeatures.keywords(text, Integer.MAX_VALUE))
                .build();
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }

    private static String firstNonBlank(List<String> values) {
        return values.stream().filter(v -> !isBlank(v)).map(String::strip).findFirst().orElse(null);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
