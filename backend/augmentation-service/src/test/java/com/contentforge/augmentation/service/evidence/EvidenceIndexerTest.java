package com.contentforge.augmentation.service.evidence;

import com.contentforge.augmentation.dto.ResearchData;
import com.contentforge.augmentation.dto.ResearchData.ResearchResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class EvidenceIndexerTest {

    private static final String FALLBACK = "Research Data";

    private final EvidenceIndexer indexer = new EvidenceIndexer();

    @Test
    @DisplayName("null 또는 빈 번들은 빈 증거 풀")
    void emptyBundle() {
        assertThat(indexer.index(null, FALLBACK)).isEmpty();
        assertThat(indexer.index(ResearchData.empty(), FALLBACK)).isEmpty();
    }

    @Test
    @DisplayName("통계, 인용문, 리서치 답변 순으로 인덱싱하고 출처 키를 결정")
    void bundleOrderAndSourceKeys() {
        // given
        ResearchData data = ResearchData.builder()
                .statistics(List.of("Sales increased 25% in 2023", "  "))
                .expertQuotes(List.of("\"AI will reshape retail\", said Jane Doe"))
                .results(Arrays.asList(
                        ResearchResult.builder()
                                .query("retail growth 2023")
                                .answer("Sales increased 25% in 2023, according to the census.")
                                .sources(List.of("https://www.census.gov/retail"))
                                .build(),
                        ResearchResult.builder().query("no answer").build(),
                        null))
                .sources(List.of("https://bundle.example.com/report"))
                .build();

        // when
        List<EvidenceItem> items = indexer.index(data, FALLBACK);

        // then
        assertThat(items)
                .extracting(EvidenceItem::getOrdinal, EvidenceItem::getType,
                        EvidenceItem::getSource, EvidenceItem::getSourceKey)
                .containsExactly(
                        tuple(0, EvidenceType.STATISTIC, EvidenceIndexer.STATISTICS_SOURCE,
                                "https://www.census.gov/retail"),
                        tuple(1, EvidenceType.EXPERT_OPINION, EvidenceIndexer.QUOTES_SOURCE,
                                "https://bundle.example.com/report"),
                        tuple(2, EvidenceType.RESEARCH_FINDING, "retail growth 2023",
                                "https://www.census.gov/retail"));
    }

    @Test
    @DisplayName("증거 항목도 주장과 같은 숫자/키워드 토큰을 가짐")
    void derivedTokens() {
        ResearchData data = ResearchData.builder()
                .statistics(List.of("Sales increased 25% in 2023"))
                .build();

        EvidenceItem item = indexer.index(data, FALLBACK).get(0);

        assertThat(item.getNumbers()).containsExactly("25%", "25", "2023");
        assertThat(item.getDates()).contains("2023", "in 2023");
        assertThat(item.getKeywords()).containsExactly("sales", "increased");
    }

    @Test
    @DisplayName("출처 URL이 없으면 쿼리 라벨과 대체 라벨 사용")
    void fallbackLabels() {
        ResearchData data = ResearchData.builder()
                .results(List.of(
                        ResearchResult.builder().answer("Remote work adoption doubled.").build(),
                        ResearchResult.builder().answer("Hybrid schedules are common.")
                                .sources(List.of(" ", "https://a.example.com/hybrid")).build()))
                .build();

        List<EvidenceItem> items = indexer.index(data, FALLBACK);

        assertThat(items)
                .extracting(EvidenceItem::getSource, EvidenceItem::getSourceKey)
                .containsExactly(
                        tuple(EvidenceIndexer.QUERY_SOURCE, FALLBACK),
                        tuple("https://a.example.com/hybrid", "https://a.example.com/hybrid"));
    }
}
