package com.contentforge.augmentation.service.claim;

import com.contentforge.augmentation.service.evidence.EvidenceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.regex.Matcher;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class ClaimPatternTest {

    static Stream<Arguments> samples() {
        return Stream.of(
                Arguments.of(ClaimPattern.GROWTH_METRICS,
                        "Sales grew by 25% in 2023", "Sales grew by 25%"),
                Arguments.of(ClaimPattern.PERCENTAGE_STATISTICS,
                        "Nearly 40% of users churned", "Nearly 40%"),
                Arguments.of(ClaimPattern.FINANCIAL_FIGURES,
                        "Revenue reached $1.5 billion last year", "Revenue reached $1.5 billion"),
                Arguments.of(ClaimPattern.MARKET_DATA,
                        "The market size reached $4.2 billion in 2024", "The market size reached $4.2 billion"),
                Arguments.of(ClaimPattern.TEMPORAL_CLAIMS,
                        "The company expanded in 2021 to Europe", "The company expanded in 2021"),
                Arguments.of(ClaimPattern.RESEARCH_FINDINGS,
                        "A recent survey found that remote work is here to stay",
                        "A recent survey found that remote work is here to stay"),
                Arguments.of(ClaimPattern.QUANTITATIVE_CLAIMS,
                        "The platform now serves 2,500 customers worldwide",
                        "The platform now serves 2,500 customers"),
                Arguments.of(ClaimPattern.COMPARATIVE_CLAIMS,
                        "The new engine runs 3x faster than before",
                        "The new engine runs 3x faster than before"),
                Arguments.of(ClaimPattern.EXPERT_ATTRIBUTIONS,
                        "According to analysts the sector will double",
                        "According to analysts the sector will double"),
                Arguments.of(ClaimPattern.TREND_CLAIMS,
                        "Python remains the most popular language for data work",
                        "Python remains the most popular language for data work")
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("samples")
    @DisplayName("각 규칙은 문장 시작부터 트리거까지 매칭")
    void matchesSample(ClaimPattern rule, String sentence, String expected) {
        Matcher m = rule.getPattern().matcher(sentence);

        assertThat(m.find()).isTrue();
        assertThat(m.group()).isEqualTo(expected);
    }

    @ParameterizedTest
    @EnumSource(ClaimPattern.class)
    @DisplayName("매칭은 마침표를 넘어가지 않음")
    void neverCrossesSentenceBoundary(ClaimPattern rule) {
        Matcher m = rule.getPattern().matcher("Plain opening words. Sales grew by 25% in 2023 and experts say the trend is popular");

        while (m.find()) {
            assertThat(m.group()).doesNotContain(".");
        }
    }

    @ParameterizedTest
    @EnumSource(ClaimPattern.class)
    @DisplayName("매칭은 줄바꿈을 넘어가지 않음")
    void neverCrossesLineBreak(ClaimPattern rule) {
        Matcher m = rule.getPattern().matcher("Heading without facts\nSales grew by 25% in 2023 according to analysts");

        while (m.find()) {
            assertThat(m.group()).doesNotContain("\n");
        }
    }

    @ParameterizedTest
    @EnumSource(ClaimPattern.class)
    @DisplayName("마침표 없는 긴 줄에서도 다음 줄까지 매칭 계속")
    void longLineWithoutPeriod(ClaimPattern rule) {
        Matcher m = rule.getPattern().matcher("word ".repeat(1200)
                + "\nAnalysts say the market size reached $4.2 billion in 2024 as sales grew by 25%, "
                + "3x faster than 1,200 customers expected as a study found a leading trend");

        int lastEnd = -1;
        while (m.find()) {
            lastEnd = m.end();
        }
        assertThat(lastEnd).isGreaterThan(6000);
    }

    @Test
    @DisplayName("대소문자 구분 없이 매칭")
    void caseInsensitive() {
        assertThat(ClaimPattern.RESEARCH_FINDINGS.getPattern().matcher("THE STUDY FOUND NOTHING").find()).isTrue();
    }

    @Test
    @DisplayName("성장 규칙이 가장 먼저 등록되고 우선순위는 1~3")
    void registrationOrder() {
        assertThat(ClaimPattern.values()[0]).isEqualTo(ClaimPattern.GROWTH_METRICS);
        assertThat(ClaimPattern.values()).hasSize(10);
        assertThat(ClaimPattern.values())
                .allSatisfy(p -> assertThat(p.getPriority()).isBetween(1, 3));
    }

    @Test
    @DisplayName("통계 계열 주장 유형은 통계 증거와 일치")
    void typeAffinity() {
        assertThat(ClaimType.GROWTH.agreesWith(EvidenceType.STATISTIC))
                .isTrue();
        assertThat(ClaimType.ATTRIBUTION.agreesWith(EvidenceType.EXPERT_OPINION))
                .isTrue();
        assertThat(ClaimType.TEMPORAL.agreesWith(EvidenceType.STATISTIC))
                .isFalse();
    }
}
