package com.contentforge.augmentation.service.factcheck;

import com.contentforge.augmentation.config.AugmentationProperties;
import com.contentforge.augmentation.dto.FactCheckResult;
import com.contentforge.augmentation.dto.FactCheckResult.FactCheckMetadata;
import com.contentforge.augmentation.dto.FactCheckResult.VerificationDetails;
import com.contentforge.augmentation.dto.FactCheckResult.VerificationStatistics;
import com.contentforge.augmentation.dto.FactCheckResult.VerifiedClaim;
import com.contentforge.augmentation.dto.ResearchData;
import com.contentforge.augmentation.service.claim.Claim;
import com.contentforge.augmentation.service.claim.ClaimExtractor;
import com.contentforge.augmentation.service.claim.ExtractionPolicy;
import com.contentforge.augmentation.service.evidence.EvidenceIndexer;
import com.contentforge.augmentation.service.evidence.EvidenceItem;
import com.contentforge.augmentation.service.matching.ClaimMatcher;
import com.contentforge.augmentation.service.matching.MatchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 팩트체크 리포트 서비스
 *
 * 원고의 사실 주장을 리서치 데이터와 대조하여 verified / needs_review / unsupported 로
 * 분류하고, 우선순위 가중 정확도 점수와 개선 권고를 생성합니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FactCheckReportService {

    static final String NO_RESEARCH_DATA = "No research data available";
    static final String NO_RESEARCH_RECOMMENDATION = "No research data available for fact verification";
    static final String NO_CLAIMS_RECOMMENDATION = "No factual claims detected for verification";

    private final ClaimExtractor claimExtractor;
    private final EvidenceIndexer evidenceIndexer;
    private final ClaimMatcher claimMatcher;
    private final AccuracyCalculator accuracyCalculator;
    private final RecommendationGenerator recommendationGenerator;
    private final AugmentationProperties properties;

    /**
     * Never throws: failures return an empty report with {@code metadata.error} set.
     */
    public FactCheckResult verifyFacts(String content, ResearchData researchData) {
        long startedAt = System.nanoTime();
        AugmentationProperties.FactCheck config = properties.getFactCheck();

        log.info("Starting fact-checking process");

        try {
            List<EvidenceItem> evidence = evidenceIndexer.index(
                    researchData, properties.getCitation().getFallbackSourceLabel());
            if (evidence.isEmpty()) {
                log.warn("No research data available for fact-checking");
                return FactCheckResult.builder()
                        .verifiedClaims(List.of())
                        .statistics(VerificationStatistics.none())
                        .recommendations(List.of(NO_RESEARCH_RECOMMENDATION))
                        .accuracyScore(0.0)
                        .metadata(FactCheckMetadata.builder()
                                .processingTimeSeconds(elapsedSeconds(startedAt))
                                .claimsExtracted(0)
                                .noResearchData(true)
                                .error(NO_RESEARCH_DATA)
                                .build())
                        .build();
            }

            List<Claim> claims = claimExtractor.extract(content, ExtractionPolicy.forFactCheck(properties));
            log.info("Extracted {} factual claims for verification", claims.size());

            if (claims.isEmpty()) {
                return FactCheckResult.builder()
                        .verifiedClaims(List.of())
                        .statistics(VerificationStatistics.none())
                        .recommendations(List.of(NO_CLAIMS_RECOMMENDATION))
                        .accuracyScore(1.0)
                        .metadata(FactCheckMetadata.builder()
                                .processingTimeSeconds(elapsedSeconds(startedAt))
                                .claimsExtracted(0)
                                .confidenceThreshold(config.getVerifiedThreshold())
                                .verificationComplete(true)
                                .build())
                        .build();
            }

            List<VerifiedClaim> verified = claims.stream()
                    .map(claim -> assess(claim, evidence, config))
                    .toList();

            VerificationStatistics statistics = VerificationStatistics.builder()
                    .totalClaims(verified.size())
                    .verified(count(verified, VerificationStatus.VERIFIED))
                    .unsupported(count(verified, VerificationStatus.UNSUPPORTED))
                    .needsReview(count(verified, VerificationStatus.NEEDS_REVIEW))
                    .build();
            double accuracy = accuracyCalculator.calculate(verified);

            log.info("Fact-checking completed: {}/{} claims verified, accuracy score: {}",
                    statistics.getVerified(), statistics.getTotalClaims(), accuracy);

            return FactCheckResult.builder()
                    .verifiedClaims(verified)
                    .statistics(statistics)
                    .recommendations(recommendationGenerator.generate(verified))
                    .accuracyScore(accuracy)
                    .metadata(FactCheckMetadata.builder()
                            .processingTimeSeconds(elapsedSeconds(startedAt))
                            .claimsExtracted(claims.size())
                            .confidenceThreshold(config.getVerifiedThreshold())
                            .verificationComplete(true)
                            .build())
                    .build();

        } catch (Exception e) {
            log.error("Error in fact-checking process: {}", e.getMessage(), e);
            return FactCheckResult.builder()
                    .verifiedClaims(List.of())
                    .statistics(VerificationStatistics.none())
                    .recommendations(List.of("Fact-checking failed: " + describe(e)))
                    .accuracyScore(0.0)
                    .metadata(FactCheckMetadata.builder()
                            .processingTimeSeconds(elapsedSeconds(startedAt))
                            .error(describe(e))
                            .build())
                    .build();
        }
    }

    private VerifiedClaim assess(Claim claim, List<EvidenceItem> evidence, AugmentationProperties.FactCheck config) {
        Optional<MatchResult> match = claimMatcher.bestMatch(claim, evidence);

        // 반올림한 값으로 분류해야 보고된 신뢰도와 구간이 어긋나지 않음
        double confidence = AccuracyCalculator.round3(match.map(MatchResult::confidence).orElse(0.0));
        VerificationStatus status = VerificationStatus.classify(
                confidence, config.getVerifiedThreshold(), config.getReviewThreshold());

        return VerifiedClaim.builder()
                .id(claim.getId())
                .text(claim.getText())
                .type(claim.getType())
                .patternName(claim.getPattern().name().toLowerCase(Locale.ROOT))
                .priority(claim.getPriority())
                .startPos(claim.getStartOffset())
                .endPos(claim.getEndOffset())
                .location(claim.getLocation())
                .extractedNumbers(claim.getNumbers())
                .extractedDates(claim.getDates())
                .keywords(claim.getKeywords())
                .status(status)
                .confidence(confidence)
                .supportingSource(match.map(m -> m.evidence().getSource()).orElse(null))
                .supportingTextExcerpt(match.map(m -> excerpt(m.evidence().getText(), config.getExcerptLength()))
                        .orElse(null))
                .verificationDetails(VerificationDetails.builder()
                        .bestMatchConfidence(match.map(MatchResult::confidence).orElse(0.0))
                        .matchType(match.map(m -> m.evidence().getType()).orElse(null))
                        .matchingNumbers(match.map(MatchResult::matchingNumbers).orElse(List.of()))
                        .matchingKeywords(match.map(MatchResult::matchingKeywords).orElse(List.of()))
                        .build())
                .build();
    }

    private static String excerpt(String text, int limit) {
        return text.length() > limit ? text.substring(0, limit) + "..." : text;
    }

    private static int count(List<VerifiedClaim> claims, VerificationStatus status) {
        return (int) claims.stream().filter(c -> c.getStatus() == status).count();
    }

    private static double elapsedSeconds(long startedAt) {
        return (System.nanoTime() - startedAt) / 1_000_000_000.0;
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
