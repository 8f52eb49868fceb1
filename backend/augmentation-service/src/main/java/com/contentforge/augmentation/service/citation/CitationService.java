package com.contentforge.augmentation.service.citation;

import com.contentforge.augmentation.config.AugmentationProperties;
import com.contentforge.augmentation.dto.CitationEntry;
import com.contentforge.augmentation.dto.CitationResult;
import com.contentforge.augmentation.dto.CitationResult.CitationMetadata;
import com.contentforge.augmentation.dto.CitationResult.UncitedClaim;
import com.contentforge.augmentation.dto.ResearchData;
import com.contentforge.augmentation.service.citation.CitationMarkerWriter.Marker;
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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 인용 추가 서비스
 *
 * 원고에서 인용이 필요한 주장을 찾아 리서치 데이터와 매칭하고,
 * 인라인 [n] 표기와 참고문헌(References) 섹션을 붙입니다.
 *
 * 처리 흐름:
 * 1. 주장 추출 (20자 초과)
 * 2. 증거 인덱싱
 * 3. 주장별 최적 증거 매칭, 신뢰도 하한 초과 시 인용
 * 4. 출처 키 단위로 인용 번호 부여 (같은 출처 = 같은 번호)
 * 5. 뒤에서부터 표기 삽입 후 참고문헌 추가
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CitationService {

    static final String NO_MATCH = "No matching source found";
    static final String LOW_CONFIDENCE = "Low confidence match";
    static final String NO_RESEARCH_DATA = "No research data available";

    private final ClaimExtractor claimExtractor;
    private final EvidenceIndexer evidenceIndexer;
    private final ClaimMatcher claimMatcher;
    private final CitationFormatter citationFormatter;
    private final CitationMarkerWriter markerWriter;
    private final AugmentationProperties properties;

    public CitationResult addCitations(String content, ResearchData researchData) {
        return addCitations(content, researchData, null);
    }

    /**
     * Never throws: failures return the original content with {@code metadata.error} set.
     *
     * @param style apa | mla | chicago; null or unknown uses the configured default
     */
    public CitationResult addCitations(String content, ResearchData researchData, String style) {
        long startedAt = System.nanoTime();
        String original = content == null ? "" : content;
        AugmentationProperties.Citation config = properties.getCitation();
        CitationStyle citationStyle = CitationStyle.from(style,
                CitationStyle.from(config.getDefaultStyle(), CitationStyle.APA));

        log.info("Starting citation process: {} chars, style={}", original.length(), citationStyle.getCode());

        try {
            List<EvidenceItem> evidence = evidenceIndexer.index(researchData, config.getFallbackSourceLabel());
            if (evidence.isEmpty()) {
                log.warn("No research data available for citations");
                return unchanged(original, CitationMetadata.builder()
                        .processingTimeSeconds(elapsedSeconds(startedAt))
                        .citationStyle(citationStyle.getCode())
                        .noResearchData(true)
                        .error(NO_RESEARCH_DATA)
                        .build());
            }

            List<Claim> claims = claimExtractor.extract(original, ExtractionPolicy.forCitation(properties));
            log.info("Identified {} potential claims for citation", claims.size());

            Map<String, Integer> citationNumbers = new LinkedHashMap<>();
            List<CitationEntry> bibliography = new ArrayList<>();
            List<Marker> markers = new ArrayList<>();
            List<UncitedClaim> uncited = new ArrayList<>();

            for (Claim claim : claims) {
                Optional<MatchResult> match = claimMatcher.bestMatch(claim, evidence);
                if (match.isEmpty() || match.get().confidence() <= config.getConfidenceFloor()) {
                    uncited.add(UncitedClaim.builder()
                            .text(claim.getText())
                            .type(claim.getType().getCode())
                            .reason(match.isEmpty() ? NO_MATCH : LOW_CONFIDENCE)
                            .build());
                    continue;
                }

                String sourceKey = match.get().evidence().getSourceKey();
                Integer number = citationNumbers.get(sourceKey);
                if (number == null) {
                    number = citationNumbers.size() + 1;
                    citationNumbers.put(sourceKey, number);
                    bibliography.add(citationFormatter.format(sourceKey, number, citationStyle));
                }
                markers.add(new Marker(claim.getEndOffset(), number));
            }

            String cited = markerWriter.apply(original, markers)
                    + citationFormatter.referencesSection(bibliography);
            int withSources = markers.size();

            CitationResult result = CitationResult.builder()
                    .citedContent(cited)
                    .bibliography(bibliography)
                    .citationCount(bibliography.size())
                    .uncitedClaims(uncited)
                    .metadata(CitationMetadata.builder()
                            .processingTimeSeconds(elapsedSeconds(startedAt))
                            .totalClaimsIdentified(claims.size())
                            .claimsWithSources(withSources)
                            .citationStyle(citationStyle.getCode())
                            .successRate(claims.isEmpty() ? 0.0 : (double) withSources / claims.size())
                            .build())
                    .build();

            log.info("Citation process completed: {} citations added, {} uncited claims",
                    result.getCitationCount(), uncited.size());
            return result;

        } catch (Exception e) {
            log.error("Error in citation process: {}", e.getMessage(), e);
            return unchanged(original, CitationMetadata.builder()
                    .processingTimeSeconds(elapsedSeconds(startedAt))
                    .citationStyle(citationStyle.getCode())
                    .error(describe(e))
                    .build());
        }
    }

    private CitationResult unchanged(String content, CitationMetadata metadata) {
        return CitationResult.builder()
                .citedContent(content)
                .bibliography(List.of())
                .citationCount(0)
                .uncitedClaims(List.of())
                .metadata(metadata)
                .build();
    }

    private static double elapsedSeconds(long startedAt) {
        return (System.nanoTime() - startedAt) / 1_000_000_000.0;
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
