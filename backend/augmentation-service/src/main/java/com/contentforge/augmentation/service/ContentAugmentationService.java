package com.contentforge.augmentation.service;

import com.contentforge.augmentation.dto.AugmentationRequest;
import com.contentforge.augmentation.dto.AugmentationResult;
import com.contentforge.augmentation.dto.CitationResult;
import com.contentforge.augmentation.dto.FactCheckResult;
import com.contentforge.augmentation.dto.ResearchData;
import com.contentforge.augmentation.exception.AugmentationException;
import com.contentforge.augmentation.service.citation.CitationService;
import com.contentforge.augmentation.service.evidence.ResearchDataReader;
import com.contentforge.augmentation.service.factcheck.FactCheckReportService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the citation stage and then the fact-check stage over one draft.
 *
 * The fact-check stage reads the cited content only when citations were actually added
 * and the request asks for it; otherwise it reads the original draft.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContentAugmentationService {

    private final CitationService citationService;
    private final FactCheckReportService factCheckReportService;
    private final ResearchDataReader researchDataReader;
    private final MeterRegistry meterRegistry;

    public AugmentationResult augment(AugmentationRequest request) {
        String content = request.getContent() == null ? "" : request.getContent();
        ResearchData researchData = request.getResearchData() == null
                ? ResearchData.empty()
                : request.getResearchData();

        CitationResult citations = null;
        String finalContent = content;

        if (request.isIncludeCitations()) {
            citations = timer("augmentation.citation.duration").record(() ->
                    citationService.addCitations(content, researchData, request.getCitationStyle()));
            recordOutcome("citation", citations.getMetadata().getError(), citations.getMetadata().isNoResearchData());
            if (citations.getCitationCount() > 0) {
                finalContent = citations.getCitedContent();
            }
        }

        FactCheckResult factCheck = null;
        if (request.isIncludeFactCheck()) {
            String target = request.isFactCheckCitedContent() ? finalContent : content;
            factCheck = timer("augmentation.factcheck.duration").record(() ->
                    factCheckReportService.verifyFacts(target, researchData));
            meterRegistry.counter("augmentation.claims.extracted")
                    .increment(factCheck.getStatistics().getTotalClaims());
            recordOutcome("factcheck", factCheck.getMetadata().getError(), factCheck.getMetadata().isNoResearchData());
        }

        return AugmentationResult.builder()
                .finalContent(finalContent)
                .citations(citations)
                .factCheck(factCheck)
                .build();
    }

    /**
     * Same as {@link #augment(AugmentationRequest)} with the research bundle given as stored JSON.
     * Unreadable JSON degrades to an empty bundle.
     */
    public AugmentationResult augment(String content, String researchJson, String citationStyle) {
        ResearchData researchData;
        try {
            researchData = researchDataReader.read(researchJson);
        } catch (AugmentationException e) {
            log.warn("Falling back to empty research data [{}]: {}", e.getErrorCode(), e.getMessage());
            meterRegistry.counter("augmentation.failures", "stage", "research-data").increment();
            researchData = ResearchData.empty();
        }
        return augment(AugmentationRequest.builder()
                .content(content)
                .researchData(researchData)
                .citationStyle(citationStyle)
                .build());
    }

    private Timer timer(String name) {
        return Timer.builder(name).register(meterRegistry);
    }

    private void recordOutcome(String stage, String error, boolean noResearchData) {
        if (error != null && !noResearchData) {
            log.warn("Stage {} finished with error: {}", stage, error);
            meterRegistry.counter("augmentation.failures", "stage", stage).increment();
        }
    }
}
