package com.contentforge.augmentation.service.factcheck;

import com.contentforge.augmentation.config.AugmentationProperties;
import com.contentforge.augmentation.dto.FactCheckResult.VerifiedClaim;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 우선순위 가중 정확도 점수
 *
 * 가중치: priority 1 → 3, priority 2 → 2, priority 3 → 1
 * 기여도: verified → confidence, needs_review → confidence × 0.6, unsupported → 0
 */
@Component
@RequiredArgsConstructor
public class AccuracyCalculator {

    private static final int MAX_PRIORITY_WEIGHT = 4;

    private final AugmentationProperties properties;

    /** 1.0 when there is nothing to verify. */
    public double calculate(List<VerifiedClaim> claims) {
        if (claims.isEmpty()) {
            return 1.0;
        }

        double weighted = 0.0;
        double totalWeight = 0.0;
        for (VerifiedClaim claim : claims) {
            int weight = Math.max(1, MAX_PRIORITY_WEIGHT - claim.getPriority());
            weighted += contribution(claim) * weight;
            totalWeight += weight;
        }
        double score = totalWeight > 0 ? weighted / totalWeight : 0.0;
        return round3(Math.max(0.0, Math.min(1.0, score)));
    }

    private double contribution(VerifiedClaim claim) {
        return switch (claim.getStatus()) {
            case VERIFIED -> claim.getConfidence();
            case NEEDS_REVIEW -> claim.getConfidence() * properties.getFactCheck().getNeedsReviewCredit();
            case UNSUPPORTED -> 0.0;
        };
    }

    static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
