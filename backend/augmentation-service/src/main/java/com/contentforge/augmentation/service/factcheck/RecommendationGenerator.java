package com.contentforge.augmentation.service.factcheck;

import com.contentforge.augmentation.dto.FactCheckResult.VerifiedClaim;
import com.contentforge.augmentation.service.claim.ClaimType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns verification outcomes into remediation advice, one line per class of problem.
 */
@Component
public class RecommendationGenerator {

    static final String ALL_SUPPORTED = "All claims are well-supported by research data";

    private static final int HIGH_PRIORITY = 2;
    private static final int TYPE_CALLOUT_MIN = 2;

    public List<String> generate(List<VerifiedClaim> claims) {
        List<String> recommendations = new ArrayList<>();

        List<VerifiedClaim> unsupported = claims.stream()
                .filter(c -> c.getStatus() == VerificationStatus.UNSUPPORTED)
                .toList();
        long needsReview = claims.stream()
                .filter(c -> c.getStatus() == VerificationStatus.NEEDS_REVIEW)
                .count();

        if (!unsupported.isEmpty()) {
            recommendations.add(String.format("Remove or find sources for %d unsupported claims", unsupported.size()));

            long highPriority = unsupported.stream().filter(c -> c.getPriority() <= HIGH_PRIORITY).count();
            if (highPriority > 0) {
                recommendations.add(String.format("Priority: Verify %d high-priority statistical claims", highPriority));
            }
        }

        if (needsReview > 0) {
            recommendations.add(String.format(
                    "Review and strengthen sources for %d partially supported claims", needsReview));
        }

        Map<ClaimType, Integer> unsupportedByType = new LinkedHashMap<>();
        unsupported.forEach(c -> unsupportedByType.merge(c.getType(), 1, Integer::sum));
        unsupportedByType.forEach((type, count) -> {
            if (count >= TYPE_CALLOUT_MIN) {
                recommendations.add(String.format(
                        "Focus on verifying %s claims - %d found unsupported", type.getCode(), count));
            }
        });

        if (recommendations.isEmpty()) {
            recommendations.add(ALL_SUPPORTED);
        }
        return recommendations;
    }
}
