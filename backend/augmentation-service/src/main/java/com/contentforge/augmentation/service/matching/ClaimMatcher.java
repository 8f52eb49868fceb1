package com.contentforge.augmentation.service.matching;

import com.contentforge.augmentation.service.claim.Claim;
import com.contentforge.augmentation.service.evidence.EvidenceItem;
import com.contentforge.augmentation.util.TextFeatures;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.text.similarity.LongestCommonSubsequence;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Scores claims against evidence items.
 *
 * confidence = text × wText + numbers × wNumbers + keywords × wKeywords + typeBonus × wType,
 * capped at 1.0. Pure function of its inputs and the {@link ScoringPolicy}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClaimMatcher {

    private static final LongestCommonSubsequence LCS = new LongestCommonSubsequence();

    private final ScoringPolicy policy;

    public double score(Claim claim, EvidenceItem evidence) {
        return weigh(breakdown(claim, evidence));
    }

    /**
     * Evaluates every item and keeps the highest score; the earliest item wins a tie.
     *
     * @return empty when the pool is empty or nothing scores above zero
     */
    public Optional<MatchResult> bestMatch(Claim claim, List<EvidenceItem> evidence) {
        EvidenceItem best = null;
        ScoreBreakdown bestBreakdown = null;
        double bestScore = 0.0;

        for (EvidenceItem item : evidence) {
            ScoreBreakdown b = breakdown(claim, item);
            double s = weigh(b);
            if (s > bestScore) {
                bestScore = s;
                best = item;
                bestBreakdown = b;
            }
        }

        if (best == null) {
            log.debug("Claim {} has no scoring evidence", claim.getId());
            return Optional.empty();
        }

        log.debug("Claim {} best match: evidence #{} ({}) confidence={}",
                claim.getId(), best.getOrdinal(), best.getType(), bestScore);
        return Optional.of(new MatchResult(
                claim.getId(),
                best,
                bestScore,
                bestBreakdown,
                matchingNumbers(claim.getNumbers(), best.getNumbers()),
                matchingKeywords(claim.getKeywords(), best.getKeywords())));
    }

    ScoreBreakdown breakdown(Claim claim, EvidenceItem evidence) {
        return new ScoreBreakdown(
                textSimilarity(claim.getText(), evidence.getText()),
                numberOverlap(claim.getNumbers(), evidence.getNumbers()),
                keywordOverlap(claim.getKeywords(), evidence.getKeywords()),
                claim.getType().agreesWith(evidence.getType()) ? 1.0 : 0.0);
    }

    private double weigh(ScoreBreakdown b) {
        double score = b.textSimilarity() * policy.textSimilarityWeight()
                + b.numberOverlap() * policy.numberOverlapWeight()
                + b.keywordOverlap() * policy.keywordOverlapWeight()
                + b.typeBonus() * policy.typeBonusWeight();
        return Math.max(0.0, Math.min(1.0, score));
    }

    double textSimilarity(String a, String b) {
        if (a == null || b == null) return 0.0;
        String left = a.toLowerCase(Locale.ROOT);
        String right = b.toLowerCase(Locale.ROOT);
        int total = left.length() + right.length();
        if (total == 0) return 0.0;
        return 2.0 * LCS.apply(left, right) / total;
    }

    double numberOverlap(List<String> claimNumbers, List<String> evidenceNumbers) {
        if (claimNumbers.isEmpty() || evidenceNumbers.isEmpty()) return 0.0;

        List<String> candidates = evidenceNumbers.stream().map(TextFeatures::normalizeNumber).toList();
        double credit = 0.0;
        for (String raw : claimNumbers) {
            String n = TextFeatures.normalizeNumber(raw);
            if (candidates.contains(n)) {
                credit += 1.0;
            } else if (candidates.stream().anyMatch(c -> isClose(n, c))) {
                credit += policy.closeNumberCredit();
            }
        }
        return credit / claimNumbers.size();
    }

    double keywordOverlap(List<String> claimKeywords, List<String> evidenceKeywords) {
        if (claimKeywords.isEmpty()) return 0.0;
        Set<String> claimSet = new HashSet<>(claimKeywords);
        Set<String> common = new HashSet<>(claimSet);
        common.retainAll(new HashSet<>(evidenceKeywords));
        return (double) common.size() / claimSet.size();
    }

    /** ≤ limit: absolute difference within tolerance; otherwise relative difference within tolerance. */
    boolean isClose(String a, String b) {
        try {
            double x = Double.parseDouble(a);
            double y = Double.parseDouble(b);
            double larger = Math.max(x, y);
            if (larger <= policy.smallNumberLimit()) {
                return Math.abs(x - y) <= policy.smallNumberTolerance();
            }
            return Math.abs(x - y) / larger <= policy.relativeTolerance();
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private List<String> matchingNumbers(List<String> claimNumbers, List<String> evidenceNumbers) {
        List<String> candidates = evidenceNumbers.stream().map(TextFeatures::normalizeNumber).toList();
        List<String> out = new ArrayList<>();
        for (String raw : claimNumbers) {
            String n = TextFeatures.normalizeNumber(raw);
            if (candidates.stream().anyMatch(c -> c.equals(n) || isClose(n, c))) {
                out.add(raw);
            }
        }
        return out;
    }

    private List<String> matchingKeywords(List<String> claimKeywords, List<String> evidenceKeywords) {
        Set<String> evidenceSet = new HashSet<>(evidenceKeywords);
        return claimKeywords.stream().filter(evidenceSet::contains).toList();
    }
}
