package com.contentforge.augmentation.service.claim;

import com.contentforge.augmentation.util.TextFeatures;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans article text with every {@link ClaimPattern} rule and keeps the validated,
 * positionally deduplicated hits as {@link Claim}s.
 */
@Component
@Slf4j
public class ClaimExtractor {

    // 리스트 번호, 글머리표, 괄호/대괄호만 있는 조각은 주장이 아님
    private static final List<Pattern> INVALID_SHAPES = List.of(
            Pattern.compile("^\\s*\\d+\\.\\s*$"),
            Pattern.compile("^\\s*[•*\\-]\\s*$"),
            Pattern.compile("^\\s*\\([^)]*\\)\\s*$"),
            Pattern.compile("^\\s*\\[[^\\]]*\\]\\s*$")
    );

    private static final List<String> EVIDENTIARY_TERMS = List.of(
            "study", "research", "report", "analysis", "found", "shows", "indicates");

    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** Heading markers, quote markers, bullets and "3)" list markers at the start of a hit */
    private static final Pattern LEADING_MARKUP =
            Pattern.compile("(?:\\s*(?:#{1,6}|>|[*•\\-]|\\d+\\))(?=\\s))*\\s*");

    private static final Pattern HEADING = Pattern.compile("(?m)^#{1,6}[ \\t]+(.+?)[ \\t#]*$");
    private static final String DEFAULT_SECTION = "introduction";

    private static final int MIN_WORDS = 3;

    /**
     * Extract claims in document order.
     *
     * @param document article text, possibly with markdown headings
     * @param policy   mode-specific length bounds and dedup window
     * @return claims sorted by (start offset, priority), ids renumbered 1..N
     */
    public List<Claim> extract(String document, ExtractionPolicy policy) {
        if (document == null || document.isBlank()) {
            return List.of();
        }

        List<Heading> headings = headings(document);
        List<Claim> accepted = new ArrayList<>();
        List<Integer> positions = new ArrayList<>();

        for (ClaimPattern rule : ClaimPattern.values()) {
            try {
                Matcher m = rule.getPattern().matcher(document);
                while (m.find()) {
                    Span span = trim(document, m.start(), m.end());
                    if (span == null || isNearAccepted(span.start(), positions, policy.dedupWindow())) {
                        continue;
                    }
                    String text = document.substring(span.start(), span.end());
                    if (!policy.acceptsLength(text.length()) || !isValidClaim(text)) {
                        continue;
                    }
                    accepted.add(Claim.builder()
                            .text(text)
                            .type(rule.getType())
                            .pattern(rule)
                            .priority(rule.getPriority())
                            .startOffset(span.start())
                            .endOffset(span.end())
                            .location(locate(headings, span.start()))
                            .numbers(TextFeatures.numbers(text))
                            .dates(TextFeatures.dates(text))
                            .keywords(TextFeatures.keywords(text, policy.maxKeywords()))
                            .build());
                    positions.add(span.start());
                }
            } catch (RuntimeException e) {
                log.warn("Claim pattern {} failed and was skipped: {}", rule, e.toString());
            }
        }

        AtomicInteger sequence = new AtomicInteger(1);
        List<Claim> claims = accepted.stream()
                .sorted(Comparator.comparingInt(Claim::getStartOffset).thenComparingInt(Claim::getPriority))
                .map(c -> c.toBuilder().id(sequence.getAndIncrement()).build())
                .toList();

        log.debug("Extracted {} claims from {} chars", claims.size(), document.length());
        return claims;
    }

    boolean isValidClaim(String text) {
        for (Pattern invalid : INVALID_SHAPES) {
            if (invalid.matcher(text).matches()) {
                return false;
            }
        }
        if (WHITESPACE.split(text.strip()).length < MIN_WORDS) {
            return false;
        }
        if (DIGIT.matcher(text).find()) {
            return true;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return EVIDENTIARY_TERMS.stream().anyMatch(lower::contains);
    }

    private boolean isNearAccepted(int start, List<Integer> positions, int window) {
        for (int pos : positions) {
            if (Math.abs(start - pos) < window) {
                return true;
            }
        }
        return false;
    }

    private Span trim(String document, int start, int end) {
        Matcher lead = LEADING_MARKUP.matcher(document).region(start, end);
        int s = lead.lookingAt() ? lead.end() : start;
        int e = end;
        while (e > s && Character.isWhitespace(document.charAt(e - 1))) {
            e--;
        }
        return e > s ? new Span(s, e) : null;
    }

    private List<Heading> headings(String document) {
        List<Heading> out = new ArrayList<>();
        Matcher m = HEADING.matcher(document);
        while (m.find()) {
            out.add(new Heading(m.start(), m.group(1).strip().toLowerCase(Locale.ROOT)));
        }
        return out;
    }

    private String locate(List<Heading> headings, int position) {
        String section = DEFAULT_SECTION;
        for (Heading h : headings) {
            if (h.offset() > position) {
                break;
            }
            section = h.title();
        }
        return section;
    }

    private record Span(int start, int end) {}

    private record Heading(int offset, String title) {}
}
