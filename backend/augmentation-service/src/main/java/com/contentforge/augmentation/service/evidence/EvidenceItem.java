package com.contentforge.augmentation.service.evidence;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A normalized unit of research data, carrying the same derived tokens as a claim.
 */
@Value
@Builder
public class EvidenceItem {
    /** Insertion order within the pool; earlier items win score ties */
    int ordinal;
    String text;
    EvidenceType type;
    /** Where the item came from: "research_statistics", "expert_quotes" or the originating query */
    String source;
    /** Bibliography key: first known source URL, or the fallback label */
    String sourceKey;
    List<String> numbers;
    List<String> dates;
    List<String> keywords;
}
