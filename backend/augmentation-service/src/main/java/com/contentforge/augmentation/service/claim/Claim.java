package com.contentforge.augmentation.service.claim;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A span of article text asserting a verifiable fact.
 */
@Value
@Builder(toBuilder = true)
public class Claim {
    /** Sequential, 1..N in document order */
    int id;
    String text;
    ClaimType type;
    ClaimPattern pattern;
    int priority;
    /** Offset of the first character in the source text */
    int startOffset;
    /** Offset just past the last character */
    int endOffset;
    String location;
    List<String> numbers;
    List<String> dates;
    List<String> keywords;
}
