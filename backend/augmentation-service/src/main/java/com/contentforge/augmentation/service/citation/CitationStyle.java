package com.contentforge.augmentation.service.citation;

import java.util.Arrays;
import java.util.Locale;

public enum CitationStyle {
    APA("apa"),
    MLA("mla"),
    CHICAGO("chicago");

    private final String code;

    CitationStyle(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /** Unknown or blank style names resolve to {@code fallback}. */
    public static CitationStyle from(String name, CitationStyle fallback) {
        if (name == null || name.isBlank()) return fallback;
        String key = name.strip().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(s -> s.code.equals(key))
                .findFirst()
                .orElse(fallback);
    }
}
