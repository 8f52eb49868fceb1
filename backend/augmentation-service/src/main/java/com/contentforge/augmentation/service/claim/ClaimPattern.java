package com.contentforge.augmentation.service.claim;

import java.util.regex.Pattern;

/**
 * Closed rule list describing the syntactic shapes of verifiable statements.
 *
 * Declaration order is registration order: when two rules hit the same position the
 * earlier rule keeps the claim. A hit runs from the start of its sentence (never across a
 * sentence-ending period or a line break; "4.2" is not a sentence end) to the end of the
 * triggering token. Open-ended rules carry on to the end of the sentence, since the token
 * alone says nothing.
 */
public enum ClaimPattern {

    GROWTH_METRICS(ClaimType.GROWTH, 1, "Growth and change metrics",
            "\\b(?:grew|increased|decreased|rose|fell|improved|declined|dropped|jumped)\\s+(?:by\\s+)?"
                    + "\\d+(?:\\.\\d+)?%"),

    PERCENTAGE_STATISTICS(ClaimType.STATISTIC, 1, "Percentage-based statistics",
            "\\b\\d+(?:\\.\\d+)?%"),

    FINANCIAL_FIGURES(ClaimType.FINANCIAL, 1, "Financial figures and amounts",
            "\\$\\d+(?:,\\d{3})*(?:\\.\\d+)?" + Fragments.SCALE),

    MARKET_DATA(ClaimType.MARKET, 2, "Market size and industry data",
            "\\b(?:market|industry|sector)\\s+(?:size|value|worth)" + Fragments.LEAD
                    + "\\$?\\d+(?:,\\d{3})*(?:\\.\\d+)?" + Fragments.SCALE),

    TEMPORAL_CLAIMS(ClaimType.TEMPORAL, 2, "Time-specific claims",
            "\\b(?:in|during|by)\\s+(?:19|20)\\d{2}\\b"),

    RESEARCH_FINDINGS(ClaimType.RESEARCH, 2, "Research and study findings",
            "\\b(?:study|research|survey|report|analysis)\\s+"
                    + "(?:shows|showed|found|finds|indicates|indicated|reveals|revealed|suggests|suggested)\\b"
                    + Fragments.REST),

    QUANTITATIVE_CLAIMS(ClaimType.QUANTITATIVE, 3, "Quantitative business claims",
            "\\b\\d+(?:,\\d{3})*(?:\\.\\d+)?" + Fragments.SCALE
                    + "\\s*(?:users|customers|companies|businesses|people|organizations|employees)\\b"),

    COMPARATIVE_CLAIMS(ClaimType.COMPARATIVE, 3, "Comparative performance claims",
            "(?:(?:\\b\\d+(?:\\.\\d+)?x|\\btimes)\\s+(?:more|less|faster|slower|better|worse|higher|lower)\\b"
                    + "|\\b(?:compared to|versus|more than|less than|higher than|lower than)\\b)"
                    + Fragments.REST),

    EXPERT_ATTRIBUTIONS(ClaimType.ATTRIBUTION, 3, "Expert opinion attributions",
            "\\b(?:according to|experts|analysts|researchers)\\s+" + Fragments.REST),

    TREND_CLAIMS(ClaimType.TREND, 3, "Definitive statements about trends",
            "\\b(?:trend|trending|popular|leading|dominant|fastest-growing)\\b" + Fragments.REST);

    private final ClaimType type;
    private final int priority;
    private final String description;
    private final Pattern pattern;

    ClaimPattern(ClaimType type, int priority, String description, String trigger) {
        this.type = type;
        this.priority = priority;
        this.description = description;
        this.pattern = Pattern.compile(Fragments.LEAD + trigger, Pattern.CASE_INSENSITIVE);
    }

    public ClaimType getType() {
        return type;
    }

    /** 1 = highest */
    public int getPriority() {
        return priority;
    }

    public String getDescription() {
        return description;
    }

    public Pattern getPattern() {
        return pattern;
    }

    private static final class Fragments {
        /**
         * Sentence text before the trigger; a decimal point does not end a sentence. Kept as
         * character-class runs joined at decimal points, which the engine matches without
         * recursing per character.
         */
        static final String LEAD = "[^.\\n]*?(?:\\.(?=\\d)[^.\\n]*?)*?";
        /** Remainder of the sentence */
        static final String REST = "[^.\\n]*(?:\\.(?=\\d)[^.\\n]*)*";
        static final String SCALE = "(?:\\s*(?:trillion|billion|million|thousand|k)\\b)?";
    }
}
