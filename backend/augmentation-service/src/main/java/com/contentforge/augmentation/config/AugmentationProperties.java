package com.contentforge.augmentation.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized policy for claim extraction, evidence scoring, citation and fact-check reporting.
 *
 * Scoring weights are expected to sum to 1.0; the final confidence is capped at 1.0 either way.
 * Fact-check bands:
 * - confidence >= verifiedThreshold : verified
 * - confidence >= reviewThreshold   : needs_review
 * - otherwise                       : unsupported
 */
@Configuration
@ConfigurationProperties(prefix = "augmentation")
@Validated
@Data
public class AugmentationProperties {

    @Valid
    private Scoring scoring = new Scoring();

    @Valid
    private FactCheck factCheck = new FactCheck();

    @Valid
    private Citation citation = new Citation();

    @Valid
    private Extraction extraction = new Extraction();

    @Data
    public static class Scoring {
        /** LCS ratio between claim and evidence text */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double textSimilarityWeight = 0.30;

        /** Share of claim numbers found (exactly or closely) in the evidence */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double numberOverlapWeight = 0.35;

        /** Share of claim keywords found in the evidence */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double keywordOverlapWeight = 0.25;

        /** Flat bonus when claim type and evidence type agree */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double typeBonusWeight = 0.10;

        /** Credit for a close (not exact) numeric match */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double closeNumberCredit = 0.7;

        /** Values up to this limit are compared by absolute difference */
        @DecimalMin("0.0")
        private double smallNumberLimit = 10;

        /** Allowed absolute difference for small values */
        @DecimalMin("0.0")
        private double smallNumberTolerance = 1;

        /** Allowed relative difference for larger values */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double relativeTolerance = 0.10;
    }

    @Data
    public static class FactCheck {
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double verifiedThreshold = 0.7;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double reviewThreshold = 0.4;

        @Min(1)
        private int minClaimLength = 10;

        @Min(1)
        private int maxClaimLength = 200;

        /** Partial credit applied to needs_review claims in the accuracy score */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double needsReviewCredit = 0.6;

        @Min(1)
        private int excerptLength = 200;
    }

    @Data
    public static class Citation {
        /** Matches at or below this confidence are not cited */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double confidenceFloor = 0.3;

        @Min(1)
        private int minClaimLength = 21;

        @NotBlank
        private String defaultStyle = "apa";

        /** Bibliography label used when no source URL is known */
        @NotBlank
        private String fallbackSourceLabel = "Research Data";
    }

    @Data
    public static class Extraction {
        /** Matches starting this close to an accepted claim are dropped */
        @Min(0)
        private int dedupWindow = 10;

        @Min(1)
        private int maxKeywords = 10;
    }
}
