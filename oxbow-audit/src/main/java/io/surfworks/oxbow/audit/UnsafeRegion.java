package io.surfworks.oxbow.audit;

import java.util.Objects;

/**
 * One unsafe region found by the auditor.
 *
 * @param line           line of the {@code unsafe} keyword (1-based)
 * @param form           block or whole function
 * @param kind           heuristic classification
 * @param confidence     elimination confidence, 0 to 100
 * @param remediation    suggested rewrite
 * @param statementCount top-level statements inside the region
 */
public record UnsafeRegion(
        int line,
        RegionForm form,
        RiskKind kind,
        int confidence,
        String remediation,
        int statementCount
) {

    public static final int HIGH_CONFIDENCE = 70;
    public static final int MEDIUM_CONFIDENCE = 40;

    public UnsafeRegion {
        Objects.requireNonNull(form, "form cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(remediation, "remediation cannot be null");
    }

    /**
     * Lines attributed to the region: its statements plus the opening and closing lines.
     * An approximation; the region's actual layout is not measured.
     */
    public int lineCount() {
        return statementCount + 2;
    }

    public boolean isHighConfidence() {
        return confidence >= HIGH_CONFIDENCE;
    }

    /**
     * HIGH, MEDIUM or LOW elimination confidence.
     */
    public String confidenceBand() {
        if (confidence >= HIGH_CONFIDENCE) {
            return "HIGH";
        }
        return confidence >= MEDIUM_CONFIDENCE ? "MEDIUM" : "LOW";
    }
}
