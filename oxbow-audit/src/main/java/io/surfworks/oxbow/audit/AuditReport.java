package io.surfworks.oxbow.audit;

import java.util.List;

/**
 * Result of auditing one Rust source text.
 *
 * @param totalLines        lines in the source text
 * @param unsafeLines       lines attributed to unsafe regions, at most {@code totalLines}
 * @param densityPercent    {@code unsafeLines / totalLines * 100}; 0 for empty text
 * @param regions           unsafe regions in source order
 * @param averageConfidence mean region confidence; 0 when there are no regions
 */
public record AuditReport(
        int totalLines,
        int unsafeLines,
        double densityPercent,
        List<UnsafeRegion> regions,
        double averageConfidence
) {

    /** Generated code should keep unsafe density below this percentage. */
    public static final double DENSITY_TARGET_PERCENT = 5.0;

    public AuditReport {
        regions = List.copyOf(regions);
    }

    /**
     * Regions whose confidence is at least {@link UnsafeRegion#HIGH_CONFIDENCE}.
     */
    public List<UnsafeRegion> highConfidenceRegions() {
        return regions.stream().filter(UnsafeRegion::isHighConfidence).toList();
    }

    public boolean meetsDensityTarget() {
        return densityPercent < DENSITY_TARGET_PERCENT;
    }

    public boolean isSafe() {
        return regions.isEmpty();
    }
}
