package org.broadinstitute.replicon.tools.replicon.formats;

/**
 * Alignment of a fragment against its best reference replicon.
 * <p>
 * Every value may be unknown, represented as {@link Double#NaN}. Unknown percentages count as 0 and an unknown
 * or non-positive reference length gives no reference coverage.
 * </p>
 */
public final class AlignmentStats {

    public static final AlignmentStats UNKNOWN = new AlignmentStats(Double.NaN, Double.NaN, Double.NaN, Double.NaN);

    private final double referenceLength;
    private final double referenceCoveredLength;
    private final double queryCoveragePercent;
    private final double identityPercent;

    public AlignmentStats(final double referenceLength, final double referenceCoveredLength,
                          final double queryCoveragePercent, final double identityPercent) {
        this.referenceLength = referenceLength;
        this.referenceCoveredLength = referenceCoveredLength;
        this.queryCoveragePercent = queryCoveragePercent;
        this.identityPercent = identityPercent;
    }

    public double getReferenceLength() {
        return referenceLength;
    }

    public double getReferenceCoveredLength() {
        return referenceCoveredLength;
    }

    public double getQueryCoveragePercent() {
        return queryCoveragePercent;
    }

    public double getIdentityPercent() {
        return identityPercent;
    }

    /**
     * @return covered over total reference length, or {@link Double#NaN} if it cannot be computed.
     */
    public double referenceCoverage() {
        if (Double.isNaN(referenceLength) || Double.isNaN(referenceCoveredLength) || referenceLength <= 0) {
            return Double.NaN;
        }
        return referenceCoveredLength / referenceLength;
    }

    /**
     * @return the query coverage as a fraction in [0, 1]; 0 if unknown.
     */
    public double queryCoverage() {
        return Double.isNaN(queryCoveragePercent) ? 0 : queryCoveragePercent / 100.0;
    }

    /**
     * @return the identity as a fraction in [0, 1]; 0 if unknown.
     */
    public double identity() {
        return Double.isNaN(identityPercent) ? 0 : identityPercent / 100.0;
    }

    public boolean isUnknown() {
        return Double.isNaN(referenceLength) && Double.isNaN(referenceCoveredLength)
                && Double.isNaN(queryCoveragePercent) && Double.isNaN(identityPercent);
    }

    @Override
    public String toString() {
        return String.format("AlignmentStats{ref=%s, covered=%s, query%%=%s, identity%%=%s}",
                referenceLength, referenceCoveredLength, queryCoveragePercent, identityPercent);
    }
}
