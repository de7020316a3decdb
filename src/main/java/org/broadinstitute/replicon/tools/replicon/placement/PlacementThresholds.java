package org.broadinstitute.replicon.tools.replicon.placement;

import org.broadinstitute.replicon.tools.replicon.formats.AlignmentStats;
import org.broadinstitute.replicon.utils.Utils;

/**
 * Completeness thresholds of the {@link PlacementMode#COMPLETE} mode, all fractions in [0, 1].
 */
public final class PlacementThresholds {

    public static final double DEFAULT_REFERENCE_COVERAGE = 0.95;
    public static final double DEFAULT_QUERY_COVERAGE = 0.90;
    public static final double DEFAULT_IDENTITY = 0.90;

    public static final PlacementThresholds DEFAULT =
            new PlacementThresholds(DEFAULT_REFERENCE_COVERAGE, DEFAULT_QUERY_COVERAGE, DEFAULT_IDENTITY);

    private final double referenceCoverage;
    private final double queryCoverage;
    private final double identity;

    public PlacementThresholds(final double referenceCoverage, final double queryCoverage, final double identity) {
        this.referenceCoverage = checkFraction(referenceCoverage, "reference coverage");
        this.queryCoverage = checkFraction(queryCoverage, "query coverage");
        this.identity = checkFraction(identity, "identity");
    }

    private static double checkFraction(final double value, final String name) {
        Utils.validateArg(value >= 0 && value <= 1, () -> "the " + name + " threshold must be in [0, 1] but was " + value);
        return value;
    }

    public double getReferenceCoverage() {
        return referenceCoverage;
    }

    public double getQueryCoverage() {
        return queryCoverage;
    }

    public double getIdentity() {
        return identity;
    }

    /**
     * A fragment is complete when its reference coverage is known and every value reaches its threshold.
     * Unknown query coverage and identity count as 0.
     */
    public boolean passes(final AlignmentStats stats) {
        Utils.nonNull(stats, "the stats cannot be null");
        final double refCoverage = stats.referenceCoverage();
        return !Double.isNaN(refCoverage)
                && refCoverage >= referenceCoverage
                && stats.queryCoverage() >= queryCoverage
                && stats.identity() >= identity;
    }

    @Override
    public String toString() {
        return String.format("ref_cov=%.0f%%, query_cov=%.0f%%, identity=%.0f%%",
                referenceCoverage * 100, queryCoverage * 100, identity * 100);
    }
}
