package org.broadinstitute.replicon.tools.replicon.formats;

import org.broadinstitute.replicon.utils.Utils;

/**
 * Best whole-plasmid alignment of a contig, with the values as found in the hits table.
 */
public final class WholePlasmidStats {

    private final String plasmidName;
    private final String refLength;
    private final String refCoveredLength;
    private final String queryCoveragePercent;
    private final String identityPercent;

    public WholePlasmidStats(final String plasmidName, final String refLength, final String refCoveredLength,
                             final String queryCoveragePercent, final String identityPercent) {
        this.plasmidName = Utils.nonNull(plasmidName);
        this.refLength = Utils.nonNull(refLength);
        this.refCoveredLength = Utils.nonNull(refCoveredLength);
        this.queryCoveragePercent = Utils.nonNull(queryCoveragePercent);
        this.identityPercent = Utils.nonNull(identityPercent);
    }

    public String getPlasmidName() {
        return plasmidName;
    }

    public String getRefLength() {
        return refLength;
    }

    public String getRefCoveredLength() {
        return refCoveredLength;
    }

    public String getQueryCoveragePercent() {
        return queryCoveragePercent;
    }

    public String getIdentityPercent() {
        return identityPercent;
    }
}
