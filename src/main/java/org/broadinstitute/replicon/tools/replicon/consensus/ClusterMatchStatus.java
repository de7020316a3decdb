package org.broadinstitute.replicon.tools.replicon.consensus;

/**
 * How well the member genes of a cluster could be traced to a replicon.
 */
public enum ClusterMatchStatus {
    /** Every non-refound member gene has a call. */
    MATCHED,
    /** Some, but not all, non-refound member genes have a call. */
    PARTIALLY_MATCHED,
    /** No member gene has a call. */
    UNMATCHED,
    /** The cluster lists no member genes. */
    NO_GENE_IDS;

    public boolean hasCalls() {
        return this == MATCHED || this == PARTIALLY_MATCHED;
    }
}
