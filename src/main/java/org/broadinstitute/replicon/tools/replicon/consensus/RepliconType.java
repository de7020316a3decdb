package org.broadinstitute.replicon.tools.replicon.consensus;

import org.broadinstitute.replicon.tools.replicon.calls.CallNormalizer;

/**
 * Coarse type of a replicon call.
 */
public enum RepliconType {
    MULTI_REPLICON("multi-replicon"),
    CHROMOSOME("chromosome"),
    CIRCULAR_PLASMID("circular_plasmid"),
    LINEAR_PLASMID("linear_plasmid"),
    UNKNOWN("unknown"),
    UNMATCHED("unmatched"),
    OTHER("other");

    private final String label;

    RepliconType(final String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static RepliconType classify(final String replicon) {
        final String call = CallNormalizer.normalize(replicon);
        if (call.equals(MULTI_REPLICON.label)) {
            return MULTI_REPLICON;
        } else if (call.equals(CallNormalizer.CHROMOSOME)) {
            return CHROMOSOME;
        } else if (call.startsWith("cp")) {
            return CIRCULAR_PLASMID;
        } else if (call.startsWith("lp")) {
            return LINEAR_PLASMID;
        } else if (call.equals(UNKNOWN.label)) {
            return UNKNOWN;
        } else if (call.equals(UNMATCHED.label)) {
            return UNMATCHED;
        }
        return OTHER;
    }

    @Override
    public String toString() {
        return label;
    }
}
