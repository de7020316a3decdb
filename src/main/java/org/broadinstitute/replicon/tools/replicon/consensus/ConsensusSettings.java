package org.broadinstitute.replicon.tools.replicon.consensus;

import org.broadinstitute.replicon.utils.Utils;

/**
 * Parameters of the gene-cluster consensus.
 */
public final class ConsensusSettings {

    public static final double DEFAULT_THRESHOLD = 0.9;

    public static final ConsensusSettings DEFAULT = new ConsensusSettings(DEFAULT_THRESHOLD);

    private final double threshold;

    /**
     * @param threshold minimum fraction of members that must agree on the top call, in [0, 1].
     */
    public ConsensusSettings(final double threshold) {
        Utils.validateArg(threshold >= 0 && threshold <= 1,
                () -> "the consensus threshold must be in [0, 1] but was " + threshold);
        this.threshold = threshold;
    }

    public double getThreshold() {
        return threshold;
    }

    @Override
    public String toString() {
        return "ConsensusSettings{threshold=" + threshold + "}";
    }
}
