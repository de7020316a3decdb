package org.broadinstitute.replicon.tools.replicon.consensus;

import org.broadinstitute.replicon.utils.Utils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Majority call of a gene cluster.
 */
public final class ConsensusResult {

    public static final String MULTI_REPLICON = "multi-replicon";
    public static final String UNKNOWN = "unknown";

    private final String consensusReplicon;
    private final String topReplicon;
    private final double consensusFraction;
    private final int numberOfIsolates;
    private final Map<String, Integer> repliconCounts;
    private final String detail;

    public ConsensusResult(final String consensusReplicon, final String topReplicon, final double consensusFraction,
                           final int numberOfIsolates, final Map<String, Integer> repliconCounts) {
        this(consensusReplicon, topReplicon, consensusFraction, numberOfIsolates, repliconCounts,
                CountFormatting.detail(repliconCounts));
    }

    private ConsensusResult(final String consensusReplicon, final String topReplicon, final double consensusFraction,
                            final int numberOfIsolates, final Map<String, Integer> repliconCounts, final String detail) {
        this.consensusReplicon = Utils.nonNull(consensusReplicon);
        this.topReplicon = Utils.nonNull(topReplicon);
        this.consensusFraction = consensusFraction;
        this.numberOfIsolates = numberOfIsolates;
        this.repliconCounts = Collections.unmodifiableMap(new LinkedHashMap<>(Utils.nonNull(repliconCounts)));
        this.detail = Utils.nonNull(detail);
    }

    /**
     * Result for a cluster without any call.
     */
    public static ConsensusResult unknown() {
        return new ConsensusResult(UNKNOWN, UNKNOWN, 0.0, 0, Collections.emptyMap(), UNKNOWN);
    }

    /**
     * Result that carries a placeholder label instead of a computed consensus, with an empty detail.
     */
    public static ConsensusResult placeholder(final String label) {
        return new ConsensusResult(label, label, 0.0, 0, Collections.emptyMap(), "");
    }

    public String getConsensusReplicon() {
        return consensusReplicon;
    }

    public String getTopReplicon() {
        return topReplicon;
    }

    /**
     * @return the fraction of members carrying the top call, rounded to 3 decimals.
     */
    public double getConsensusFraction() {
        return consensusFraction;
    }

    public int getNumberOfIsolates() {
        return numberOfIsolates;
    }

    /**
     * @return counts by call, most frequent first; ties in order of first appearance.
     */
    public Map<String, Integer> getRepliconCounts() {
        return repliconCounts;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return String.format("%s (top=%s, frac=%s, n=%d, %s)", consensusReplicon, topReplicon, consensusFraction,
                numberOfIsolates, detail);
    }
}
