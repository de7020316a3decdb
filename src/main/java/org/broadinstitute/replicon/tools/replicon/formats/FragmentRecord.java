package org.broadinstitute.replicon.tools.replicon.formats;

import org.broadinstitute.replicon.utils.Utils;

/**
 * One row of evidence about a fragment: its length, the replicon call and optional alignment statistics.
 */
public final class FragmentRecord {

    private final FragmentKey key;
    private final long length;
    private final String call;
    private final AlignmentStats alignmentStats;

    public FragmentRecord(final FragmentKey key, final long length, final String call) {
        this(key, length, call, AlignmentStats.UNKNOWN);
    }

    public FragmentRecord(final FragmentKey key, final long length, final String call, final AlignmentStats alignmentStats) {
        this.key = Utils.nonNull(key, "the key cannot be null");
        Utils.validateArg(length >= 0, "the length cannot be negative");
        this.length = length;
        this.call = call == null ? "" : call;
        this.alignmentStats = Utils.nonNull(alignmentStats, "the alignment stats cannot be null");
    }

    public FragmentKey getKey() {
        return key;
    }

    public String getAssemblyId() {
        return key.getAssemblyId();
    }

    public String getContigId() {
        return key.getContigId();
    }

    /**
     * @return the length in bp, 0 if unknown.
     */
    public long getLength() {
        return length;
    }

    /**
     * @return the raw call, never {@code null}.
     */
    public String getCall() {
        return call;
    }

    public AlignmentStats getAlignmentStats() {
        return alignmentStats;
    }

    @Override
    public String toString() {
        return key + "(" + length + "bp): " + call;
    }
}
