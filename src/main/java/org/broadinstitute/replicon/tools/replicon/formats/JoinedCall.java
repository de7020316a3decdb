package org.broadinstitute.replicon.tools.replicon.formats;

import org.broadinstitute.replicon.utils.Utils;

import java.util.Optional;

/**
 * A call joined with its whole-plasmid alignment, if any.
 */
public final class JoinedCall {

    private final String assemblyId;
    private final String contigId;
    private final String contigLength;
    private final String call;
    private final WholePlasmidStats stats;

    public JoinedCall(final String assemblyId, final String contigId, final String contigLength, final String call,
                      final WholePlasmidStats stats) {
        this.assemblyId = Utils.nonNull(assemblyId);
        this.contigId = Utils.nonNull(contigId);
        this.contigLength = Utils.nonNull(contigLength);
        this.call = Utils.nonNull(call);
        this.stats = stats;
    }

    public String getAssemblyId() {
        return assemblyId;
    }

    public String getContigId() {
        return contigId;
    }

    public String getContigLength() {
        return contigLength;
    }

    public String getCall() {
        return call;
    }

    public Optional<WholePlasmidStats> getStats() {
        return Optional.ofNullable(stats);
    }
}
