package org.broadinstitute.replicon.tools.replicon.placement;

import org.broadinstitute.replicon.tools.replicon.calls.CallNormalizer;

/**
 * Molecule topology inferred from a replicon name: {@code cp*} replicons are circular, everything else linear.
 */
public enum RepliconTopology {
    LINEAR("Linear"),
    CIRCULAR("Circular");

    private final String displayName;

    RepliconTopology(final String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static RepliconTopology of(final String replicon) {
        return CallNormalizer.normalize(replicon).startsWith("cp") ? CIRCULAR : LINEAR;
    }
}
