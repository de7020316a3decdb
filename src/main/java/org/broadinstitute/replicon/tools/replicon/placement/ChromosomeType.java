package org.broadinstitute.replicon.tools.replicon.placement;

import org.broadinstitute.replicon.tools.replicon.calls.CallNormalizer;

public enum ChromosomeType {
    CHROMOSOME("Chromosome"),
    PLASMID("Plasmid");

    private final String displayName;

    ChromosomeType(final String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static ChromosomeType of(final String replicon) {
        return CallNormalizer.isChromosome(replicon) ? CHROMOSOME : PLASMID;
    }
}
