package org.broadinstitute.replicon.tools.replicon.placement;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.replicon.utils.Utils;

import java.util.List;

/**
 * Placement of one assembly's fragments.
 */
public final class AssemblyPlacement {

    private final String assemblyId;
    private final List<ChromosomeListEntry> chromosomeEntries;
    private final List<UnlocalisedListEntry> unlocalisedEntries;
    private final int unplacedCount;

    public AssemblyPlacement(final String assemblyId, final List<ChromosomeListEntry> chromosomeEntries,
                             final List<UnlocalisedListEntry> unlocalisedEntries, final int unplacedCount) {
        this.assemblyId = Utils.nonNull(assemblyId);
        this.chromosomeEntries = ImmutableList.copyOf(Utils.nonNull(chromosomeEntries));
        this.unlocalisedEntries = ImmutableList.copyOf(Utils.nonNull(unlocalisedEntries));
        Utils.validateArg(unplacedCount >= 0, "the unplaced count cannot be negative");
        this.unplacedCount = unplacedCount;
    }

    public String getAssemblyId() {
        return assemblyId;
    }

    public List<ChromosomeListEntry> getChromosomeEntries() {
        return chromosomeEntries;
    }

    public List<UnlocalisedListEntry> getUnlocalisedEntries() {
        return unlocalisedEntries;
    }

    public int getUnplacedCount() {
        return unplacedCount;
    }

    /**
     * An assembly without any primary placement stays at contig level and gets no list file.
     */
    public boolean hasPlacements() {
        return !chromosomeEntries.isEmpty();
    }
}
