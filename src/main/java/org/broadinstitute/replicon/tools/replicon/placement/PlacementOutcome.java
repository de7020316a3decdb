package org.broadinstitute.replicon.tools.replicon.placement;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.replicon.utils.Utils;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Placements of all assemblies, sorted by assembly id, and the assemblies whose placement failed.
 */
public final class PlacementOutcome {

    private final List<AssemblyPlacement> placements;
    private final List<String> failedAssemblies;

    public PlacementOutcome(final List<AssemblyPlacement> placements, final List<String> failedAssemblies) {
        this.placements = ImmutableList.copyOf(Utils.nonNull(placements));
        this.failedAssemblies = ImmutableList.copyOf(Utils.nonNull(failedAssemblies));
    }

    public List<AssemblyPlacement> getPlacements() {
        return placements;
    }

    public List<String> getFailedAssemblies() {
        return failedAssemblies;
    }

    /**
     * @return ids of the assemblies with no primary placement.
     */
    public List<String> getAssembliesWithoutEntries() {
        return placements.stream()
                .filter(p -> !p.hasPlacements())
                .map(AssemblyPlacement::getAssemblyId)
                .collect(Collectors.toList());
    }

    public int totalPlaced() {
        return placements.stream().mapToInt(p -> p.getChromosomeEntries().size()).sum();
    }

    public int totalUnlocalised() {
        return placements.stream().mapToInt(p -> p.getUnlocalisedEntries().size()).sum();
    }

    public int totalUnplaced() {
        return placements.stream().mapToInt(AssemblyPlacement::getUnplacedCount).sum();
    }
}
