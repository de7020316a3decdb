package org.broadinstitute.replicon.tools.replicon.placement;

import org.broadinstitute.replicon.utils.Utils;

import java.util.Objects;

/**
 * Primary sequence of a replicon in a chromosome list.
 */
public final class ChromosomeListEntry {

    private final String objectName;
    private final String chromosomeName;
    private final RepliconTopology topology;
    private final ChromosomeType type;

    public ChromosomeListEntry(final String objectName, final String chromosomeName,
                               final RepliconTopology topology, final ChromosomeType type) {
        this.objectName = Utils.nonEmpty(objectName, "the object name cannot be null or empty");
        this.chromosomeName = Utils.nonEmpty(chromosomeName, "the chromosome name cannot be null or empty");
        this.topology = Utils.nonNull(topology);
        this.type = Utils.nonNull(type);
    }

    public String getObjectName() {
        return objectName;
    }

    public String getChromosomeName() {
        return chromosomeName;
    }

    public RepliconTopology getTopology() {
        return topology;
    }

    public ChromosomeType getType() {
        return type;
    }

    /**
     * @return the combined value of the type column, e.g. {@code Linear-Plasmid}.
     */
    public String getChromosomeType() {
        return topology.getDisplayName() + "-" + type.getDisplayName();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final ChromosomeListEntry that = (ChromosomeListEntry) o;
        return objectName.equals(that.objectName) && chromosomeName.equals(that.chromosomeName)
                && topology == that.topology && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(objectName, chromosomeName, topology, type);
    }

    @Override
    public String toString() {
        return objectName + "\t" + chromosomeName + "\t" + getChromosomeType();
    }
}
