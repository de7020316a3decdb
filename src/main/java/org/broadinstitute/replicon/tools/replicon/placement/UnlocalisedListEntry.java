package org.broadinstitute.replicon.tools.replicon.placement;

import org.broadinstitute.replicon.utils.Utils;

import java.util.Objects;

/**
 * Fragment of a replicon whose primary sequence is listed elsewhere.
 */
public final class UnlocalisedListEntry {

    private final String objectName;
    private final String chromosomeName;

    public UnlocalisedListEntry(final String objectName, final String chromosomeName) {
        this.objectName = Utils.nonEmpty(objectName, "the object name cannot be null or empty");
        this.chromosomeName = Utils.nonEmpty(chromosomeName, "the chromosome name cannot be null or empty");
    }

    public String getObjectName() {
        return objectName;
    }

    public String getChromosomeName() {
        return chromosomeName;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final UnlocalisedListEntry that = (UnlocalisedListEntry) o;
        return objectName.equals(that.objectName) && chromosomeName.equals(that.chromosomeName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(objectName, chromosomeName);
    }

    @Override
    public String toString() {
        return objectName + "\t" + chromosomeName;
    }
}
