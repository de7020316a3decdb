package org.broadinstitute.replicon.tools.replicon.formats;

import org.broadinstitute.replicon.utils.Utils;

import java.util.Comparator;

/**
 * Identifies a sequence fragment: the assembly it belongs to and its contig id.
 * Keys sort by assembly and then by contig.
 */
public final class FragmentKey implements Comparable<FragmentKey> {

    private static final Comparator<FragmentKey> ORDER =
            Comparator.comparing(FragmentKey::getAssemblyId).thenComparing(FragmentKey::getContigId);

    private final String assemblyId;
    private final String contigId;

    public FragmentKey(final String assemblyId, final String contigId) {
        this.assemblyId = Utils.nonNull(assemblyId, "the assembly id cannot be null");
        this.contigId = Utils.nonNull(contigId, "the contig id cannot be null");
    }

    public String getAssemblyId() {
        return assemblyId;
    }

    public String getContigId() {
        return contigId;
    }

    @Override
    public int compareTo(final FragmentKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final FragmentKey that = (FragmentKey) o;
        return assemblyId.equals(that.assemblyId) && contigId.equals(that.contigId);
    }

    @Override
    public int hashCode() {
        return 31 * assemblyId.hashCode() + contigId.hashCode();
    }

    @Override
    public String toString() {
        return assemblyId + "/" + contigId;
    }
}
