package org.broadinstitute.replicon.tools.replicon.comparison;

import org.broadinstitute.replicon.tools.replicon.formats.FragmentKey;
import org.broadinstitute.replicon.utils.Utils;

/**
 * Outcome of comparing the two calls of one fragment.
 */
public final class ComparisonResult implements Comparable<ComparisonResult> {

    private final FragmentKey key;
    private final long contigLength;
    private final String oldCall;
    private final String newCall;
    private final ComparisonCategory category;
    private final String resolvedCall;

    public ComparisonResult(final FragmentKey key, final long contigLength, final String oldCall, final String newCall,
                            final ComparisonCategory category, final String resolvedCall) {
        this.key = Utils.nonNull(key, "the key cannot be null");
        this.contigLength = contigLength;
        this.oldCall = oldCall == null ? "" : oldCall;
        this.newCall = newCall == null ? "" : newCall;
        this.category = Utils.nonNull(category, "the category cannot be null");
        this.resolvedCall = resolvedCall == null ? "" : resolvedCall;
    }

    public FragmentKey getKey() {
        return key;
    }

    public long getContigLength() {
        return contigLength;
    }

    public String getOldCall() {
        return oldCall;
    }

    public String getNewCall() {
        return newCall;
    }

    public ComparisonCategory getCategory() {
        return category;
    }

    public String getResolvedCall() {
        return resolvedCall;
    }

    public boolean needsReview() {
        return category.needsReview();
    }

    @Override
    public int compareTo(final ComparisonResult other) {
        return key.compareTo(other.key);
    }

    /**
     * Formats the result as it appears in review listings.
     */
    public String toReviewString() {
        return String.format("%s/%s (%dbp): '%s' -> '%s' [%s]",
                key.getAssemblyId(), key.getContigId(), contigLength, oldCall, newCall, category);
    }

    @Override
    public String toString() {
        return key + " " + category + " -> " + resolvedCall;
    }
}
