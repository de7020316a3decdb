package org.broadinstitute.replicon.tools.replicon.comparison;

import org.broadinstitute.replicon.utils.Utils;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Number of fragments per {@link ComparisonCategory}.
 * <p>
 * Instances are immutable. {@link #merge} sums per category, so partial tallies can be combined in any order
 * with {@link #empty()} as the identity.
 * </p>
 */
public final class CategoryCounts {

    private static final CategoryCounts EMPTY = new CategoryCounts(new EnumMap<>(ComparisonCategory.class));

    private final Map<ComparisonCategory, Long> counts;

    private CategoryCounts(final EnumMap<ComparisonCategory, Long> counts) {
        this.counts = Collections.unmodifiableMap(counts);
    }

    public static CategoryCounts empty() {
        return EMPTY;
    }

    public static CategoryCounts of(final ComparisonCategory category) {
        final EnumMap<ComparisonCategory, Long> counts = new EnumMap<>(ComparisonCategory.class);
        counts.put(Utils.nonNull(category, "the category cannot be null"), 1L);
        return new CategoryCounts(counts);
    }

    public static CategoryCounts of(final Iterable<ComparisonResult> results) {
        final EnumMap<ComparisonCategory, Long> counts = new EnumMap<>(ComparisonCategory.class);
        for (final ComparisonResult result : Utils.nonNull(results, "the results cannot be null")) {
            counts.merge(result.getCategory(), 1L, Long::sum);
        }
        return new CategoryCounts(counts);
    }

    public CategoryCounts merge(final CategoryCounts other) {
        Utils.nonNull(other, "the other counts cannot be null");
        final EnumMap<ComparisonCategory, Long> merged = new EnumMap<>(ComparisonCategory.class);
        merged.putAll(counts);
        other.counts.forEach((category, count) -> merged.merge(category, count, Long::sum));
        return new CategoryCounts(merged);
    }

    public long get(final ComparisonCategory category) {
        return counts.getOrDefault(category, 0L);
    }

    public long total() {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }

    /**
     * @return the non-zero counts in summary order.
     */
    public Map<ComparisonCategory, Long> asMap() {
        return counts;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return counts.equals(((CategoryCounts) o).counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return counts.toString();
    }
}
