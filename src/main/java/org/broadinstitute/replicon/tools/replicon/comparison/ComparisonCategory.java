package org.broadinstitute.replicon.tools.replicon.comparison;

import org.broadinstitute.replicon.utils.Utils;

/**
 * Relationship between the old and the new call of a fragment.
 * <p>
 * Constants are declared in the order used by summaries. The label is the value written to output tables.
 * </p>
 */
public enum ComparisonCategory {
    EXACT_MATCH("exact_match", false),
    ANNOTATION_SUFFIX("annotation_suffix", false),
    EXTRA_ANNOTATION("extra_annotation", false),
    BASE_MATCH("base_match", false),
    SAME_FAMILY_TIEBREAK("same_family_tiebreak", false),
    AUTO_CHROMOSOME("auto_chromosome", false),
    MANUAL_OVERRIDE("manual_override", false),
    PARTIAL_OVERLAP("partial_overlap", true),
    DIFFERENT("different", true),
    NEW_UNCLASSIFIED("new_unclassified", true),
    OLD_UNCLASSIFIED("old_unclassified", false),
    OLD_ONLY("old_only", false),
    NEW_ONLY("new_only", false);

    private final String label;
    private final boolean needsReview;

    ComparisonCategory(final String label, final boolean needsReview) {
        this.label = label;
        this.needsReview = needsReview;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Whether fragments in this category are listed for manual review.
     */
    public boolean needsReview() {
        return needsReview;
    }

    public static ComparisonCategory fromLabel(final String label) {
        Utils.nonNull(label, "the label cannot be null");
        for (final ComparisonCategory category : values()) {
            if (category.label.equals(label.trim())) {
                return category;
            }
        }
        throw new IllegalArgumentException("unknown comparison category: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
