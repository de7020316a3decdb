package org.broadinstitute.replicon.tools.replicon.comparison;

import org.broadinstitute.replicon.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.stream.Collectors;

public final class ComparisonCategoryUnitTest extends BaseTest {

    @Test
    public void testReviewCategories() {
        final EnumSet<ComparisonCategory> review = Arrays.stream(ComparisonCategory.values())
                .filter(ComparisonCategory::needsReview)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(ComparisonCategory.class)));
        Assert.assertEquals(review, EnumSet.of(ComparisonCategory.DIFFERENT, ComparisonCategory.PARTIAL_OVERLAP,
                ComparisonCategory.NEW_UNCLASSIFIED));
    }

    @Test
    public void testLabels() {
        for (final ComparisonCategory category : ComparisonCategory.values()) {
            Assert.assertEquals(ComparisonCategory.fromLabel(category.getLabel()), category);
            Assert.assertEquals(category.toString(), category.getLabel());
            Assert.assertEquals(category.getLabel(), category.name().toLowerCase());
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testUnknownLabel() {
        ComparisonCategory.fromLabel("not_a_category");
    }
}
