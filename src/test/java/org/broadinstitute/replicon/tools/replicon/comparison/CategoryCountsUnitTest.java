package org.broadinstitute.replicon.tools.replicon.comparison;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.replicon.testutils.BaseTest;
import org.broadinstitute.replicon.tools.replicon.formats.FragmentKey;
import org.testng.Assert;
import org.testng.annotations.Test;

public final class CategoryCountsUnitTest extends BaseTest {

    private static final CategoryCounts A = CategoryCounts.of(ImmutableList.of(
            result("c1", ComparisonCategory.EXACT_MATCH),
            result("c2", ComparisonCategory.EXACT_MATCH),
            result("c3", ComparisonCategory.DIFFERENT)));
    private static final CategoryCounts B = CategoryCounts.of(ComparisonCategory.DIFFERENT);
    private static final CategoryCounts C = CategoryCounts.of(ComparisonCategory.NEW_ONLY);

    private static ComparisonResult result(final String contig, final ComparisonCategory category) {
        return new ComparisonResult(new FragmentKey("asm", contig), 10, "a", "b", category, "a");
    }

    @Test
    public void testCounts() {
        Assert.assertEquals(A.get(ComparisonCategory.EXACT_MATCH), 2);
        Assert.assertEquals(A.get(ComparisonCategory.DIFFERENT), 1);
        Assert.assertEquals(A.get(ComparisonCategory.OLD_ONLY), 0);
        Assert.assertEquals(A.total(), 3);
        Assert.assertEquals(CategoryCounts.empty().total(), 0);
    }

    @Test
    public void testMergeIsACommutativeMonoid() {
        Assert.assertEquals(A.merge(CategoryCounts.empty()), A);
        Assert.assertEquals(CategoryCounts.empty().merge(A), A);
        Assert.assertEquals(A.merge(B), B.merge(A));
        Assert.assertEquals(A.merge(B).merge(C), A.merge(B.merge(C)));
        Assert.assertEquals(A.merge(B).get(ComparisonCategory.DIFFERENT), 2);
        Assert.assertEquals(A.merge(B).merge(C).total(), 5);
    }

    @Test
    public void testMergeDoesNotModifyOperands() {
        A.merge(B);
        Assert.assertEquals(A.total(), 3);
        Assert.assertEquals(B.total(), 1);
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void testAsMapIsUnmodifiable() {
        A.asMap().put(ComparisonCategory.OLD_ONLY, 1L);
    }
}
