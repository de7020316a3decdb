package org.broadinstitute.replicon.tools.replicon.calls;

import com.google.common.collect.ImmutableSet;
import org.broadinstitute.replicon.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Set;

public final class CallNormalizerUnitTest extends BaseTest {

    @DataProvider(name = "emptyCalls")
    public Object[][] emptyCalls() {
        return new Object[][] {
                {null}, {""}, {"   "}, {"NA"}, {"na"}, {"NaN"}, {"None"}, {"unclassified"}, {" Unclassified\t"}
        };
    }

    @Test(dataProvider = "emptyCalls")
    public void testEmptyCallsNormalizeToTheEmptyCall(final String call) {
        Assert.assertEquals(CallNormalizer.normalize(call), CallNormalizer.EMPTY_CALL);
        Assert.assertTrue(CallNormalizer.isEmpty(call));
        Assert.assertTrue(CallNormalizer.splitCompound(call).isEmpty());
        Assert.assertNull(CallNormalizer.familyOf(call));
    }

    @DataProvider(name = "calls")
    public Object[][] calls() {
        return new Object[][] {
                {"lp28-4", "lp28-4"},
                {" LP28-4 ", "lp28-4"},
                {"Chromosome", "chromosome"},
                {"cp32-1+5", "cp32-1+5"},
                {"lp28-4:::LP17", "lp28-4:::lp17"},
                {"unclassified_x", "unclassified_x"}
        };
    }

    @Test(dataProvider = "calls")
    public void testNormalizeIsIdempotentAndCaseInsensitive(final String call, final String expected) {
        final String normalized = CallNormalizer.normalize(call);
        Assert.assertEquals(normalized, expected);
        Assert.assertEquals(CallNormalizer.normalize(normalized), normalized);
        Assert.assertEquals(CallNormalizer.normalize(call.toUpperCase()), normalized);
        Assert.assertFalse(CallNormalizer.isEmpty(call));
    }

    @Test
    public void testSentinelsShareOneNormalForm() {
        Assert.assertEquals(CallNormalizer.normalize(""), CallNormalizer.normalize("NA"));
        Assert.assertEquals(CallNormalizer.normalize("NA"), CallNormalizer.normalize("unclassified"));
    }

    @Test
    public void testIsChromosome() {
        Assert.assertTrue(CallNormalizer.isChromosome(" CHROMOSOME "));
        Assert.assertFalse(CallNormalizer.isChromosome("chromosome*"));
        Assert.assertFalse(CallNormalizer.isChromosome(null));
    }

    @DataProvider(name = "suffixes")
    public Object[][] suffixes() {
        return new Object[][] {
                {"lp28-4*", "lp28-4"},
                {"lp28-4***", "lp28-4"},
                {" lp28-4 * ", "lp28-4"},
                {"lp28-4", "lp28-4"},
                {"lp*28", "lp*28"},
                {null, ""}
        };
    }

    @Test(dataProvider = "suffixes")
    public void testStripSuffix(final String call, final String expected) {
        Assert.assertEquals(CallNormalizer.stripSuffix(call), expected);
    }

    @Test
    public void testSplitCompound() {
        Assert.assertEquals(CallNormalizer.splitCompound("lp28-4:::lp17"), ImmutableSet.of("lp28-4", "lp17"));
        Assert.assertEquals(CallNormalizer.splitCompound("cp32-1+5"), ImmutableSet.of("cp32-1+5"));
        Assert.assertEquals(CallNormalizer.splitCompound("LP17 ::: lp17:::"), ImmutableSet.of("lp17"));
    }

    @Test
    public void testSplitCompoundKeepsOrderOfAppearance() {
        final Set<String> tokens = CallNormalizer.splitCompound("lp54:::cp26:::lp17");
        Assert.assertEquals(new ArrayList<>(tokens).get(0), "lp54");
        Assert.assertEquals(new ArrayList<>(tokens).get(2), "lp17");
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void testSplitCompoundIsUnmodifiable() {
        CallNormalizer.splitCompound("lp54").add("lp17");
    }

    @DataProvider(name = "families")
    public Object[][] families() {
        return new Object[][] {
                {"lp28-4", "lp28"},
                {"LP28-4*", "lp28"},
                {"cp32-1+5", "cp32"},
                {"lp28-2+lp25", "lp28"},
                {"lp56-cp32", "lp56"},
                {"cp9", "cp9"},
                {"chromosome", "chromosome"},
                {"unknown", "unknown"},
                {"multi-replicon", "multi-replicon"},
                {"plasmid_x", "plasmid_x"},
                {"+lp17", "+lp17"}
        };
    }

    @Test(dataProvider = "families")
    public void testFamilyOf(final String call, final String expected) {
        Assert.assertEquals(CallNormalizer.familyOf(call), expected);
    }
}
