package org.broadinstitute.replicon.tools.replicon.calls;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.replicon.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

public final class FamilyRuleTableUnitTest extends BaseTest {

    @Test
    public void testDefaultRuleOrder() {
        final List<String> names = FamilyRuleTable.DEFAULT.getRules().stream()
                .map(FamilyRule::getName)
                .collect(Collectors.toList());
        Assert.assertEquals(names, ImmutableList.of(FamilyRuleTable.SENTINEL_RULE, FamilyRuleTable.CHROMOSOME_RULE,
                FamilyRuleTable.FUSION_RULE, FamilyRuleTable.PREFIX_RULE, FamilyRuleTable.IDENTITY_RULE));
    }

    @Test
    public void testRulesInIsolation() {
        final List<FamilyRule> rules = FamilyRuleTable.DEFAULT.getRules();
        final FamilyRule chromosome = rules.get(1);
        final FamilyRule fusion = rules.get(2);
        final FamilyRule prefix = rules.get(3);

        Assert.assertEquals(chromosome.apply("chromosome"), Optional.of("chromosome"));
        Assert.assertEquals(chromosome.apply("lp54"), Optional.empty());

        Assert.assertEquals(fusion.apply("cp32-1+5"), Optional.of("cp32"));
        Assert.assertEquals(fusion.apply("lp28-4"), Optional.empty());
        // the component before the join has no letters+digits run
        Assert.assertEquals(fusion.apply("x+lp17"), Optional.empty());

        Assert.assertEquals(prefix.apply("lp28-4"), Optional.of("lp28"));
        Assert.assertEquals(prefix.apply("plasmid_x"), Optional.empty());
    }

    @Test
    public void testFusionWithoutPrefixFallsThroughToPrefixRule() {
        Assert.assertEquals(FamilyRuleTable.DEFAULT.familyOf("x+lp17"), "x+lp17");
        Assert.assertEquals(FamilyRuleTable.DEFAULT.familyOf("lp17x+cp9"), "lp17");
    }

    @Test
    public void testCustomTable() {
        final FamilyRuleTable table = new FamilyRuleTable(ImmutableList.of(
                new FamilyRule("first-letter", call -> Optional.of(call.substring(0, 1)))));
        Assert.assertEquals(table.familyOf("lp54"), "l");
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testTableWithoutFallbackCanFail() {
        new FamilyRuleTable(ImmutableList.of(new FamilyRule("never", call -> Optional.empty()))).familyOf("lp54");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testEmptyTableIsRejected() {
        new FamilyRuleTable(Collections.emptyList());
    }
}
