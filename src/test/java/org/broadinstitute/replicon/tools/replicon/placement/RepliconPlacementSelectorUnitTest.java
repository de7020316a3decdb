package org.broadinstitute.replicon.tools.replicon.placement;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.replicon.testutils.BaseTest;
import org.broadinstitute.replicon.tools.replicon.formats.AlignmentStats;
import org.broadinstitute.replicon.tools.replicon.formats.FragmentKey;
import org.broadinstitute.replicon.tools.replicon.formats.FragmentRecord;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public final class RepliconPlacementSelectorUnitTest extends BaseTest {

    private static final RepliconPlacementSelector CLASSIFIED =
            new RepliconPlacementSelector(PlacementMode.CLASSIFIED, PlacementThresholds.DEFAULT);
    private static final RepliconPlacementSelector COMPLETE =
            new RepliconPlacementSelector(PlacementMode.COMPLETE, PlacementThresholds.DEFAULT);

    private static FragmentRecord fragment(final String assembly, final String contig, final long length, final String call) {
        return new FragmentRecord(new FragmentKey(assembly, contig), length, call);
    }

    private static FragmentRecord aligned(final String contig, final String call, final double refLength,
                                          final double covered, final double queryPercent, final double identityPercent) {
        return new FragmentRecord(new FragmentKey("asm", contig), 1000, call,
                new AlignmentStats(refLength, covered, queryPercent, identityPercent));
    }

    @Test
    public void testClassifiedPlacement() {
        final AssemblyPlacement placement = CLASSIFIED.place("asm", ImmutableList.of(
                fragment("asm", "A", 1000, "lp54"),
                fragment("asm", "B", 400, "lp54"),
                fragment("asm", "C", 900, "chromosome")));
        Assert.assertEquals(placement.getChromosomeEntries(), ImmutableList.of(
                new ChromosomeListEntry("C", "main", RepliconTopology.LINEAR, ChromosomeType.CHROMOSOME),
                new ChromosomeListEntry("A", "lp54", RepliconTopology.LINEAR, ChromosomeType.PLASMID)));
        Assert.assertEquals(placement.getChromosomeEntries().get(0).getChromosomeType(), "Linear-Chromosome");
        Assert.assertEquals(placement.getChromosomeEntries().get(1).getChromosomeType(), "Linear-Plasmid");
        Assert.assertEquals(placement.getUnlocalisedEntries(), ImmutableList.of(new UnlocalisedListEntry("B", "lp54")));
        Assert.assertEquals(placement.getUnplacedCount(), 0);
        Assert.assertTrue(placement.hasPlacements());
    }

    @Test
    public void testClassifiedTiesKeepInputOrder() {
        final AssemblyPlacement placement = CLASSIFIED.place("asm", ImmutableList.of(
                fragment("asm", "first", 500, "cp32-1+5"),
                fragment("asm", "second", 500, "cp32-1+5"),
                fragment("asm", "third", 700, "cp32-1+5")));
        Assert.assertEquals(placement.getChromosomeEntries(), ImmutableList.of(
                new ChromosomeListEntry("third", "cp32-1-5", RepliconTopology.CIRCULAR, ChromosomeType.PLASMID)));
        Assert.assertEquals(placement.getChromosomeEntries().get(0).getChromosomeType(), "Circular-Plasmid");
        Assert.assertEquals(placement.getUnlocalisedEntries(), ImmutableList.of(
                new UnlocalisedListEntry("first", "cp32-1-5"),
                new UnlocalisedListEntry("second", "cp32-1-5")));
    }

    @Test
    public void testClassifiedUnplacedFragments() {
        final AssemblyPlacement placement = CLASSIFIED.place("asm", ImmutableList.of(
                fragment("asm", "A", 1000, ""),
                fragment("asm", "B", 1000, "Unclassified"),
                fragment("asm", "C", 1000, "NA")));
        Assert.assertFalse(placement.hasPlacements());
        Assert.assertEquals(placement.getUnplacedCount(), 3);
    }

    @Test
    public void testClassifiedObjectNamesDropMetadata() {
        final AssemblyPlacement placement = CLASSIFIED.place("asm", ImmutableList.of(
                fragment("asm", "contig_7 [topology=circular] [completeness=complete]", 1000, "cp26")));
        Assert.assertEquals(placement.getChromosomeEntries().get(0).getObjectName(), "contig_7");
    }

    @DataProvider(name = "completeness")
    public Object[][] completeness() {
        return new Object[][] {
                {aligned("c", "lp54", 1000, 950, 90, 90), true},
                {aligned("c", "lp54", 1000, 949, 90, 90), false},
                {aligned("c", "lp54", 1000, 1000, 89.9, 100), false},
                {aligned("c", "lp54", 1000, 1000, 100, 89.9), false},
                {aligned("c", "lp54", 0, 0, 100, 100), false},
                {aligned("c", "lp54", Double.NaN, 1000, 100, 100), false},
                {aligned("c", "lp54", 1000, 1000, Double.NaN, 100), false},
                {new FragmentRecord(new FragmentKey("asm", "c"), 1000, "lp54"), false}
        };
    }

    @Test(dataProvider = "completeness")
    public void testCompletePlacement(final FragmentRecord fragment, final boolean placed) {
        final AssemblyPlacement placement = COMPLETE.place("asm", ImmutableList.of(fragment));
        Assert.assertEquals(placement.getChromosomeEntries().size(), placed ? 1 : 0);
        Assert.assertEquals(placement.getUnplacedCount(), placed ? 0 : 1);
        Assert.assertTrue(placement.getUnlocalisedEntries().isEmpty());
    }

    @Test
    public void testCompletePlacementHasNoFragmentTier() {
        final AssemblyPlacement placement = COMPLETE.place("asm", ImmutableList.of(
                aligned("c1", "lp28-4", 1000, 1000, 100, 100),
                aligned("c2", "lp28-4", 1000, 1000, 100, 100),
                aligned("c3", "", 1000, 1000, 100, 100),
                aligned("c4", "chromosome", 1000, 1000, 100, 100)));
        Assert.assertEquals(placement.getChromosomeEntries().stream().map(ChromosomeListEntry::getObjectName).collect(Collectors.toList()),
                ImmutableList.of("c1", "c2", "c4"));
        Assert.assertEquals(placement.getChromosomeEntries().get(2).getChromosomeName(), "main");
        Assert.assertEquals(placement.getUnplacedCount(), 0);
    }

    @Test
    public void testCustomThresholds() {
        final RepliconPlacementSelector lenient = new RepliconPlacementSelector(PlacementMode.COMPLETE,
                new PlacementThresholds(0.5, 0.5, 0.5));
        Assert.assertTrue(lenient.place("asm", ImmutableList.of(aligned("c", "lp54", 1000, 600, 60, 60))).hasPlacements());
        Assert.assertFalse(COMPLETE.place("asm", ImmutableList.of(aligned("c", "lp54", 1000, 600, 60, 60))).hasPlacements());
    }

    @Test(dataProvider = "threadCounts")
    public void testPlaceAll(final int threads) {
        final List<FragmentRecord> records = new ArrayList<>();
        records.add(fragment("asm2", "A", 1000, "lp54"));
        records.add(fragment("asm1", "A", 1000, "lp54"));
        records.add(fragment("asm1", "B", 100, "lp54"));
        records.add(fragment("asm3", "A", 1000, "unclassified"));
        records.add(fragment(" ", "A", 1000, "lp54"));
        final PlacementOutcome outcome = CLASSIFIED.placeAll(records, threads);
        Assert.assertEquals(outcome.getPlacements().stream().map(AssemblyPlacement::getAssemblyId).collect(Collectors.toList()),
                ImmutableList.of("asm1", "asm2", "asm3"));
        Assert.assertEquals(outcome.getAssembliesWithoutEntries(), ImmutableList.of("asm3"));
        Assert.assertEquals(outcome.totalPlaced(), 2);
        Assert.assertEquals(outcome.totalUnlocalised(), 1);
        Assert.assertEquals(outcome.totalUnplaced(), 1);
        Assert.assertTrue(outcome.getFailedAssemblies().isEmpty());
    }

    @DataProvider(name = "threadCounts")
    public Object[][] threadCounts() {
        return new Object[][] {{1}, {3}};
    }

    @DataProvider(name = "names")
    public Object[][] names() {
        return new Object[][] {
                {"cp32-1+5", "cp32-1-5"},
                {"chromosome", "main"},
                {"Chromosome ", "main"},
                {"lp28-4", "lp28-4"}
        };
    }

    @Test(dataProvider = "names")
    public void testSanitizeRepliconName(final String replicon, final String expected) {
        Assert.assertEquals(RepliconPlacementSelector.sanitizeRepliconName(replicon), expected);
    }

    @Test
    public void testTopologyAndType() {
        Assert.assertEquals(RepliconTopology.of("cp26"), RepliconTopology.CIRCULAR);
        Assert.assertEquals(RepliconTopology.of("lp54"), RepliconTopology.LINEAR);
        Assert.assertEquals(RepliconTopology.of("chromosome"), RepliconTopology.LINEAR);
        Assert.assertEquals(RepliconTopology.of("plasmid_x"), RepliconTopology.LINEAR);
        Assert.assertEquals(ChromosomeType.of("CHROMOSOME"), ChromosomeType.CHROMOSOME);
        Assert.assertEquals(ChromosomeType.of("cp26"), ChromosomeType.PLASMID);
    }

    @Test
    public void testThresholdsToString() {
        Assert.assertEquals(PlacementThresholds.DEFAULT.toString(), "ref_cov=95%, query_cov=90%, identity=90%");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testThresholdOutOfRange() {
        new PlacementThresholds(1.1, 0.9, 0.9);
    }
}
