package org.broadinstitute.replicon.tools.replicon.formats;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.replicon.testutils.BaseTest;
import org.broadinstitute.replicon.tools.replicon.comparison.ComparisonCategory;
import org.broadinstitute.replicon.tools.replicon.comparison.ComparisonResult;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;

public final class ComparisonTableWriterUnitTest extends BaseTest {

    private static final List<ComparisonResult> RESULTS = ImmutableList.of(
            new ComparisonResult(new FragmentKey("asm1", "contig_1"), 30500, "lp28-4", "cp26",
                    ComparisonCategory.DIFFERENT, "lp28-4"),
            new ComparisonResult(new FragmentKey("asm1", "contig_2"), 910000, "", "",
                    ComparisonCategory.AUTO_CHROMOSOME, "chromosome"));

    @Test
    public void testWriteTsv() throws IOException {
        final Path output = createTempFile("comparison", ".tsv").toPath();
        try (final ComparisonTableWriter writer = new ComparisonTableWriter(output)) {
            writer.writeAllRecords(RESULTS);
        }
        Assert.assertEquals(readLines(output), ImmutableList.of(
                "assembly_id\tcontig_id\tcontig_len\told_call\tnew_call\tcategory\tresolved_call",
                "asm1\tcontig_1\t30500\tlp28-4\tcp26\tdifferent\tlp28-4",
                "asm1\tcontig_2\t910000\t\t\tauto_chromosome\tchromosome"));
    }

    @Test
    public void testWriteCsvQuotesSeparators() throws IOException {
        final StringWriter out = new StringWriter();
        try (final ComparisonTableWriter writer = new ComparisonTableWriter(out, ',')) {
            writer.writeRecord(new ComparisonResult(new FragmentKey("asm1", "contig_3"), 1200, "cp32-1,cp32-2", "cp32-1",
                    ComparisonCategory.PARTIAL_OVERLAP, "cp32-1,cp32-2"));
        }
        Assert.assertEquals(out.toString(),
                "assembly_id,contig_id,contig_len,old_call,new_call,category,resolved_call\n"
                        + "asm1,contig_3,1200,\"cp32-1,cp32-2\",cp32-1,partial_overlap,\"cp32-1,cp32-2\"\n");
    }

    @Test
    public void testEmptyTableHasHeader() throws IOException {
        final Path output = createTempFile("comparison", ".csv").toPath();
        new ComparisonTableWriter(output).close();
        Assert.assertEquals(readLines(output),
                ImmutableList.of("assembly_id,contig_id,contig_len,old_call,new_call,category,resolved_call"));
    }

    @Test
    public void testResolvedCallWriter() throws IOException {
        final Path output = createTempFile("resolved", ".tsv").toPath();
        try (final ResolvedCallWriter writer = new ResolvedCallWriter(output)) {
            writer.writeAllRecords(RESULTS);
        }
        Assert.assertEquals(readLines(output), ImmutableList.of(
                "assembly_id\tcontig_id\tresolved_call",
                "asm1\tcontig_1\tlp28-4",
                "asm1\tcontig_2\tchromosome"));
    }
}
