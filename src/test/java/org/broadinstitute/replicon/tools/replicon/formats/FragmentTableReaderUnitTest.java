package org.broadinstitute.replicon.tools.replicon.formats;

import org.broadinstitute.replicon.exceptions.UserException;
import org.broadinstitute.replicon.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPOutputStream;

public final class FragmentTableReaderUnitTest extends BaseTest {

    private static final FragmentColumns COLUMNS = new FragmentColumns("assembly_id", "contig_id", "final_call");

    @Test
    public void testReadTabSeparated() {
        final File input = createTempFileWithContents("calls", ".tsv",
                "assembly_id\tcontig_id\tcontig_len\tfinal_call",
                "asm1\tcontig_1\t30500\tlp28-4",
                "asm1\tcontig_2\t910000\t chromosome ");
        final List<FragmentRecord> records = new FragmentTableReader(COLUMNS).read(input.toPath());
        Assert.assertEquals(records.size(), 2);
        Assert.assertEquals(records.get(0).getKey(), new FragmentKey("asm1", "contig_1"));
        Assert.assertEquals(records.get(0).getLength(), 30500L);
        Assert.assertEquals(records.get(0).getCall(), "lp28-4");
        Assert.assertEquals(records.get(1).getCall(), "chromosome");
        Assert.assertTrue(records.get(1).getAlignmentStats().isUnknown());
    }

    @Test
    public void testReadCommaSeparated() {
        final File input = createTempFileWithContents("calls", ".csv",
                "assembly_id,contig_id,contig_len,final_call",
                "asm1,contig_1,1200,\"cp32-1+cp32-2\"");
        final List<FragmentRecord> records = new FragmentTableReader(COLUMNS).read(input.toPath());
        Assert.assertEquals(records.size(), 1);
        Assert.assertEquals(records.get(0).getCall(), "cp32-1+cp32-2");
        Assert.assertEquals(records.get(0).getLength(), 1200L);
    }

    @Test
    public void testReadGzippedCsv() throws IOException {
        final Path input = createTempFile("calls", ".csv.gz").toPath();
        try (final PrintWriter out = new PrintWriter(new GZIPOutputStream(Files.newOutputStream(input)))) {
            out.print("assembly_id,contig_id,final_call\n");
            out.print("asm1,contig_1,lp54\n");
        }
        final List<FragmentRecord> records = new FragmentTableReader(COLUMNS).read(input);
        Assert.assertEquals(records.size(), 1);
        Assert.assertEquals(records.get(0).getLength(), 0L);
        Assert.assertEquals(records.get(0).getCall(), "lp54");
    }

    @Test
    public void testCustomColumnNames() {
        final File input = createTempFileWithContents("calls", ".tsv",
                "asm\tctg\tplasmid_name",
                "asm1\tcontig_1\tlp17");
        final List<FragmentRecord> records =
                new FragmentTableReader(new FragmentColumns("asm", "ctg", "plasmid_name")).read(input.toPath());
        Assert.assertEquals(records.get(0).getKey(), new FragmentKey("asm1", "contig_1"));
        Assert.assertEquals(records.get(0).getCall(), "lp17");
    }

    @Test(expectedExceptions = UserException.MissingColumn.class)
    public void testMissingCallColumn() {
        final File input = createTempFileWithContents("calls", ".tsv",
                "assembly_id\tcontig_id\tplasmid_name",
                "asm1\tcontig_1\tlp17");
        new FragmentTableReader(COLUMNS).read(input.toPath());
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingFile() {
        new FragmentTableReader(COLUMNS).read(getSafeNonExistentFile("missing.tsv").toPath());
    }

    @Test
    public void testSkippedRowsAndInvalidNumbers() {
        final File input = createTempFileWithContents("calls", ".tsv",
                "assembly_id\tcontig_id\tcontig_len\tfinal_call\tref_length\tref_covered_length\tquery_coverage_percent\toverall_percent_identity",
                "\tcontig_1\t100\tlp17\t\t\t\t",
                "asm1\t \t100\tlp17\t\t\t\t",
                "asm1\tcontig_3\tabc\tlp17\t17000\t16900\tn/a\t99.5",
                "asm1\tcontig_4\t-5\tlp25\t\t\t\t");
        final FragmentTableReader reader = new FragmentTableReader(COLUMNS);
        final List<FragmentRecord> records = reader.read(input.toPath());
        Assert.assertEquals(records.size(), 2);
        Assert.assertEquals(reader.getSkippedRows(), 2);
        Assert.assertEquals(reader.getInvalidNumericValues(), 2);

        final FragmentRecord withStats = records.get(0);
        Assert.assertEquals(withStats.getLength(), 0L);
        Assert.assertEquals(withStats.getAlignmentStats().getReferenceLength(), 17000.0);
        Assert.assertEquals(withStats.getAlignmentStats().getReferenceCoveredLength(), 16900.0);
        Assert.assertTrue(Double.isNaN(withStats.getAlignmentStats().getQueryCoveragePercent()));
        assertEqualsDoubleSmart(withStats.getAlignmentStats().identity(), 0.995);
        Assert.assertEquals(records.get(1).getLength(), 0L);
    }

    @Test
    public void testRowMissingTrailingLength() {
        final File input = createTempFileWithContents("calls", ".tsv",
                "assembly_id\tcontig_id\tfinal_call\tcontig_len",
                "asm\tc1\tlp54\t1000",
                "asm\tc2\tcp26");
        final FragmentTableReader reader = new FragmentTableReader(COLUMNS);
        final List<FragmentRecord> records = reader.read(input.toPath());
        Assert.assertEquals(records.size(), 2);
        Assert.assertEquals(records.get(0).getLength(), 1000L);
        Assert.assertEquals(records.get(1).getKey(), new FragmentKey("asm", "c2"));
        Assert.assertEquals(records.get(1).getCall(), "cp26");
        Assert.assertEquals(records.get(1).getLength(), 0L);
        Assert.assertEquals(reader.getInvalidNumericValues(), 0);
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testRowWithExtraValues() {
        final File input = createTempFileWithContents("calls", ".tsv",
                "assembly_id\tcontig_id\tfinal_call",
                "asm\tc1\tlp54\textra");
        new FragmentTableReader(COLUMNS).read(input.toPath());
    }

    @Test
    public void testReadByKeyKeepsLastDuplicate() {
        final File input = createTempFileWithContents("calls", ".tsv",
                "assembly_id\tcontig_id\tfinal_call",
                "asm1\tcontig_1\tlp17",
                "asm1\tcontig_2\tlp25",
                "asm1\tcontig_1\tlp28-1");
        final FragmentTableReader reader = new FragmentTableReader(COLUMNS);
        final Map<FragmentKey, FragmentRecord> byKey = reader.readByKey(input.toPath());
        Assert.assertEquals(byKey.size(), 2);
        Assert.assertEquals(reader.getDuplicateKeys(), 1);
        Assert.assertEquals(new ArrayList<>(byKey.keySet()),
                List.of(new FragmentKey("asm1", "contig_1"), new FragmentKey("asm1", "contig_2")));
        Assert.assertEquals(byKey.get(new FragmentKey("asm1", "contig_1")).getCall(), "lp28-1");
    }

    @Test
    public void testCommentLinesAreIgnored() {
        final File input = createTempFileWithContents("calls", ".tsv",
                "#produced by the classifier",
                "assembly_id\tcontig_id\tfinal_call",
                "asm1\tcontig_1\tlp17");
        Assert.assertEquals(new FragmentTableReader(COLUMNS).read(input.toPath()).size(), 1);
    }
}
