package org.broadinstitute.replicon.tools.replicon.formats;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.broadinstitute.replicon.exceptions.UserException;
import org.broadinstitute.replicon.testutils.BaseTest;
import org.broadinstitute.replicon.tools.replicon.comparison.ComparisonCategory;
import org.broadinstitute.replicon.tools.replicon.comparison.ComparisonResult;
import org.testng.Assert;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;

public final class ClassifierHitsIndexUnitTest extends BaseTest {

    private static final String HEADER = "assembly_id\tcontig_id\tcontig_len\tplasmid_name\tidentity";

    private Path allHitsDir;

    @BeforeClass
    public void createHitsDirectory() throws IOException {
        allHitsDir = createTempDir("allHits").toPath();
        writeTable("pf32", "asm1_all.tsv",
                HEADER,
                "asm1\tcontig_1\t30500\tlp28-4\t98.1   ",
                "asm1\tcontig_1\t30500\t\t",
                "asm1\tcontig_2\t910000\tchromosome\t99.9");
        writeTable("wp", "asm1.v2_all.tsv",
                "asm1\tcontig_1\t30500\tcp26\t90.0");
        // no all-hits table, so not a database
        Files.createDirectories(allHitsDir.resolve("empty").resolve(ClassifierHitsIndex.TABLES_DIRECTORY));
        Files.createDirectories(allHitsDir.resolve("no_tables"));
    }

    private void writeTable(final String database, final String fileName, final String... lines) throws IOException {
        final Path tables = allHitsDir.resolve(database).resolve(ClassifierHitsIndex.TABLES_DIRECTORY);
        Files.createDirectories(tables);
        Files.write(tables.resolve(fileName), Arrays.asList(lines), StandardCharsets.UTF_8);
    }

    @Test
    public void testDiscoverDatabases() {
        final ClassifierHitsIndex index = ClassifierHitsIndex.discover(allHitsDir);
        Assert.assertFalse(index.isEmpty());
        Assert.assertEquals(index.getDatabases(), ImmutableSet.of("pf32", "wp"));
    }

    @Test
    public void testHitsAndHeader() {
        final ClassifierHitsIndex index = ClassifierHitsIndex.discover(allHitsDir);
        Assert.assertEquals(index.hits("pf32", "asm1", "contig_1"),
                ImmutableList.of("asm1\tcontig_1\t30500\tlp28-4\t98.1   "));
        Assert.assertEquals(index.header("pf32", "asm1"), Optional.of(HEADER));
        Assert.assertEquals(index.hits("pf32", "asm2", "contig_1"), ImmutableList.of());
    }

    @Test
    public void testPrefixFallbackWithoutHeader() {
        final ClassifierHitsIndex index = ClassifierHitsIndex.discover(allHitsDir);
        Assert.assertEquals(index.hits("wp", "asm1", "contig_1"), ImmutableList.of("asm1\tcontig_1\t30500\tcp26\t90.0"));
        Assert.assertEquals(index.header("wp", "asm1"), Optional.empty());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testUnknownDatabase() {
        ClassifierHitsIndex.discover(allHitsDir).tableLines("pmlp", "asm1");
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testNotADirectory() {
        ClassifierHitsIndex.discover(createTempFile("hits", ".tsv").toPath());
    }

    @Test
    public void testReviewReport() {
        final ReviewReportWriter writer = new ReviewReportWriter(ClassifierHitsIndex.discover(allHitsDir));
        final StringWriter out = new StringWriter();
        try (final PrintWriter printer = new PrintWriter(out)) {
            writer.write(printer, ImmutableList.of(new ComparisonResult(new FragmentKey("asm1", "contig_2"), 910000,
                    "chromosome", "lp54", ComparisonCategory.DIFFERENT, "chromosome")));
        }
        final String rule = "=".repeat(100);
        Assert.assertEquals(out.toString(), String.join("\n",
                "# Detailed review of 1 contigs needing manual review",
                "# Databases found: pf32, wp",
                "# Format: all hits per database for each flagged contig",
                "#",
                "",
                rule,
                "### asm1 / contig_2",
                "### old=chromosome  new=lp54  category=different",
                rule,
                "",
                "--- pf32 (1 hits) ---",
                "  " + HEADER,
                "  asm1\tcontig_2\t910000\tchromosome\t99.9",
                "",
                "--- wp (0 hits) ---",
                "  (no hits)",
                "",
                "",
                ""));
    }

    @Test
    public void testReviewReportFile() {
        final Path report = createTempFile("review", ".txt").toPath();
        new ReviewReportWriter(ClassifierHitsIndex.discover(allHitsDir)).write(report, ImmutableList.of(
                new ComparisonResult(new FragmentKey("asm1", "contig_1"), 30500, "lp28-4", "cp26",
                        ComparisonCategory.DIFFERENT, "lp28-4")));
        assertContainsAll(readLines(report),
                "--- pf32 (1 hits) ---",
                "  asm1\tcontig_1\t30500\tlp28-4\t98.1",
                "--- wp (1 hits) ---",
                "  asm1\tcontig_1\t30500\tcp26\t90.0");
    }
}
