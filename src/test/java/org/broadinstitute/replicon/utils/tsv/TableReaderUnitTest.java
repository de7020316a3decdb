package org.broadinstitute.replicon.utils.tsv;

import org.broadinstitute.replicon.exceptions.UserException;
import org.broadinstitute.replicon.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;

public final class TableReaderUnitTest extends BaseTest {

    private static TableReader<String> pairReader(final String content) throws IOException {
        return TableUtils.reader("test-table", new StringReader(content),
                new TableReaderOptions(TableUtils.COLUMN_SEPARATOR, true),
                (columns, formatErrorFactory) -> {
                    columns.requireAll("test-table", "a", "b");
                    return dataLine -> dataLine.get("a").equals("skip") ? null : dataLine.get("a") + ":" + dataLine.get("b");
                });
    }

    @Test
    public void testReadRecordSkipsCommentsAndBlankLines() throws IOException {
        try (final TableReader<String> reader = pairReader("# a comment\na\tb\n1\t2\n\n# another\n3\t4\n")) {
            Assert.assertEquals(reader.columns().names(), Arrays.asList("a", "b"));
            Assert.assertEquals(reader.readRecord(), "1:2");
            Assert.assertEquals(reader.readRecord(), "3:4");
            Assert.assertNull(reader.readRecord());
        }
    }

    @Test
    public void testNullRecordsAreDropped() throws IOException {
        try (final TableReader<String> reader = pairReader("a\tb\nskip\t1\n2\t3\n")) {
            Assert.assertEquals(reader.toList(), Collections.singletonList("2:3"));
        }
    }

    @Test
    public void testByteOrderMarkAndPaddedHeader() throws IOException {
        try (final TableReader<String> reader = pairReader("\uFEFFa\t b \n1\t2\n")) {
            Assert.assertTrue(reader.columns().containsAll("a", "b"));
            Assert.assertEquals(reader.toList(), Collections.singletonList("1:2"));
        }
    }

    @Test
    public void testCommaSeparatedInput() throws IOException {
        try (final TableReader<String> reader = TableUtils.reader("test-table", new StringReader("a,b\n\"x,y\",z\n"),
                new TableReaderOptions(TableUtils.CSV_COLUMN_SEPARATOR, true),
                (columns, formatErrorFactory) -> dataLine -> dataLine.get("a") + "|" + dataLine.get("b"))) {
            Assert.assertEquals(reader.toList(), Collections.singletonList("x,y|z"));
        }
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testMismatchingValueCount() throws IOException {
        try (final TableReader<String> reader = pairReader("a\tb\n1\t2\t3\n")) {
            reader.toList();
        }
    }

    @Test
    public void testShortLinesArePadded() throws IOException {
        try (final TableReader<String> reader = pairReader("a\tb\n1\t2\n3\n")) {
            Assert.assertEquals(reader.toList(), Arrays.asList("1:2", "3:"));
        }
    }

    @Test
    public void testShortLinesRejectedWhenCountMustMatch() throws IOException {
        try (final TableReader<String> reader = TableUtils.reader("test-table", new StringReader("a\tb\n1\t2\n3\n"),
                new TableReaderOptions(TableUtils.COLUMN_SEPARATOR, true, false),
                (columns, formatErrorFactory) -> dataLine -> dataLine.get("a") + ":" + dataLine.get("b"))) {
            Assert.assertEquals(reader.readRecord(), "1:2");
            final UserException.BadInput ex = Assert.expectThrows(UserException.BadInput.class, reader::readRecord);
            Assert.assertTrue(ex.getMessage().contains("line 3"), ex.getMessage());
        }
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testMissingHeader() throws IOException {
        pairReader("# only comments\n\n");
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testRepeatedColumnNames() throws IOException {
        pairReader("a\tb\ta\n1\t2\t3\n");
    }

    @Test
    public void testRequiredColumnAbsent() {
        final UserException.MissingColumn ex = Assert.expectThrows(UserException.MissingColumn.class,
                () -> pairReader("a\tc\n1\t2\n"));
        Assert.assertEquals(ex.getColumn(), "b");
        Assert.assertTrue(ex.getMessage().contains("[a, c]"), ex.getMessage());
    }

    @Test
    public void testUnknownColumnRequestIsAFormatError() throws IOException {
        try (final TableReader<String> reader = TableUtils.reader("test-table", new StringReader("a\n1\n"),
                new TableReaderOptions(TableUtils.COLUMN_SEPARATOR, true),
                (columns, formatErrorFactory) -> dataLine -> dataLine.get("b"))) {
            final UserException.BadInput ex = Assert.expectThrows(UserException.BadInput.class, reader::toList);
            Assert.assertTrue(ex.getMessage().contains("test-table"), ex.getMessage());
            Assert.assertTrue(ex.getMessage().contains("there is no such a column: b"), ex.getMessage());
        }
    }

    @Test
    public void testDefaultValueForAbsentColumn() throws IOException {
        try (final TableReader<String> reader = TableUtils.reader("test-table", new StringReader("a\n1\n"),
                new TableReaderOptions(TableUtils.COLUMN_SEPARATOR, true),
                (columns, formatErrorFactory) -> dataLine -> dataLine.get("a") + dataLine.get("b", "-"))) {
            Assert.assertEquals(reader.toList(), Collections.singletonList("1-"));
        }
    }

    @Test
    public void testWriterRejectsIncompleteLines() throws IOException {
        final TableColumnCollection columns = new TableColumnCollection("a", "b");
        final StringWriter output = new StringWriter();
        try (final TableWriter<String> writer = TableUtils.writer(output, columns, TableUtils.COLUMN_SEPARATOR, true,
                (value, dataLine) -> dataLine.append(value))) {
            Assert.assertThrows(IllegalStateException.class, () -> writer.writeRecord("x"));
        }
        try (final TableWriter<String> writer = TableUtils.writer(new StringWriter(), columns, TableUtils.COLUMN_SEPARATOR, true,
                (value, dataLine) -> dataLine.append(value, value, value))) {
            Assert.assertThrows(IllegalStateException.class, () -> writer.writeRecord("x"));
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testColumnNamesCannotStartAsComment() {
        new TableColumnCollection("#a", "b");
    }
}
