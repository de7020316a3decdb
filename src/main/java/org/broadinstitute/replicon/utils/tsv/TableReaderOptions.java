package org.broadinstitute.replicon.utils.tsv;

import org.broadinstitute.replicon.utils.Utils;

import java.nio.file.Path;

/**
 * Parsing options for a {@link TableReader}.
 */
public final class TableReaderOptions {

    final char columnSeparator;

    final boolean skipBlankLines;

    final boolean padShortLines;

    /**
     * Options that pad lines with fewer values than columns, see {@link #TableReaderOptions(char, boolean, boolean)}.
     */
    public TableReaderOptions(final char columnSeparator, final boolean skipBlankLines) {
        this(columnSeparator, skipBlankLines, true);
    }

    /**
     * @param padShortLines whether a line with fewer values than columns has its missing trailing values read as
     *                      empty strings; if {@code false} such a line is a format error. A line with more values
     *                      than columns is always a format error.
     */
    public TableReaderOptions(final char columnSeparator, final boolean skipBlankLines, final boolean padShortLines) {
        this.columnSeparator = columnSeparator;
        this.skipBlankLines = skipBlankLines;
        this.padShortLines = padShortLines;
    }

    /**
     * Options for a table file whose separator is deduced from its name, see {@link TableUtils#separatorFor(Path)}.
     */
    public static TableReaderOptions forPath(final Path path) {
        return new TableReaderOptions(TableUtils.separatorFor(Utils.nonNull(path, "the path cannot be null")), true);
    }
}
