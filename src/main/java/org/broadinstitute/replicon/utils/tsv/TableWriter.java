package org.broadinstitute.replicon.utils.tsv;

import com.opencsv.CSVWriter;
import org.broadinstitute.replicon.utils.Utils;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Class to write tab or comma separated table files.
 * <p>
 * Sub-classes implement {@link #composeLine} to fill a {@link DataLine} from a record. The header line is
 * written before the first record, or on {@link #close} if there were no records, unless the writer was
 * created headerless.
 * </p>
 *
 * @param <R> the record type.
 */
public abstract class TableWriter<R> implements Closeable {

    private final CSVWriter writer;

    private final TableColumnCollection columns;

    private boolean headerWritten;

    /**
     * Creates a new table writer on a file, using the separator implied by the file name.
     *
     * @throws IOException if the file could not be opened for writing.
     */
    public TableWriter(final Path path, final TableColumnCollection columns) throws IOException {
        this(Files.newBufferedWriter(Utils.nonNull(path, "The path cannot be null."), StandardCharsets.UTF_8),
                columns, TableUtils.separatorFor(path), true);
    }

    /**
     * Creates a new table writer.
     *
     * @param writer the destination.
     * @param columns the table columns.
     * @param columnSeparator the separator character.
     * @param writeHeader whether a header line is written.
     */
    public TableWriter(final Writer writer, final TableColumnCollection columns, final char columnSeparator,
                       final boolean writeHeader) {
        this.columns = Utils.nonNull(columns, "The columns cannot be null.");
        this.writer = new CSVWriter(Utils.nonNull(writer, "the input writer cannot be null"),
                columnSeparator, TableUtils.QUOTE_CHARACTER, TableUtils.ESCAPE_CHARACTER);
        this.headerWritten = !writeHeader;
    }

    public void writeRecord(final R record) throws IOException {
        Utils.nonNull(record, "The record cannot be null.");
        writeHeaderIfApplies();
        final DataLine dataLine = new DataLine(columns, IllegalArgumentException::new);
        composeLine(record, dataLine);
        writer.writeNext(dataLine.unpack(), false);
    }

    public final void writeAllRecords(final Iterable<R> records) throws IOException {
        Utils.nonNull(records, "The record iterable cannot be null.");
        for (final R record : records) {
            writeRecord(record);
        }
    }

    @Override
    public final void close() throws IOException {
        writeHeaderIfApplies();
        writer.close();
    }

    public void writeHeaderIfApplies() throws IOException {
        if (!headerWritten) {
            writer.writeNext(columns.names().toArray(new String[columns.columnCount()]), false);
        }
        headerWritten = true;
    }

    /**
     * Composes the data-line to write for a record; every column must be set.
     */
    protected abstract void composeLine(final R record, final DataLine dataLine);
}
