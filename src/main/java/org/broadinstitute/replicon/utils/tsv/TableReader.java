package org.broadinstitute.replicon.utils.tsv;

import com.opencsv.CSVReader;
import org.broadinstitute.replicon.exceptions.UserException;
import org.broadinstitute.replicon.utils.Utils;
import org.broadinstitute.replicon.utils.io.IOUtils;

import java.io.*;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reader class for tab or comma separated table files.
 * <p>
 * The first non-comment line is the header; it names the columns. Every following non-comment,
 * non-blank line is a record and may not have more values than there are columns; missing trailing values
 * read as empty strings unless {@link TableReaderOptions} asks for an exact count. A leading UTF-8 byte-order mark
 * on the header line is ignored and so is surrounding whitespace in column names.
 * </p>
 * <p>
 * Sub-classes implement {@link #createRecord(DataLine)} to turn a {@link DataLine} into a record.
 * Returning {@code null} from it drops the line.
 * </p>
 * <p>
 * Format errors are reported as {@link UserException.BadInput} with the source and line number.
 * </p>
 *
 * @param <R> record type.
 */
public abstract class TableReader<R> implements Closeable, Iterable<R> {

    private static final char BYTE_ORDER_MARK = '﻿';

    /**
     * Name of the source, typically the file path; {@code null} if unknown.
     */
    private final String source;

    private final LineNumberReader reader;

    private final CSVReader csvReader;

    private final TableReaderOptions options;

    private TableColumnCollection columns;

    private boolean nextRecordFetched = false;

    private R nextRecord;

    /**
     * Opens a table file, possibly gzipped, using the separator implied by its name.
     *
     * @throws IOException if thrown when opening or reading the header.
     * @throws UserException.BadInput if the header is missing or invalid.
     */
    public TableReader(final Path path) throws IOException {
        this(path, TableReaderOptions.forPath(Utils.nonNull(path, "the input file cannot be null")));
    }

    public TableReader(final Path path, final TableReaderOptions options) throws IOException {
        this(Utils.nonNull(path, "the input file cannot be null").toString(),
                IOUtils.makeReaderMaybeGzipped(path),
                options);
    }

    protected TableReader(final String sourceName, final Reader sourceReader,
                          final TableReaderOptions options) throws IOException {
        Utils.nonNull(sourceReader, "the reader cannot be null");
        this.options = Utils.nonNull(options, "the options cannot be null");
        this.source = sourceName;
        this.reader = sourceReader instanceof LineNumberReader ? (LineNumberReader) sourceReader : new LineNumberReader(sourceReader);
        this.csvReader = new CSVReader(this.reader, options.columnSeparator, TableUtils.QUOTE_CHARACTER, TableUtils.ESCAPE_CHARACTER);
        findAndProcessHeaderLine();
    }

    private void findAndProcessHeaderLine() throws IOException {
        String[] line;
        while ((line = csvReader.readNext()) != null) {
            if (line.length > 0 && !line[0].isEmpty() && line[0].charAt(0) == BYTE_ORDER_MARK) {
                line[0] = line[0].substring(1);
            }
            if (!isCommentLine(line) && !isBlankLine(line)) {
                break;
            }
        }
        if (line == null) {
            throw formatException("premature end of table: header line not found");
        }
        final String[] names = Arrays.stream(line).map(String::trim).toArray(String[]::new);
        TableColumnCollection.checkNames(names, this::formatException);
        columns = new TableColumnCollection(names);
        processColumns(columns);
    }

    private boolean isCommentLine(final String[] line) {
        return line.length > 0 && line[0].startsWith(TableUtils.COMMENT_PREFIX);
    }

    private boolean isBlankLine(final String[] line) {
        return options.skipBlankLines && (line.length == 0 || (line.length == 1 && line[0].trim().isEmpty()));
    }

    /**
     * Composes a format error that includes the source and current line number.
     */
    protected final UserException.BadInput formatException(final String message) {
        final String explanation = message == null ? "" : ": " + message;
        if (source == null) {
            return new UserException.BadInput(String.format("format error at line %d", reader.getLineNumber()) + explanation);
        } else {
            return new UserException.BadInput(String.format("format error in '%s' at line %d", source, reader.getLineNumber()) + explanation);
        }
    }

    /**
     * Hook for checking the header columns; sub-classes typically call
     * {@link TableColumnCollection#requireAll} here.
     *
     * @param tableColumns the header columns.
     */
    protected void processColumns(@SuppressWarnings("unused") final TableColumnCollection tableColumns) {
        // nothing by default.
    }

    public TableColumnCollection columns() {
        Utils.validate(columns != null, "columns are null");
        return columns;
    }

    /**
     * Reads the next record.
     *
     * @return {@code null} when the end of the input has been reached.
     */
    public final R readRecord() throws IOException {
        if (!nextRecordFetched) {
            nextRecord = fetchNextRecord();
        }
        nextRecordFetched = false;
        return nextRecord;
    }

    private R fetchNextRecord() throws IOException {
        nextRecordFetched = true;
        String[] line;
        while ((line = csvReader.readNext()) != null) {
            if (!isCommentLine(line) && !isBlankLine(line)) {
                if (line.length > columns.columnCount() || (line.length < columns.columnCount() && !options.padShortLines)) {
                    throw formatException(String.format("mismatch between number of values in line (%d) and number of columns (%d)", line.length, columns.columnCount()));
                }
                if (line.length < columns.columnCount()) {
                    final int present = line.length;
                    line = Arrays.copyOf(line, columns.columnCount());
                    Arrays.fill(line, present, line.length, "");
                }
                final R result = createRecord(new DataLine(line, columns, this::formatException));
                if (result != null) {
                    return result;
                }
            }
        }
        return null;
    }

    /**
     * Transforms a data-line into a record.
     *
     * @param dataLine the source data-line.
     * @return {@code null} to skip the line.
     */
    protected abstract R createRecord(final DataLine dataLine);

    @Override
    public void close() throws IOException {
        csvReader.close();
    }

    @Override
    public Iterator<R> iterator() {
        return new Iterator<R>() {

            @Override
            public boolean hasNext() {
                fetchIfNeeded();
                return nextRecord != null;
            }

            @Override
            public R next() {
                fetchIfNeeded();
                if (nextRecord == null) {
                    throw new NoSuchElementException("there is no more record in the input");
                }
                nextRecordFetched = false;
                return nextRecord;
            }

            private void fetchIfNeeded() {
                if (!nextRecordFetched) {
                    try {
                        nextRecord = fetchNextRecord();
                    } catch (final IOException ex) {
                        throw new UncheckedIOException(ex);
                    }
                }
            }
        };
    }

    @Override
    public Spliterator<R> spliterator() {
        return Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL);
    }

    public Stream<R> stream() {
        return Utils.stream(this);
    }

    public List<R> toList() {
        return stream().collect(Collectors.toList());
    }
}
