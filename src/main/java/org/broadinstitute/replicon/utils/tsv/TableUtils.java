package org.broadinstitute.replicon.utils.tsv;

import org.broadinstitute.replicon.utils.Utils;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Common constants and factory methods for table readers and writers.
 */
public final class TableUtils {

    public static final char COLUMN_SEPARATOR = '\t';

    public static final char CSV_COLUMN_SEPARATOR = ',';

    public static final String COMMENT_PREFIX = "#";

    public static final char QUOTE_CHARACTER = '\"';

    public static final char ESCAPE_CHARACTER = '\\';

    /**
     * Returns the column separator for a table file: comma for {@code .csv} and {@code .csv.gz}, tab otherwise.
     */
    public static char separatorFor(final Path path) {
        final Path fileName = Utils.nonNull(path, "the path cannot be null").getFileName();
        final String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".csv") || name.endsWith(".csv.gz") ? CSV_COLUMN_SEPARATOR : COLUMN_SEPARATOR;
    }

    /**
     * Creates a new table reader given a record extractor factory based on the columns found in the input.
     * <p>
     * The extractor factory is called once the header has been read; it may throw to reject the header.
     * </p>
     */
    public static <R> TableReader<R> reader(final Path path,
                                            final BiFunction<TableColumnCollection, Function<String, RuntimeException>, Function<DataLine, R>> recordExtractorFactory)
            throws IOException {
        Utils.nonNull(recordExtractorFactory, "the record extractor factory cannot be null");
        return new TableReader<R>(path) {
            private Function<DataLine, R> recordExtractor;

            @Override
            protected void processColumns(final TableColumnCollection columns) {
                recordExtractor = recordExtractorFactory.apply(columns, this::formatException);
                if (recordExtractor == null) {
                    throw new IllegalStateException("the record extractor function cannot be null");
                }
            }

            @Override
            protected R createRecord(final DataLine dataLine) {
                return recordExtractor.apply(dataLine);
            }
        };
    }

    /**
     * Creates a new table reader on a {@link Reader}.
     */
    public static <R> TableReader<R> reader(final String sourceName,
                                            final Reader reader,
                                            final TableReaderOptions options,
                                            final BiFunction<TableColumnCollection, Function<String, RuntimeException>, Function<DataLine, R>> recordExtractorFactory)
            throws IOException {
        Utils.nonNull(recordExtractorFactory, "the record extractor factory cannot be null");
        return new TableReader<R>(sourceName, reader, options) {
            private Function<DataLine, R> recordExtractor;

            @Override
            protected void processColumns(final TableColumnCollection columns) {
                recordExtractor = recordExtractorFactory.apply(columns, this::formatException);
                if (recordExtractor == null) {
                    throw new IllegalStateException("the record extractor function cannot be null");
                }
            }

            @Override
            protected R createRecord(final DataLine dataLine) {
                return recordExtractor.apply(dataLine);
            }
        };
    }

    /**
     * Creates a new table writer on a file given the data-line composer.
     */
    public static <R> TableWriter<R> writer(final Path path, final TableColumnCollection columns,
                                            final BiConsumer<R, DataLine> dataLineComposer) throws IOException {
        Utils.nonNull(dataLineComposer, "the data-line composer cannot be null");
        return new TableWriter<R>(path, columns) {
            @Override
            protected void composeLine(final R record, final DataLine dataLine) {
                dataLineComposer.accept(record, dataLine);
            }
        };
    }

    /**
     * Creates a new table writer on a {@link Writer} given the data-line composer.
     */
    public static <R> TableWriter<R> writer(final Writer writer, final TableColumnCollection columns,
                                            final char columnSeparator, final boolean writeHeader,
                                            final BiConsumer<R, DataLine> dataLineComposer) {
        Utils.nonNull(dataLineComposer, "the data-line composer cannot be null");
        return new TableWriter<R>(writer, columns, columnSeparator, writeHeader) {
            @Override
            protected void composeLine(final R record, final DataLine dataLine) {
                dataLineComposer.accept(record, dataLine);
            }
        };
    }

    private TableUtils() {
        throw new UnsupportedOperationException();
    }
}
