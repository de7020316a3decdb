package org.broadinstitute.replicon.tools.replicon.formats;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.replicon.exceptions.UserException;
import org.broadinstitute.replicon.utils.Utils;
import org.broadinstitute.replicon.utils.io.IOUtils;
import org.broadinstitute.replicon.utils.tsv.DataLine;
import org.broadinstitute.replicon.utils.tsv.TableColumnCollection;
import org.broadinstitute.replicon.utils.tsv.TableReader;
import org.broadinstitute.replicon.utils.tsv.TableUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads {@link FragmentRecord}s from a tab or comma separated table.
 * <p>
 * Values are trimmed. Rows with an empty assembly or contig id are skipped. An unparsable length reads as 0 and an
 * unparsable alignment value as unknown; such values are logged at debug level and counted, see
 * {@link #getInvalidNumericValues()}.
 * </p>
 */
public final class FragmentTableReader {

    private static final Logger logger = LogManager.getLogger(FragmentTableReader.class);

    private final FragmentColumns columns;

    private int skippedRows;
    private int invalidNumericValues;
    private int duplicateKeys;

    public FragmentTableReader(final FragmentColumns columns) {
        this.columns = Utils.nonNull(columns, "the columns cannot be null");
    }

    /**
     * @throws UserException.MissingColumn if a required column is absent.
     * @throws UserException.CouldNotReadInputFile if the file cannot be read.
     */
    public List<FragmentRecord> read(final Path path) {
        IOUtils.assertFileIsReadable(path);
        try (final TableReader<FragmentRecord> reader = TableUtils.reader(path,
                (tableColumns, formatExceptionFactory) -> {
                    tableColumns.requireAll(path.getFileName().toString(), columns.required());
                    return dataLine -> toRecord(dataLine, tableColumns);
                })) {
            return reader.toList();
        } catch (final IOException | UncheckedIOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
    }

    /**
     * Reads the table into a map by fragment key, in file order. A repeated key keeps its last row.
     */
    public Map<FragmentKey, FragmentRecord> readByKey(final Path path) {
        final Map<FragmentKey, FragmentRecord> byKey = new LinkedHashMap<>();
        for (final FragmentRecord record : read(path)) {
            if (byKey.put(record.getKey(), record) != null) {
                duplicateKeys++;
                logger.debug(String.format("Repeated fragment %s in %s, keeping the last row", record.getKey(), path));
            }
        }
        return byKey;
    }

    private FragmentRecord toRecord(final DataLine dataLine, final TableColumnCollection tableColumns) {
        final String assemblyId = dataLine.get(columns.getAssemblyColumn()).trim();
        final String contigId = dataLine.get(columns.getContigColumn()).trim();
        if (assemblyId.isEmpty() || contigId.isEmpty()) {
            skippedRows++;
            return null;
        }
        final String call = dataLine.get(columns.getCallColumn()).trim();
        final double length = parse(dataLine, tableColumns, FragmentColumns.CONTIG_LENGTH);
        final AlignmentStats stats = new AlignmentStats(
                parse(dataLine, tableColumns, FragmentColumns.REF_LENGTH),
                parse(dataLine, tableColumns, FragmentColumns.REF_COVERED_LENGTH),
                parse(dataLine, tableColumns, FragmentColumns.QUERY_COVERAGE_PERCENT),
                parse(dataLine, tableColumns, FragmentColumns.OVERALL_PERCENT_IDENTITY));
        return new FragmentRecord(new FragmentKey(assemblyId, contigId),
                Double.isNaN(length) || length < 0 ? 0 : (long) length, call, stats);
    }

    /**
     * @return {@link Double#NaN} if the column is absent, blank or unparsable.
     */
    private double parse(final DataLine dataLine, final TableColumnCollection tableColumns, final String column) {
        if (!tableColumns.contains(column)) {
            return Double.NaN;
        }
        final String value = dataLine.get(column).trim();
        if (value.isEmpty()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(value);
        } catch (final NumberFormatException ex) {
            invalidNumericValues++;
            logger.debug(String.format("Unparsable %s value '%s' treated as unknown", column, value));
            return Double.NaN;
        }
    }

    public FragmentColumns getColumns() {
        return columns;
    }

    /**
     * @return rows skipped for lack of an assembly or contig id.
     */
    public int getSkippedRows() {
        return skippedRows;
    }

    public int getInvalidNumericValues() {
        return invalidNumericValues;
    }

    public int getDuplicateKeys() {
        return duplicateKeys;
    }
}
