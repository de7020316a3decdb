package org.broadinstitute.replicon.tools.replicon.formats;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.Table;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.replicon.exceptions.UserException;
import org.broadinstitute.replicon.utils.Utils;
import org.broadinstitute.replicon.utils.io.IOUtils;
import org.broadinstitute.replicon.utils.tsv.DataLine;
import org.broadinstitute.replicon.utils.tsv.TableReader;
import org.broadinstitute.replicon.utils.tsv.TableReaderOptions;
import org.broadinstitute.replicon.utils.tsv.TableUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Builds a {@link ScaffoldRepliconLookup} from a pangenome gene data table with columns {@code scaffold_name} and
 * {@code clustering_id} ({@code isolate_scaffold_gene}).
 * <p>
 * The separator is a tab if the header line contains one and a comma otherwise; if the required columns are not
 * found the other separator is tried. The first gene seen on a scaffold names its replicon.
 * </p>
 */
public final class GeneDataTableReader {

    private static final Logger logger = LogManager.getLogger(GeneDataTableReader.class);

    public static final String SCAFFOLD_NAME = "scaffold_name";
    public static final String CLUSTERING_ID = "clustering_id";

    private final Map<String, String> accessionLookup;

    private int rowsParsed;
    private int rowsSkipped;
    private int accessionResolved;

    /**
     * @param accessionLookup lower-case accession to replicon name, possibly empty.
     */
    public GeneDataTableReader(final Map<String, String> accessionLookup) {
        this.accessionLookup = Utils.nonNull(accessionLookup, "the accession lookup cannot be null");
    }

    public ScaffoldRepliconLookup read(final Path path) {
        IOUtils.assertFileIsReadable(path);
        final char separator = headerSeparator(path);
        try {
            return read(path, separator);
        } catch (final UserException.MissingColumn ex) {
            final char alternative = separator == TableUtils.COLUMN_SEPARATOR ? TableUtils.CSV_COLUMN_SEPARATOR : TableUtils.COLUMN_SEPARATOR;
            logger.debug("Required gene data columns not found with the detected separator, trying the other one");
            return read(path, alternative);
        }
    }

    private ScaffoldRepliconLookup read(final Path path, final char separator) {
        rowsParsed = 0;
        rowsSkipped = 0;
        accessionResolved = 0;
        final Table<String, String, String> replicons = HashBasedTable.create();
        try (final Reader source = IOUtils.makeReaderMaybeGzipped(path);
             final TableReader<DataLine> reader = TableUtils.reader(path.toString(), source,
                new TableReaderOptions(separator, true),
                (columns, formatExceptionFactory) -> {
                    columns.requireAll(path.getFileName().toString(), SCAFFOLD_NAME, CLUSTERING_ID);
                    return dataLine -> dataLine;
                })) {
            for (final DataLine dataLine : reader) {
                rowsParsed++;
                final String scaffold = dataLine.get(SCAFFOLD_NAME).trim();
                final String clusteringId = dataLine.get(CLUSTERING_ID).trim();
                if (scaffold.isEmpty() || clusteringId.isEmpty()) {
                    rowsSkipped++;
                    continue;
                }
                final String[] parts = clusteringId.split("_", -1);
                if (parts.length < 3 || replicons.contains(parts[0], parts[1])) {
                    continue;
                }
                final String replicon = ScaffoldRepliconLookup.parseRepliconFromScaffold(scaffold, accessionLookup);
                replicons.put(parts[0], parts[1], replicon);
                if (ScaffoldRepliconLookup.hasAccessionReplicon(scaffold)) {
                    accessionResolved++;
                }
                logger.debug(String.format("Scaffold mapping: (%s, %s) %s -> %s", parts[0], parts[1], scaffold, replicon));
            }
        } catch (final IOException | UncheckedIOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
        return new ScaffoldRepliconLookup(replicons);
    }

    private static char headerSeparator(final Path path) {
        try (final BufferedReader reader = new BufferedReader(IOUtils.makeReaderMaybeGzipped(path))) {
            final String header = reader.readLine();
            return header != null && header.indexOf(TableUtils.COLUMN_SEPARATOR) >= 0
                    ? TableUtils.COLUMN_SEPARATOR : TableUtils.CSV_COLUMN_SEPARATOR;
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
    }

    public int getRowsParsed() {
        return rowsParsed;
    }

    /**
     * @return rows without a scaffold name or clustering id.
     */
    public int getRowsSkipped() {
        return rowsSkipped;
    }

    /**
     * @return scaffolds whose replicon part looked like an accession.
     */
    public int getAccessionResolved() {
        return accessionResolved;
    }
}
