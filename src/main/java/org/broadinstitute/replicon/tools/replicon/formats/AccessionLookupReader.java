package org.broadinstitute.replicon.tools.replicon.formats;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.replicon.exceptions.UserException;
import org.broadinstitute.replicon.utils.io.IOUtils;
import org.broadinstitute.replicon.utils.tsv.TableReader;
import org.broadinstitute.replicon.utils.tsv.TableUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a classifier best-hits table into a map from lower-case sequence accession to replicon name.
 * <p>
 * The accession is taken from the {@code contig_id} column, e.g. {@code cp019844.1} from
 * {@code "NZ_CP019844.1 Borreliella burgdorferi strain PAli chromosome"}; the replicon is the lower-cased
 * {@code plasmid_name}. The first row of an accession wins. A table without these columns gives an empty map.
 * </p>
 */
public final class AccessionLookupReader {

    private static final Logger logger = LogManager.getLogger(AccessionLookupReader.class);

    public static final String PLASMID_NAME = "plasmid_name";

    static final Pattern ACCESSION = Pattern.compile("([A-Z]{2}_)?([A-Z]{2}\\d+\\.\\d+)");

    private AccessionLookupReader() {}

    public static Map<String, String> read(final Path path) {
        IOUtils.assertFileIsReadable(path);
        final Map<String, String> lookup = new LinkedHashMap<>();
        try (final TableReader<String[]> reader = TableUtils.reader(path,
                (columns, formatExceptionFactory) -> {
                    if (!columns.containsAll(FragmentColumns.CONTIG_ID, PLASMID_NAME)) {
                        logger.warn(String.format("%s lacks the columns %s and %s; no accession will be resolved",
                                path, FragmentColumns.CONTIG_ID, PLASMID_NAME));
                        return dataLine -> null;
                    }
                    return dataLine -> new String[]{dataLine.get(FragmentColumns.CONTIG_ID), dataLine.get(PLASMID_NAME)};
                })) {
            for (final String[] row : reader) {
                final String contigId = row[0].trim();
                final String plasmidName = row[1].trim();
                if (contigId.isEmpty() || plasmidName.isEmpty()) {
                    continue;
                }
                final Matcher matcher = ACCESSION.matcher(contigId);
                if (matcher.find()) {
                    lookup.putIfAbsent(matcher.group(2).toLowerCase(Locale.ROOT), plasmidName.toLowerCase(Locale.ROOT));
                }
            }
        } catch (final IOException | UncheckedIOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
        return Collections.unmodifiableMap(lookup);
    }
}
