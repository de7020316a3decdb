package org.broadinstitute.replicon.tools.replicon.formats;

import org.broadinstitute.replicon.exceptions.UserException;
import org.broadinstitute.replicon.utils.Utils;
import org.broadinstitute.replicon.utils.io.IOUtils;
import org.broadinstitute.replicon.utils.tsv.TableReader;
import org.broadinstitute.replicon.utils.tsv.TableUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.AbstractMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads a whole-plasmid best-hits table, keyed by assembly and contig id without its bracketed metadata.
 * The first row of a fragment wins.
 */
public final class WholePlasmidStatsReader {

    public static final String PLASMID_NAME = "plasmid_name_wp";
    public static final String REF_LENGTH = "ref_length_wp";
    public static final String REF_COVERED_LENGTH = "ref_covered_length_wp";
    public static final String QUERY_COVERAGE_PERCENT = "query_coverage_percent_wp";
    public static final String OVERALL_PERCENT_IDENTITY = "overall_percent_identity_wp";

    private static final Pattern BRACKET_METADATA = Pattern.compile("\\s*\\[.*?]");

    private WholePlasmidStatsReader() {}

    /**
     * Removes bracketed metadata from a contig id: {@code "contig_1 [topology=linear]"} gives {@code contig_1}.
     */
    public static String joinContigId(final String contigId) {
        return BRACKET_METADATA.matcher(Utils.nonNull(contigId)).replaceAll("").trim();
    }

    public static FragmentKey joinKey(final String assemblyId, final String contigId) {
        return new FragmentKey(Utils.nonNull(assemblyId).trim(), joinContigId(contigId));
    }

    public static Map<FragmentKey, WholePlasmidStats> read(final Path path, final String assemblyColumn,
                                                           final String contigColumn) {
        IOUtils.assertFileIsReadable(path);
        final Map<FragmentKey, WholePlasmidStats> stats = new LinkedHashMap<>();
        try (final TableReader<Map.Entry<FragmentKey, WholePlasmidStats>> reader = TableUtils.reader(path,
                (columns, formatExceptionFactory) -> {
                    columns.requireAll(path.getFileName().toString(), assemblyColumn, contigColumn, PLASMID_NAME,
                            REF_LENGTH, REF_COVERED_LENGTH, QUERY_COVERAGE_PERCENT, OVERALL_PERCENT_IDENTITY);
                    return dataLine -> new AbstractMap.SimpleImmutableEntry<>(
                            joinKey(dataLine.get(assemblyColumn), dataLine.get(contigColumn)),
                            new WholePlasmidStats(dataLine.get(PLASMID_NAME).trim(),
                                    dataLine.get(REF_LENGTH).trim(),
                                    dataLine.get(REF_COVERED_LENGTH).trim(),
                                    dataLine.get(QUERY_COVERAGE_PERCENT).trim(),
                                    dataLine.get(OVERALL_PERCENT_IDENTITY).trim()));
                })) {
            reader.stream().forEach(e -> stats.putIfAbsent(e.getKey(), e.getValue()));
        } catch (final IOException | UncheckedIOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
        return stats;
    }
}
