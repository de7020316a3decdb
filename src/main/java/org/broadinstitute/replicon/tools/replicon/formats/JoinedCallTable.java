package org.broadinstitute.replicon.tools.replicon.formats;

import org.broadinstitute.replicon.exceptions.UserException;
import org.broadinstitute.replicon.utils.Utils;
import org.broadinstitute.replicon.utils.io.IOUtils;
import org.broadinstitute.replicon.utils.tsv.DataLine;
import org.broadinstitute.replicon.utils.tsv.TableColumnCollection;
import org.broadinstitute.replicon.utils.tsv.TableReader;
import org.broadinstitute.replicon.utils.tsv.TableUtils;
import org.broadinstitute.replicon.utils.tsv.TableWriter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Left join of a call table with whole-plasmid alignment statistics, on assembly id and contig id without its
 * bracketed metadata. The output carries the columns read by the complete placement mode.
 */
public final class JoinedCallTable {

    public static final String WP_PLASMID_NAME = "wp_plasmid_name";

    public static final TableColumnCollection COLUMNS = new TableColumnCollection(
            FragmentColumns.ASSEMBLY_ID, FragmentColumns.CONTIG_ID, FragmentColumns.CONTIG_LENGTH,
            AccessionLookupReader.PLASMID_NAME, WP_PLASMID_NAME,
            FragmentColumns.REF_LENGTH, FragmentColumns.REF_COVERED_LENGTH,
            FragmentColumns.QUERY_COVERAGE_PERCENT, FragmentColumns.OVERALL_PERCENT_IDENTITY);

    private JoinedCallTable() {}

    /**
     * Reads the calls and attaches their statistics; the {@code contig_len} column is copied when present.
     */
    public static List<JoinedCall> join(final Path callsPath, final FragmentColumns columns,
                                        final Map<FragmentKey, WholePlasmidStats> stats) {
        Utils.nonNull(columns, "the columns cannot be null");
        Utils.nonNull(stats, "the stats cannot be null");
        IOUtils.assertFileIsReadable(callsPath);
        try (final TableReader<JoinedCall> reader = TableUtils.reader(callsPath,
                (tableColumns, formatExceptionFactory) -> {
                    tableColumns.requireAll(callsPath.getFileName().toString(), columns.required());
                    return dataLine -> toJoinedCall(dataLine, columns, stats);
                })) {
            return reader.toList();
        } catch (final IOException | UncheckedIOException e) {
            throw new UserException.CouldNotReadInputFile(callsPath, e);
        }
    }

    private static JoinedCall toJoinedCall(final DataLine dataLine, final FragmentColumns columns,
                                           final Map<FragmentKey, WholePlasmidStats> stats) {
        final String assemblyId = dataLine.get(columns.getAssemblyColumn());
        final String contigId = dataLine.get(columns.getContigColumn());
        return new JoinedCall(assemblyId, contigId, dataLine.get(FragmentColumns.CONTIG_LENGTH, ""),
                dataLine.get(columns.getCallColumn()),
                stats.get(WholePlasmidStatsReader.joinKey(assemblyId, contigId)));
    }

    public static void write(final Path output, final List<JoinedCall> calls) {
        Utils.nonNull(calls, "the calls cannot be null");
        try (final TableWriter<JoinedCall> writer = TableUtils.writer(output, COLUMNS, (call, dataLine) -> {
            dataLine.append(call.getAssemblyId(), call.getContigId(), call.getContigLength(), call.getCall());
            if (call.getStats().isPresent()) {
                final WholePlasmidStats s = call.getStats().get();
                dataLine.append(s.getPlasmidName(), s.getRefLength(), s.getRefCoveredLength(),
                        s.getQueryCoveragePercent(), s.getIdentityPercent());
            } else {
                dataLine.append("", "", "", "", "");
            }
        })) {
            writer.writeAllRecords(calls);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(output.toFile(), e);
        }
    }
}
