package org.broadinstitute.replicon.tools.replicon;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.replicon.cmdline.CommandLineProgram;
import org.broadinstitute.replicon.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.replicon.cmdline.programgroups.RepliconResolutionProgramGroup;
import org.broadinstitute.replicon.tools.replicon.formats.*;
import org.broadinstitute.replicon.utils.config.ConfigFactory;
import org.broadinstitute.replicon.utils.config.ResolverConfig;

import java.io.File;
import java.util.List;
import java.util.Map;

/**
 * Attaches whole-replicon alignment statistics to published replicon calls, producing the input of
 * {@link GenerateChromosomeLists} in complete mode.
 *
 * <p>Calls and statistics are joined on assembly id and contig id; bracketed metadata in contig ids is ignored.
 * Calls without statistics are kept with blank statistic columns.</p>
 *
 * <h3>Usage example</h3>
 * <pre>
 * replicon-resolver JoinCallsWithAlignmentStats \
 *     --calls best_hits_1000bp.csv \
 *     --wp wp/tables/summary_best_hits.tsv \
 *     -O calls_with_wp_stats.tsv
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Joins replicon calls with whole-replicon alignment statistics on assembly and contig id.",
        oneLineSummary = "Join replicon calls with alignment statistics",
        programGroup = RepliconResolutionProgramGroup.class
)
public final class JoinCallsWithAlignmentStats extends CommandLineProgram {

    public static final String CALLS_LONG_NAME = "calls";
    public static final String WP_LONG_NAME = "wp";

    private final ResolverConfig config = ConfigFactory.getInstance().getResolverConfig();

    @Argument(fullName = CALLS_LONG_NAME, doc = "Published replicon calls.")
    private File callsFile;

    @Argument(fullName = WP_LONG_NAME, doc = "Whole-replicon best hits table with alignment statistics.")
    private File statsFile;

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Output joined table.")
    private File outputFile;

    @Argument(fullName = "calls-" + StandardArgumentDefinitions.ASSEMBLY_COLUMN_LONG_NAME, doc = "Assembly id column of the calls.", optional = true)
    private String callsAssemblyColumn = config.assemblyColumn();

    @Argument(fullName = "calls-" + StandardArgumentDefinitions.CONTIG_COLUMN_LONG_NAME, doc = "Contig id column of the calls.", optional = true)
    private String callsContigColumn = config.contigColumn();

    @Argument(fullName = "calls-" + StandardArgumentDefinitions.CALL_COLUMN_LONG_NAME, doc = "Call column of the calls.", optional = true)
    private String callsCallColumn = config.placementCallColumn();

    @Argument(fullName = "wp-" + StandardArgumentDefinitions.ASSEMBLY_COLUMN_LONG_NAME, doc = "Assembly id column of the statistics.", optional = true)
    private String statsAssemblyColumn = config.assemblyColumn();

    @Argument(fullName = "wp-" + StandardArgumentDefinitions.CONTIG_COLUMN_LONG_NAME, doc = "Contig id column of the statistics.", optional = true)
    private String statsContigColumn = config.contigColumn();

    @Override
    protected Object doWork() {
        final Map<FragmentKey, WholePlasmidStats> stats =
                WholePlasmidStatsReader.read(statsFile.toPath(), statsAssemblyColumn, statsContigColumn);
        logger.info(String.format("Loaded alignment statistics for %d contigs from %s", stats.size(), statsFile));

        final List<JoinedCall> joined = JoinedCallTable.join(callsFile.toPath(),
                new FragmentColumns(callsAssemblyColumn, callsContigColumn, callsCallColumn), stats);
        logger.info(String.format("Loaded %d calls from %s", joined.size(), callsFile));

        final long withStats = joined.stream().filter(c -> c.getStats().isPresent()).count();
        logger.info("Join results:");
        logger.info(String.format("  With alignment statistics:    %d", withStats));
        logger.info(String.format("  Without alignment statistics: %d", joined.size() - withStats));

        JoinedCallTable.write(outputFile.toPath(), joined);
        logger.info(String.format("Wrote %d rows to %s", joined.size(), outputFile));
        return "SUCCESS";
    }
}
