package org.broadinstitute.replicon.tools.replicon;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.replicon.cmdline.CommandLineProgram;
import org.broadinstitute.replicon.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.replicon.cmdline.programgroups.RepliconResolutionProgramGroup;
import org.broadinstitute.replicon.tools.replicon.formats.FragmentColumns;
import org.broadinstitute.replicon.tools.replicon.formats.FragmentRecord;
import org.broadinstitute.replicon.tools.replicon.formats.FragmentTableReader;
import org.broadinstitute.replicon.tools.replicon.formats.PlacementListWriter;
import org.broadinstitute.replicon.tools.replicon.placement.*;
import org.broadinstitute.replicon.utils.Utils;
import org.broadinstitute.replicon.utils.config.ConfigFactory;
import org.broadinstitute.replicon.utils.config.ResolverConfig;
import org.broadinstitute.replicon.utils.io.IOUtils;

import java.io.File;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the chromosome list and unlocalised list files of a genome submission from resolved replicon calls.
 *
 * <p>In {@code CLASSIFIED} mode every classified fragment is placed: the longest fragment of each replicon goes to
 * the chromosome list and its shorter siblings to the unlocalised list. In {@code COMPLETE} mode only fragments
 * whose alignment to the reference replicon passes the coverage and identity thresholds are placed.</p>
 *
 * <p>Assemblies without any placed fragment get no files and stay at contig level.</p>
 *
 * <h3>Usage example</h3>
 * <pre>
 * replicon-resolver GenerateChromosomeLists \
 *     -I calls_with_wp_stats.tsv \
 *     --output-dir chromosome_lists \
 *     --mode COMPLETE \
 *     --ref-cov 0.95
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Writes per-assembly chromosome list and unlocalised list files from replicon calls and alignment statistics.",
        oneLineSummary = "Generate chromosome and unlocalised lists from replicon calls",
        programGroup = RepliconResolutionProgramGroup.class
)
public final class GenerateChromosomeLists extends CommandLineProgram {

    public static final String OUTPUT_DIR_LONG_NAME = "output-dir";
    public static final String MODE_LONG_NAME = "mode";
    public static final String REF_COVERAGE_LONG_NAME = "ref-cov";
    public static final String QUERY_COVERAGE_LONG_NAME = "query-cov";
    public static final String IDENTITY_LONG_NAME = "identity";
    public static final String DRY_RUN_LONG_NAME = "dry-run";

    private final ResolverConfig config = ConfigFactory.getInstance().getResolverConfig();

    @Argument(fullName = StandardArgumentDefinitions.INPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME,
            doc = "Replicon calls, with alignment statistics for the complete mode.")
    private File inputFile;

    @Argument(fullName = OUTPUT_DIR_LONG_NAME, doc = "Directory the list files are written to.")
    private File outputDir;

    @Argument(fullName = MODE_LONG_NAME, doc = "Placement mode.", optional = true)
    private PlacementMode mode = PlacementMode.COMPLETE;

    @Argument(fullName = REF_COVERAGE_LONG_NAME, doc = "Minimum reference coverage fraction (complete mode only).",
            minValue = 0.0, maxValue = 1.0, optional = true)
    private double referenceCoverage = config.placementRefCoverage();

    @Argument(fullName = QUERY_COVERAGE_LONG_NAME, doc = "Minimum query coverage fraction (complete mode only).",
            minValue = 0.0, maxValue = 1.0, optional = true)
    private double queryCoverage = config.placementQueryCoverage();

    @Argument(fullName = IDENTITY_LONG_NAME, doc = "Minimum identity fraction (complete mode only).",
            minValue = 0.0, maxValue = 1.0, optional = true)
    private double identity = config.placementIdentity();

    @Argument(fullName = StandardArgumentDefinitions.ASSEMBLY_COLUMN_LONG_NAME, doc = "Assembly id column.", optional = true)
    private String assemblyColumn = config.assemblyColumn();

    @Argument(fullName = StandardArgumentDefinitions.CONTIG_COLUMN_LONG_NAME, doc = "Contig id column.", optional = true)
    private String contigColumn = config.contigColumn();

    @Argument(fullName = StandardArgumentDefinitions.CALL_COLUMN_LONG_NAME, doc = "Replicon call column.", optional = true)
    private String callColumn = config.placementCallColumn();

    @Argument(fullName = DRY_RUN_LONG_NAME, doc = "Log the entries that would be written without writing any file.", optional = true)
    private boolean dryRun = false;

    @Argument(fullName = StandardArgumentDefinitions.THREADS_LONG_NAME,
            doc = "Number of threads used to process assemblies.",
            minValue = 1, optional = true)
    private int threads = config.threads();

    @Override
    protected Object doWork() {
        final FragmentTableReader reader = new FragmentTableReader(new FragmentColumns(assemblyColumn, contigColumn, callColumn));
        final List<FragmentRecord> records = reader.read(inputFile.toPath());
        logger.info(String.format("Loaded %d rows from %s", records.size(), inputFile));
        if (reader.getSkippedRows() > 0) {
            logger.warn(String.format("Skipped %d rows without assembly or contig id", reader.getSkippedRows()));
        }
        if (reader.getInvalidNumericValues() > 0) {
            logger.warn(String.format("%d unparsable numeric values were treated as unknown", reader.getInvalidNumericValues()));
        }

        final PlacementThresholds thresholds = new PlacementThresholds(referenceCoverage, queryCoverage, identity);
        logger.info("Mode: " + mode);
        if (mode == PlacementMode.COMPLETE) {
            logger.info("Thresholds: " + thresholds);
        }

        final PlacementOutcome outcome = new RepliconPlacementSelector(mode, thresholds).placeAll(records, threads);
        logger.info(String.format("Found %d assemblies", outcome.getPlacements().size() + outcome.getFailedAssemblies().size()));

        final Path outputPath = outputDir.toPath();
        if (!dryRun) {
            IOUtils.createDirectories(outputPath);
        }
        int chromosomeListFiles = 0;
        int unlocalisedListFiles = 0;
        for (final AssemblyPlacement placement : outcome.getPlacements()) {
            if (!placement.hasPlacements()) {
                continue;
            }
            final String counts = String.format("%s: %d placed, %d unlocalised", placement.getAssemblyId(),
                    placement.getChromosomeEntries().size(), placement.getUnlocalisedEntries().size());
            if (dryRun) {
                logger.info("[DRY RUN] " + counts);
                placement.getChromosomeEntries().forEach(e -> logger.info(String.format("  [CHROM] %s\t%s\t%s",
                        e.getObjectName(), e.getChromosomeName(), e.getChromosomeType())));
                placement.getUnlocalisedEntries().forEach(e -> logger.info(String.format("  [UNLOC] %s\t%s",
                        e.getObjectName(), e.getChromosomeName())));
                continue;
            }
            final List<Path> written = PlacementListWriter.write(outputPath, placement);
            chromosomeListFiles++;
            unlocalisedListFiles += written.size() - 1;
            logger.info("[OK] " + counts);
        }

        logger.info(Utils.dupChar('=', 60));
        logger.info(String.format("Generated %d chromosome list files", chromosomeListFiles));
        logger.info(String.format("Generated %d unlocalised list files", unlocalisedListFiles));
        logger.info(String.format("Placed replicons (chromosome list): %d", outcome.totalPlaced()));
        logger.info(String.format("Unlocalised fragments: %d", outcome.totalUnlocalised()));
        logger.info(String.format("Unplaced/unclassified: %d", outcome.totalUnplaced()));
        final List<String> withoutEntries = outcome.getAssembliesWithoutEntries();
        if (!withoutEntries.isEmpty()) {
            logger.info(String.format("%d assemblies with no entries (will remain contig-level):", withoutEntries.size()));
            withoutEntries.forEach(a -> logger.info("  " + a));
        }
        if (!outcome.getFailedAssemblies().isEmpty()) {
            logger.warn(String.format("%d assemblies could not be placed: %s",
                    outcome.getFailedAssemblies().size(), String.join(", ", outcome.getFailedAssemblies())));
        }
        return "SUCCESS";
    }
}
