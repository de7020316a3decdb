package org.broadinstitute.replicon.tools.replicon;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.replicon.cmdline.CommandLineProgram;
import org.broadinstitute.replicon.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.replicon.cmdline.programgroups.RepliconResolutionProgramGroup;
import org.broadinstitute.replicon.exceptions.UserException;
import org.broadinstitute.replicon.tools.replicon.comparison.*;
import org.broadinstitute.replicon.tools.replicon.formats.*;
import org.broadinstitute.replicon.utils.config.ConfigFactory;
import org.broadinstitute.replicon.utils.config.ResolverConfig;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Compares the replicon calls of two classifier runs over the same assemblies and resolves one call per contig.
 *
 * <p>Every contig found in either table is categorized (exact match, annotation suffix, extra annotation, base
 * match, partial overlap, same family, different, or unclassified on one side) and given a resolved call.
 * Optionally, long contigs newly called chromosome are resolved automatically, and a manual override table takes
 * priority over everything but exact matches.</p>
 *
 * <h3>Inputs</h3>
 * <ul>
 *     <li>The old and new call tables (tab separated, or comma separated for .csv)</li>
 *     <li>Optionally, a manual override table with columns assembly_id, contig_id, resolved_call</li>
 *     <li>Optionally, the classifier all-hits directory, for the review report</li>
 * </ul>
 *
 * <h3>Outputs</h3>
 * <ul>
 *     <li>The comparison table: assembly_id, contig_id, contig_len, old_call, new_call, category, resolved_call</li>
 *     <li>Optionally, the resolved calls: assembly_id, contig_id, resolved_call</li>
 *     <li>Optionally, a review report listing all classifier hits of the contigs needing review</li>
 * </ul>
 *
 * <h3>Usage example</h3>
 * <pre>
 * replicon-resolver CompareRepliconCalls \
 *     --old calls_v10.tsv \
 *     --new calls_v11.tsv \
 *     -O comparison.tsv \
 *     --resolved resolved.tsv \
 *     --auto-chromosome-bp 100000 \
 *     --review review.txt \
 *     --all-hits-dir classifier_output
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Compares the replicon calls of two classifier runs, categorizes each difference and resolves one call per contig.",
        oneLineSummary = "Compare and resolve replicon calls of two classifier runs",
        programGroup = RepliconResolutionProgramGroup.class
)
public final class CompareRepliconCalls extends CommandLineProgram {

    public static final String OLD_LONG_NAME = "old";
    public static final String NEW_LONG_NAME = "new";
    public static final String RESOLVED_LONG_NAME = "resolved";
    public static final String REVIEW_LONG_NAME = "review";
    public static final String ALL_HITS_DIR_LONG_NAME = "all-hits-dir";
    public static final String MIN_REVIEW_BP_LONG_NAME = "min-review-bp";
    public static final String OVERRIDES_LONG_NAME = "overrides";
    public static final String AUTO_CHROMOSOME_BP_LONG_NAME = "auto-chromosome-bp";
    public static final String REVIEW_MAX_LISTED_LONG_NAME = "review-max-listed";

    private final ResolverConfig config = ConfigFactory.getInstance().getResolverConfig();

    @Argument(fullName = OLD_LONG_NAME, doc = "Call table of the old classifier run.")
    private File oldCallsFile;

    @Argument(fullName = NEW_LONG_NAME, doc = "Call table of the new classifier run.")
    private File newCallsFile;

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Output comparison table.")
    private File outputFile;

    @Argument(fullName = RESOLVED_LONG_NAME, doc = "Output table of resolved calls.", optional = true)
    private File resolvedFile = null;

    @Argument(fullName = REVIEW_LONG_NAME,
            doc = "Output review report with all classifier hits of the contigs needing review. Requires --" + ALL_HITS_DIR_LONG_NAME + ".",
            optional = true)
    private File reviewFile = null;

    @Argument(fullName = ALL_HITS_DIR_LONG_NAME,
            doc = "Classifier output directory holding <database>/tables/<assembly>_all.tsv tables.",
            optional = true)
    private File allHitsDir = null;

    @Argument(fullName = MIN_REVIEW_BP_LONG_NAME,
            doc = "Only contigs at least this long are included in the review report.",
            minValue = 0, optional = true)
    private long minReviewBp = 0;

    @Argument(fullName = OVERRIDES_LONG_NAME,
            doc = "Manual override table with columns assembly_id, contig_id, resolved_call.",
            optional = true)
    private File overridesFile = null;

    @Argument(fullName = AUTO_CHROMOSOME_BP_LONG_NAME,
            doc = "Resolve 'different' contigs of at least this length newly called chromosome, and shorter contigs " +
                    "no longer called chromosome, to the new call. 0 disables it.",
            minValue = 0, optional = true)
    private long autoChromosomeBp = config.autoChromosomeBp();

    @Argument(fullName = REVIEW_MAX_LISTED_LONG_NAME,
            doc = "Maximum number of contigs needing review listed in the log.",
            minValue = 0, optional = true)
    private int reviewMaxListed = config.reviewMaxListed();

    @Argument(fullName = StandardArgumentDefinitions.THREADS_LONG_NAME,
            doc = "Number of threads used to process assemblies.",
            minValue = 1, optional = true)
    private int threads = config.threads();

    @Argument(fullName = "old-" + StandardArgumentDefinitions.ASSEMBLY_COLUMN_LONG_NAME, doc = "Assembly id column of the old table.", optional = true)
    private String oldAssemblyColumn = config.assemblyColumn();

    @Argument(fullName = "old-" + StandardArgumentDefinitions.CONTIG_COLUMN_LONG_NAME, doc = "Contig id column of the old table.", optional = true)
    private String oldContigColumn = config.contigColumn();

    @Argument(fullName = "old-" + StandardArgumentDefinitions.CALL_COLUMN_LONG_NAME, doc = "Call column of the old table.", optional = true)
    private String oldCallColumn = config.comparisonCallColumn();

    @Argument(fullName = "new-" + StandardArgumentDefinitions.ASSEMBLY_COLUMN_LONG_NAME, doc = "Assembly id column of the new table.", optional = true)
    private String newAssemblyColumn = config.assemblyColumn();

    @Argument(fullName = "new-" + StandardArgumentDefinitions.CONTIG_COLUMN_LONG_NAME, doc = "Contig id column of the new table.", optional = true)
    private String newContigColumn = config.contigColumn();

    @Argument(fullName = "new-" + StandardArgumentDefinitions.CALL_COLUMN_LONG_NAME, doc = "Call column of the new table.", optional = true)
    private String newCallColumn = config.comparisonCallColumn();

    @Override
    protected String[] customCommandLineValidation() {
        final List<String> errors = new ArrayList<>();
        if (reviewFile != null && allHitsDir == null) {
            errors.add("--" + REVIEW_LONG_NAME + " requires --" + ALL_HITS_DIR_LONG_NAME);
        }
        return errors.isEmpty() ? null : errors.toArray(new String[0]);
    }

    @Override
    protected Object doWork() {
        final Map<FragmentKey, FragmentRecord> oldRecords =
                readCalls(new FragmentColumns(oldAssemblyColumn, oldContigColumn, oldCallColumn), oldCallsFile, "old");
        final Map<FragmentKey, FragmentRecord> newRecords =
                readCalls(new FragmentColumns(newAssemblyColumn, newContigColumn, newCallColumn), newCallsFile, "new");

        ManualOverrides overrides = ManualOverrides.NONE;
        if (overridesFile != null) {
            overrides = OverrideTableReader.read(overridesFile.toPath());
            logger.info(String.format("Loaded %d manual overrides from %s", overrides.size(), overridesFile));
        }

        final ComparisonSettings settings = new ComparisonSettings(autoChromosomeBp);
        final ResolutionOrchestrator orchestrator =
                new ResolutionOrchestrator(new CallComparator(), settings, overrides, threads);
        final ResolutionOutcome outcome = orchestrator.resolve(oldRecords, newRecords);

        writeComparison(outcome.getResults());
        if (resolvedFile != null) {
            writeResolved(outcome.getResults());
        }
        logSummary(outcome, settings, overrides);
        final List<ComparisonResult> needsReview = outcome.getResultsNeedingReview();
        logNeedsReview(needsReview);
        if (reviewFile != null) {
            writeReview(needsReview);
        }
        if (!outcome.getFailedAssemblies().isEmpty()) {
            logger.warn(String.format("%d assemblies could not be compared: %s",
                    outcome.getFailedAssemblies().size(), String.join(", ", outcome.getFailedAssemblies())));
        }
        return "SUCCESS";
    }

    private Map<FragmentKey, FragmentRecord> readCalls(final FragmentColumns columns, final File file, final String side) {
        final FragmentTableReader reader = new FragmentTableReader(columns);
        final Map<FragmentKey, FragmentRecord> records = reader.readByKey(file.toPath());
        logger.info(String.format("Loaded %d %s calls from %s (%s)", records.size(), side, file, columns));
        if (reader.getSkippedRows() > 0) {
            logger.warn(String.format("Skipped %d rows without assembly or contig id in %s", reader.getSkippedRows(), file));
        }
        if (reader.getDuplicateKeys() > 0) {
            logger.warn(String.format("%d repeated contigs in %s; the last row of each was kept", reader.getDuplicateKeys(), file));
        }
        if (reader.getInvalidNumericValues() > 0) {
            logger.warn(String.format("%d unparsable numeric values in %s were treated as unknown", reader.getInvalidNumericValues(), file));
        }
        return records;
    }

    private void writeComparison(final List<ComparisonResult> results) {
        try (final ComparisonTableWriter writer = new ComparisonTableWriter(outputFile.toPath())) {
            writer.writeAllRecords(results);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(outputFile, e);
        }
        logger.info(String.format("Wrote %d rows to %s", results.size(), outputFile));
    }

    private void writeResolved(final List<ComparisonResult> results) {
        try (final ResolvedCallWriter writer = new ResolvedCallWriter(resolvedFile.toPath())) {
            writer.writeAllRecords(results);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(resolvedFile, e);
        }
        logger.info(String.format("Wrote %d resolved calls to %s", results.size(), resolvedFile));
    }

    private void logSummary(final ResolutionOutcome outcome, final ComparisonSettings settings,
                            final ManualOverrides overrides) {
        final CategoryCounts counts = outcome.getCounts();
        logger.info("Category summary:");
        for (final ComparisonCategory category : ComparisonCategory.values()) {
            final long count = counts.get(category);
            if (count > 0) {
                logger.info(String.format("  %-25s %6d", category.getLabel(), count));
            }
        }
        logger.info(String.format("  %-25s %6d", "TOTAL", counts.total()));
        if (settings.isAutoChromosomeEnabled()) {
            logger.info(String.format("Auto-resolved %d contigs as chromosome (>=%dbp)",
                    counts.get(ComparisonCategory.AUTO_CHROMOSOME), settings.getAutoChromosomeBp()));
        }
        if (!overrides.isEmpty()) {
            logger.info(String.format("Applied %d manual overrides", counts.get(ComparisonCategory.MANUAL_OVERRIDE)));
        }
    }

    private void logNeedsReview(final List<ComparisonResult> needsReview) {
        if (needsReview.isEmpty()) {
            return;
        }
        logger.info(String.format("%d contigs need review (different, partial_overlap, new_unclassified):", needsReview.size()));
        needsReview.stream().limit(reviewMaxListed).forEach(r -> logger.info("  " + r.toReviewString()));
        if (needsReview.size() > reviewMaxListed) {
            logger.info(String.format("  ... and %d more", needsReview.size() - reviewMaxListed));
        }
    }

    private void writeReview(final List<ComparisonResult> needsReview) {
        List<ComparisonResult> flagged = needsReview;
        if (minReviewBp > 0) {
            flagged = needsReview.stream()
                    .filter(r -> r.getContigLength() >= minReviewBp)
                    .collect(Collectors.toList());
            logger.info(String.format("Review filter: %d contigs below %dbp skipped", needsReview.size() - flagged.size(), minReviewBp));
        }
        final ClassifierHitsIndex hitsIndex = ClassifierHitsIndex.discover(allHitsDir.toPath());
        if (hitsIndex.isEmpty()) {
            logger.warn(String.format("No database tables found in %s; no review report written", allHitsDir));
            return;
        }
        new ReviewReportWriter(hitsIndex).write(reviewFile.toPath(), flagged);
        logger.info(String.format("Wrote review of %d contigs across %d databases to %s",
                flagged.size(), hitsIndex.getDatabases().size(), reviewFile));
    }
}
