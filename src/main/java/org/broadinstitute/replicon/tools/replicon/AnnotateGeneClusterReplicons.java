package org.broadinstitute.replicon.tools.replicon;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.replicon.cmdline.CommandLineProgram;
import org.broadinstitute.replicon.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.replicon.cmdline.programgroups.PangenomeProgramGroup;
import org.broadinstitute.replicon.exceptions.UserException;
import org.broadinstitute.replicon.tools.replicon.consensus.*;
import org.broadinstitute.replicon.tools.replicon.formats.*;
import org.broadinstitute.replicon.utils.config.ConfigFactory;
import org.broadinstitute.replicon.utils.config.ResolverConfig;

import java.io.File;
import java.io.IOException;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Assigns a consensus replicon to every gene cluster of a pangenome.
 *
 * <p>Each member gene of a cluster is traced back to the scaffold it was annotated on, and so to the replicon that
 * scaffold was called as. A cluster gets the replicon carried by at least {@code --threshold} of its members, or
 * {@code multi-replicon} otherwise. Calls are also grouped into replicon families to score how far a cluster
 * spreads across unrelated replicons.</p>
 *
 * <h3>Inputs</h3>
 * <ul>
 *     <li>Gene data table with scaffold_name and clustering_id columns</li>
 *     <li>Gene cluster table with cluster_id, gene_ids and, optionally, gene_name columns</li>
 *     <li>Optionally, a best-hits table mapping accession-named scaffolds to replicon names</li>
 * </ul>
 *
 * <h3>Usage example</h3>
 * <pre>
 * replicon-resolver AnnotateGeneClusterReplicons \
 *     --gene-data gene_data.csv \
 *     --gene-clusters gene_clusters.tsv \
 *     --best-hits best_hits.csv \
 *     -O replicon_summary.tsv
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Assigns a consensus replicon and a cross-family diversity score to every pangenome gene cluster.",
        oneLineSummary = "Annotate gene clusters with their consensus replicon",
        programGroup = PangenomeProgramGroup.class
)
public final class AnnotateGeneClusterReplicons extends CommandLineProgram {

    public static final String GENE_DATA_LONG_NAME = "gene-data";
    public static final String GENE_CLUSTERS_LONG_NAME = "gene-clusters";
    public static final String BEST_HITS_LONG_NAME = "best-hits";
    public static final String THRESHOLD_LONG_NAME = "threshold";

    static final double HIGH_CROSS_FAMILY_SCORE = 0.5;
    static final int MAX_MULTI_REPLICON_LISTED = 20;
    static final int MAX_HIGH_CROSS_FAMILY_LISTED = 15;

    private final ResolverConfig config = ConfigFactory.getInstance().getResolverConfig();

    @Argument(fullName = GENE_DATA_LONG_NAME, doc = "Gene data table mapping scaffolds to clustering ids.")
    private File geneDataFile;

    @Argument(fullName = GENE_CLUSTERS_LONG_NAME, doc = "Gene cluster table listing the member gene ids of each cluster.")
    private File geneClustersFile;

    @Argument(fullName = BEST_HITS_LONG_NAME,
            doc = "Best-hits table used to name the replicon of scaffolds named after an accession.",
            optional = true)
    private File bestHitsFile = null;

    @Argument(fullName = THRESHOLD_LONG_NAME, doc = "Minimum fraction of members sharing a replicon for a consensus call.",
            minValue = 0.0, maxValue = 1.0, optional = true)
    private double threshold = config.consensusThreshold();

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Output gene cluster annotation table.")
    private File outputFile;

    @Argument(fullName = StandardArgumentDefinitions.THREADS_LONG_NAME,
            doc = "Number of threads used to process gene clusters.",
            minValue = 1, optional = true)
    private int threads = config.threads();

    @Override
    protected Object doWork() {
        Map<String, String> accessionLookup = Collections.emptyMap();
        if (bestHitsFile != null) {
            accessionLookup = AccessionLookupReader.read(bestHitsFile.toPath());
            logger.info(String.format("Loaded %d accession to replicon mappings from %s", accessionLookup.size(), bestHitsFile));
        }

        final GeneDataTableReader geneDataReader = new GeneDataTableReader(accessionLookup);
        final ScaffoldRepliconLookup scaffoldLookup = geneDataReader.read(geneDataFile.toPath());
        logger.info(String.format("Parsed %d scaffolds from %s (%d rows skipped, %d named through accessions)",
                scaffoldLookup.size(), geneDataFile, geneDataReader.getRowsSkipped(), geneDataReader.getAccessionResolved()));
        final SortedSet<String> uniqueReplicons = scaffoldLookup.uniqueReplicons();
        logger.info(String.format("Unique replicons found (%d): %s", uniqueReplicons.size(), String.join(", ", uniqueReplicons)));

        final List<GeneClusterEvidence> clusters = GeneClusterTableReader.read(geneClustersFile.toPath(), scaffoldLookup);
        logger.info(String.format("Annotating %d gene clusters (threshold=%s)", clusters.size(), threshold));

        final ConsensusOutcome outcome = new ConsensusAggregator(new ConsensusSettings(threshold)).annotateAll(clusters, threads);
        final List<GeneClusterAnnotation> annotations = outcome.getAnnotations();

        try (final GeneClusterAnnotationWriter writer = new GeneClusterAnnotationWriter(outputFile.toPath())) {
            writer.writeAllRecords(annotations);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(outputFile, e);
        }
        logger.info(String.format("Wrote %d gene cluster annotations to %s", annotations.size(), outputFile));

        logSummary(clusters, annotations);
        if (!outcome.getFailedClusters().isEmpty()) {
            logger.warn(String.format("%d gene clusters could not be annotated: %s",
                    outcome.getFailedClusters().size(), String.join(", ", outcome.getFailedClusters())));
        }
        return "SUCCESS";
    }

    private void logSummary(final List<GeneClusterEvidence> clusters, final List<GeneClusterAnnotation> annotations) {
        final long matched = annotations.stream().filter(a -> a.getStatus().hasCalls()).count();
        final long partiallyMatched = annotations.stream().filter(a -> a.getStatus() == ClusterMatchStatus.PARTIALLY_MATCHED).count();
        final int refound = clusters.stream().mapToInt(GeneClusterEvidence::getRefoundGenes).sum();
        logger.info("Results:");
        logger.info(String.format("  Matched:           %d", matched));
        logger.info(String.format("  Unmatched:         %d", annotations.size() - matched));
        logger.info(String.format("  Partially matched: %d", partiallyMatched));
        logger.info(String.format("  Refound genes:     %d (skipped for replicon assignment)", refound));

        final List<Map.Entry<String, Long>> repliconCounts =
                mostCommonFirst(annotations, a -> a.getConsensus().getConsensusReplicon());
        logger.info(String.format("Replicon distribution (%d categories):", repliconCounts.size()));
        repliconCounts.forEach(e -> logger.info(String.format("  %-25s %6d clusters", e.getKey(), e.getValue())));

        logger.info("Replicon type distribution:");
        mostCommonFirst(annotations, GeneClusterAnnotation::getRepliconType)
                .forEach(e -> logger.info(String.format("  %-25s %6d clusters", e.getKey(), e.getValue())));

        final List<GeneClusterAnnotation> multiReplicon = annotations.stream()
                .filter(a -> ConsensusResult.MULTI_REPLICON.equals(a.getConsensus().getConsensusReplicon()))
                .collect(Collectors.toList());
        if (!multiReplicon.isEmpty()) {
            logger.info(String.format("Multi-replicon clusters (%d):", multiReplicon.size()));
            multiReplicon.stream().limit(MAX_MULTI_REPLICON_LISTED)
                    .forEach(a -> logger.info(String.format("  %-30s %s", a.getDisplayName(), a.getConsensus().getDetail())));
            if (multiReplicon.size() > MAX_MULTI_REPLICON_LISTED) {
                logger.info(String.format("  ... and %d more", multiReplicon.size() - MAX_MULTI_REPLICON_LISTED));
            }
            multiReplicon.forEach(a -> logger.debug(String.format("  %-30s %s", a.getDisplayName(), a.getConsensus().getDetail())));
        }

        final long singleFamily = annotations.stream().filter(a -> a.getDiversity().isSingleFamily()).count();
        final long crossFamily = annotations.stream().filter(a -> a.getDiversity().getNumberOfFamilies() > 1).count();
        logger.info("Family diversity analysis:");
        logger.info(String.format("  Single-family clusters: %d (within-family variation only)", singleFamily));
        logger.info(String.format("  Cross-family clusters:  %d (inter-replicon movement)", crossFamily));

        final List<GeneClusterAnnotation> highCrossFamily = annotations.stream()
                .filter(a -> a.getDiversity().getCrossFamilyScore() > HIGH_CROSS_FAMILY_SCORE)
                .sorted(Comparator.comparingDouble((GeneClusterAnnotation a) -> a.getDiversity().getCrossFamilyScore()).reversed())
                .collect(Collectors.toList());
        if (!highCrossFamily.isEmpty()) {
            logger.info(String.format("High cross-family score clusters (>%s): %d", HIGH_CROSS_FAMILY_SCORE, highCrossFamily.size()));
            highCrossFamily.stream().limit(MAX_HIGH_CROSS_FAMILY_LISTED)
                    .forEach(a -> logger.info(String.format("  %-30s score=%.2f  %s", a.getDisplayName(),
                            a.getDiversity().getCrossFamilyScore(), a.getDiversity().getDetail())));
            if (highCrossFamily.size() > MAX_HIGH_CROSS_FAMILY_LISTED) {
                logger.info(String.format("  ... and %d more", highCrossFamily.size() - MAX_HIGH_CROSS_FAMILY_LISTED));
            }
        }
    }

    private static List<Map.Entry<String, Long>> mostCommonFirst(final List<GeneClusterAnnotation> annotations,
                                                               final Function<GeneClusterAnnotation, String> key) {
        final Map<String, Long> counts = annotations.stream()
                .collect(Collectors.groupingBy(key, LinkedHashMap::new, Collectors.counting()));
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .collect(Collectors.toList());
    }
}
