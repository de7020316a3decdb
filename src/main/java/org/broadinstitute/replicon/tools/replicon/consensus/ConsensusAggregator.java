package org.broadinstitute.replicon.tools.replicon.consensus;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.replicon.exceptions.ResolverException;
import org.broadinstitute.replicon.tools.replicon.calls.CallNormalizer;
import org.broadinstitute.replicon.utils.Utils;

import java.util.*;
import java.util.function.Function;

/**
 * Computes the majority call and the family diversity of gene clusters.
 * <p>
 * Calls are normalized first; empty calls are counted as {@value #UNCLASSIFIED_LABEL}. The top call is the most
 * frequent one, ties going to the call seen first. It becomes the consensus when its fraction reaches the
 * threshold, otherwise the consensus is {@value ConsensusResult#MULTI_REPLICON}.
 * </p>
 * <p>
 * Family diversity uses a different label for the same calls: an empty call has no family and is counted under
 * {@value ConsensusResult#UNKNOWN}. A cluster of empty calls therefore reports an {@value #UNCLASSIFIED_LABEL} top
 * replicon and an {@value ConsensusResult#UNKNOWN} top family.
 * </p>
 */
public final class ConsensusAggregator {

    private static final Logger logger = LogManager.getLogger(ConsensusAggregator.class);

    public static final String UNCLASSIFIED_LABEL = "unclassified";

    public static final String NO_GENE_IDS_LABEL = "no_geneIDs";

    public static final String UNMATCHED_LABEL = "unmatched";

    private final ConsensusSettings settings;

    public ConsensusAggregator(final ConsensusSettings settings) {
        this.settings = Utils.nonNull(settings, "the settings cannot be null");
    }

    public ConsensusSettings getSettings() {
        return settings;
    }

    public ConsensusResult consensus(final List<String> calls) {
        Utils.nonNull(calls, "the calls cannot be null");
        if (calls.isEmpty()) {
            return ConsensusResult.unknown();
        }
        final Map<String, Integer> counts = mostCommonFirst(countInOrder(calls, ConsensusAggregator::label));
        final Map.Entry<String, Integer> top = counts.entrySet().iterator().next();
        final double fraction = (double) top.getValue() / calls.size();
        final String consensus = fraction >= settings.getThreshold() ? top.getKey() : ConsensusResult.MULTI_REPLICON;
        return new ConsensusResult(consensus, top.getKey(), CountFormatting.round3(fraction), calls.size(), counts);
    }

    /**
     * Groups the calls by family; calls without a family are counted as {@value ConsensusResult#UNKNOWN}.
     * Family counts are kept in order of first appearance.
     */
    public DiversityResult diversity(final List<String> calls) {
        Utils.nonNull(calls, "the calls cannot be null");
        if (calls.isEmpty()) {
            return DiversityResult.none(ConsensusResult.UNKNOWN);
        }
        final Map<String, Integer> familyCounts = countInOrder(calls, call -> {
            final String family = CallNormalizer.familyOf(call);
            return family == null ? ConsensusResult.UNKNOWN : family;
        });
        final Map.Entry<String, Integer> top = mostCommonFirst(familyCounts).entrySet().iterator().next();
        final double familyFraction = CountFormatting.round3((double) top.getValue() / calls.size());
        return new DiversityResult(familyCounts, top.getKey(), familyFraction, crossFamilyScore(familyCounts.values(), calls.size()));
    }

    /**
     * Shannon entropy (base 2) of the distribution divided by its maximum, {@code log2(number of families)}.
     *
     * @return 0 for at most one family, rounded to 3 decimals otherwise.
     */
    static double crossFamilyScore(final Collection<Integer> familyCounts, final int total) {
        final int numberOfFamilies = familyCounts.size();
        if (numberOfFamilies <= 1) {
            return 0.0;
        }
        double entropy = 0;
        for (final int count : familyCounts) {
            final double p = (double) count / total;
            if (p > 0) {
                entropy -= p * log2(p);
            }
        }
        final double score = CountFormatting.round3(entropy / log2(numberOfFamilies));
        return Math.max(0.0, Math.min(1.0, score));
    }

    public GeneClusterAnnotation annotate(final GeneClusterEvidence evidence) {
        Utils.nonNull(evidence, "the evidence cannot be null");
        final ClusterMatchStatus status = evidence.getStatus();
        switch (status) {
            case NO_GENE_IDS:
                return new GeneClusterAnnotation(evidence.getClusterId(), evidence.getGeneName(), status,
                        ConsensusResult.placeholder(NO_GENE_IDS_LABEL),
                        RepliconType.UNKNOWN.getLabel(), RepliconType.UNKNOWN.getLabel(),
                        DiversityResult.none(ConsensusResult.UNKNOWN), 0);
            case UNMATCHED:
                return new GeneClusterAnnotation(evidence.getClusterId(), evidence.getGeneName(), status,
                        ConsensusResult.placeholder(UNMATCHED_LABEL),
                        RepliconType.UNMATCHED.getLabel(), RepliconType.UNMATCHED.getLabel(),
                        DiversityResult.none(UNMATCHED_LABEL), evidence.getRefoundGenes());
            case MATCHED:
            case PARTIALLY_MATCHED:
                final ConsensusResult consensus = consensus(evidence.getMemberCalls());
                final DiversityResult diversity = diversity(evidence.getMemberCalls());
                if (logger.isDebugEnabled()) {
                    logger.debug(String.format("Cluster %s (%s): %s, %s", evidence.getClusterId(),
                            evidence.getGeneName(), consensus, diversity));
                }
                return new GeneClusterAnnotation(evidence.getClusterId(), evidence.getGeneName(), status, consensus,
                        RepliconType.classify(consensus.getConsensusReplicon()).getLabel(),
                        RepliconType.classify(consensus.getTopReplicon()).getLabel(),
                        diversity, evidence.getRefoundGenes());
            default:
                throw new ResolverException.ShouldNeverReachHereException("unexpected cluster status " + status);
        }
    }

    /**
     * Annotates every cluster using {@code threads} workers. The annotations follow the input order; a cluster
     * whose annotation fails is logged and reported in {@link ConsensusOutcome#getFailedClusters()}.
     */
    public ConsensusOutcome annotateAll(final List<GeneClusterEvidence> clusters, final int threads) {
        Utils.nonNull(clusters, "the clusters cannot be null");
        final List<Object> evaluated = Utils.mapInParallel(clusters, evidence -> {
            try {
                return annotate(evidence);
            } catch (final RuntimeException ex) {
                return new ResolverException.KeyEvaluationFailure(evidence.getClusterId(), ex);
            }
        }, threads);

        final List<GeneClusterAnnotation> annotations = new ArrayList<>(clusters.size());
        final List<String> failed = new ArrayList<>();
        for (final Object result : evaluated) {
            if (result instanceof ResolverException.KeyEvaluationFailure) {
                final ResolverException.KeyEvaluationFailure failure = (ResolverException.KeyEvaluationFailure) result;
                logger.error(failure.getMessage(), failure);
                failed.add(failure.getKey());
            } else {
                annotations.add((GeneClusterAnnotation) result);
            }
        }
        return new ConsensusOutcome(annotations, failed);
    }

    private static String label(final String call) {
        final String normalized = CallNormalizer.normalize(call);
        return normalized.isEmpty() ? UNCLASSIFIED_LABEL : normalized;
    }

    private static Map<String, Integer> countInOrder(final List<String> calls,
                                                     final Function<String, String> key) {
        final Map<String, Integer> counts = new LinkedHashMap<>();
        for (final String call : calls) {
            counts.merge(key.apply(call), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Reorders counts by decreasing count; the sort is stable so ties keep their order.
     */
    private static Map<String, Integer> mostCommonFirst(final Map<String, Integer> counts) {
        final List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
        final Map<String, Integer> result = new LinkedHashMap<>();
        entries.forEach(e -> result.put(e.getKey(), e.getValue()));
        return result;
    }

    private static double log2(final double x) {
        return Math.log(x) / Math.log(2);
    }
}
