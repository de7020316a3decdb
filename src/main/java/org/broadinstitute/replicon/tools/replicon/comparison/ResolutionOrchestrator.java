package org.broadinstitute.replicon.tools.replicon.comparison;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.replicon.exceptions.ResolverException;
import org.broadinstitute.replicon.tools.replicon.calls.CallNormalizer;
import org.broadinstitute.replicon.tools.replicon.formats.FragmentKey;
import org.broadinstitute.replicon.tools.replicon.formats.FragmentRecord;
import org.broadinstitute.replicon.utils.Utils;

import java.util.*;

/**
 * Resolves the calls of two evidence sources for every fragment present in either.
 * <p>
 * For each fragment, in priority order:
 * </p>
 * <ol>
 *     <li>a fragment known to one source only is {@code old_only} or {@code new_only} and keeps that call;</li>
 *     <li>otherwise the {@link CallComparator} categorizes the pair;</li>
 *     <li>a {@code different} pair may be promoted to {@code auto_chromosome} by the length heuristics;</li>
 *     <li>a manual override replaces the resolved call and, unless the pair was an {@code exact_match},
 *     the category becomes {@code manual_override}.</li>
 * </ol>
 * <p>
 * Assemblies are independent and evaluated in parallel. An assembly that fails is logged and reported in
 * {@link ResolutionOutcome#getFailedAssemblies()}; its fragments are left out of the results.
 * </p>
 */
public final class ResolutionOrchestrator {

    private static final Logger logger = LogManager.getLogger(ResolutionOrchestrator.class);

    private final CallComparator comparator;
    private final ComparisonSettings settings;
    private final ManualOverrides overrides;
    private final int threads;

    public ResolutionOrchestrator(final CallComparator comparator, final ComparisonSettings settings,
                                  final ManualOverrides overrides, final int threads) {
        this.comparator = Utils.nonNull(comparator, "the comparator cannot be null");
        this.settings = Utils.nonNull(settings, "the settings cannot be null");
        this.overrides = Utils.nonNull(overrides, "the overrides cannot be null");
        Utils.validateArg(threads > 0, "the number of threads must be positive");
        this.threads = threads;
    }

    /**
     * @param oldRecords old evidence by fragment.
     * @param newRecords new evidence by fragment.
     */
    public ResolutionOutcome resolve(final Map<FragmentKey, FragmentRecord> oldRecords,
                                     final Map<FragmentKey, FragmentRecord> newRecords) {
        Utils.nonNull(oldRecords, "the old records cannot be null");
        Utils.nonNull(newRecords, "the new records cannot be null");

        final SortedMap<String, List<FragmentKey>> keysByAssembly = new TreeMap<>();
        final Set<FragmentKey> allKeys = new TreeSet<>(oldRecords.keySet());
        allKeys.addAll(newRecords.keySet());
        for (final FragmentKey key : allKeys) {
            keysByAssembly.computeIfAbsent(key.getAssemblyId(), k -> new ArrayList<>()).add(key);
        }

        final List<Map.Entry<String, List<FragmentKey>>> assemblies = new ArrayList<>(keysByAssembly.entrySet());
        final List<AssemblyEvaluation> evaluations = Utils.mapInParallel(assemblies,
                entry -> evaluateAssembly(entry.getKey(), entry.getValue(), oldRecords, newRecords), threads);

        final List<ComparisonResult> results = new ArrayList<>(allKeys.size());
        final List<String> failed = new ArrayList<>();
        CategoryCounts counts = CategoryCounts.empty();
        for (final AssemblyEvaluation evaluation : evaluations) {
            if (evaluation.failure != null) {
                logger.error(evaluation.failure.getMessage(), evaluation.failure);
                failed.add(evaluation.failure.getKey());
            } else {
                results.addAll(evaluation.results);
                counts = counts.merge(evaluation.counts);
            }
        }
        Collections.sort(results);
        return new ResolutionOutcome(results, counts, failed);
    }

    private AssemblyEvaluation evaluateAssembly(final String assemblyId, final List<FragmentKey> keys,
                                                final Map<FragmentKey, FragmentRecord> oldRecords,
                                                final Map<FragmentKey, FragmentRecord> newRecords) {
        try {
            final List<ComparisonResult> results = new ArrayList<>(keys.size());
            CategoryCounts counts = CategoryCounts.empty();
            for (final FragmentKey key : keys) {
                final ComparisonResult result = evaluate(key, oldRecords.get(key), newRecords.get(key));
                results.add(result);
                counts = counts.merge(CategoryCounts.of(result.getCategory()));
            }
            return new AssemblyEvaluation(results, counts, null);
        } catch (final RuntimeException ex) {
            return new AssemblyEvaluation(null, null, new ResolverException.KeyEvaluationFailure(assemblyId, ex));
        }
    }

    /**
     * Resolves a single fragment.
     *
     * @param oldRecord the old evidence, {@code null} if absent.
     * @param newRecord the new evidence, {@code null} if absent.
     */
    public ComparisonResult evaluate(final FragmentKey key, final FragmentRecord oldRecord, final FragmentRecord newRecord) {
        Utils.nonNull(key, "the key cannot be null");
        Utils.validateArg(oldRecord != null || newRecord != null, () -> "no evidence for " + key);

        final String oldCall = oldRecord == null ? "" : oldRecord.getCall();
        final String newCall = newRecord == null ? "" : newRecord.getCall();
        final long length = newRecord != null && newRecord.getLength() > 0 ? newRecord.getLength()
                : (oldRecord != null ? oldRecord.getLength() : 0);

        ComparisonCategory category;
        String resolved;
        if (newRecord == null) {
            category = ComparisonCategory.OLD_ONLY;
            resolved = oldCall.trim();
        } else if (oldRecord == null) {
            category = ComparisonCategory.NEW_ONLY;
            resolved = newCall.trim();
        } else {
            final CallComparator.Categorization categorization = comparator.categorize(oldCall, newCall);
            category = categorization.getCategory();
            resolved = categorization.getResolvedCall();
            if (category == ComparisonCategory.DIFFERENT && autoChromosomeApplies(oldCall, newCall, length)) {
                category = ComparisonCategory.AUTO_CHROMOSOME;
                resolved = newCall.trim();
            }
        }

        final Optional<String> override = overrides.get(key);
        if (override.isPresent()) {
            resolved = override.get();
            if (category != ComparisonCategory.EXACT_MATCH) {
                category = ComparisonCategory.MANUAL_OVERRIDE;
            }
        }
        if (logger.isDebugEnabled()) {
            logger.debug(String.format("%s: '%s' vs '%s' -> %s '%s'", key, oldCall, newCall, category, resolved));
        }
        return new ComparisonResult(key, length, oldCall, newCall, category, resolved);
    }

    /**
     * The chromosome heuristics: a long fragment newly called chromosome, or a short fragment previously called
     * chromosome and now called something else, takes the new call.
     */
    private boolean autoChromosomeApplies(final String oldCall, final String newCall, final long length) {
        if (!settings.isAutoChromosomeEnabled()) {
            return false;
        }
        final long threshold = settings.getAutoChromosomeBp();
        if (CallNormalizer.isChromosome(newCall)) {
            return length >= threshold;
        }
        return CallNormalizer.isChromosome(oldCall) && !CallNormalizer.isEmpty(newCall) && length < threshold;
    }

    private static final class AssemblyEvaluation {
        private final List<ComparisonResult> results;
        private final CategoryCounts counts;
        private final ResolverException.KeyEvaluationFailure failure;

        private AssemblyEvaluation(final List<ComparisonResult> results, final CategoryCounts counts,
                                   final ResolverException.KeyEvaluationFailure failure) {
            this.results = results;
            this.counts = counts;
            this.failure = failure;
        }
    }
}
