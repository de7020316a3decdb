package org.broadinstitute.replicon.tools.replicon.placement;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.replicon.exceptions.ResolverException;
import org.broadinstitute.replicon.tools.replicon.calls.CallNormalizer;
import org.broadinstitute.replicon.tools.replicon.formats.FragmentRecord;
import org.broadinstitute.replicon.utils.Utils;

import java.util.*;

/**
 * Decides, per assembly, which fragment represents each replicon.
 * <p>
 * In {@link PlacementMode#CLASSIFIED} mode fragments are grouped by call; within a group the longest fragment is
 * the primary placement and the others are unlocalised fragments of the same replicon. Groups are visited in
 * replicon name order and length ties keep the input order.
 * </p>
 * <p>
 * In {@link PlacementMode#COMPLETE} mode a fragment is placed only if its alignment passes the
 * {@link PlacementThresholds}; there are no unlocalised fragments.
 * </p>
 * <p>
 * Replicon names are made submission-safe: {@code +} becomes {@code -} and {@code chromosome}, a reserved word,
 * becomes {@code main}. The object name is the contig id up to the first whitespace.
 * </p>
 */
public final class RepliconPlacementSelector {

    private static final Logger logger = LogManager.getLogger(RepliconPlacementSelector.class);

    public static final String MAIN_CHROMOSOME_NAME = "main";

    private final PlacementMode mode;
    private final PlacementThresholds thresholds;

    public RepliconPlacementSelector(final PlacementMode mode, final PlacementThresholds thresholds) {
        this.mode = Utils.nonNull(mode, "the mode cannot be null");
        this.thresholds = Utils.nonNull(thresholds, "the thresholds cannot be null");
    }

    public PlacementMode getMode() {
        return mode;
    }

    public PlacementThresholds getThresholds() {
        return thresholds;
    }

    /**
     * Places the fragments of several assemblies using {@code threads} workers.
     * Records with an empty assembly id are ignored.
     */
    public PlacementOutcome placeAll(final List<FragmentRecord> records, final int threads) {
        Utils.nonNull(records, "the records cannot be null");
        final SortedMap<String, List<FragmentRecord>> byAssembly = new TreeMap<>();
        for (final FragmentRecord record : records) {
            final String assemblyId = record.getAssemblyId().trim();
            if (!assemblyId.isEmpty()) {
                byAssembly.computeIfAbsent(assemblyId, k -> new ArrayList<>()).add(record);
            }
        }

        final List<Map.Entry<String, List<FragmentRecord>>> assemblies = new ArrayList<>(byAssembly.entrySet());
        final List<Object> evaluated = Utils.mapInParallel(assemblies, entry -> {
            try {
                return place(entry.getKey(), entry.getValue());
            } catch (final RuntimeException ex) {
                return new ResolverException.KeyEvaluationFailure(entry.getKey(), ex);
            }
        }, threads);

        final List<AssemblyPlacement> placements = new ArrayList<>();
        final List<String> failed = new ArrayList<>();
        for (final Object result : evaluated) {
            if (result instanceof ResolverException.KeyEvaluationFailure) {
                final ResolverException.KeyEvaluationFailure failure = (ResolverException.KeyEvaluationFailure) result;
                logger.error(failure.getMessage(), failure);
                failed.add(failure.getKey());
            } else {
                placements.add((AssemblyPlacement) result);
            }
        }
        return new PlacementOutcome(placements, failed);
    }

    /**
     * Places the fragments of one assembly.
     */
    public AssemblyPlacement place(final String assemblyId, final List<FragmentRecord> fragments) {
        Utils.nonNull(assemblyId, "the assembly id cannot be null");
        Utils.nonNull(fragments, "the fragments cannot be null");
        switch (mode) {
            case CLASSIFIED:
                return placeClassified(assemblyId, fragments);
            case COMPLETE:
                return placeComplete(assemblyId, fragments);
            default:
                throw new ResolverException.ShouldNeverReachHereException("unexpected placement mode " + mode);
        }
    }

    private AssemblyPlacement placeClassified(final String assemblyId, final List<FragmentRecord> fragments) {
        final SortedMap<String, List<FragmentRecord>> byReplicon = new TreeMap<>();
        int unplaced = 0;
        for (final FragmentRecord fragment : fragments) {
            final String call = fragment.getCall().trim();
            if (CallNormalizer.isEmpty(call) || fragment.getContigId().trim().isEmpty()) {
                unplaced++;
                continue;
            }
            byReplicon.computeIfAbsent(call, k -> new ArrayList<>()).add(fragment);
        }

        final List<ChromosomeListEntry> primaries = new ArrayList<>();
        final List<UnlocalisedListEntry> unlocalised = new ArrayList<>();
        for (final Map.Entry<String, List<FragmentRecord>> group : byReplicon.entrySet()) {
            final String replicon = group.getKey();
            final String chromosomeName = sanitizeRepliconName(replicon);
            final List<FragmentRecord> members = new ArrayList<>(group.getValue());
            members.sort(Comparator.comparingLong(FragmentRecord::getLength).reversed());

            primaries.add(chromosomeEntry(members.get(0), replicon));
            for (final FragmentRecord fragment : members.subList(1, members.size())) {
                unlocalised.add(new UnlocalisedListEntry(objectName(fragment.getContigId()), chromosomeName));
            }
        }
        return new AssemblyPlacement(assemblyId, primaries, unlocalised, unplaced);
    }

    private AssemblyPlacement placeComplete(final String assemblyId, final List<FragmentRecord> fragments) {
        final List<ChromosomeListEntry> placed = new ArrayList<>();
        int unplaced = 0;
        for (final FragmentRecord fragment : fragments) {
            final String call = fragment.getCall().trim();
            if (fragment.getContigId().trim().isEmpty() || CallNormalizer.isEmpty(call)) {
                continue;
            }
            if (thresholds.passes(fragment.getAlignmentStats())) {
                placed.add(chromosomeEntry(fragment, call));
            } else {
                logger.debug(String.format("%s: %s fails completeness (%s)", fragment.getKey(), call, fragment.getAlignmentStats()));
                unplaced++;
            }
        }
        return new AssemblyPlacement(assemblyId, placed, Collections.emptyList(), unplaced);
    }

    private static ChromosomeListEntry chromosomeEntry(final FragmentRecord fragment, final String replicon) {
        return new ChromosomeListEntry(objectName(fragment.getContigId()), sanitizeRepliconName(replicon),
                RepliconTopology.of(replicon), ChromosomeType.of(replicon));
    }

    /**
     * Replaces {@code +} by {@code -} and renames the chromosome to {@value #MAIN_CHROMOSOME_NAME}.
     */
    public static String sanitizeRepliconName(final String replicon) {
        final String name = Utils.nonNull(replicon, "the replicon cannot be null").trim().replace('+', '-');
        return CallNormalizer.CHROMOSOME.equalsIgnoreCase(name) ? MAIN_CHROMOSOME_NAME : name;
    }

    /**
     * Drops the bracketed metadata of a contig id: {@code "contig_1 [topology=linear]"} gives {@code contig_1}.
     */
    public static String objectName(final String contigId) {
        final String trimmed = Utils.nonNull(contigId, "the contig id cannot be null").trim();
        Utils.validateArg(!trimmed.isEmpty(), "the contig id cannot be empty");
        return trimmed.split("\\s+")[0];
    }
}
