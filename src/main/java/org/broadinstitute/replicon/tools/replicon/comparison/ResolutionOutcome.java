package org.broadinstitute.replicon.tools.replicon.comparison;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.replicon.utils.Utils;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Results of a comparison run: one {@link ComparisonResult} per fragment sorted by key, the category tally and
 * the assemblies whose evaluation failed.
 */
public final class ResolutionOutcome {

    private final List<ComparisonResult> results;
    private final CategoryCounts counts;
    private final List<String> failedAssemblies;

    public ResolutionOutcome(final List<ComparisonResult> results, final CategoryCounts counts,
                             final List<String> failedAssemblies) {
        this.results = ImmutableList.copyOf(Utils.nonNull(results, "the results cannot be null"));
        this.counts = Utils.nonNull(counts, "the counts cannot be null");
        this.failedAssemblies = ImmutableList.copyOf(Utils.nonNull(failedAssemblies, "the failed list cannot be null"));
    }

    public List<ComparisonResult> getResults() {
        return results;
    }

    public CategoryCounts getCounts() {
        return counts;
    }

    public List<String> getFailedAssemblies() {
        return failedAssemblies;
    }

    public List<ComparisonResult> getResultsNeedingReview() {
        return results.stream().filter(ComparisonResult::needsReview).collect(Collectors.toList());
    }
}
