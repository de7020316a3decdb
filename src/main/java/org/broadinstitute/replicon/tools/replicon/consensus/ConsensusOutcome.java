package org.broadinstitute.replicon.tools.replicon.consensus;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.replicon.utils.Utils;

import java.util.List;

/**
 * Annotations of a batch of gene clusters, in input order, and the ids of the clusters that failed.
 */
public final class ConsensusOutcome {

    private final List<GeneClusterAnnotation> annotations;
    private final List<String> failedClusters;

    public ConsensusOutcome(final List<GeneClusterAnnotation> annotations, final List<String> failedClusters) {
        this.annotations = ImmutableList.copyOf(Utils.nonNull(annotations));
        this.failedClusters = ImmutableList.copyOf(Utils.nonNull(failedClusters));
    }

    public List<GeneClusterAnnotation> getAnnotations() {
        return annotations;
    }

    public List<String> getFailedClusters() {
        return failedClusters;
    }
}
