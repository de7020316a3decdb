package org.broadinstitute.replicon.tools.replicon.consensus;

import org.broadinstitute.replicon.utils.Utils;

/**
 * Consensus and family diversity of one gene cluster.
 */
public final class GeneClusterAnnotation {

    private final String clusterId;
    private final String geneName;
    private final ClusterMatchStatus status;
    private final ConsensusResult consensus;
    private final String repliconType;
    private final String topRepliconType;
    private final DiversityResult diversity;
    private final int refoundGenes;

    public GeneClusterAnnotation(final String clusterId, final String geneName, final ClusterMatchStatus status,
                                 final ConsensusResult consensus, final String repliconType,
                                 final String topRepliconType, final DiversityResult diversity,
                                 final int refoundGenes) {
        this.clusterId = Utils.nonNull(clusterId);
        this.geneName = geneName == null ? "" : geneName;
        this.status = Utils.nonNull(status);
        this.consensus = Utils.nonNull(consensus);
        this.repliconType = Utils.nonNull(repliconType);
        this.topRepliconType = Utils.nonNull(topRepliconType);
        this.diversity = Utils.nonNull(diversity);
        this.refoundGenes = refoundGenes;
    }

    public String getClusterId() {
        return clusterId;
    }

    public String getGeneName() {
        return geneName;
    }

    public ClusterMatchStatus getStatus() {
        return status;
    }

    public ConsensusResult getConsensus() {
        return consensus;
    }

    public String getRepliconType() {
        return repliconType;
    }

    public String getTopRepliconType() {
        return topRepliconType;
    }

    public DiversityResult getDiversity() {
        return diversity;
    }

    public int getRefoundGenes() {
        return refoundGenes;
    }

    /**
     * @return the gene name, or the cluster id if the cluster has no name.
     */
    public String getDisplayName() {
        return geneName.isEmpty() ? clusterId : geneName;
    }
}
