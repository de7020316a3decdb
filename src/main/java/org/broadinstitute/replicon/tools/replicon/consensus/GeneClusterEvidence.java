package org.broadinstitute.replicon.tools.replicon.consensus;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.replicon.tools.replicon.formats.ScaffoldRepliconLookup;
import org.broadinstitute.replicon.utils.Utils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Member calls of one gene cluster.
 * <p>
 * Member genes are identified as {@code isolate_scaffold_gene}; the call of a gene is the replicon of its scaffold.
 * Genes whose scaffold index is {@value #REFOUND_SCAFFOLD} were re-found by the pangenome tool, have no scaffold and
 * are skipped.
 * </p>
 */
public final class GeneClusterEvidence {

    public static final String GENE_ID_SEPARATOR = ";";

    public static final String REFOUND_SCAFFOLD = "refound";

    private final String clusterId;
    private final String geneName;
    private final List<String> memberCalls;
    private final int totalGenes;
    private final int refoundGenes;

    public GeneClusterEvidence(final String clusterId, final String geneName, final List<String> memberCalls,
                               final int totalGenes, final int refoundGenes) {
        this.clusterId = Utils.nonNull(clusterId, "the cluster id cannot be null");
        this.geneName = geneName == null ? "" : geneName;
        this.memberCalls = ImmutableList.copyOf(Utils.nonNull(memberCalls, "the member calls cannot be null"));
        Utils.validateArg(totalGenes >= 0 && refoundGenes >= 0, "gene counts cannot be negative");
        this.totalGenes = totalGenes;
        this.refoundGenes = refoundGenes;
    }

    /**
     * Resolves the calls of a cluster's member genes.
     *
     * @param geneIds the {@value #GENE_ID_SEPARATOR}-separated gene ids; blank if the cluster lists none.
     * @param lookup  scaffold to replicon lookup.
     */
    public static GeneClusterEvidence fromGeneIds(final String clusterId, final String geneName, final String geneIds,
                                                  final ScaffoldRepliconLookup lookup) {
        Utils.nonNull(lookup, "the lookup cannot be null");
        if (geneIds == null || geneIds.trim().isEmpty()) {
            return new GeneClusterEvidence(clusterId, geneName, ImmutableList.of(), 0, 0);
        }
        final String[] ids = geneIds.split(GENE_ID_SEPARATOR, -1);
        final List<String> calls = new ArrayList<>(ids.length);
        int refound = 0;
        for (final String id : ids) {
            final String[] parts = id.trim().split("_", -1);
            if (parts.length < 3) {
                continue;
            }
            if (REFOUND_SCAFFOLD.equals(parts[1])) {
                refound++;
                continue;
            }
            final Optional<String> replicon = lookup.lookup(parts[0], parts[1]);
            replicon.ifPresent(calls::add);
        }
        return new GeneClusterEvidence(clusterId, geneName, calls, ids.length, refound);
    }

    public String getClusterId() {
        return clusterId;
    }

    public String getGeneName() {
        return geneName;
    }

    public List<String> getMemberCalls() {
        return memberCalls;
    }

    /**
     * @return the number of listed gene ids, 0 if the cluster lists none.
     */
    public int getTotalGenes() {
        return totalGenes;
    }

    public int getRefoundGenes() {
        return refoundGenes;
    }

    public ClusterMatchStatus getStatus() {
        if (totalGenes == 0) {
            return ClusterMatchStatus.NO_GENE_IDS;
        } else if (memberCalls.isEmpty()) {
            return ClusterMatchStatus.UNMATCHED;
        } else if (memberCalls.size() < totalGenes - refoundGenes) {
            return ClusterMatchStatus.PARTIALLY_MATCHED;
        }
        return ClusterMatchStatus.MATCHED;
    }
}
