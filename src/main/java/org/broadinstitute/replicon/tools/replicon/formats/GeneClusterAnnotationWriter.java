package org.broadinstitute.replicon.tools.replicon.formats;

import org.broadinstitute.replicon.tools.replicon.consensus.ConsensusResult;
import org.broadinstitute.replicon.tools.replicon.consensus.DiversityResult;
import org.broadinstitute.replicon.tools.replicon.consensus.GeneClusterAnnotation;
import org.broadinstitute.replicon.utils.tsv.DataLine;
import org.broadinstitute.replicon.utils.tsv.TableColumnCollection;
import org.broadinstitute.replicon.utils.tsv.TableWriter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes one row of consensus and family diversity per gene cluster.
 */
public final class GeneClusterAnnotationWriter extends TableWriter<GeneClusterAnnotation> {

    public enum GeneClusterAnnotationColumn {
        CLUSTER_ID,
        GENE_NAME,
        CONSENSUS_REPLICON,
        TOP_REPLICON,
        REPLICON_TYPE,
        TOP_REPLICON_TYPE,
        CONSENSUS_FRACTION,
        N_ISOLATES,
        REPLICON_DETAIL,
        TOP_FAMILY,
        N_FAMILIES,
        FAMILY_CONSENSUS_FRAC,
        IS_SINGLE_FAMILY,
        CROSS_FAMILY_SCORE,
        FAMILY_DETAIL;

        @Override
        public String toString() {
            return name().toLowerCase();
        }

        public static final TableColumnCollection COLUMNS = new TableColumnCollection(GeneClusterAnnotationColumn.class);
    }

    public GeneClusterAnnotationWriter(final Path path) throws IOException {
        super(path, GeneClusterAnnotationColumn.COLUMNS);
    }

    @Override
    protected void composeLine(final GeneClusterAnnotation record, final DataLine dataLine) {
        final ConsensusResult consensus = record.getConsensus();
        final DiversityResult diversity = record.getDiversity();
        dataLine.append(record.getClusterId(), record.getGeneName(),
                        consensus.getConsensusReplicon(), consensus.getTopReplicon(),
                        record.getRepliconType(), record.getTopRepliconType(),
                        Double.toString(consensus.getConsensusFraction()))
                .append(consensus.getNumberOfIsolates())
                .append(consensus.getDetail(), diversity.getTopFamily())
                .append(diversity.getNumberOfFamilies())
                .append(Double.toString(diversity.getFamilyConsensusFraction()))
                .append(diversity.isSingleFamily() ? 1 : 0)
                .append(Double.toString(diversity.getCrossFamilyScore()), diversity.getDetail());
    }
}
