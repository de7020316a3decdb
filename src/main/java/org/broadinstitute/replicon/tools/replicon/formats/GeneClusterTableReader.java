package org.broadinstitute.replicon.tools.replicon.formats;

import org.broadinstitute.replicon.exceptions.UserException;
import org.broadinstitute.replicon.tools.replicon.consensus.GeneClusterEvidence;
import org.broadinstitute.replicon.utils.Utils;
import org.broadinstitute.replicon.utils.io.IOUtils;
import org.broadinstitute.replicon.utils.tsv.TableReader;
import org.broadinstitute.replicon.utils.tsv.TableUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads gene clusters ({@code cluster_id}, {@code gene_ids} and optionally {@code gene_name}) and resolves the
 * calls of their member genes. Rows with an empty cluster id are skipped.
 */
public final class GeneClusterTableReader {

    public static final String CLUSTER_ID = "cluster_id";
    public static final String GENE_IDS = "gene_ids";
    public static final String GENE_NAME = "gene_name";

    private GeneClusterTableReader() {}

    public static List<GeneClusterEvidence> read(final Path path, final ScaffoldRepliconLookup lookup) {
        Utils.nonNull(lookup, "the lookup cannot be null");
        IOUtils.assertFileIsReadable(path);
        try (final TableReader<GeneClusterEvidence> reader = TableUtils.reader(path,
                (columns, formatExceptionFactory) -> {
                    columns.requireAll(path.getFileName().toString(), CLUSTER_ID, GENE_IDS);
                    return dataLine -> {
                        final String clusterId = dataLine.get(CLUSTER_ID).trim();
                        if (clusterId.isEmpty()) {
                            return null;
                        }
                        return GeneClusterEvidence.fromGeneIds(clusterId, dataLine.get(GENE_NAME, "").trim(),
                                dataLine.get(GENE_IDS), lookup);
                    };
                })) {
            return reader.toList();
        } catch (final IOException | UncheckedIOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
    }
}
