package org.broadinstitute.replicon.tools.replicon.formats;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.ImmutableTable;
import org.broadinstitute.replicon.exceptions.UserException;
import org.broadinstitute.replicon.testutils.BaseTest;
import org.broadinstitute.replicon.tools.replicon.calls.CallNormalizer;
import org.broadinstitute.replicon.tools.replicon.consensus.ClusterMatchStatus;
import org.broadinstitute.replicon.tools.replicon.consensus.ConsensusAggregator;
import org.broadinstitute.replicon.tools.replicon.consensus.ConsensusSettings;
import org.broadinstitute.replicon.tools.replicon.consensus.GeneClusterEvidence;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class GeneClusterTablesUnitTest extends BaseTest {

    @Test
    public void testAccessionLookup() {
        final File input = createTempFileWithContents("bestHits", ".tsv",
                "assembly_id\tcontig_id\tplasmid_name",
                "asm1\tNZ_CP009656.1 [topology=linear]\tLP54",
                "asm1\tCP009657.1\tcp26",
                "asm2\tNZ_CP009656.1\tlp28-4",
                "asm2\tcontig_1\tlp17",
                "asm2\tCP009658.1\t");
        final Map<String, String> lookup = AccessionLookupReader.read(input.toPath());
        Assert.assertEquals(lookup, ImmutableMap.of("cp009656.1", "lp54", "cp009657.1", "cp26"));
    }

    @Test
    public void testAccessionLookupWithoutColumns() {
        final File input = createTempFileWithContents("bestHits", ".tsv",
                "assembly_id\tcontig\tcall",
                "asm1\tCP009657.1\tcp26");
        Assert.assertTrue(AccessionLookupReader.read(input.toPath()).isEmpty());
    }

    @Test
    public void testGeneDataTable() {
        final File input = createTempFileWithContents("geneData", ".tsv",
                "gene_id\tscaffold_name\tclustering_id",
                "g1\tESI26H_lp54_contig_3\tiso1_scaf3_00012",
                "g2\tESI26H_cp26_contig_4\tiso1_scaf3_00013",
                "g3\tESI26H_cp009656.1_contig_1\tiso1_scaf7_00001",
                "g4\t\tiso2_scaf1_00001",
                "g5\tESI26H_lp17_contig_9\tiso2",
                "g6\tESI26H_contig_10\tiso2_scaf2_00004");
        final GeneDataTableReader reader = new GeneDataTableReader(ImmutableMap.of("cp009656.1", "lp28-4"));
        final ScaffoldRepliconLookup lookup = reader.read(input.toPath());
        Assert.assertEquals(reader.getRowsParsed(), 6);
        Assert.assertEquals(reader.getRowsSkipped(), 1);
        Assert.assertEquals(reader.getAccessionResolved(), 1);
        Assert.assertEquals(lookup.size(), 3);
        Assert.assertEquals(lookup.lookup("iso1", "scaf3"), Optional.of("lp54"));
        Assert.assertEquals(lookup.lookup("iso1", "scaf7"), Optional.of("lp28-4"));
        Assert.assertEquals(lookup.lookup("iso2", "scaf2"), Optional.of("unknown"));
        Assert.assertEquals(lookup.uniqueReplicons(), ImmutableSortedSet.of("lp28-4", "lp54", "unknown"));
    }

    @Test
    public void testGeneDataCommaSeparated() {
        final File input = createTempFileWithContents("geneData", ".txt",
                "scaffold_name,clustering_id",
                "ESI26H_lp54_contig_3,iso1_scaf3_00012");
        final ScaffoldRepliconLookup lookup = new GeneDataTableReader(ImmutableMap.of()).read(input.toPath());
        Assert.assertEquals(lookup.lookup("iso1", "scaf3"), Optional.of("lp54"));
    }

    @Test
    public void testClusteringIdWithEmptyGenePart() {
        final File input = createTempFileWithContents("geneData", ".tsv",
                "scaffold_name\tclustering_id",
                "ESI26H_lp54_contig_3\tiso1_scaf3_",
                "ESI26H_cp26_contig_4\tiso1_scaf4");
        final ScaffoldRepliconLookup lookup = new GeneDataTableReader(ImmutableMap.of()).read(input.toPath());
        Assert.assertEquals(lookup.size(), 1);
        Assert.assertEquals(lookup.lookup("iso1", "scaf3"), Optional.of("lp54"));
        Assert.assertEquals(lookup.lookup("iso1", "scaf4"), Optional.empty());

        final GeneClusterEvidence evidence = GeneClusterEvidence.fromGeneIds("group_1", "", "iso1_scaf3_", lookup);
        Assert.assertEquals(evidence.getMemberCalls(), ImmutableList.of("lp54"));
    }

    @Test(expectedExceptions = UserException.MissingColumn.class)
    public void testGeneDataMissingColumn() {
        final File input = createTempFileWithContents("geneData", ".tsv",
                "gene_id\tscaffold_name",
                "g1\tESI26H_lp54_contig_3");
        new GeneDataTableReader(ImmutableMap.of()).read(input.toPath());
    }

    @Test
    public void testGeneClusterTable() {
        final ScaffoldRepliconLookup lookup = new ScaffoldRepliconLookup(ImmutableTable.<String, String, String>builder()
                .put("iso1", "scaf1", "lp54")
                .put("iso2", "scaf1", "lp54")
                .put("iso3", "scaf4", "cp26")
                .build());
        final File input = createTempFileWithContents("clusters", ".tsv",
                "cluster_id\tgene_name\tgene_ids",
                "c1\tBBA64\tiso1_scaf1_001;iso2_scaf1_004;iso3_scaf4_010",
                "c2\t\tiso1_refound_002;iso9_scaf1_001",
                "c3\tdnaA\t",
                "\tghost\tiso1_scaf1_001");
        final List<GeneClusterEvidence> clusters = GeneClusterTableReader.read(input.toPath(), lookup);
        Assert.assertEquals(clusters.size(), 3);

        Assert.assertEquals(clusters.get(0).getClusterId(), "c1");
        Assert.assertEquals(clusters.get(0).getGeneName(), "BBA64");
        Assert.assertEquals(clusters.get(0).getMemberCalls(), ImmutableList.of("lp54", "lp54", "cp26"));
        Assert.assertEquals(clusters.get(0).getStatus(), ClusterMatchStatus.MATCHED);

        Assert.assertEquals(clusters.get(1).getRefoundGenes(), 1);
        Assert.assertEquals(clusters.get(1).getTotalGenes(), 2);
        Assert.assertEquals(clusters.get(1).getStatus(), ClusterMatchStatus.UNMATCHED);

        Assert.assertEquals(clusters.get(2).getStatus(), ClusterMatchStatus.NO_GENE_IDS);
    }

    @Test
    public void testAnnotationWriter() throws IOException {
        final ConsensusAggregator aggregator = new ConsensusAggregator(ConsensusSettings.DEFAULT);
        final ScaffoldRepliconLookup lookup = new ScaffoldRepliconLookup(ImmutableTable.of("iso1", "scaf1", "lp54"));
        final Path output = createTempFile("annotations", ".tsv").toPath();
        try (final GeneClusterAnnotationWriter writer = new GeneClusterAnnotationWriter(output)) {
            writer.writeAllRecords(ImmutableList.of(
                    aggregator.annotate(new GeneClusterEvidence("c1", "BBA64", ImmutableList.of("lp54", "LP54"), 2, 0)),
                    aggregator.annotate(GeneClusterEvidence.fromGeneIds("c2", "", "iso5_scaf1_001", lookup)),
                    aggregator.annotate(GeneClusterEvidence.fromGeneIds("c3", "dnaA", "", lookup))));
        }
        final String family = CallNormalizer.familyOf("lp54");
        Assert.assertEquals(readLines(output), ImmutableList.of(
                "cluster_id\tgene_name\tconsensus_replicon\ttop_replicon\treplicon_type\ttop_replicon_type\t"
                        + "consensus_fraction\tn_isolates\treplicon_detail\ttop_family\tn_families\t"
                        + "family_consensus_frac\tis_single_family\tcross_family_score\tfamily_detail",
                "c1\tBBA64\tlp54\tlp54\tlinear_plasmid\tlinear_plasmid\t1.0\t2\tlp54(2)\t" + family + "\t1\t1.0\t1\t0.0\t"
                        + family + "(2)",
                "c2\t\tunmatched\tunmatched\tunmatched\tunmatched\t0.0\t0\t\tunmatched\t0\t0.0\t1\t0.0\t",
                "c3\tdnaA\tno_geneIDs\tno_geneIDs\tunknown\tunknown\t0.0\t0\t\tunknown\t0\t0.0\t1\t0.0\t"));
    }

    @Test
    public void testGeneClusterTableKeepsClusterWithoutMatches() {
        final File input = createTempFileWithContents("clusters", ".csv",
                "cluster_id,gene_ids",
                "c1,iso1_scaf1_001");
        final List<GeneClusterEvidence> clusters = GeneClusterTableReader.read(input.toPath(),
                new ScaffoldRepliconLookup(ImmutableTable.of()));
        Assert.assertEquals(clusters.size(), 1);
        Assert.assertEquals(clusters.get(0).getGeneName(), "");
        Assert.assertEquals(clusters.get(0).getStatus(), ClusterMatchStatus.UNMATCHED);
    }
}
