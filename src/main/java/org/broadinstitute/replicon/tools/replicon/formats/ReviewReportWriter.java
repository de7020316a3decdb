package org.broadinstitute.replicon.tools.replicon.formats;

import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.replicon.exceptions.UserException;
import org.broadinstitute.replicon.tools.replicon.comparison.ComparisonResult;
import org.broadinstitute.replicon.utils.Utils;
import org.broadinstitute.replicon.utils.io.IOUtils;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Writes the detailed review report: for every flagged fragment, the hits of that contig in every classifier
 * database.
 */
public final class ReviewReportWriter {

    private static final String RULE = Utils.dupChar('=', 100);

    private final ClassifierHitsIndex hitsIndex;

    public ReviewReportWriter(final ClassifierHitsIndex hitsIndex) {
        this.hitsIndex = Utils.nonNull(hitsIndex, "the hits index cannot be null");
    }

    public void write(final Path reportPath, final List<ComparisonResult> flagged) {
        Utils.nonNull(reportPath, "the report path cannot be null");
        Utils.nonNull(flagged, "the flagged results cannot be null");
        try (final PrintWriter out = IOUtils.makePrintWriter(reportPath)) {
            write(out, flagged);
            if (out.checkError()) {
                throw new UserException.CouldNotCreateOutputFile(reportPath.toFile(), "an error occurred while writing");
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(reportPath.toFile(), e);
        }
    }

    void write(final PrintWriter out, final List<ComparisonResult> flagged) {
        out.print("# Detailed review of " + flagged.size() + " contigs needing manual review\n");
        out.print("# Databases found: " + String.join(", ", hitsIndex.getDatabases()) + "\n");
        out.print("# Format: all hits per database for each flagged contig\n");
        out.print("#\n\n");

        for (final ComparisonResult result : flagged) {
            final String assemblyId = result.getKey().getAssemblyId();
            final String contigId = result.getKey().getContigId();
            out.print(RULE + "\n");
            out.print("### " + assemblyId + " / " + contigId + "\n");
            out.print(String.format("### old=%s  new=%s  category=%s\n", result.getOldCall(), result.getNewCall(),
                    result.getCategory()));
            out.print(RULE + "\n\n");

            for (final String database : hitsIndex.getDatabases()) {
                final List<String> hits = hitsIndex.hits(database, assemblyId, contigId);
                out.print("--- " + database + " (" + hits.size() + " hits) ---\n");
                if (hits.isEmpty()) {
                    out.print("  (no hits)\n");
                } else {
                    final Optional<String> header = hitsIndex.header(database, assemblyId);
                    header.ifPresent(h -> out.print("  " + StringUtils.stripEnd(h, null) + "\n"));
                    hits.forEach(hit -> out.print("  " + StringUtils.stripEnd(hit, null) + "\n"));
                }
                out.print("\n");
            }
            out.print("\n");
        }
    }
}
