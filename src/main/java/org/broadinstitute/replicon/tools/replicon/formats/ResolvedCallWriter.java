package org.broadinstitute.replicon.tools.replicon.formats;

import org.broadinstitute.replicon.tools.replicon.comparison.ComparisonResult;
import org.broadinstitute.replicon.utils.tsv.DataLine;
import org.broadinstitute.replicon.utils.tsv.TableColumnCollection;
import org.broadinstitute.replicon.utils.tsv.TableWriter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes the final call of every fragment: {@code assembly_id}, {@code contig_id}, {@code resolved_call}.
 */
public final class ResolvedCallWriter extends TableWriter<ComparisonResult> {

    public static final TableColumnCollection COLUMNS =
            new TableColumnCollection(FragmentColumns.ASSEMBLY_ID, FragmentColumns.CONTIG_ID, OverrideTableReader.RESOLVED_CALL);

    public ResolvedCallWriter(final Path path) throws IOException {
        super(path, COLUMNS);
    }

    @Override
    protected void composeLine(final ComparisonResult record, final DataLine dataLine) {
        dataLine.append(record.getKey().getAssemblyId(), record.getKey().getContigId(), record.getResolvedCall());
    }
}
