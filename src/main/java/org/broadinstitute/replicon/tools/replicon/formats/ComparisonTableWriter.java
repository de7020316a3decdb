package org.broadinstitute.replicon.tools.replicon.formats;

import org.broadinstitute.replicon.tools.replicon.comparison.ComparisonResult;
import org.broadinstitute.replicon.utils.tsv.DataLine;
import org.broadinstitute.replicon.utils.tsv.TableColumnCollection;
import org.broadinstitute.replicon.utils.tsv.TableWriter;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;

/**
 * Writes one row per compared fragment.
 */
public final class ComparisonTableWriter extends TableWriter<ComparisonResult> {

    public enum ComparisonTableColumn {
        ASSEMBLY_ID("assembly_id"),
        CONTIG_ID("contig_id"),
        CONTIG_LEN("contig_len"),
        OLD_CALL("old_call"),
        NEW_CALL("new_call"),
        CATEGORY("category"),
        RESOLVED_CALL("resolved_call");

        private final String columnName;

        ComparisonTableColumn(final String columnName) {
            this.columnName = columnName;
        }

        @Override
        public String toString() {
            return columnName;
        }

        public static final TableColumnCollection COLUMNS = new TableColumnCollection(ComparisonTableColumn.class);
    }

    public ComparisonTableWriter(final Path path) throws IOException {
        super(path, ComparisonTableColumn.COLUMNS);
    }

    public ComparisonTableWriter(final Writer writer, final char columnSeparator) {
        super(writer, ComparisonTableColumn.COLUMNS, columnSeparator, true);
    }

    @Override
    protected void composeLine(final ComparisonResult record, final DataLine dataLine) {
        dataLine.append(record.getKey().getAssemblyId())
                .append(record.getKey().getContigId())
                .append(record.getContigLength())
                .append(record.getOldCall())
                .append(record.getNewCall())
                .append(record.getCategory().getLabel())
                .append(record.getResolvedCall());
    }
}
