package org.broadinstitute.replicon.tools.replicon.formats;

import org.broadinstitute.replicon.utils.Utils;

/**
 * Names of the columns read from a fragment table.
 * <p>
 * The key and call columns are configurable and required. The length and alignment columns have fixed names
 * and are optional.
 * </p>
 */
public final class FragmentColumns {

    public static final String ASSEMBLY_ID = "assembly_id";
    public static final String CONTIG_ID = "contig_id";
    public static final String CONTIG_LENGTH = "contig_len";
    public static final String REF_LENGTH = "ref_length";
    public static final String REF_COVERED_LENGTH = "ref_covered_length";
    public static final String QUERY_COVERAGE_PERCENT = "query_coverage_percent";
    public static final String OVERALL_PERCENT_IDENTITY = "overall_percent_identity";

    private final String assemblyColumn;
    private final String contigColumn;
    private final String callColumn;

    public FragmentColumns(final String assemblyColumn, final String contigColumn, final String callColumn) {
        this.assemblyColumn = Utils.nonEmpty(assemblyColumn, "the assembly column cannot be null or empty");
        this.contigColumn = Utils.nonEmpty(contigColumn, "the contig column cannot be null or empty");
        this.callColumn = Utils.nonEmpty(callColumn, "the call column cannot be null or empty");
    }

    public String getAssemblyColumn() {
        return assemblyColumn;
    }

    public String getContigColumn() {
        return contigColumn;
    }

    public String getCallColumn() {
        return callColumn;
    }

    public String[] required() {
        return new String[]{assemblyColumn, contigColumn, callColumn};
    }

    @Override
    public String toString() {
        return String.format("assembly=%s, contig=%s, call=%s", assemblyColumn, contigColumn, callColumn);
    }
}
