package org.broadinstitute.replicon.cmdline;

/**
 * A set of String constants in which the name of the constant (minus the _SHORT_NAME suffix)
 * is the standard long Name for the argument, and the value is the short name.
 */
public final class StandardArgumentDefinitions {
    private StandardArgumentDefinitions(){}

    public static final String INPUT_LONG_NAME = "input";
    public static final String OUTPUT_LONG_NAME = "output";
    public static final String VERBOSITY_NAME = "verbosity";
    public static final String QUIET_NAME = "QUIET";
    public static final String THREADS_LONG_NAME = "threads";
    public static final String ASSEMBLY_COLUMN_LONG_NAME = "assembly-column";
    public static final String CONTIG_COLUMN_LONG_NAME = "contig-column";
    public static final String CALL_COLUMN_LONG_NAME = "call-column";

    public static final String INPUT_SHORT_NAME = "I";
    public static final String OUTPUT_SHORT_NAME = "O";

    /**
     * The option specifying a configuration file; parsed out in {@link org.broadinstitute.replicon.Main} before
     * any program is created.
     */
    public static final String RESOLVER_CONFIG_FILE_OPTION = "resolver-config-file";
}
