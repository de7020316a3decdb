package org.broadinstitute.replicon.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;
import org.aeonbits.owner.Mutable;

/**
 * Configuration file for replicon resolver defaults.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, which specifies that if a configuration option is not found
 * in the first source, the option will be sought in all following sources until a definition is found.
 * If the option is not specified in any file, the coded default value will be used (as defined by @DefaultValue).
 *
 * The load order is:
 *        1)   "file:${" + ResolverConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "file:ResolverConfig.properties",
 *        3)   "classpath:org/broadinstitute/replicon/utils/config/ResolverConfig.properties"
 *        4)   hard-coded values specified by @DefaultValue
 *
 * Tools read their argument defaults from here; the core components receive immutable settings objects instead.
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + ResolverConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
        "file:ResolverConfig.properties",
        "classpath:org/broadinstitute/replicon/utils/config/ResolverConfig.properties"
})
public interface ResolverConfig extends Mutable, Accessible {

    /**
     * Name of the configuration file variable used in the {@link Sources} annotation; set from the
     * command line by {@link ConfigFactory#initializeConfigurationsFromCommandLineArgs}.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "ResolverConfig.pathToResolverConfig";

    // ----------------------------------------------------------
    // Miscellaneous Options:
    // ----------------------------------------------------------

    @Key("resolver_stacktrace_on_user_exception")
    @DefaultValue("false")
    boolean resolver_stacktrace_on_user_exception();

    @Key("threads")
    @DefaultValue("1")
    int threads();

    // ----------------------------------------------------------
    // Input columns:
    // ----------------------------------------------------------

    @Key("assembly_column")
    @DefaultValue("assembly_id")
    String assemblyColumn();

    @Key("contig_column")
    @DefaultValue("contig_id")
    String contigColumn();

    @Key("comparison_call_column")
    @DefaultValue("final_call")
    String comparisonCallColumn();

    @Key("placement_call_column")
    @DefaultValue("plasmid_name")
    String placementCallColumn();

    // ----------------------------------------------------------
    // Comparison:
    // ----------------------------------------------------------

    /**
     * Minimum fragment length for the chromosome auto-resolution heuristics; 0 disables them.
     */
    @Key("auto_chromosome_bp")
    @DefaultValue("0")
    long autoChromosomeBp();

    @Key("review_max_listed")
    @DefaultValue("20")
    int reviewMaxListed();

    // ----------------------------------------------------------
    // Consensus:
    // ----------------------------------------------------------

    @Key("consensus_threshold")
    @DefaultValue("0.9")
    double consensusThreshold();

    // ----------------------------------------------------------
    // Placement:
    // ----------------------------------------------------------

    @Key("placement_ref_coverage")
    @DefaultValue("0.95")
    double placementRefCoverage();

    @Key("placement_query_coverage")
    @DefaultValue("0.90")
    double placementQueryCoverage();

    @Key("placement_identity")
    @DefaultValue("0.90")
    double placementIdentity();
}
