package org.broadinstitute.replicon.utils.config;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.Log;
import org.aeonbits.owner.Config;
import org.aeonbits.owner.ConfigCache;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.replicon.exceptions.ResolverException;
import org.broadinstitute.replicon.exceptions.UserException;
import org.broadinstitute.replicon.utils.LoggingUtils;
import org.broadinstitute.replicon.utils.Utils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A singleton class to act as a user interface for loading configuration files from {@link org.aeonbits.owner}.
 * <p>
 * Path variables in {@link Config.Sources} annotations (such as {@code file:${some.variable}}) that are not defined
 * in the environment, the system properties or the owner properties are set to a neutral value so that loading
 * falls through to the next source.
 * </p>
 */
public final class ConfigFactory {

    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    private static final ConfigFactory instance = new ConfigFactory();

    public static ConfigFactory getInstance() {
        return instance;
    }

    // This class is a singleton, so no public construction.
    private ConfigFactory() {}

    private static final Pattern sourcesAnnotationPathVariablePattern = Pattern.compile("\\$\\{(.*)}");

    /**
     * Value for path variables that were not defined anywhere. Loading from it yields nothing.
     */
    @VisibleForTesting
    static final String NO_PATH_VARIABLE_VALUE = "/dev/null";

    private ResolverConfig resolverConfig;

    // =================================================================================================================

    @VisibleForTesting
    void checkFileNamePropertyExistenceAndSetConfigFactoryProperties(final List<String> filenameProperties) {
        final Properties systemProperties = System.getProperties();
        final Map<String, String> environmentProperties = System.getenv();

        for (final String property : filenameProperties) {
            if ( environmentProperties.containsKey(property) ) {
                logger.debug("Config path variable found in Environment Properties: " + property + "=" + environmentProperties.get(property) + " - will search for config here.");
            }
            else if ( systemProperties.containsKey(property) ) {
                logger.debug("Config path variable found in System Properties: " + property + "=" + systemProperties.get(property) + " - will search for config here.");
            }
            else if ( org.aeonbits.owner.ConfigFactory.getProperties().containsKey(property) ) {
                logger.debug("Config path variable found in Config Factory Properties (probably from the command-line): " + property + "=" + org.aeonbits.owner.ConfigFactory.getProperty(property) + " - will search for config here.");
            }
            else {
                logger.debug("Config path variable not found: " + property + " - setting value to default empty variable: " + NO_PATH_VARIABLE_VALUE);
                org.aeonbits.owner.ConfigFactory.setProperty(property, NO_PATH_VARIABLE_VALUE);
            }
        }
    }

    /**
     * Get a list of the config file variables from the given {@link Config} class's {@link Config.Sources} annotation.
     */
    @VisibleForTesting
    <T extends Config> List<String> getSourcesAnnotationPathVariables(final Class<? extends T> configClass) {
        final List<String> configPathVariableNames = new ArrayList<>();
        final Config.Sources annotation = configClass.getAnnotation(Config.Sources.class);

        if ( annotation != null ) {
            for (final String val : annotation.value()) {
                final Matcher m = sourcesAnnotationPathVariablePattern.matcher(val);
                if (m.find()) {
                    configPathVariableNames.add(m.group(1));
                }
            }
        }
        return configPathVariableNames;
    }

    // =================================================================================================================

    /**
     * Returns the {@link ResolverConfig} loaded by the last call to
     * {@link #initializeConfigurationsFromCommandLineArgs}, or the cached default configuration.
     */
    public synchronized ResolverConfig getResolverConfig() {
        if ( resolverConfig == null ) {
            resolverConfig = getOrCreate(ResolverConfig.class);
        }
        return resolverConfig;
    }

    /**
     * Gets a singleton instance of the given {@link Config} class, creating it if needed.
     */
    public <T extends Config> T getOrCreate(final Class<? extends T> clazz, final Map<?, ?>... imports) {
        Utils.nonNull(clazz);
        resolvePathVariables(clazz);
        return ConfigCache.getOrCreate(clazz, imports);
    }

    /**
     * Creates a new, uncached instance of the given {@link Config} class.
     */
    public <T extends Config> T create(final Class<? extends T> clazz, final Map<?, ?>... imports) {
        Utils.nonNull(clazz);
        resolvePathVariables(clazz);
        return org.aeonbits.owner.ConfigFactory.create(clazz, imports);
    }

    private synchronized <T extends Config> void resolvePathVariables(final Class<? extends T> clazz) {
        checkFileNamePropertyExistenceAndSetConfigFactoryProperties(getSourcesAnnotationPathVariables(clazz));
    }

    /**
     * Get the configuration file name from the given arguments.
     *
     * @return the file name following {@code configFileOption}, or {@code null} if the option is absent.
     * @throws UserException.BadInput if the option is present without a file name.
     */
    public static String getConfigFilenameFromArgs( final String[] args, final String configFileOption ) {
        Utils.nonNull(args);
        Utils.nonNull(configFileOption);

        for ( int i = 0 ; i < args.length ; ++i ) {
            if (args[i].equals(configFileOption)) {
                if ( ((i+1) < args.length) && (!args[i+1].startsWith("-")) ) {
                    return args[i+1];
                }
                throw new UserException.BadInput("ERROR: Configuration file not given after config file option specified: " + configFileOption);
            }
        }
        return null;
    }

    /**
     * Loads the {@link ResolverConfig} from the file named on the command line after {@code configFileOption},
     * or from the default sources if the option is absent. The loaded configuration replaces any previous one.
     */
    public synchronized void initializeConfigurationsFromCommandLineArgs(final String[] argList,
                                                                         final String configFileOption) {
        Utils.nonNull(argList);
        Utils.nonNull(configFileOption);

        final String configFileName = getConfigFilenameFromArgs(argList, configFileOption);
        org.aeonbits.owner.ConfigFactory.setProperty(ResolverConfig.CONFIG_FILE_VARIABLE_FILE_NAME,
                configFileName == null ? NO_PATH_VARIABLE_VALUE : configFileName);

        resolverConfig = create(ResolverConfig.class);
    }

    public static <T extends Config> void logConfigFields(final T config) {
        logConfigFields(config, Log.LogLevel.DEBUG);
    }

    /**
     * Logs all the parameters in the given {@link Config} object at the given {@link Log.LogLevel}.
     */
    public static <T extends Config> void logConfigFields(final T config, final Log.LogLevel logLevel) {
        Utils.nonNull(config);
        Utils.nonNull(logLevel);

        final Level level = LoggingUtils.levelToLog4jLevel(logLevel);
        if ( !logger.isEnabled(level) ) {
            return;
        }

        logger.log(level, "Configuration file values: ");
        for ( final Map.Entry<String, Object> entry : getConfigMap(config).entrySet() ) {
            logger.log(level, "\t" + entry.getKey() + " = " + entry.getValue());
        }
    }

    /**
     * Gets all the property values of a configuration by reflection on its {@link Config} interfaces.
     *
     * @return a map from property key to value.
     */
    @VisibleForTesting
    static <T extends Config> LinkedHashMap<String, Object> getConfigMap(final T config) {
        final LinkedHashMap<String, Object> configMap = new LinkedHashMap<>();

        for ( final Class<?> classInterface : config.getClass().getInterfaces() ) {
            if ( !Config.class.isAssignableFrom(classInterface) ) {
                continue;
            }
            for (final Method propertyMethod : classInterface.getDeclaredMethods()) {
                if ( propertyMethod.getParameterCount() != 0 ) {
                    continue;
                }
                final Config.Key key = propertyMethod.getAnnotation(Config.Key.class);
                final String propertyName = key != null ? key.value() : propertyMethod.getName();
                try {
                    configMap.put(propertyName, propertyMethod.invoke(config));
                } catch (final IllegalAccessException | InvocationTargetException ex) {
                    throw new ResolverException("Could not invoke the config getter: " +
                            config.getClass().getSimpleName() + "." + propertyMethod.getName(), ex);
                }
            }
        }
        return configMap;
    }
}
