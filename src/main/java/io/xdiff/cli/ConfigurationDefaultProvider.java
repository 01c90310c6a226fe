package io.xdiff.cli;

import java.io.File;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.builder.fluent.Configurations;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.IDefaultValueProvider;
import picocli.CommandLine.Model.ArgSpec;
import picocli.CommandLine.Model.OptionSpec;

/**
 * Supplies option defaults from a properties file. The property key is the option's long name without
 * the leading dashes, e.g. {@code left-uri=jdbc:postgresql://...}. Options given on the command line win.
 */
public class ConfigurationDefaultProvider implements IDefaultValueProvider {

    private static Logger logger = LoggerFactory.getLogger(ConfigurationDefaultProvider.class);

    private final Configuration properties;

    public ConfigurationDefaultProvider(Configuration properties) {
        this.properties = properties;
    }

    /**
     * Reads {@code propsFile}; a missing file yields an empty configuration.
     */
    public static ConfigurationDefaultProvider load(File propsFile) throws ConfigurationException {
        if (propsFile == null || !propsFile.exists()) {
            logger.debug("Config file {} not found, using command line options only", propsFile);
            return new ConfigurationDefaultProvider(new PropertiesConfiguration());
        }
        Configurations configs = new Configurations();
        logger.info("Loaded configuration from: {}", propsFile.getAbsolutePath());
        return new ConfigurationDefaultProvider(configs.properties(propsFile));
    }

    @Override
    public String defaultValue(ArgSpec argSpec) {
        if (!argSpec.isOption()) {
            return null;
        }
        String key = StringUtils.stripStart(((OptionSpec) argSpec).longestName(), "-");
        return properties.getString(key, null);
    }
}
