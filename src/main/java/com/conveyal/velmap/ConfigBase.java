package com.conveyal.velmap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Shared functionality for classes that load properties containing configuration information and expose these options
 * via the Config interfaces of the pipeline components.
 *
 * Some validation may be performed here, but any interpretation or conditional logic should be provided in the
 * components themselves. Options that every run needs are required, to avoid any confusion due to merging layers of
 * defaults. Options that only matter for some choice of method are read with the optional*Prop methods and checked
 * by the component that needs them.
 */
public class ConfigBase {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigBase.class);

    public static final String VELMAP_PROPERTY_PREFIX = "velmap-";

    // All access to these should be through the *Prop methods.
    private final Properties properties;

    protected final Set<String> keysWithErrors = new TreeSet<>();

    /**
     * Prepare to load config from the given properties, overriding from environment variables and system properties.
     * In the latter two sources, the keys may be in upper or lower case and use dashes, underscores, or dots as
     * separators. System properties can be set on the JVM command line with -D options. The usual config file keys
     * must be prefixed with "velmap", e.g. VELMAP_WORKER_THREADS=4 or java -Dvelmap.worker.threads=4.
     * Precedence of configuration sources is: system properties > environment variables > config file.
     */
    protected ConfigBase (Properties properties) {
        this.properties = properties;
        setPropertiesFromMap(System.getenv(), "environment variable");
        setPropertiesFromMap(System.getProperties(), "system properties");
    }

    /** Static convenience method to uniformly load files into properties and catch errors. */
    protected static Properties propsFromFile (String filename) {
        try (Reader propsReader = new FileReader(filename)) {
            Properties properties = new Properties();
            properties.load(propsReader);
            return properties;
        } catch (IOException e) {
            throw new ConfigurationException("Could not load configuration properties from " + filename, e);
        }
    }

    // Always use the following *Prop methods to read properties. This will catch and log missing keys or parse
    // exceptions, allowing config loading to continue and reporting as many problems as possible at once.

    // Catches and records missing values,
    // so methods that wrap this and parse into non-String types can just ignore null values.
    protected String strProp (String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            LOG.error("Missing configuration option {}", key);
            keysWithErrors.add(key);
        }
        return value == null ? null : value.trim();
    }

    protected int intProp (String key) {
        Integer value = parseInt(key, strProp(key));
        return value == null ? 0 : value;
    }

    /** @return the integer value of an option that may be absent, or null if it is absent. */
    protected Integer optionalIntProp (String key) {
        return parseInt(key, optionalValue(key));
    }

    protected double doubleProp (String key) {
        Double value = parseDouble(key, strProp(key));
        return value == null ? 0 : value;
    }

    /** @return the numeric value of an option that may be absent, or null if it is absent. */
    protected Double optionalDoubleProp (String key) {
        return parseDouble(key, optionalValue(key));
    }

    protected boolean boolProp (String key) {
        String val = strProp(key);
        if (val != null) {
            // Boolean.parseBoolean will return false for any string other than "true".
            // We want to be more strict.
            if ("true".equalsIgnoreCase(val) || "yes".equalsIgnoreCase(val)) {
                return true;
            } else if ("false".equalsIgnoreCase(val) || "no".equalsIgnoreCase(val)) {
                return false;
            } else {
                LOG.error("Value of configuration option '{}' could not be parsed as a boolean: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return false;
    }

    /**
     * Read one of the constants of an enum. Values are matched case-insensitively, with dashes standing in for
     * underscores, so "two-stage" and "TWO_STAGE" both name TWO_STAGE.
     */
    protected <E extends Enum<E>> E enumProp (String key, Class<E> enumClass) {
        String val = strProp(key);
        if (val != null) {
            try {
                return Enum.valueOf(enumClass, val.toUpperCase(Locale.ROOT).replace('-', '_'));
            } catch (IllegalArgumentException e) {
                LOG.error("Value of configuration option '{}' is not one of {}: {}", key,
                        Arrays.toString(enumClass.getEnumConstants()), val);
                keysWithErrors.add(key);
            }
        }
        return null;
    }

    private String optionalValue (String key) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    private Integer parseInt (String key, String val) {
        if (val != null) {
            try {
                return Integer.parseInt(val);
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as an integer: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return null;
    }

    private Double parseDouble (String key, String val) {
        if (val != null) {
            try {
                return Double.parseDouble(val);
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as a number: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return null;
    }

    /**
     * Call this after reading all properties to enforce the presence and validity of all configuration options.
     * @throws ConfigurationException listing every missing or malformed key.
     */
    protected void exitIfErrors () {
        if (!keysWithErrors.isEmpty()) {
            String keys = String.join(", ", keysWithErrors);
            LOG.error("You must provide valid values for these configuration properties: {}", keys);
            throw new ConfigurationException("Missing or invalid configuration properties: " + keys);
        }
    }

    /**
     * Overwrite configuration options supplied in the config file with environment variables and system properties
     * (e.g. supplied on the JVM command line). Case and separators are normalized to conform to both properties and
     * environment variable conventions. Properties are Object-Object Maps so key and value are cast to String.
     */
    private void setPropertiesFromMap (Map<?, ?> map, String sourceDescription) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            // Normalize to String type, all lower case, all dash separators.
            String key = ((String)entry.getKey()).toLowerCase(Locale.ROOT).replaceAll("[\\._-]", "-");
            String value = ((String)entry.getValue());
            if (key.startsWith(VELMAP_PROPERTY_PREFIX)) {
                // Strip off velmap prefix to get the key that would be used in our config file.
                key = key.substring(VELMAP_PROPERTY_PREFIX.length());
                String existingKey = properties.getProperty(key);
                if (existingKey != null) {
                    LOG.info("Overwriting existing config key {} to '{}' from {}.", key, value, sourceDescription);
                } else {
                    LOG.info("Setting configuration key {} to '{}' from {}.", key, value, sourceDescription);
                }
                properties.setProperty(key, value);
            }
        }
    }

}
