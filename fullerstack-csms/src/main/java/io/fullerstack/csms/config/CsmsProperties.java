package io.fullerstack.csms.config;

import java.util.Locale;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.ResourceBundle;

/**
 * Property lookup backed by a {@link ResourceBundle} ({@code <bundle>.properties} on the
 * classpath) with JVM system properties taking precedence.
 *
 * <pre>
 * # csms.properties
 * csms.port=9000
 * csms.heartbeat-interval-seconds=300
 * </pre>
 *
 * <pre>
 * java -Dcsms.port=9100 -jar csms.jar
 * </pre>
 *
 * A missing bundle is treated as empty, so every key falls back to its default.
 */
public class CsmsProperties {

    private final ResourceBundle bundle;
    private final String bundleName;

    private CsmsProperties(ResourceBundle bundle, String bundleName) {
        this.bundle = bundle;
        this.bundleName = bundleName;
    }

    /**
     * Loads {@code csms.properties}.
     */
    public static CsmsProperties load() {
        return load("csms");
    }

    public static CsmsProperties load(String bundleName) {
        Objects.requireNonNull(bundleName, "bundleName cannot be null");
        if (bundleName.isBlank()) {
            throw new IllegalArgumentException("bundleName cannot be blank");
        }
        ResourceBundle bundle;
        try {
            bundle = ResourceBundle.getBundle(bundleName, Locale.ROOT);
        } catch (MissingResourceException e) {
            bundle = null;
        }
        return new CsmsProperties(bundle, bundleName);
    }

    /**
     * Get string value with default. System properties win over the bundle.
     */
    public String getString(String key, String defaultValue) {
        String sysProp = System.getProperty(key);
        if (sysProp != null) {
            return sysProp.trim();
        }
        if (bundle == null) {
            return defaultValue;
        }
        try {
            return bundle.getString(key).trim();
        } catch (MissingResourceException e) {
            return defaultValue;
        }
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                "Invalid int value for key '" + key + "' in " + bundleName + ": " + value, e);
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                "Invalid long value for key '" + key + "' in " + bundleName + ": " + value, e);
        }
    }

    public double getDouble(String key, double defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                "Invalid double value for key '" + key + "' in " + bundleName + ": " + value, e);
        }
    }

    public boolean contains(String key) {
        if (System.getProperty(key) != null) {
            return true;
        }
        return bundle != null && bundle.containsKey(key);
    }

    @Override
    public String toString() {
        return "CsmsProperties[" + bundleName + (bundle == null ? ", missing" : "") + "]";
    }
}
