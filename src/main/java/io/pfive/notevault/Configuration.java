// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.notevault;

import io.pfive.notevault.exception.ConfigIOException;
import io.pfive.notevault.exception.ConfigParseException;

import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Properties;
import java.util.Set;

/// Application settings, as opposed to the per-vault configuration in VaultConfig. Defaults come
/// from notevault.properties on the classpath. If the system property notevault.config names a
/// file, its entries override the defaults. Every key must end up with a parseable value, and
/// unknown keys are rejected (they are usually misspellings).
public class Configuration {

    public static final String RESOURCE_NAME = "/notevault.properties";
    public static final String OVERRIDE_PROPERTY = "notevault.config";

    private static final Set<String> KNOWN_KEYS = Set.of(
          "default-storage-dir", "log-level", "hide-password-input", "max-title-length");

    /// Where the vault lives when no directory is given on the command line. A leading ~ stands for
    /// the user's home directory.
    public final Path defaultStorageDir;
    /// Root log level when no -v flag is given.
    public final String logLevel;
    /// Read passwords without echo when a console is attached.
    public final boolean hidePasswordInput;
    public final int maxTitleLength;

    private final Properties properties;

    private Configuration (Properties properties) {
        this.properties = properties;
        for (String key : properties.stringPropertyNames()) {
            if (!KNOWN_KEYS.contains(key)) {
                throw new ConfigParseException("Unknown configuration key: " + key);
            }
        }
        defaultStorageDir = expandHome(stringVal("default-storage-dir"));
        logLevel = stringVal("log-level");
        hidePasswordInput = boolVal("hide-password-input");
        maxTitleLength = intVal("max-title-length");
        if (maxTitleLength <= 0) {
            throw new ConfigParseException("max-title-length must be positive, got " + maxTitleLength);
        }
    }

    public static Configuration fromProperties (Properties properties) {
        return new Configuration(properties);
    }

    /// Load the classpath defaults, then apply the override file if one is named.
    public static Configuration load () {
        Properties properties = new Properties();
        try (InputStream in = Configuration.class.getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                throw new ConfigIOException(RESOURCE_NAME + " not found on classpath", null);
            }
            properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigIOException("cannot read " + RESOURCE_NAME, e);
        }
        String overridePath = System.getProperty(OVERRIDE_PROPERTY);
        if (overridePath != null) {
            try (Reader reader = new FileReader(overridePath, StandardCharsets.UTF_8)) {
                properties.load(reader);
            } catch (IOException e) {
                throw new ConfigIOException("cannot read " + overridePath, e);
            }
        }
        return new Configuration(properties);
    }

    private static Path expandHome (String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return Path.of(System.getProperty("user.home"), path.substring(1));
        }
        return Path.of(path);
    }

    private String stringVal (String key) {
        String val = properties.getProperty(key);
        if (val == null) throw new ConfigParseException("Missing configuration key: " + key);
        return val.trim();
    }

    private int intVal (String key) {
        String val = stringVal(key);
        try {
            return Integer.parseInt(val);
        } catch (NumberFormatException e) {
            var message = String.format("Cannot parse value '%s' for configuration key '%s' as integer.", val, key);
            throw new ConfigParseException(message, e);
        }
    }

    private boolean boolVal (String key) {
        String val = stringVal(key);
        if (val.equalsIgnoreCase("true")) return true;
        if (val.equalsIgnoreCase("yes")) return true;
        if (val.equalsIgnoreCase("false")) return false;
        if (val.equalsIgnoreCase("no")) return false;
        var message = String.format("Boolean value '%s' for configuration key '%s' must be true/false/yes/no.", val, key);
        throw new ConfigParseException(message);
    }

}
