// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.notevault.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.base.Preconditions;
import io.pfive.notevault.authentication.Credential;
import io.pfive.notevault.authentication.CredentialManager;
import io.pfive.notevault.exception.ConfigIOException;
import io.pfive.notevault.exception.ConfigParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;

/// The salt and password verifier of one vault, kept in two files in the storage directory:
/// config.json holds the storage path and salt as text, and a separate file holds the raw verifier
/// bytes. config.json is always written before the verifier and deleted after it, so a verifier file
/// never exists on its own. config.json without a verifier means the first password was never
/// completely saved, and openOrInitialize() starts that vault over. A lone verifier file is
/// corruption, which load() reports rather than guessing.
///
/// The salt is chosen when the vault is created and never changes, not even on password change.
/// The verifier is absent exactly until the first password is set, and only erase() removes it.
public class VaultConfig {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final String CONFIG_FILE_NAME = "config.json";
    public static final String VERIFIER_FILE_NAME = "hash";

    private final Path storagePath;
    private final String passwordSalt;
    private byte[] passwordVerifier; // Null until a password has been set.

    private VaultConfig (Path storagePath, String passwordSalt, byte[] passwordVerifier) {
        this.storagePath = storagePath;
        this.passwordSalt = passwordSalt;
        this.passwordVerifier = passwordVerifier;
    }

    /// The on-disk JSON shape. Field names are snake_case, any other field is rejected by Jackson.
    record ConfigFile (
        @JsonProperty("storage_path") String storagePath,
        @JsonProperty("password_salt") String passwordSalt
    ) { }

    /// True if either of the two configuration files is present in the directory.
    public static boolean exists (Path storagePath) {
        return Files.exists(storagePath.resolve(CONFIG_FILE_NAME))
            || Files.exists(storagePath.resolve(VERIFIER_FILE_NAME));
    }

    public static VaultConfig load (Path storagePath) {
        Path configPath = storagePath.resolve(CONFIG_FILE_NAME);
        Path verifierPath = storagePath.resolve(VERIFIER_FILE_NAME);
        boolean configPresent = Files.exists(configPath);
        boolean verifierPresent = Files.exists(verifierPath);
        if (!configPresent && !verifierPresent) {
            throw new ConfigIOException("no configuration found in " + storagePath, null);
        }
        if (configPresent != verifierPresent) {
            throw new ConfigParseException(String.format("found %s without %s in %s, the vault is corrupt.",
                  configPresent ? CONFIG_FILE_NAME : VERIFIER_FILE_NAME,
                  configPresent ? VERIFIER_FILE_NAME : CONFIG_FILE_NAME,
                  storagePath));
        }
        ConfigFile configFile;
        try {
            configFile = FileStore.readJson(configPath, ConfigFile.class);
        } catch (JsonProcessingException e) {
            throw new ConfigParseException(configPath + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigIOException("cannot read " + configPath, e);
        }
        if (configFile == null) {
            throw new ConfigParseException(configPath + " is empty.");
        }
        if (configFile.passwordSalt() == null || configFile.passwordSalt().isEmpty()) {
            throw new ConfigParseException(configPath + " has no password_salt.");
        }
        if (configFile.storagePath() == null) {
            throw new ConfigParseException(configPath + " has no storage_path.");
        }
        if (!Path.of(configFile.storagePath()).toAbsolutePath().normalize()
                .equals(storagePath.toAbsolutePath().normalize())) {
            LOG.warn("Configuration records storage path {} but was loaded from {}, the vault has been moved.",
                  configFile.storagePath(), storagePath);
        }
        byte[] verifier;
        try {
            verifier = FileStore.readBytes(verifierPath);
        } catch (IOException e) {
            throw new ConfigIOException("cannot read " + verifierPath, e);
        }
        if (verifier.length != Credential.LENGTH_BYTES) {
            throw new ConfigParseException(String.format("%s holds %d bytes, expected %d.",
                  verifierPath, verifier.length, Credential.LENGTH_BYTES));
        }
        return new VaultConfig(storagePath, configFile.passwordSalt(), verifier);
    }

    /// Create the in-memory configuration for a brand new vault. Nothing is written until a
    /// password is set and save() is called.
    public static VaultConfig initialize (Path storagePath, String passwordSalt) {
        Preconditions.checkArgument(passwordSalt != null && !passwordSalt.isEmpty(), "Salt is required.");
        Preconditions.checkState(!exists(storagePath), "A vault configuration already exists in %s", storagePath);
        return new VaultConfig(storagePath, passwordSalt, null);
    }

    public static VaultConfig openOrInitialize (Path storagePath) {
        if (Files.exists(storagePath.resolve(CONFIG_FILE_NAME))
                && !Files.exists(storagePath.resolve(VERIFIER_FILE_NAME))) {
            LOG.warn("Found {} without a password verifier in {}, setup was interrupted. Starting over.",
                  CONFIG_FILE_NAME, storagePath);
            try {
                FileStore.deleteAll(storagePath.resolve(CONFIG_FILE_NAME));
            } catch (IOException e) {
                throw new ConfigIOException("cannot remove incomplete configuration in " + storagePath, e);
            }
        }
        if (exists(storagePath)) {
            LOG.debug("Loading existing config from {}", storagePath);
            return load(storagePath);
        }
        LOG.debug("Setting up new configuration in {}", storagePath);
        return initialize(storagePath, CredentialManager.generateSalt());
    }

    public Path storagePath () {
        return storagePath;
    }

    public String passwordSalt () {
        return passwordSalt;
    }

    public boolean hasVerifier () {
        return passwordVerifier != null;
    }

    public byte[] passwordVerifier () {
        Preconditions.checkState(hasVerifier(), "No password has been set for this vault.");
        return passwordVerifier.clone();
    }

    /// Record the verifier of a newly set password. Calling it again replaces the verifier, which is
    /// how a password change takes effect. Not persisted until save().
    public void setVerifier (byte[] verifier) {
        Preconditions.checkArgument(verifier != null && verifier.length == Credential.LENGTH_BYTES,
              "Verifier must be exactly %s bytes.", Credential.LENGTH_BYTES);
        this.passwordVerifier = verifier.clone();
    }

    /// Persist both files, config.json first, each by write-then-rename.
    public void save () {
        Preconditions.checkState(hasVerifier(), "Cannot save a vault configuration before a password is set.");
        Path configPath = storagePath.resolve(CONFIG_FILE_NAME);
        Path verifierPath = storagePath.resolve(VERIFIER_FILE_NAME);
        try {
            FileStore.storeJson(new ConfigFile(storagePath.toString(), passwordSalt), configPath);
            FileStore.storeBytes(passwordVerifier, verifierPath);
        } catch (IOException e) {
            throw new ConfigIOException("cannot write configuration in " + storagePath, e);
        }
        LOG.debug("Saved vault configuration in {}", storagePath);
    }

    /// Delete both files and forget the verifier. Part of a hard reset.
    public void erase () {
        try {
            FileStore.deleteAll(storagePath.resolve(VERIFIER_FILE_NAME), storagePath.resolve(CONFIG_FILE_NAME));
        } catch (IOException e) {
            throw new ConfigIOException("cannot delete configuration in " + storagePath, e);
        }
        passwordVerifier = null;
        LOG.info("Erased vault configuration in {}", storagePath);
    }

}
