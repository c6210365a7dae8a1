// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.notevault;

import ch.qos.logback.classic.Level;
import io.pfive.notevault.access.AccessStateMachine;
import io.pfive.notevault.console.VaultConsole;
import io.pfive.notevault.exception.VaultException;
import io.pfive.notevault.store.RecordStore;
import io.pfive.notevault.store.VaultConfig;
import io.pfive.notevault.util.Ret;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;

/// Command line entry point. Parses the options, sets the log level, opens the vault in the chosen
/// directory and hands control to the console until the user quits. Only this class decides the
/// process exit code.
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final int EXIT_OK = 0;
    public static final int EXIT_FATAL = 1;
    public static final int EXIT_USAGE = 2;

    static final String USAGE = String.join("\n",
          "Usage: notevault [-d|--storage-dir DIR] [-v|-vv] [-h|--help]",
          "  -d, --storage-dir DIR  directory holding the vault, must already exist",
          "  -v                     debug logging",
          "  -vv                    trace logging",
          "  -h, --help             show this help");

    /// Parsed command line. A null storageDir means the configured default directory.
    record Options (Path storageDir, int verbosity, boolean help) { }

    public static void main (String[] args) {
        System.exit(run(args));
    }

    static int run (String[] args) {
        Ret<Options> parsed = parseOptions(args);
        if (parsed.isErr()) {
            System.err.println(parsed.errorMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        }
        Options options = parsed.get();
        if (options.help()) {
            System.out.println(USAGE);
            return EXIT_OK;
        }
        Configuration configuration;
        try {
            configuration = Configuration.load();
        } catch (VaultException e) {
            System.err.println(e.getMessage());
            return EXIT_FATAL;
        }
        setLogLevel(options.verbosity(), configuration.logLevel);

        Ret<Path> storageDir = resolveStorageDir(options, configuration, System.err);
        if (storageDir.isErr()) {
            System.err.println(storageDir.errorMessage());
            return EXIT_USAGE;
        }
        return openAndRun(storageDir.get(), configuration);
    }

    private static int openAndRun (Path storageDir, Configuration configuration) {
        LOG.debug("Using storage directory {}", storageDir);
        AccessStateMachine opened;
        try {
            VaultConfig vaultConfig = VaultConfig.openOrInitialize(storageDir);
            RecordStore store = RecordStore.open(storageDir);
            try {
                opened = new AccessStateMachine(vaultConfig, store, configuration.maxTitleLength);
            } catch (VaultException e) {
                store.close();
                throw e;
            }
        } catch (VaultException e) {
            LOG.error("Cannot open the vault in {}: {}", storageDir, e.getMessage());
            return EXIT_FATAL;
        }
        try (AccessStateMachine machine = opened) {
            VaultConsole.forTerminal(machine, configuration.hidePasswordInput).run();
        } catch (IOException e) {
            LOG.error("Console input failed.", e);
            return EXIT_FATAL;
        } catch (VaultException e) {
            LOG.error("Fatal vault error ({}).", e.errorType(), e);
            return EXIT_FATAL;
        }
        return EXIT_OK;
    }

    static Ret<Options> parseOptions (String[] args) {
        Path storageDir = null;
        int verbosity = 0;
        boolean help = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-d", "--storage-dir" -> {
                    if (i + 1 >= args.length) return Ret.err("Option " + arg + " requires a directory.");
                    if (storageDir != null) return Ret.err("Storage directory given more than once.");
                    storageDir = Path.of(args[++i]);
                }
                case "-v" -> verbosity += 1;
                case "-vv" -> verbosity += 2;
                case "-h", "--help" -> help = true;
                default -> {
                    return Ret.err("Unrecognized argument: " + arg);
                }
            }
        }
        return Ret.ok(new Options(storageDir, verbosity, help));
    }

    /// A directory given on the command line must exist. The default one is created on first use.
    static Ret<Path> resolveStorageDir (Options options, Configuration configuration, PrintStream err) {
        if (options.storageDir() != null) {
            Path dir = options.storageDir().toAbsolutePath();
            if (!Files.isDirectory(dir)) {
                return Ret.err("Storage directory does not exist: " + dir);
            }
            return Ret.ok(dir);
        }
        Path dir = configuration.defaultStorageDir.toAbsolutePath();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            err.println("Cannot create storage directory " + dir + ": " + e.getMessage());
            return Ret.err("Storage directory is not usable: " + dir);
        }
        return Ret.ok(dir);
    }

    /// Logback is the SLF4J backend on the classpath, so the root logger can be cast to set its level.
    static void setLogLevel (int verbosity, String configuredLevel) {
        Level level = switch (verbosity) {
            case 0 -> Level.toLevel(configuredLevel, Level.INFO);
            case 1 -> Level.DEBUG;
            default -> Level.TRACE;
        };
        var root = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(level);
    }

}
