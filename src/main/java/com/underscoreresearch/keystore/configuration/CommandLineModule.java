package com.underscoreresearch.keystore.configuration;

import static com.underscoreresearch.keystore.utils.SerializationUtils.KEYSTORE_CONFIGURATION_READER;

import java.io.File;
import java.io.IOException;
import java.nio.file.Paths;

import lombok.extern.slf4j.Slf4j;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang.SystemUtils;

import com.google.common.base.Strings;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import com.underscoreresearch.keystore.keys.SignatureSchemes;
import com.underscoreresearch.keystore.model.KeystoreConfiguration;

@Slf4j
public class CommandLineModule extends AbstractModule {
    public static final String CONFIG = "config";
    public static final String KEYSTORE = "keystore";
    public static final String SCHEME = "scheme";
    public static final String FORCE = "force";
    public static final String SURI = "suri";
    public static final String PAPERKEY = "paperkey";
    public static final String PASSWORD = "password";
    public static final String NEW_PASSWORD = "new-password";
    public static final String DEBUG = "debug";
    public static final String KEYSTORE_LOCATION = "KEYSTORE_LOCATION";

    private final String[] argv;

    public CommandLineModule(String[] argv) {
        this.argv = argv;
    }

    public static String getDefaultKeystoreLocation() {
        if (SystemUtils.IS_OS_WINDOWS) {
            String appData = System.getenv("APPDATA");
            if (Strings.isNullOrEmpty(appData)) {
                appData = Paths.get(System.getProperty("user.home"), "AppData", "Roaming").toString();
            }
            return Paths.get(appData, "UnderscoreKeystore").toString();
        }
        return Paths.get(System.getProperty("user.home"), ".underscorekeystore").toString();
    }

    @Provides
    @Singleton
    public Options options() {
        Options options = new Options();

        options.addOption("c", CONFIG, true, "Location for configuration file");
        options.addOption("k", KEYSTORE, true, "Keystore directory");
        options.addOption(null, SCHEME, true, "Signature scheme, ed25519 (default) or ecdsa");
        options.addOption("f", FORCE, false, "Replace an existing device key");
        options.addOption(null, SURI, true, "Derive the device key from a secret URI");
        options.addOption(null, PAPERKEY, false, "Restore the device key from a paper key");
        options.addOption(null, PASSWORD, true, "Keystore password");
        options.addOption(null, NEW_PASSWORD, true, "New keystore password");
        options.addOption("d", DEBUG, false, "Enable verbose debugging");

        return options;
    }

    @Provides
    @Singleton
    public CommandLine commandLine(Options options) throws ParseException {
        CommandLineParser parser = new DefaultParser();
        return parser.parse(options, argv);
    }

    @Provides
    @Named(DEBUG)
    public boolean debug(CommandLine commandLine) {
        return commandLine.hasOption(DEBUG);
    }

    @Provides
    @Singleton
    public KeystoreConfiguration keystoreConfiguration(CommandLine commandLine) throws IOException, ParseException {
        KeystoreConfiguration configuration;
        if (commandLine.hasOption(CONFIG)) {
            File file = new File(commandLine.getOptionValue(CONFIG));
            configuration = KEYSTORE_CONFIGURATION_READER.readValue(file);
            log.debug("Read configuration from {}", file);
        } else {
            configuration = new KeystoreConfiguration();
        }

        KeystoreConfiguration.KeystoreConfigurationBuilder builder = configuration.toBuilder();
        if (commandLine.hasOption(KEYSTORE)) {
            builder.keystorePath(commandLine.getOptionValue(KEYSTORE));
        }
        if (commandLine.hasOption(SCHEME)) {
            try {
                builder.signatureScheme(SignatureSchemes.fromName(commandLine.getOptionValue(SCHEME)));
            } catch (IllegalArgumentException exc) {
                throw new ParseException(exc.getMessage());
            }
        }
        return builder.build();
    }

    @Provides
    @Singleton
    @Named(KEYSTORE_LOCATION)
    public String keystoreLocation(KeystoreConfiguration configuration) {
        if (!Strings.isNullOrEmpty(configuration.getKeystorePath())) {
            return configuration.getKeystorePath();
        }
        return getDefaultKeystoreLocation();
    }
}
