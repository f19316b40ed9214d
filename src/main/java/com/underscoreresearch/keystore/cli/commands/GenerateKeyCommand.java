package com.underscoreresearch.keystore.cli.commands;

import static com.underscoreresearch.keystore.configuration.CommandLineModule.FORCE;
import static com.underscoreresearch.keystore.configuration.CommandLineModule.PAPERKEY;
import static com.underscoreresearch.keystore.configuration.CommandLineModule.SURI;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.ParseException;

import com.google.inject.Inject;
import com.underscoreresearch.keystore.cli.Command;
import com.underscoreresearch.keystore.cli.CommandPlugin;
import com.underscoreresearch.keystore.cli.PasswordReader;
import com.underscoreresearch.keystore.encryption.Password;
import com.underscoreresearch.keystore.errors.HasDeviceKeyException;
import com.underscoreresearch.keystore.keys.AccountId;
import com.underscoreresearch.keystore.keys.KeyHandle;
import com.underscoreresearch.keystore.store.Keystore;

@CommandPlugin(value = "generate-key", description = "Generate a new device key or restore one from a paper key or secret URI")
public class GenerateKeyCommand extends Command {
    private final Keystore keystore;

    @Inject
    public GenerateKeyCommand(Keystore keystore) {
        this.keystore = keystore;
    }

    public void executeCommand(CommandLine commandLine) throws Exception {
        expectArguments(commandLine, 0);
        if (commandLine.hasOption(SURI) && commandLine.hasOption(PAPERKEY)) {
            throw new ParseException("Only one of --suri and --paperkey can be specified");
        }

        boolean force = commandLine.hasOption(FORCE);
        if (!force && keystore.hasDeviceKey()) {
            throw new HasDeviceKeyException();
        }

        KeyHandle key = importedKey(commandLine);
        Password password = readNewPassword(commandLine);
        try {
            AccountId accountId;
            if (key != null) {
                accountId = keystore.setDeviceKey(key, password, force);
            } else {
                accountId = keystore.provisionDevice(password, keystore.gen(), force);
            }
            System.out.println("Device key " + accountId + " stored at generation " + keystore.gen());
        } finally {
            password.destroy();
            if (key != null) {
                key.destroy();
            }
            keystore.lock();
        }
    }

    private KeyHandle importedKey(CommandLine commandLine) throws Exception {
        if (commandLine.hasOption(SURI)) {
            return KeyHandle.fromSuri(keystore.getScheme(), commandLine.getOptionValue(SURI));
        }
        if (commandLine.hasOption(PAPERKEY)) {
            String phrase = PasswordReader.readSecretLine("Please enter the paper key: ");
            if (phrase == null) {
                throw new IllegalArgumentException("No paper key provided.");
            }
            return KeyHandle.fromMnemonic(keystore.getScheme(), phrase);
        }
        return null;
    }
}
