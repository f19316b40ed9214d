package com.underscoreresearch.keystore.cli.commands;

import org.apache.commons.cli.CommandLine;

import com.google.inject.Inject;
import com.underscoreresearch.keystore.cli.Command;
import com.underscoreresearch.keystore.cli.CommandPlugin;
import com.underscoreresearch.keystore.encryption.Password;
import com.underscoreresearch.keystore.store.Keystore;

@CommandPlugin(value = "account", description = "Print the account id of the device key")
public class AccountCommand extends Command {
    private final Keystore keystore;

    @Inject
    public AccountCommand(Keystore keystore) {
        this.keystore = keystore;
    }

    public void executeCommand(CommandLine commandLine) throws Exception {
        expectArguments(commandLine, 0);

        Password password = readPassword(commandLine);
        try {
            keystore.unlock(password);
            System.out.println(keystore.accountId());
        } finally {
            password.destroy();
            keystore.lock();
        }
    }
}
