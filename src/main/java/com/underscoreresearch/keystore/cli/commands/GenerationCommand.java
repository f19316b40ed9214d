package com.underscoreresearch.keystore.cli.commands;

import org.apache.commons.cli.CommandLine;

import com.google.inject.Inject;
import com.underscoreresearch.keystore.cli.Command;
import com.underscoreresearch.keystore.cli.CommandPlugin;
import com.underscoreresearch.keystore.store.Keystore;

@CommandPlugin(value = "generation", description = "Print the password generation of the keystore")
public class GenerationCommand extends Command {
    private final Keystore keystore;

    @Inject
    public GenerationCommand(Keystore keystore) {
        this.keystore = keystore;
    }

    public void executeCommand(CommandLine commandLine) throws Exception {
        expectArguments(commandLine, 0);
        System.out.println(keystore.gen());
    }
}
