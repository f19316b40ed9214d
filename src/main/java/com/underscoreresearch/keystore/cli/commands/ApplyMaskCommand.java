package com.underscoreresearch.keystore.cli.commands;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.ParseException;

import com.google.inject.Inject;
import com.underscoreresearch.keystore.cli.Command;
import com.underscoreresearch.keystore.cli.CommandPlugin;
import com.underscoreresearch.keystore.encryption.Mask;
import com.underscoreresearch.keystore.store.GenerationCounter;
import com.underscoreresearch.keystore.store.Keystore;

@CommandPlugin(value = "apply-mask", args = "<mask> <generation>", description = "Apply a password change made on another copy of the keystore")
public class ApplyMaskCommand extends Command {
    private final Keystore keystore;

    @Inject
    public ApplyMaskCommand(Keystore keystore) {
        this.keystore = keystore;
    }

    public void executeCommand(CommandLine commandLine) throws Exception {
        expectArguments(commandLine, 2);

        Mask mask;
        GenerationCounter generation;
        try {
            mask = Mask.decode(commandLine.getArgList().get(1));
            generation = GenerationCounter.parse(commandLine.getArgList().get(2));
        } catch (IllegalArgumentException exc) {
            throw new ParseException(exc.getMessage());
        }

        try {
            keystore.applyMask(mask, generation);
        } finally {
            mask.destroy();
        }
        System.out.println("Keystore is now at generation " + keystore.gen());
    }
}
