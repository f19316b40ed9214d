package com.underscoreresearch.keystore.cli.commands;

import static com.underscoreresearch.keystore.configuration.CommandLineModule.NEW_PASSWORD;

import lombok.extern.slf4j.Slf4j;

import org.apache.commons.cli.CommandLine;

import com.google.inject.Inject;
import com.underscoreresearch.keystore.cli.Command;
import com.underscoreresearch.keystore.cli.CommandPlugin;
import com.underscoreresearch.keystore.encryption.Password;
import com.underscoreresearch.keystore.store.Keystore;
import com.underscoreresearch.keystore.store.MaskTransition;

@Slf4j
@CommandPlugin(value = "change-password", description = "Change the password of the device key and print the mask for other copies")
public class ChangePasswordCommand extends Command {
    private final Keystore keystore;

    @Inject
    public ChangePasswordCommand(Keystore keystore) {
        this.keystore = keystore;
    }

    public void executeCommand(CommandLine commandLine) throws Exception {
        expectArguments(commandLine, 0);

        Password oldPassword = readPassword(commandLine);
        MaskTransition transition;
        try {
            keystore.unlock(oldPassword);
        } finally {
            oldPassword.destroy();
        }

        try {
            Password newPassword = readNewPassword(commandLine, NEW_PASSWORD);
            try {
                transition = keystore.changePasswordMask(newPassword);
            } finally {
                newPassword.destroy();
            }

            keystore.applyMask(transition.getMask(), transition.getNextGeneration());
            System.out.println(transition.getMask().encode() + " " + transition.getNextGeneration());
            log.info("Apply the mask above to every other copy of this keystore with apply-mask");
        } finally {
            keystore.lock();
        }
        transition.getMask().destroy();
    }
}
