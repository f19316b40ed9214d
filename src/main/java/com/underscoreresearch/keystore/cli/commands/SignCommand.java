package com.underscoreresearch.keystore.cli.commands;

import static com.underscoreresearch.keystore.utils.EncodingUtils.decodeHex;
import static com.underscoreresearch.keystore.utils.EncodingUtils.encodeHex;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.ParseException;

import com.google.inject.Inject;
import com.underscoreresearch.keystore.cli.Command;
import com.underscoreresearch.keystore.cli.CommandPlugin;
import com.underscoreresearch.keystore.encryption.Password;
import com.underscoreresearch.keystore.store.Keystore;

@CommandPlugin(value = "sign", args = "<hex payload>", description = "Sign a payload with the device key")
public class SignCommand extends Command {
    private final Keystore keystore;

    @Inject
    public SignCommand(Keystore keystore) {
        this.keystore = keystore;
    }

    public void executeCommand(CommandLine commandLine) throws Exception {
        expectArguments(commandLine, 1);

        byte[] payload;
        try {
            payload = decodeHex(commandLine.getArgList().get(1));
        } catch (IllegalArgumentException exc) {
            throw new ParseException("Payload must be hex encoded");
        }

        Password password = readPassword(commandLine);
        try {
            keystore.unlock(password);
            System.out.println(encodeHex(keystore.sign(payload)));
        } finally {
            password.destroy();
            keystore.lock();
        }
    }
}
