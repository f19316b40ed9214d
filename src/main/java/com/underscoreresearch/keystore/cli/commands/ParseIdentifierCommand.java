package com.underscoreresearch.keystore.cli.commands;

import org.apache.commons.cli.CommandLine;

import com.underscoreresearch.keystore.cli.Command;
import com.underscoreresearch.keystore.cli.CommandPlugin;
import com.underscoreresearch.keystore.identity.ServiceIdentifier;

@CommandPlugin(value = "parse-identifier", args = "<username@service>", description = "Validate an external service identifier")
public class ParseIdentifierCommand extends Command {
    public void executeCommand(CommandLine commandLine) throws Exception {
        expectArguments(commandLine, 1);
        ServiceIdentifier identifier = ServiceIdentifier.parse(commandLine.getArgList().get(1));
        System.out.println(identifier);
    }
}
