package com.underscoreresearch.keystore.cli;

import static com.underscoreresearch.keystore.configuration.CommandLineModule.DEBUG;

import lombok.extern.slf4j.Slf4j;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.ProvisionException;
import com.google.inject.name.Names;
import com.underscoreresearch.keystore.configuration.CommandLineModule;
import com.underscoreresearch.keystore.configuration.KeystoreModule;
import com.underscoreresearch.keystore.errors.KeystoreException;
import com.underscoreresearch.keystore.identity.ServiceParseException;

@Slf4j
public final class Main {
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_FATAL = 2;

    private Main() {
    }

    public static void help(Options options) {
        HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp("underscore-keystore [OPTION]... [COMMAND]...\n ", options);
        System.out.println();
        System.out.println("Commands:");

        for (Class<? extends Command> command : Command.allCommandClasses()) {
            System.out.println();
            System.out.println(Command.name(command) + " " + Command.args(command));
            System.out.println("\t" + Command.description(command));
        }

        System.out.println();
    }

    public static void main(String[] argv) {
        System.exit(run(argv));
    }

    public static int run(String[] argv) {
        Injector injector = Guice.createInjector(new CommandLineModule(argv), new KeystoreModule());
        Options options = injector.getInstance(Options.class);

        try {
            CommandLine commandLine = injector.getInstance(CommandLine.class);
            if (injector.getInstance(Key.get(Boolean.class, Names.named(DEBUG)))) {
                Configurator.setRootLevel(Level.DEBUG);
            }

            if (commandLine.getArgList().isEmpty()) {
                help(options);
                return EXIT_OK;
            }

            Class<? extends Command> command = Command.findCommandClass(commandLine.getArgList().get(0));
            if (command == null) {
                System.out.println("Unknown command: " + commandLine.getArgList().get(0));
                System.out.println();
                help(options);
                return EXIT_FAILED;
            }

            Command commandInstance = injector.getInstance(command);
            commandInstance.executeCommand(commandLine);
            return EXIT_OK;
        } catch (Exception exc) {
            Throwable cause = exc;
            if (cause instanceof ProvisionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof ParseException) {
                System.err.println(cause.getMessage());
                System.err.println();
                help(options);
                return EXIT_FAILED;
            }
            if (cause instanceof KeystoreException
                    || cause instanceof ServiceParseException
                    || cause instanceof IllegalArgumentException) {
                log.debug("Command failed", cause);
                System.err.println(cause.getMessage());
                return EXIT_FAILED;
            }
            log.error("Fatal exception", exc);
            return EXIT_FATAL;
        }
    }
}
