package com.underscoreresearch.keystore.cli;

import static com.underscoreresearch.keystore.configuration.CommandLineModule.NEW_PASSWORD;
import static com.underscoreresearch.keystore.configuration.CommandLineModule.PASSWORD;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.ParseException;
import org.reflections.Reflections;

import com.underscoreresearch.keystore.encryption.Password;

public abstract class Command {
    public static final int MINIMUM_PASSWORD_LENGTH = 8;
    private static final Reflections REFLECTIONS = new Reflections("com.underscoreresearch.keystore.cli.commands");

    public static String args(Class<? extends Command> clz) {
        CommandPlugin plugin = clz.getAnnotation(CommandPlugin.class);
        if (plugin != null)
            return plugin.args();
        return null;
    }

    public static String name(Class<? extends Command> clz) {
        CommandPlugin plugin = clz.getAnnotation(CommandPlugin.class);
        if (plugin != null)
            return plugin.value();
        return null;
    }

    public static String description(Class<? extends Command> clz) {
        CommandPlugin plugin = clz.getAnnotation(CommandPlugin.class);
        if (plugin != null)
            return plugin.description();
        return null;
    }

    @SuppressWarnings("unchecked")
    public static List<Class<? extends Command>> allCommandClasses() {
        List<Class<? extends Command>> commands = new ArrayList<>();

        REFLECTIONS.getTypesAnnotatedWith(CommandPlugin.class).stream()
                .map(t -> (Class<? extends Command>) t).forEach(commands::add);
        commands.sort(Comparator.comparing(Command::name));
        return commands;
    }

    public static Class<? extends Command> findCommandClass(String name) {
        for (Class<? extends Command> command : Command.allCommandClasses()) {
            if (Command.name(command).equals(name)) {
                return command;
            }
        }
        return null;
    }

    protected static void expectArguments(CommandLine commandLine, int count) throws ParseException {
        if (commandLine.getArgList().size() < count + 1) {
            throw new ParseException("Missing argument for command");
        }
        if (commandLine.getArgList().size() > count + 1) {
            throw new ParseException("Too many arguments for command");
        }
    }

    /**
     * The current keystore password, from the command line if given.
     */
    protected static Password readPassword(CommandLine commandLine) throws IOException {
        if (commandLine.hasOption(PASSWORD)) {
            return new Password(commandLine.getOptionValue(PASSWORD));
        }
        Password password = PasswordReader.readPassword("Please enter the keystore password: ");
        if (password == null) {
            throw new IllegalArgumentException("No password provided.");
        }
        return password;
    }

    /**
     * A password about to be set, entered twice unless given on the command line.
     */
    protected static Password readNewPassword(CommandLine commandLine, String option) throws IOException {
        Password firstTry;
        if (commandLine.hasOption(option)) {
            firstTry = new Password(commandLine.getOptionValue(option));
        } else {
            firstTry = PasswordReader.readPassword("Please enter the new keystore password: ");
            if (firstTry == null) {
                throw new IllegalArgumentException("No password provided.");
            }
            Password secondTry = PasswordReader.readPassword("Reenter the new keystore password: ");
            try {
                if (secondTry == null || !firstTry.matches(secondTry)) {
                    firstTry.destroy();
                    throw new IllegalArgumentException("Passwords don't match.");
                }
            } finally {
                if (secondTry != null) {
                    secondTry.destroy();
                }
            }
        }
        if (firstTry.length() < MINIMUM_PASSWORD_LENGTH) {
            firstTry.destroy();
            throw new IllegalArgumentException("Password too short.");
        }
        return firstTry;
    }

    protected static Password readNewPassword(CommandLine commandLine) throws IOException {
        return readNewPassword(commandLine, commandLine.hasOption(NEW_PASSWORD) ? NEW_PASSWORD : PASSWORD);
    }

    public abstract void executeCommand(CommandLine commandLine) throws Exception;

    public String name() {
        return name(this.getClass());
    }

    public String description() {
        return description(this.getClass());
    }
}
