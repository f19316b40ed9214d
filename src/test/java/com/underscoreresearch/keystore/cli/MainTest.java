package com.underscoreresearch.keystore.cli;

import static org.hamcrest.MatcherAssert.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.hamcrest.core.Is;
import org.hamcrest.core.IsNot;
import org.hamcrest.core.StringContains;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.underscoreresearch.keystore.utils.TestDirectories;

class MainTest {
    private PrintStream originalOut;
    private ByteArrayOutputStream output;
    private Path tempDir;
    private Path config;
    private Path keystoreDir;

    @BeforeEach
    public void setup() throws IOException {
        originalOut = System.out;
        tempDir = Files.createTempDirectory("cli");
        config = tempDir.resolve("config.json");
        Files.write(config, "{\"kdfIterations\":1,\"kdfMemory\":1024,\"kdfParallelism\":1}"
                .getBytes(StandardCharsets.UTF_8));
        keystoreDir = tempDir.resolve("keystore");
    }

    @AfterEach
    public void teardown() throws IOException {
        System.setOut(originalOut);
        TestDirectories.deleteRecursively(tempDir);
    }

    private int run(Path keystore, String... args) {
        output = new ByteArrayOutputStream();
        System.setOut(new PrintStream(output, true, StandardCharsets.UTF_8));
        List<String> argv = new ArrayList<>(List.of("--config", config.toString(),
                "--keystore", keystore.toString()));
        argv.addAll(Arrays.asList(args));
        try {
            return Main.run(argv.toArray(new String[0]));
        } finally {
            System.setOut(originalOut);
        }
    }

    private String lastLine() {
        String[] lines = output.toString(StandardCharsets.UTF_8).trim().split("\\R");
        return lines[lines.length - 1].trim();
    }

    @Test
    public void testKeyLifecycle() throws IOException {
        assertThat(run(keystoreDir, "--password", "correct-horse", "generate-key"), Is.is(Main.EXIT_OK));
        assertThat(lastLine(), StringContains.containsString("generation 1"));

        assertThat(run(keystoreDir, "--password", "correct-horse", "account"), Is.is(Main.EXIT_OK));
        String account = lastLine();
        assertThat(account.length(), Is.is(64));

        assertThat(run(keystoreDir, "generation"), Is.is(Main.EXIT_OK));
        assertThat(lastLine(), Is.is("1"));

        assertThat(run(keystoreDir, "--password", "correct-horse", "generate-key"), Is.is(Main.EXIT_FAILED));
        assertThat(run(keystoreDir, "--password", "wrong-horse", "account"), Is.is(Main.EXIT_FAILED));

        assertThat(run(keystoreDir, "--password", "correct-horse", "sign", "0xdeadbeef"), Is.is(Main.EXIT_OK));
        assertThat(lastLine().length(), Is.is(128));

        Path copyDir = tempDir.resolve("copy");
        TestDirectories.copyDirectory(keystoreDir, copyDir);

        assertThat(run(keystoreDir, "--password", "correct-horse", "--new-password", "battery-staple",
                "change-password"), Is.is(Main.EXIT_OK));
        String[] transition = lastLine().split(" ");
        assertThat(transition.length, Is.is(2));
        assertThat(transition[1], Is.is("2"));

        assertThat(run(copyDir, "apply-mask", transition[0], transition[1]), Is.is(Main.EXIT_OK));
        assertThat(run(copyDir, "apply-mask", transition[0], transition[1]), Is.is(Main.EXIT_FAILED));
        assertThat(run(copyDir, "--password", "correct-horse", "account"), Is.is(Main.EXIT_FAILED));
        assertThat(run(copyDir, "--password", "battery-staple", "account"), Is.is(Main.EXIT_OK));
        assertThat(lastLine(), Is.is(account));
    }

    @Test
    public void testRestoreFromSuri() {
        assertThat(run(keystoreDir, "--password", "correct-horse", "--suri", "//Alice", "generate-key"),
                Is.is(Main.EXIT_OK));
        assertThat(run(keystoreDir, "--password", "correct-horse", "account"), Is.is(Main.EXIT_OK));
        assertThat(lastLine(), Is.is("88dc3417d5058ec4b4503e0c12ea1a0a89be200fe98922423d4334014fa6b0ee"));

        assertThat(run(keystoreDir, "--password", "correct-horse", "--force", "generate-key"),
                Is.is(Main.EXIT_OK));
        assertThat(run(keystoreDir, "--password", "correct-horse", "account"), Is.is(Main.EXIT_OK));
        assertThat(lastLine(), IsNot.not("88dc3417d5058ec4b4503e0c12ea1a0a89be200fe98922423d4334014fa6b0ee"));
    }

    @Test
    public void testPasswordTooShort() {
        assertThat(run(keystoreDir, "--password", "short", "generate-key"), Is.is(Main.EXIT_FAILED));
        assertThat(Files.exists(keystoreDir.resolve("devicekey.json")), Is.is(false));
    }

    @Test
    public void testParseIdentifier() {
        assertThat(run(keystoreDir, "parse-identifier", "alice@github"), Is.is(Main.EXIT_OK));
        assertThat(lastLine(), Is.is("alice@github"));
        assertThat(run(keystoreDir, "parse-identifier", "alice@gitlab"), Is.is(Main.EXIT_FAILED));
        assertThat(run(keystoreDir, "parse-identifier"), Is.is(Main.EXIT_FAILED));
    }

    @Test
    public void testUnknownCommand() {
        assertThat(run(keystoreDir, "frobnicate"), Is.is(Main.EXIT_FAILED));
        assertThat(run(keystoreDir), Is.is(Main.EXIT_OK));
        assertThat(output.toString(StandardCharsets.UTF_8), StringContains.containsString("change-password"));
    }
}
