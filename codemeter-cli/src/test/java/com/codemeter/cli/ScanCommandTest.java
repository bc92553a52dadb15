package com.codemeter.cli;

import com.codemeter.CodeMeterCLI;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ScanCommand}.
 */
class ScanCommandTest {

    @TempDir
    Path tempDir;

    private final PrintStream originalOut = System.out;
    private ByteArrayOutputStream outputStream;

    @BeforeEach
    void setUp() throws IOException {
        outputStream = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outputStream, true, StandardCharsets.UTF_8));

        Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(tempDir.resolve("src/App.java"), "// app\nclass App {}\n");
        Files.writeString(tempDir.resolve("build.py"), "# build\n\nrun()\n");
        Files.writeString(tempDir.resolve("LICENSE"), "MIT\n");
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    private int execute(String... args) {
        return CodeMeterCLI.commandLine().execute(args);
    }

    private String output() {
        return outputStream.toString(StandardCharsets.UTF_8);
    }

    @Test
    void scan_consoleReport_listsLanguagesAndTotals() {
        int exitCode = execute("-q", "scan", tempDir.toString(), "--no-color");

        assertThat(exitCode).isZero();
        String text = output();
        assertThat(text).containsPattern("Java\\s+1\\s+0\\s+1\\s+1\\s+2");
        assertThat(text).containsPattern("Python\\s+1\\s+1\\s+1\\s+1\\s+3");
        assertThat(text).containsPattern("Total:\\s+2\\s+1\\s+2\\s+2\\s+5");
        assertThat(text).contains("Ignored 1 files");
    }

    @Test
    void scan_jsonFormat_printsJson() throws IOException {
        int exitCode = execute("-q", "scan", tempDir.toString(), "-f", "json", "--backend", "pool", "-j", "2");

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(output());
        assertThat(json.get("backend").asText()).isEqualTo("pool");
        assertThat(json.get("totals").get("files").asLong()).isEqualTo(2);
    }

    @Test
    void scan_noRecurse_skipsSubdirectories() throws IOException {
        int exitCode = execute("-q", "scan", tempDir.toString(), "--no-recurse", "-f", "json", "--backend", "sync");

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(output());
        assertThat(json.get("languages")).hasSize(1);
        assertThat(json.get("languages").get(0).get("language").asText()).isEqualTo("Python");
    }

    @Test
    void scan_configFileInRoot_isApplied() throws IOException {
        Files.writeString(tempDir.resolve("codemeter.yaml"), """
            revision:
              backend: sync
            output:
              format: json
            """);

        int exitCode = execute("-q", "scan", tempDir.toString());

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(output());
        assertThat(json.get("backend").asText()).isEqualTo("sync");
    }

    @Test
    void scan_commandLineOverridesConfigFile() throws IOException {
        Path config = tempDir.resolve("custom.yaml");
        Files.writeString(config, """
            revision:
              backend: pool
              workerThreadCount: 2
            output:
              format: json
            """);

        int exitCode = execute("-q", "scan", tempDir.toString(), "-c", config.toString(), "--backend", "SYNC");

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(output());
        assertThat(json.get("backend").asText()).isEqualTo("sync");
    }

    @Test
    void scan_missingDirectory_failsWithExitCodeOne() {
        int exitCode = execute("-q", "scan", tempDir.resolve("missing").toString(), "--no-color");

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void scan_negativeThreads_failsWithExitCodeOne() {
        int exitCode = execute("-q", "scan", tempDir.toString(), "-j", "-1");

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void scan_unknownFormat_failsWithExitCodeOne() {
        int exitCode = execute("-q", "scan", tempDir.toString(), "-f", "pdf");

        assertThat(exitCode).isEqualTo(1);
        assertThat(output()).isEmpty();
    }
}
