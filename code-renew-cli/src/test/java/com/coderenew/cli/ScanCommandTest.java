package com.coderenew.cli;

import com.coderenew.CodeRenewCLI;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ScanCommand} run through the full command line.
 */
class ScanCommandTest {

    private static final String PLUGIN = """
        <?php
        function legacy_page() {
            $page = get_page(42);
            return $page;
        }
        """;

    @TempDir
    Path tempDir;

    private Path plugin;
    private Path config;

    @BeforeEach
    void setUp() throws IOException {
        plugin = Files.createDirectories(tempDir.resolve("my-plugin"));
        Files.writeString(plugin.resolve("plugin.php"), PLUGIN);
        config = tempDir.resolve("missing-config.yaml");
    }

    @Test
    void scan_offlineJsonReport_writesIssues() throws IOException {
        // Given
        Path out = tempDir.resolve("report.json");

        // When
        int exitCode = CodeRenewCLI.commandLine().execute(
            "scan", plugin.toString(), "--from", "5.9", "--to", "6.4",
            "--offline", "-c", config.toString(), "--format", "json", "-o", out.toString());

        // Then
        assertThat(exitCode).isZero();
        JsonNode report = new ObjectMapper().readTree(out.toFile());
        assertThat(report.path("status").asText()).isEqualTo("completed");
        assertThat(report.path("risk_level").asText()).isEqualTo("critical");
        assertThat(report.path("version_from").asText()).isEqualTo("5.9");
        assertThat(report.path("issues").toString()).contains("get_page");
        assertThat(report.path("statistics").path("files_processed").asInt()).isEqualTo(1);
    }

    @Test
    void scan_textFormat_rendersSummary() throws IOException {
        Path out = tempDir.resolve("report.txt");

        int exitCode = CodeRenewCLI.commandLine().execute(
            "scan", plugin.toString(), "--from", "5.9", "--to", "6.4",
            "--offline", "-c", config.toString(), "-o", out.toString());

        assertThat(exitCode).isZero();
        String text = Files.readString(out);
        assertThat(text)
            .contains("WordPress 5.9 -> 6.4")
            .contains("Risk level: CRITICAL")
            .contains("plugin.php:3");
    }

    @Test
    void scan_zipArchive_scansExtractedFiles() throws IOException {
        // Given
        Path archive = tempDir.resolve("my-plugin.zip");
        ZipFixtures.zip(archive, "my-plugin/plugin.php", PLUGIN);
        Path out = tempDir.resolve("report.json");

        // When
        int exitCode = CodeRenewCLI.commandLine().execute(
            "scan", archive.toString(), "--from", "5.9", "--to", "6.4",
            "--offline", "-c", config.toString(), "--format", "JSON", "-o", out.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(Files.readString(out)).contains("get_page");
    }

    @Test
    void scan_invertedRange_returnsUsageError() {
        int exitCode = CodeRenewCLI.commandLine().execute(
            "scan", plugin.toString(), "--from", "6.4", "--to", "5.9", "--offline", "-c", config.toString());

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void scan_missingRange_returnsUsageError() {
        int exitCode = CodeRenewCLI.commandLine().execute("scan", plugin.toString(), "--offline");

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void scan_missingDirectory_returnsFailure() {
        Path out = tempDir.resolve("report.json");

        int exitCode = CodeRenewCLI.commandLine().execute(
            "scan", tempDir.resolve("nope").toString(), "--from", "5.9", "--to", "6.4",
            "--offline", "-c", config.toString(), "--format", "json", "-o", out.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out).exists();
    }
}
