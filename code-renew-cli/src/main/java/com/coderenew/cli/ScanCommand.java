package com.coderenew.cli;

import com.coderenew.core.CodeRenewEngine;
import com.coderenew.core.model.ScanIssue;
import com.coderenew.core.model.Severity;
import com.coderenew.core.scan.ScanOrchestrator;
import com.coderenew.core.scan.ScanReport;
import com.coderenew.core.scan.ScanStatistics;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

/**
 * Command to scan a plugin or theme for compatibility issues.
 *
 * <p>Accepts a directory or a zip archive. Archives are extracted into a temporary
 * directory that is removed afterwards.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Scan a directory
 * coderenew scan ./my-plugin --from 5.9 --to 6.4
 *
 * # Static analysis only, JSON report to a file
 * coderenew scan my-plugin.zip --from 5.9 --to 6.4 --static-only --format json -o report.json
 * }</pre>
 */
@Command(
    name = "scan",
    description = "Scan a plugin or theme directory or zip archive for compatibility issues",
    mixinStandardHelpOptions = true
)
public class ScanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ScanCommand.class);

    @Parameters(
        index = "0",
        description = "Plugin/theme directory or zip archive (default: current directory)",
        defaultValue = "."
    )
    private Path target;

    @Mixin
    private EngineOptions options;

    @Option(names = "--static-only", description = "Skip AI analysis and run the static pass only")
    private boolean staticOnly;

    @Option(names = "--format", description = "Report format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "text")
    private ReportFormat format;

    @Option(names = {"-o", "--output"}, description = "Write the report to this file instead of standard output")
    private Path output;

    @Override
    public Integer call() {
        options.validateRange();
        log.info("Starting scan of: {}", target.toAbsolutePath());

        try (CodeRenewEngine engine = CodeRenewEngine.create(options.loadConfiguration(), staticOnly, options.offline)) {
            ScanOrchestrator orchestrator = engine.getOrchestrator();
            if (orchestrator.isStaticOnly()) {
                System.err.println("Running static analysis only");
            }

            ScanReport report = isArchive(target)
                ? scanArchive(orchestrator)
                : orchestrator.scanDirectory(target, options.versionFrom, options.versionTo);

            writeReport(report);
            if (!report.isCompleted()) {
                System.err.println("✗ Scan failed: " + report.failureReason());
                return 1;
            }
            System.err.println("✓ Scan complete: " + report.issues().size() + " issues, risk "
                + report.riskLevel().wireName());
            return 0;
        } catch (IOException e) {
            log.error("Scan failed", e);
            System.err.println("✗ Scan failed: " + e.getMessage());
            return 1;
        }
    }

    private ScanReport scanArchive(ScanOrchestrator orchestrator) throws IOException {
        Path workDirectory = Files.createTempDirectory("coderenew-");
        try {
            return orchestrator.scanArchive(target, workDirectory, options.versionFrom, options.versionTo);
        } finally {
            deleteRecursively(workDirectory);
        }
    }

    private void writeReport(ScanReport report) throws IOException {
        String rendered = format == ReportFormat.JSON ? renderJson(report) : renderText(report);
        if (output != null) {
            Files.writeString(output, rendered, StandardCharsets.UTF_8);
            System.err.println("✓ Report written to: " + output.toAbsolutePath());
        } else {
            System.out.print(rendered);
        }
    }

    static String renderJson(Object value) throws IOException {
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        return mapper.writeValueAsString(value) + System.lineSeparator();
    }

    static String renderText(ScanReport report) {
        StringBuilder text = new StringBuilder();
        text.append("CodeRenew scan ").append(report.scanId()).append('\n');
        text.append("WordPress ").append(report.versionFrom()).append(" -> ").append(report.versionTo()).append('\n');
        text.append("Status: ").append(report.status().wireName()).append('\n');
        text.append("Risk level: ").append(report.riskLevel().wireName().toUpperCase(Locale.ROOT)).append('\n');
        text.append('\n');

        ScanStatistics stats = report.statistics();
        text.append(stats.getSummary()).append('\n');
        if (!stats.topErrors().isEmpty()) {
            text.append("Errors:\n");
            stats.topErrors().forEach(error -> text.append("  - ").append(error).append('\n'));
        }
        text.append('\n');

        List<ScanIssue> issues = report.issues().stream()
            .sorted(Comparator.comparing(ScanIssue::severity).thenComparing(ScanIssue::filePath))
            .toList();
        if (issues.isEmpty()) {
            text.append("No issues found.\n");
            return text.toString();
        }

        text.append("Issues (").append(issues.size()).append("):\n");
        for (Severity severity : Severity.values()) {
            long count = report.countBySeverity(severity);
            if (count > 0) {
                text.append("  ").append(severity.wireName()).append(": ").append(count).append('\n');
            }
        }
        text.append('\n');

        for (ScanIssue issue : issues) {
            text.append("[").append(issue.severity().wireName().toUpperCase(Locale.ROOT)).append("] ")
                .append(issue.filePath());
            if (issue.line() != null) {
                text.append(':').append(issue.line());
            }
            text.append(" (").append(issue.issueType()).append(", ").append(issue.source().wireName()).append(")\n");
            text.append("    ").append(issue.description()).append('\n');
            if (!issue.recommendation().isBlank()) {
                text.append("    Fix: ").append(issue.recommendation()).append('\n');
            }
        }
        return text.toString();
    }

    private static boolean isArchive(Path path) {
        Path fileName = path.getFileName();
        return Files.isRegularFile(path) && fileName != null
            && fileName.toString().toLowerCase(Locale.ROOT).endsWith(".zip");
    }

    private static void deleteRecursively(Path directory) {
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("Could not delete {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not clean up {}: {}", directory, e.getMessage());
        }
    }

    /**
     * Report output formats.
     */
    public enum ReportFormat {
        TEXT,
        JSON
    }
}
