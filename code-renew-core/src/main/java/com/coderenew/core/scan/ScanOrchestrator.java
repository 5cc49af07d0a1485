package com.coderenew.core.scan;

import com.coderenew.core.ai.AiIssue;
import com.coderenew.core.ai.AnalysisClient;
import com.coderenew.core.ai.AnalysisFile;
import com.coderenew.core.ai.BatchAnalysis;
import com.coderenew.core.ai.StructuredOutput;
import com.coderenew.core.analyzer.StaticAnalyzer;
import com.coderenew.core.config.CodeRenewConfig.PricingConfig;
import com.coderenew.core.exception.CodeRenewException;
import com.coderenew.core.exception.ScanException;
import com.coderenew.core.model.ChangeType;
import com.coderenew.core.model.DeprecatedUsage;
import com.coderenew.core.model.FileTokenCount;
import com.coderenew.core.model.IssueSource;
import com.coderenew.core.model.OptimizationResult;
import com.coderenew.core.model.OverflowRisk;
import com.coderenew.core.model.PatternFinding;
import com.coderenew.core.model.RiskLevel;
import com.coderenew.core.model.ScanIssue;
import com.coderenew.core.model.SecurityFinding;
import com.coderenew.core.model.Severity;
import com.coderenew.core.model.TokenEstimate;
import com.coderenew.core.optimizer.TokenBudgetOptimizer;
import com.coderenew.core.util.PhpPatterns;
import com.coderenew.core.version.WordPressVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Top-level coordinator of a compatibility scan.
 *
 * <p><b>Pipeline:</b></p>
 * <ol>
 *   <li>Admit source files that exist, are not skip-listed, empty or third-party</li>
 *   <li>Run the static pass over every admitted file</li>
 *   <li>Order files by priority and partition them with {@link BatchPlanner}</li>
 *   <li>Optimize each batch's content and send it to {@link AnalysisClient}</li>
 *   <li>Tag and attribute AI issues, deduplicate, roll up the risk level</li>
 * </ol>
 *
 * <p>Batches run sequentially. A failing batch is logged and counted, and the scan
 * moves on; only failures outside the batch loop (such as an unreadable archive)
 * drive the session to {@link ScanStatus#FAILED}. Without an {@link AnalysisClient}
 * the orchestrator runs the static pass only.
 *
 * @since 1.0.0
 */
public class ScanOrchestrator {

    static final Set<String> SOURCE_EXTENSIONS = Set.of("php", "inc", "js");
    static final int TOP_FILES = 10;
    static final String TRUNCATION_MARKER = "\n// [code-renew] truncated: file exceeds the batch token ceiling";

    private static final Logger log = LoggerFactory.getLogger(ScanOrchestrator.class);
    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000);
    private static final Comparator<SourceFile> BY_PRIORITY = Comparator.comparingInt(SourceFile::priority).reversed();

    private final TokenBudgetOptimizer optimizer;
    private final StaticAnalyzer analyzer;
    private final AnalysisClient analysisClient;
    private final BatchPlanner planner;
    private final PricingConfig pricing;
    private final ArchiveExtractor archiveExtractor;

    /**
     * Creates an orchestrator.
     *
     * @param optimizer token counting, skip decisions and code shrinking
     * @param analyzer static pass
     * @param analysisClient analysis service client, or null for static-only scans
     * @param planner batch partitioning
     * @param pricing token prices for estimates
     */
    public ScanOrchestrator(
        TokenBudgetOptimizer optimizer,
        StaticAnalyzer analyzer,
        AnalysisClient analysisClient,
        BatchPlanner planner,
        PricingConfig pricing
    ) {
        this.optimizer = Objects.requireNonNull(optimizer, "optimizer must not be null");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        this.analysisClient = analysisClient;
        this.planner = Objects.requireNonNull(planner, "planner must not be null");
        this.pricing = Objects.requireNonNull(pricing, "pricing must not be null");
        this.archiveExtractor = new ArchiveExtractor();
    }

    public boolean isStaticOnly() {
        return analysisClient == null;
    }

    /**
     * Scans a list of files.
     *
     * @param files files to scan
     * @param versionFrom version upgrading from
     * @param versionTo version upgrading to
     * @return scan report
     */
    public ScanReport scan(List<Path> files, String versionFrom, String versionTo) {
        return scan(ScanSession.create(versionFrom, versionTo), files);
    }

    /**
     * Scans a list of files within an existing session, which lets the caller cancel it.
     *
     * @param session pending session
     * @param files files to scan
     * @return scan report
     * @throws IllegalStateException if the session is not pending
     */
    public ScanReport scan(ScanSession session, List<Path> files) {
        return execute(session, null, () -> List.copyOf(files));
    }

    /**
     * Scans every source file under a directory.
     *
     * @param root plugin or theme directory
     * @param versionFrom version upgrading from
     * @param versionTo version upgrading to
     * @return scan report; failed if the directory cannot be walked
     */
    public ScanReport scanDirectory(Path root, String versionFrom, String versionTo) {
        return scanDirectory(ScanSession.create(versionFrom, versionTo), root);
    }

    public ScanReport scanDirectory(ScanSession session, Path root) {
        return execute(session, root, () -> collectSourceFiles(root));
    }

    /**
     * Extracts a zip archive into a working directory and scans its source files.
     *
     * @param archive plugin or theme zip
     * @param workDirectory directory to extract into
     * @param versionFrom version upgrading from
     * @param versionTo version upgrading to
     * @return scan report; failed if the archive cannot be extracted
     */
    public ScanReport scanArchive(Path archive, Path workDirectory, String versionFrom, String versionTo) {
        return scanArchive(ScanSession.create(versionFrom, versionTo), archive, workDirectory);
    }

    public ScanReport scanArchive(ScanSession session, Path archive, Path workDirectory) {
        return execute(session, workDirectory, () -> {
            archiveExtractor.extract(archive, workDirectory);
            return collectSourceFiles(workDirectory);
        });
    }

    /**
     * Projects tokens, batches and cost without calling the analysis service.
     *
     * @param files files that would be scanned
     * @param versionFrom version upgrading from
     * @param versionTo version upgrading to
     * @return estimate
     */
    public TokenEstimate estimate(List<Path> files, String versionFrom, String versionTo) {
        log.debug("Estimating {} files for {} -> {}", files.size(), versionFrom, versionTo);
        return estimate(null, files);
    }

    /**
     * Projects tokens, batches and cost for every source file under a directory.
     *
     * @param root plugin or theme directory
     * @param versionFrom version upgrading from
     * @param versionTo version upgrading to
     * @return estimate
     * @throws IOException if the directory cannot be walked
     */
    public TokenEstimate estimateDirectory(Path root, String versionFrom, String versionTo) throws IOException {
        log.debug("Estimating {} for {} -> {}", root, versionFrom, versionTo);
        return estimate(root, collectSourceFiles(root));
    }

    private TokenEstimate estimate(Path root, List<Path> files) {
        List<SourceFile> admitted = new ArrayList<>();
        for (Path file : files) {
            String displayPath = displayPath(root, file);
            if (!isSourceFile(file) || !Files.isRegularFile(file) || optimizer.shouldSkipFile(Path.of(displayPath))) {
                continue;
            }
            try {
                String content = readContent(file);
                if (content.isBlank() || optimizer.isThirdPartyCode(content)) {
                    continue;
                }
                int priority = analyzer.getFilePriority(Path.of(displayPath));
                admitted.add(new SourceFile(file, displayPath, Files.size(file), optimizer.countTokens(content), priority));
            } catch (IOException e) {
                log.debug("Not estimating unreadable file {}: {}", file, e.getMessage());
            }
        }
        admitted.sort(BY_PRIORITY);

        long totalTokens = admitted.stream().mapToLong(SourceFile::estimatedTokens).sum();
        List<FileTokenCount> topFiles = admitted.stream()
            .sorted(Comparator.comparingInt(SourceFile::estimatedTokens).reversed())
            .limit(TOP_FILES)
            .map(file -> new FileTokenCount(file.displayPath(), file.estimatedTokens()))
            .toList();

        return new TokenEstimate(
            admitted.size(),
            totalTokens,
            planner.estimateBatchCount(admitted),
            estimateCost(totalTokens),
            OverflowRisk.of(totalTokens, planner.getMaxTokens()),
            topFiles
        );
    }

    /**
     * Lists the source files under a directory in path order.
     *
     * @param root directory to walk
     * @return regular files with a source extension
     * @throws IOException if the directory cannot be walked
     */
    public List<Path> collectSourceFiles(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new ScanException("Not a directory: " + root);
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                .filter(ScanOrchestrator::isSourceFile)
                .sorted()
                .collect(Collectors.toList());
        }
    }

    double estimateCost(long totalTokens) {
        BigDecimal tokens = BigDecimal.valueOf(totalTokens);
        BigDecimal input = tokens.multiply(BigDecimal.valueOf(pricing.inputCostPerMillionTokens()));
        BigDecimal output = tokens.multiply(BigDecimal.valueOf(pricing.expectedOutputRatio()))
            .multiply(BigDecimal.valueOf(pricing.outputCostPerMillionTokens()));
        return input.add(output).divide(MILLION, 2, RoundingMode.HALF_UP).doubleValue();
    }

    private ScanReport execute(ScanSession session, Path root, InputCollector collector) {
        session.transitionTo(ScanStatus.PROCESSING);
        log.info("Starting scan {} ({} -> {}){}", session.getId(), session.getVersionFrom(), session.getVersionTo(),
            isStaticOnly() ? " in static-only mode" : "");

        ScanStatistics.Builder stats = new ScanStatistics.Builder();
        try {
            List<Path> files = collector.collect();
            List<ScanIssue> issues = run(session, root, files, stats);
            RiskLevel risk = ScanReport.riskOf(issues);
            session.transitionTo(ScanStatus.COMPLETED);

            ScanStatistics snapshot = stats.build();
            log.info("Scan {} completed: {} issues, risk {}", session.getId(), issues.size(), risk.wireName());
            log.info("Scan {} statistics: {}", session.getId(), snapshot.getSummary());
            return new ScanReport(session.getId(), ScanStatus.COMPLETED, session.getVersionFrom(),
                session.getVersionTo(), risk, issues, snapshot, null);
        } catch (IOException | UncheckedIOException | CodeRenewException e) {
            log.error("Scan {} failed: {}", session.getId(), e.getMessage());
            session.fail(e.getMessage());
            return new ScanReport(session.getId(), ScanStatus.FAILED, session.getVersionFrom(),
                session.getVersionTo(), RiskLevel.UNKNOWN, List.of(), stats.build(), e.getMessage());
        }
    }

    private List<ScanIssue> run(ScanSession session, Path root, List<Path> files, ScanStatistics.Builder stats) {
        stats.filesDiscovered(files.size());
        analyzer.loadRange(session.getVersionFrom(), session.getVersionTo());

        List<ScanIssue> staticIssues = new ArrayList<>();
        List<SourceFile> admitted = new ArrayList<>();
        for (Path file : files) {
            admit(file, displayPath(root, file), session.getVersionTo(), stats, staticIssues)
                .ifPresent(admitted::add);
        }
        admitted.sort(BY_PRIORITY);
        stats.staticIssues(staticIssues.size());
        log.info("Static pass: {} files admitted, {} issues", admitted.size(), staticIssues.size());

        List<ScanIssue> aiIssues = new ArrayList<>();
        if (analysisClient == null) {
            log.info("No analysis client configured, skipping AI analysis");
        } else if (!admitted.isEmpty()) {
            aiIssues = analyzeBatches(session, admitted, stats);
        }
        stats.aiIssues(aiIssues.size());

        Map<String, ScanIssue> merged = new LinkedHashMap<>();
        Stream.concat(staticIssues.stream(), aiIssues.stream())
            .forEach(issue -> merged.putIfAbsent(issue.deduplicationKey(), issue));
        return new ArrayList<>(merged.values());
    }

    private Optional<SourceFile> admit(
        Path file,
        String displayPath,
        String versionTo,
        ScanStatistics.Builder stats,
        List<ScanIssue> issues
    ) {
        if (!isSourceFile(file) || optimizer.shouldSkipFile(Path.of(displayPath))) {
            log.debug("Skipping {}", displayPath);
            stats.incrementFilesSkipped();
            return Optional.empty();
        }
        if (!Files.isRegularFile(file)) {
            log.warn("Skipping missing file {}", displayPath);
            stats.incrementFilesFailed().addError("file_missing", displayPath + ": not found");
            return Optional.empty();
        }

        String content;
        long size;
        try {
            content = readContent(file);
            size = Files.size(file);
        } catch (IOException e) {
            log.warn("Skipping unreadable file {}: {}", displayPath, e.getMessage());
            stats.incrementFilesFailed().addError("file_unreadable", displayPath + ": " + e.getMessage());
            return Optional.empty();
        }

        if (content.isBlank() || optimizer.isThirdPartyCode(content)) {
            log.debug("Skipping empty or third-party file {}", displayPath);
            stats.incrementFilesSkipped();
            return Optional.empty();
        }

        issues.addAll(staticIssues(displayPath, content, versionTo));
        stats.incrementFilesProcessed();
        int priority = analyzer.getFilePriority(Path.of(displayPath));
        return Optional.of(new SourceFile(file, displayPath, size, optimizer.countTokens(content), priority));
    }

    List<ScanIssue> staticIssues(String displayPath, String content, String versionTo) {
        String[] lines = PhpPatterns.lines(content);
        List<ScanIssue> issues = new ArrayList<>();

        for (DeprecatedUsage usage : analyzer.findDeprecatedFunctions(content)) {
            boolean removed = usage.removedIn() != null
                && WordPressVersion.compare(usage.removedIn(), versionTo) <= 0;
            Severity severity = removed && usage.changeType() == ChangeType.REMOVED_FUNCTION
                ? Severity.CRITICAL
                : usage.severity();
            issues.add(new ScanIssue(
                severity,
                usage.changeType().wireName(),
                displayPath,
                usage.line(),
                describe(usage, removed),
                usage.replacement() != null
                    ? "Replace " + usage.function() + "() with " + usage.replacement() + "()"
                    : "Remove the call to " + usage.function() + "() or replace it with a supported API",
                lineAt(lines, usage.line()),
                IssueSource.STATIC,
                usage.deprecatedIn(),
                usage.removedIn(),
                usage.replacement()
            ));
        }

        for (SecurityFinding finding : analyzer.detectSecurityIssues(content)) {
            issues.add(new ScanIssue(
                finding.severity(),
                finding.type(),
                displayPath,
                finding.line(),
                finding.description(),
                securityRecommendation(finding.type()),
                finding.codeSnippet(),
                IssueSource.STATIC
            ));
        }

        for (PatternFinding finding : analyzer.detectPatterns(content)) {
            issues.add(new ScanIssue(
                finding.severity(),
                finding.type(),
                displayPath,
                null,
                finding.description(),
                finding.recommendation(),
                null,
                IssueSource.STATIC
            ));
        }
        return issues;
    }

    private List<ScanIssue> analyzeBatches(ScanSession session, List<SourceFile> files, ScanStatistics.Builder stats) {
        List<FileBatch> batches = planner.plan(files);
        stats.batchesPlanned(batches.size());
        log.info("Planned {} batches for {} files", batches.size(), files.size());

        List<ScanIssue> issues = new ArrayList<>();
        for (FileBatch batch : batches) {
            if (session.isCancelled() || Thread.currentThread().isInterrupted()) {
                log.warn("Scan {} cancelled, {} of {} batches not dispatched",
                    session.getId(), batches.size() - batch.index(), batches.size());
                stats.cancelled(true);
                break;
            }

            int number = batch.index() + 1;
            try {
                List<AnalysisFile> payload = prepare(batch, stats);
                if (payload.isEmpty()) {
                    log.warn("Batch {} has no readable files, skipping", number);
                    continue;
                }

                log.info("Analyzing batch {}/{} ({} files, ~{} tokens)",
                    number, batches.size(), payload.size(), batch.totalTokens());
                StructuredOutput output = analysisClient.analyzeBatch(
                    payload, session.getVersionFrom(), session.getVersionTo(), null);
                stats.addUsage(output.usage().inputTokens(), output.usage().outputTokens());

                if (output.isPresent()) {
                    stats.incrementBatchesProcessed();
                } else {
                    stats.incrementBatchesDegraded()
                        .addError("degraded_response", "Batch " + number + ": " + output.missingReason());
                }

                BatchAnalysis analysis = output.analysisOrDegraded();
                for (AiIssue aiIssue : analysis.issues()) {
                    issues.add(toScanIssue(aiIssue, batch));
                }
                log.debug("Batch {} returned {} issues, risk {}", number, analysis.issues().size(),
                    analysis.riskLevel().wireName());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Scan {} interrupted during batch {}", session.getId(), number);
                stats.cancelled(true);
                break;
            } catch (CodeRenewException e) {
                log.error("Batch {} failed: {}", number, e.getMessage());
                stats.incrementBatchesFailed().addError(e.getErrorCode(), "Batch " + number + ": " + e.getMessage());
            } catch (RuntimeException e) {
                log.error("Batch {} failed unexpectedly", number, e);
                stats.incrementBatchesFailed()
                    .addError("UNEXPECTED_ERROR", "Batch " + number + ": " + e.getClass().getSimpleName()
                        + ": " + e.getMessage());
            }
        }
        return issues;
    }

    private List<AnalysisFile> prepare(FileBatch batch, ScanStatistics.Builder stats) {
        List<AnalysisFile> payload = new ArrayList<>();
        for (SourceFile file : batch.files()) {
            String content;
            try {
                content = readContent(file.path());
            } catch (IOException e) {
                log.warn("Dropping {} from batch {}: {}", file.displayPath(), batch.index() + 1, e.getMessage());
                stats.addError("file_unreadable", file.displayPath() + ": " + e.getMessage());
                continue;
            }

            OptimizationResult result = optimizer.optimizeCode(content);
            String optimized = result.optimizedCode();
            if (result.optimizedTokens() > planner.getMaxTokens()) {
                optimized = truncate(optimized, result.optimizedTokens(), planner.getMaxTokens());
                log.warn("Truncated {} from ~{} tokens to fit the batch ceiling", file.displayPath(),
                    result.optimizedTokens());
            }
            stats.addOptimization(result.originalTokens(), result.optimizedTokens());
            payload.add(new AnalysisFile(file.displayPath(), optimized));
        }
        return payload;
    }

    static String truncate(String content, long tokens, long maxTokens) {
        int keep = (int) (content.length() * maxTokens / tokens) - TRUNCATION_MARKER.length();
        if (keep <= 0) {
            return TRUNCATION_MARKER.strip();
        }
        return content.substring(0, keep) + TRUNCATION_MARKER;
    }

    /**
     * Converts an AI issue, attributing it to a batch file when the reported file is vague.
     */
    static ScanIssue toScanIssue(AiIssue issue, FileBatch batch) {
        return new ScanIssue(
            issue.severity(),
            issue.issueType(),
            attribute(issue.file(), batch),
            issue.line(),
            issue.description(),
            issue.recommendation(),
            issue.codeSnippet(),
            IssueSource.AI
        );
    }

    static String attribute(String reported, FileBatch batch) {
        List<SourceFile> files = batch.files();
        if (reported != null && !reported.isBlank()) {
            String normalized = reported.trim().replace('\\', '/');
            for (SourceFile file : files) {
                if (file.displayPath().replace('\\', '/').equals(normalized)) {
                    return file.displayPath();
                }
            }
            for (SourceFile file : files) {
                String candidate = file.displayPath().replace('\\', '/');
                if (candidate.endsWith("/" + normalized) || normalized.endsWith("/" + candidate)) {
                    return file.displayPath();
                }
            }
        }
        if (files.size() == 1) {
            return files.get(0).displayPath();
        }
        return reported == null ? "" : reported.trim();
    }

    private static String describe(DeprecatedUsage usage, boolean removed) {
        StringBuilder description = new StringBuilder(usage.function()).append("() was deprecated in WordPress ")
            .append(usage.deprecatedIn());
        if (usage.removedIn() != null) {
            description.append(removed ? " and removed in " : " and is scheduled for removal in ")
                .append(usage.removedIn());
        }
        if (!usage.description().isBlank()) {
            description.append(": ").append(usage.description());
        }
        return description.toString();
    }

    private static String securityRecommendation(String type) {
        return switch (type) {
            case "sql_injection" -> "Use $wpdb->prepare() with placeholders instead of interpolating variables";
            case "xss" -> "Escape output with esc_html(), esc_attr() or esc_url()";
            case "file_inclusion" -> "Never build include paths from request input; map allowed values to fixed files";
            default -> "Review this code for security issues";
        };
    }

    private static String lineAt(String[] lines, int line) {
        if (line < 1 || line > lines.length) {
            return null;
        }
        return lines[line - 1].strip();
    }

    private static String displayPath(Path root, Path file) {
        if (root != null) {
            Path absoluteRoot = root.toAbsolutePath().normalize();
            Path absoluteFile = file.toAbsolutePath().normalize();
            if (absoluteFile.startsWith(absoluteRoot)) {
                return absoluteRoot.relativize(absoluteFile).toString().replace('\\', '/');
            }
        }
        return file.toString();
    }

    static boolean isSourceFile(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return false;
        }
        String fileName = name.toString().toLowerCase(Locale.ROOT);
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 && SOURCE_EXTENSIONS.contains(fileName.substring(dot + 1));
    }

    private static String readContent(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    @FunctionalInterface
    private interface InputCollector {
        List<Path> collect() throws IOException;
    }
}
