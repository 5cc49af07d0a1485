package com.coderenew.core.analyzer;

import com.coderenew.core.knowledge.DeprecationKnowledgeBase;
import com.coderenew.core.model.DeprecatedItem;
import com.coderenew.core.model.DeprecatedUsage;
import com.coderenew.core.model.FileAnalysis;
import com.coderenew.core.model.HookType;
import com.coderenew.core.model.HookUsage;
import com.coderenew.core.model.PatternFinding;
import com.coderenew.core.model.QuickScanResult;
import com.coderenew.core.model.RiskLevel;
import com.coderenew.core.model.SecurityFinding;
import com.coderenew.core.model.Severity;
import com.coderenew.core.model.VersionSummary;
import com.coderenew.core.util.PhpPatterns;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Fast, free first pass over WordPress source text.
 *
 * <p>Detects:
 * <ul>
 *   <li>Called identifiers and hook registrations</li>
 *   <li>Call sites of catalogued deprecated identifiers</li>
 *   <li>A fixed set of security signatures (SQL injection, reflected XSS, dynamic inclusion)</li>
 *   <li>Anti-pattern heuristics (raw drivers, missing nonces, unsanitized input,
 *       unescaped output, deprecated jQuery APIs)</li>
 * </ul>
 *
 * <p>Stateless apart from the injected knowledge base and safe to share.
 *
 * @since 1.0.0
 */
public class StaticAnalyzer extends AbstractPatternAnalyzer {

    static final Set<String> CONTROL_STRUCTURES = Set.of(
        "if", "while", "for", "foreach", "switch", "elseif", "array", "echo", "print",
        "isset", "empty", "unset", "die", "exit", "return", "function"
    );

    private static final String SQL_INJECTION = "sql_injection";

    private static final List<SecuritySignature> SECURITY_SIGNATURES = List.of(
        new SecuritySignature(SQL_INJECTION, Severity.CRITICAL,
            "\\$wpdb->query\\s*\\(\\s*[\"'].*?\\$",
            "Direct SQL query with variable interpolation - potential SQL injection"),
        new SecuritySignature(SQL_INJECTION, Severity.CRITICAL,
            "mysql_query\\s*\\(",
            "Deprecated mysql_query usage - security risk"),
        new SecuritySignature(SQL_INJECTION, Severity.CRITICAL,
            "mysqli_query\\s*\\(.*?\\$",
            "Direct mysqli query with variables - use prepared statements"),
        new SecuritySignature("xss", Severity.HIGH,
            "(?:echo|print)\\s+\\$_(GET|POST|REQUEST)\\[",
            "Direct output of user input - potential XSS"),
        new SecuritySignature("file_inclusion", Severity.CRITICAL,
            "(?:include|require)(?:_once)?\\s*\\(?\\s*\\$_(GET|POST|REQUEST)",
            "Dynamic file inclusion - potential RFI/LFI")
    );

    private static final Pattern RAW_MYSQLI = Pattern.compile("new\\s+mysqli\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern ADMIN_POST_HOOK = Pattern.compile("add_action\\s*\\(\\s*['\"]admin_post_");
    private static final Pattern NONCE_CHECK = Pattern.compile("wp_verify_nonce|check_admin_referer");
    private static final Pattern SUPERGLOBAL_READ = Pattern.compile("\\$_(GET|POST|REQUEST)\\[");
    private static final Pattern SANITIZATION = Pattern.compile("sanitize_\\w+|absint|intval");
    private static final Pattern VARIABLE_OUTPUT = Pattern.compile("(?:echo|print)\\s+\\$");
    private static final Pattern ESCAPING = Pattern.compile("esc_html|esc_attr|esc_url");

    private static final List<JQueryMethod> DEPRECATED_JQUERY = List.of(
        new JQueryMethod("load", "$.on(\"load\", ...)"),
        new JQueryMethod("bind", "$.on"),
        new JQueryMethod("unbind", "$.off"),
        new JQueryMethod("delegate", "$.on"),
        new JQueryMethod("undelegate", "$.off")
    );

    private final DeprecationKnowledgeBase knowledgeBase;

    public StaticAnalyzer(DeprecationKnowledgeBase knowledgeBase) {
        super();
        this.knowledgeBase = Objects.requireNonNull(knowledgeBase, "knowledgeBase must not be null");
    }

    /**
     * Runs every detector over one file.
     *
     * @param file file path, used only for reporting
     * @param content file content
     * @return analysis report
     */
    public FileAnalysis analyzeFile(Path file, String content) {
        return new FileAnalysis(
            file.toString(),
            extractFunctions(content),
            extractHooks(content),
            findDeprecatedFunctions(content),
            detectSecurityIssues(content),
            detectPatterns(content)
        );
    }

    /**
     * Collects identifiers written as calls, excluding control structures and language constructs.
     *
     * @param code source text
     * @return distinct identifiers in order of first appearance
     */
    public Set<String> extractFunctions(String code) {
        Set<String> functions = new LinkedHashSet<>();
        for (MatchResult match : findMatches(PhpPatterns.FUNCTION_CALL, code)) {
            String name = match.group(1);
            if (!CONTROL_STRUCTURES.contains(name.toLowerCase(Locale.ROOT))) {
                functions.add(name);
            }
        }
        return functions;
    }

    /**
     * Finds {@code add_action} and {@code add_filter} registrations with literal hook names.
     *
     * @param code source text
     * @return hook registrations in order of appearance
     */
    public List<HookUsage> extractHooks(String code) {
        List<HookUsage> hooks = new ArrayList<>();
        for (MatchResult match : findMatches(PhpPatterns.HOOK_WITH_NAME, code)) {
            HookType type = "action".equals(match.group(1)) ? HookType.ACTION : HookType.FILTER;
            hooks.add(new HookUsage(type, match.group(2), lineNumberAt(code, match.start())));
        }
        return hooks;
    }

    /**
     * Reports every call site of every catalogued identifier.
     *
     * <p>Catalogue names ending in an underscore (such as {@code mysql_}) stand
     * for a whole family of functions and match by prefix.
     *
     * @param code source text
     * @return one record per call site, ordered by line
     */
    public List<DeprecatedUsage> findDeprecatedFunctions(String code) {
        List<DeprecatedUsage> usages = new ArrayList<>();
        for (String function : extractFunctions(code)) {
            Optional<DeprecatedItem> item = resolve(function);
            if (item.isEmpty()) {
                continue;
            }
            Pattern callSite = Pattern.compile("\\b" + Pattern.quote(function) + "\\s*\\(");
            for (MatchResult match : findMatches(callSite, code)) {
                int line = lineNumberAt(code, match.start());
                log.debug("Deprecated call {} at line {}", function, line);
                usages.add(DeprecatedUsage.of(item.get(), function, line));
            }
        }
        usages.sort(Comparator.comparingInt(DeprecatedUsage::line));
        return usages;
    }

    /**
     * Matches the fixed security signature set.
     *
     * @param code source text
     * @return findings with a code snippet each
     */
    public List<SecurityFinding> detectSecurityIssues(String code) {
        List<SecurityFinding> findings = new ArrayList<>();
        for (SecuritySignature signature : SECURITY_SIGNATURES) {
            for (MatchResult match : findMatches(signature.pattern(), code)) {
                int line = lineNumberAt(code, match.start());
                findings.add(new SecurityFinding(
                    signature.type(),
                    line,
                    signature.severity(),
                    signature.description(),
                    lineContext(code, line)
                ));
            }
        }
        findings.sort(Comparator.comparingInt(SecurityFinding::line));
        return findings;
    }

    /**
     * Applies file-level anti-pattern heuristics.
     *
     * @param code source text
     * @return findings, at most one per heuristic and jQuery method
     */
    public List<PatternFinding> detectPatterns(String code) {
        List<PatternFinding> findings = new ArrayList<>();

        if (matches(RAW_MYSQLI, code)) {
            findings.add(new PatternFinding("anti_pattern", Severity.MEDIUM,
                "Direct mysqli usage detected - use $wpdb instead",
                "Use WordPress $wpdb object for database queries"));
        }

        if (matches(ADMIN_POST_HOOK, code) && !matches(NONCE_CHECK, code)) {
            findings.add(new PatternFinding("security", Severity.HIGH,
                "Admin POST handler without nonce verification",
                "Add wp_verify_nonce() to verify form submissions"));
        }

        if (matches(SUPERGLOBAL_READ, code) && !matches(SANITIZATION, code)) {
            findings.add(new PatternFinding("security", Severity.HIGH,
                "User input without sanitization detected",
                "Use sanitize_text_field(), sanitize_email(), or other sanitization functions"));
        }

        if (matches(VARIABLE_OUTPUT, code) && !matches(ESCAPING, code)) {
            findings.add(new PatternFinding("security", Severity.MEDIUM,
                "Output without escaping detected",
                "Use esc_html(), esc_attr(), or esc_url() when outputting variables"));
        }

        for (JQueryMethod method : DEPRECATED_JQUERY) {
            if (matches(method.pattern(), code)) {
                findings.add(new PatternFinding("deprecated", Severity.MEDIUM,
                    "Deprecated jQuery method $." + method.name() + " detected",
                    "Replace with " + method.replacement()));
            }
        }
        return findings;
    }

    /**
     * Loads the deprecations of a version range into the knowledge base so that
     * later lookups also see records only a remote source knows about.
     *
     * @param versionFrom version upgrading from
     * @param versionTo version upgrading to
     * @return number of deprecations known for the range
     */
    public int loadRange(String versionFrom, String versionTo) {
        int count = knowledgeBase.deprecatedInRange(versionFrom, versionTo).join().size();
        log.debug("Loaded {} deprecations for {} -> {}", count, versionFrom, versionTo);
        return count;
    }

    /**
     * Composes deprecated-call and security detection into a risk verdict.
     *
     * @param code source text
     * @param versionFrom version upgrading from
     * @param versionTo version upgrading to
     * @return quick scan result
     */
    public QuickScanResult quickScan(String code, String versionFrom, String versionTo) {
        List<DeprecatedUsage> deprecated = findDeprecatedFunctions(code);
        List<SecurityFinding> security = detectSecurityIssues(code);
        VersionSummary summary = knowledgeBase.versionSummary(versionFrom, versionTo).join();

        int critical = (int) (deprecated.stream().filter(d -> d.severity() == Severity.CRITICAL).count()
            + security.stream().filter(s -> s.severity() == Severity.CRITICAL).count());

        RiskLevel risk = RiskLevel.SAFE;
        if (critical > 0) {
            risk = RiskLevel.CRITICAL;
        } else if (!deprecated.isEmpty() || !security.isEmpty()) {
            risk = RiskLevel.WARNING;
        }
        return new QuickScanResult(risk, deprecated.size(), security.size(), critical, deprecated, security, summary);
    }

    /**
     * Ranks a file for analysis order; higher runs first.
     *
     * @param file file path
     * @return 100 for entry points, 50 for templates, 10 for include/asset/vendor folders, else 25
     */
    public int getFilePriority(Path file) {
        Path fileName = file.getFileName();
        String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
        if (containsAny(name, "functions.php", "index.php", "plugin.php", "class-", "init.php")) {
            return 100;
        }
        if (containsAny(name, "template", "header.php", "footer.php", "sidebar.php")) {
            return 50;
        }
        String path = file.toString().replace('\\', '/');
        if (containsAny(path, "inc/", "includes/", "assets/", "vendor/")) {
            return 10;
        }
        return 25;
    }

    private Optional<DeprecatedItem> resolve(String function) {
        Optional<DeprecatedItem> exact = knowledgeBase.checkFunction(function);
        if (exact.isPresent()) {
            return exact;
        }
        return knowledgeBase.allFunctionNames().stream()
            .filter(name -> name.endsWith("_") && function.startsWith(name))
            .findFirst()
            .flatMap(knowledgeBase::checkFunction);
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private record SecuritySignature(String type, Severity severity, Pattern pattern, String description) {

        SecuritySignature(String type, Severity severity, String regex, String description) {
            this(type, severity, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), description);
        }
    }

    private record JQueryMethod(String name, String replacement, Pattern pattern) {

        JQueryMethod(String name, String replacement) {
            this(name, replacement, Pattern.compile(
                "\\$\\." + name + "\\b|(?:\\$|jQuery)\\s*\\([^)]*\\)\\s*\\." + name + "\\s*\\("));
        }
    }
}
