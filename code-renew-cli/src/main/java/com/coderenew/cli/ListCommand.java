package com.coderenew.cli;

import com.coderenew.core.CodeRenewEngine;
import com.coderenew.core.knowledge.DeprecationKnowledgeBase;
import com.coderenew.core.model.DeprecatedItem;
import com.coderenew.core.model.VersionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list catalogued deprecations for a version range.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * coderenew list deprecations --from 5.9 --to 6.4
 * }</pre>
 */
@Command(
    name = "list",
    description = "List catalogued deprecations for a version range",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: deprecations"
    )
    private String type;

    @Mixin
    private EngineOptions options;

    @Override
    public Integer call() {
        options.validateRange();
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "deprecations", "deprecation" -> listDeprecations();
            default -> {
                log.error("Unknown type: {}. Use: deprecations", type);
                System.err.println("✗ Unknown type: " + type + ". Use: deprecations");
                yield 2;
            }
        };
    }

    private int listDeprecations() {
        try (CodeRenewEngine engine = CodeRenewEngine.create(options.loadConfiguration(), true, options.offline)) {
            DeprecationKnowledgeBase knowledgeBase = engine.getKnowledgeBase();
            List<DeprecatedItem> items = knowledgeBase.deprecatedInRange(options.versionFrom, options.versionTo).join();
            VersionSummary summary = VersionSummary.of(items);

            System.out.printf("Deprecations between WordPress %s and %s:%n%n", options.versionFrom, options.versionTo);
            if (items.isEmpty()) {
                System.out.println("  None found.");
                return 0;
            }
            for (DeprecatedItem item : items) {
                System.out.printf("  • %s [%s, %s]%n", item.name(), item.severity().wireName(),
                    item.changeType().wireName());
                System.out.printf("    Deprecated in %s%s%n", item.deprecatedIn(),
                    item.removedIn() != null ? ", removed in " + item.removedIn() : "");
                if (item.replacement() != null) {
                    System.out.printf("    Replacement: %s%n", item.replacement());
                }
            }
            System.out.println();
            System.out.printf("Total: %d (critical %d, high %d, medium %d, low %d)%n",
                summary.total(), summary.critical(), summary.high(), summary.medium(), summary.low());
            return 0;
        }
    }
}
