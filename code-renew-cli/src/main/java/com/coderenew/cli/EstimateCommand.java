package com.coderenew.cli;

import com.coderenew.core.CodeRenewEngine;
import com.coderenew.core.model.FileTokenCount;
import com.coderenew.core.model.TokenEstimate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to project the tokens, batches and cost of a scan without running it.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * coderenew estimate ./my-plugin --from 5.9 --to 6.4
 * }</pre>
 */
@Command(
    name = "estimate",
    description = "Estimate tokens, batches and cost of scanning a directory",
    mixinStandardHelpOptions = true
)
public class EstimateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(EstimateCommand.class);

    @Parameters(
        index = "0",
        description = "Plugin/theme directory (default: current directory)",
        defaultValue = "."
    )
    private Path directory;

    @Mixin
    private EngineOptions options;

    @Option(names = "--json", description = "Print the estimate as JSON")
    private boolean json;

    @Override
    public Integer call() {
        options.validateRange();

        try (CodeRenewEngine engine = CodeRenewEngine.create(options.loadConfiguration(), true, true)) {
            TokenEstimate estimate = engine.getOrchestrator()
                .estimateDirectory(directory, options.versionFrom, options.versionTo);
            System.out.print(json ? ScanCommand.renderJson(estimate) : render(estimate));
            return 0;
        } catch (IOException | RuntimeException e) {
            log.error("Estimate failed", e);
            System.err.println("✗ Estimate failed: " + e.getMessage());
            return 1;
        }
    }

    static String render(TokenEstimate estimate) {
        StringBuilder text = new StringBuilder();
        text.append("Files:             ").append(estimate.totalFiles()).append('\n');
        text.append("Estimated tokens:  ").append(estimate.totalTokens()).append('\n');
        text.append("Estimated batches: ").append(estimate.estimatedBatches()).append('\n');
        text.append("Estimated cost:    $").append(String.format(Locale.ROOT, "%.2f", estimate.estimatedCost())).append('\n');
        text.append("Overflow risk:     ").append(estimate.contextOverflowRisk().wireName()).append('\n');
        if (!estimate.topFiles().isEmpty()) {
            text.append('\n').append("Largest files:\n");
            for (FileTokenCount file : estimate.topFiles()) {
                text.append(String.format(Locale.ROOT, "  %8d  %s%n", file.tokens(), file.file()));
            }
        }
        return text.toString();
    }
}
