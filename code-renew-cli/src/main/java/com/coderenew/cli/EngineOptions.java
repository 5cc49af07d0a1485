package com.coderenew.cli;

import com.coderenew.core.config.CodeRenewConfig;
import com.coderenew.core.config.ConfigLoader;
import com.coderenew.core.version.WordPressVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Options shared by every command that builds a scanning engine.
 */
public class EngineOptions {

    private static final Logger log = LoggerFactory.getLogger(EngineOptions.class);

    @Spec(Spec.Target.MIXEE)
    private CommandSpec spec;

    @Option(names = "--from", required = true, description = "WordPress version upgrading from (e.g. 5.9)")
    String versionFrom;

    @Option(names = "--to", required = true, description = "WordPress version upgrading to (e.g. 6.4)")
    String versionTo;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: coderenew.yaml)"
    )
    Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = "--offline", description = "Use only the bundled deprecation catalogue; call no remote service")
    boolean offline;

    /**
     * Rejects blank or inverted version ranges.
     *
     * @throws CommandLine.ParameterException if the range is invalid
     */
    void validateRange() {
        if (versionFrom.isBlank() || versionTo.isBlank()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--from and --to must not be blank");
        }
        if (WordPressVersion.compare(versionFrom, versionTo) > 0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "--from " + versionFrom + " is newer than --to " + versionTo);
        }
    }

    /**
     * Loads configuration with environment overrides applied.
     *
     * @return configuration
     */
    CodeRenewConfig loadConfiguration() {
        log.debug("Loading configuration from: {}", configPath.toAbsolutePath());
        return ConfigLoader.loadWithEnvironment(configPath);
    }
}
