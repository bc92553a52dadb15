package com.codemeter.cli;

import com.codemeter.core.config.BackendKind;
import com.codemeter.core.config.ConfigLoader;
import com.codemeter.core.config.ProjectConfig;
import com.codemeter.core.config.RevisionConfig;
import com.codemeter.core.engine.RevisionEngine;
import com.codemeter.core.engine.RevisionResult;
import com.codemeter.core.renderer.RenderOptions;
import com.codemeter.core.renderer.ReportRenderer;
import com.codemeter.core.renderer.ReportRenderers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to count lines under a directory and print the report.
 *
 * <p>Settings are resolved in this order, later wins:
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>{@code codemeter.yaml} in the scanned directory, or the file given with {@code --config}</li>
 *   <li>command-line options</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Count the current directory
 * codemeter scan
 *
 * # Single-threaded, top level only
 * codemeter scan src --backend sync --no-recurse
 *
 * # JSON report
 * codemeter scan -f json > report.json
 * }</pre>
 */
@Command(
    name = "scan",
    description = "Count blank, comment and code lines per language",
    mixinStandardHelpOptions = true
)
public class ScanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ScanCommand.class);

    @Parameters(
        index = "0",
        description = "Directory or file to scan (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: codemeter.yaml in the scanned directory)"
    )
    private Path configPath;

    @Option(
        names = {"--backend"},
        description = "Execution backend: ${COMPLETION-CANDIDATES} (default: auto)"
    )
    private BackendKind backend;

    @Option(
        names = {"-j", "--threads"},
        description = "Worker threads for the pool backend (default: available processors)"
    )
    private Integer threads;

    @Option(
        names = {"--queue-length"},
        description = "Maximum queued files for the pool backend (default: max(64, 8 x threads))"
    )
    private Integer queueLength;

    @Option(
        names = {"--no-recurse"},
        description = "Only count files directly inside the directory"
    )
    private boolean noRecurse;

    @Option(
        names = {"-f", "--format"},
        description = "Report format: console or json (overrides config)"
    )
    private String format;

    @Option(
        names = {"--no-color"},
        description = "Disable ANSI colors"
    )
    private boolean noColor;

    @Override
    public Integer call() {
        ProjectConfig config = loadConfiguration();
        RevisionConfig revisionConfig = config.revision().mergedWith(new RevisionConfig(
            noRecurse ? Boolean.FALSE : null,
            backend,
            threads,
            queueLength
        ));

        String formatId = format != null ? format : config.output().effectiveFormat();
        Optional<ReportRenderer> renderer = ReportRenderers.find(formatId);
        if (renderer.isEmpty()) {
            log.error("Unknown report format: {}. Use 'codemeter list renderers'", formatId);
            return 1;
        }

        log.debug("Scanning {} with {}", projectPath.toAbsolutePath(), revisionConfig);
        RevisionResult result = new RevisionEngine().run(projectPath, revisionConfig);

        boolean colors = !noColor && config.output().effectiveColors();
        renderer.get().render(result.snapshot(), new RenderOptions(colors), System.out);

        if (!result.isSuccess()) {
            System.err.println("✗ Scan failed: " + result.status());
            return 1;
        }
        return 0;
    }

    private ProjectConfig loadConfiguration() {
        if (configPath != null) {
            return ConfigLoader.load(configPath);
        }
        return ConfigLoader.loadFromRoot(projectPath);
    }
}
