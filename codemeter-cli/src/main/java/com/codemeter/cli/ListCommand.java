package com.codemeter.cli;

import com.codemeter.core.renderer.ReportRenderer;
import com.codemeter.core.renderer.ReportRenderers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list available plugins.
 *
 * <p>Discovers report renderers via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codemeter list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available report renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: renderers"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: renderers", type);
                yield 1;
            }
        };
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        List<ReportRenderer> renderers = ReportRenderers.all();
        for (ReportRenderer renderer : renderers) {
            System.out.printf("  • %s (ID: %s)%n", renderer.getDescription(), renderer.getId());
        }

        if (renderers.isEmpty()) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }
}
