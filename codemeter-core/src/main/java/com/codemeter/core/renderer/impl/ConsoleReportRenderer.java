package com.codemeter.core.renderer.impl;

import com.codemeter.core.model.LanguageSummary;
import com.codemeter.core.model.RevisionSnapshot;
import com.codemeter.core.model.RevisionTotals;
import com.codemeter.core.renderer.RenderOptions;
import com.codemeter.core.renderer.ReportRenderer;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Renders the revision as a fixed-width text table with optional ANSI color formatting.
 *
 * <p><b>Example output:</b>
 * <pre>
 * -----------------------------------------------------------------------------------
 * Language                      Files       Blank     Comment        Code       Total
 * -----------------------------------------------------------------------------------
 * Java                             12         140         210        1302        1652
 * XML                               2           3           1          80          84
 * -----------------------------------------------------------------------------------
 * Total:                           14         143         211        1382        1736
 * -----------------------------------------------------------------------------------
 * Time: 0.041s  Ignored 3 files
 * </pre>
 *
 * <p>Rows are sorted by code lines, largest first, then by language name.
 */
public class ConsoleReportRenderer implements ReportRenderer {

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String ROW_FORMAT = "%-25s%10d%12d%12d%12d%12d";
    private static final String HEADER_FORMAT = "%-25s%10s%12s%12s%12s%12s";
    private static final String SEPARATOR = "-".repeat(83);

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public String getDescription() {
        return "Text table of files and lines per language";
    }

    @Override
    public void render(RevisionSnapshot snapshot, RenderOptions options, PrintStream out) {
        boolean useColors = options.colors();
        String bold = useColors ? ANSI_BOLD : "";
        String cyan = useColors ? ANSI_CYAN : "";
        String yellow = useColors ? ANSI_YELLOW : "";
        String reset = useColors ? ANSI_RESET : "";

        out.println(SEPARATOR);
        out.println(bold + String.format(Locale.ROOT, HEADER_FORMAT,
            "Language", "Files", "Blank", "Comment", "Code", "Total") + reset);
        out.println(SEPARATOR);

        for (LanguageSummary row : snapshot.languagesByCode()) {
            out.println(String.format(Locale.ROOT, ROW_FORMAT,
                truncate(row.language()), row.files(), row.blank(), row.comment(), row.code(), row.total()));
        }

        RevisionTotals totals = snapshot.totals();
        out.println(SEPARATOR);
        out.println(bold + String.format(Locale.ROOT, ROW_FORMAT,
            "Total:", totals.files(), totals.blank(), totals.comment(), totals.code(), totals.total()) + reset);
        out.println(SEPARATOR);

        StringBuilder footer = new StringBuilder(String.format(Locale.ROOT, "Time: %.3fs  Ignored %d files",
            snapshot.elapsed().toNanos() / 1_000_000_000.0, snapshot.ignoredFiles()));
        if (snapshot.skippedFiles() > 0) {
            footer.append(String.format(Locale.ROOT, "  Skipped %d files", snapshot.skippedFiles()));
        }
        out.println(cyan + footer + reset);

        if (snapshot.failedFiles() > 0) {
            out.println(yellow + String.format(Locale.ROOT, "Failed to read %d files", snapshot.failedFiles()) + reset);
        }
    }

    private static String truncate(String language) {
        return language.length() > 24 ? language.substring(0, 23) + "~" : language;
    }
}
