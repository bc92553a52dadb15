package com.codemeter.core.renderer.impl;

import com.codemeter.core.model.LanguageSummary;
import com.codemeter.core.model.RevisionSnapshot;
import com.codemeter.core.model.RevisionTotals;
import com.codemeter.core.renderer.RenderOptions;
import com.codemeter.core.renderer.ReportRenderer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Renders the revision as pretty-printed JSON.
 *
 * <p><b>Example output:</b>
 * <pre>{@code
 * {
 *   "root" : "src",
 *   "backend" : "pool",
 *   "elapsedMillis" : 41,
 *   "languages" : [ {
 *     "language" : "Java",
 *     "files" : 12,
 *     ...
 *   } ],
 *   "totals" : { ... },
 *   "ignoredFiles" : 3,
 *   "skippedFiles" : 0,
 *   "failedFiles" : 0
 * }
 * }</pre>
 */
public class JsonReportRenderer implements ReportRenderer {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String getDescription() {
        return "Machine-readable JSON report";
    }

    @Override
    public void render(RevisionSnapshot snapshot, RenderOptions options, PrintStream out) {
        JsonReport report = new JsonReport(
            snapshot.root().toString(),
            snapshot.backend(),
            snapshot.elapsed().toMillis(),
            snapshot.languagesByCode(),
            snapshot.totals(),
            snapshot.ignoredFiles(),
            snapshot.skippedFiles(),
            snapshot.failedFiles()
        );
        try {
            out.println(JSON_MAPPER.writeValueAsString(report));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize revision report", e);
        }
    }

    /**
     * Serialized form of a snapshot.
     */
    public record JsonReport(
        String root,
        String backend,
        long elapsedMillis,
        List<LanguageSummary> languages,
        RevisionTotals totals,
        long ignoredFiles,
        long skippedFiles,
        long failedFiles
    ) {}
}
