package com.codemeter.core.renderer;

import com.codemeter.core.model.RevisionSnapshot;

import java.io.PrintStream;

/**
 * Formats a finished {@link RevisionSnapshot} for output.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class CsvReportRenderer implements ReportRenderer {
 *     @Override
 *     public String getId() {
 *         return "csv";
 *     }
 *
 *     @Override
 *     public void render(RevisionSnapshot snapshot, RenderOptions options, PrintStream out) {
 *         out.println("language,files,blank,comment,code");
 *         for (LanguageSummary row : snapshot.languagesByCode()) {
 *             out.printf("%s,%d,%d,%d,%d%n", row.language(), row.files(),
 *                 row.blank(), row.comment(), row.code());
 *         }
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.codemeter.core.renderer.ReportRenderer}
 *
 * @see RenderOptions
 */
public interface ReportRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Used for selecting the renderer from configuration and the command line. Should be
     * lowercase (e.g., "console", "json").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Returns a one-line description for listings.
     *
     * @return renderer description
     */
    default String getDescription() {
        return getId();
    }

    /**
     * Writes the report.
     *
     * @param snapshot finished revision
     * @param options rendering options
     * @param out destination stream; implementations must not close it
     */
    void render(RevisionSnapshot snapshot, RenderOptions options, PrintStream out);
}
