package com.supplier.matching.export;

import com.supplier.matching.api.MatchingResult;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Writes the price comparisons of a matching run in a specific format.
 */
public interface ComparisonExporter {

    /**
     * Exports a run to a writer. The writer is flushed but not closed.
     *
     * @param result the run to export
     * @param writer the writer to write to
     * @return counts of what was written
     * @throws IOException if writing fails
     */
    ExportResult export(MatchingResult result, Writer writer) throws IOException;

    /**
     * Exports a run to an output stream as UTF-8.
     */
    default ExportResult export(MatchingResult result, OutputStream output) throws IOException {
        return export(result, new OutputStreamWriter(output, StandardCharsets.UTF_8));
    }

    /**
     * Returns the format produced by this exporter (e.g., "csv", "json").
     */
    String getFormat();
}
