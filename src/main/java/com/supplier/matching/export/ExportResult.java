package com.supplier.matching.export;

/**
 * Result of an export.
 *
 * @param format   format written
 * @param groups   groups written
 * @param rows     member rows written
 * @param warnings warnings written
 */
public record ExportResult(String format, int groups, int rows, int warnings) {

    @Override
    public String toString() {
        return "ExportResult{" +
                "format=" + format +
                ", groups=" + groups +
                ", rows=" + rows +
                ", warnings=" + warnings +
                '}';
    }
}
