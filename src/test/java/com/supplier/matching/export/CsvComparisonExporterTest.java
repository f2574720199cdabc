package com.supplier.matching.export;

import com.supplier.matching.api.MatchingResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CsvComparisonExporter Tests")
class CsvComparisonExporterTest {

    private final MatchingResult result = ExporterTestSupport.sampleResult();

    @Test
    @DisplayName("Writes one row per member of multi-member groups")
    void rowsPerMember() throws IOException {
        StringWriter out = new StringWriter();
        ExportResult exportResult = new CsvComparisonExporter().export(result, out);

        String[] lines = out.toString().split("\\R");
        assertEquals(CsvComparisonExporter.HEADER, lines[0]);
        assertEquals(3, lines.length);
        // two-member groups take the longer name as representative
        assertTrue(lines[1].startsWith(
                "group-0001,\"无线鼠标2.4G黑色, \"\"新款\"\"\",0.7540,1,A,s1,无线鼠标 2.4G,15,CNY,0,16.6667,"));
        assertTrue(lines[1].endsWith("https://s1.example.com/a"));
        assertEquals(1, exportResult.groups());
        assertEquals(2, exportResult.rows());
        assertEquals("csv", exportResult.format());
    }

    @Test
    @DisplayName("Fields with commas or quotes are escaped")
    void escaping() throws IOException {
        StringWriter out = new StringWriter();
        new CsvComparisonExporter().export(result, out);

        assertTrue(out.toString().contains(",\"无线鼠标2.4G黑色, \"\"新款\"\"\",18,CNY,3,"));
    }

    @Test
    @DisplayName("Singletons are included on request")
    void includeSingletons() throws IOException {
        StringWriter out = new StringWriter();
        ExportResult exportResult = new CsvComparisonExporter(true).export(result, out);

        assertEquals(2, exportResult.groups());
        assertEquals(3, exportResult.rows());
        assertTrue(out.toString().contains("group-0002,蓝牙耳机,1.0000,1,C,s3,蓝牙耳机,50,CNY,0,0.0000,"));
    }

    @Test
    @DisplayName("Output streams are written as UTF-8")
    void utf8Stream() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new CsvComparisonExporter().export(result, out);
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("无线鼠标"));
    }

    @Test
    @DisplayName("csvEscape handles null and plain values")
    void csvEscape() {
        assertEquals("", CsvComparisonExporter.csvEscape(null));
        assertEquals("plain", CsvComparisonExporter.csvEscape("plain"));
        assertEquals("\"a\nb\"", CsvComparisonExporter.csvEscape("a\nb"));
    }
}
