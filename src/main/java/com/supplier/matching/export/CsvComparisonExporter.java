package com.supplier.matching.export;

import com.supplier.matching.api.MatchingResult;
import com.supplier.matching.core.model.MatchingGroup;
import com.supplier.matching.core.model.PriceComparison;
import com.supplier.matching.core.model.RankedMember;
import com.supplier.matching.logging.LogContext;
import com.supplier.matching.report.PriceComparisonReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.util.Locale;

/**
 * CSV comparison exporter. One row per ranked group member; singletons are skipped
 * unless {@code includeSingletons} is set.
 *
 * <p>Output format:</p>
 * <pre>
 * groupId,representativeName,confidence,rank,productId,supplierId,name,price,currency,deltaFromBest,savingsPercent,url
 * group-0001,无线鼠标2.4G,0.7540,1,A,s1,无线鼠标 2.4G,15,CNY,0,16.6667,
 * </pre>
 */
public class CsvComparisonExporter implements ComparisonExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvComparisonExporter.class);

    static final String HEADER = "groupId,representativeName,confidence,rank,productId,supplierId,"
            + "name,price,currency,deltaFromBest,savingsPercent,url";

    private final boolean includeSingletons;
    private final PriceComparisonReporter reporter = new PriceComparisonReporter();

    public CsvComparisonExporter() {
        this(false);
    }

    public CsvComparisonExporter(boolean includeSingletons) {
        this.includeSingletons = includeSingletons;
    }

    @Override
    public ExportResult export(MatchingResult result, Writer writer) throws IOException {
        try (LogContext ctx = LogContext.forExport(result.runId(), getFormat())) {
            PrintWriter pw = new PrintWriter(new BufferedWriter(writer));
            int groups = 0;
            int rows = 0;

            pw.println(HEADER);
            for (MatchingGroup group : result.groups()) {
                if (group.isSingleton() && !includeSingletons) {
                    continue;
                }
                PriceComparison comparison = group.getComparison() != null
                        ? group.getComparison()
                        : reporter.compare(group);
                for (RankedMember member : comparison.rankedMembers()) {
                    pw.printf(Locale.ROOT, "%s,%s,%.4f,%d,%s,%s,%s,%s,%s,%s,%.4f,%s%n",
                            csvEscape(group.getGroupId()),
                            csvEscape(group.getRepresentativeName()),
                            group.getConfidenceScore(),
                            member.rank(),
                            csvEscape(member.productId()),
                            csvEscape(member.supplierId()),
                            csvEscape(member.name()),
                            plain(member.price().amount()),
                            csvEscape(member.price().currency()),
                            plain(member.deltaFromBest()),
                            comparison.savingsPercent(),
                            csvEscape(member.url()));
                    rows++;
                }
                groups++;
            }
            pw.flush();
            if (pw.checkError()) {
                throw new IOException("Failed to write CSV export");
            }

            ExportResult exportResult = new ExportResult(getFormat(), groups, rows, 0);
            log.info("export.completed result={}", exportResult);
            return exportResult;
        }
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }

    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
