package com.supplier.matching.export;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.supplier.matching.api.MatchingResult;
import com.supplier.matching.api.MatchingStatistics;
import com.supplier.matching.core.model.MatchingGroup;
import com.supplier.matching.core.model.MatchingWarning;
import com.supplier.matching.core.model.PriceComparison;
import com.supplier.matching.core.model.RankedMember;
import com.supplier.matching.logging.LogContext;
import com.supplier.matching.report.PriceComparisonReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;

/**
 * JSON comparison exporter. Writes one document with the run id, statistics,
 * every group with its ranked members, and the warnings.
 * Prices are written as decimal strings so no precision is lost.
 */
public class JsonComparisonExporter implements ComparisonExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonComparisonExporter.class);

    private final ObjectMapper objectMapper;
    private final PriceComparisonReporter reporter = new PriceComparisonReporter();

    public JsonComparisonExporter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public JsonComparisonExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ExportResult export(MatchingResult result, Writer writer) throws IOException {
        try (LogContext ctx = LogContext.forExport(result.runId(), getFormat())) {
            ObjectNode root = toJson(result);
            objectMapper.writer()
                    .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                    .writeValue(writer, root);
            writer.flush();

            int rows = result.groups().stream().mapToInt(MatchingGroup::size).sum();
            ExportResult exportResult = new ExportResult(getFormat(), result.groups().size(), rows,
                    result.warnings().size());
            log.info("export.completed result={}", exportResult);
            return exportResult;
        }
    }

    /**
     * Builds the document tree without writing it.
     */
    public ObjectNode toJson(MatchingResult result) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("runId", result.runId());
        if (result.options() != null) {
            root.put("mode", result.options().getMode().name());
            root.put("threshold", result.options().getThreshold());
        }
        root.set("statistics", statistics(result.statistics()));

        ArrayNode groups = root.putArray("groups");
        for (MatchingGroup group : result.groups()) {
            groups.add(group(group));
        }

        ArrayNode warnings = root.putArray("warnings");
        for (MatchingWarning warning : result.warnings()) {
            ObjectNode node = warnings.addObject();
            node.put("type", warning.type().name());
            node.put("groupId", warning.groupId());
            ArrayNode ids = node.putArray("productIds");
            warning.productIds().forEach(ids::add);
            node.put("message", warning.message());
        }
        return root;
    }

    private ObjectNode statistics(MatchingStatistics statistics) {
        ObjectNode node = objectMapper.createObjectNode();
        if (statistics == null) {
            return node;
        }
        node.put("productCount", statistics.productCount());
        node.put("supplierCount", statistics.supplierCount());
        node.put("candidatePairCount", statistics.candidatePairCount());
        node.put("matchedPairCount", statistics.matchedPairCount());
        node.put("groupCount", statistics.groupCount());
        node.put("multiMemberGroupCount", statistics.multiMemberGroupCount());
        node.put("averageConfidence", statistics.averageConfidence());
        node.put("warningCount", statistics.warningCount());
        node.put("durationMillis", statistics.durationMillis());
        return node;
    }

    private ObjectNode group(MatchingGroup group) {
        PriceComparison comparison = group.getComparison() != null
                ? group.getComparison()
                : reporter.compare(group);

        ObjectNode node = objectMapper.createObjectNode();
        node.put("groupId", group.getGroupId());
        node.put("representativeName", group.getRepresentativeName());
        node.put("confidenceScore", group.getConfidenceScore());
        node.put("currency", group.getCurrency());
        node.put("minPrice", group.getMinPrice().toPlainString());
        node.put("maxPrice", group.getMaxPrice().toPlainString());
        node.put("avgPrice", group.getAvgPrice().toPlainString());
        node.put("bestMemberId", group.getBestMemberId());
        node.put("savingsAbsolute", comparison.savingsAbsolute().toPlainString());
        node.put("savingsPercent", comparison.savingsPercent());

        ArrayNode members = node.putArray("members");
        for (RankedMember member : comparison.rankedMembers()) {
            ObjectNode m = members.addObject();
            m.put("rank", member.rank());
            m.put("productId", member.productId());
            m.put("supplierId", member.supplierId());
            m.put("name", member.name());
            m.put("price", member.price().amount().toPlainString());
            m.put("currency", member.price().currency());
            m.put("deltaFromBest", member.deltaFromBest().toPlainString());
            m.put("url", member.url());
        }
        return node;
    }

    @Override
    public String getFormat() {
        return "json";
    }
}
