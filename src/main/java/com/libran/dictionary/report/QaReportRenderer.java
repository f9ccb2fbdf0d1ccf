package com.libran.dictionary.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libran.dictionary.baseline.BaselineDiscrepancy;
import com.libran.dictionary.qa.BaselineConsistencyResult;
import com.libran.dictionary.qa.CategoryResult;
import com.libran.dictionary.qa.QaCategoryType;
import com.libran.dictionary.qa.QaIssue;
import com.libran.dictionary.qa.QaReport;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link QaReport} as structured JSON and as a flat CSV table
 * ({@code Category,Score,Issues,Summary}).
 */
public class QaReportRenderer {

    static final String CSV_HEADER = "Category,Score,Issues,Summary";

    private final ObjectMapper objectMapper;

    public QaReportRenderer() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public QaReportRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(QaReport report) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("timestamp", report.generatedAt() != null ? report.generatedAt().toString() : null);
        root.put("version", report.version());
        root.put("totalEntries", report.totalEntries());
        root.put("overallScore", report.overallScore());
        root.put("threshold", report.threshold());
        root.put("passed", report.passed());

        ArrayNode categories = root.putArray("categories");
        for (CategoryResult result : report.categories()) {
            ObjectNode node = categories.addObject();
            node.put("category", result.category().displayName());
            node.put("score", result.score());
            node.put("issues", result.issueCount());
            node.put("summary", result.summary());
        }

        ObjectNode ranked = root.putObject("issueCountsByCategory");
        for (Map.Entry<QaCategoryType, Integer> e : report.issueCountsByCategory().entrySet()) {
            ranked.put(e.getKey().displayName(), e.getValue());
        }

        report.baselineResult().ifPresent(b -> writeBaseline(root.putObject("baselineConsistency"), b));

        ArrayNode detailed = root.putArray("detailedIssues");
        for (QaIssue issue : report.allIssues()) {
            ObjectNode node = detailed.addObject();
            node.put("category", issue.category().displayName());
            node.put("type", issue.code());
            node.put("subject", issue.subject());
            node.put("detail", issue.detail());
        }

        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void writeBaseline(ObjectNode node, BaselineConsistencyResult baseline) {
        node.put("score", baseline.score());
        node.put("baselineMatches", baseline.baselineMatches());
        node.put("totalChecked", baseline.totalChecked());
        node.put("baselineCoverage", baseline.coveragePercent());
        node.put("summary", baseline.summary());
        ArrayNode items = node.putArray("issues");
        for (BaselineDiscrepancy d : baseline.discrepancies()) {
            ObjectNode item = items.addObject();
            item.put("entry", d.english());
            item.put("type", d.kind().name().toLowerCase(Locale.ROOT));
            item.put("severity", d.severity().name().toLowerCase(Locale.ROOT));
            item.put("message", d.message());
        }
    }

    public String toCsv(QaReport report) {
        List<String> lines = new ArrayList<>();
        lines.add(CSV_HEADER);
        for (CategoryResult result : report.categories()) {
            lines.add(Csv.quote(result.category().displayName()) + "," + Csv.number(result.score()) + ","
                    + result.issueCount() + "," + Csv.quote(result.summary()));
        }
        report.baselineResult().ifPresent(b -> lines.add(Csv.quote("Baseline Consistency") + ","
                + Csv.number(b.score()) + "," + b.discrepancies().size() + "," + Csv.quote(b.summary())));
        return String.join("\n", lines);
    }
}
