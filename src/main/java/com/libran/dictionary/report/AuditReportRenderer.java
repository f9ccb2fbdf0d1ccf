package com.libran.dictionary.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libran.dictionary.audit.AuditCheckResult;
import com.libran.dictionary.audit.AuditIssue;
import com.libran.dictionary.audit.AuditReport;
import com.libran.dictionary.audit.Suppression;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders an {@link AuditReport} as structured JSON, a flat CSV table
 * ({@code Category,Issues,Summary}) and a prose report that lists at most
 * {@value #PROSE_EXAMPLES} issues per check.
 */
public class AuditReportRenderer {

    static final String CSV_HEADER = "Category,Issues,Summary";
    static final int PROSE_EXAMPLES = 10;

    private final ObjectMapper objectMapper;

    public AuditReportRenderer() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public AuditReportRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(AuditReport report) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("timestamp", report.generatedAt() != null ? report.generatedAt().toString() : null);
        root.put("version", report.version());
        root.put("totalEntries", report.totalEntries());
        root.put("auditScore", report.score());

        ArrayNode categories = root.putArray("categories");
        for (AuditCheckResult result : report.results()) {
            ObjectNode node = categories.addObject();
            node.put("category", result.check().displayName());
            node.put("issues", result.issueCount());
            node.put("summary", result.summary());
        }

        ArrayNode detailed = root.putArray("detailedIssues");
        for (AuditIssue issue : report.allIssues()) {
            writeIssue(detailed.addObject(), issue);
        }

        ArrayNode suppressed = root.putArray("suppressions");
        for (Suppression suppression : report.suppressions()) {
            ObjectNode node = suppressed.addObject();
            writeIssue(node.putObject("issue"), suppression.issue());
            node.put("category", suppression.match().entry().category());
            node.put("canonical", suppression.match().entry().term());
            node.put("matchType", suppression.match().matchType().name());
            node.put("justification", suppression.match().entry().justification());
        }

        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void writeIssue(ObjectNode node, AuditIssue issue) {
        node.put("category", issue.check().displayName());
        node.put("type", issue.code());
        node.put("severity", issue.severity().name().toLowerCase(Locale.ROOT));
        node.put("english", issue.english());
        node.put("ancient", issue.ancient());
        node.put("modern", issue.modern());
        node.put("reason", issue.reason());
        node.put("recommendation", issue.recommendation());
    }

    public String toCsv(AuditReport report) {
        List<String> lines = new ArrayList<>();
        lines.add(CSV_HEADER);
        for (AuditCheckResult result : report.results()) {
            lines.add(Csv.quote(result.check().displayName()) + "," + result.issueCount() + ","
                    + Csv.quote(result.summary()));
        }
        return String.join("\n", lines);
    }

    public String toText(AuditReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("DICTIONARY AUDIT REPORT\n");
        sb.append("=".repeat(50)).append("\n\n");
        sb.append("Total Entries: ").append(report.totalEntries()).append('\n');
        sb.append("Audit Score: ").append(Csv.number(report.score())).append("%\n");
        sb.append("Suppressed by exclusion list: ").append(report.suppressions().size()).append("\n\n");

        for (AuditCheckResult result : report.results()) {
            if (result.issueCount() == 0) {
                continue;
            }
            String title = result.check().displayName();
            sb.append(title.toUpperCase(Locale.ROOT)).append('\n');
            sb.append("-".repeat(title.length())).append('\n');
            sb.append(result.summary()).append("\n\n");

            List<AuditIssue> issues = result.issues();
            for (AuditIssue issue : issues.subList(0, Math.min(PROSE_EXAMPLES, issues.size()))) {
                sb.append("• \"").append(issue.english()).append("\" [")
                        .append(issue.severity().name().toLowerCase(Locale.ROOT)).append("]\n");
                sb.append("  Ancient: \"").append(nullToEmpty(issue.ancient())).append("\"\n");
                sb.append("  Modern: \"").append(nullToEmpty(issue.modern())).append("\"\n");
                sb.append("  Issue: ").append(issue.reason()).append('\n');
                sb.append("  Recommendation: ").append(issue.recommendation()).append("\n\n");
            }
            if (issues.size() > PROSE_EXAMPLES) {
                sb.append("... and ").append(issues.size() - PROSE_EXAMPLES).append(" more issues\n\n");
            }
        }
        return sb.toString();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
