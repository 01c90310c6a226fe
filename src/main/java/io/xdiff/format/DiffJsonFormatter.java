package io.xdiff.format;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.xdiff.diff.DiffSummary;
import io.xdiff.model.DiffRecord;
import io.xdiff.model.TablePath;
import io.xdiff.model.TableRef;

/**
 * JSON report of a finished diff:
 *
 * <pre>
 * { "version": "1.0.0", "status": "success", "result": "identical" | "different", "model": ...,
 *   "dataset1": [schema, table], "dataset2": [schema, table],
 *   "rows": { "exclusive": { "dataset1": [...], "dataset2": [...] }, "diff": [...] },
 *   "summary": {...} | null, "columns": null }
 * </pre>
 *
 * Every row is an object keyed by column name; exclusive rows hold {@code isPK} and {@code value},
 * changed rows hold {@code isPK}, {@code dataset1}, {@code dataset2} and {@code isDiff}.
 */
public class DiffJsonFormatter {

    public static final String VERSION = "1.0.0";

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public String format(List<DiffRecord> records, TableRef left, TableRef right, DiffSummary summary,
                         String model) {
        try {
            return objectMapper.writeValueAsString(toJson(records, left, right, summary, model));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render diff report", e);
        }
    }

    /**
     * @param summary statistics to include, or {@code null} to leave the summary out
     * @param model   name of the compared model, or {@code null}
     */
    public ObjectNode toJson(List<DiffRecord> records, TableRef left, TableRef right, DiffSummary summary,
                             String model) {
        ObjectNode rootNode = objectMapper.createObjectNode();
        rootNode.put("version", VERSION);
        rootNode.put("status", summary == null || summary.getStatus() != DiffSummary.DiffStatus.FAILED
                ? "success" : "failed");
        rootNode.put("result", records.isEmpty() ? "identical" : "different");
        rootNode.put("model", model);
        rootNode.set("dataset1", datasetPath(left.getPath()));
        rootNode.set("dataset2", datasetPath(right.getPath()));

        ArrayNode exclusive1 = objectMapper.createArrayNode();
        ArrayNode exclusive2 = objectMapper.createArrayNode();
        ArrayNode diff = objectMapper.createArrayNode();
        for (DiffRecord r : records) {
            switch (r.getKind()) {
                case REMOVED:
                    exclusive1.add(exclusiveRow(left.getKeyColumn(), r.getKey(), r.getLeftValues()));
                    break;
                case ADDED:
                    exclusive2.add(exclusiveRow(right.getKeyColumn(), r.getKey(), r.getRightValues()));
                    break;
                default:
                    diff.add(changedRow(left.getKeyColumn(), r));
            }
        }
        ObjectNode rows = rootNode.putObject("rows");
        ObjectNode exclusive = rows.putObject("exclusive");
        exclusive.set("dataset1", exclusive1);
        exclusive.set("dataset2", exclusive2);
        rows.set("diff", diff);

        if (summary == null) {
            rootNode.putNull("summary");
        } else {
            rootNode.set("summary", summaryNode(records, summary));
        }
        rootNode.putNull("columns");
        return rootNode;
    }

    private ArrayNode datasetPath(TablePath path) {
        ArrayNode node = objectMapper.createArrayNode();
        if (path.hasSchema()) {
            node.add(path.getSchemaName());
        }
        node.add(path.getTableName());
        return node;
    }

    private ObjectNode exclusiveRow(String keyColumn, Object key, Map<String, String> values) {
        ObjectNode row = objectMapper.createObjectNode();
        ObjectNode keyNode = row.putObject(keyColumn);
        keyNode.put("isPK", true);
        keyNode.put("value", DiffTextFormatter.keyText(key));
        values.forEach((column, value) -> {
            ObjectNode c = row.putObject(column);
            c.put("isPK", false);
            c.put("value", value);
        });
        return row;
    }

    private ObjectNode changedRow(String keyColumn, DiffRecord record) {
        ObjectNode row = objectMapper.createObjectNode();
        String key = DiffTextFormatter.keyText(record.getKey());
        ObjectNode keyNode = row.putObject(keyColumn);
        keyNode.put("isPK", true);
        keyNode.put("dataset1", key);
        keyNode.put("dataset2", key);
        keyNode.put("isDiff", false);
        // columns pair up by position; the left name labels the pair
        String[] rightValues = record.getRightValues().values().toArray(new String[0]);
        int i = 0;
        for (Map.Entry<String, String> e : record.getLeftValues().entrySet()) {
            String rightValue = rightValues[i++];
            ObjectNode c = row.putObject(e.getKey());
            c.put("isPK", false);
            c.put("dataset1", e.getValue());
            c.put("dataset2", rightValue);
            c.put("isDiff", !Objects.equals(e.getValue(), rightValue));
        }
        return row;
    }

    private ObjectNode summaryNode(List<DiffRecord> records, DiffSummary summary) {
        ObjectNode node = objectMapper.createObjectNode();
        ObjectNode rows = node.putObject("rows");
        ObjectNode total = rows.putObject("total");
        total.put("dataset1", summary.getLeftRowCount());
        total.put("dataset2", summary.getRightRowCount());
        ObjectNode exclusive = rows.putObject("exclusive");
        exclusive.put("dataset1", summary.getRemoved());
        exclusive.put("dataset2", summary.getAdded());
        rows.put("updated", summary.getChanged());
        rows.put("unchanged", DiffStatsFormatter.unchanged(summary));

        ObjectNode stats = node.putObject("stats");
        ObjectNode diffCounts = stats.putObject("diffCounts");
        columnDiffCounts(records).forEach(diffCounts::put);
        stats.put("segments", summary.getSegments());
        stats.put("exactDiffs", summary.getExactDiffs());
        stats.put("queries", summary.getLeftQueries() + summary.getRightQueries());
        stats.put("retries", summary.getRetries());
        stats.put("failedSegments", summary.getFailedSegments());
        return node;
    }

    /**
     * Per column, the number of changed rows whose value differs in that column.
     */
    static Map<String, Long> columnDiffCounts(List<DiffRecord> records) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (DiffRecord r : records) {
            if (r.getKind() != DiffRecord.Kind.CHANGED) {
                continue;
            }
            String[] rightValues = r.getRightValues().values().toArray(new String[0]);
            int i = 0;
            for (Map.Entry<String, String> e : r.getLeftValues().entrySet()) {
                if (!Objects.equals(e.getValue(), rightValues[i++])) {
                    counts.merge(e.getKey(), 1L, Long::sum);
                }
            }
        }
        return counts;
    }
}
