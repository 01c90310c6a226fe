package io.xdiff.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.xdiff.diff.DiffSummary;
import io.xdiff.diff.SegmentComparison;
import io.xdiff.model.DiffRecord;
import io.xdiff.model.KeyRange;
import io.xdiff.model.KeyType;
import io.xdiff.model.Segment;
import io.xdiff.model.Side;
import io.xdiff.model.TableRef;
import io.xdiff.partition.IntegerKeySpace;

public class DiffJsonFormatterTest {

    private final static TableRef LEFT = TableRef.of(Side.LEFT, "public.items", "id", KeyType.INTEGER,
            Arrays.asList("name", "price"));
    private final static TableRef RIGHT = TableRef.of(Side.RIGHT, "items", "id", KeyType.INTEGER,
            Arrays.asList("name", "amount"));

    private final DiffJsonFormatter formatter = new DiffJsonFormatter();

    private static Map<String, String> values(String name, String price, String priceColumn) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("name", name);
        values.put(priceColumn, price);
        return values;
    }

    private static List<DiffRecord> records() {
        List<DiffRecord> records = new ArrayList<>();
        records.add(DiffRecord.removed(5L, values("item-5", "7.50", "price")));
        records.add(DiffRecord.changed(77L, values("item-77", "115.50", "price"),
                values("item-77", "99.00", "amount")));
        records.add(DiffRecord.added(201L, values("item-201", null, "amount")));
        return records;
    }

    @Test
    public void testIdenticalReport() {
        ObjectNode root = formatter.toJson(new ArrayList<>(), LEFT, RIGHT, null, null);
        assertEquals(DiffJsonFormatter.VERSION, root.get("version").asText());
        assertEquals("success", root.get("status").asText());
        assertEquals("identical", root.get("result").asText());
        assertTrue(root.get("summary").isNull());
        assertTrue(root.get("columns").isNull());
        assertEquals(0, root.get("rows").get("diff").size());
    }

    @Test
    public void testRows() {
        ObjectNode root = formatter.toJson(records(), LEFT, RIGHT, null, "items");
        assertEquals("different", root.get("result").asText());
        assertEquals("items", root.get("model").asText());
        assertEquals("public", root.get("dataset1").get(0).asText());
        assertEquals("items", root.get("dataset1").get(1).asText());
        assertEquals(1, root.get("dataset2").size());

        JsonNode removed = root.get("rows").get("exclusive").get("dataset1").get(0);
        assertTrue(removed.get("id").get("isPK").asBoolean());
        assertEquals("5", removed.get("id").get("value").asText());
        assertEquals("7.50", removed.get("price").get("value").asText());

        JsonNode added = root.get("rows").get("exclusive").get("dataset2").get(0);
        assertEquals("201", added.get("id").get("value").asText());
        assertTrue(added.get("amount").get("value").isNull());

        JsonNode changed = root.get("rows").get("diff").get(0);
        assertEquals("77", changed.get("id").get("dataset1").asText());
        assertFalse(changed.get("name").get("isDiff").asBoolean());
        assertTrue(changed.get("price").get("isDiff").asBoolean());
        assertEquals("115.50", changed.get("price").get("dataset1").asText());
        assertEquals("99.00", changed.get("price").get("dataset2").asText());
    }

    @Test
    public void testSummary() throws Exception {
        IntegerKeySpace keys = new IntegerKeySpace();
        KeyRange range = KeyRange.unbounded(1L, 201L, keys);
        DiffSummary summary = new DiffSummary();
        summary.start();
        summary.segmentCompared(new SegmentComparison(range, new Segment(Side.LEFT, range, 200, BigInteger.ONE),
                new Segment(Side.RIGHT, range, 200, BigInteger.TEN), 16), 0);
        for (DiffRecord r : records()) {
            summary.recordEmitted(r);
        }
        summary.finish(DiffSummary.DiffStatus.SUCCEEDED);

        JsonNode root = new ObjectMapper().readTree(formatter.format(records(), LEFT, RIGHT, summary, null));
        JsonNode rows = root.get("summary").get("rows");
        assertEquals(200, rows.get("total").get("dataset1").asLong());
        assertEquals(1, rows.get("exclusive").get("dataset1").asLong());
        assertEquals(1, rows.get("exclusive").get("dataset2").asLong());
        assertEquals(1, rows.get("updated").asLong());
        assertEquals(198, rows.get("unchanged").asLong());
        assertEquals(1, root.get("summary").get("stats").get("diffCounts").get("price").asLong());
        assertFalse(root.get("summary").get("stats").get("diffCounts").has("name"));
        assertEquals(1, root.get("summary").get("stats").get("segments").asLong());
    }

    @Test
    public void testFailedStatus() {
        DiffSummary summary = new DiffSummary();
        summary.start();
        summary.finish(DiffSummary.DiffStatus.FAILED);
        assertEquals("failed", formatter.toJson(new ArrayList<>(), LEFT, RIGHT, summary, null)
                .get("status").asText());
    }
}
