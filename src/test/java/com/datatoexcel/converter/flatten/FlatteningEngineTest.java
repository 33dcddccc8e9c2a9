package com.datatoexcel.converter.flatten;

import com.datatoexcel.converter.model.Column;
import com.datatoexcel.converter.model.DocumentNode;
import com.datatoexcel.converter.model.ObjectNode;
import com.datatoexcel.converter.model.ScalarNode;
import com.datatoexcel.converter.model.Table;
import com.datatoexcel.converter.parser.DocumentParsers;
import com.datatoexcel.converter.parser.SourceFormat;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FlatteningEngine.
 */
class FlatteningEngineTest {

    private final FlatteningEngine engine = new FlatteningEngine();

    @Test
    void testSplitsListOfObjectsAndNestedScalarLists() {
        Map<String, Table> tables = engine.flatten(json("""
                {"a": 1, "items": [{"x": 1, "tags": ["p", "q"]}, {"x": 2, "tags": ["r"]}]}
                """));

        assertThat(tables).containsOnlyKeys("ROOT", "items", "items.tags1", "items.tags2");

        Table root = tables.get("ROOT");
        assertThat(root.getColumnNames()).containsExactly("a");
        assertThat(values(root, "a")).containsExactly(1);

        Table items = tables.get("items");
        assertThat(items.getColumnNames()).containsExactly("x");
        assertThat(values(items, "x")).containsExactly(1, 2);

        Table tags1 = tables.get("items.tags1");
        assertThat(tags1.getColumnCount()).isEqualTo(1);
        assertThat(values(tags1, "tags")).containsExactly("p", "q");

        Table tags2 = tables.get("items.tags2");
        assertThat(values(tags2, "tags")).containsExactly("r");
    }

    @Test
    void testListOfScalarsAtFirstLevel() {
        Map<String, Table> tables = engine.flatten(json("""
                {"name": "A", "children": ["x", "y", "z"]}
                """));

        assertThat(tables).containsOnlyKeys("ROOT", "children");
        assertThat(tables.get("ROOT").getColumnNames()).containsExactly("name");
        assertThat(values(tables.get("ROOT"), "name")).containsExactly("A");

        Table children = tables.get("children");
        assertThat(children.getColumnNames()).containsExactly("children");
        assertThat(children.getRowCount()).isEqualTo(3);
        assertThat(values(children, "children")).containsExactly("x", "y", "z");
    }

    @Test
    void testNestedObjectsBecomeDottedColumns() {
        Map<String, Table> tables = engine.flatten(json("""
                {"Doc": {"bgr": {"oms": "school", "prj": {"id": 7}}, "empty": {}}}
                """));

        Table root = tables.get("Doc");
        assertThat(root.getColumnNames()).containsExactly("Doc.bgr.oms", "Doc.bgr.prj.id");
        assertThat(values(root, "Doc.bgr.prj.id")).containsExactly(7);
    }

    @Test
    void testRootTakesSingleTopLevelKey() {
        Map<String, Table> tables = engine.flatten(json("""
                {"Doc": {"title": "t", "lines": [{"n": 1}, {"n": 2}]}}
                """));

        assertThat(tables).containsOnlyKeys("Doc", "Doc.lines");
        assertThat(tables.get("Doc").getColumnNames()).containsExactly("Doc.title");
        assertThat(tables.get("Doc.lines").getRowCount()).isEqualTo(2);
    }

    @Test
    void testRootFallsBackWhenTopLevelKeyNamesADerivedTable() {
        Map<String, Table> tables = new FlatteningEngine(EmptyTablePolicy.KEEP_EMPTY).flatten(json("""
                {"items": [{"n": 1}]}
                """));

        assertThat(tables).containsOnlyKeys("ROOT", "items");
        assertThat(tables.get("ROOT").hasColumns()).isFalse();
        assertThat(tables.get("ROOT").getRowCount()).isEqualTo(1);
    }

    @Test
    void testRootAvoidsTopLevelListNamedRoot() {
        Map<String, Table> tables = engine.flatten(json("""
                {"a": 1, "ROOT": [1, 2]}
                """));

        assertThat(tables).containsOnlyKeys("ROOT1", "ROOT");
        assertThat(values(tables.get("ROOT1"), "a")).containsExactly(1);
        assertThat(values(tables.get("ROOT"), "ROOT")).containsExactly(1, 2);
    }

    @Test
    void testRootSkipsEveryTakenSuffix() {
        Map<String, Table> tables = engine.flatten(json("""
                {"a": 1, "ROOT": [1], "ROOT1": [2]}
                """));

        assertThat(tables).containsOnlyKeys("ROOT2", "ROOT", "ROOT1");
        assertThat(tables.get("ROOT2").getColumnNames()).containsExactly("a");
    }

    @Test
    void testTopLevelListUnderEmptyKeyIsRejected() {
        assertThatThrownBy(() -> engine.flatten(json("""
                {"a": 1, "": [1, 2]}
                """)))
                .isInstanceOf(FlatteningException.class)
                .hasMessageContaining("empty field name");
    }

    @Test
    void testChildNameClashIsReported() {
        Map<String, Table> ordinals = engine.flatten(json("""
                {"a": 0, "t": [{"b1": [1]}, {"x": 2}, {"x": 3}, {"x": 4}, {"x": 5}, {"x": 6},
                               {"x": 7}, {"x": 8}, {"x": 9}, {"x": 10}, {"x": 11}]}
                """));
        assertThat(ordinals).containsKey("t.b11");

        assertThatThrownBy(() -> engine.flatten(json("""
                {"a": 0, "t": [{"b1": [1]}, {"x": 2}, {"x": 3}, {"x": 4}, {"x": 5}, {"x": 6},
                               {"x": 7}, {"x": 8}, {"x": 9}, {"x": 10}, {"b": [11]}]}
                """)))
                .isInstanceOf(FlatteningException.class)
                .hasMessage("Two derived tables share the name t.b11");
    }

    @Test
    void testRowOrdinalCountsAllRowsOfParent() {
        Map<String, Table> tables = engine.flatten(json("""
                {"items": [{"x": 1}, {"x": 2, "tags": ["a"]}, {"x": 3, "tags": "none"}, {"x": 4, "tags": ["b", "c"]}]}
                """));

        assertThat(tables).containsKeys("items.tags2", "items.tags4");
        assertThat(tables).doesNotContainKeys("items.tags1", "items.tags3");
        assertThat(values(tables.get("items.tags4"), "tags")).containsExactly("b", "c");
    }

    @Test
    void testExpandedColumnIsRemovedFromEveryRow() {
        Map<String, Table> tables = engine.flatten(json("""
                {"items": [{"x": 1, "tags": "single"}, {"x": 2, "tags": ["a"]}]}
                """));

        Table items = tables.get("items");
        assertThat(items.getColumnNames()).containsExactly("x");
        assertThat(items.getRowCount()).isEqualTo(2);
    }

    @Test
    void testDeepNestingReachesFixedPoint() {
        Map<String, Table> tables = engine.flatten(json("""
                {"orders": [
                  {"id": 1, "lines": [
                    {"sku": "A", "parts": [{"p": "bolt", "sizes": [3, 4]}]},
                    {"sku": "B", "parts": []}
                  ]}
                ]}
                """));

        assertThat(tables).containsOnlyKeys("orders", "orders.lines1", "orders.lines1.parts1",
                "orders.lines1.parts1.sizes1");
        assertThat(tables.values()).noneMatch(Table::containsListCells);
        assertThat(tables.get("orders.lines1").getColumnNames()).containsExactly("sku");
        assertThat(tables.get("orders.lines1.parts1").getColumnNames()).containsExactly("p");
        assertThat(values(tables.get("orders.lines1.parts1.sizes1"), "sizes")).containsExactly(3, 4);
    }

    @Test
    void testEmptyNestedListIsDroppedByDefault() {
        String document = """
                {"id": 1, "lines": [{"sku": "A", "parts": []}]}
                """;

        assertThat(engine.flatten(json(document))).containsOnlyKeys("ROOT", "lines");

        Map<String, Table> kept = new FlatteningEngine(EmptyTablePolicy.KEEP_EMPTY).flatten(json(document));
        assertThat(kept).containsOnlyKeys("ROOT", "lines", "lines.parts1");
        assertThat(kept.get("lines.parts1").getColumnCount()).isZero();
    }

    @Test
    void testParentLosingAllColumnsIsDroppedByDefault() {
        String document = """
                {"groups": [{"members": ["a", "b"]}]}
                """;

        assertThat(engine.flatten(json(document))).containsOnlyKeys("groups.members1");

        Map<String, Table> kept = new FlatteningEngine(EmptyTablePolicy.KEEP_EMPTY).flatten(json(document));
        assertThat(kept).containsOnlyKeys("ROOT", "groups", "groups.members1");
        assertThat(kept.get("groups").getRowCount()).isEqualTo(1);
    }

    @Test
    void testMissingFieldsBecomeNullCells() {
        Map<String, Table> tables = engine.flatten(json("""
                {"rows": [{"a": 1}, {"b": 2.5}]}
                """));

        Table rows = tables.get("rows");
        assertThat(rows.getColumnNames()).containsExactly("a", "b");
        assertThat(rows.getCell(1, "a")).isEqualTo(ScalarNode.NULL);
        assertThat(rows.getCell(0, "b")).isEqualTo(ScalarNode.NULL);
        assertThat(rows.getCell(1, "b")).isEqualTo(ScalarNode.of(new BigDecimal("2.5")));
    }

    @Test
    void testRowConservation() {
        Map<String, Table> tables = engine.flatten(json("""
                {"s": [1, 2, 3, 4, 5], "o": [{"k": 1}, {"k": 2}, {}]}
                """));

        assertThat(tables.get("s").getRowCount()).isEqualTo(5);
        assertThat(tables.get("o").getRowCount()).isEqualTo(3);
    }

    @Test
    void testFlatteningIsDeterministic() {
        String document = """
                {"a": [{"b": [{"c": [1, 2]}, {"c": [3]}]}, {"b": [{"c": []}]}], "d": {"e": [true, false]}}
                """;

        Map<String, Table> first = new FlatteningEngine(EmptyTablePolicy.KEEP_EMPTY).flatten(json(document));
        Map<String, Table> second = new FlatteningEngine(EmptyTablePolicy.KEEP_EMPTY).flatten(json(document));

        assertThat(first.keySet()).containsExactlyElementsOf(second.keySet());
        first.forEach((name, table) -> {
            Table other = second.get(name);
            assertThat(table.getColumnNames()).containsExactlyElementsOf(other.getColumnNames());
            for (String column : table.getColumnNames()) {
                assertThat(values(table, column)).containsExactlyElementsOf(values(other, column));
            }
        });
        assertThat(first).containsKeys("a", "a.b1", "a.b2", "a.b1.c1", "a.b1.c2", "a.b2.c1", "d.e");
    }

    @Test
    void testListOfListsIsRejected() {
        assertThatThrownBy(() -> engine.flatten(json("""
                {"matrix": [[1, 2], [3, 4]]}
                """)))
                .isInstanceOf(FlatteningException.class)
                .hasMessageContaining("List of lists")
                .hasMessageContaining("matrix");
    }

    @Test
    void testNestedListOfListsIsRejected() {
        assertThatThrownBy(() -> engine.flatten(json("""
                {"items": [{"grid": [[1], [2]]}]}
                """)))
                .isInstanceOf(FlatteningException.class)
                .hasMessageContaining("items.grid1");
    }

    @Test
    void testMixedListIsRejected() {
        assertThatThrownBy(() -> engine.flatten(json("""
                {"mixed": [1, {"a": 2}]}
                """)))
                .isInstanceOf(FlatteningException.class)
                .hasMessageContaining("mixes scalar and object");
    }

    @Test
    void testResultIsReadOnly() {
        Map<String, Table> tables = engine.flatten(json("""
                {"a": 1}
                """));

        assertThatThrownBy(() -> tables.remove("ROOT")).isInstanceOf(UnsupportedOperationException.class);
    }

    private static ObjectNode json(String content) {
        return DocumentParsers.forFormat(SourceFormat.JSON).parse(content);
    }

    private static List<Object> values(Table table, String column) {
        Column cells = table.getColumn(column).orElseThrow();
        return cells.getCells().stream()
                .map(FlatteningEngineTest::value)
                .collect(Collectors.toList());
    }

    private static Object value(DocumentNode node) {
        return ((ScalarNode) node).getValue();
    }
}
