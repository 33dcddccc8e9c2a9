package com.datatoexcel.converter.parser;

import com.datatoexcel.converter.model.DocumentNode;
import com.datatoexcel.converter.model.ListNode;
import com.datatoexcel.converter.model.ObjectNode;
import com.datatoexcel.converter.model.ScalarNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for JacksonDocumentParser, in both its json and yml flavours.
 */
class JacksonDocumentParserTest {

    @TempDir
    Path tempDir;

    private final DocumentParser json = DocumentParsers.forFormat(SourceFormat.JSON);
    private final DocumentParser yml = DocumentParsers.forFormat(SourceFormat.YML);

    @Test
    void testJsonKeepsFieldOrderAndTypes() {
        ObjectNode document = json.parse("{\"b\": 1, \"a\": 2.50, \"c\": true, \"d\": null, \"e\": \"t\"}");

        assertThat(document.fieldNames()).containsExactly("b", "a", "c", "d", "e");
        assertThat(field(document, "b")).isEqualTo(ScalarNode.of(1));
        assertThat((BigDecimal) ((ScalarNode) field(document, "a")).getValue()).isEqualByComparingTo("2.5");
        assertThat(field(document, "c")).isEqualTo(ScalarNode.of(true));
        assertThat(field(document, "d")).isEqualTo(ScalarNode.NULL);
        assertThat(field(document, "e")).isEqualTo(ScalarNode.of("t"));
    }

    @Test
    void testJsonArraysBecomeLists() {
        ObjectNode document = json.parse("{\"items\": [{\"x\": 1}, {\"x\": 2}]}");

        assertThat(field(document, "items")).isInstanceOf(ListNode.class);
        assertThat(((ListNode) field(document, "items")).size()).isEqualTo(2);
    }

    @Test
    void testJsonRootMustBeObject() {
        assertThatThrownBy(() -> json.parse("[1, 2]"))
                .isInstanceOf(DocumentParseException.class)
                .hasMessage("Document root must be an object, found list");
    }

    @Test
    void testInvalidJsonFails() {
        assertThatThrownBy(() -> json.parse("{\"a\": "))
                .isInstanceOf(DocumentParseException.class)
                .hasMessageStartingWith("Invalid json document");
    }

    @Test
    void testEmptyJsonFails() {
        assertThatThrownBy(() -> json.parse(""))
                .isInstanceOf(DocumentParseException.class)
                .hasMessageContaining("empty document");
    }

    @Test
    void testYamlDocument() {
        ObjectNode document = yml.parse("name: A\nchildren:\n  - x\n  - y\n");

        assertThat(document.fieldNames()).containsExactly("name", "children");
        assertThat(((ListNode) field(document, "children")).getElements())
                .containsExactly(ScalarNode.of("x"), ScalarNode.of("y"));
    }

    @Test
    void testYamlScalarRootRejected() {
        assertThatThrownBy(() -> yml.parse("just text"))
                .isInstanceOf(DocumentParseException.class)
                .hasMessage("Document root must be an object, found scalar");
    }

    @Test
    void testBothYamlExtensionsAccepted() throws IOException {
        Path yaml = Files.writeString(tempDir.resolve("doc.yaml"), "a: 1\n");
        Path yamlUpper = Files.writeString(tempDir.resolve("doc.YML"), "a: 2\n");

        assertThat(field(yml.parse(yaml), "a")).isEqualTo(ScalarNode.of(1));
        assertThat(field(yml.parse(yamlUpper), "a")).isEqualTo(ScalarNode.of(2));
    }

    @Test
    void testExtensionMismatchRejected() throws IOException {
        Path file = Files.writeString(tempDir.resolve("doc.yml"), "a: 1\n");

        assertThatThrownBy(() -> json.parse(file))
                .isInstanceOf(DocumentParseException.class)
                .hasMessage("This is no .json file: " + file);
    }

    @Test
    void testMissingFileFails() {
        Path file = tempDir.resolve("absent.json");

        assertThatThrownBy(() -> json.parse(file))
                .isInstanceOf(DocumentParseException.class)
                .hasMessageStartingWith("Failed to read " + file);
    }

    private static DocumentNode field(ObjectNode node, String name) {
        return node.get(name).orElseThrow();
    }
}
