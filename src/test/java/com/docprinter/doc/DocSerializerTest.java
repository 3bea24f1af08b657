package com.docprinter.doc;

import static com.docprinter.doc.Docs.concat;
import static com.docprinter.doc.Docs.group;
import static com.docprinter.doc.Docs.groupWithId;
import static com.docprinter.doc.Docs.hardLine;
import static com.docprinter.doc.Docs.ifBreak;
import static com.docprinter.doc.Docs.indent;
import static com.docprinter.doc.Docs.line;
import static com.docprinter.doc.Docs.lineSuffix;
import static com.docprinter.doc.Docs.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.docprinter.config.LayoutConfig;
import com.docprinter.printer.DocPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import org.junit.jupiter.api.Test;

class DocSerializerTest {

    @Test
    void writesTaggedObjectsInOrder() {
        Doc doc = group(text("a"), line(), indent(text("b")));

        JsonNode tree = DocSerializer.toTree(doc, 100);

        assertThat(tree.get("kind").asText()).isEqualTo("group");
        assertThat(tree.get("break").asBoolean()).isFalse();
        assertThat(tree.has("id")).isFalse();
        JsonNode parts = tree.get("contents").get("parts");
        assertThat(parts).hasSize(3);
        assertThat(parts.get(0).get("value").asText()).isEqualTo("a");
        assertThat(parts.get(1).get("lineKind").asText()).isEqualTo("soft");
        assertThat(parts.get(2).get("kind").asText()).isEqualTo("indent");
        assertThat(parts.get(2).get("contents").get("value").asText()).isEqualTo("b");
    }

    @Test
    void namesDistinctGroupIdsApart() {
        GroupId first = GroupId.create("args");
        GroupId second = GroupId.create("args");
        Doc doc = concat(
                groupWithId(first, text("a")),
                groupWithId(second, text("b")),
                ifBreak(text("x"), text("y"), second));

        JsonNode parts = DocSerializer.toTree(doc, 100).get("parts");

        assertThat(parts.get(0).get("id").asText()).isEqualTo("args");
        assertThat(parts.get(1).get("id").asText()).isEqualTo("args#2");
        assertThat(parts.get(2).get("groupId").asText()).isEqualTo("args#2");
    }

    @Test
    void readBackDocumentPrintsTheSame() throws Exception {
        GroupId id = GroupId.create("call");
        Doc doc = concat(
                text("f("),
                groupWithId(id, indent(Docs.softLine(), Docs.fill(text("alpha"), line(), text("beta"))), Docs.softLine()),
                ifBreak(text(""), text(")"), id),
                lineSuffix(" // note"),
                hardLine(),
                Docs.trim(),
                Docs.breakParent());
        LayoutConfig config = LayoutConfig.builder().maxWidth(8).build();

        Doc read = DocSerializer.fromJson(DocSerializer.toJson(doc, 100), 100);

        assertThat(DocPrinter.print(read, config)).isEqualTo(DocPrinter.print(doc, config));
    }

    @Test
    void readsDocumentsWithoutIdsAsEqualValues() {
        Doc doc = Docs.group(Docs.concat(text("a"), Docs.literalLine(), text("b")), true);

        assertThat(DocSerializer.fromTree(DocSerializer.toTree(doc, 100), 100)).isEqualTo(doc);
    }

    @Test
    void rejectsUnknownKinds() {
        assertThatThrownBy(() -> DocSerializer.fromJson("{\"kind\":\"align\"}", 100))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("align");
    }

    @Test
    void enforcesDepthLimit() {
        Doc deep = nestedConcat(20);

        assertThatThrownBy(() -> DocSerializer.toTree(deep, 10)).isInstanceOf(RecursionTooDeepException.class);
    }

    @Test
    void writesAndReadsDocumentAtTheDepthCeiling() throws Exception {
        Doc doc = nestedConcat(1000);
        LayoutConfig config = LayoutConfig.defaults();

        String json = DocSerializer.toJson(doc, config.getMaxDepth());
        Doc read = DocSerializer.fromJson(json, config.getMaxDepth());

        assertThat(DocPrinter.print(read, config)).isEqualTo("x");
        assertThat(read).isEqualTo(doc);
    }

    @Test
    void rejectsDocumentOneLevelPastTheCeiling() {
        Doc doc = nestedConcat(1001);

        assertThatThrownBy(() -> DocSerializer.toJson(doc, 1000))
                .isInstanceOf(RecursionTooDeepException.class);
    }

    @Test
    void handlesVeryDeepDocumentsWithoutRecursing() {
        LayoutConfig config = LayoutConfig.builder().maxDepth(100_000).build();
        Doc doc = nestedConcat(90_000);

        JsonNode tree = DocSerializer.toTree(doc, config.getMaxDepth());
        Doc read = DocSerializer.fromTree(tree, config.getMaxDepth());

        assertThat(DocPrinter.print(read, config)).isEqualTo("x");
    }

    private static Doc nestedConcat(int levels) {
        Doc doc = text("x");
        for (int i = 0; i < levels; i++) {
            doc = new Concat(List.of(doc));
        }
        return doc;
    }
}
