package io.markupxform.core.engine;

import static io.markupxform.core.testkit.TestTrees.rows;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.markupxform.core.model.DocumentNode;
import io.markupxform.core.model.NodeTag;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CsvTableBuilderTest {

    private final CsvTableBuilder builder = new CsvTableBuilder("moin-csv-table moin-sortable");

    @Test
    @DisplayName("a;b / 1;2 / 3;4 → header [a,b], rows [1,2] [3,4]")
    void headerAndBody() {
        DocumentNode table = builder.build("a;b\n1;2\n3;4", ";");

        assertThat(table.tag()).isEqualTo(NodeTag.TABLE);
        assertThat(table.cssClass()).isEqualTo("moin-csv-table moin-sortable");
        assertThat(table.childNodes()).extracting(DocumentNode::tag)
                .containsExactly(NodeTag.TABLE_HEADER, NodeTag.TABLE_BODY);
        assertThat(rows(table.childNodes().get(0))).containsExactly(List.of("a", "b"));
        assertThat(rows(table.childNodes().get(1))).containsExactly(List.of("1", "2"), List.of("3", "4"));
    }

    @Test
    @DisplayName("Ragged row is kept short, not padded")
    void raggedRow() {
        DocumentNode table = builder.build("a;b\n1", ";");

        assertThat(rows(table.childNodes().get(1))).containsExactly(List.of("1"));
    }

    @Test
    void trailingEmptyCellsAreKept() {
        DocumentNode table = builder.build("a;b;\n1;;", ";");

        assertThat(rows(table.childNodes().get(0))).containsExactly(List.of("a", "b", ""));
        assertThat(rows(table.childNodes().get(1))).containsExactly(List.of("1", "", ""));
    }

    @Test
    @DisplayName("Multi-character separator is matched literally")
    void literalMultiCharSeparator() {
        DocumentNode table = builder.build("a||b.c\n1||2", "||");

        assertThat(rows(table.childNodes().get(0))).containsExactly(List.of("a", "b.c"));
        assertThat(rows(builder.build("a.b", ".").childNodes().get(0))).containsExactly(List.of("a", "b"));
    }

    @Test
    @DisplayName("Empty input → empty header row, no body rows")
    void emptyInput() {
        DocumentNode table = builder.build("", ";");

        DocumentNode header = table.childNodes().get(0);
        assertThat(header.childNodes()).hasSize(1);
        assertThat(header.childNodes().get(0).children()).isEmpty();
        assertThat(table.childNodes().get(1).children()).isEmpty();
    }

    @Test
    void emptyTableClassSetsNoAttribute() {
        assertThat(new CsvTableBuilder("").build("a", ";").attributes()).isEmpty();
    }

    @Test
    void emptySeparatorIsRejected() {
        assertThatThrownBy(() -> builder.build("a", "")).isInstanceOf(IllegalArgumentException.class);
    }
}
