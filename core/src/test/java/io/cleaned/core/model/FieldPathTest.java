package io.cleaned.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FieldPath rendering")
class FieldPathTest {

    @Test
    @DisplayName("Names are dot-separated, indices and keys bracketed")
    void rendersMixedSegments() {
        FieldPath path = FieldPath.of(
                PathSegment.name("items"), PathSegment.index(2), PathSegment.name("tags"), PathSegment.key("primary"));

        assertThat(path.render()).isEqualTo("items[2].tags[primary]");
        assertThat(path).hasToString("items[2].tags[primary]");
    }

    @Test
    @DisplayName("A path starting with an index has no leading dot")
    void leadingIndex() {
        assertThat(FieldPath.of(PathSegment.index(0), PathSegment.name("zip")).render())
                .isEqualTo("[0].zip");
    }

    @Test
    @DisplayName("Root path renders empty")
    void rootIsEmpty() {
        assertThat(FieldPath.root().isRoot()).isTrue();
        assertThat(FieldPath.root().render()).isEmpty();
    }

    @Test
    @DisplayName("child() returns a new path and leaves the receiver unchanged")
    void childIsImmutable() {
        FieldPath parent = FieldPath.of(PathSegment.name("address"));
        FieldPath child = parent.child(PathSegment.name("zip"));

        assertThat(parent.render()).isEqualTo("address");
        assertThat(child.render()).isEqualTo("address.zip");
        assertThat(child.segments()).hasSize(2);
    }

    @Test
    @DisplayName("Keys use their string form")
    void keyUsesStringForm() {
        assertThat(PathSegment.key(42L)).isEqualTo(new PathSegment.Key("42"));
        assertThat(PathSegment.key(42L)).hasToString("[42]");
    }

    @Test
    @DisplayName("A failed key renders apart from the value under the same key")
    void failedKeyHasOwnAddress() {
        assertThat(FieldPath.of(PathSegment.name("scores"), PathSegment.keyOf(0)).render())
                .isEqualTo("scores[0:key]");
        assertThat(PathSegment.keyOf(0)).isNotEqualTo(PathSegment.key(0)).isNotEqualTo(PathSegment.index(0));
    }

    @Test
    @DisplayName("Negative index is rejected")
    void negativeIndexRejected() {
        assertThatThrownBy(() -> PathSegment.index(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
