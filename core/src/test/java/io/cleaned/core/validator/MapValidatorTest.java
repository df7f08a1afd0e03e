package io.cleaned.core.validator;

import static io.cleaned.core.testkit.TestResults.failedPaths;
import static io.cleaned.core.testkit.TestResults.failureOf;
import static io.cleaned.core.testkit.TestResults.raw;
import static io.cleaned.core.testkit.TestResults.violationsOf;
import static io.cleaned.core.validator.Validators.integer;
import static io.cleaned.core.validator.Validators.mapOf;
import static io.cleaned.core.validator.Validators.str;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.tuple;

import io.cleaned.core.model.ErrorCode;
import io.cleaned.core.model.ErrorNode;
import io.cleaned.core.model.Failure;
import io.cleaned.core.model.PathSegment;
import io.cleaned.core.model.Result;
import io.cleaned.core.model.Violation;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MapValidator")
class MapValidatorTest {

    @Test
    @DisplayName("Keys and values are cleaned, order kept")
    void cleansEntries() {
        Map<String, Long> cleaned = mapOf(integer()).validate(raw(" b ", "2", "a", 1)).value();

        assertThat(cleaned).containsExactly(entry("b", 2L), entry("a", 1L));
    }

    @Test
    @DisplayName("Value failures are reported under the cleaned key")
    void valueFailureUnderKey() {
        Result<Map<String, Long>> result = mapOf(integer()).validate(raw("a", "1", " b ", "x"));

        assertThat(failedPaths(result)).containsExactly("[b]");
        ErrorNode.Branch branch = (ErrorNode.Branch) result.error();
        assertThat(branch.child(PathSegment.key("b")))
                .isEqualTo(ErrorNode.leaf(Failure.typeError("an integer", "x")));
    }

    @Test
    @DisplayName("Key failures are reported under the raw key with a :key suffix")
    void keyFailureUnderRawKey() {
        Result<Map<Long, String>> result = mapOf(integer(), str()).validate(raw("x", "v", "2", "", "3", "w"));

        ErrorNode.Branch branch = (ErrorNode.Branch) result.error();
        assertThat(branch.children()).containsOnlyKeys(PathSegment.keyOf("x"), PathSegment.key(2L));
        assertThat(((ErrorNode.Leaf) branch.child(PathSegment.keyOf("x"))).failure().code())
                .isEqualTo(ErrorCode.TYPE_ERROR);
        assertThat(((ErrorNode.Leaf) branch.child(PathSegment.key(2L))).failure().code())
                .isEqualTo(ErrorCode.BLANK);
        assertThat(failedPaths(result)).containsExactly("[x:key]", "[2]");
    }

    @Test
    @DisplayName("With integer keys, a key failure and a value failure keep distinct paths")
    void integerKeysDoNotCollide() {
        Map<Object, Object> input = new LinkedHashMap<>();
        input.put("x", 1);
        input.put(0, "bad");

        Result<Map<Long, Long>> result = mapOf(integer(), integer()).validate(input);

        assertThat(failedPaths(result)).containsExactly("[x:key]", "[0]").doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Failed raw keys with the same string form are told apart by position")
    void sameStringFormKeys() {
        Map<Object, Object> input = new LinkedHashMap<>();
        input.put(1, "a");
        input.put("1", "b");

        Result<Map<Long, String>> result = mapOf(integer().min(5), str()).validate(input);

        assertThat(failedPaths(result)).containsExactly("[1:key]", "[1#1:key]");
    }

    @Test
    @DisplayName("Raw keys that clean to the same key are a duplicate_key under the later raw key")
    void duplicateKey() {
        Result<Map<String, Long>> result = mapOf(integer()).validate(raw("a", 1, " a", 2));

        ErrorNode.Branch branch = (ErrorNode.Branch) result.error();
        assertThat(branch.children()).containsOnlyKeys(PathSegment.keyOf(" a"));
        assertThat(((ErrorNode.Leaf) branch.child(PathSegment.keyOf(" a"))).failure())
                .isEqualTo(Failure.of(ErrorCode.DUPLICATE_KEY, "duplicate key 'a' after cleaning"));
    }

    @Test
    @DisplayName("A duplicate key keeps the failure of the first entry's value")
    void duplicateKeepsValueFailure() {
        Result<Map<String, Long>> result = mapOf(integer()).validate(raw("a", "notanint", " a", 2));

        assertThat(violationsOf(result))
                .extracting(v -> v.path().render(), Violation::code)
                .containsExactly(tuple("[a]", ErrorCode.TYPE_ERROR), tuple("[ a:key]", ErrorCode.DUPLICATE_KEY));
    }

    @Test
    @DisplayName("Non-mappings are a type_error")
    void notAMapping() {
        assertThat(failureOf(mapOf(integer()).validate(new ArrayList<>())))
                .isEqualTo(Failure.of(ErrorCode.TYPE_ERROR, "expected a mapping, got ArrayList"));
    }

    @Test
    @DisplayName("Entry count limits")
    void entryCount() {
        assertThat(failureOf(mapOf(integer()).maxLength(1).validate(raw("a", 1, "b", 2))))
                .isEqualTo(Failure.of(ErrorCode.MAX_LENGTH, "entry count must be ≤ 1"));
    }
}
