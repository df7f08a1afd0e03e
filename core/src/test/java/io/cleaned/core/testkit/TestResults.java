package io.cleaned.core.testkit;

import io.cleaned.core.model.ErrorNode;
import io.cleaned.core.model.Failure;
import io.cleaned.core.model.Result;
import io.cleaned.core.model.Violation;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Shorthands for inspecting validator results and building raw input in tests. */
public final class TestResults {

    private TestResults() {}

    /**
     * Returns the single failure of an invalid scalar result.
     *
     * @throws AssertionError if the result is valid or its failure is a subtree
     */
    public static Failure failureOf(Result<?> result) {
        if (result.isValid()) {
            throw new AssertionError("expected an invalid result, got " + result);
        }
        if (!(result.error() instanceof ErrorNode.Leaf)) {
            throw new AssertionError("expected a leaf failure, got " + result.error());
        }
        return ((ErrorNode.Leaf) result.error()).failure();
    }

    /** Rendered paths of every failure in an invalid result, e.g. {@code [[1], [3]]}. */
    public static List<String> failedPaths(Result<?> result) {
        return result.error().flatten().stream()
                .map(v -> v.path().render())
                .collect(Collectors.toList());
    }

    public static List<Violation> violationsOf(Result<?> result) {
        return result.error().flatten();
    }

    /** Builds an insertion-ordered map from alternating keys and values; values may be null. */
    public static Map<String, Object> raw(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("expected key/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }
}
