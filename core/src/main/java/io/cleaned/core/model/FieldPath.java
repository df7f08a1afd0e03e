package io.cleaned.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Location of a failure inside a validated value, e.g. {@code address.lines[1]}.
 *
 * @param segments the steps from the record root, outermost first
 */
public record FieldPath(List<PathSegment> segments) {

    public FieldPath {
        Objects.requireNonNull(segments, "segments must not be null");
        segments = List.copyOf(segments);
    }

    public static FieldPath root() {
        return new FieldPath(List.of());
    }

    public static FieldPath of(PathSegment... segments) {
        return new FieldPath(List.of(segments));
    }

    /** Returns a new path with {@code segment} appended. */
    public FieldPath child(PathSegment segment) {
        List<PathSegment> next = new ArrayList<>(segments.size() + 1);
        next.addAll(segments);
        next.add(segment);
        return new FieldPath(next);
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    /** Renders the path in dot/bracket notation. The root renders as an empty string. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (PathSegment segment : segments) {
            segment.appendTo(sb);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
