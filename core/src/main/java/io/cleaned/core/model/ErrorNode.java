package io.cleaned.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tree of validation failures. A {@link Leaf} holds the failure of a single value; a
 * {@link Branch} holds the failures of a composite value (record fields, list elements, map
 * entries) keyed by the {@link PathSegment} that addresses each child.
 *
 * <p>Branch children keep insertion order, which is the order in which the validator visited
 * them (field declaration order for records, element order for containers).
 *
 * <p>Thread-safe and immutable.
 */
public sealed interface ErrorNode {

    /**
     * Appends every leaf failure under this node to {@code out}, each prefixed by its full
     * path. Traversal is depth-first in child order.
     */
    void collect(FieldPath prefix, List<Violation> out);

    /** Flattens this node into {@code (path, failure)} pairs relative to this node. */
    default List<Violation> flatten() {
        List<Violation> out = new ArrayList<>();
        collect(FieldPath.root(), out);
        return Collections.unmodifiableList(out);
    }

    static Leaf leaf(Failure failure) {
        return new Leaf(failure);
    }

    static Builder branch() {
        return new Builder();
    }

    /** Failure of one value. */
    record Leaf(Failure failure) implements ErrorNode {
        public Leaf {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public void collect(FieldPath prefix, List<Violation> out) {
            out.add(new Violation(prefix, failure));
        }
    }

    /** Failures of the children of a composite value. Never empty. */
    record Branch(Map<PathSegment, ErrorNode> children) implements ErrorNode {
        public Branch {
            Objects.requireNonNull(children, "children must not be null");
            if (children.isEmpty()) {
                throw new IllegalArgumentException("a branch must have at least one child");
            }
            children = Collections.unmodifiableMap(new LinkedHashMap<>(children));
        }

        public ErrorNode child(PathSegment segment) {
            return children.get(segment);
        }

        @Override
        public void collect(FieldPath prefix, List<Violation> out) {
            for (Map.Entry<PathSegment, ErrorNode> entry : children.entrySet()) {
                entry.getValue().collect(prefix.child(entry.getKey()), out);
            }
        }
    }

    /**
     * Accumulates child failures while a composite value is being validated. Not thread-safe;
     * each validate call uses its own builder.
     */
    final class Builder {

        private final Map<PathSegment, ErrorNode> children = new LinkedHashMap<>();

        Builder() {}

        /** Records a child failure. A later failure for the same segment replaces the earlier one. */
        public Builder put(PathSegment segment, ErrorNode node) {
            children.put(Objects.requireNonNull(segment, "segment"), Objects.requireNonNull(node, "node"));
            return this;
        }

        public Builder put(PathSegment segment, Failure failure) {
            return put(segment, new Leaf(failure));
        }

        public boolean contains(PathSegment segment) {
            return children.containsKey(segment);
        }

        public boolean isEmpty() {
            return children.isEmpty();
        }

        /** @throws IllegalStateException if nothing was recorded */
        public Branch build() {
            if (children.isEmpty()) {
                throw new IllegalStateException("no failures recorded");
            }
            return new Branch(children);
        }
    }
}
