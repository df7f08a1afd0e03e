package io.cleaned.core.error;

import io.cleaned.core.model.ErrorCode;
import io.cleaned.core.model.ErrorNode;
import io.cleaned.core.model.Failure;
import io.cleaned.core.model.PathSegment;
import io.cleaned.core.model.Violation;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Aggregated report of every failure found by one {@code Schema.validate} call. Thrown once per
 * failed call, never per field.
 *
 * <p>Failures are addressed by top-level field name. A field's entry is either a {@link Failure}
 * (the field's own value was rejected) or a nested {@code ValidationError} (failures inside a
 * nested record or container), which can be inspected the same way at any depth:
 *
 * <pre>{@code
 * try {
 *     schema.validate(raw);
 * } catch (ValidationError e) {
 *     e.failure("age");                       // Optional[required: this field is required]
 *     e.nested("address").flatMap(a -> a.failure("zip"));
 *     e.violations();                         // [(path, message, code), ...]
 * }
 * }</pre>
 *
 * <p>Immutable.
 */
public final class ValidationError extends CleanedException {

    private static final long serialVersionUID = 1L;

    private final transient ErrorNode.Branch errors;

    public ValidationError(String schemaName, ErrorNode.Branch errors) {
        super(summarize(schemaName, errors), null, schemaName, Phase.VALIDATION, true);
        this.errors = errors;
    }

    private ValidationError(String schemaName, ErrorNode.Branch errors, boolean writableStackTrace) {
        super(summarize(schemaName, errors), null, schemaName, Phase.VALIDATION, writableStackTrace);
        this.errors = errors;
    }

    /** The underlying failure tree. */
    public ErrorNode.Branch errors() {
        return errors;
    }

    /** Failing entries at this level, keyed by segment, in validation order. */
    public Map<PathSegment, ErrorNode> entries() {
        return errors.children();
    }

    /** Names of the failing top-level fields, in declaration order. */
    public Set<String> fields() {
        Set<String> names = new LinkedHashSet<>();
        for (PathSegment segment : errors.children().keySet()) {
            names.add(label(segment));
        }
        return Collections.unmodifiableSet(names);
    }

    /**
     * Returns the failure node for a field name, a container index written as {@code [2]}, a
     * mapping key written as {@code [key]}, or a failed mapping key written as {@code [key:key]}.
     */
    public Optional<ErrorNode> get(String field) {
        for (Map.Entry<PathSegment, ErrorNode> entry : errors.children().entrySet()) {
            if (label(entry.getKey()).equals(field)) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    public Optional<ErrorNode> get(PathSegment segment) {
        return Optional.ofNullable(errors.child(segment));
    }

    /** Returns the field's own failure, or empty if it passed or its failures are nested. */
    public Optional<Failure> failure(String field) {
        return get(field).filter(ErrorNode.Leaf.class::isInstance).map(n -> ((ErrorNode.Leaf) n).failure());
    }

    /** Returns the failures inside a nested record or container field. */
    public Optional<ValidationError> nested(String field) {
        return get(field)
                .filter(ErrorNode.Branch.class::isInstance)
                .map(n -> new ValidationError(qualify(field), (ErrorNode.Branch) n, false));
    }

    public boolean hasFailure(String field) {
        return get(field).isPresent();
    }

    /** Flattens the whole tree into {@code (path, message, code)} triples, depth-first. */
    public List<Violation> violations() {
        return errors.flatten();
    }

    /** Codes of every leaf failure, in {@link #violations()} order. */
    public List<ErrorCode> codes() {
        List<ErrorCode> codes = new ArrayList<>();
        for (Violation v : violations()) {
            codes.add(v.code());
        }
        return Collections.unmodifiableList(codes);
    }

    private String qualify(String field) {
        String parent = schemaName();
        if (parent == null) {
            return field;
        }
        return field.startsWith("[") ? parent + field : parent + "." + field;
    }

    private static String label(PathSegment segment) {
        return segment.toString();
    }

    private static String summarize(String schemaName, ErrorNode.Branch errors) {
        List<Violation> violations = errors.flatten();
        String listed = violations.stream()
                .map(v -> v.path().render() + " (" + v.code().tag() + ")")
                .collect(Collectors.joining(", "));
        String subject = schemaName != null ? "'" + schemaName + "'" : "record";
        return "Validation of " + subject + " failed with " + violations.size() + " violation(s): " + listed;
    }
}
