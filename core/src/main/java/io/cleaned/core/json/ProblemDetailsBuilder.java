package io.cleaned.core.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cleaned.core.error.ValidationError;
import io.cleaned.core.model.ErrorNode;
import io.cleaned.core.model.PathSegment;
import io.cleaned.core.model.Violation;
import java.util.Map;

/**
 * Renders a {@link ValidationError} for API responses.
 *
 * <ul>
 * <li>{@link #build}: RFC 9457 Problem Details with an {@code errors} array holding one
 * {@code {path, message, code}} object per violation.</li>
 * <li>{@link #tree}: the nested form: one JSON member per failing field, holding either
 * {@code {message, code}} or the nested field's own tree.</li>
 * </ul>
 *
 * <p>Thread-safe and immutable.
 */
public final class ProblemDetailsBuilder {

    public static final String TYPE = "urn:cleaned:error:validation-failed";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int DEFAULT_STATUS = 422;
    private static final String DEFAULT_TITLE = "Validation Failed";

    private final int status;
    private final String title;

    /** Creates a builder with status 422 and title "Validation Failed". */
    public ProblemDetailsBuilder() {
        this(DEFAULT_STATUS, DEFAULT_TITLE);
    }

    public ProblemDetailsBuilder(int status, String title) {
        if (status < 400 || status > 599) {
            throw new IllegalArgumentException("status must be an error status (400-599), got: " + status);
        }
        this.status = status;
        this.title = title;
    }

    /**
     * Builds a Problem Details document.
     *
     * @param error    the failed validation
     * @param instance the request path or other instance URI, may be null
     */
    public ObjectNode build(ValidationError error, String instance) {
        ObjectNode response = MAPPER.createObjectNode();
        response.put("type", TYPE);
        response.put("title", title);
        response.put("status", status);
        response.put("detail", error.getMessage());
        if (instance != null) {
            response.put("instance", instance);
        } else {
            response.putNull("instance");
        }
        ArrayNode errors = response.putArray("errors");
        for (Violation violation : error.violations()) {
            ObjectNode entry = errors.addObject();
            entry.put("path", violation.path().render());
            entry.put("message", violation.message());
            entry.put("code", violation.code().tag());
        }
        return response;
    }

    public int status() {
        return status;
    }

    /**
     * Renders the failure tree keyed by field name, index ({@code [2]}), key ({@code [k]}) or
     * failed key ({@code [k:key]}).
     */
    public static ObjectNode tree(ValidationError error) {
        return (ObjectNode) render(error.errors());
    }

    private static JsonNode render(ErrorNode node) {
        if (node instanceof ErrorNode.Leaf) {
            ErrorNode.Leaf leaf = (ErrorNode.Leaf) node;
            ObjectNode failure = MAPPER.createObjectNode();
            failure.put("message", leaf.failure().message());
            failure.put("code", leaf.failure().code().tag());
            return failure;
        }
        ObjectNode branch = MAPPER.createObjectNode();
        for (Map.Entry<PathSegment, ErrorNode> child : ((ErrorNode.Branch) node).children().entrySet()) {
            branch.set(memberName(branch, child.getKey().toString()), render(child.getValue()));
        }
        return branch;
    }

    /** Segments that render alike (key {@code "1"} and key {@code 1}) get a {@code #n} suffix. */
    private static String memberName(ObjectNode branch, String label) {
        String name = label;
        for (int n = 2; branch.has(name); n++) {
            name = label + "#" + n;
        }
        return name;
    }
}
