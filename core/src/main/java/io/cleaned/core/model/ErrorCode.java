package io.cleaned.core.model;

/**
 * Failure kinds reported by validators. Each {@link Failure} carries exactly one code.
 *
 * <p>The {@link #tag()} is the stable, lower-case identifier used in flattened reports and
 * JSON renderings (e.g. {@code "min_length"}).
 */
public enum ErrorCode {
    REQUIRED("required"),
    TYPE_ERROR("type_error"),
    BLANK("blank"),
    MIN_LENGTH("min_length"),
    MAX_LENGTH("max_length"),
    PATTERN("pattern"),
    MIN("min"),
    MAX("max"),
    NO_MATCH("no_match"),
    INVALID_CHOICE("invalid_choice"),
    DUPLICATE_KEY("duplicate_key");

    private final String tag;

    ErrorCode(String tag) {
        this.tag = tag;
    }

    /** Returns the wire tag, e.g. {@code "type_error"}. */
    public String tag() {
        return tag;
    }

    /**
     * Looks up a code by its tag.
     *
     * @throws IllegalArgumentException if no code has the given tag
     */
    public static ErrorCode fromTag(String tag) {
        for (ErrorCode code : values()) {
            if (code.tag.equals(tag)) {
                return code;
            }
        }
        throw new IllegalArgumentException("Unknown error code tag: '" + tag + "'");
    }

    @Override
    public String toString() {
        return tag;
    }
}
