package io.cleaned.core.validator;

import io.cleaned.core.model.ErrorCode;
import io.cleaned.core.model.Failure;
import io.cleaned.core.model.Result;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates strings. Only {@link String} raw values are accepted.
 *
 * <p>The value is normalized first: surrounding whitespace is stripped (unless
 * {@link #strip(boolean) strip(false)}) and line breaks are replaced by a single space (unless
 * {@link #multiline(boolean) multiline(true)}). Constraints are then checked in this order, and
 * only the first failure is reported:
 *
 * <ol>
 * <li>blank: rejected by default; when {@link #allowBlank() allowed}, a blank value skips the
 * remaining checks
 * <li>length: {@code min_length} / {@code max_length}, counted in code points
 * <li>pattern: the whole value must match
 * <li>choices: {@code invalid_choice}
 * </ol>
 *
 * <p>Immutable: every configuration method returns a new validator.
 */
public final class StrValidator extends ScalarValidator<String> {

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

    private final boolean blankAllowed;
    private final boolean strip;
    private final boolean multiline;
    private final Integer minLength;
    private final Integer maxLength;
    private final Pattern pattern;
    private final Set<String> choices;

    StrValidator() {
        this(false, true, false, null, null, null, null);
    }

    private StrValidator(
            boolean blankAllowed,
            boolean strip,
            boolean multiline,
            Integer minLength,
            Integer maxLength,
            Pattern pattern,
            Set<String> choices) {
        Checks.requireLengthRange(minLength, maxLength);
        this.blankAllowed = blankAllowed;
        this.strip = strip;
        this.multiline = multiline;
        this.minLength = minLength;
        this.maxLength = maxLength;
        this.pattern = pattern;
        this.choices = choices;
    }

    /** Accepts blank values. */
    public StrValidator allowBlank() {
        return blank(true);
    }

    public StrValidator blank(boolean allowed) {
        return new StrValidator(allowed, strip, multiline, minLength, maxLength, pattern, choices);
    }

    public StrValidator strip(boolean enabled) {
        return new StrValidator(blankAllowed, enabled, multiline, minLength, maxLength, pattern, choices);
    }

    /** Keeps line breaks instead of folding them into spaces. */
    public StrValidator multiline(boolean enabled) {
        return new StrValidator(blankAllowed, strip, enabled, minLength, maxLength, pattern, choices);
    }

    public StrValidator minLength(int min) {
        return new StrValidator(blankAllowed, strip, multiline, min, maxLength, pattern, choices);
    }

    public StrValidator maxLength(int max) {
        return new StrValidator(blankAllowed, strip, multiline, minLength, max, pattern, choices);
    }

    /** Requires exactly {@code length} code points. */
    public StrValidator length(int length) {
        return new StrValidator(blankAllowed, strip, multiline, length, length, pattern, choices);
    }

    /** Requires the whole value to match {@code regex}. */
    public StrValidator pattern(String regex) {
        return pattern(Pattern.compile(regex));
    }

    public StrValidator pattern(Pattern regex) {
        return new StrValidator(blankAllowed, strip, multiline, minLength, maxLength, regex, choices);
    }

    public StrValidator oneOf(String... values) {
        return new StrValidator(blankAllowed, strip, multiline, minLength, maxLength, pattern, Checks.choices(values));
    }

    @Override
    protected Result<String> convert(Object raw) {
        if (!(raw instanceof String)) {
            return Result.invalid(Failure.typeError("a string", raw));
        }
        String value = (String) raw;
        if (strip) {
            value = value.strip();
        }
        if (!multiline) {
            value = LINE_BREAK.matcher(value).replaceAll(" ");
        }
        return Result.valid(value);
    }

    @Override
    protected Optional<Failure> check(String value) {
        if (value.isBlank()) {
            if (blankAllowed) {
                return Optional.empty();
            }
            return Optional.of(Failure.of(ErrorCode.BLANK, "must not be blank"));
        }
        Optional<Failure> length = Checks.length(value.codePointCount(0, value.length()), minLength, maxLength, "length");
        if (length.isPresent()) {
            return length;
        }
        if (pattern != null && !pattern.matcher(value).matches()) {
            return Optional.of(Failure.of(ErrorCode.PATTERN, "must match pattern " + pattern.pattern()));
        }
        return Checks.choice(value, choices);
    }
}
