package io.cleaned.core.validator;

import io.cleaned.core.model.ErrorCode;
import io.cleaned.core.model.ErrorNode;
import io.cleaned.core.model.Failure;
import io.cleaned.core.model.Result;
import io.cleaned.core.model.Violation;
import io.cleaned.core.spi.Validator;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * First-match evaluation shared by the union validators. Candidates are tried in declaration
 * order; when none accepts the value, the {@code no_match} message lists why each one refused
 * it.
 */
final class Alternatives {

    /** The winning candidate's position and cleaned value. */
    record Match(int index, Object value) {}

    private Alternatives() {}

    static Result<Match> tryEach(List<? extends Validator<?>> candidates, Object raw) {
        List<String> reasons = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            Result<?> result = candidates.get(i).validate(raw);
            if (result.isValid()) {
                return Result.valid(new Match(i, result.value()));
            }
            reasons.add("[" + i + "] " + describe(result.error()));
        }
        return Result.invalid(Failure.of(ErrorCode.NO_MATCH, "no alternative matched: " + String.join("; ", reasons)));
    }

    /** Absence is accepted by the first candidate that accepts it; otherwise it is {@code required}. */
    static Result<Match> tryAbsent(List<? extends Validator<?>> candidates) {
        for (int i = 0; i < candidates.size(); i++) {
            Result<?> result = candidates.get(i).absent();
            if (result.isValid()) {
                return Result.valid(new Match(i, result.value()));
            }
        }
        return Result.invalid(Failure.required());
    }

    private static String describe(ErrorNode error) {
        Set<String> distinct = new LinkedHashSet<>();
        for (Violation v : error.flatten()) {
            String where = v.path().isRoot() ? "" : v.path().render() + ": ";
            distinct.add(where + v.failure());
        }
        return String.join(", ", distinct);
    }
}
