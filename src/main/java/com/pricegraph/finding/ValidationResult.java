package com.pricegraph.finding;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a validation pass. Findings are sorted by severity, code, path,
 * entity id and message so results diff cleanly.
 *
 * @param ok       true when there are no ERROR findings
 * @param findings All findings, sorted
 * @param errors   ERROR findings
 * @param warnings WARNING findings
 * @param info     INFO findings
 */
public record ValidationResult(
        boolean ok,
        List<Finding> findings,
        List<Finding> errors,
        List<Finding> warnings,
        List<Finding> info
) {

    public static final Comparator<Finding> ORDER = Comparator
            .comparingInt((Finding f) -> f.severity().rank())
            .thenComparing(Finding::code)
            .thenComparing(f -> Objects.toString(f.path(), ""))
            .thenComparing(f -> Objects.toString(f.entityId(), ""))
            .thenComparing(f -> Objects.toString(f.message(), ""));

    public static ValidationResult of(List<Finding> findings) {
        List<Finding> sorted = new ArrayList<>(findings);
        sorted.sort(ORDER);

        List<Finding> errors = new ArrayList<>();
        List<Finding> warnings = new ArrayList<>();
        List<Finding> info = new ArrayList<>();
        for (Finding f : sorted) {
            switch (f.severity()) {
                case ERROR -> errors.add(f);
                case WARNING -> warnings.add(f);
                case INFO -> info.add(f);
            }
        }
        return new ValidationResult(errors.isEmpty(), List.copyOf(sorted),
                List.copyOf(errors), List.copyOf(warnings), List.copyOf(info));
    }

    public boolean hasCode(String code) {
        return findings.stream().anyMatch(f -> f.code().equals(code));
    }

    public boolean hasError(String code) {
        return errors.stream().anyMatch(f -> f.code().equals(code));
    }

    public boolean hasWarning(String code) {
        return warnings.stream().anyMatch(f -> f.code().equals(code));
    }
}
