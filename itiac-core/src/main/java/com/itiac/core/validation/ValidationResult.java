package com.itiac.core.validation;

import java.util.List;

/**
 * Outcome of a validation: errors make the subject invalid, warnings do not.
 *
 * @param errors blocking problems
 * @param warnings advisory findings
 */
public record ValidationResult(List<String> errors, List<String> warnings) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ValidationResult ok() {
        return new ValidationResult(List.of(), List.of());
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
