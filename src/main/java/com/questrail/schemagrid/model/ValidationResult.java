package com.questrail.schemagrid.model;

import java.util.List;

/**
 * Outcome of a structural validation pass.
 *
 * <p>Errors are human-readable and ordered by row, then by check. The result
 * is valid exactly when the error list is empty.</p>
 */
public record ValidationResult(List<String> errors)
{
    private static final ValidationResult VALID = new ValidationResult(List.of());

    public ValidationResult {
        errors = (errors == null) ? List.of() : List.copyOf(errors);
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult of(List<String> errors) {
        return errors.isEmpty() ? VALID : new ValidationResult(errors);
    }

    public static ValidationResult invalid(String error) {
        return new ValidationResult(List.of(error));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * Joins the errors the way embedded-error outputs render them.
     */
    public String joinedErrors() {
        return String.join(", ", errors);
    }
}
