package com.lyshra.open.template.integration.models.version;

import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Structured outcome of validating a template version or a migration script.
 * Validation never throws; every problem found is listed here.
 */
@Data
@Builder
public class ValidationResult implements Serializable {

    private static final long serialVersionUID = 1L;

    @Builder.Default
    private final List<String> errors = new ArrayList<>();

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public static ValidationResult valid() {
        return ValidationResult.builder().build();
    }

    public static ValidationResult of(List<String> errors) {
        return ValidationResult.builder()
                .errors(new ArrayList<>(errors))
                .build();
    }
}
