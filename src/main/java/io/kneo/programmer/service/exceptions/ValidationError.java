package io.kneo.programmer.service.exceptions;

import lombok.Getter;

import java.util.List;

@Getter
public class ValidationError extends CompileError {
    private final List<String> errors;

    public ValidationError(List<String> errors) {
        super(String.format("Validation failed with %d error(s): %s", errors.size(), String.join("; ", errors)));
        this.errors = List.copyOf(errors);
    }
}
