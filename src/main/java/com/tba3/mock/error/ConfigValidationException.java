package com.tba3.mock.error;

import com.tba3.mock.validation.ValidationIssue;

import java.util.List;
import java.util.stream.Collectors;

public class ConfigValidationException extends RuntimeException {
    private final List<ValidationIssue> issues;

    public ConfigValidationException(List<ValidationIssue> issues) {
        super(issues.stream()
                .map(i -> i.code() + " [" + i.source() + "] " + i.message())
                .collect(Collectors.joining("; ", "Invalid configuration: ", "")));
        this.issues = List.copyOf(issues);
    }

    public ConfigValidationException(String source, String message, Throwable cause) {
        super("Invalid configuration in " + source + ": " + message, cause);
        this.issues = List.of(new ValidationIssue("MALFORMED", message, source, null));
    }

    public List<ValidationIssue> issues() {
        return issues;
    }
}
