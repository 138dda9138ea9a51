package com.tba3.mock.validation;

public record ValidationIssue(String code, String message, String source, String entityId) {}
