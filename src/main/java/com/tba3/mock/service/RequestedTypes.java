package com.tba3.mock.service;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public record RequestedTypes(boolean group, boolean students) {

    public static RequestedTypes parse(String type) {
        Set<String> requested = type == null ? Set.of() : Arrays.stream(type.split(","))
                .map(t -> t.trim().toLowerCase(Locale.ROOT))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toSet());
        boolean students = requested.contains("students");
        return new RequestedTypes(!students || requested.contains("group"), students);
    }
}
