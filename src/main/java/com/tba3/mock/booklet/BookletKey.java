package com.tba3.mock.booklet;

import java.util.Arrays;
import java.util.Locale;

public record BookletKey(int level, int year, String subject, String bookletId) {

    public BookletKey {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("BookletKey subject must not be blank");
        }
        if (bookletId == null || bookletId.isEmpty()) {
            throw new IllegalArgumentException("Booklet ID is empty");
        }
        subject = subject.toLowerCase(Locale.ROOT);
    }

    public static BookletKey parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("BookletKey string must not be null");
        }
        String[] parts = value.split("-", -1);
        if (parts.length < 4) {
            throw new IllegalArgumentException("BookletKey must have at least 4 dash-separated segments, got "
                    + parts.length + ": '" + value + "'");
        }
        String levelPart = parts[0];
        if (!levelPart.startsWith("V")) {
            throw new IllegalArgumentException("BookletKey must start with 'V', got: '" + levelPart + "'");
        }
        int level;
        try {
            level = Integer.parseInt(levelPart.substring(1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Cannot parse level from '" + levelPart + "'", e);
        }
        int year;
        try {
            year = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Cannot parse year from '" + parts[1] + "'", e);
        }
        String bookletId = String.join("-", Arrays.asList(parts).subList(3, parts.length));
        return new BookletKey(level, year, parts[2], bookletId);
    }

    @Override
    public String toString() {
        return "V" + level + "-" + year + "-" + subject.toUpperCase(Locale.ROOT) + "-" + bookletId;
    }
}
