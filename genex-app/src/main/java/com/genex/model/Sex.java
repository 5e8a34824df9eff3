package com.genex.model;

import java.util.Locale;

public enum Sex {
    MALE("M"),
    FEMALE("F"),
    UNKNOWN("U");

    private final String code;

    Sex(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Sex fromCode(String code) {
        if (code == null) return UNKNOWN;
        return switch (code.trim().toUpperCase(Locale.ROOT)) {
            case "M" -> MALE;
            case "F" -> FEMALE;
            default -> UNKNOWN;
        };
    }
}
