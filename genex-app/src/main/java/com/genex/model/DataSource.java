package com.genex.model;

import java.util.Locale;

/**
 * Vendor that produced a genotype export, guessed from its header comments.
 */
public enum DataSource {
    TWENTYTHREE_AND_ME("23andme", "23andMe"),
    ANCESTRY_DNA("ancestry", "AncestryDNA"),
    MYHERITAGE("myheritage", "MyHeritage"),
    FTDNA("ftdna", "FamilyTreeDNA"),
    UNKNOWN("unknown", null);

    private final String code;
    private final String headerMarker;

    DataSource(String code, String headerMarker) {
        this.code = code;
        this.headerMarker = headerMarker;
    }

    public String code() {
        return code;
    }

    public static DataSource fromHeader(String headerLine) {
        String lower = headerLine.toLowerCase(Locale.ROOT);
        for (DataSource source : values()) {
            if (source.headerMarker != null && lower.contains(source.headerMarker.toLowerCase(Locale.ROOT))) {
                return source;
            }
        }
        return UNKNOWN;
    }

    public static DataSource fromCode(String code) {
        for (DataSource source : values()) {
            if (source.code.equals(code)) return source;
        }
        return UNKNOWN;
    }
}
