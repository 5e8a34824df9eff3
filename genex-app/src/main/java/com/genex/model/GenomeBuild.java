package com.genex.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public enum GenomeBuild {
    GRCH36("GRCh36"),
    GRCH37("GRCh37"),
    GRCH38("GRCh38"),
    UNKNOWN("unknown");

    // "build 37", "GRCh37", "hg19"
    private static final Pattern BUILD_PATTERN =
        Pattern.compile("(?i)(?:build\\s*|grch)(3[678])\\b|\\bhg(18|19|38)\\b");

    private final String label;

    GenomeBuild(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static GenomeBuild fromHeader(String headerLine) {
        Matcher m = BUILD_PATTERN.matcher(headerLine);
        if (!m.find()) return UNKNOWN;
        if (m.group(1) != null) {
            return switch (m.group(1)) {
                case "36" -> GRCH36;
                case "37" -> GRCH37;
                default -> GRCH38;
            };
        }
        return switch (m.group(2)) {
            case "18" -> GRCH36;
            case "19" -> GRCH37;
            default -> GRCH38;
        };
    }

    public static GenomeBuild fromLabel(String label) {
        for (GenomeBuild build : values()) {
            if (build.label.equals(label)) return build;
        }
        return UNKNOWN;
    }
}
