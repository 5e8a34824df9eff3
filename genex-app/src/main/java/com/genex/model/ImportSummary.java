package com.genex.model;

import java.util.List;

public record ImportSummary(
    Kind kind,
    String source,
    int recordCount,
    List<ParseWarning> warnings
) {
    public ImportSummary {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public enum Kind {
        GENOME,
        FAMILY_TREE
    }
}
