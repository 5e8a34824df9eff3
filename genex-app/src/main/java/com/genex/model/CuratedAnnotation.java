package com.genex.model;

import java.util.List;
import java.util.Map;

/**
 * A curated reference entry for one rsid. Interpretation rule keys are genotype patterns
 * in normalized (sorted) allele order.
 */
public record CuratedAnnotation(
    String rsid,
    String gene,
    String category,
    String description,
    String condition,
    String riskAllele,
    String normalAllele,
    String clinicalSignificance,
    String drugs,
    String recommendation,
    Map<String, String> interpretationRules,
    List<String> citations
) {
    public CuratedAnnotation {
        interpretationRules = interpretationRules != null ? Map.copyOf(interpretationRules) : Map.of();
        citations = citations != null ? List.copyOf(citations) : List.of();
    }
}
