package com.genex.parser;

import com.genex.model.Family;
import com.genex.model.Individual;
import com.genex.model.ParseWarning;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Outcome of one GEDCOM parse. Every reference held by the records resolves to a record
 * in this result.
 */
public record GedcomResult(
    Map<String, Individual> individuals,
    Map<String, Family> families,
    List<ParseWarning> warnings,
    Map<String, String> header,
    SortedSet<String> cyclicIndividuals
) {
    public GedcomResult {
        individuals = Collections.unmodifiableMap(new LinkedHashMap<>(individuals));
        families = Collections.unmodifiableMap(new LinkedHashMap<>(families));
        warnings = List.copyOf(warnings);
        header = Collections.unmodifiableMap(new LinkedHashMap<>(header));
        cyclicIndividuals = Collections.unmodifiableSortedSet(new TreeSet<>(cyclicIndividuals));
    }

    public int recordCount() {
        return individuals.size() + families.size();
    }
}
