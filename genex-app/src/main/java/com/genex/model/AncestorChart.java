package com.genex.model;

import java.util.List;

/**
 * Ancestors of {@code subject}, one entry per generation starting with the parents.
 */
public record AncestorChart(Individual subject, List<AncestorGeneration> generations) {
    public AncestorChart {
        generations = List.copyOf(generations);
    }

    public int ancestorCount() {
        return generations.stream().mapToInt(g -> g.individuals().size()).sum();
    }
}
