package com.genex.model;

import java.util.List;

/**
 * Individuals exactly {@code generation} parent edges above the starting person.
 * Generation 1 is parents, 2 grandparents, and so on.
 */
public record AncestorGeneration(int generation, List<Individual> individuals) {
    public AncestorGeneration {
        individuals = List.copyOf(individuals);
    }
}
