package com.genex.service;

import com.genex.model.Individual;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The tree splits into several unconnected groups, so no single starting person can be
 * inferred. Carries the best candidate of each group.
 */
public class AmbiguousRootException extends RuntimeException {

    private final List<Individual> candidates;

    public AmbiguousRootException(List<Individual> candidates) {
        super("Family tree has " + candidates.size() + " unconnected groups, name a person to start from: "
            + candidates.stream()
                .map(c -> c.displayName() + " (" + c.id() + ")")
                .collect(Collectors.joining(", ")));
        this.candidates = List.copyOf(candidates);
    }

    public List<Individual> getCandidates() {
        return candidates;
    }
}
