package com.genex.service;

import com.genex.model.AncestorGeneration;
import com.genex.model.Family;
import com.genex.model.FamilyGraph;
import com.genex.model.Individual;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory relationship queries over one loaded tree. Built once per session from a full
 * scan of the store and never updated afterwards.
 */
public class FamilyTreeEngine {

    private static final Comparator<Individual> SEARCH_ORDER = Comparator
        .comparing((Individual i) -> i.surname().toLowerCase(Locale.ROOT))
        .thenComparing(i -> i.givenName().toLowerCase(Locale.ROOT))
        .thenComparing(Individual::id);

    private final FamilyGraph graph;

    public FamilyTreeEngine(FamilyGraph graph) {
        this.graph = graph;
    }

    public static FamilyTreeEngine of(Collection<Individual> individuals, Collection<Family> families) {
        return new FamilyTreeEngine(FamilyGraph.of(individuals, families));
    }

    public int size() {
        return graph.individuals().size();
    }

    /**
     * Looks an individual up by id. GEDCOM pointer syntax ({@code @I1@}) is accepted too.
     */
    public Optional<Individual> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String key = id.trim();
        if (key.length() > 2 && key.startsWith("@") && key.endsWith("@")) {
            key = key.substring(1, key.length() - 1);
        }
        return graph.individual(key);
    }

    public List<Individual> parents(String id) {
        return resolve(graph.parentsOf(id));
    }

    public List<Individual> children(String id) {
        return resolve(graph.childrenOf(id));
    }

    public List<Individual> spouses(String id) {
        return resolve(graph.spousesOf(id));
    }

    /**
     * Number of distinct individuals reachable through child edges, excluding the start.
     */
    public int descendantCount(String id) {
        Set<String> visited = new HashSet<>();
        visited.add(id);
        Deque<String> queue = new ArrayDeque<>(List.of(id));
        while (!queue.isEmpty()) {
            for (String childId : graph.childrenOf(queue.poll())) {
                if (visited.add(childId)) {
                    queue.add(childId);
                }
            }
        }
        return visited.size() - 1;
    }

    // ========== ROOT INFERENCE ==========

    /**
     * Heuristic choice of the person a tree is "about": the one with the most descendants,
     * preferring a complete birth record, then the lowest id. Only individuals linked to
     * someone else are considered unless nobody is linked at all.
     * <p>
     * Unlinked individuals (single-person components) never make the tree ambiguous: a tree
     * with one linked group plus any number of loose individuals resolves to that group.
     * Two or more linked groups do.
     *
     * @return empty for an empty tree
     * @throws AmbiguousRootException if the linked individuals form more than one group
     */
    public Optional<Individual> inferRoot() {
        List<Set<String>> components = components();
        List<Set<String>> linked = components.stream().filter(c -> c.size() > 1).toList();

        if (linked.size() > 1) {
            throw new AmbiguousRootException(linked.stream()
                .map(this::bestCandidate)
                .sorted(Comparator.comparing(Individual::id))
                .toList());
        }
        if (linked.size() == 1) {
            return Optional.of(bestCandidate(linked.get(0)));
        }
        Set<String> everyone = new LinkedHashSet<>();
        components.forEach(everyone::addAll);
        return everyone.isEmpty() ? Optional.empty() : Optional.of(bestCandidate(everyone));
    }

    private Individual bestCandidate(Set<String> ids) {
        Map<String, Integer> descendants = new HashMap<>();
        for (String id : ids) {
            descendants.put(id, descendantCount(id));
        }
        Comparator<Individual> preference = Comparator
            .comparingInt((Individual i) -> descendants.get(i.id())).reversed()
            .thenComparing(i -> i.hasCompleteBirthRecord() ? 0 : 1)
            .thenComparing(Individual::id);
        return resolve(ids).stream().min(preference).orElseThrow();
    }

    /**
     * Groups of individuals connected through any parent, child or spouse edge, in id order.
     */
    public List<Set<String>> components() {
        List<Set<String>> components = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Individual individual : graph.individuals()) {
            if (seen.contains(individual.id())) {
                continue;
            }
            Set<String> component = new LinkedHashSet<>();
            Deque<String> queue = new ArrayDeque<>(List.of(individual.id()));
            seen.add(individual.id());
            while (!queue.isEmpty()) {
                String id = queue.poll();
                component.add(id);
                for (List<String> edges : List.of(graph.parentsOf(id), graph.childrenOf(id), graph.spousesOf(id))) {
                    for (String next : edges) {
                        if (seen.add(next)) {
                            queue.add(next);
                        }
                    }
                }
            }
            components.add(component);
        }
        return components;
    }

    public int componentCount() {
        return components().size();
    }

    // ========== ANCESTORS ==========

    /**
     * Breadth-first walk up parent edges, one entry per generation. Each individual is
     * reported once, at the nearest generation it is reached, so cyclic data terminates.
     *
     * @param maxGenerations deepest generation to report, or null for no limit
     * @throws IllegalArgumentException if the id is unknown
     */
    public List<AncestorGeneration> ancestors(String id, Integer maxGenerations) {
        Individual start = findById(id)
            .orElseThrow(() -> new IllegalArgumentException("Unknown individual: " + id));
        if (maxGenerations != null && maxGenerations < 1) {
            throw new IllegalArgumentException("maxGenerations must be at least 1");
        }

        List<AncestorGeneration> generations = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(start.id());
        List<String> frontier = List.of(start.id());
        int generation = 1;
        while (maxGenerations == null || generation <= maxGenerations) {
            List<String> next = new ArrayList<>();
            for (String personId : frontier) {
                for (String parentId : graph.parentsOf(personId)) {
                    if (visited.add(parentId)) {
                        next.add(parentId);
                    }
                }
            }
            if (next.isEmpty()) {
                break;
            }
            generations.add(new AncestorGeneration(generation, resolve(next)));
            frontier = next;
            generation++;
        }
        return generations;
    }

    // ========== SEARCH ==========

    /**
     * Case-insensitive substring match on given name, surname, full name or birth place,
     * ordered by surname, given name, then id.
     */
    public List<Individual> search(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        return graph.individuals().stream()
            .filter(i -> contains(i.givenName(), needle)
                || contains(i.surname(), needle)
                || contains(i.fullName(), needle)
                || contains(i.birthPlace(), needle))
            .sorted(SEARCH_ORDER)
            .toList();
    }

    private static boolean contains(String field, String needle) {
        return field != null && field.toLowerCase(Locale.ROOT).contains(needle);
    }

    private List<Individual> resolve(Collection<String> ids) {
        List<Individual> individuals = new ArrayList<>(ids.size());
        for (String id : ids) {
            graph.individual(id).ifPresent(individuals::add);
        }
        return individuals;
    }
}
