package com.genex.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Id-addressed view of a tree with the derived parent, child and spouse indexes.
 * Records reference each other only by id; edges to unknown ids are dropped while indexing.
 * The child of a family is anyone listed by its CHIL lines or pointing at it through FAMC.
 */
public final class FamilyGraph {

    private final Map<String, Individual> individuals = new TreeMap<>();
    private final Map<String, Family> families = new TreeMap<>();
    private final Map<String, List<String>> parents = new HashMap<>();
    private final Map<String, List<String>> children = new HashMap<>();
    private final Map<String, List<String>> spouses = new HashMap<>();

    private FamilyGraph(Collection<Individual> individuals, Collection<Family> families) {
        for (Individual individual : individuals) {
            this.individuals.putIfAbsent(individual.id(), individual);
        }
        for (Family family : families) {
            this.families.putIfAbsent(family.id(), family);
        }
        index();
    }

    public static FamilyGraph of(Collection<Individual> individuals, Collection<Family> families) {
        return new FamilyGraph(individuals, families);
    }

    private void index() {
        Map<String, Set<String>> childrenByFamily = new HashMap<>();
        Map<String, Set<String>> familiesByChild = new HashMap<>();

        for (Family family : families.values()) {
            Set<String> familyChildren = new LinkedHashSet<>();
            for (String childId : family.childRefs()) {
                if (individuals.containsKey(childId)) {
                    familyChildren.add(childId);
                }
            }
            childrenByFamily.put(family.id(), familyChildren);
        }
        for (Individual individual : individuals.values()) {
            String familyId = individual.parentFamilyRef();
            if (familyId != null && families.containsKey(familyId)) {
                childrenByFamily.get(familyId).add(individual.id());
                familiesByChild.computeIfAbsent(individual.id(), k -> new LinkedHashSet<>()).add(familyId);
            }
        }
        for (Map.Entry<String, Set<String>> entry : childrenByFamily.entrySet()) {
            for (String childId : entry.getValue()) {
                familiesByChild.computeIfAbsent(childId, k -> new LinkedHashSet<>()).add(entry.getKey());
            }
        }

        for (Map.Entry<String, Set<String>> entry : familiesByChild.entrySet()) {
            Set<String> childParents = new LinkedHashSet<>();
            for (String familyId : orderedFamilies(entry.getKey(), entry.getValue())) {
                childParents.addAll(knownSpouses(families.get(familyId)));
            }
            parents.put(entry.getKey(), List.copyOf(childParents));
        }

        Map<String, Set<String>> childrenByParent = new HashMap<>();
        Map<String, Set<String>> spousesByPerson = new HashMap<>();
        for (Family family : families.values()) {
            List<String> familySpouses = knownSpouses(family);
            for (String spouseId : familySpouses) {
                childrenByParent.computeIfAbsent(spouseId, k -> new LinkedHashSet<>())
                    .addAll(childrenByFamily.get(family.id()));
                for (String otherId : familySpouses) {
                    if (!otherId.equals(spouseId)) {
                        spousesByPerson.computeIfAbsent(spouseId, k -> new LinkedHashSet<>()).add(otherId);
                    }
                }
            }
        }
        childrenByParent.forEach((id, ids) -> children.put(id, List.copyOf(ids)));
        spousesByPerson.forEach((id, ids) -> spouses.put(id, List.copyOf(ids)));
    }

    // FAMC family first, then the remaining families in id order
    private List<String> orderedFamilies(String childId, Set<String> familyIds) {
        List<String> ordered = new ArrayList<>();
        String primary = individuals.get(childId).parentFamilyRef();
        if (primary != null && familyIds.contains(primary)) {
            ordered.add(primary);
        }
        for (String familyId : new TreeSet<>(familyIds)) {
            if (!familyId.equals(primary)) {
                ordered.add(familyId);
            }
        }
        return ordered;
    }

    private List<String> knownSpouses(Family family) {
        List<String> known = new ArrayList<>(2);
        for (String spouseId : family.spouseRefs()) {
            if (individuals.containsKey(spouseId)) {
                known.add(spouseId);
            }
        }
        return known;
    }

    public Optional<Individual> individual(String id) {
        return Optional.ofNullable(individuals.get(id));
    }

    public boolean contains(String id) {
        return individuals.containsKey(id);
    }

    /**
     * All individuals in id order.
     */
    public Collection<Individual> individuals() {
        return Collections.unmodifiableCollection(individuals.values());
    }

    public Collection<Family> families() {
        return Collections.unmodifiableCollection(families.values());
    }

    public List<String> parentsOf(String id) {
        return parents.getOrDefault(id, List.of());
    }

    public List<String> childrenOf(String id) {
        return children.getOrDefault(id, List.of());
    }

    public List<String> spousesOf(String id) {
        return spouses.getOrDefault(id, List.of());
    }

    /**
     * Individuals that are their own ancestor, found with a colouring depth-first walk over parent edges.
     */
    public SortedSet<String> cycleMembers() {
        SortedSet<String> members = new TreeSet<>();
        Map<String, Boolean> finished = new HashMap<>(); // absent = unvisited, false = on path, true = done

        for (String start : individuals.keySet()) {
            if (finished.containsKey(start)) {
                continue;
            }
            Deque<String> path = new ArrayDeque<>();
            Deque<Iterator<String>> pending = new ArrayDeque<>();
            path.push(start);
            pending.push(parentsOf(start).iterator());
            finished.put(start, false);

            while (!path.isEmpty()) {
                Iterator<String> it = pending.peek();
                if (!it.hasNext()) {
                    finished.put(path.pop(), true);
                    pending.pop();
                    continue;
                }
                String parentId = it.next();
                Boolean state = finished.get(parentId);
                if (state == null) {
                    finished.put(parentId, false);
                    path.push(parentId);
                    pending.push(parentsOf(parentId).iterator());
                } else if (!state) {
                    // back edge: everything on the path down to parentId is on the cycle
                    for (String onPath : path) {
                        members.add(onPath);
                        if (onPath.equals(parentId)) break;
                    }
                }
            }
        }
        return members;
    }
}
