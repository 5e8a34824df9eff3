package com.genex.service;

import com.genex.config.GenexConfig;
import com.genex.model.AncestorChart;
import com.genex.model.Individual;
import com.genex.parser.GedcomParser;
import com.genex.repository.FamilyRepository;
import com.genex.repository.IndividualRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class FamilyTreeService {

    private static final Logger log = LoggerFactory.getLogger(FamilyTreeService.class);

    private final IndividualRepository individualRepository;
    private final FamilyRepository familyRepository;
    private final GenexConfig config;

    public FamilyTreeService(IndividualRepository individualRepository, FamilyRepository familyRepository,
                             GenexConfig config) {
        this.individualRepository = individualRepository;
        this.familyRepository = familyRepository;
        this.config = config;
    }

    /**
     * Loads the whole stored tree into a fresh engine.
     */
    public FamilyTreeEngine openSession() {
        FamilyTreeEngine engine = FamilyTreeEngine.of(individualRepository.findAll(), familyRepository.findAll());
        log.debug("Opened tree session with {} individuals", engine.size());
        return engine;
    }

    public Optional<Individual> findPerson(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        String canonical = GedcomParser.canonicalId(id);
        return individualRepository.findById(canonical != null ? canonical : id.trim());
    }

    public List<Individual> search(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        return individualRepository.searchByName(query);
    }

    /**
     * Exact id first (with or without the @ delimiters), otherwise the first search match.
     */
    public Optional<Individual> resolvePerson(FamilyTreeEngine engine, String query) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        Optional<Individual> byId = engine.findById(query);
        if (byId.isPresent()) {
            return byId;
        }
        List<Individual> matches = engine.search(query);
        if (matches.size() > 1) {
            log.info("{} individuals match '{}', using {}", matches.size(), query, matches.get(0).displayName());
        }
        return matches.stream().findFirst();
    }

    public Optional<Individual> rootPerson() {
        return openSession().inferRoot();
    }

    /**
     * Ancestors of the named person, or of the inferred root when {@code personQuery} is null.
     *
     * @throws IllegalArgumentException if nobody matches {@code personQuery}
     * @throws IllegalStateException if no tree has been imported
     * @throws AmbiguousRootException if no person is named and the tree has several unconnected groups
     */
    public AncestorChart ancestors(String personQuery) {
        return ancestors(personQuery, config.getTree().getMaxGenerations());
    }

    public AncestorChart ancestors(String personQuery, Integer maxGenerations) {
        FamilyTreeEngine engine = openSession();
        Individual subject;
        if (personQuery == null || personQuery.isBlank()) {
            subject = engine.inferRoot()
                .orElseThrow(() -> new IllegalStateException("No family tree imported"));
        } else {
            subject = resolvePerson(engine, personQuery)
                .orElseThrow(() -> new IllegalArgumentException("No individual matches '" + personQuery + "'"));
        }
        return new AncestorChart(subject, engine.ancestors(subject.id(), maxGenerations));
    }
}
