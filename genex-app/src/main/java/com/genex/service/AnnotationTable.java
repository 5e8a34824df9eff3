package com.genex.service;

import com.genex.config.AnnotationsConfig;
import com.genex.model.CuratedAnnotation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only curated annotations keyed by rsid, loaded once from snpdb.yml.
 */
@Component
public class AnnotationTable {

    private static final Logger log = LoggerFactory.getLogger(AnnotationTable.class);

    private final Map<String, CuratedAnnotation> byRsid;
    private final String version;

    @Autowired
    public AnnotationTable(AnnotationsConfig config) {
        this(config.toAnnotations(), config.getVersion());
    }

    public AnnotationTable(List<CuratedAnnotation> annotations, String version) {
        Map<String, CuratedAnnotation> table = new LinkedHashMap<>();
        for (CuratedAnnotation annotation : annotations) {
            if (annotation.rsid() == null || annotation.rsid().isBlank()) {
                throw new IllegalArgumentException("Annotation without rsid for gene " + annotation.gene());
            }
            if (table.putIfAbsent(key(annotation.rsid()), annotation) != null) {
                log.warn("Duplicate annotation for {} ignored", annotation.rsid());
            }
        }
        this.byRsid = Collections.unmodifiableMap(table);
        this.version = version;
        log.info("Loaded {} curated annotations (snpdb {})", table.size(), version);
    }

    public Optional<CuratedAnnotation> find(String rsid) {
        return rsid == null ? Optional.empty() : Optional.ofNullable(byRsid.get(key(rsid)));
    }

    public List<CuratedAnnotation> byCategory(String category) {
        return byRsid.values().stream()
            .filter(a -> a.category() != null && a.category().equalsIgnoreCase(category))
            .toList();
    }

    public int size() {
        return byRsid.size();
    }

    public String version() {
        return version;
    }

    private static String key(String rsid) {
        return rsid.trim().toLowerCase(Locale.ROOT);
    }
}
