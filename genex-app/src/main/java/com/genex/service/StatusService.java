package com.genex.service;

import com.genex.model.StoreStatus;
import com.genex.repository.MetadataRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class StatusService {

    private final JdbcTemplate jdbc;
    private final MetadataRepository metadataRepository;
    private final AnnotationTable annotationTable;

    public StatusService(JdbcTemplate jdbc, MetadataRepository metadataRepository, AnnotationTable annotationTable) {
        this.jdbc = jdbc;
        this.metadataRepository = metadataRepository;
        this.annotationTable = annotationTable;
    }

    public StoreStatus status() {
        Map<String, String> metadata = metadataRepository.findAll();
        return jdbc.queryForObject("""
            SELECT
                (SELECT COUNT(*) FROM genotype_call) AS call_count,
                (SELECT COUNT(*) FROM individual) AS individual_count,
                (SELECT COUNT(*) FROM family) AS family_count
            """,
            (rs, rowNum) -> new StoreStatus(
                rs.getLong("call_count"),
                rs.getLong("individual_count"),
                rs.getLong("family_count"),
                metadata.get(MetadataRepository.GENOME_SOURCE),
                metadata.get(MetadataRepository.GEDCOM_SOURCE),
                metadata.getOrDefault(MetadataRepository.SNPDB_VERSION, annotationTable.version())
            )
        );
    }

    public Map<String, String> metadata() {
        return metadataRepository.findAll();
    }
}
