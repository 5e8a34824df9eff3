package com.genex.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class MetadataRepository {

    public static final String GENOME_SOURCE = "genome_source";
    public static final String GENOME_DATA_SOURCE = "genome_data_source";
    public static final String GENOME_BUILD = "genome_build";
    public static final String GENOME_CALL_COUNT = "genome_call_count";
    public static final String GENOME_IMPORTED_AT = "genome_imported_at";
    public static final String GEDCOM_SOURCE = "gedcom_source";
    public static final String GEDCOM_IMPORTED_AT = "gedcom_imported_at";
    public static final String GEDCOM_PRODUCER = "gedcom_producer";
    public static final String GEDCOM_VERSION = "gedcom_version";
    public static final String GEDCOM_CHARSET = "gedcom_charset";
    public static final String SNPDB_VERSION = "snpdb_version";

    private final JdbcTemplate jdbc;

    public MetadataRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<String> get(String key) {
        List<String> results = jdbc.query(
            "SELECT meta_value FROM import_metadata WHERE meta_key = ?",
            (rs, rowNum) -> rs.getString("meta_value"),
            key
        );
        return results.isEmpty() ? Optional.empty() : Optional.ofNullable(results.get(0));
    }

    public void put(String key, String value) {
        jdbc.update("MERGE INTO import_metadata (meta_key, meta_value) KEY (meta_key) VALUES (?, ?)", key, value);
    }

    public Map<String, String> findAll() {
        Map<String, String> metadata = new LinkedHashMap<>();
        jdbc.query(
            "SELECT meta_key, meta_value FROM import_metadata ORDER BY meta_key",
            rs -> {
                metadata.put(rs.getString("meta_key"), rs.getString("meta_value"));
            }
        );
        return metadata;
    }

    public void delete(String key) {
        jdbc.update("DELETE FROM import_metadata WHERE meta_key = ?", key);
    }
}
