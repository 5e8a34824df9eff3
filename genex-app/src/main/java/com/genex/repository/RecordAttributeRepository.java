package com.genex.repository;

import com.genex.model.GedcomAttribute;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Unrecognized GEDCOM tags of individuals and families, kept in file order.
 */
@Repository
public class RecordAttributeRepository {

    private final JdbcTemplate jdbc;

    public RecordAttributeRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void saveAll(String recordId, List<GedcomAttribute> attributes) {
        if (attributes.isEmpty()) {
            return;
        }
        List<Object[]> rows = new ArrayList<>(attributes.size());
        for (int i = 0; i < attributes.size(); i++) {
            GedcomAttribute attribute = attributes.get(i);
            rows.add(new Object[] {recordId, i, attribute.tagPath(), attribute.value()});
        }
        jdbc.batchUpdate(
            "INSERT INTO record_attribute (record_id, seq, tag_path, tag_value) VALUES (?, ?, ?, ?)",
            rows
        );
    }

    public List<GedcomAttribute> findByRecordId(String recordId) {
        return jdbc.query(
            "SELECT tag_path, tag_value FROM record_attribute WHERE record_id = ? ORDER BY seq",
            (rs, rowNum) -> new GedcomAttribute(rs.getString("tag_path"), rs.getString("tag_value")),
            recordId
        );
    }

    public Map<String, List<GedcomAttribute>> findAllByRecord() {
        Map<String, List<GedcomAttribute>> byRecord = new HashMap<>();
        jdbc.query(
            "SELECT record_id, tag_path, tag_value FROM record_attribute ORDER BY record_id, seq",
            rs -> {
                byRecord.computeIfAbsent(rs.getString("record_id"), k -> new ArrayList<>())
                    .add(new GedcomAttribute(rs.getString("tag_path"), rs.getString("tag_value")));
            }
        );
        return byRecord;
    }

    public void deleteAll() {
        jdbc.update("DELETE FROM record_attribute");
    }
}
