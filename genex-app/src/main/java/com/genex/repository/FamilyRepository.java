package com.genex.repository;

import com.genex.model.Family;
import com.genex.model.GedcomAttribute;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class FamilyRepository {

    private final JdbcTemplate jdbc;
    private final RecordAttributeRepository attributes;

    private static final RowMapper<Family> FAMILY_MAPPER = (rs, rowNum) -> new Family(
        rs.getString("id"),
        rs.getString("husband_id"),
        rs.getString("wife_id"),
        rs.getString("marriage_date"),
        rs.getString("marriage_place"),
        List.of(),
        List.of()
    );

    public FamilyRepository(JdbcTemplate jdbc, RecordAttributeRepository attributes) {
        this.jdbc = jdbc;
        this.attributes = attributes;
    }

    /**
     * Inserts families with their ordered children. Referenced individuals must already exist.
     */
    public void saveAll(Collection<Family> families) {
        if (families.isEmpty()) {
            return;
        }
        List<Object[]> rows = new ArrayList<>(families.size());
        List<Object[]> childRows = new ArrayList<>();
        for (Family f : families) {
            rows.add(new Object[] {f.id(), f.husbandRef(), f.wifeRef(), f.marriageDate(), f.marriagePlace()});
            for (int order = 0; order < f.childRefs().size(); order++) {
                childRows.add(new Object[] {f.id(), f.childRefs().get(order), order});
            }
        }
        jdbc.batchUpdate(
            "INSERT INTO family (id, husband_id, wife_id, marriage_date, marriage_place) VALUES (?, ?, ?, ?, ?)",
            rows
        );
        if (!childRows.isEmpty()) {
            jdbc.batchUpdate(
                "INSERT INTO family_child (family_id, child_id, child_order) VALUES (?, ?, ?)",
                childRows
            );
        }
        for (Family f : families) {
            attributes.saveAll(f.id(), f.attributes());
        }
    }

    public Optional<Family> findById(String id) {
        List<Family> results = jdbc.query(
            "SELECT * FROM family WHERE id = ?",
            FAMILY_MAPPER,
            id
        );
        if (results.isEmpty()) {
            return Optional.empty();
        }
        List<String> children = jdbc.queryForList(
            "SELECT child_id FROM family_child WHERE family_id = ? ORDER BY child_order",
            String.class,
            id
        );
        return Optional.of(complete(results.get(0), children, attributes.findByRecordId(id)));
    }

    public List<Family> findAll() {
        List<Family> rows = jdbc.query("SELECT * FROM family ORDER BY id", FAMILY_MAPPER);
        Map<String, List<String>> children = new HashMap<>();
        jdbc.query(
            "SELECT family_id, child_id FROM family_child ORDER BY family_id, child_order",
            rs -> {
                children.computeIfAbsent(rs.getString("family_id"), k -> new ArrayList<>())
                    .add(rs.getString("child_id"));
            }
        );
        Map<String, List<GedcomAttribute>> attributesByRecord = attributes.findAllByRecord();

        List<Family> families = new ArrayList<>(rows.size());
        for (Family row : rows) {
            families.add(complete(row,
                children.getOrDefault(row.id(), List.of()),
                attributesByRecord.getOrDefault(row.id(), List.of())));
        }
        return families;
    }

    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM family", Long.class);
        return count != null ? count : 0;
    }

    /**
     * Removes families and their child links. Spouse links pointing at families go first.
     */
    public void deleteAll() {
        jdbc.update("DELETE FROM individual_spouse_family");
        jdbc.update("DELETE FROM family_child");
        jdbc.update("DELETE FROM family");
    }

    private static Family complete(Family row, List<String> children, List<GedcomAttribute> attrs) {
        return new Family(row.id(), row.husbandRef(), row.wifeRef(), row.marriageDate(), row.marriagePlace(),
            children, attrs);
    }
}
