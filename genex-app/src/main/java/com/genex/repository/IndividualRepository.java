package com.genex.repository;

import com.genex.model.GedcomAttribute;
import com.genex.model.Individual;
import com.genex.model.Sex;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Repository
public class IndividualRepository {

    private final JdbcTemplate jdbc;
    private final RecordAttributeRepository attributes;

    // spouse families and attributes are attached afterwards
    private static final RowMapper<Individual> INDIVIDUAL_MAPPER = (rs, rowNum) -> new Individual(
        rs.getString("id"),
        rs.getString("given_name"),
        rs.getString("surname"),
        Sex.fromCode(rs.getString("sex")),
        rs.getString("birth_date"),
        rs.getString("birth_place"),
        rs.getString("death_date"),
        rs.getString("death_place"),
        rs.getString("parent_family_id"),
        List.of(),
        List.of()
    );

    public IndividualRepository(JdbcTemplate jdbc, RecordAttributeRepository attributes) {
        this.jdbc = jdbc;
        this.attributes = attributes;
    }

    /**
     * Inserts the individual rows and their attributes. Spouse family links need the
     * families to exist, see {@link #saveSpouseLinks(Collection)}.
     */
    public void saveAll(Collection<Individual> individuals) {
        if (individuals.isEmpty()) {
            return;
        }
        List<Object[]> rows = new ArrayList<>(individuals.size());
        for (Individual i : individuals) {
            rows.add(new Object[] {
                i.id(), i.givenName(), i.surname(), i.sex().code(),
                i.birthDate(), i.birthPlace(), i.deathDate(), i.deathPlace(), i.parentFamilyRef()
            });
        }
        jdbc.batchUpdate("""
            INSERT INTO individual (id, given_name, surname, sex, birth_date, birth_place,
                                    death_date, death_place, parent_family_id)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """, rows);
        for (Individual i : individuals) {
            attributes.saveAll(i.id(), i.attributes());
        }
    }

    public void saveSpouseLinks(Collection<Individual> individuals) {
        List<Object[]> rows = new ArrayList<>();
        for (Individual i : individuals) {
            List<String> familyIds = i.spouseFamilyRefs();
            for (int order = 0; order < familyIds.size(); order++) {
                rows.add(new Object[] {i.id(), familyIds.get(order), order});
            }
        }
        if (!rows.isEmpty()) {
            jdbc.batchUpdate(
                "INSERT INTO individual_spouse_family (individual_id, family_id, family_order) VALUES (?, ?, ?)",
                rows
            );
        }
    }

    public Optional<Individual> findById(String id) {
        List<Individual> results = jdbc.query(
            "SELECT * FROM individual WHERE id = ?",
            INDIVIDUAL_MAPPER,
            id
        );
        if (results.isEmpty()) {
            return Optional.empty();
        }
        Individual row = results.get(0);
        List<String> spouseFamilies = jdbc.queryForList(
            "SELECT family_id FROM individual_spouse_family WHERE individual_id = ? ORDER BY family_order",
            String.class,
            id
        );
        return Optional.of(complete(row, spouseFamilies, attributes.findByRecordId(id)));
    }

    /**
     * Every individual, ordered by id, with spouse families and attributes attached.
     */
    public List<Individual> findAll() {
        List<Individual> rows = jdbc.query("SELECT * FROM individual ORDER BY id", INDIVIDUAL_MAPPER);
        Map<String, List<String>> spouseFamilies = new HashMap<>();
        jdbc.query(
            "SELECT individual_id, family_id FROM individual_spouse_family ORDER BY individual_id, family_order",
            rs -> {
                spouseFamilies.computeIfAbsent(rs.getString("individual_id"), k -> new ArrayList<>())
                    .add(rs.getString("family_id"));
            }
        );
        Map<String, List<GedcomAttribute>> attributesByRecord = attributes.findAllByRecord();

        List<Individual> individuals = new ArrayList<>(rows.size());
        for (Individual row : rows) {
            individuals.add(complete(row,
                spouseFamilies.getOrDefault(row.id(), List.of()),
                attributesByRecord.getOrDefault(row.id(), List.of())));
        }
        return individuals;
    }

    /**
     * Case-insensitive substring match on given name, surname, full name or birth place,
     * ordered by surname, given name, id.
     */
    public List<Individual> searchByName(String query) {
        String pattern = "%" + escapeLike(query.trim().toLowerCase(Locale.ROOT)) + "%";
        return jdbc.query("""
            SELECT * FROM individual
            WHERE LOWER(given_name) LIKE ? ESCAPE '\\'
               OR LOWER(surname) LIKE ? ESCAPE '\\'
               OR LOWER(TRIM(given_name || ' ' || surname)) LIKE ? ESCAPE '\\'
               OR LOWER(birth_place) LIKE ? ESCAPE '\\'
            ORDER BY LOWER(surname), LOWER(given_name), id
            """,
            INDIVIDUAL_MAPPER,
            pattern, pattern, pattern, pattern
        );
    }

    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM individual", Long.class);
        return count != null ? count : 0;
    }

    /**
     * Removes individuals and their spouse links. Families must be deleted first.
     */
    public void deleteAll() {
        jdbc.update("DELETE FROM individual_spouse_family");
        jdbc.update("DELETE FROM individual");
    }

    private static Individual complete(Individual row, List<String> spouseFamilies, List<GedcomAttribute> attrs) {
        return new Individual(row.id(), row.givenName(), row.surname(), row.sex(),
            row.birthDate(), row.birthPlace(), row.deathDate(), row.deathPlace(),
            row.parentFamilyRef(), spouseFamilies, attrs);
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
