package com.genex.repository;

import com.genex.model.GenotypeCall;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class GenotypeCallRepository {

    private static final String UPSERT = """
        MERGE INTO genotype_call (rsid, chromosome, position_bp, genotype, source_file)
        KEY (rsid) VALUES (?, ?, ?, ?, ?)
        """;

    private final JdbcTemplate jdbc;

    private static final RowMapper<GenotypeCall> CALL_MAPPER = (rs, rowNum) -> new GenotypeCall(
        rs.getString("rsid"),
        rs.getString("chromosome"),
        rs.getLong("position_bp"),
        rs.getString("genotype"),
        rs.getString("source_file")
    );

    public GenotypeCallRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Writes calls in batches. A repeated rsid overwrites the earlier row, so the last
     * occurrence in the input wins.
     *
     * @return number of calls written, duplicates included
     */
    public long saveAll(Iterator<GenotypeCall> calls, int batchSize) {
        long written = 0;
        List<Object[]> batch = new ArrayList<>(batchSize);
        while (calls.hasNext()) {
            GenotypeCall call = calls.next();
            batch.add(new Object[] {
                call.rsid(), call.chromosome(), call.position(), call.genotype(), call.sourceFile()
            });
            if (batch.size() >= batchSize) {
                jdbc.batchUpdate(UPSERT, batch);
                written += batch.size();
                batch.clear();
            }
        }
        if (!batch.isEmpty()) {
            jdbc.batchUpdate(UPSERT, batch);
            written += batch.size();
        }
        return written;
    }

    public Optional<GenotypeCall> findByRsid(String rsid) {
        List<GenotypeCall> results = jdbc.query(
            "SELECT * FROM genotype_call WHERE rsid = ?",
            CALL_MAPPER,
            rsid
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Calls for the given rsids keyed by rsid. Rsids without a call are absent from the map.
     */
    public Map<String, GenotypeCall> findByRsids(Collection<String> rsids) {
        if (rsids.isEmpty()) {
            return Collections.emptyMap();
        }
        String placeholders = String.join(", ", Collections.nCopies(rsids.size(), "?"));
        List<GenotypeCall> results = jdbc.query(
            "SELECT * FROM genotype_call WHERE rsid IN (" + placeholders + ")",
            CALL_MAPPER,
            rsids.toArray()
        );
        Map<String, GenotypeCall> byRsid = new LinkedHashMap<>();
        for (GenotypeCall call : results) {
            byRsid.put(call.rsid(), call);
        }
        return byRsid;
    }

    public List<GenotypeCall> findAll() {
        return jdbc.query("SELECT * FROM genotype_call ORDER BY rsid", CALL_MAPPER);
    }

    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM genotype_call", Long.class);
        return count != null ? count : 0;
    }

    public void deleteAll() {
        jdbc.update("DELETE FROM genotype_call");
    }
}
