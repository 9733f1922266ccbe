package com.wagesearch.salary.persistence;

import com.wagesearch.salary.model.CompensationQuery;
import com.wagesearch.salary.model.CompensationRecord;
import com.wagesearch.salary.model.MatchPolicy;
import com.wagesearch.salary.model.PayUnit;
import com.wagesearch.salary.util.SearchText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

@Repository
public class JdbcCompensationIndex implements CompensationIndex {
    private static final Logger log = LoggerFactory.getLogger(JdbcCompensationIndex.class);
    private static final String SELECT_COLUMNS = "id, title, salary_amount, pay_unit, city, state";
    private static final RowMapper<CompensationRecord> RECORD_MAPPER = (rs, rowNum) -> new CompensationRecord(
        rs.getString("title"),
        rs.getBigDecimal("salary_amount"),
        PayUnit.valueOf(rs.getString("pay_unit")),
        rs.getString("city"),
        rs.getString("state")
    );

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcCompensationIndex(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void load(List<CompensationRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        Timestamp loadedAt = Timestamp.from(Instant.now());
        SqlParameterSource[] batch = new SqlParameterSource[records.size()];
        for (int i = 0; i < records.size(); i++) {
            CompensationRecord record = records.get(i);
            batch[i] = new MapSqlParameterSource()
                .addValue("title", record.title())
                .addValue("salaryAmount", record.salaryAmount(), Types.NUMERIC)
                .addValue("payUnit", record.payUnit().name())
                .addValue("city", record.city(), Types.VARCHAR)
                .addValue("state", record.state(), Types.VARCHAR)
                .addValue("titleSearch", SearchText.indexForm(record.title()))
                .addValue("locationSearch", SearchText.indexForm(record.city(), record.state()))
                .addValue("loadedAt", loadedAt);
        }
        jdbc.batchUpdate(
            """
                INSERT INTO compensation_records (
                    title, salary_amount, pay_unit, city, state, title_search, location_search, loaded_at
                ) VALUES (
                    :title, :salaryAmount, :payUnit, :city, :state, :titleSearch, :locationSearch, :loadedAt
                )
                """,
            batch
        );
        log.debug("Loaded batch of {} compensation records", records.size());
    }

    @Override
    public long countAll() {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM compensation_records", Long.class);
        return count == null ? 0L : count;
    }

    @Override
    public boolean isReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    @Override
    public void clear() {
        int deleted = jdbc.getJdbcTemplate().update("DELETE FROM compensation_records");
        log.info("Cleared {} compensation records", deleted);
    }

    @Override
    public long count(CompensationQuery query) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        TermClauses clauses = termClauses(query, params);
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM compensation_records" + clauses.whereClause(query.matchPolicy()),
            params,
            Long.class
        );
        return count == null ? 0L : count;
    }

    @Override
    public List<CompensationRecord> search(CompensationQuery query, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
        TermClauses clauses = termClauses(query, params);
        String orderBy = query.matchPolicy() == MatchPolicy.ANY
            ? " ORDER BY match_rank DESC, id ASC"
            : " ORDER BY id ASC";
        return jdbc.query(
            "SELECT " + SELECT_COLUMNS + ", " + clauses.rankExpression() + " AS match_rank"
                + " FROM compensation_records"
                + clauses.whereClause(query.matchPolicy())
                + orderBy
                + " LIMIT :limit",
            params,
            RECORD_MAPPER
        );
    }

    @Override
    public void forEachMatch(CompensationQuery query, int cap, Consumer<CompensationRecord> consumer) {
        if (cap <= 0) {
            return;
        }
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", cap);
        TermClauses clauses = termClauses(query, params);
        RowCallbackHandler handler = rs -> consumer.accept(RECORD_MAPPER.mapRow(rs, 0));
        jdbc.query(
            "SELECT " + SELECT_COLUMNS
                + " FROM compensation_records"
                + clauses.whereClause(query.matchPolicy())
                + " ORDER BY id ASC LIMIT :limit",
            params,
            handler
        );
    }

    private TermClauses termClauses(CompensationQuery query, MapSqlParameterSource params) {
        List<List<String>> titleTerms = new ArrayList<>();
        for (String word : query.titleTerms()) {
            titleTerms.add(List.of(word));
        }
        return new TermClauses(
            fieldClauses("title_search", "titleTerm", titleTerms, params),
            fieldClauses("location_search", "locationTerm", query.locationTerms(), params)
        );
    }

    // One clause per term; a term matches when any of its alternatives does.
    private List<String> fieldClauses(
        String column,
        String paramPrefix,
        List<List<String>> terms,
        MapSqlParameterSource params
    ) {
        List<String> clauses = new ArrayList<>();
        for (int i = 0; i < terms.size(); i++) {
            List<String> alternatives = terms.get(i);
            List<String> likes = new ArrayList<>();
            for (int j = 0; j < alternatives.size(); j++) {
                String name = paramPrefix + i + "_" + j;
                params.addValue(name, wordPattern(alternatives.get(j)), Types.VARCHAR);
                likes.add(column + " LIKE :" + name);
            }
            clauses.add("(" + String.join(" OR ", likes) + ")");
        }
        return clauses;
    }

    private String wordPattern(String term) {
        return "% " + term + " %";
    }

    private record TermClauses(List<String> title, List<String> location) {

        String whereClause(MatchPolicy policy) {
            List<String> predicates = new ArrayList<>();
            String joiner = policy == MatchPolicy.ANY ? " OR " : " AND ";
            if (!title.isEmpty()) {
                predicates.add("(" + String.join(joiner, title) + ")");
            }
            if (!location.isEmpty()) {
                predicates.add("(" + String.join(joiner, location) + ")");
            }
            return predicates.isEmpty() ? "" : " WHERE " + String.join(" AND ", predicates);
        }

        String rankExpression() {
            List<String> cases = new ArrayList<>();
            for (String clause : title) {
                cases.add("CASE WHEN " + clause + " THEN 1 ELSE 0 END");
            }
            for (String clause : location) {
                cases.add("CASE WHEN " + clause + " THEN 1 ELSE 0 END");
            }
            return cases.isEmpty() ? "0" : "(" + String.join(" + ", cases) + ")";
        }
    }
}
