package com.identity.engine.query.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.identity.core.exception.InternalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads projection rows stored as one JSON document per row.
 *
 * The query must select the document as its first column. Missing rows are reported as
 * empty results; undecodable documents and storage failures as {@link InternalException}.
 */
public class JsonObjectQuery {

    private static final Logger log = LoggerFactory.getLogger(JsonObjectQuery.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JsonObjectQuery(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * @return the decoded document, empty if no row matched
     * @throws InternalException if more than one row matched
     */
    public <T> Optional<T> queryOne(String sql, Class<T> type, Object... args) {
        List<String> documents = fetch(sql, args);
        if (documents.isEmpty()) {
            return Optional.empty();
        }
        if (documents.size() > 1) {
            throw new InternalException("DATAB-Ohm4e", "Errors.Query.TooManyResults");
        }
        return Optional.of(decode(documents.get(0), type));
    }

    public <T> List<T> queryList(String sql, Class<T> type, Object... args) {
        List<String> documents = fetch(sql, args);
        List<T> result = new ArrayList<>(documents.size());
        for (String document : documents) {
            result.add(decode(document, type));
        }
        return result;
    }

    private List<String> fetch(String sql, Object... args) {
        try {
            return jdbcTemplate.query(sql, (rs, rowNum) -> rs.getString(1), args);
        } catch (DataAccessException e) {
            log.error("Projection query failed: {}", e.getMessage());
            throw new InternalException("DATAB-Oath6", "Errors.Internal", e);
        }
    }

    private <T> T decode(String document, Class<T> type) {
        if (document == null) {
            throw new InternalException("DATAB-Vohs6", "Errors.Internal");
        }
        try {
            return objectMapper.readValue(document, type);
        } catch (JsonProcessingException e) {
            log.error("Malformed {} document: {}", type.getSimpleName(), e.getOriginalMessage());
            throw new InternalException("DATAB-Vohs6", "Errors.Internal", e);
        }
    }
}
