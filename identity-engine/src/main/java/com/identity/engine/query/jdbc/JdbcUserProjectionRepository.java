package com.identity.engine.query.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.identity.core.exception.InternalException;
import com.identity.core.exception.NotFoundException;
import com.identity.core.projection.User;
import com.identity.core.query.SearchQuery;
import com.identity.core.repository.UserProjectionRepository;
import com.identity.engine.query.UserProjectionWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQL-backed user projection.
 *
 * Each row keeps the searchable attributes as columns and the whole record as a JSON document.
 * Login names live in a separate table so a user can be found by any of them.
 * Writes replace the user row and its login names in one transaction.
 */
public class JdbcUserProjectionRepository implements UserProjectionRepository, UserProjectionWriter {

    private static final Logger log = LoggerFactory.getLogger(JdbcUserProjectionRepository.class);

    private static final String SELECT = "SELECT users.data FROM projections.users users WHERE users.tenant_id = ?";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final JsonObjectQuery jsonQuery;
    private final TransactionTemplate transactionTemplate;

    public JdbcUserProjectionRepository(
            JdbcTemplate jdbcTemplate,
            PlatformTransactionManager transactionManager,
            ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.objectMapper = objectMapper;
        this.jsonQuery = new JsonObjectQuery(jdbcTemplate, objectMapper);
    }

    @Override
    public User getById(String tenantId, String userId) {
        return jsonQuery.queryOne(SELECT + " AND users.id = ?", User.class, tenantId, userId)
            .orElseThrow(() -> new NotFoundException("QUERY-Dfbg2", "Errors.User.NotFound"));
    }

    @Override
    public User getOne(String tenantId, SearchQuery query) {
        List<Object> args = new ArrayList<>();
        args.add(tenantId);
        String sql = SELECT + " AND " + query.toSql(args);
        return jsonQuery.queryOne(sql, User.class, args.toArray())
            .orElseThrow(() -> new NotFoundException("QUERY-Dfbg3", "Errors.User.NotFound"));
    }

    @Override
    public List<User> search(String tenantId, SearchQuery query) {
        List<Object> args = new ArrayList<>();
        args.add(tenantId);
        String sql = SELECT + " AND " + query.toSql(args) + " ORDER BY users.id";
        return jsonQuery.queryList(sql, User.class, args.toArray());
    }

    /**
     * Insert or replace the user row and its login names.
     */
    @Override
    public void save(User user) {
        String document;
        try {
            document = objectMapper.writeValueAsString(user);
        } catch (JsonProcessingException e) {
            throw new InternalException("QUERY-Wr1tE", "Errors.Internal", e);
        }
        try {
            transactionTemplate.executeWithoutResult(status -> replace(user, document));
            log.debug("Saved user projection {} at sequence {}", user.id(), user.sequence());
        } catch (DataAccessException | TransactionException e) {
            throw new InternalException("QUERY-Wr2tE", "Errors.Internal", e);
        }
    }

    @Override
    public void delete(String tenantId, String userId) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                jdbcTemplate.update("DELETE FROM projections.login_names WHERE tenant_id = ? AND user_id = ?",
                    tenantId, userId);
                jdbcTemplate.update("DELETE FROM projections.users WHERE tenant_id = ? AND id = ?", tenantId, userId);
            });
        } catch (DataAccessException | TransactionException e) {
            throw new InternalException("QUERY-Dl3tE", "Errors.Internal", e);
        }
    }

    @Override
    public Optional<User> find(String tenantId, String userId) {
        return jsonQuery.queryOne(SELECT + " AND users.id = ?", User.class, tenantId, userId);
    }

    // ========== Internal Methods ==========

    private void replace(User user, String document) {
        jdbcTemplate.update("DELETE FROM projections.login_names WHERE tenant_id = ? AND user_id = ?",
            user.tenantId(), user.id());
        jdbcTemplate.update("DELETE FROM projections.users WHERE tenant_id = ? AND id = ?",
            user.tenantId(), user.id());
        jdbcTemplate.update("""
            INSERT INTO projections.users (
                tenant_id, id, resource_owner, state, type, user_name,
                first_name, last_name, nick_name, display_name, email,
                sequence, change_date, data
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            user.tenantId(), user.id(), user.resourceOwner(),
            user.state() == null ? null : user.state().name(),
            user.type() == null ? null : user.type().name(),
            user.userName(),
            user.human() == null ? null : user.human().firstName(),
            user.human() == null ? null : user.human().lastName(),
            user.human() == null ? null : user.human().nickName(),
            user.human() == null ? null : user.human().displayName(),
            user.human() == null ? null : user.human().email(),
            user.sequence(),
            user.changeDate() == null ? null : Timestamp.from(user.changeDate()),
            document);
        for (String loginName : user.loginNames()) {
            jdbcTemplate.update("""
                INSERT INTO projections.login_names (tenant_id, user_id, login_name, is_primary)
                VALUES (?, ?, ?, ?)
                """,
                user.tenantId(), user.id(), loginName, loginName.equals(user.preferredLoginName()));
        }
    }
}
