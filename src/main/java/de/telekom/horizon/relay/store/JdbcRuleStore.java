// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.store;

import de.telekom.horizon.relay.exception.RuleStoreException;
import de.telekom.horizon.relay.model.RelayRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Statement;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The {@code JdbcRuleStore} keeps relay rules in the {@code relay_rules} table.
 * The unique constraint on server, topic and webhook rejects duplicate rules.
 */
@Slf4j
@Repository
public class JdbcRuleStore implements RuleStore {

    private static final String SELECT_ALL = "SELECT id, source_endpoint, source_topic, destination_endpoint, auth_credential FROM relay_rules ORDER BY id";

    private static final String INSERT = "INSERT INTO relay_rules (source_endpoint, source_topic, destination_endpoint, auth_credential) VALUES (?, ?, ?, ?)";

    private static final String DELETE = "DELETE FROM relay_rules WHERE id = ?";

    private static final RowMapper<RelayRule> ROW_MAPPER = (rs, rowNum) -> new RelayRule(
            rs.getLong("id"),
            rs.getString("source_endpoint"),
            rs.getString("source_topic"),
            rs.getString("destination_endpoint"),
            rs.getString("auth_credential"));

    private final JdbcTemplate jdbcTemplate;

    public JdbcRuleStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<RelayRule> list() {
        try {
            return jdbcTemplate.query(SELECT_ALL, ROW_MAPPER);
        } catch (DataAccessException e) {
            throw new RuleStoreException("Could not list relay rules", e);
        }
    }

    @Override
    public Optional<RelayRule> add(String sourceEndpoint, String sourceTopic, String destinationEndpoint, String authCredential) {
        var keyHolder = new GeneratedKeyHolder();

        try {
            jdbcTemplate.update(connection -> {
                var statement = connection.prepareStatement(INSERT, Statement.RETURN_GENERATED_KEYS);
                statement.setString(1, sourceEndpoint);
                statement.setString(2, sourceTopic);
                statement.setString(3, destinationEndpoint);
                statement.setString(4, authCredential);
                return statement;
            }, keyHolder);
        } catch (DuplicateKeyException e) {
            log.warn("Rule {}/{} -> {} already exists.", sourceEndpoint, sourceTopic, destinationEndpoint);
            return Optional.empty();
        } catch (DataAccessException e) {
            throw new RuleStoreException("Could not add relay rule", e);
        }

        var id = Objects.requireNonNull(keyHolder.getKey(), "No id generated for new relay rule").longValue();
        log.info("Rule added with ID {}: {}/{} -> Discord", id, sourceEndpoint, sourceTopic);

        return Optional.of(new RelayRule(id, sourceEndpoint, sourceTopic, destinationEndpoint, authCredential));
    }

    @Override
    public boolean remove(long id) {
        int removed;
        try {
            removed = jdbcTemplate.update(DELETE, id);
        } catch (DataAccessException e) {
            throw new RuleStoreException("Could not remove relay rule " + id, e);
        }

        if (removed == 0) {
            log.warn("Rule not found with ID: {}", id);
            return false;
        }

        log.info("Rule removed with ID: {}", id);
        return true;
    }
}
