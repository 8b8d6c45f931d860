package com.flagship.invoices.eventlog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.invoices.invoice.CorruptEventLogException;
import com.flagship.invoices.invoice.InvoiceSnapshot;
import com.flagship.invoices.invoice.SnapshotReducer;
import com.flagship.invoices.invoice.event.EventPayload;
import com.flagship.invoices.invoice.event.InvoiceEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

/**
 * Append-only event log per invoice.
 *
 * This service enforces:
 * 1. Events are never updated or deleted
 * 2. (origin_id, version) is the primary key, so no version is written twice
 * 3. Appends happen in the caller's transaction, together with the snapshot
 *
 * Plain JDBC: the log is an insert-only table, there is nothing for JPA to manage.
 */
@Service
@Slf4j
public class EventLogService {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final SnapshotReducer reducer;

    public EventLogService(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, SnapshotReducer reducer) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.reducer = reducer;
    }

    /**
     * Appends the events of one command.
     *
     * @throws org.springframework.dao.DuplicateKeyException if a version was already written
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void append(UUID originId, List<InvoiceEvent> events) {
        for (InvoiceEvent event : events) {
            jdbcTemplate.update(
                "INSERT INTO invoice_events (origin_id, version, command_id, event_type, payload, occurred_at, recorded_at) " +
                "VALUES (?, ?, ?, ?, ?::jsonb, ?, CURRENT_TIMESTAMP)",
                originId,
                event.getVersion(),
                event.getCommandId(),
                event.getPayload().eventType(),
                serialize(event.getPayload()),
                Timestamp.from(event.getTimestamp())
            );
        }
        log.debug("Appended {} event(s) for invoice {}", events.size(), originId);
    }

    /**
     * Full history of one invoice, oldest first. Empty for an unknown origin id.
     */
    @Transactional(readOnly = true)
    public List<InvoiceEvent> history(UUID originId) {
        return jdbcTemplate.query(
            "SELECT version, command_id, payload, occurred_at FROM invoice_events " +
            "WHERE origin_id = ? ORDER BY version",
            eventRowMapper(),
            originId
        );
    }

    /**
     * Highest version written for the invoice, 0 if none.
     */
    @Transactional(readOnly = true)
    public int latestVersion(UUID originId) {
        Integer version = jdbcTemplate.queryForObject(
            "SELECT COALESCE(MAX(version), 0) FROM invoice_events WHERE origin_id = ?",
            Integer.class,
            originId
        );
        return version != null ? version : 0;
    }

    /**
     * Rebuilds the snapshot from the log alone.
     *
     * @throws CorruptEventLogException if the stored history does not fold
     */
    @Transactional(readOnly = true)
    public InvoiceSnapshot replay(UUID originId) {
        return reducer.replay(history(originId));
    }

    private RowMapper<InvoiceEvent> eventRowMapper() {
        return (rs, rowNum) -> new InvoiceEvent(
            rs.getInt("version"),
            rs.getTimestamp("occurred_at").toInstant(),
            rs.getObject("command_id", UUID.class),
            deserialize(rs.getString("payload"))
        );
    }

    private String serialize(EventPayload payload) {
        try {
            return objectMapper.writerFor(EventPayload.class).writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }

    private EventPayload deserialize(String json) {
        try {
            return objectMapper.readValue(json, EventPayload.class);
        } catch (JsonProcessingException e) {
            throw new CorruptEventLogException("Unreadable event payload in log: " + e.getOriginalMessage(), e);
        }
    }
}
