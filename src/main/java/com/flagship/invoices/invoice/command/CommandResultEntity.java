package com.flagship.invoices.invoice.command;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * Stored outcome of a command, keyed by command id. Database side of the idempotency check.
 */
@Entity
@Table(
    name = "command_results",
    indexes = @Index(name = "idx_command_results_origin_id", columnList = "origin_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CommandResultEntity {

    @Id
    @Column(name = "command_id", nullable = false, updatable = false)
    private UUID commandId;

    @Column(name = "origin_id", nullable = false, updatable = false)
    private UUID originId;

    @Column(name = "succeeded", nullable = false, updatable = false)
    private boolean succeeded;

    @Column(name = "result", nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String result;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static CommandResultEntity of(CommandResult result, String json) {
        return new CommandResultEntity(
            result.getCommandId(),
            result.getOriginId(),
            result.succeeded(),
            json,
            null
        );
    }
}
