package com.flagship.invoices.invoice;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
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
 * JPA entity for the latest snapshot of each invoice.
 *
 * No setters: the row only moves forward through {@link #advance(int, String)}.
 */
@Entity
@Table(name = "invoice_snapshots")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InvoiceSnapshotEntity {

    @Id
    @Column(name = "origin_id", nullable = false, updatable = false)
    private UUID originId;

    @Column(name = "version", nullable = false)
    private int version;

    @Column(name = "invoice", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String invoice;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static InvoiceSnapshotEntity create(UUID originId, int version, String invoiceJson) {
        return new InvoiceSnapshotEntity(originId, version, invoiceJson, null, null);
    }

    void advance(int newVersion, String invoiceJson) {
        if (newVersion <= this.version) {
            throw new IllegalStateException(
                String.format("Snapshot %s cannot move from version %d to %d", originId, version, newVersion));
        }
        this.version = newVersion;
        this.invoice = invoiceJson;
    }
}
