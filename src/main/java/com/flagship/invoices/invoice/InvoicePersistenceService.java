package com.flagship.invoices.invoice;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Snapshot store: bridges {@link InvoiceSnapshot} and {@link InvoiceSnapshotEntity}.
 *
 * An origin id with no row is the empty snapshot (version 0, no invoice).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoicePersistenceService {

    private final InvoiceSnapshotRepository repository;
    private final ObjectMapper objectMapper;

    @Transactional(readOnly = true)
    public InvoiceSnapshot load(UUID originId) {
        return repository.findById(originId)
            .map(this::toSnapshot)
            .orElse(InvoiceSnapshot.empty());
    }

    /**
     * Loads and row-locks the snapshot for the rest of the caller's transaction.
     * Nothing is locked for an origin id that has no row yet.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public InvoiceSnapshot loadForUpdate(UUID originId) {
        return repository.findForUpdate(originId)
            .map(this::toSnapshot)
            .orElse(InvoiceSnapshot.empty());
    }

    /**
     * Writes newSnapshot in place of oldSnapshot.
     *
     * @throws OptimisticLockingFailureException if the stored version is no longer oldSnapshot's
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void save(UUID originId, InvoiceSnapshot oldSnapshot, InvoiceSnapshot newSnapshot) {
        String invoiceJson = serialize(newSnapshot.getInvoice());
        Optional<InvoiceSnapshotEntity> existing = repository.findById(originId);

        if (existing.isEmpty()) {
            if (oldSnapshot.getVersion() != 0) {
                throw new OptimisticLockingFailureException(
                    String.format("Snapshot %s expected at version %d but does not exist",
                        originId, oldSnapshot.getVersion()));
            }
            repository.saveAndFlush(InvoiceSnapshotEntity.create(originId, newSnapshot.getVersion(), invoiceJson));
            log.debug("Inserted snapshot {} at version {}", originId, newSnapshot.getVersion());
            return;
        }

        InvoiceSnapshotEntity entity = existing.get();
        if (entity.getVersion() != oldSnapshot.getVersion()) {
            throw new OptimisticLockingFailureException(
                String.format("Snapshot %s is at version %d, expected %d",
                    originId, entity.getVersion(), oldSnapshot.getVersion()));
        }
        entity.advance(newSnapshot.getVersion(), invoiceJson);
        repository.saveAndFlush(entity);
        log.debug("Advanced snapshot {} from version {} to {}",
            originId, oldSnapshot.getVersion(), newSnapshot.getVersion());
    }

    private InvoiceSnapshot toSnapshot(InvoiceSnapshotEntity entity) {
        return new InvoiceSnapshot(entity.getVersion(), deserialize(entity.getInvoice()));
    }

    private String serialize(Invoice invoice) {
        if (invoice == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(invoice);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize invoice", e);
        }
    }

    private Invoice deserialize(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, Invoice.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable snapshot: " + e.getOriginalMessage(), e);
        }
    }
}
