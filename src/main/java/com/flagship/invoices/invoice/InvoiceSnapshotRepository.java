package com.flagship.invoices.invoice;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface InvoiceSnapshotRepository extends JpaRepository<InvoiceSnapshotEntity, UUID> {

    /**
     * SELECT ... FOR UPDATE on the snapshot row. Held until the command transaction
     * ends, so commands for one invoice execute one at a time.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM InvoiceSnapshotEntity s WHERE s.originId = :originId")
    Optional<InvoiceSnapshotEntity> findForUpdate(@Param("originId") UUID originId);
}
