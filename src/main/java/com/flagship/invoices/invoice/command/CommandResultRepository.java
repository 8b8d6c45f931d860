package com.flagship.invoices.invoice.command;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface CommandResultRepository extends JpaRepository<CommandResultEntity, UUID> {

    long countByOriginId(UUID originId);
}
