package com.flagship.invoices.consumer;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.UUID;

/**
 * Composite primary key of processed_events.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProcessedEventKey implements Serializable {
    private UUID originId;
    private int version;
    private String consumerGroup;
}
