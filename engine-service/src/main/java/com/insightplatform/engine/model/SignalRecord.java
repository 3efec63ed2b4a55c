package com.insightplatform.engine.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Persisted signal. {@code evidenceJson} holds the evidence map as JSON text.
 * Unique on (store_id, week_start, type, entity_type, entity_key).
 */
@Data
@NoArgsConstructor
@Table("signals")
public class SignalRecord {

    @Id
    private Long id;

    private String storeId;
    private LocalDate weekStart;
    private String type;
    private String entityType;
    private String entityKey;
    private double confidence;
    private String evidenceJson;

    private LocalDateTime updatedAt;
}
