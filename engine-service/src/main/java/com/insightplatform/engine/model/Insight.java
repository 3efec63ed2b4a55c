package com.insightplatform.engine.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A ranked call-to-action for a store and week, from either the store pipeline or the
 * trends job. Unique on (store_id, week_start, cta_type, entity_type, entity_key).
 *
 * <p>{@code status} starts ACTIVE and only changes through feedback.
 */
@Data
@NoArgsConstructor
@Table("insights")
public class Insight {

    @Id
    private Long id;

    private String storeId;
    private LocalDate weekStart;
    private String ctaType;
    private String entityType;
    private String entityKey;
    private int priority;
    private double confidence;
    private String evidenceJson;
    private String recommendedAction;
    private String status;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
