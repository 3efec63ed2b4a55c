package com.insightplatform.engine.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

/**
 * One row per (store_id, entity_type, entity_key).
 */
@Data
@NoArgsConstructor
@Table("insight_cooldowns")
public class InsightCooldown {

    @Id
    private Long id;

    private String storeId;
    private String entityType;
    private String entityKey;
    private Instant lastGeneratedAt;
    private Instant lastExecutedAt;
}
