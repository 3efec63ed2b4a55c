package com.insightplatform.engine.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Tenant row. Created on first aggregation for a store id, never updated.
 */
@Data
@NoArgsConstructor
@Table("stores")
public class Store {

    @Id
    private String id;

    private String name;
    private LocalDateTime createdAt;
}
