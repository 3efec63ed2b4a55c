package com.insightplatform.engine.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Weekly funnel numbers for one normalized query of a store.
 * Unique on (store_id, week_start, query_norm).
 */
@Data
@NoArgsConstructor
@Table("agg_queries")
public class AggQuery {

    @Id
    private Long id;

    private String storeId;
    private LocalDate weekStart;
    private String queryNorm;

    private int searches;
    private int clicks;
    private int purchases;
    private double ctr;
    private double conversionRate;

    @Column("delta_wow")
    private double deltaWoW;

    private double avgResultsCount;

    private LocalDateTime updatedAt;
}
