package com.insightplatform.engine.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Weekly product views, purchases and revenue. Only written for catalog products.
 */
@Data
@NoArgsConstructor
@Table("agg_products")
public class AggProduct {

    @Id
    private Long id;

    private String storeId;
    private LocalDate weekStart;
    private String productId;

    private int views;
    private int purchases;
    private long revenueCents;

    @Column("delta_wow")
    private double deltaWoW;

    private LocalDateTime updatedAt;
}
