package com.insightplatform.engine.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Query rows rolled up by topic. Unique on (store_id, week_start, topic).
 */
@Data
@NoArgsConstructor
@Table("agg_topics")
public class AggTopic {

    @Id
    private Long id;

    private String storeId;
    private LocalDate weekStart;
    private String topic;

    private int searches;
    private int clicks;
    private int purchases;
    private double ctr;
    private double conversionRate;

    @Column("delta_wow")
    private double deltaWoW;

    private LocalDateTime updatedAt;
}
