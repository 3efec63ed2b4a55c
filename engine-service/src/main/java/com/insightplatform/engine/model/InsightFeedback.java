package com.insightplatform.engine.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Append-only log of merchant feedback on insights.
 */
@Data
@NoArgsConstructor
@Table("insight_feedback")
public class InsightFeedback {

    @Id
    private Long id;

    private Long insightId;
    private String storeId;
    private String kind;
    private String note;
    private LocalDateTime createdAt;
}
