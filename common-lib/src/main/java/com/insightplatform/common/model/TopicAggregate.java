package com.insightplatform.common.model;

/**
 * Roll-up of {@link QueryAggregate} rows per classified topic.
 */
public record TopicAggregate(
    String topic,
    int searches,
    int clicks,
    int purchases,
    double ctr,
    double conversionRate,
    double deltaWoW
) {}
