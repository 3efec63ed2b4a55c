package com.insightplatform.common.model;

/**
 * Weekly product funnel: views from clicks, purchases and revenue from purchase events.
 * {@code deltaWoW} is computed on views.
 */
public record ProductAggregate(
    String productId,
    int views,
    int purchases,
    long revenueCents,
    double deltaWoW
) {}
