package com.insightplatform.common.model;

/**
 * Weekly statistics for one normalized query.
 *
 * @param queryNorm       normalized query text
 * @param searches        explicit searches, or implicit ones from clicks when the week has no search events
 * @param clicks          click events attributed to the query
 * @param purchases       purchase events attributed to the query
 * @param ctr             clicks / searches, 0 when searches is 0
 * @param conversionRate  purchases / searches, 0 when searches is 0
 * @param deltaWoW        percent change of searches against the previous week
 * @param avgResultsCount mean results returned over explicit search events
 */
public record QueryAggregate(
    String queryNorm,
    int searches,
    int clicks,
    int purchases,
    double ctr,
    double conversionRate,
    double deltaWoW,
    double avgResultsCount
) {}
