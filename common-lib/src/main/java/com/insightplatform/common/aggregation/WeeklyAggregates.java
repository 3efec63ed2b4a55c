package com.insightplatform.common.aggregation;

import com.insightplatform.common.model.ProductAggregate;
import com.insightplatform.common.model.QueryAggregate;
import com.insightplatform.common.model.TopicAggregate;

import java.util.List;

/**
 * Immutable result of {@link WeeklyAggregator#aggregate}. Rows are sorted by entity key.
 */
public record WeeklyAggregates(
    List<QueryAggregate> queries,
    List<TopicAggregate> topics,
    List<ProductAggregate> products,
    StoreSummary summary
) {

    public WeeklyAggregates {
        queries  = List.copyOf(queries);
        topics   = List.copyOf(topics);
        products = List.copyOf(products);
    }
}
