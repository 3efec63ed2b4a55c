package com.insightplatform.engine.repository;

import com.insightplatform.engine.model.InsightFeedback;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface InsightFeedbackRepository extends ReactiveCrudRepository<InsightFeedback, Long> {
}
