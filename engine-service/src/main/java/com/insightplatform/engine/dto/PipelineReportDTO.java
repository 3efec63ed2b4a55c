package com.insightplatform.engine.dto;

/**
 * The three store stages of one pipeline run, in execution order.
 */
public record PipelineReportDTO(
    String               runId,
    AggregationReportDTO aggregation,
    SignalsReportDTO     signals,
    DecisionsReportDTO   decisions
) {}
