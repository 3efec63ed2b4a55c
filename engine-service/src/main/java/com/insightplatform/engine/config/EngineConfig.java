package com.insightplatform.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.insightplatform.common.decision.DecisionConfig;
import com.insightplatform.common.signal.SignalThresholds;
import com.insightplatform.common.trends.TrendsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Engine tunables, validated once at startup. An invalid value fails the context.
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    // ── signals ────────────────────────────────────────────────────────────

    @Value("${insight.signals.min-searches:25}")
    private int signalMinSearches;

    @Value("${insight.signals.spike-demand-delta-pct:30}")
    private double spikeDemandDeltaPct;

    @Value("${insight.signals.no-results-avg-threshold:0}")
    private double noResultsAvgThreshold;

    @Value("${insight.signals.min-ctr:0.25}")
    private double minCtr;

    @Value("${insight.signals.max-conversion-rate:0.01}")
    private double maxConversionRate;

    // ── decisions ──────────────────────────────────────────────────────────

    @Value("${insight.decisions.max-ctas-per-week:3}")
    private int maxCtasPerWeek;

    @Value("${insight.decisions.cooldown-days:10}")
    private int cooldownDays;

    @Value("${insight.decisions.min-searches:25}")
    private int decisionMinSearches;

    // ── trends ─────────────────────────────────────────────────────────────

    @Value("${insight.trends.min-volume:10}")
    private int trendsMinVolume;

    @Value("${insight.trends.recent-weeks:4}")
    private int recentWeeks;

    @Value("${insight.trends.velocity-threshold-pct:25}")
    private double velocityThresholdPct;

    @Value("${insight.trends.emerging-max-weeks:6}")
    private int emergingMaxWeeks;

    @Value("${insight.trends.emerging-min-volume:5}")
    private int emergingMinVolume;

    @Value("${insight.trends.max-per-type:5}")
    private int maxPerType;

    @Bean
    public SignalThresholds signalThresholds() {
        SignalThresholds thresholds = new SignalThresholds(
            signalMinSearches, spikeDemandDeltaPct, noResultsAvgThreshold, minCtr, maxConversionRate).validate();
        log.info("Signal thresholds loaded. {}", thresholds);
        return thresholds;
    }

    @Bean
    public DecisionConfig decisionConfig() {
        DecisionConfig config = new DecisionConfig(maxCtasPerWeek, cooldownDays, decisionMinSearches).validate();
        log.info("Decision config loaded. {}", config);
        return config;
    }

    @Bean
    public TrendsConfig trendsConfig() {
        TrendsConfig config = new TrendsConfig(trendsMinVolume, recentWeeks, velocityThresholdPct,
            emergingMaxWeeks, emergingMinVolume, maxPerType).validate();
        log.info("Trends config loaded. {}", config);
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
