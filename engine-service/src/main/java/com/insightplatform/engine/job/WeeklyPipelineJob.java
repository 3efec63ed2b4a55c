package com.insightplatform.engine.job;

import com.insightplatform.engine.service.PipelineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.List;

/**
 * Runs the weekly store pipeline for every configured store, then the trends job.
 *
 * <p>Stores run one after another. A failing store is logged and the next one still runs.
 */
@Component
public class WeeklyPipelineJob {

    private static final Logger log = LoggerFactory.getLogger(WeeklyPipelineJob.class);

    private final PipelineService pipelineService;

    @Value("${insight.scheduler.enabled:false}")
    private boolean enabled;

    @Value("${insight.scheduler.store-ids:}")
    private String storeIdsConfig;

    @Value("${insight.trends.store-id:global}")
    private String trendsStoreId;

    public WeeklyPipelineJob(PipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @Scheduled(cron = "${insight.scheduler.cron:0 0 6 * * MON}", zone = "UTC")
    public void runWeekly() {
        if (!enabled) {
            log.debug("Weekly pipeline disabled, skipping");
            return;
        }
        List<String> storeIds = storeIds();
        log.info("Weekly pipeline triggered. stores={} trendsStoreId={}", storeIds, trendsStoreId);

        Flux.fromIterable(storeIds)
            .concatMap(storeId -> pipelineService.runPipeline(storeId, null)
                .onErrorResume(e -> {
                    log.warn("Weekly pipeline failed for store (continuing). storeId={} reason={}",
                             storeId, e.getMessage());
                    return Mono.empty();
                }))
            .then(Mono.defer(() -> pipelineService.runTrends(trendsStoreId))
                .onErrorResume(e -> {
                    log.warn("Weekly trends run failed. storeId={} reason={}", trendsStoreId, e.getMessage());
                    return Mono.empty();
                }))
            .subscribe(
                report -> log.info("Weekly run completed. trendsInsights={}", report.insightsSaved()),
                err -> log.error("Weekly run aborted", err));
    }

    List<String> storeIds() {
        if (storeIdsConfig == null || storeIdsConfig.isBlank()) {
            return List.of();
        }
        return Arrays.stream(storeIdsConfig.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }
}
