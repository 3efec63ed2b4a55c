package com.insightplatform.engine.controller;

import com.insightplatform.engine.dto.FeedbackRequestDTO;
import com.insightplatform.engine.dto.InsightDTO;
import com.insightplatform.engine.service.InsightService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/insights")
public class InsightsController {

    private static final Logger log = LoggerFactory.getLogger(InsightsController.class);

    private final InsightService insightService;

    public InsightsController(InsightService insightService) {
        this.insightService = insightService;
    }

    @GetMapping
    public Flux<InsightDTO> list(@RequestParam String storeId) {
        log.info("Insights query received. storeId={}", storeId);
        return insightService.listActive(storeId);
    }

    @PostMapping("/{id}/feedback")
    public Mono<ResponseEntity<InsightDTO>> feedback(@PathVariable Long id,
                                                     @RequestBody FeedbackRequestDTO body) {
        log.info("Feedback received. insightId={} kind={}", id, body.kind());
        return insightService.applyFeedback(id, body)
            .map(ResponseEntity::ok);
    }
}
