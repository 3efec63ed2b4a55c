package com.insightplatform.engine.service;

import com.insightplatform.common.model.InsightStatus;
import com.insightplatform.engine.dto.FeedbackKind;
import com.insightplatform.engine.dto.FeedbackRequestDTO;
import com.insightplatform.engine.dto.InsightDTO;
import com.insightplatform.engine.exception.InsightNotFoundException;
import com.insightplatform.engine.model.Insight;
import com.insightplatform.engine.model.InsightFeedback;
import com.insightplatform.engine.repository.InsightCooldownRepository;
import com.insightplatform.engine.repository.InsightFeedbackRepository;
import com.insightplatform.engine.repository.InsightRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Read side of insights and the merchant feedback loop.
 */
@Service
public class InsightService {

    private static final Logger log = LoggerFactory.getLogger(InsightService.class);

    static final int LIST_LIMIT = 50;

    private final InsightRepository insightRepository;
    private final InsightFeedbackRepository feedbackRepository;
    private final InsightCooldownRepository cooldownRepository;
    private final TransactionalOperator transactionalOperator;
    private final EvidenceJson evidenceJson;
    private final Clock clock;

    public InsightService(InsightRepository insightRepository,
                          InsightFeedbackRepository feedbackRepository,
                          InsightCooldownRepository cooldownRepository,
                          TransactionalOperator transactionalOperator,
                          EvidenceJson evidenceJson,
                          Clock clock) {
        this.insightRepository     = insightRepository;
        this.feedbackRepository    = feedbackRepository;
        this.cooldownRepository    = cooldownRepository;
        this.transactionalOperator = transactionalOperator;
        this.evidenceJson          = evidenceJson;
        this.clock                 = clock;
    }

    /** ACTIVE insights of a store, newest week first, then by priority. At most 50. */
    public Flux<InsightDTO> listActive(String storeId) {
        if (storeId == null || storeId.isBlank()) {
            return Flux.error(new IllegalArgumentException("storeId is required"));
        }
        return insightRepository.findActiveByStore(storeId, LIST_LIMIT)
            .map(this::toDto);
    }

    /**
     * Applies merchant feedback: status becomes EXECUTED or DISMISSED, the feedback is
     * appended, and EXECUTED also stamps the entity's cooldown. All in one transaction.
     *
     * @throws InsightNotFoundException (as error signal) when the insight does not exist
     */
    public Mono<InsightDTO> applyFeedback(Long insightId, FeedbackRequestDTO request) {
        if (request == null || request.kind() == null) {
            return Mono.error(new IllegalArgumentException("kind must be one of EXECUTED, NOT_RELEVANT"));
        }
        if (request.note() != null && request.note().length() > FeedbackRequestDTO.MAX_NOTE_LENGTH) {
            return Mono.error(new IllegalArgumentException(
                "note must be at most " + FeedbackRequestDTO.MAX_NOTE_LENGTH + " characters"));
        }
        FeedbackKind kind = request.kind();
        InsightStatus next = kind.resultingStatus();

        return insightRepository.findById(insightId)
            .switchIfEmpty(Mono.error(new InsightNotFoundException(insightId)))
            .flatMap(insight -> transactionalOperator.transactional(
                    insightRepository.updateStatus(insightId, next.name())
                        .then(feedbackRepository.save(feedback(insight, kind, request.note())))
                        .then(kind == FeedbackKind.EXECUTED
                            ? cooldownRepository.markExecuted(insight.getStoreId(), insight.getEntityType(),
                                                              insight.getEntityKey(), clock.instant())
                            : Mono.<Void>empty()))
                .then(Mono.fromSupplier(() -> {
                    insight.setStatus(next.name());
                    return toDto(insight);
                })))
            .doOnSuccess(dto -> log.info("Feedback applied. insightId={} kind={} status={} storeId={}",
                                         insightId, kind, next, dto.storeId()))
            .doOnError(e -> log.warn("Feedback not applied. insightId={} kind={} reason={}",
                                     insightId, kind, e.getMessage()));
    }

    private InsightFeedback feedback(Insight insight, FeedbackKind kind, String note) {
        InsightFeedback f = new InsightFeedback();
        f.setInsightId(insight.getId());
        f.setStoreId(insight.getStoreId());
        f.setKind(kind.name());
        f.setNote(note);
        f.setCreatedAt(LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC));
        return f;
    }

    InsightDTO toDto(Insight i) {
        return new InsightDTO(i.getId(), i.getStoreId(), i.getWeekStart(), i.getCtaType(), i.getEntityType(),
            i.getEntityKey(), i.getPriority(), i.getConfidence(), evidenceJson.read(i.getEvidenceJson()),
            i.getRecommendedAction(), i.getStatus());
    }
}
