package com.insightplatform.engine.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.insightplatform.engine.dto.FeedbackKind;
import com.insightplatform.engine.dto.FeedbackRequestDTO;
import com.insightplatform.engine.exception.InsightNotFoundException;
import com.insightplatform.engine.model.Insight;
import com.insightplatform.engine.model.InsightFeedback;
import com.insightplatform.engine.repository.InsightCooldownRepository;
import com.insightplatform.engine.repository.InsightFeedbackRepository;
import com.insightplatform.engine.repository.InsightRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("InsightService")
class InsightServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-05T09:30:00Z");

    @Mock private InsightRepository insightRepository;
    @Mock private InsightFeedbackRepository feedbackRepository;
    @Mock private InsightCooldownRepository cooldownRepository;
    @Mock private TransactionalOperator transactionalOperator;

    private InsightService service;

    @BeforeEach
    void setUp() {
        EvidenceJson evidenceJson = new EvidenceJson(new ObjectMapper().registerModule(new JavaTimeModule()));
        service = new InsightService(insightRepository, feedbackRepository, cooldownRepository,
            transactionalOperator, evidenceJson, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Insight insight(long id) {
        Insight i = new Insight();
        i.setId(id);
        i.setStoreId("demo-store");
        i.setWeekStart(LocalDate.of(2025, 6, 2));
        i.setCtaType("PUSH_THIS_WEEK");
        i.setEntityType("query");
        i.setEntityKey("pinot noir");
        i.setPriority(1);
        i.setConfidence(0.9);
        i.setEvidenceJson("{\"searches\":80,\"deltaWoW\":220.0}");
        i.setRecommendedAction("Merchandise and feature \"pinot noir\" prominently this week.");
        i.setStatus("ACTIVE");
        return i;
    }

    @SuppressWarnings("unchecked")
    private void stubWrites() {
        when(transactionalOperator.transactional(any(Mono.class))).thenAnswer(inv -> inv.getArgument(0));
        when(insightRepository.updateStatus(anyLong(), anyString())).thenReturn(Mono.just(1));
        when(feedbackRepository.save(any(InsightFeedback.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
    }

    @Nested
    @DisplayName("Feedback")
    class Feedback {

        @Test
        @DisplayName("EXECUTED marks the insight executed and stamps the cooldown")
        void executed() {
            when(insightRepository.findById(7L)).thenReturn(Mono.just(insight(7L)));
            stubWrites();
            when(cooldownRepository.markExecuted("demo-store", "query", "pinot noir", NOW)).thenReturn(Mono.empty());

            StepVerifier.create(service.applyFeedback(7L, new FeedbackRequestDTO(FeedbackKind.EXECUTED, "featured on homepage")))
                .assertNext(dto -> {
                    assertThat(dto.id()).isEqualTo(7L);
                    assertThat(dto.status()).isEqualTo("EXECUTED");
                    assertThat(dto.evidence()).containsEntry("searches", 80);
                })
                .verifyComplete();

            verify(insightRepository).updateStatus(7L, "EXECUTED");
            ArgumentCaptor<InsightFeedback> saved = ArgumentCaptor.forClass(InsightFeedback.class);
            verify(feedbackRepository).save(saved.capture());
            assertThat(saved.getValue().getInsightId()).isEqualTo(7L);
            assertThat(saved.getValue().getKind()).isEqualTo("EXECUTED");
            assertThat(saved.getValue().getNote()).isEqualTo("featured on homepage");
            verify(cooldownRepository).markExecuted("demo-store", "query", "pinot noir", NOW);
        }

        @Test
        @DisplayName("NOT_RELEVANT dismisses without touching the cooldown")
        void notRelevant() {
            when(insightRepository.findById(7L)).thenReturn(Mono.just(insight(7L)));
            stubWrites();

            StepVerifier.create(service.applyFeedback(7L, new FeedbackRequestDTO(FeedbackKind.NOT_RELEVANT, null)))
                .assertNext(dto -> assertThat(dto.status()).isEqualTo("DISMISSED"))
                .verifyComplete();

            verify(insightRepository).updateStatus(7L, "DISMISSED");
            verifyNoInteractions(cooldownRepository);
        }

        @Test
        @DisplayName("unknown insight id signals InsightNotFoundException")
        void notFound() {
            when(insightRepository.findById(99L)).thenReturn(Mono.empty());

            StepVerifier.create(service.applyFeedback(99L, new FeedbackRequestDTO(FeedbackKind.EXECUTED, null)))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(InsightNotFoundException.class);
                    assertThat(((InsightNotFoundException) e).getInsightId()).isEqualTo(99L);
                })
                .verify();

            verifyNoInteractions(feedbackRepository, cooldownRepository);
        }

        @Test
        @DisplayName("missing kind is rejected before any lookup")
        void missingKind() {
            StepVerifier.create(service.applyFeedback(7L, new FeedbackRequestDTO(null, "x")))
                .expectError(IllegalArgumentException.class)
                .verify();

            verifyNoInteractions(insightRepository);
        }

        @Test
        @DisplayName("note longer than the limit is rejected")
        void noteTooLong() {
            String note = "x".repeat(FeedbackRequestDTO.MAX_NOTE_LENGTH + 1);

            StepVerifier.create(service.applyFeedback(7L, new FeedbackRequestDTO(FeedbackKind.EXECUTED, note)))
                .expectErrorMessage("note must be at most 2000 characters")
                .verify();

            verifyNoInteractions(insightRepository);
        }
    }

    @Nested
    @DisplayName("Listing")
    class Listing {

        @Test
        @DisplayName("active insights are listed with parsed evidence")
        void listActive() {
            when(insightRepository.findActiveByStore("demo-store", InsightService.LIST_LIMIT))
                .thenReturn(Flux.just(insight(1L), insight(2L)));

            StepVerifier.create(service.listActive("demo-store"))
                .assertNext(dto -> {
                    assertThat(dto.id()).isEqualTo(1L);
                    assertThat(dto.ctaType()).isEqualTo("PUSH_THIS_WEEK");
                    assertThat(dto.evidence()).containsKeys("searches", "deltaWoW");
                })
                .assertNext(dto -> assertThat(dto.id()).isEqualTo(2L))
                .verifyComplete();
        }

        @Test
        @DisplayName("blank storeId is rejected")
        void blankStore() {
            StepVerifier.create(service.listActive(" "))
                .expectError(IllegalArgumentException.class)
                .verify();
        }
    }
}
