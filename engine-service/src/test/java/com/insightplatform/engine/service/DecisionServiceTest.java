package com.insightplatform.engine.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.insightplatform.common.decision.DecisionConfig;
import com.insightplatform.engine.logger.PipelineFlowLogger;
import com.insightplatform.engine.model.Insight;
import com.insightplatform.engine.model.InsightCooldown;
import com.insightplatform.engine.model.SignalRecord;
import com.insightplatform.engine.repository.InsightCooldownRepository;
import com.insightplatform.engine.repository.InsightRepository;
import com.insightplatform.engine.repository.InventoryRepository;
import com.insightplatform.engine.repository.SignalRepository;
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
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DecisionService")
class DecisionServiceTest {

    private static final String STORE = "demo-store";
    private static final LocalDate WEEK = LocalDate.of(2025, 6, 2);
    private static final Instant NOW = Instant.parse("2025-06-04T12:00:00Z");

    private static final String SPIKE_EVIDENCE =
        "{\"searches\":80,\"deltaWoW\":220.0,\"weekStart\":\"2025-06-02\",\"ctr\":0.125,\"avgResultsCount\":12.0}";

    @Mock private SignalRepository signalRepository;
    @Mock private InsightCooldownRepository cooldownRepository;
    @Mock private InventoryRepository inventoryRepository;
    @Mock private InsightRepository insightRepository;
    @Mock private TransactionalOperator transactionalOperator;

    private DecisionService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        EvidenceJson evidenceJson = new EvidenceJson(new ObjectMapper().registerModule(new JavaTimeModule()));
        service = new DecisionService(signalRepository, cooldownRepository, inventoryRepository, insightRepository,
            transactionalOperator, DecisionConfig.defaults(), evidenceJson, new PipelineFlowLogger(),
            Clock.fixed(NOW, ZoneOffset.UTC));

        lenient().when(transactionalOperator.transactional(any(Mono.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(insightRepository.upsert(any(), any(), any(), any(), any(), anyInt(), anyDouble(), any(), any()))
            .thenReturn(Mono.empty());
        lenient().when(cooldownRepository.markGenerated(any(), any(), any(), any())).thenReturn(Mono.empty());
        lenient().when(insightRepository.findByStoreIdAndWeekStart(STORE, WEEK)).thenReturn(Flux.empty());
    }

    private static SignalRecord signal(String type, String entityType, String key, double confidence, String evidence) {
        SignalRecord row = new SignalRecord();
        row.setStoreId(STORE);
        row.setWeekStart(WEEK);
        row.setType(type);
        row.setEntityType(entityType);
        row.setEntityKey(key);
        row.setConfidence(confidence);
        row.setEvidenceJson(evidence);
        return row;
    }

    private static InsightCooldown cooldown(String key, Instant lastGenerated) {
        InsightCooldown row = new InsightCooldown();
        row.setStoreId(STORE);
        row.setEntityType("query");
        row.setEntityKey(key);
        row.setLastGeneratedAt(lastGenerated);
        return row;
    }

    private static Insight stored(long id, String ctaType, String key, int priority, String status) {
        Insight row = new Insight();
        row.setId(id);
        row.setStoreId(STORE);
        row.setWeekStart(WEEK);
        row.setCtaType(ctaType);
        row.setEntityType("query");
        row.setEntityKey(key);
        row.setPriority(priority);
        row.setStatus(status);
        return row;
    }

    private static Flux<SignalRecord> noResultSignals(int n) {
        List<SignalRecord> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            int searches = 30 + i * 10;
            rows.add(signal("NO_RESULTS_SPIKE", "query", "q" + i, 0.3 + i * 0.05,
                "{\"searches\":" + searches + ",\"deltaWoW\":0.0,\"avgResultsCount\":0.0}"));
        }
        return Flux.fromIterable(rows);
    }

    private void stub(boolean inStock, InsightCooldown... cooldowns) {
        when(signalRepository.findByStoreIdAndWeekStart(STORE, WEEK)).thenReturn(Flux.just(
            signal("SPIKE_DEMAND", "query", "pinot noir", 0.9, SPIKE_EVIDENCE)));
        when(cooldownRepository.findByStoreId(STORE)).thenReturn(Flux.fromArray(cooldowns));
        when(inventoryRepository.existsInStock(STORE)).thenReturn(Mono.just(inStock));
    }

    @Nested
    @DisplayName("Selection")
    class Selection {

        @Test
        @DisplayName("spiking query with stock on hand becomes PUSH_THIS_WEEK at priority 1")
        void pushThisWeek() {
            stub(true);

            StepVerifier.create(service.run(STORE, WEEK))
                .assertNext(report -> {
                    assertThat(report.candidates()).isEqualTo(1);
                    assertThat(report.selected()).isEqualTo(1);
                    assertThat(report.insightsUpserted()).isEqualTo(1);
                })
                .verifyComplete();

            ArgumentCaptor<String> action = ArgumentCaptor.forClass(String.class);
            verify(insightRepository).upsert(eq(STORE), eq(WEEK), eq("PUSH_THIS_WEEK"), eq("query"), eq("pinot noir"),
                eq(1), eq(0.9), contains("\"searches\":80"), action.capture());
            assertThat(action.getValue()).startsWith("Merchandise and feature \"pinot noir\"");
            verify(cooldownRepository).markGenerated(STORE, "query", "pinot noir", NOW);
        }

        @Test
        @DisplayName("no in-stock inventory suppresses demand pushes")
        void noInventory() {
            stub(false);

            StepVerifier.create(service.run(STORE, WEEK))
                .assertNext(report -> {
                    assertThat(report.candidates()).isZero();
                    assertThat(report.selected()).isZero();
                })
                .verifyComplete();

            verify(insightRepository, never()).upsert(any(), any(), any(), any(), any(), anyInt(), anyDouble(), any(), any());
            verify(cooldownRepository, never()).markGenerated(any(), any(), any(), any());
        }

        @Test
        @DisplayName("missing inventory answer counts as no stock")
        void inventoryUnknown() {
            when(signalRepository.findByStoreIdAndWeekStart(STORE, WEEK)).thenReturn(Flux.just(
                signal("SPIKE_DEMAND", "query", "pinot noir", 0.9, SPIKE_EVIDENCE)));
            when(cooldownRepository.findByStoreId(STORE)).thenReturn(Flux.empty());
            when(inventoryRepository.existsInStock(STORE)).thenReturn(Mono.empty());

            StepVerifier.create(service.run(STORE, WEEK))
                .assertNext(report -> assertThat(report.selected()).isZero())
                .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Cooldowns")
    class Cooldowns {

        @Test
        @DisplayName("entity generated three days ago is skipped")
        void recentlyGenerated() {
            stub(true, cooldown("pinot noir", NOW.minus(Duration.ofDays(3))));

            StepVerifier.create(service.run(STORE, WEEK))
                .assertNext(report -> assertThat(report.selected()).isZero())
                .verifyComplete();

            verifyNoInteractions(transactionalOperator);
        }

        @Test
        @DisplayName("entity generated twelve days ago is eligible again")
        void cooldownElapsed() {
            stub(true, cooldown("pinot noir", NOW.minus(Duration.ofDays(12))));

            StepVerifier.create(service.run(STORE, WEEK))
                .assertNext(report -> assertThat(report.selected()).isEqualTo(1))
                .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Re-running a week")
    class Rerun {

        @Test
        @DisplayName("second run for the same week writes the same picks with the same ranks")
        void sameSelection() {
            when(signalRepository.findByStoreIdAndWeekStart(STORE, WEEK))
                .thenReturn(noResultSignals(5), noResultSignals(5));
            when(inventoryRepository.existsInStock(STORE)).thenReturn(Mono.just(true));
            when(cooldownRepository.findByStoreId(STORE)).thenReturn(
                Flux.empty(),
                Flux.just(cooldown("q4", NOW), cooldown("q3", NOW), cooldown("q2", NOW)));
            when(insightRepository.findByStoreIdAndWeekStart(STORE, WEEK)).thenReturn(
                Flux.empty(),
                Flux.just(stored(1L, "FIX_THIS", "q4", 1, "ACTIVE"),
                          stored(2L, "FIX_THIS", "q3", 2, "ACTIVE"),
                          stored(3L, "FIX_THIS", "q2", 3, "DISMISSED")));

            StepVerifier.create(service.run(STORE, WEEK))
                .assertNext(report -> assertThat(report.selected()).isEqualTo(3))
                .verifyComplete();
            StepVerifier.create(service.run(STORE, WEEK))
                .assertNext(report -> assertThat(report.selected()).isEqualTo(3))
                .verifyComplete();

            ArgumentCaptor<String> keys = ArgumentCaptor.forClass(String.class);
            ArgumentCaptor<Integer> ranks = ArgumentCaptor.forClass(Integer.class);
            verify(insightRepository, times(6)).upsert(eq(STORE), eq(WEEK), eq("FIX_THIS"), eq("query"),
                keys.capture(), ranks.capture(), anyDouble(), any(), any());
            assertThat(keys.getAllValues()).containsExactly("q4", "q3", "q2", "q4", "q3", "q2");
            assertThat(ranks.getAllValues()).containsExactly(1, 2, 3, 1, 2, 3);
            verify(insightRepository, never()).deleteAllById(anyIterable());
        }

        @Test
        @DisplayName("ACTIVE rows of the week that fall out of the selection are removed")
        void staleRowsRemoved() {
            when(signalRepository.findByStoreIdAndWeekStart(STORE, WEEK)).thenReturn(noResultSignals(1));
            when(inventoryRepository.existsInStock(STORE)).thenReturn(Mono.just(true));
            when(cooldownRepository.findByStoreId(STORE)).thenReturn(Flux.empty());
            when(insightRepository.findByStoreIdAndWeekStart(STORE, WEEK)).thenReturn(Flux.just(
                stored(10L, "PUSH_THIS_WEEK", "merlot", 1, "ACTIVE"),
                stored(11L, "REPOSITION_THIS", "syrah", 2, "EXECUTED"),
                stored(12L, "PROMOTE_THIS_THEME", "Prosecco", 1, "ACTIVE")));
            when(insightRepository.deleteAllById(anyIterable())).thenReturn(Mono.empty());

            StepVerifier.create(service.run(STORE, WEEK))
                .assertNext(report -> assertThat(report.insightsUpserted()).isEqualTo(1))
                .verifyComplete();

            verify(insightRepository).deleteAllById(List.of(10L));
        }
    }

    @Test
    @DisplayName("the week's insight and cooldown writes run inside one transaction")
    @SuppressWarnings("unchecked")
    void writesAreTransactional() {
        stub(true);

        StepVerifier.create(service.run(STORE, WEEK))
            .expectNextCount(1)
            .verifyComplete();

        verify(transactionalOperator, times(1)).transactional(any(Mono.class));
    }

    @Test
    @DisplayName("unreadable evidence JSON still yields a candidate")
    void unreadableEvidence() {
        when(signalRepository.findByStoreIdAndWeekStart(STORE, WEEK)).thenReturn(Flux.just(
            signal("NO_RESULTS_SPIKE", "query", "orange wine", 0.4, "{not json")));
        when(cooldownRepository.findByStoreId(STORE)).thenReturn(Flux.empty());
        when(inventoryRepository.existsInStock(STORE)).thenReturn(Mono.just(true));

        StepVerifier.create(service.run(STORE, WEEK))
            .assertNext(report -> assertThat(report.selected()).isEqualTo(1))
            .verifyComplete();

        verify(insightRepository).upsert(eq(STORE), eq(WEEK), eq("FIX_THIS"), eq("query"), eq("orange wine"),
            eq(1), eq(0.4), eq("{}"), anyString());
    }
}
