package com.insightplatform.engine.events;

import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Date;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("MongoRawEventStore")
class MongoRawEventStoreTest {

    private static final Instant FROM = Instant.parse("2025-06-02T00:00:00Z");
    private static final Instant TO   = Instant.parse("2025-06-09T00:00:00Z");

    @Mock
    private ReactiveMongoTemplate mongoTemplate;

    private MongoRawEventStore store;

    @BeforeEach
    void setUp() {
        store = new MongoRawEventStore(mongoTemplate);
        ReflectionTestUtils.setField(store, "searchCollection", "search_events");
        ReflectionTestUtils.setField(store, "clickCollection", "click_events");
        ReflectionTestUtils.setField(store, "purchaseCollection", "purchase_events");
        ReflectionTestUtils.setField(store, "tenantField", "tenantId");
        ReflectionTestUtils.setField(store, "readLimit", 0);
    }

    @Test
    @DisplayName("time window covers four timestamp fields in four encodings")
    void timeWindowAlternatives() {
        Document filter = MongoRawEventStore.timeWindow(FROM, TO).getCriteriaObject();

        List<?> alternatives = (List<?>) filter.get("$or");
        assertThat(alternatives).hasSize(16);
        assertThat(alternatives.get(0).toString()).contains("ts").contains("$gte");
        assertThat(filter.toJson()).contains("1748822400").contains("1749427200");
    }

    @Test
    @DisplayName("string range spans whole UTC days around the window")
    void stringRangeWidened() {
        String json = MongoRawEventStore.timeWindow(FROM, TO).getCriteriaObject().toJson();

        assertThat(json).contains("\"$gte\": \"2025-06-01\"").contains("\"$lt\": \"2025-06-11\"");
    }

    @Test
    @DisplayName("date-only and offset timestamps are kept or dropped by their instant")
    void dateOnlyAndOffsetTimestamps() {
        Document dateOnly = new Document("query", "rioja").append("ts", "2025-06-02");
        Document offsetInside = new Document("query", "cava").append("ts", "2025-06-09T01:00:00+03:00");
        Document offsetOutside = new Document("query", "syrah").append("ts", "2025-06-08T23:30:00-05:00");
        Document dayBefore = new Document("query", "malbec").append("ts", "2025-06-01");
        when(mongoTemplate.find(any(Query.class), eq(Document.class), eq("search_events")))
            .thenReturn(Flux.just(dateOnly, offsetInside, offsetOutside, dayBefore));

        StepVerifier.create(store.readWindow(EventStream.SEARCH, "demo-store", FROM, TO))
            .assertNext(doc -> assertThat(doc).containsEntry("query", "rioja"))
            .assertNext(doc -> assertThat(doc).containsEntry("query", "cava"))
            .verifyComplete();
    }

    @Test
    @DisplayName("window read scopes by tenant and re-checks timestamps client side")
    void readWindowFiltersByTenant() {
        Document inside = new Document("query", "pinot noir").append("timestamp", Date.from(Instant.parse("2025-06-03T10:00:00Z")));
        Document outside = new Document("query", "pinot noir").append("ts", "2025-06-10T10:00:00Z");
        when(mongoTemplate.find(any(Query.class), eq(Document.class), eq("click_events")))
            .thenReturn(Flux.just(inside, outside));

        StepVerifier.create(store.readWindow(EventStream.CLICK, "demo-store", FROM, TO))
            .assertNext(doc -> assertThat(doc).containsEntry("query", "pinot noir"))
            .verifyComplete();

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(query.capture(), eq(Document.class), eq("click_events"));
        assertThat(query.getValue().getQueryObject().toJson()).contains("\"tenantId\": \"demo-store\"");
    }

    @Test
    @DisplayName("global read has no tenant condition and projects query and time fields")
    void readAllGlobal() {
        when(mongoTemplate.find(any(Query.class), eq(Document.class), eq("search_events")))
            .thenReturn(Flux.empty());

        StepVerifier.create(store.readAll(EventStream.SEARCH, RawEventStore.GLOBAL_STORE_ID))
            .verifyComplete();

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(query.capture(), eq(Document.class), eq("search_events"));
        assertThat(query.getValue().getQueryObject()).isEmpty();
        assertThat(query.getValue().getFieldsObject()).containsKeys("query", "queryNorm", "ts", "created_at");
    }
}
