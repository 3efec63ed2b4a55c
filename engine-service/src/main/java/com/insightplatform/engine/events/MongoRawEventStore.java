package com.insightplatform.engine.events;

import com.insightplatform.common.aggregation.RawEventFields;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * {@link RawEventStore} over reactive MongoDB.
 *
 * <p>Producers wrote timestamps under several field names and in several encodings, so
 * the window filter is an {@code $or} over every (field, encoding) pair: BSON date,
 * ISO-8601 string, epoch seconds and epoch milliseconds. Mongo only compares values
 * within the same type bracket, so the numeric and string ranges never cross-match.
 * String timestamps compare lexicographically, so date-only values and values carrying a
 * UTC offset sort outside the exact ISO bounds; the string range is therefore widened to
 * whole UTC dates wide enough to cover any offset. Documents are re-checked in memory with {@link RawEventFields#within} because an
 * event can carry more than one timestamp field.
 */
@Component
public class MongoRawEventStore implements RawEventStore {

    private static final Logger log = LoggerFactory.getLogger(MongoRawEventStore.class);

    @Value("${insight.events.search-collection:search_events}")
    private String searchCollection;

    @Value("${insight.events.click-collection:click_events}")
    private String clickCollection;

    @Value("${insight.events.purchase-collection:purchase_events}")
    private String purchaseCollection;

    @Value("${insight.events.tenant-field:tenantId}")
    private String tenantField;

    // 0 = unlimited
    @Value("${insight.events.read-limit:0}")
    private int readLimit;

    private final ReactiveMongoTemplate mongoTemplate;

    public MongoRawEventStore(ReactiveMongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Flux<Map<String, Object>> readWindow(EventStream stream, String storeId, Instant from, Instant to) {
        Query query = new Query(withTenant(storeId, timeWindow(from, to)));
        if (readLimit > 0) {
            query.limit(readLimit);
        }
        String collection = collectionFor(stream);
        log.debug("Reading raw events. collection={} storeId={} from={} to={} limit={}",
                  collection, storeId, from, to, readLimit);
        return mongoTemplate.find(query, Document.class, collection)
            .map(MongoRawEventStore::asMap)
            .filter(doc -> RawEventFields.within(doc, from, to))
            .doOnError(e -> log.error("Raw event read failed. collection={} storeId={}", collection, storeId, e));
    }

    @Override
    public Flux<Map<String, Object>> readAll(EventStream stream, String storeId) {
        Query query = GLOBAL_STORE_ID.equals(storeId)
            ? new Query()
            : new Query(Criteria.where(tenantField).is(storeId));
        List<String> projected = new ArrayList<>();
        projected.addAll(RawEventFields.QUERY_FIELDS);
        projected.addAll(RawEventFields.TIMESTAMP_FIELDS);
        query.fields().include(projected.toArray(String[]::new));

        String collection = collectionFor(stream);
        log.debug("Reading all raw events. collection={} storeId={}", collection, storeId);
        return mongoTemplate.find(query, Document.class, collection)
            .map(MongoRawEventStore::asMap)
            .doOnError(e -> log.error("Raw event read failed. collection={} storeId={}", collection, storeId, e));
    }

    // ── filters ────────────────────────────────────────────────────────────

    static Criteria timeWindow(Instant from, Instant to) {
        Date fromDate = Date.from(from);
        Date toDate = Date.from(to);
        String fromIso = from.atZone(ZoneOffset.UTC).toLocalDate().minusDays(1).toString();
        String toIso = to.atZone(ZoneOffset.UTC).toLocalDate().plusDays(2).toString();

        List<Criteria> alternatives = new ArrayList<>();
        for (String field : RawEventFields.TIMESTAMP_FIELDS) {
            alternatives.add(Criteria.where(field).gte(fromDate).lt(toDate));
            alternatives.add(Criteria.where(field).gte(fromIso).lt(toIso));
            alternatives.add(Criteria.where(field).gte(from.getEpochSecond()).lt(to.getEpochSecond()));
            alternatives.add(Criteria.where(field).gte(from.toEpochMilli()).lt(to.toEpochMilli()));
        }
        return new Criteria().orOperator(alternatives.toArray(Criteria[]::new));
    }

    private Criteria withTenant(String storeId, Criteria window) {
        if (GLOBAL_STORE_ID.equals(storeId)) {
            return window;
        }
        return new Criteria().andOperator(Criteria.where(tenantField).is(storeId), window);
    }

    private String collectionFor(EventStream stream) {
        return switch (stream) {
            case SEARCH   -> searchCollection;
            case CLICK    -> clickCollection;
            case PURCHASE -> purchaseCollection;
        };
    }

    private static Map<String, Object> asMap(Document document) {
        return document;
    }
}
