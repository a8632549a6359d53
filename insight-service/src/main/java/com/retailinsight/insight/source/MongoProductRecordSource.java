package com.retailinsight.insight.source;

import com.retailinsight.common.model.RawProductRecord;
import com.retailinsight.insight.exception.InsightException;
import com.retailinsight.insight.exception.SourceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationOptions;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Live {@link ProductRecordSource} over a MongoDB collection.
 *
 * <p>Fetch pipeline:
 * <ol>
 *   <li>{@code $match price > 0 AND price < 1e9}</li>
 *   <li>{@code $project _id, name, category, price, promotion, stock_history[:100]}</li>
 * </ol>
 * run with disk use allowed and a cursor batch size of {@value #BATCH_SIZE}.
 *
 * <p>The fetch timeout bounds the whole load (diagnostics and cursor), not the gap between
 * documents. Every failure surfaces as {@link SourceUnavailableException}. No retry.
 */
@Component
public class MongoProductRecordSource implements ProductRecordSource {

    private static final Logger log = LoggerFactory.getLogger(MongoProductRecordSource.class);

    static final long MAX_PRICE_EXCLUSIVE = 1_000_000_000L;
    static final int BATCH_SIZE = 500;

    private final ReactiveMongoTemplate template;
    private final String database;
    private final String collection;
    private final Duration fetchTimeout;

    public MongoProductRecordSource(ReactiveMongoTemplate template,
                                    @Value("${spring.data.mongodb.database:retail}") String database,
                                    @Value("${insight.source.collection:products}") String collection,
                                    @Value("${insight.source.fetch-timeout:PT30S}") Duration fetchTimeout) {
        this.template     = template;
        this.database     = database;
        this.collection   = collection;
        this.fetchTimeout = fetchTimeout;
    }

    @Override
    public String identity() {
        return "mongo:" + database + "/" + collection;
    }

    @Override
    public Flux<RawProductRecord> fetchAll() {
        return diagnostics()
            .doOnNext(d -> log.info("SOURCE_DIAGNOSTICS source={} total={} invalidPrice={} missingHistory={}",
                                    identity(), d.totalDocuments(), d.invalidPrice(), d.missingHistory()))
            .thenMany(template.aggregate(fetchPipeline(), collection, ProductDocument.class))
            .map(ProductDocumentMapper::toRawRecord)
            .timeout(Mono.delay(fetchTimeout), item -> Mono.never())
            .onErrorMap(e -> !(e instanceof InsightException),
                        e -> new SourceUnavailableException(identity(), describe(e), e))
            .doOnError(e -> log.error("SOURCE_UNAVAILABLE source={}", identity(), e));
    }

    private String describe(Throwable e) {
        return e instanceof TimeoutException
            ? "Product fetch exceeded " + fetchTimeout
            : "Product fetch failed: " + e.getMessage();
    }

    /** Counts of all, invalid-price and history-less documents in the collection. */
    public Mono<SourceDiagnostics> diagnostics() {
        Query invalidPrice = new Query(new Criteria().orOperator(
            Criteria.where("price").lte(0),
            Criteria.where("price").gte(MAX_PRICE_EXCLUSIVE),
            Criteria.where("price").exists(false)
        ));
        Query missingHistory = new Query(new Criteria().orOperator(
            Criteria.where("stock_history").exists(false),
            Criteria.where("stock_history").size(0)
        ));
        return Mono.zip(
                template.count(new Query(), collection),
                template.count(invalidPrice, collection),
                template.count(missingHistory, collection))
            .map(t -> new SourceDiagnostics(t.getT1(), t.getT2(), t.getT3()));
    }

    static Aggregation fetchPipeline() {
        return Aggregation.newAggregation(
                Aggregation.match(Criteria.where("price").gt(0).lt(MAX_PRICE_EXCLUSIVE)),
                Aggregation.project("name", "category", "price", "promotion")
                    .and("stock_history").slice(FETCH_HISTORY_LIMIT).as("stock_history"))
            .withOptions(AggregationOptions.builder()
                .allowDiskUse(true)
                .cursorBatchSize(BATCH_SIZE)
                .build());
    }
}
