package com.retailinsight.insight;

import com.retailinsight.common.model.RawProductRecord;
import com.retailinsight.insight.source.ProductRecordSource;
import reactor.core.publisher.Flux;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/** Test source serving fixed records (or a fixed error) and counting fetches. */
public class InMemoryProductRecordSource implements ProductRecordSource {

    private final List<RawProductRecord> records;
    private final RuntimeException failure;
    private final AtomicInteger fetches = new AtomicInteger();

    private InMemoryProductRecordSource(List<RawProductRecord> records, RuntimeException failure) {
        this.records = records;
        this.failure = failure;
    }

    public static InMemoryProductRecordSource of(List<RawProductRecord> records) {
        return new InMemoryProductRecordSource(records, null);
    }

    public static InMemoryProductRecordSource failing(RuntimeException failure) {
        return new InMemoryProductRecordSource(List.of(), failure);
    }

    /** Two dairy products: milk sold on 2025-03-10, cheese on 2025-04-01. */
    public static List<RawProductRecord> sampleRecords() {
        return List.of(
            new RawProductRecord("1", "Milk", "Dairy", 1000, "", List.of(move("2025-03-10", 5, 2))),
            new RawProductRecord("2", "Cheese", "Dairy", 5000, "-10%", List.of(move("2025-04-01", 3, 0))));
    }

    public static Map<String, Object> move(String date, Object decreased, Object increased) {
        Map<String, Object> entry = new HashMap<>();
        entry.put("date", date);
        entry.put("stock_decreased", decreased);
        entry.put("stock_increased", increased);
        return entry;
    }

    public int fetchCount() {
        return fetches.get();
    }

    @Override
    public String identity() {
        return "memory:products";
    }

    @Override
    public Flux<RawProductRecord> fetchAll() {
        return Flux.defer(() -> {
            fetches.incrementAndGet();
            return failure != null ? Flux.error(failure) : Flux.fromIterable(records);
        });
    }
}
