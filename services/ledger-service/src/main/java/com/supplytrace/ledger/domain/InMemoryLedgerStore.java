package com.supplytrace.ledger.domain;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Heap-backed {@link LedgerStore}. Not thread-safe. */
public class InMemoryLedgerStore implements LedgerStore {

    private final Map<Long, ProductRecord> products = new HashMap<>();
    private final Map<Long, List<InspectionEntry>> checks = new HashMap<>();
    private long lastId;

    @Override
    public long nextProductId() {
        return ++lastId;
    }

    @Override
    public long productCount() {
        return lastId;
    }

    @Override
    public Optional<ProductRecord> findProduct(long id) {
        return Optional.ofNullable(products.get(id));
    }

    @Override
    public void saveProduct(long id, ProductRecord product) {
        products.put(id, product);
    }

    @Override
    public void appendCheck(long id, InspectionEntry entry) {
        checks.computeIfAbsent(id, ignored -> new ArrayList<>()).add(entry);
    }

    @Override
    public List<InspectionEntry> checks(long id) {
        List<InspectionEntry> entries = checks.get(id);
        return entries == null ? List.of() : List.copyOf(entries);
    }
}
