package com.supplytrace.ledger.domain;

import java.util.List;
import java.util.Optional;

/**
 * Storage port for product records, their inspection logs and the id counter.
 *
 * <p>Implementations are not required to be thread-safe: every call arrives under the
 * {@link SupplyChainLedger} lock.
 */
public interface LedgerStore {

    /** Advances the id counter and returns the new id. The first call returns 1. */
    long nextProductId();

    /** Number of ids issued so far. */
    long productCount();

    Optional<ProductRecord> findProduct(long id);

    void saveProduct(long id, ProductRecord product);

    /** Appends to the end of the id's check sequence. */
    void appendCheck(long id, InspectionEntry entry);

    /** The id's checks in append order, as an immutable list; empty if none. */
    List<InspectionEntry> checks(long id);
}
