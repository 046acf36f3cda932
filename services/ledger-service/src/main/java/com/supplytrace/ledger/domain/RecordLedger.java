package com.supplytrace.ledger.domain;

import com.supplytrace.eventmodel.EntityType;
import com.supplytrace.eventmodel.EventEntity;
import com.supplytrace.eventmodel.EventFactory;
import com.supplytrace.eventmodel.EventPublisher;
import com.supplytrace.eventmodel.EventType;
import com.supplytrace.ledger.domain.event.ProductCompleted;
import com.supplytrace.ledger.domain.event.ProductRegistered;
import com.supplytrace.ledger.domain.event.ProductUpdated;
import com.supplytrace.ledger.domain.event.QualityCheckPerformed;
import com.supplytrace.observability.CorrelationContextHolder;
import com.supplytrace.security.AccessGuard;
import com.supplytrace.security.Identity;
import com.supplytrace.security.Role;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Product lifecycle and append-only inspection log.
 *
 * <p>Per product id: {@code UNREGISTERED -register-> ACTIVE -complete-> COMPLETED}. Checks and
 * updates are only accepted while ACTIVE. Every mutating operation runs its guards before the
 * first write, so a rejected call changes nothing and publishes nothing.
 *
 * <p>Not thread-safe. {@link SupplyChainLedger} serializes access.
 */
public class RecordLedger {

    private static final Logger log = LoggerFactory.getLogger(RecordLedger.class);

    static final String PRODUCER = "record-ledger";

    /** Roles allowed to record a quality check. */
    static final Set<Role> INSPECTOR_ROLES =
            EnumSet.of(Role.MANUFACTURER, Role.DISTRIBUTOR, Role.RETAILER);

    private final LedgerStore store;
    private final AccessGuard guard;
    private final EventPublisher publisher;
    private final Clock clock;

    public RecordLedger(LedgerStore store, AccessGuard guard, EventPublisher publisher, Clock clock) {
        if (store == null || guard == null || publisher == null || clock == null) {
            throw new IllegalArgumentException("store, guard, publisher and clock must not be null");
        }
        this.store = store;
        this.guard = guard;
        this.publisher = publisher;
        this.clock = clock;
    }

    /**
     * Registers a new product owned by the caller.
     *
     * @return the new product id (1 for the first product, then strictly increasing)
     * @throws com.supplytrace.security.UnauthorizedException if the caller is not a MANUFACTURER
     */
    public long register(
            Identity caller, String name, String originLocation, String batchNumber,
            Instant expirationDate) {
        guard.requireRole(caller, Role.MANUFACTURER);
        Instant now = clock.instant();
        // Invalid details must fail before an id is drawn.
        ProductRecord draft = new ProductRecord(
                0, name, originLocation, batchNumber, caller, now, expirationDate, false);

        long id = store.nextProductId();
        store.saveProduct(id, draft.withId(id));

        log.info("Registered product {} '{}' for {}", id, name, caller);
        publish(EventType.PRODUCT_REGISTERED, id, now, new ProductRegistered(id, name, caller));
        return id;
    }

    /**
     * Appends a quality check to a product's log.
     *
     * <p>The id is not required to be registered: checks against an unknown id are kept and
     * show up once that id is issued.
     *
     * @throws com.supplytrace.security.UnauthorizedException if the caller holds none of
     *     MANUFACTURER, DISTRIBUTOR, RETAILER
     * @throws AlreadyCompletedException if the product is completed
     */
    public void performCheck(
            Identity caller, long id, String checkpointName, boolean passed, String notes) {
        guard.requireAnyOf(caller, INSPECTOR_ROLES);
        requireActive(id, load(id));

        InspectionEntry entry = new InspectionEntry(caller, clock.instant(), checkpointName, passed, notes);
        store.appendCheck(id, entry);

        if (passed) {
            log.info("Product {} passed check '{}' by {}", id, checkpointName, caller);
        } else {
            log.warn("Product {} failed check '{}' by {}", id, checkpointName, caller);
        }
        publish(EventType.QUALITY_CHECK_PERFORMED, id, entry.timestamp(),
                new QualityCheckPerformed(id, checkpointName, passed));
    }

    /**
     * Closes a product's journey. One-way.
     *
     * @throws com.supplytrace.security.UnauthorizedException if the caller is not a RETAILER
     * @throws AlreadyCompletedException if the product is already completed
     */
    public void complete(Identity caller, long id) {
        guard.requireRole(caller, Role.RETAILER);
        ProductRecord product = load(id);
        requireActive(id, product);

        store.saveProduct(id, product.markCompleted());

        log.info("Product {} completed by {}", id, caller);
        publish(EventType.PRODUCT_COMPLETED, id, clock.instant(), new ProductCompleted(id));
    }

    /**
     * Rewrites the descriptive fields of a product.
     *
     * @throws com.supplytrace.security.UnauthorizedException if the caller is not a MANUFACTURER
     * @throws com.supplytrace.security.NotOwnerException if the caller did not register it
     * @throws AlreadyCompletedException if the product is completed
     */
    public void update(
            Identity caller, long id, String name, String originLocation, String batchNumber,
            Instant expirationDate) {
        guard.requireRole(caller, Role.MANUFACTURER);
        ProductRecord product = load(id);
        guard.requireOwner(caller, product.manufacturer());
        requireActive(id, product);

        store.saveProduct(id, product.withDetails(name, originLocation, batchNumber, expirationDate));

        log.info("Product {} updated by {}", id, caller);
        publish(EventType.PRODUCT_UPDATED, id, clock.instant(), new ProductUpdated(id));
    }

    /** The stored product, or {@link ProductRecord#zero()} when nothing is stored for the id. */
    public ProductRecord getRecord(long id) {
        return load(id);
    }

    /** The product's checks in the order they were recorded. */
    public List<InspectionEntry> getChecks(long id) {
        return store.checks(id);
    }

    /** Number of product ids issued so far. */
    public long productCount() {
        return store.productCount();
    }

    private ProductRecord load(long id) {
        return store.findProduct(id).orElse(ProductRecord.zero());
    }

    private static void requireActive(long id, ProductRecord product) {
        if (product.completed()) {
            throw new AlreadyCompletedException(id);
        }
    }

    private void publish(EventType type, long id, Instant occurredAt, Object payload) {
        publisher.publish(EventFactory.create(
                type,
                PRODUCER,
                CorrelationContextHolder.currentCorrelationId(),
                occurredAt,
                EventEntity.of(EntityType.PRODUCT, Long.toString(id)),
                payload));
    }
}
