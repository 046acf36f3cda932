package com.supplytrace.ledger.domain;

import com.supplytrace.security.Identity;
import com.supplytrace.security.Role;
import com.supplytrace.security.RoleRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * The ledger's public operation surface and its single serialization point.
 *
 * <p>Every mutation (product or role) runs under one fair write lock, so mutations apply in a
 * total order and events are published in commit order. Reads take the read lock and see the
 * last committed state. Nothing here blocks on I/O.
 */
public class SupplyChainLedger {

    private final RoleRegistry roles;
    private final RecordLedger records;
    private final LedgerMetrics metrics;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    public SupplyChainLedger(RoleRegistry roles, RecordLedger records, LedgerMetrics metrics) {
        this.roles = roles;
        this.records = records;
        this.metrics = metrics;
    }

    public long register(
            Identity caller, String name, String originLocation, String batchNumber,
            Instant expirationDate) {
        return write("register",
                () -> records.register(caller, name, originLocation, batchNumber, expirationDate));
    }

    public void performCheck(
            Identity caller, long productId, String checkpointName, boolean passed, String notes) {
        write("performCheck", () -> {
            records.performCheck(caller, productId, checkpointName, passed, notes);
            return null;
        });
    }

    public void complete(Identity caller, long productId) {
        write("complete", () -> {
            records.complete(caller, productId);
            return null;
        });
    }

    public void update(
            Identity caller, long productId, String name, String originLocation,
            String batchNumber, Instant expirationDate) {
        write("update", () -> {
            records.update(caller, productId, name, originLocation, batchNumber, expirationDate);
            return null;
        });
    }

    public void grantRole(Identity caller, Role role, Identity target) {
        write("grantRole", () -> {
            roles.grant(caller, role, target);
            return null;
        });
    }

    public void revokeRole(Identity caller, Role role, Identity target) {
        write("revokeRole", () -> {
            roles.revoke(caller, role, target);
            return null;
        });
    }

    public void renounceRole(Identity caller, Role role, Identity account) {
        write("renounceRole", () -> {
            roles.renounce(caller, role, account);
            return null;
        });
    }

    public ProductRecord getRecord(long productId) {
        return read(() -> records.getRecord(productId));
    }

    public List<InspectionEntry> getChecks(long productId) {
        return read(() -> records.getChecks(productId));
    }

    public long productCount() {
        return read(records::productCount);
    }

    public boolean hasRole(Identity identity, Role role) {
        return read(() -> roles.has(identity, role));
    }

    public Set<Role> rolesOf(Identity identity) {
        return read(() -> roles.rolesOf(identity));
    }

    private <T> T write(String operation, Supplier<T> action) {
        lock.writeLock().lock();
        try {
            T result = action.get();
            metrics.recordAccepted(operation);
            metrics.updateProductCount(records.productCount());
            return result;
        } catch (RuntimeException e) {
            metrics.recordRejected(operation, e);
            throw e;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T read(Supplier<T> query) {
        lock.readLock().lock();
        try {
            return query.get();
        } finally {
            lock.readLock().unlock();
        }
    }
}
