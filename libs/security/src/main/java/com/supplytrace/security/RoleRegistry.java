package com.supplytrace.security;

import com.supplytrace.eventmodel.EntityType;
import com.supplytrace.eventmodel.EventEntity;
import com.supplytrace.eventmodel.EventFactory;
import com.supplytrace.eventmodel.EventPublisher;
import com.supplytrace.eventmodel.EventType;
import com.supplytrace.observability.CorrelationContextHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Set;

/**
 * Single source of truth for which identities hold which roles.
 * <p>
 * Every role is administered by {@link Role#ADMIN}. Grants and revocations are idempotent:
 * re-applying the current value succeeds without publishing an event. The registry is not
 * thread-safe; mutations must be serialized by the caller.
 */
public class RoleRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoleRegistry.class);

    static final String PRODUCER = "role-registry";

    private final RoleAssignmentStore store;
    private final EventPublisher publisher;
    private final Clock clock;

    /**
     * Creates the registry and grants {@link Role#ADMIN} to the initializing identity.
     *
     * @param store     backing store for role assignments
     * @param publisher sink for RoleGranted / RoleRevoked events
     * @param clock     timestamps published events
     * @param admin     the initializing identity
     */
    public RoleRegistry(
            RoleAssignmentStore store, EventPublisher publisher, Clock clock, Identity admin) {
        if (store == null || publisher == null || clock == null || admin == null) {
            throw new IllegalArgumentException("store, publisher, clock and admin must not be null");
        }
        this.store = store;
        this.publisher = publisher;
        this.clock = clock;
        if (store.assign(admin, Role.ADMIN)) {
            publishGranted(Role.ADMIN, admin, admin);
        }
        log.info("Role registry initialized with admin {}", admin);
    }

    /**
     * Checks whether the identity currently holds the role. No side effects.
     */
    public boolean has(Identity identity, Role role) {
        return store.isAssigned(identity, role);
    }

    /** All roles the identity currently holds. */
    public Set<Role> rolesOf(Identity identity) {
        return store.rolesOf(identity);
    }

    /**
     * Grants {@code role} to {@code target}.
     *
     * @throws UnauthorizedException if the caller does not hold the role's admin role
     */
    public void grant(Identity caller, Role role, Identity target) {
        requireAdminOf(caller, role);
        if (store.assign(target, role)) {
            log.info("Granted {} to {} by {}", role, target, caller);
            publishGranted(role, target, caller);
        } else {
            log.debug("{} already holds {}, grant is a no-op", target, role);
        }
    }

    /**
     * Revokes {@code role} from {@code target}.
     *
     * @throws UnauthorizedException if the caller does not hold the role's admin role
     */
    public void revoke(Identity caller, Role role, Identity target) {
        requireAdminOf(caller, role);
        removeRole(caller, role, target);
    }

    /**
     * Drops a role the caller holds itself. Lets a compromised or retired account give up its
     * privileges without involving an administrator.
     *
     * @throws UnauthorizedException if {@code account} is not the caller
     */
    public void renounce(Identity caller, Role role, Identity account) {
        if (!caller.equals(account)) {
            throw new UnauthorizedException(caller, "Identity '%s' can only renounce roles for itself"
                    .formatted(caller));
        }
        removeRole(caller, role, account);
    }

    private void removeRole(Identity caller, Role role, Identity target) {
        if (store.unassign(target, role)) {
            log.info("Revoked {} from {} by {}", role, target, caller);
            publisher.publish(EventFactory.create(
                    EventType.ROLE_REVOKED,
                    PRODUCER,
                    CorrelationContextHolder.currentCorrelationId(),
                    clock.instant(),
                    entity(role, target),
                    new RoleRevoked(role, target, caller)));
        } else {
            log.debug("{} does not hold {}, revoke is a no-op", target, role);
        }
    }

    private void requireAdminOf(Identity caller, Role role) {
        Role admin = role.adminRole();
        if (!store.isAssigned(caller, admin)) {
            throw new UnauthorizedException(caller, Set.of(admin));
        }
    }

    private void publishGranted(Role role, Identity account, Identity sender) {
        publisher.publish(EventFactory.create(
                EventType.ROLE_GRANTED,
                PRODUCER,
                CorrelationContextHolder.currentCorrelationId(),
                clock.instant(),
                entity(role, account),
                new RoleGranted(role, account, sender)));
    }

    private static EventEntity entity(Role role, Identity account) {
        return EventEntity.of(EntityType.ROLE_ASSIGNMENT, role.value() + ":" + account.value());
    }
}
