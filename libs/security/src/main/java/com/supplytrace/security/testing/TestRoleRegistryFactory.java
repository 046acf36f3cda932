package com.supplytrace.security.testing;

import com.supplytrace.eventmodel.EventPublisher;
import com.supplytrace.eventmodel.InMemoryEventLog;
import com.supplytrace.security.Identity;
import com.supplytrace.security.InMemoryRoleAssignmentStore;
import com.supplytrace.security.Role;
import com.supplytrace.security.RoleRegistry;

import java.time.Clock;

/**
 * Builds pre-populated {@link RoleRegistry} instances for tests.
 * <p>
 * Lives in {@code src/main/java} under a {@code testing} package so other modules can use it
 * from their test scope.
 */
public final class TestRoleRegistryFactory {

    public static final Identity ADMIN = Identity.of("0xadmin");
    public static final Identity MANUFACTURER = Identity.of("0xmanufacturer");
    public static final Identity DISTRIBUTOR = Identity.of("0xdistributor");
    public static final Identity RETAILER = Identity.of("0xretailer");
    public static final Identity OUTSIDER = Identity.of("0xoutsider");

    private TestRoleRegistryFactory() {
        // utility class
    }

    /**
     * Creates a registry administered by {@link #ADMIN} with one holder per supply chain role.
     */
    public static RoleRegistry createSupplyChain(EventPublisher publisher) {
        RoleRegistry registry = createEmpty(publisher);
        registry.grant(ADMIN, Role.MANUFACTURER, MANUFACTURER);
        registry.grant(ADMIN, Role.DISTRIBUTOR, DISTRIBUTOR);
        registry.grant(ADMIN, Role.RETAILER, RETAILER);
        return registry;
    }

    /** Same as {@link #createSupplyChain(EventPublisher)} with a throwaway event log. */
    public static RoleRegistry createSupplyChain() {
        return createSupplyChain(new InMemoryEventLog());
    }

    /** Creates a registry where only {@link #ADMIN} holds a role. */
    public static RoleRegistry createEmpty(EventPublisher publisher) {
        return new RoleRegistry(
                new InMemoryRoleAssignmentStore(), publisher, Clock.systemUTC(), ADMIN);
    }
}
