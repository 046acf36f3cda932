package com.supplytrace.ledger.api;

import com.supplytrace.ledger.domain.SupplyChainLedger;
import com.supplytrace.security.Identity;
import com.supplytrace.security.Role;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Role administration endpoints. Roles are addressed by name ("retailer") or canonical value
 * ("RETAILER_ROLE").
 */
@RestController
@RequestMapping("/api/v1")
public class RoleController {

    private final SupplyChainLedger ledger;

    public RoleController(SupplyChainLedger ledger) {
        this.ledger = ledger;
    }

    @PutMapping("/roles/{role}/members/{identity}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void grant(
            @RequestHeader(CallerHeaders.CALLER_IDENTITY) String caller,
            @PathVariable String role,
            @PathVariable String identity) {
        ledger.grantRole(CallerHeaders.caller(caller), Role.parse(role), Identity.of(identity));
    }

    @DeleteMapping("/roles/{role}/members/{identity}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void revoke(
            @RequestHeader(CallerHeaders.CALLER_IDENTITY) String caller,
            @PathVariable String role,
            @PathVariable String identity) {
        ledger.revokeRole(CallerHeaders.caller(caller), Role.parse(role), Identity.of(identity));
    }

    @PostMapping("/roles/{role}/renunciation")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void renounce(
            @RequestHeader(CallerHeaders.CALLER_IDENTITY) String caller, @PathVariable String role) {
        Identity self = CallerHeaders.caller(caller);
        ledger.renounceRole(self, Role.parse(role), self);
    }

    @GetMapping("/roles/{role}/members/{identity}")
    public RoleMembershipResponse membership(
            @PathVariable String role, @PathVariable String identity) {
        Role parsed = Role.parse(role);
        Identity member = Identity.of(identity);
        return new RoleMembershipResponse(
                parsed.value(), member.value(), ledger.hasRole(member, parsed));
    }

    @GetMapping("/identities/{identity}/roles")
    public IdentityRolesResponse rolesOf(@PathVariable String identity) {
        Identity member = Identity.of(identity);
        return new IdentityRolesResponse(
                member.value(),
                ledger.rolesOf(member).stream().sorted().map(Role::value).toList());
    }
}
