package com.supplytrace.ledger.api;

import com.supplytrace.ledger.config.LedgerServiceProperties;
import com.supplytrace.ledger.domain.SupplyChainLedger;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Lightweight runtime info next to the Actuator endpoints. */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final LedgerServiceProperties properties;
    private final SupplyChainLedger ledger;

    public ServiceInfoController(LedgerServiceProperties properties, SupplyChainLedger ledger) {
        this.properties = properties;
        this.ledger = ledger;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "description", properties.description(),
                "products", ledger.productCount(),
                "status", "running",
                "timestamp", Instant.now().toString());
    }
}
