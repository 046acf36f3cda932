package com.supplytrace.ledger.api;

import com.supplytrace.ledger.domain.SupplyChainLedger;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Product lifecycle endpoints. Authorization failures surface as exceptions and are mapped by
 * {@link com.supplytrace.ledger.infrastructure.web.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/products")
public class ProductController {

    private final SupplyChainLedger ledger;

    public ProductController(SupplyChainLedger ledger) {
        this.ledger = ledger;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ProductRegisteredResponse register(
            @RequestHeader(CallerHeaders.CALLER_IDENTITY) String caller,
            @Valid @RequestBody ProductDetailsRequest request) {
        long id = ledger.register(
                CallerHeaders.caller(caller),
                request.name(),
                request.originLocation(),
                request.batchNumber(),
                request.expirationDate());
        return new ProductRegisteredResponse(id);
    }

    @PutMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void update(
            @RequestHeader(CallerHeaders.CALLER_IDENTITY) String caller,
            @PathVariable long id,
            @Valid @RequestBody ProductDetailsRequest request) {
        ledger.update(
                CallerHeaders.caller(caller),
                id,
                request.name(),
                request.originLocation(),
                request.batchNumber(),
                request.expirationDate());
    }

    @PostMapping("/{id}/checks")
    @ResponseStatus(HttpStatus.CREATED)
    public void performCheck(
            @RequestHeader(CallerHeaders.CALLER_IDENTITY) String caller,
            @PathVariable long id,
            @Valid @RequestBody QualityCheckRequest request) {
        ledger.performCheck(
                CallerHeaders.caller(caller), id, request.checkpointName(), request.passed(),
                request.notes());
    }

    @PostMapping("/{id}/completion")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void complete(
            @RequestHeader(CallerHeaders.CALLER_IDENTITY) String caller, @PathVariable long id) {
        ledger.complete(CallerHeaders.caller(caller), id);
    }

    @GetMapping("/{id}")
    public ProductResponse getRecord(@PathVariable long id) {
        return ProductResponse.from(ledger.getRecord(id));
    }

    @GetMapping("/{id}/checks")
    public List<InspectionEntryResponse> getChecks(@PathVariable long id) {
        return ledger.getChecks(id).stream().map(InspectionEntryResponse::from).toList();
    }
}
