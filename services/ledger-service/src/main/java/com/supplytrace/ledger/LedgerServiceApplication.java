package com.supplytrace.ledger;

import com.supplytrace.ledger.config.LedgerServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Ledger service entry point.
 *
 * <p>Hosts the supply chain ledger in-process and exposes it over HTTP under {@code /api/v1}.
 * Callers are identified by the {@code X-Caller-Identity} header set by the upstream gateway.
 */
@SpringBootApplication
@EnableConfigurationProperties(LedgerServiceProperties.class)
public class LedgerServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(LedgerServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(LedgerServiceApplication.class, args);
        log.info("Ledger service started successfully");
    }
}
