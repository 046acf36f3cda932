package com.supplytrace.ledger.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.supplytrace.security.Identity;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryLedgerStore")
class InMemoryLedgerStoreTest {

    private final InMemoryLedgerStore store = new InMemoryLedgerStore();

    @Test
    @DisplayName("id counter starts at 1 and only moves forward")
    void counter() {
        assertThat(store.productCount()).isZero();
        assertThat(store.nextProductId()).isEqualTo(1);
        assertThat(store.nextProductId()).isEqualTo(2);
        assertThat(store.productCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("keeps check sequences per id")
    void checksPerId() {
        var entry = new InspectionEntry(Identity.of("0xi"), Instant.EPOCH, "gate", true, "");

        store.appendCheck(1, entry);
        store.appendCheck(1, entry);
        store.appendCheck(2, entry);

        assertThat(store.checks(1)).hasSize(2);
        assertThat(store.checks(2)).hasSize(1);
        assertThat(store.checks(3)).isEmpty();
    }

    @Test
    @DisplayName("findProduct() is empty until saved")
    void findProduct() {
        assertThat(store.findProduct(1)).isEmpty();

        store.saveProduct(1, ProductRecord.zero());

        assertThat(store.findProduct(1)).contains(ProductRecord.zero());
    }
}
