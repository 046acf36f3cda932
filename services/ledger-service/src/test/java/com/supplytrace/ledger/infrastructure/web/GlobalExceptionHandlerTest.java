package com.supplytrace.ledger.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.supplytrace.ledger.domain.AlreadyCompletedException;
import com.supplytrace.observability.CorrelationContextHolder;
import com.supplytrace.observability.testing.TestCorrelationContextFactory;
import com.supplytrace.security.Identity;
import com.supplytrace.security.NotOwnerException;
import com.supplytrace.security.Role;
import com.supplytrace.security.UnauthorizedException;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private static final Identity CALLER = Identity.of("0xcaller");

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("maps UnauthorizedException to 403")
    void unauthorized() {
        ProblemDetail result = handler.handleUnauthorized(
                new UnauthorizedException(CALLER, Set.of(Role.MANUFACTURER)));

        assertThat(result.getStatus()).isEqualTo(403);
        assertThat(result.getTitle()).isEqualTo("Unauthorized");
        assertThat(result.getDetail()).contains("0xcaller").contains("MANUFACTURER");
    }

    @Test
    @DisplayName("maps NotOwnerException to 403 with its own type")
    void notOwner() {
        ProblemDetail result = handler.handleNotOwner(new NotOwnerException(CALLER, Identity.ZERO));

        assertThat(result.getStatus()).isEqualTo(403);
        assertThat(result.getType().toString()).endsWith("/errors/not-owner");
    }

    @Test
    @DisplayName("maps AlreadyCompletedException to 409 with the product id")
    void alreadyCompleted() {
        ProblemDetail result = handler.handleAlreadyCompleted(new AlreadyCompletedException(7));

        assertThat(result.getStatus()).isEqualTo(409);
        assertThat(result.getProperties()).containsEntry("productId", 7L);
    }

    @Test
    @DisplayName("maps IllegalArgumentException to 400 Bad Request")
    void illegalArgument() {
        ProblemDetail result = handler.handleIllegalArgument(new IllegalArgumentException("bad role"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("bad role");
    }

    @Test
    @DisplayName("maps generic Exception to 500 without leaking the message")
    void generic() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("secret"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getDetail()).doesNotContain("secret");
    }

    @Test
    @DisplayName("includes timestamp and the bound correlation ID")
    void enrichesWithCorrelation() {
        CorrelationContextHolder.set(TestCorrelationContextFactory.withCorrelationId("corr-9"));

        ProblemDetail result = handler.handleAlreadyCompleted(new AlreadyCompletedException(1));

        assertThat(result.getProperties())
                .containsKey("timestamp")
                .containsEntry("correlationId", "corr-9");
    }
}
