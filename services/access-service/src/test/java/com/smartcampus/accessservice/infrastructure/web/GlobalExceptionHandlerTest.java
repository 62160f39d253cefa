package com.smartcampus.accessservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.smartcampus.accessservice.config.AccessServiceProperties;
import com.smartcampus.observability.RequestContext;
import com.smartcampus.observability.RequestContextHolder;
import com.smartcampus.security.AccessDeniedException;
import com.smartcampus.security.Action;
import com.smartcampus.security.MalformedPrincipalException;
import com.smartcampus.security.ResourceKind;
import com.smartcampus.security.policy.Decision;
import com.smartcampus.security.policy.PolicyConfigurationException;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = handler("development");

    @AfterEach
    void cleanup() {
        RequestContextHolder.clear();
    }

    @Nested
    @DisplayName("access denied")
    class Denied {

        private final AccessDeniedException tenantMismatch =
                new AccessDeniedException(
                        Decision.deny(Decision.Code.TENANT_MISMATCH, "principal tenant 'SCH1', resource tenant 'SCH2'"),
                        Action.READ, ResourceKind.FEE, "fee-9");

        private final AccessDeniedException notFound =
                new AccessDeniedException(
                        Decision.deny(Decision.Code.RESOURCE_NOT_FOUND), Action.READ, ResourceKind.FEE, "fee-404");

        @Test
        @DisplayName("maps to 403 with the generic detail")
        void forbidden() {
            ProblemDetail result = handler.handleAccessDenied(tenantMismatch);

            assertThat(result.getStatus()).isEqualTo(403);
            assertThat(result.getTitle()).isEqualTo("Forbidden");
            assertThat(result.getDetail()).isEqualTo("Access denied");
            assertThat(result.getType().toString()).isEqualTo("https://smartcampus.dev/errors/access-denied");
        }

        @Test
        @DisplayName("adds the reason outside production")
        void reasonExposed() {
            assertThat(handler.handleAccessDenied(tenantMismatch).getProperties())
                    .containsEntry("reason", "tenant mismatch: principal tenant 'SCH1', resource tenant 'SCH2'");
        }

        @Test
        @DisplayName("cannot tell a missing resource from a denial in production")
        void productionIndistinguishable() {
            GlobalExceptionHandler production = handler("production");

            ProblemDetail denied = production.handleAccessDenied(tenantMismatch);
            ProblemDetail missing = production.handleAccessDenied(notFound);

            assertThat(denied.getProperties()).doesNotContainKey("reason");
            assertThat(missing.getProperties()).doesNotContainKey("reason");
            assertThat(missing.getStatus()).isEqualTo(denied.getStatus());
            assertThat(missing.getDetail()).isEqualTo(denied.getDetail());
            assertThat(missing.getType()).isEqualTo(denied.getType());
        }
    }

    @Test
    @DisplayName("maps a malformed principal to 401")
    void malformedPrincipal() {
        ProblemDetail result = handler.handleMalformedPrincipal(
                new MalformedPrincipalException(List.of("unknown role 'janitor'")));

        assertThat(result.getStatus()).isEqualTo(401);
        assertThat(result.getDetail()).isEqualTo("unknown role 'janitor'");
    }

    @Test
    @DisplayName("maps a rejected policy table to 422")
    void invalidPolicy() {
        ProblemDetail result = handler.handlePolicyConfiguration(
                new PolicyConfigurationException("Duplicate rule for parent/fee/read"));

        assertThat(result.getStatus()).isEqualTo(422);
        assertThat(result.getDetail()).isEqualTo("Duplicate rule for parent/fee/read");
    }

    @Test
    @DisplayName("maps IllegalArgumentException to 400 Bad Request")
    void illegalArgument() {
        ProblemDetail result = handler.handleIllegalArgument(new IllegalArgumentException("invalid input"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("invalid input");
        assertThat(result.getTitle()).isEqualTo("Bad Request");
    }

    @Test
    @DisplayName("maps a generic Exception to 500 without its message")
    void generic() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("connection refused: db-1"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getTitle()).isEqualTo("Internal Server Error");
        assertThat(result.getDetail()).isEqualTo("An unexpected error occurred");
    }

    @Test
    @DisplayName("includes the timestamp and the request's correlation ID")
    void correlation() {
        RequestContextHolder.set(RequestContext.anonymous("corr-99"));

        ProblemDetail result = handler.handleGeneric(new RuntimeException("oops"));

        assertThat(result.getProperties()).containsKey("timestamp").containsEntry("correlationId", "corr-99");
    }

    private static GlobalExceptionHandler handler(String environment) {
        return new GlobalExceptionHandler(
                new AccessServiceProperties("access-service", environment, null, null, null, null));
    }
}
