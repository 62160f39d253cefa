package com.smartcampus.accessservice.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.smartcampus.security.AccessDeniedException;
import com.smartcampus.security.policy.Decision;
import java.util.Locale;

/**
 * Decision as returned to the caller. For a denial with reasons hidden, {@code code} is omitted
 * and {@code reason} is the generic message, so a missing resource reads like any other denial.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DecisionResponse(String outcome, String code, String reason) {

    static DecisionResponse from(Decision decision, boolean exposeReasons) {
        String outcome = decision.outcome().name().toLowerCase(Locale.ROOT);
        if (decision.isAllowed() || exposeReasons) {
            return new DecisionResponse(
                    outcome, decision.code().name().toLowerCase(Locale.ROOT), decision.reason());
        }
        return new DecisionResponse(outcome, null, AccessDeniedException.PUBLIC_MESSAGE);
    }
}
