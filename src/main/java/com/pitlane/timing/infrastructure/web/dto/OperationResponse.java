package com.pitlane.timing.infrastructure.web.dto;

import com.pitlane.timing.domain.model.StoreOutcome;

public record OperationResponse(
        boolean success,
        String error_kind,
        String detail
) {
    public static OperationResponse fromOutcome(StoreOutcome outcome) {
        return new OperationResponse(
                outcome.success(),
                outcome.errorKind() != null ? outcome.errorKind().name().toLowerCase() : null,
                outcome.detail()
        );
    }

    public static OperationResponse invalid(String detail) {
        return new OperationResponse(false, "invalid_request", detail);
    }
}
