package com.soko.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Stable, machine-checkable error kinds returned in every error payload.
 * Only storage-level failures are worth retrying; everything else needs a different request.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    RESOURCE_NOT_FOUND(404, false),
    INVALID_INPUT(400, false),
    VALIDATION_FAILED(400, false),
    INSUFFICIENT_STOCK(422, false),
    ACCESS_DENIED(403, false),
    INVALID_TRANSITION(422, false),
    CONCURRENT_MODIFICATION(409, true),
    INTERNAL_ERROR(500, true);

    private final int httpStatus;
    private final boolean retryable;
}
