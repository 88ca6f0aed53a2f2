package com.ai.hospital.controller;

import com.ai.hospital.dto.ErrorType;
import org.springframework.http.HttpStatus;

final class OutcomeStatus {

    private OutcomeStatus() {
    }

    static HttpStatus of(boolean success, ErrorType errorType) {
        if (success) return HttpStatus.OK;
        if (errorType == null) return HttpStatus.INTERNAL_SERVER_ERROR;
        return switch (errorType) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case CONFLICT, STATE -> HttpStatus.CONFLICT;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
