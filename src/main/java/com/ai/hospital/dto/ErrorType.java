package com.ai.hospital.dto;

public enum ErrorType {
    VALIDATION,
    CONFLICT,
    NOT_FOUND,
    UNAUTHORIZED,
    STATE,
    INTERNAL
}
