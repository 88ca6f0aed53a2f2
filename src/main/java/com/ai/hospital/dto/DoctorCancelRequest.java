package com.ai.hospital.dto;

public record DoctorCancelRequest(String reason) {
}
