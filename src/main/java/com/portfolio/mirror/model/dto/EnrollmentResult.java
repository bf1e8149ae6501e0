package com.portfolio.mirror.model.dto;

public record EnrollmentResult(String personName, String apiServer) {
}
