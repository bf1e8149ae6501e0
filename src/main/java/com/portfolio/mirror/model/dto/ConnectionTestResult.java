package com.portfolio.mirror.model.dto;

public record ConnectionTestResult(String personName, String apiServer, String serverTime) {
}
