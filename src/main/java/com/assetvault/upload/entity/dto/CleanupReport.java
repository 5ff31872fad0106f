package com.assetvault.upload.entity.dto;

public record CleanupReport(int attempted, int completed, int failed) {
}
