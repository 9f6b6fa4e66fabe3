package com.finrisk.analytics.controller.dto;

import java.util.List;

public record ExportResponseDto(String outputDir, List<String> files, int totalAnomalies, List<String> failedCategories) {
}
